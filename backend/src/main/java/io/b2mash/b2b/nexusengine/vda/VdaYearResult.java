package io.b2mash.b2b.nexusengine.vda;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Liability of one jurisdiction-year under a voluntary disclosure agreement.
 *
 * @param year the calendar year
 * @param effectiveObligationStart obligation start truncated to the disclosure lookback, null
 *     without nexus
 * @param taxableSales sales taxable from the effective start
 * @param baseTax tax on {@code taxableSales}
 * @param interest interest to the filing date, zero when waived
 * @param penalties penalties, zero when waived
 * @param totalLiability {@code baseTax + interest + penalties}
 * @param interestWaived whether the jurisdiction waives interest on disclosure
 * @param penaltiesWaived whether the jurisdiction waives penalties on disclosure
 * @param standardTotalLiability the year's liability without a disclosure
 * @param savings {@code standardTotalLiability - totalLiability}
 */
public record VdaYearResult(
    int year,
    LocalDate effectiveObligationStart,
    BigDecimal taxableSales,
    BigDecimal baseTax,
    BigDecimal interest,
    BigDecimal penalties,
    BigDecimal totalLiability,
    boolean interestWaived,
    boolean penaltiesWaived,
    BigDecimal standardTotalLiability,
    BigDecimal savings) {}
