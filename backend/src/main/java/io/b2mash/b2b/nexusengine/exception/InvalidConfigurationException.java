package io.b2mash.b2b.nexusengine.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Jurisdiction reference data that cannot be used for a determination. */
public class InvalidConfigurationException extends ErrorResponseException {

  private final String jurisdictionCode;

  public InvalidConfigurationException(String jurisdictionCode, String detail) {
    super(
        HttpStatus.UNPROCESSABLE_ENTITY,
        createProblem("Invalid jurisdiction configuration", jurisdictionCode, detail),
        null);
    this.jurisdictionCode = jurisdictionCode;
  }

  public String getJurisdictionCode() {
    return jurisdictionCode;
  }

  private static ProblemDetail createProblem(String title, String jurisdictionCode, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
    problem.setTitle(title);
    problem.setDetail(jurisdictionCode + ": " + detail);
    problem.setProperty("jurisdictionCode", jurisdictionCode);
    return problem;
  }
}
