package io.b2mash.b2b.nexusengine.nexus;

import java.time.LocalDate;

/** Per-jurisdiction tracker state. Once established, nexus never reverts. */
sealed interface NexusState {

  NexusState NO_NEXUS = new NoNexus();

  record NoNexus() implements NexusState {}

  record Established(int firstNexusYear, LocalDate nexusDate, NexusType nexusType)
      implements NexusState {

    Established withType(NexusType type) {
      return new Established(firstNexusYear, nexusDate, type);
    }
  }
}
