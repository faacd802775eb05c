package io.b2mash.b2b.nexusengine.nexus;

/** Why a jurisdiction has nexus in a year. */
public enum NexusType {
  NONE,
  ECONOMIC,
  PHYSICAL,
  BOTH;

  public boolean hasNexus() {
    return this != NONE;
  }

  /** Adds physical presence to this nexus type. */
  NexusType withPhysical() {
    return this == ECONOMIC || this == BOTH ? BOTH : PHYSICAL;
  }
}
