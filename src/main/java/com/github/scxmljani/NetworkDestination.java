package com.github.scxmljani;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class NetworkDestination {
  private final String location;
  // null when the edge has a single destination
  private final Expression probability;
  private final List<NetworkAssignment> assignments;

  NetworkDestination(final String location, final Expression probability,
      final List<NetworkAssignment> assignments) {
    this.location = location;
    this.probability = probability;
    this.assignments = Collections.unmodifiableList(new ArrayList<>(assignments));
  }

  public String getLocation() {
    return location;
  }

  public Expression getProbability() {
    return probability;
  }

  public List<NetworkAssignment> getAssignments() {
    return assignments;
  }

  @Override
  public String toString() {
    return "-> " + location + (probability == null ? "" : " p=" + probability) + " "
        + assignments;
  }
}
