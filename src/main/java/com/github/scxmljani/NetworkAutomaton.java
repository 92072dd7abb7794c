package com.github.scxmljani;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Flat automaton of the network: named locations, one initial location and guarded edges.
 */
public final class NetworkAutomaton {
  private final String name;
  private final List<String> locations;
  private final String initialLocation;
  private final List<NetworkEdge> edges;

  NetworkAutomaton(final String name, final List<String> locations,
      final String initialLocation, final List<NetworkEdge> edges) {
    this.name = name;
    this.locations = Collections.unmodifiableList(new ArrayList<>(locations));
    this.initialLocation = initialLocation;
    this.edges = Collections.unmodifiableList(new ArrayList<>(edges));
  }

  public String getName() {
    return name;
  }

  public List<String> getLocations() {
    return locations;
  }

  public String getInitialLocation() {
    return initialLocation;
  }

  public List<NetworkEdge> getEdges() {
    return edges;
  }

  public List<NetworkEdge> getEdgesFrom(final String location) {
    final List<NetworkEdge> outgoing = new ArrayList<>();
    for (NetworkEdge edge : edges) {
      if (edge.getLocation().equals(location)) {
        outgoing.add(edge);
      }
    }
    return outgoing;
  }

  @Override
  public String toString() {
    return "NetworkAutomaton [name=" + name + ", locations=" + locations.size() + ", edges="
        + edges.size() + "]";
  }
}
