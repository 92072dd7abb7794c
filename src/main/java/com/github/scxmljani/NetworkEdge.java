package com.github.scxmljani;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Edge of a network automaton. A null action marks a silent edge that never synchronizes.
 */
public final class NetworkEdge {
  private final String location;
  private final String action;
  private final Expression guard;
  private final List<NetworkDestination> destinations;

  NetworkEdge(final String location, final String action, final Expression guard,
      final List<NetworkDestination> destinations) {
    this.location = location;
    this.action = action;
    this.guard = guard;
    this.destinations = Collections.unmodifiableList(new ArrayList<>(destinations));
  }

  public String getLocation() {
    return location;
  }

  public String getAction() {
    return action;
  }

  public boolean isSilent() {
    return action == null;
  }

  public Expression getGuard() {
    return guard;
  }

  public List<NetworkDestination> getDestinations() {
    return destinations;
  }

  @Override
  public String toString() {
    return "NetworkEdge [" + location + (action == null ? "" : " " + action) + " [" + guard
        + "] " + destinations + "]";
  }
}
