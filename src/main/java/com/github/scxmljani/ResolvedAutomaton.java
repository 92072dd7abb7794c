package com.github.scxmljani;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Flat result of resolving one statechart: an arena of locations and the microsteps between
 * them. Location 0 is the initial location. The statechart it was resolved from is kept for
 * diagnostics only.
 */
public final class ResolvedAutomaton {
  private final Statechart statechart;
  private final Scope scope;
  private final List<Location> locations;
  private final List<Microstep> microsteps;
  private final Set<String> receivableEvents;

  ResolvedAutomaton(final Statechart statechart, final Scope scope,
      final List<Location> locations, final List<Microstep> microsteps,
      final Set<String> receivableEvents) {
    this.statechart = statechart;
    this.scope = scope;
    this.locations = Collections.unmodifiableList(new ArrayList<>(locations));
    this.microsteps = Collections.unmodifiableList(new ArrayList<>(microsteps));
    this.receivableEvents = receivableEvents;
  }

  public String getName() {
    return statechart.getName();
  }

  public Statechart getStatechart() {
    return statechart;
  }

  /**
   * Scope of the automaton's expressions, without event data.
   */
  public Scope getScope() {
    return scope;
  }

  public List<Location> getLocations() {
    return locations;
  }

  public Location getLocation(final int index) {
    return locations.get(index);
  }

  public Location getInitialLocation() {
    return locations.get(0);
  }

  public Location findLocation(final String name) {
    for (Location location : locations) {
      if (location.getName().equals(name)) {
        return location;
      }
    }
    return null;
  }

  public List<Microstep> getMicrosteps() {
    return microsteps;
  }

  /**
   * Microsteps leaving the given location, in creation order.
   */
  public List<Microstep> getMicrostepsFrom(final int location) {
    final List<Microstep> outgoing = new ArrayList<>();
    for (Microstep microstep : microsteps) {
      if (microstep.getSource() == location) {
        outgoing.add(microstep);
      }
    }
    return outgoing;
  }

  public Set<String> getReceivableEvents() {
    return receivableEvents;
  }

  @Override
  public String toString() {
    return "ResolvedAutomaton [name=" + getName() + ", locations=" + locations.size()
        + ", microsteps=" + microsteps.size() + "]";
  }
}
