package com.github.scxmljani;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Holder of statistics for one compiler instance and the automata of its latest network.
 */
public final class CompilationStatistics {
  private final String compilerId;

  CompilationStatistics(final String compilerId) {
    this.compilerId = compilerId;
  }

  private final long startTstampMillis = System.currentTimeMillis();
  private final List<AutomatonStatistics> latestAutomatonStats = new ArrayList<>();
  int totalCompilations;
  int totalFailures;
  String latestNetwork;
  long latestElapsedMillis;

  public long getStartTimeMillis() {
    return startTstampMillis;
  }

  public String getCompilerId() {
    return compilerId;
  }

  public synchronized List<AutomatonStatistics> getLatestAutomatonStats() {
    return Collections.unmodifiableList(new ArrayList<>(latestAutomatonStats));
  }

  synchronized void replaceAutomatonStats(final String network,
      final List<AutomatonStatistics> automatonStats, final long elapsedMillis) {
    latestAutomatonStats.clear();
    latestAutomatonStats.addAll(automatonStats);
    latestNetwork = network;
    latestElapsedMillis = elapsedMillis;
  }

  public int getTotalCompilations() {
    return totalCompilations;
  }

  public int getTotalFailures() {
    return totalFailures;
  }

  public String getLatestNetwork() {
    return latestNetwork;
  }

  public long getLatestElapsedMillis() {
    return latestElapsedMillis;
  }

  @Override
  public String toString() {
    return "CompilationStatistics [compilerId=" + compilerId + ", startTstampMillis="
        + startTstampMillis + ", totalCompilations=" + totalCompilations + ", totalFailures="
        + totalFailures + ", latestNetwork=" + latestNetwork + ", latestElapsedMillis="
        + latestElapsedMillis + ", automatonStats=" + latestAutomatonStats + "]";
  }

  /**
   * Sizes of one automaton before and after composition.
   */
  public final static class AutomatonStatistics {
    String automaton;
    // flat locations and microsteps found by the resolver
    int resolvedLocations;
    int microsteps;
    // locations and edges emitted, intermediate ones included
    int locations;
    int edges;

    public String getAutomaton() {
      return automaton;
    }

    public int getResolvedLocations() {
      return resolvedLocations;
    }

    public int getMicrosteps() {
      return microsteps;
    }

    public int getLocations() {
      return locations;
    }

    public int getEdges() {
      return edges;
    }

    @Override
    public String toString() {
      return "AutomatonStatistics [automaton=" + automaton + ", resolvedLocations="
          + resolvedLocations + ", microsteps=" + microsteps + ", locations=" + locations
          + ", edges=" + edges + "]";
    }
  }

}
