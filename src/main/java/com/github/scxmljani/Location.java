package com.github.scxmljani;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One flat location of a resolved automaton: a reachable configuration together with the
 * internal events raised but not consumed yet. Locations live in an arena and are referred to by
 * index.
 */
public final class Location {
  private final int index;
  private final String name;
  private final ActiveConfiguration configuration;
  private final List<String> internalQueue;
  // true only for the synthetic location that runs the initial entry content
  private final boolean initializing;

  Location(final int index, final String name, final ActiveConfiguration configuration,
      final List<String> internalQueue, final boolean initializing) {
    this.index = index;
    this.name = name;
    this.configuration = configuration;
    this.internalQueue = Collections.unmodifiableList(new ArrayList<>(internalQueue));
    this.initializing = initializing;
  }

  public int getIndex() {
    return index;
  }

  public String getName() {
    return name;
  }

  public ActiveConfiguration getConfiguration() {
    return configuration;
  }

  public List<String> getInternalQueue() {
    return internalQueue;
  }

  public boolean isInitializing() {
    return initializing;
  }

  public boolean isTerminated() {
    return configuration.isTerminated();
  }

  static String nameOf(final ActiveConfiguration configuration, final List<String> queue) {
    if (queue.isEmpty()) {
      return configuration.getName();
    }
    final StringBuilder name = new StringBuilder(configuration.getName()).append('|');
    for (int i = 0; i < queue.size(); i++) {
      if (i > 0) {
        name.append(',');
      }
      name.append(queue.get(i));
    }
    return name.toString();
  }

  @Override
  public String toString() {
    return "Location [" + index + ":" + name + "]";
  }
}
