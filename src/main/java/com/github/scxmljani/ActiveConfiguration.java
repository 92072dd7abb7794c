package com.github.scxmljani;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable set of active atomic states of one statechart, ordered by document index. All active
 * states, ancestors included, are derived from it.
 */
public final class ActiveConfiguration {
  static final Comparator<StateNode> documentOrder = new Comparator<StateNode>() {
    @Override
    public int compare(StateNode first, StateNode second) {
      return Integer.compare(first.getDocumentIndex(), second.getDocumentIndex());
    }
  };

  private final List<StateNode> atomicStates;
  private final Set<StateNode> activeStates;

  public ActiveConfiguration(final Collection<StateNode> states) {
    final TreeSet<StateNode> atomic = new TreeSet<>(documentOrder);
    final TreeSet<StateNode> active = new TreeSet<>(documentOrder);
    for (StateNode state : states) {
      if (state.isAtomic()) {
        atomic.add(state);
      }
    }
    for (StateNode state : atomic) {
      active.add(state);
      for (StateNode ancestor : state.getAncestors(null)) {
        if (ancestor.getParent() != null) {
          active.add(ancestor);
        }
      }
    }
    this.atomicStates = Collections.unmodifiableList(new ArrayList<>(atomic));
    this.activeStates = Collections.unmodifiableSet(new LinkedHashSet<>(active));
  }

  public static ActiveConfiguration empty() {
    return new ActiveConfiguration(Collections.<StateNode>emptyList());
  }

  /**
   * Active atomic states in document order.
   */
  public List<StateNode> getAtomicStates() {
    return atomicStates;
  }

  /**
   * Every active state except the synthetic root, in document order.
   */
  public Set<StateNode> getActiveStates() {
    return activeStates;
  }

  public Set<String> getActiveIds() {
    final Set<String> ids = new LinkedHashSet<>();
    for (StateNode state : activeStates) {
      ids.add(state.getId());
    }
    return ids;
  }

  public boolean isEmpty() {
    return atomicStates.isEmpty();
  }

  public boolean contains(final StateNode state) {
    return activeStates.contains(state);
  }

  /**
   * True iff a final child of the root is active.
   */
  public boolean isTerminated() {
    for (StateNode state : atomicStates) {
      if (state.isFinal() && state.getParent() != null && state.getParent().getParent() == null) {
        return true;
      }
    }
    return false;
  }

  /**
   * Location name of this configuration: atomic ids joined with '+'.
   */
  public String getName() {
    final StringBuilder name = new StringBuilder();
    for (StateNode state : atomicStates) {
      if (name.length() > 0) {
        name.append('+');
      }
      name.append(state.getId());
    }
    return name.toString();
  }

  @Override
  public int hashCode() {
    return atomicStates.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof ActiveConfiguration
        && atomicStates.equals(((ActiveConfiguration) obj).atomicStates);
  }

  @Override
  public String toString() {
    return "{" + getName() + "}";
  }
}
