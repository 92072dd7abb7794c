package com.github.scxmljani;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One parsed statechart automaton: the state tree under a synthetic compound root, all
 * transitions in document order and the local data model. Built once by {@link StatechartParser}
 * and never modified afterwards.
 */
public final class Statechart {
  // not a valid XML id, so it never collides with a declared state
  public static final String rootId = "#root";

  private final String name;
  private final String documentId;
  private final StateNode root;
  private final Map<String, StateNode> states;
  private final List<TransitionNode> transitions;
  private final Map<String, DataVariable> dataVariables;

  Statechart(final String name, final String documentId, final StateNode root,
      final Map<String, StateNode> states, final List<TransitionNode> transitions,
      final Map<String, DataVariable> dataVariables) {
    this.name = name;
    this.documentId = documentId;
    this.root = root;
    this.states = Collections.unmodifiableMap(new LinkedHashMap<>(states));
    this.transitions = Collections.unmodifiableList(new ArrayList<>(transitions));
    this.dataVariables = Collections.unmodifiableMap(new LinkedHashMap<>(dataVariables));
  }

  /**
   * Automaton name, unique per instance in a network.
   */
  public String getName() {
    return name;
  }

  public String getDocumentId() {
    return documentId;
  }

  public StateNode getRoot() {
    return root;
  }

  /**
   * All states except the synthetic root, keyed by id, in document order.
   */
  public Map<String, StateNode> getStates() {
    return states;
  }

  public StateNode getState(final String id) {
    return states.get(id);
  }

  public List<TransitionNode> getTransitions() {
    return transitions;
  }

  public Map<String, DataVariable> getDataVariables() {
    return dataVariables;
  }

  /**
   * Types of the local variables, the shape a {@link Scope} wants.
   */
  public Map<String, ExpressionType> getLocalTypes() {
    final Map<String, ExpressionType> types = new LinkedHashMap<>();
    for (DataVariable variable : dataVariables.values()) {
      types.put(variable.getId(), variable.getType());
    }
    return types;
  }

  public List<StateNode> getAtomicStates() {
    final List<StateNode> atomic = new ArrayList<>();
    for (StateNode state : states.values()) {
      if (state.isAtomic()) {
        atomic.add(state);
      }
    }
    return atomic;
  }

  /**
   * True iff every state is atomic and a direct child of the root.
   */
  public boolean isFlat() {
    for (StateNode state : states.values()) {
      if (!state.isAtomic() || state.getParent() != root) {
        return false;
      }
    }
    return true;
  }

  @Override
  public String toString() {
    return "Statechart [name=" + name + ", documentId=" + documentId + ", states="
        + states.keySet() + ", transitions=" + transitions.size() + ", dataVariables="
        + dataVariables.keySet() + "]";
  }
}
