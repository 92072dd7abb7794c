package com.github.scxmljani;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * This object represents one state of a statechart and its place in the state tree. It is
 * populated by the parser and read-only afterwards.
 */
public final class StateNode {
  private final String id;
  private final StateKind kind;
  private final StateNode parent;
  // pre-order position in the document, the priority tie-break
  private final int documentIndex;
  private final int depth;
  private final List<StateNode> children = new ArrayList<>();
  private final List<TransitionNode> transitions = new ArrayList<>();
  private final List<ExecutableContent> onEntry = new ArrayList<>();
  private final List<ExecutableContent> onExit = new ArrayList<>();
  // transition of the <initial> element or the initial attribute, compound states only
  private TransitionNode initialTransition;

  StateNode(final String id, final StateKind kind, final StateNode parent,
      final int documentIndex) {
    this.id = id;
    this.kind = kind;
    this.parent = parent;
    this.documentIndex = documentIndex;
    this.depth = parent == null ? 0 : parent.depth + 1;
    if (parent != null) {
      parent.children.add(this);
    }
  }

  void addTransition(final TransitionNode transition) {
    transitions.add(transition);
  }

  void addOnEntry(final List<ExecutableContent> content) {
    onEntry.addAll(content);
  }

  void addOnExit(final List<ExecutableContent> content) {
    onExit.addAll(content);
  }

  void setInitialTransition(final TransitionNode initialTransition) {
    this.initialTransition = initialTransition;
  }

  public String getId() {
    return id;
  }

  public StateKind getKind() {
    return kind;
  }

  public StateNode getParent() {
    return parent;
  }

  public int getDocumentIndex() {
    return documentIndex;
  }

  public int getDepth() {
    return depth;
  }

  public List<StateNode> getChildren() {
    return Collections.unmodifiableList(children);
  }

  public List<TransitionNode> getTransitions() {
    return Collections.unmodifiableList(transitions);
  }

  public List<ExecutableContent> getOnEntry() {
    return Collections.unmodifiableList(onEntry);
  }

  public List<ExecutableContent> getOnExit() {
    return Collections.unmodifiableList(onExit);
  }

  public TransitionNode getInitialTransition() {
    return initialTransition;
  }

  public boolean isAtomic() {
    return kind == StateKind.ATOMIC || kind == StateKind.FINAL;
  }

  public boolean isFinal() {
    return kind == StateKind.FINAL;
  }

  public boolean isParallel() {
    return kind == StateKind.PARALLEL;
  }

  public boolean isCompound() {
    return kind == StateKind.COMPOUND;
  }

  /**
   * True iff this state is a strict descendant of the given one.
   */
  public boolean isDescendantOf(final StateNode ancestor) {
    for (StateNode current = parent; current != null; current = current.parent) {
      if (current == ancestor) {
        return true;
      }
    }
    return false;
  }

  /**
   * Strict ancestors, innermost first, up to but excluding {@code upTo} (null for all).
   */
  public List<StateNode> getAncestors(final StateNode upTo) {
    final List<StateNode> ancestors = new ArrayList<>();
    for (StateNode current = parent; current != null && current != upTo;
        current = current.parent) {
      ancestors.add(current);
    }
    return ancestors;
  }

  @Override
  public int hashCode() {
    return 31 * id.hashCode() + documentIndex;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    final StateNode other = (StateNode) obj;
    return documentIndex == other.documentIndex && id.equals(other.id);
  }

  @Override
  public String toString() {
    return "StateNode [id=" + id + ", kind=" + kind + ", documentIndex=" + documentIndex + "]";
  }
}
