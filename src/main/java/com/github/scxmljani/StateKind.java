package com.github.scxmljani;

/**
 * Kind of a statechart state. INITIAL only tags the pseudo-state of an {@code <initial>}
 * element, which never becomes active.
 */
public enum StateKind {
  ATOMIC, COMPOUND, PARALLEL, FINAL, INITIAL;

  public boolean isComposite() {
    return this == COMPOUND || this == PARALLEL;
  }
}
