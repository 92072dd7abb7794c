package com.github.scxmljani;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One realized microstep of a resolved automaton, the edge between two locations.
 *
 * The guard and actions are still in source names of the automaton; {@code _event.data.*} refers
 * to the event of a RECEIVE step. Actions are only assignments and network sends, in execution
 * order; raised events are already part of the target location.
 */
public final class Microstep {
  public static enum Kind {
    // eventless transitions, internal queue consumption, initial entry
    INTERNAL,
    // an external event taken by at least one transition
    RECEIVE,
    // an external event no transition takes, consumed without effect
    DISCARD;
  }

  private final int source;
  private final int target;
  private final Kind kind;
  private final String event;
  private final Expression guard;
  private final List<ExecutableContent> actions;
  private final List<Integer> transitions;

  Microstep(final int source, final int target, final Kind kind, final String event,
      final Expression guard, final List<ExecutableContent> actions,
      final List<Integer> transitions) {
    this.source = source;
    this.target = target;
    this.kind = kind;
    this.event = event;
    this.guard = guard;
    this.actions = Collections.unmodifiableList(new ArrayList<>(actions));
    this.transitions = Collections.unmodifiableList(new ArrayList<>(transitions));
  }

  public int getSource() {
    return source;
  }

  public int getTarget() {
    return target;
  }

  public Kind getKind() {
    return kind;
  }

  /**
   * The external event of RECEIVE and DISCARD steps, the consumed internal event of an INTERNAL
   * step, or null for eventless steps.
   */
  public String getEvent() {
    return event;
  }

  public Expression getGuard() {
    return guard;
  }

  public List<ExecutableContent> getActions() {
    return actions;
  }

  /**
   * Document indices of the transitions taken, in execution order.
   */
  public List<Integer> getTransitions() {
    return transitions;
  }

  public boolean isExternal() {
    return kind != Kind.INTERNAL;
  }

  @Override
  public String toString() {
    return "Microstep [" + source + "->" + target + ", kind=" + kind + ", event=" + event
        + ", guard=" + guard + ", actions=" + actions + ", transitions=" + transitions + "]";
  }
}
