package com.github.scxmljani;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Statechart transition selection over symbolic guards.
 *
 * For every active atomic state, in document order, the state and its ancestors are searched
 * innermost first for the first transition (document order) that matches the trigger and whose
 * guard holds. Since guards are symbolic, every possible outcome of the guards is enumerated and
 * returned as one {@link Selection} with the conjunction of the decided guards. A transition
 * reachable from several atomic states is decided once per outcome.
 *
 * Conflicts among the selected transitions are then resolved: a transition whose source is
 * strictly nested in the source of a conflicting one preempts it, and among the remaining
 * conflicting transitions the smallest document index wins. Two transitions conflict when their
 * exit sets intersect; targetless transitions never conflict.
 */
final class TransitionSelector {
  private static final Comparator<TransitionNode> documentOrder =
      new Comparator<TransitionNode>() {
        @Override
        public int compare(TransitionNode first, TransitionNode second) {
          return Integer.compare(first.getDocumentIndex(), second.getDocumentIndex());
        }
      };

  private final Statechart statechart;
  private final ActiveConfiguration configuration;
  private final Scope scope;
  private final List<List<TransitionNode>> chains = new ArrayList<>();
  private final Map<TransitionNode, Expression> guards = new HashMap<>();
  private final List<Selection> selections = new ArrayList<>();

  private TransitionSelector(final Statechart statechart,
      final ActiveConfiguration configuration, final Scope scope) {
    this.statechart = statechart;
    this.configuration = configuration;
    this.scope = scope;
  }

  /**
   * Enumerates the selections for an event, or for eventless transitions when {@code event} is
   * null. The guards of the returned selections are mutually exclusive and cover every valuation;
   * selections whose transition list is empty describe when nothing is enabled.
   */
  static List<Selection> select(final Statechart statechart,
      final ActiveConfiguration configuration, final String event, final Scope scope)
      throws CompilerException {
    final TransitionSelector selector = new TransitionSelector(statechart, configuration, scope);
    selector.buildChains(event);
    selector.enumerate(0, new HashMap<TransitionNode, Boolean>(), Expressions.TRUE,
        new ArrayList<TransitionNode>());
    return selector.selections;
  }

  private void buildChains(final String event) throws CompilerException {
    final Set<String> activeIds = configuration.getActiveIds();
    for (StateNode atomic : configuration.getAtomicStates()) {
      final List<TransitionNode> chain = new ArrayList<>();
      final List<StateNode> sources = new ArrayList<>();
      sources.add(atomic);
      sources.addAll(atomic.getAncestors(statechart.getRoot()));
      for (StateNode source : sources) {
        for (TransitionNode transition : source.getTransitions()) {
          final boolean triggered =
              event == null ? transition.isEventless() : transition.matches(event);
          if (triggered) {
            chain.add(transition);
            if (!guards.containsKey(transition)) {
              guards.put(transition, prepareGuard(transition, activeIds));
            }
          }
        }
      }
      if (!chain.isEmpty()) {
        chains.add(chain);
      }
    }
  }

  private Expression prepareGuard(final TransitionNode transition, final Set<String> activeIds)
      throws CompilerException {
    if (transition.getGuard() == null) {
      return Expressions.TRUE;
    }
    try {
      ExpressionTypeChecker.checkCondition(transition.getGuard(), scope);
      return Expressions.fold(Expressions.foldIn(transition.getGuard(), activeIds));
    } catch (CompilerException problem) {
      throw problem.locate(statechart.getDocumentId(), "automaton " + statechart.getName()
          + " transition " + transition.getDocumentIndex() + " " + transition.getElementPath());
    }
  }

  private void enumerate(final int chainIndex, final Map<TransitionNode, Boolean> decisions,
      final Expression guard, final List<TransitionNode> selected) {
    if (chainIndex == chains.size()) {
      selections.add(new Selection(guard, resolveConflicts(selected)));
      return;
    }
    walk(chainIndex, 0, decisions, guard, selected);
  }

  private void walk(final int chainIndex, final int position,
      final Map<TransitionNode, Boolean> decisions, final Expression guard,
      final List<TransitionNode> selected) {
    final List<TransitionNode> chain = chains.get(chainIndex);
    if (position == chain.size()) {
      enumerate(chainIndex + 1, decisions, guard, selected);
      return;
    }
    final TransitionNode transition = chain.get(position);
    final Boolean decided = decisions.get(transition);
    if (decided != null) {
      if (decided) {
        enumerate(chainIndex + 1, decisions, guard, with(selected, transition));
      } else {
        walk(chainIndex, position + 1, decisions, guard, selected);
      }
      return;
    }
    final Expression transitionGuard = guards.get(transition);
    if (!Expressions.isFalse(transitionGuard)) {
      final Map<TransitionNode, Boolean> taken = new HashMap<>(decisions);
      taken.put(transition, Boolean.TRUE);
      enumerate(chainIndex + 1, taken, Expressions.and(guard, transitionGuard),
          with(selected, transition));
    }
    if (!Expressions.isTrue(transitionGuard)) {
      final Map<TransitionNode, Boolean> skipped = new HashMap<>(decisions);
      skipped.put(transition, Boolean.FALSE);
      walk(chainIndex, position + 1, skipped,
          Expressions.and(guard, Expressions.not(transitionGuard)), selected);
    }
  }

  private static List<TransitionNode> with(final List<TransitionNode> selected,
      final TransitionNode transition) {
    final List<TransitionNode> extended = new ArrayList<>(selected);
    if (!extended.contains(transition)) {
      extended.add(transition);
    }
    return extended;
  }

  private List<TransitionNode> resolveConflicts(final List<TransitionNode> selected) {
    final List<TransitionNode> unpreempted = new ArrayList<>();
    for (TransitionNode candidate : selected) {
      boolean preempted = false;
      for (TransitionNode other : selected) {
        if (other != candidate
            && other.getSource().isDescendantOf(candidate.getSource())
            && conflict(candidate, other)) {
          preempted = true;
          break;
        }
      }
      if (!preempted) {
        unpreempted.add(candidate);
      }
    }
    Collections.sort(unpreempted, documentOrder);
    final List<TransitionNode> kept = new ArrayList<>();
    for (TransitionNode candidate : unpreempted) {
      boolean conflicting = false;
      for (TransitionNode winner : kept) {
        if (conflict(candidate, winner)) {
          conflicting = true;
          break;
        }
      }
      if (!conflicting) {
        kept.add(candidate);
      }
    }
    return kept;
  }

  private boolean conflict(final TransitionNode first, final TransitionNode second) {
    final Set<StateNode> firstExits = exitSet(first, configuration, statechart.getRoot());
    if (firstExits.isEmpty()) {
      return false;
    }
    for (StateNode state : exitSet(second, configuration, statechart.getRoot())) {
      if (firstExits.contains(state)) {
        return true;
      }
    }
    return false;
  }

  /**
   * The states a transition leaves in the given configuration: the active descendants of its
   * domain. Empty for targetless transitions.
   */
  static Set<StateNode> exitSet(final TransitionNode transition,
      final ActiveConfiguration configuration, final StateNode root) {
    final Set<StateNode> exits = new LinkedHashSet<>();
    final StateNode domain = domain(transition, root);
    if (domain == null) {
      return exits;
    }
    for (StateNode active : configuration.getActiveStates()) {
      if (active.isDescendantOf(domain)) {
        exits.add(active);
      }
    }
    return exits;
  }

  /**
   * Transition domain: the source itself for internal transitions into its own descendants,
   * otherwise the innermost compound proper ancestor of the source containing every target.
   */
  static StateNode domain(final TransitionNode transition, final StateNode root) {
    if (transition.isTargetless()) {
      return null;
    }
    final StateNode source = transition.getSource();
    if (transition.isInternal() && source.isCompound()) {
      boolean allDescendants = true;
      for (StateNode target : transition.getTargets()) {
        allDescendants &= target.isDescendantOf(source);
      }
      if (allDescendants) {
        return source;
      }
    }
    for (StateNode ancestor : source.getAncestors(null)) {
      if (!ancestor.isCompound()) {
        continue;
      }
      boolean containsAll = true;
      for (StateNode target : transition.getTargets()) {
        containsAll &= target.isDescendantOf(ancestor);
      }
      if (containsAll) {
        return ancestor;
      }
    }
    return root;
  }

  /**
   * One outcome of the guards: when {@code guard} holds, {@code transitions} fire together, in
   * document order.
   */
  static final class Selection {
    private final Expression guard;
    private final List<TransitionNode> transitions;

    Selection(final Expression guard, final List<TransitionNode> transitions) {
      this.guard = guard;
      this.transitions = Collections.unmodifiableList(transitions);
    }

    Expression getGuard() {
      return guard;
    }

    List<TransitionNode> getTransitions() {
      return transitions;
    }

    @Override
    public String toString() {
      return "Selection [guard=" + guard + ", transitions=" + transitions + "]";
    }
  }
}
