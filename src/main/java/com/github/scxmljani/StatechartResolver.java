package com.github.scxmljani;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.Deque;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.scxmljani.CompilerException.Code;

/**
 * Flattens one statechart into locations and microsteps by exploring every reachable pair of
 * configuration and internal event queue, starting from the initial entry.
 *
 * In a location, eventless transitions are tried first. Only when none is enabled the head of the
 * internal queue is consumed, and only with an empty internal queue external events are
 * received. External events nothing takes are discarded by a self loop. Locations in the middle
 * of a macrostep let every event they listen to pass by the same way, guarded so that exactly one
 * step on an event is enabled at any time, so no listener ever blocks a broadcast. A terminated
 * automaton keeps discarding everything it listens to.
 *
 * Locations are identified by configuration and queue. Their names are only for display and are
 * made unique against the state ids of the chart.
 */
public final class StatechartResolver {
  private static final Logger logger =
      LogManager.getLogger(StatechartResolver.class.getSimpleName());

  static final String initializingLocation = "__init";

  private final Statechart statechart;
  private final EventRegistry events;
  private final CompilerConfiguration config;
  private final Scope scope;
  private final List<Location> locations = new ArrayList<>();
  // (configuration, queue) -> location index
  private final Map<List<Object>, Integer> locationIndex = new HashMap<>();
  private final Set<String> locationNames = new HashSet<>();
  private final List<Microstep> microsteps = new ArrayList<>();
  private final Deque<Integer> frontier = new ArrayDeque<>();
  // locations that can only take internal steps
  private final BitSet unstable = new BitSet();

  private StatechartResolver(final Statechart statechart,
      final Map<String, ExpressionType> globals, final EventRegistry events,
      final CompilerConfiguration config) {
    this.statechart = statechart;
    this.events = events;
    this.config = config;
    this.scope = new Scope(statechart.getName(), statechart.getLocalTypes(), globals);
  }

  public static ResolvedAutomaton resolve(final Statechart statechart,
      final Map<String, ExpressionType> globals, final EventRegistry events,
      final CompilerConfiguration config) throws CompilerException {
    final StatechartResolver resolver =
        new StatechartResolver(statechart, globals, events, config);
    resolver.explore();
    resolver.checkTermination();
    final ResolvedAutomaton automaton = new ResolvedAutomaton(statechart, resolver.scope,
        resolver.locations, resolver.microsteps,
        events.getReceivableEvents(statechart.getName()));
    if (logger.isDebugEnabled()) {
      logger.debug("[a:" + statechart.getName() + "] Resolved " + automaton.getLocations().size()
          + " locations and " + automaton.getMicrosteps().size() + " microsteps");
    }
    return automaton;
  }

  private void explore() throws CompilerException {
    final MicrostepExecutor.Step initial = MicrostepExecutor.initialize(statechart, scope);
    final List<MicrostepExecutor.Branch> branches = initial.getBranches();
    if (branches.size() == 1 && branches.get(0).getActions().isEmpty()
        && Expressions.isTrue(branches.get(0).getGuard())) {
      locate(initial.getTarget(), branches.get(0).getRaised());
    } else {
      String name = initializingLocation;
      while (statechart.getStates().containsKey(name)) {
        name = name + "_";
      }
      final Location init = new Location(0, name, ActiveConfiguration.empty(),
          Collections.<String>emptyList(), true);
      locations.add(init);
      locationNames.add(name);
      unstable.set(0);
      passBy(0, Expressions.TRUE);
      for (MicrostepExecutor.Branch branch : branches) {
        final int target = locate(initial.getTarget(), branch.getRaised());
        microsteps.add(new Microstep(0, target, Microstep.Kind.INTERNAL, null,
            Expressions.fold(branch.getGuard()), branch.getActions(),
            Collections.<Integer>emptyList()));
      }
    }
    while (!frontier.isEmpty()) {
      expand(locations.get(frontier.removeFirst()));
    }
  }

  private int locate(final ActiveConfiguration configuration, final List<String> queue)
      throws CompilerException {
    if (queue.size() > config.getInternalQueueBound()) {
      throw new CompilerException(Code.SEMANTIC_NONTERMINATION, statechart.getDocumentId(),
          "automaton " + statechart.getName(), "Internal event queue " + queue
              + " exceeds the bound of " + config.getInternalQueueBound() + " in configuration "
              + configuration);
    }
    final List<Object> key = Arrays.<Object>asList(configuration, new ArrayList<>(queue));
    final Integer known = locationIndex.get(key);
    if (known != null) {
      return known;
    }
    final String base = Location.nameOf(configuration, queue);
    String name = base;
    for (int copy = 1; !locationNames.add(name); copy++) {
      name = base + "_" + copy;
    }
    final Location location =
        new Location(locations.size(), name, configuration, queue, false);
    locations.add(location);
    locationIndex.put(key, location.getIndex());
    frontier.addLast(location.getIndex());
    return location.getIndex();
  }

  private void expand(final Location location) throws CompilerException {
    final ActiveConfiguration configuration = location.getConfiguration();
    if (location.isTerminated()) {
      for (String event : events.getReceivableEvents(statechart.getName())) {
        addMicrostep(location.getIndex(), location.getIndex(), Microstep.Kind.DISCARD, event,
            Expressions.TRUE, Collections.<ExecutableContent>emptyList(),
            Collections.<Integer>emptyList());
      }
      return;
    }
    Expression idle = Expressions.FALSE;
    for (TransitionSelector.Selection selection : TransitionSelector.select(statechart,
        configuration, null, scope)) {
      if (selection.getTransitions().isEmpty()) {
        idle = Expressions.or(idle, selection.getGuard());
      } else {
        take(location, selection, Expressions.TRUE, Microstep.Kind.INTERNAL, null,
            location.getInternalQueue(), scope);
      }
    }
    idle = Expressions.fold(idle);
    if (Expressions.isFalse(idle)) {
      unstable.set(location.getIndex());
      passBy(location.getIndex(), Expressions.TRUE);
      return;
    }
    final List<String> queue = location.getInternalQueue();
    if (!queue.isEmpty()) {
      unstable.set(location.getIndex());
      passBy(location.getIndex(), Expressions.TRUE);
      final String head = queue.get(0);
      final List<String> rest = queue.subList(1, queue.size());
      for (TransitionSelector.Selection selection : TransitionSelector.select(statechart,
          configuration, head, scope)) {
        if (selection.getTransitions().isEmpty()) {
          addMicrostep(location.getIndex(), locate(configuration, rest), Microstep.Kind.INTERNAL,
              head, Expressions.and(idle, selection.getGuard()),
              Collections.<ExecutableContent>emptyList(), Collections.<Integer>emptyList());
        } else {
          take(location, selection, idle, Microstep.Kind.INTERNAL, head, rest, scope);
        }
      }
      return;
    }
    passBy(location.getIndex(), Expressions.not(idle));
    for (String event : events.getReceivableEvents(statechart.getName())) {
      final Scope eventScope = scope.withEvent(event, events.getParameterTypes(event));
      for (TransitionSelector.Selection selection : TransitionSelector.select(statechart,
          configuration, event, eventScope)) {
        if (selection.getTransitions().isEmpty()) {
          addMicrostep(location.getIndex(), location.getIndex(), Microstep.Kind.DISCARD, event,
              Expressions.and(idle, selection.getGuard()),
              Collections.<ExecutableContent>emptyList(), Collections.<Integer>emptyList());
        } else {
          take(location, selection, idle, Microstep.Kind.RECEIVE, event,
              Collections.<String>emptyList(), eventScope);
        }
      }
    }
  }

  private void take(final Location location, final TransitionSelector.Selection selection,
      final Expression precondition, final Microstep.Kind kind, final String event,
      final List<String> queue, final Scope stepScope) throws CompilerException {
    final MicrostepExecutor.Step step = MicrostepExecutor.execute(statechart,
        location.getConfiguration(), selection.getTransitions(), stepScope);
    final List<Integer> taken = new ArrayList<>();
    for (TransitionNode transition : selection.getTransitions()) {
      taken.add(transition.getDocumentIndex());
    }
    for (MicrostepExecutor.Branch branch : step.getBranches()) {
      final Expression guard = Expressions.and(precondition,
          Expressions.and(selection.getGuard(), branch.getGuard()));
      if (Expressions.isFalse(Expressions.fold(guard))) {
        continue;
      }
      final List<String> targetQueue = new ArrayList<>(queue);
      targetQueue.addAll(branch.getRaised());
      addMicrostep(location.getIndex(), locate(step.getTarget(), targetQueue), kind, event,
          guard, branch.getActions(), taken);
    }
  }

  // external events arriving while an eventless or internal step is pending
  private void passBy(final int location, final Expression busy) throws CompilerException {
    for (String event : events.getReceivableEvents(statechart.getName())) {
      addMicrostep(location, location, Microstep.Kind.DISCARD, event, busy,
          Collections.<ExecutableContent>emptyList(), Collections.<Integer>emptyList());
    }
  }

  private void addMicrostep(final int source, final int target, final Microstep.Kind kind,
      final String event, final Expression guard, final List<ExecutableContent> actions,
      final List<Integer> transitions) throws CompilerException {
    final Expression folded = Expressions.fold(guard);
    if (Expressions.isFalse(folded)) {
      return;
    }
    microsteps.add(new Microstep(source, target, kind, event, folded, actions, transitions));
  }

  /**
   * Every location that can only take internal steps must be able to reach a location that
   * waits for external events (or has terminated); otherwise some run never settles.
   */
  private void checkTermination() throws CompilerException {
    final BitSet settles = new BitSet();
    for (Location location : locations) {
      if (!unstable.get(location.getIndex())) {
        settles.set(location.getIndex());
      }
    }
    boolean changed = true;
    while (changed) {
      changed = false;
      for (Microstep microstep : microsteps) {
        if (settles.get(microstep.getTarget()) && !settles.get(microstep.getSource())) {
          settles.set(microstep.getSource());
          changed = true;
        }
      }
    }
    for (Location location : locations) {
      if (!settles.get(location.getIndex())) {
        throw new CompilerException(Code.SEMANTIC_NONTERMINATION, statechart.getDocumentId(),
            "automaton " + statechart.getName(), "Non-terminating eventless cycle through "
                + "location '" + location.getName() + "'");
      }
    }
  }
}
