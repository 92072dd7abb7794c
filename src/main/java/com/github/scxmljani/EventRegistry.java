package com.github.scxmljani;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import com.github.scxmljani.CompilerException.Code;

/**
 * Network-wide view of the events of all automata, computed before any automaton is resolved.
 *
 * Events are classified per automaton as internal (raised by it or a done.state event of one of
 * its states), network (sent with {@code <send>} by some automaton) or environment (listened to
 * but never sent nor raised). Parameter types of network events are inferred from the senders'
 * parameter expressions and must agree across all senders.
 *
 * Closed events are only ever produced inside the network, such as the ticks and statuses of
 * an expanded behavior tree. When nobody sends one, it is never delivered instead of becoming an
 * environment event.
 */
public final class EventRegistry {
  // event -> parameter -> type
  private final Map<String, Map<String, ExpressionType>> parameterTypes = new LinkedHashMap<>();
  // event -> sending automata, in network order
  private final Map<String, Set<String>> senders = new LinkedHashMap<>();
  // automaton -> events it can be delivered, sorted
  private final Map<String, Set<String>> receivable = new LinkedHashMap<>();
  private final Set<String> environmentEvents = new TreeSet<>();
  private final Set<String> closedEvents;

  private EventRegistry(final Set<String> closedEvents) {
    this.closedEvents = closedEvents;
  }

  public static EventRegistry build(final List<Statechart> statecharts,
      final Map<String, ExpressionType> globals) throws CompilerException {
    return build(statecharts, globals, Collections.<String>emptySet());
  }

  public static EventRegistry build(final List<Statechart> statecharts,
      final Map<String, ExpressionType> globals, final Set<String> closedEvents)
      throws CompilerException {
    final EventRegistry registry = new EventRegistry(new TreeSet<>(closedEvents));
    final List<PendingSend> pending = new ArrayList<>();
    for (Statechart statechart : statecharts) {
      final Scope scope = new Scope(statechart.getName(), statechart.getLocalTypes(), globals);
      for (StateNode state : statechart.getStates().values()) {
        registry.collectSends(statechart, scope, null, state.getOnEntry(), pending);
        registry.collectSends(statechart, scope, null, state.getOnExit(), pending);
        if (state.getInitialTransition() != null) {
          registry.collectSends(statechart, scope, null,
              state.getInitialTransition().getContent(), pending);
        }
      }
      registry.collectSends(statechart, scope, null,
          statechart.getRoot().getInitialTransition().getContent(), pending);
      for (TransitionNode transition : statechart.getTransitions()) {
        String trigger = null;
        if (transition.getEvents().size() == 1
            && !transition.getEvents().get(0).contains("*")) {
          trigger = transition.getEvents().get(0);
        }
        registry.collectSends(statechart, scope, trigger, transition.getContent(), pending);
      }
    }
    registry.inferParameterTypes(pending);
    for (Statechart statechart : statecharts) {
      registry.classify(statechart);
    }
    return registry;
  }

  private void collectSends(final Statechart statechart, final Scope scope, final String trigger,
      final List<ExecutableContent> content, final List<PendingSend> pending) {
    for (ExecutableContent item : content) {
      if (item instanceof ExecutableContent.Send) {
        final ExecutableContent.Send send = (ExecutableContent.Send) item;
        Set<String> eventSenders = senders.get(send.getEvent());
        if (eventSenders == null) {
          eventSenders = new LinkedHashSet<>();
          senders.put(send.getEvent(), eventSenders);
        }
        eventSenders.add(statechart.getName());
        pending.add(new PendingSend(statechart, scope, trigger, send));
      } else if (item instanceof ExecutableContent.If) {
        for (ExecutableContent.Branch branch : ((ExecutableContent.If) item).getBranches()) {
          collectSends(statechart, scope, trigger, branch.getContent(), pending);
        }
      }
    }
  }

  /**
   * Types parameters until nothing changes, since a parameter may forward the data of the event
   * that triggered its send. Whatever cannot be typed in the end is reported.
   */
  private void inferParameterTypes(final List<PendingSend> pending) throws CompilerException {
    final List<PendingSend> remaining = new ArrayList<>(pending);
    boolean progress = true;
    CompilerException lastProblem = null;
    while (!remaining.isEmpty() && progress) {
      progress = false;
      lastProblem = null;
      for (int i = 0; i < remaining.size(); i++) {
        final PendingSend send = remaining.get(i);
        final Scope scope = send.trigger == null ? send.scope
            : send.scope.withEvent(send.trigger, parameterTypes.get(send.trigger));
        final Map<String, ExpressionType> types = new LinkedHashMap<>();
        try {
          for (Map.Entry<String, Expression> parameter : send.send.getParameters().entrySet()) {
            types.put(parameter.getKey(),
                ExpressionTypeChecker.check(parameter.getValue(), scope).erased());
          }
        } catch (CompilerException problem) {
          lastProblem = problem.locate(send.statechart.getDocumentId(),
              "automaton " + send.statechart.getName() + " " + send.send.getElementPath());
          continue;
        }
        register(send, types);
        remaining.remove(i--);
        progress = true;
      }
    }
    if (lastProblem != null) {
      throw lastProblem;
    }
  }

  private void register(final PendingSend send, final Map<String, ExpressionType> types)
      throws CompilerException {
    final String event = send.send.getEvent();
    final Map<String, ExpressionType> known = parameterTypes.get(event);
    if (known == null) {
      parameterTypes.put(event, types);
      return;
    }
    if (!known.keySet().equals(types.keySet())) {
      throw new CompilerException(Code.COMPOSITION_INCONSISTENCY,
          send.statechart.getDocumentId(), send.send.getElementPath(), "Event '" + event
              + "' is sent with parameters " + types.keySet() + " and " + known.keySet());
    }
    for (Map.Entry<String, ExpressionType> parameter : types.entrySet()) {
      final ExpressionType other = known.get(parameter.getKey());
      if (!other.equals(parameter.getValue())
          && !(other.isArray() && parameter.getValue().isArray()
              && (other.isAssignableFrom(parameter.getValue())
                  || parameter.getValue().isAssignableFrom(other)))) {
        throw new CompilerException(Code.COMPOSITION_INCONSISTENCY,
            send.statechart.getDocumentId(), send.send.getElementPath(),
            "Parameter '" + parameter.getKey() + "' of event '" + event + "' is sent as "
                + parameter.getValue() + " and as " + other);
      }
    }
  }

  private void classify(final Statechart statechart) {
    final Set<String> internal = internalEvents(statechart);
    final Set<String> events = new TreeSet<>();
    for (TransitionNode transition : statechart.getTransitions()) {
      for (String network : senders.keySet()) {
        if (transition.matches(network)) {
          events.add(network);
        }
      }
      for (String descriptor : transition.getEvents()) {
        final String token =
            descriptor.endsWith(".*") ? descriptor.substring(0, descriptor.length() - 2)
                : descriptor;
        if ("*".equals(token) || isMatchedByAny(token, senders.keySet())
            || isMatchedByAny(token, internal) || closedEvents.contains(token)) {
          continue;
        }
        events.add(token);
        environmentEvents.add(token);
      }
    }
    receivable.put(statechart.getName(), Collections.unmodifiableSet(events));
  }

  private static boolean isMatchedByAny(final String descriptor, final Set<String> events) {
    for (String event : events) {
      if (TransitionNode.descriptorMatches(descriptor, event)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Events an automaton raises itself, including the done events of its composite states.
   */
  static Set<String> internalEvents(final Statechart statechart) {
    final Set<String> internal = new LinkedHashSet<>();
    for (StateNode state : statechart.getStates().values()) {
      if (state.getKind().isComposite()) {
        internal.add(MicrostepExecutor.doneStatePrefix + state.getId());
      }
      collectRaises(state.getOnEntry(), internal);
      collectRaises(state.getOnExit(), internal);
      if (state.getInitialTransition() != null) {
        collectRaises(state.getInitialTransition().getContent(), internal);
      }
    }
    for (TransitionNode transition : statechart.getTransitions()) {
      collectRaises(transition.getContent(), internal);
    }
    return internal;
  }

  private static void collectRaises(final List<ExecutableContent> content,
      final Set<String> internal) {
    for (ExecutableContent item : content) {
      if (item instanceof ExecutableContent.Raise) {
        internal.add(((ExecutableContent.Raise) item).getEvent());
      } else if (item instanceof ExecutableContent.If) {
        for (ExecutableContent.Branch branch : ((ExecutableContent.If) item).getBranches()) {
          collectRaises(branch.getContent(), internal);
        }
      }
    }
  }

  public Set<String> getNetworkEvents() {
    return Collections.unmodifiableSet(senders.keySet());
  }

  public Set<String> getEnvironmentEvents() {
    return Collections.unmodifiableSet(environmentEvents);
  }

  public boolean isNetworkEvent(final String event) {
    return senders.containsKey(event);
  }

  public boolean isEnvironmentEvent(final String event) {
    return environmentEvents.contains(event);
  }

  /**
   * Parameter types of an event, empty for events without parameters.
   */
  public Map<String, ExpressionType> getParameterTypes(final String event) {
    final Map<String, ExpressionType> types = parameterTypes.get(event);
    return types == null ? Collections.<String, ExpressionType>emptyMap()
        : Collections.unmodifiableMap(types);
  }

  public Set<String> getSenders(final String event) {
    final Set<String> eventSenders = senders.get(event);
    return eventSenders == null ? Collections.<String>emptySet()
        : Collections.unmodifiableSet(eventSenders);
  }

  /**
   * Events that can be delivered to the automaton from the network or the environment.
   */
  public Set<String> getReceivableEvents(final String automaton) {
    final Set<String> events = receivable.get(automaton);
    return events == null ? Collections.<String>emptySet() : events;
  }

  /**
   * Automata that can be delivered the event, in network order.
   */
  public List<String> getListeners(final String event) {
    final List<String> listeners = new ArrayList<>();
    for (Map.Entry<String, Set<String>> entry : receivable.entrySet()) {
      if (entry.getValue().contains(event)) {
        listeners.add(entry.getKey());
      }
    }
    return listeners;
  }

  @Override
  public String toString() {
    return "EventRegistry [networkEvents=" + senders.keySet() + ", environmentEvents="
        + environmentEvents + ", receivable=" + receivable + "]";
  }

  private static final class PendingSend {
    private final Statechart statechart;
    private final Scope scope;
    private final String trigger;
    private final ExecutableContent.Send send;

    private PendingSend(final Statechart statechart, final Scope scope, final String trigger,
        final ExecutableContent.Send send) {
      this.statechart = statechart;
      this.scope = scope;
      this.trigger = trigger;
      this.send = send;
    }
  }
}
