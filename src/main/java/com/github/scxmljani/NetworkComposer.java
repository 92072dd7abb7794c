package com.github.scxmljani;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.scxmljani.CompilerException.Code;

/**
 * Merges resolved automata into one network.
 *
 * Every event crossing automaton boundaries is split into the labels {@code <E>_on_send} and
 * {@code <E>_on_receive}: one synchronization vector per sender and event joins the sender's
 * send with the receive of every other listener, and each environment event gets a vector of
 * receivers only. Since a JANI edge carries a single action, a microstep sending events is
 * lowered to a chain of edges through intermediate locations. Parameters travel through the
 * global variables {@code <E>.<param>}, written by the sender before the synchronizing edge while
 * {@code <E>.valid} is clear, and read by the receivers on the synchronizing edge.
 *
 * Every listener has exactly one enabled {@code <E>_on_receive} edge in every location: a real
 * receive, a discard, or a self loop letting the event pass by while the listener is in the middle
 * of a step, intermediate locations of a chain included. A send therefore never waits for its
 * listeners.
 */
public final class NetworkComposer {
  private static final Logger logger = LogManager.getLogger(NetworkComposer.class.getSimpleName());

  static final String sendSuffix = "_on_send";
  static final String receiveSuffix = "_on_receive";
  static final String validSuffix = ".valid";
  // destinations one edge may expand into for its Math.random() draws
  static final long maxRandomOutcomes = 10000L;

  private final String networkName;
  private final List<ResolvedAutomaton> automata;
  private final EventRegistry events;
  private final CompilerConfiguration config;
  private final Map<String, NetworkVariable> variables = new LinkedHashMap<>();
  // variable -> who declared it, for collision reports
  private final Map<String, String> declaredBy = new HashMap<>();
  private final Set<String> actions = new LinkedHashSet<>();
  private final List<SyncVector> syncVectors = new ArrayList<>();
  // event -> automata whose send of it synchronizes with someone
  private final Map<String, Set<String>> deliveredSends = new HashMap<>();
  // event -> automata taking part as receivers in some vector
  private final Map<String, Set<String>> receivers = new HashMap<>();

  private NetworkComposer(final String networkName, final List<ResolvedAutomaton> automata,
      final EventRegistry events, final CompilerConfiguration config) {
    this.networkName = networkName;
    this.automata = automata;
    this.events = events;
    this.config = config;
  }

  public static AutomataNetwork compose(final String networkName,
      final List<ResolvedAutomaton> automata, final List<DataVariable> globals,
      final EventRegistry events, final List<PropertyDeclaration> properties,
      final CompilerConfiguration config) throws CompilerException {
    final NetworkComposer composer = new NetworkComposer(networkName, automata, events, config);
    composer.checkAutomatonNames();
    for (DataVariable global : globals) {
      composer.declare(global.getId(), global.getType(), global.getInitialValueOrDefault(),
          new Scope(networkName, Collections.<String, ExpressionType>emptyMap(),
              Collections.<String, ExpressionType>emptyMap()),
          "global declarations");
    }
    for (ResolvedAutomaton automaton : automata) {
      final Statechart statechart = automaton.getStatechart();
      for (DataVariable local : statechart.getDataVariables().values()) {
        try {
          composer.declare(automaton.getScope().resolve(local.getId()).getQualifiedName(),
              local.getType(), local.getInitialValueOrDefault(), automaton.getScope(),
              "automaton " + automaton.getName());
        } catch (CompilerException problem) {
          throw problem.locate(statechart.getDocumentId(),
              "automaton " + automaton.getName() + " data " + local.getId());
        }
      }
    }
    composer.declareEventParameters();
    composer.buildSyncVectors();
    final List<NetworkAutomaton> networkAutomata = new ArrayList<>();
    for (ResolvedAutomaton automaton : automata) {
      networkAutomata.add(composer.translate(automaton));
    }
    final List<AutomataNetwork.Property> checkedProperties = new ArrayList<>();
    for (PropertyDeclaration property : properties) {
      checkedProperties.add(composer.checkProperty(property));
    }
    final AutomataNetwork network = new AutomataNetwork(networkName, config.getModelType(),
        new ArrayList<>(composer.variables.values()), networkAutomata,
        new ArrayList<>(composer.actions), composer.syncVectors, checkedProperties);
    logger.info("[n:" + networkName + "] Composed " + networkAutomata.size() + " automata with "
        + network.getVariables().size() + " variables and " + network.getSyncVectors().size()
        + " synchronization vectors");
    return network;
  }

  private void checkAutomatonNames() throws CompilerException {
    final Set<String> names = new HashSet<String>();
    for (ResolvedAutomaton automaton : automata) {
      if (!names.add(automaton.getName())) {
        throw new CompilerException(Code.COMPOSITION_INCONSISTENCY,
            automaton.getStatechart().getDocumentId(), null,
            "Duplicate automaton instance '" + automaton.getName() + "'");
      }
    }
  }

  private void declare(final String name, final ExpressionType type, final Expression initial,
      final Scope scope, final String owner) throws CompilerException {
    ExpressionTypeChecker.checkAssignable(type, initial, scope);
    final Expression value = Expressions.fold(initial);
    if (!type.isArray()) {
      if (!(value instanceof Expression.Literal)) {
        throw new CompilerException(Code.UNSUPPORTED_CONSTRUCT,
            "Unsupported expression construct non-constant initial value '" + initial
                + "' of '" + name + "'");
      }
      add(new NetworkVariable(name, type, coerce(type, value)), owner);
      return;
    }
    if (!(value instanceof Expression.ArrayLiteral)) {
      throw new CompilerException(Code.UNSUPPORTED_CONSTRUCT,
          "Unsupported expression construct non-constant initial value '" + initial + "' of '"
              + name + "'");
    }
    final List<Expression> elements = ((Expression.ArrayLiteral) value).getElements();
    for (Expression element : elements) {
      if (!(element instanceof Expression.Literal)) {
        throw new CompilerException(Code.UNSUPPORTED_CONSTRUCT,
            "Unsupported expression construct non-constant initial value '" + initial
                + "' of '" + name + "'");
      }
    }
    final ExpressionType arrayType = arrayType(type);
    add(new NetworkVariable(name, arrayType, pad(name, arrayType, elements)), owner);
    add(new NetworkVariable(name + Scope.lengthSuffix,
        ExpressionType.boundedInt(0L, (long) arrayType.getCapacity()),
        Expression.literal((long) elements.size())), owner);
  }

  private void add(final NetworkVariable variable, final String owner) throws CompilerException {
    final String other = declaredBy.get(variable.getName());
    if (other != null) {
      throw new CompilerException(Code.COMPOSITION_INCONSISTENCY, "Variable '"
          + variable.getName() + "' of " + owner + " collides with the one of " + other);
    }
    declaredBy.put(variable.getName(), owner);
    variables.put(variable.getName(), variable);
  }

  private ExpressionType arrayType(final ExpressionType type) {
    final ExpressionType base = type.getBase() == null ? ExpressionType.INT : type.getBase();
    final int capacity = type.getCapacity() > 0 ? type.getCapacity() : config.getMaxArraySize();
    return ExpressionType.arrayOf(base, capacity);
  }

  private static Expression coerce(final ExpressionType type, final Expression value) {
    if (type.getKind() == ExpressionType.Kind.REAL && value instanceof Expression.Literal
        && ((Expression.Literal) value).getValue() instanceof Long) {
      return Expression.literal(((Long) ((Expression.Literal) value).getValue()).doubleValue());
    }
    return value;
  }

  // fills an array value up to the capacity with the zero value of the base type
  private static Expression pad(final String name, final ExpressionType arrayType,
      final List<Expression> elements) throws CompilerException {
    if (elements.size() > arrayType.getCapacity()) {
      throw new CompilerException(Code.UNSUPPORTED_CONSTRUCT, "Unsupported expression construct "
          + "array value of " + elements.size() + " elements for '" + name + "' of capacity "
          + arrayType.getCapacity());
    }
    final List<Expression> padded = new ArrayList<>();
    for (Expression element : elements) {
      padded.add(coerce(arrayType.getBase(), element));
    }
    while (padded.size() < arrayType.getCapacity()) {
      padded.add(DataVariable.defaultValue(arrayType.getBase()));
    }
    return Expression.array(padded);
  }

  private void declareEventParameters() throws CompilerException {
    final Scope empty = new Scope(networkName, Collections.<String, ExpressionType>emptyMap(),
        Collections.<String, ExpressionType>emptyMap());
    for (String event : events.getNetworkEvents()) {
      final Map<String, ExpressionType> parameters = events.getParameterTypes(event);
      if (parameters.isEmpty()) {
        continue;
      }
      for (Map.Entry<String, ExpressionType> parameter : parameters.entrySet()) {
        final ExpressionType type = parameter.getValue().isArray()
            ? arrayType(parameter.getValue()) : parameter.getValue();
        declare(event + "." + parameter.getKey(), type, DataVariable.defaultValue(type), empty,
            "event " + event);
      }
      add(new NetworkVariable(event + validSuffix, ExpressionType.BOOL, Expressions.FALSE),
          "event " + event);
    }
  }

  private void buildSyncVectors() {
    final Map<String, Integer> positions = new HashMap<>();
    for (int i = 0; i < automata.size(); i++) {
      positions.put(automata.get(i).getName(), i);
    }
    for (String event : events.getNetworkEvents()) {
      final List<String> listeners = events.getListeners(event);
      for (String sender : events.getSenders(event)) {
        final List<String> participants = new ArrayList<>(
            Collections.<String>nCopies(automata.size(), null));
        participants.set(positions.get(sender), event + sendSuffix);
        boolean anyReceiver = false;
        for (String listener : listeners) {
          if (!listener.equals(sender)) {
            participants.set(positions.get(listener), event + receiveSuffix);
            registerReceiver(event, listener);
            anyReceiver = true;
          }
        }
        if (!anyReceiver) {
          if (logger.isDebugEnabled()) {
            logger.debug("[n:" + networkName + "][a:" + sender + "] Nobody else listens to '"
                + event + "', its sends are dropped");
          }
          continue;
        }
        Set<String> eventSenders = deliveredSends.get(event);
        if (eventSenders == null) {
          eventSenders = new HashSet<String>();
          deliveredSends.put(event, eventSenders);
        }
        eventSenders.add(sender);
        addVector(participants, event);
      }
    }
    for (String event : events.getEnvironmentEvents()) {
      final List<String> participants =
          new ArrayList<>(Collections.<String>nCopies(automata.size(), null));
      for (String listener : events.getListeners(event)) {
        participants.set(positions.get(listener), event + receiveSuffix);
        registerReceiver(event, listener);
      }
      addVector(participants, event);
    }
  }

  private void registerReceiver(final String event, final String automaton) {
    Set<String> eventReceivers = receivers.get(event);
    if (eventReceivers == null) {
      eventReceivers = new HashSet<String>();
      receivers.put(event, eventReceivers);
    }
    eventReceivers.add(automaton);
  }

  private void addVector(final List<String> participants, final String result) {
    for (String participant : participants) {
      if (participant != null) {
        actions.add(participant);
      }
    }
    actions.add(result);
    syncVectors.add(new SyncVector(participants, result));
  }

  private boolean isReceiver(final String event, final String automaton) {
    final Set<String> eventReceivers = receivers.get(event);
    return eventReceivers != null && eventReceivers.contains(automaton);
  }

  private boolean isDelivered(final String event, final String automaton) {
    final Set<String> eventSenders = deliveredSends.get(event);
    return eventSenders != null && eventSenders.contains(automaton);
  }

  private NetworkAutomaton translate(final ResolvedAutomaton automaton) throws CompilerException {
    final List<String> locations = new ArrayList<>();
    for (Location location : automaton.getLocations()) {
      locations.add(location.getName());
    }
    final Set<String> taken = new HashSet<>(locations);
    final List<NetworkEdge> edges = new ArrayList<>();
    final List<Microstep> microsteps = automaton.getMicrosteps();
    for (int i = 0; i < microsteps.size(); i++) {
      final Microstep microstep = microsteps.get(i);
      try {
        new EdgeChain(automaton, microstep, i, locations, taken, edges).lower();
      } catch (CompilerException problem) {
        throw problem.locate(automaton.getStatechart().getDocumentId(),
            "automaton " + automaton.getName() + " microstep "
                + automaton.getLocation(microstep.getSource()).getName() + " -> "
                + automaton.getLocation(microstep.getTarget()).getName());
      }
    }
    for (String intermediate : locations.subList(automaton.getLocations().size(),
        locations.size())) {
      for (String event : automaton.getReceivableEvents()) {
        if (isReceiver(event, automaton.getName())) {
          edges.add(new NetworkEdge(intermediate, event + receiveSuffix, Expressions.TRUE,
              Collections.singletonList(new NetworkDestination(intermediate, null,
                  Collections.<NetworkAssignment>emptyList()))));
        }
      }
    }
    if (logger.isDebugEnabled()) {
      logger.debug("[n:" + networkName + "][a:" + automaton.getName() + "] Translated "
          + microsteps.size() + " microsteps into " + edges.size() + " edges over "
          + locations.size() + " locations");
    }
    return new NetworkAutomaton(automaton.getName(), locations,
        automaton.getInitialLocation().getName(), edges);
  }

  private AutomataNetwork.Property checkProperty(final PropertyDeclaration property)
      throws CompilerException {
    final Map<String, ExpressionType> types = new LinkedHashMap<>();
    for (NetworkVariable variable : variables.values()) {
      types.put(variable.getName(), variable.getType());
    }
    final Scope scope =
        new Scope(networkName, Collections.<String, ExpressionType>emptyMap(), types);
    try {
      final Expression goal = ExpressionParser.parse(property.getGoal());
      if (Expressions.containsCall(goal, Operator.Function.IN)) {
        throw new CompilerException(Code.UNSUPPORTED_CONSTRUCT,
            "Unsupported expression construct In() in property goal '" + property.getGoal()
                + "'");
      }
      ExpressionTypeChecker.checkCondition(goal, scope);
      return new AutomataNetwork.Property(property.getName(), property.getKind(),
          ExpressionTranslator.qualify(goal, scope, config.getMaxArraySize()));
    } catch (CompilerException problem) {
      throw problem.locate(networkName, "property " + property.getName());
    }
  }

  /**
   * Pending write of a destination, over network-wide names, before levels are assigned.
   */
  private static final class Effect {
    private final String target;
    private final Expression index;
    private final Expression value;

    private Effect(final String target, final Expression index, final Expression value) {
      this.target = target;
      this.index = index;
      this.value = value;
    }
  }

  /**
   * Lowers one microstep into edges: the guarded first edge with the microstep's own label,
   * then per delivered send an optional silent edge writing the parameters and the edge
   * synchronizing on {@code <E>_on_send}. Assignments between two sends go on the edge of the
   * earlier send.
   */
  private final class EdgeChain {
    private final ResolvedAutomaton automaton;
    private final Microstep microstep;
    private final int ordinal;
    private final List<String> locations;
    private final Set<String> taken;
    private final List<NetworkEdge> edges;
    private final Scope scope;
    private int step;
    // edge under construction
    private String from;
    private String action;
    private Expression guard;
    private List<Effect> effects;

    private EdgeChain(final ResolvedAutomaton automaton, final Microstep microstep,
        final int ordinal, final List<String> locations, final Set<String> taken,
        final List<NetworkEdge> edges) {
      this.automaton = automaton;
      this.microstep = microstep;
      this.ordinal = ordinal;
      this.locations = locations;
      this.taken = taken;
      this.edges = edges;
      this.scope = microstep.isExternal()
          ? automaton.getScope().withEvent(microstep.getEvent(),
              events.getParameterTypes(microstep.getEvent()))
          : automaton.getScope();
    }

    private void lower() throws CompilerException {
      if (microstep.isExternal()) {
        if (!isReceiver(microstep.getEvent(), automaton.getName())) {
          return;
        }
        action = microstep.getEvent() + receiveSuffix;
      }
      from = automaton.getLocation(microstep.getSource()).getName();
      guard = ExpressionTranslator.qualify(microstep.getGuard(), scope, config.getMaxArraySize());
      effects = new ArrayList<>();
      for (ExecutableContent item : microstep.getActions()) {
        if (item instanceof ExecutableContent.Assign) {
          effects.addAll(assignEffects((ExecutableContent.Assign) item));
          continue;
        }
        final ExecutableContent.Send send = (ExecutableContent.Send) item;
        if (isDelivered(send.getEvent(), automaton.getName())) {
          lowerSend(send);
        }
      }
      close(automaton.getLocation(microstep.getTarget()).getName());
    }

    private void lowerSend(final ExecutableContent.Send send) throws CompilerException {
      final String event = send.getEvent();
      final Expression valid = Expression.variable(event + validSuffix);
      if (!send.getParameters().isEmpty()) {
        if (action != null) {
          close(intermediate());
          action = null;
          guard = Expressions.TRUE;
          effects = new ArrayList<>();
        }
        guard = Expressions.and(guard, Expressions.not(valid));
        for (Map.Entry<String, Expression> parameter : send.getParameters().entrySet()) {
          final String target = event + "." + parameter.getKey();
          final Expression value = ExpressionTranslator.qualify(parameter.getValue(), scope,
              config.getMaxArraySize());
          if (variables.get(target).getType().isArray()) {
            effects.addAll(arrayEffects(target, value));
          } else {
            effects.add(new Effect(target, null, value));
          }
        }
        effects.add(new Effect(event + validSuffix, null, Expressions.TRUE));
        close(intermediate());
        action = event + sendSuffix;
        guard = Expressions.TRUE;
        effects = new ArrayList<>();
        effects.add(new Effect(event + validSuffix, null, Expressions.FALSE));
        return;
      }
      if (action == null && effects.isEmpty()) {
        action = event + sendSuffix;
        return;
      }
      close(intermediate());
      action = event + sendSuffix;
      guard = Expressions.TRUE;
      effects = new ArrayList<>();
    }

    private String intermediate() {
      String name =
          automaton.getLocation(microstep.getSource()).getName() + "__" + ordinal + "_" + step++;
      while (!taken.add(name)) {
        name = name + "_";
      }
      locations.add(name);
      return name;
    }

    private void close(final String to) throws CompilerException {
      edges.add(new NetworkEdge(from, action, Expressions.fold(guard), destinations(to)));
      from = to;
    }

    private List<Effect> assignEffects(final ExecutableContent.Assign assign)
        throws CompilerException {
      final String target = scope.resolve(assign.getTarget()).getQualifiedName();
      final Expression value =
          ExpressionTranslator.qualify(assign.getValue(), scope, config.getMaxArraySize());
      final List<Effect> result = new ArrayList<>();
      if (assign.getIndex() != null) {
        final Expression index =
            ExpressionTranslator.qualify(assign.getIndex(), scope, config.getMaxArraySize());
        final Expression length = Expression.variable(target + Scope.lengthSuffix);
        result.add(new Effect(target, index, value));
        result.add(new Effect(target + Scope.lengthSuffix, null,
            Expressions.fold(Expression.conditional(
                Expression.binary(Operator.GREATER, length, index), length,
                Expression.binary(Operator.ADD, index, Expression.literal(1L))))));
        return result;
      }
      if (variables.get(target).getType().isArray()) {
        return arrayEffects(target, value);
      }
      result.add(new Effect(target, null, value));
      return result;
    }

    private List<Effect> arrayEffects(final String target, final Expression value)
        throws CompilerException {
      final ExpressionType type = variables.get(target).getType();
      final List<Effect> result = new ArrayList<>();
      if (value instanceof Expression.ArrayLiteral) {
        final List<Expression> elements = ((Expression.ArrayLiteral) value).getElements();
        result.add(new Effect(target, null, pad(target, type, elements)));
        result.add(new Effect(target + Scope.lengthSuffix, null,
            Expression.literal((long) elements.size())));
        return result;
      }
      if (!(value instanceof Expression.VariableRef)) {
        throw new CompilerException(Code.UNSUPPORTED_CONSTRUCT,
            "Unsupported expression construct computed array value '" + value + "'");
      }
      final String source = ((Expression.VariableRef) value).getName();
      final int capacity = variables.get(source).getType().getCapacity();
      final Expression sourceLength = Expression.variable(source + Scope.lengthSuffix);
      if (capacity == type.getCapacity()) {
        result.add(new Effect(target, null, value));
        result.add(new Effect(target + Scope.lengthSuffix, null, sourceLength));
        return result;
      }
      final List<Expression> elements = new ArrayList<>();
      for (int i = 0; i < type.getCapacity(); i++) {
        elements.add(i < capacity ? Expression.index(value, Expression.literal((long) i))
            : DataVariable.defaultValue(type.getBase()));
      }
      result.add(new Effect(target, null, Expression.array(elements)));
      final Expression limit = Expression.literal((long) type.getCapacity());
      result.add(new Effect(target + Scope.lengthSuffix, null,
          capacity < type.getCapacity() ? sourceLength
              : Expression.conditional(Expression.binary(Operator.GREATER, sourceLength, limit),
                  limit, sourceLength)));
      return result;
    }

    /**
     * One destination, or one per outcome of the Math.random() draws the effects make. Every
     * call is an independent draw over the configured number of equally likely values.
     */
    private List<NetworkDestination> destinations(final String to) throws CompilerException {
      int draws = 0;
      for (Effect effect : effects) {
        draws += countRandom(effect.value);
      }
      final List<NetworkDestination> result = new ArrayList<>();
      if (draws == 0) {
        result.add(new NetworkDestination(to, null, level(effects)));
        return result;
      }
      if (config.getModelType() == CompilerConfiguration.ModelType.LTS) {
        throw new CompilerException(Code.UNSUPPORTED_CONSTRUCT, "Unsupported expression "
            + "construct Math.random() in a model of type " + config.getModelType());
      }
      final int options = config.getRandomOptions();
      long outcomes = 1L;
      for (int i = 0; i < draws; i++) {
        outcomes = Math.multiplyExact(outcomes, (long) options);
        if (outcomes > maxRandomOutcomes) {
          throw new CompilerException(Code.UNSUPPORTED_CONSTRUCT, "Unsupported expression "
              + "construct " + draws + " Math.random() draws over " + options
              + " values on one edge, more than " + maxRandomOutcomes + " outcomes");
        }
      }
      final Expression probability = Expression.binary(Operator.DIVIDE, Expression.literal(1L),
          Expression.literal(outcomes));
      for (long outcome = 0; outcome < outcomes; outcome++) {
        final long[] digits = new long[draws];
        long rest = outcome;
        for (int i = 0; i < draws; i++) {
          digits[i] = rest % options;
          rest /= options;
        }
        final int[] next = new int[1];
        final List<Effect> drawn = new ArrayList<>();
        for (Effect effect : effects) {
          drawn.add(new Effect(effect.target, effect.index,
              Expressions.rewrite(effect.value, new Expressions.Rewrite() {
                @Override
                public Expression apply(Expression node) {
                  if (node instanceof Expression.Call && ((Expression.Call) node)
                      .getFunction() == Operator.Function.RANDOM) {
                    return Expression.literal((double) digits[next[0]++] / options);
                  }
                  return node;
                }
              })));
        }
        result.add(new NetworkDestination(to, probability, level(drawn)));
      }
      return result;
    }
  }

  private static int countRandom(final Expression expression) throws CompilerException {
    final int[] count = new int[1];
    Expressions.rewrite(expression, new Expressions.Rewrite() {
      @Override
      public Expression apply(Expression node) {
        if (node instanceof Expression.Call
            && ((Expression.Call) node).getFunction() == Operator.Function.RANDOM) {
          count[0]++;
        }
        return node;
      }
    });
    return count[0];
  }

  /**
   * Orders writes into sequencing levels: a write goes after every earlier write of a variable it
   * reads or overwrites, and not before an earlier read of its target, so that each level only
   * sees the values left by the previous ones.
   */
  private static List<NetworkAssignment> level(final List<Effect> effects) throws CompilerException {
    final Map<String, Integer> lastWrite = new HashMap<>();
    final Map<String, Integer> lastRead = new HashMap<>();
    final List<NetworkAssignment> assignments = new ArrayList<>();
    for (Effect effect : effects) {
      final Set<String> reads = new LinkedHashSet<>(Expressions.variablesRead(effect.value));
      if (effect.index != null) {
        reads.addAll(Expressions.variablesRead(effect.index));
      }
      int level = 0;
      for (String read : reads) {
        final Integer written = lastWrite.get(read);
        if (written != null) {
          level = Math.max(level, written + 1);
        }
      }
      final Integer written = lastWrite.get(effect.target);
      if (written != null) {
        level = Math.max(level, written + 1);
      }
      final Integer read = lastRead.get(effect.target);
      if (read != null) {
        level = Math.max(level, read);
      }
      lastWrite.put(effect.target, level);
      for (String name : reads) {
        final Integer previous = lastRead.get(name);
        lastRead.put(name, previous == null ? level : Math.max(previous, level));
      }
      assignments.add(new NetworkAssignment(effect.target, effect.index, effect.value, level));
    }
    return assignments;
  }
}
