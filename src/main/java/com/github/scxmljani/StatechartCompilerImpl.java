package com.github.scxmljani;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.scxmljani.CompilationStatistics.AutomatonStatistics;
import com.github.scxmljani.CompilerException.Code;
import com.github.scxmljani.NetworkDescription.AutomatonInstance;
import com.github.scxmljani.NetworkDescription.BehaviorTreeInput;

/**
 * The compilation pipeline: behavior-tree expansion, statechart parsing, network-wide event
 * classification, per-automaton resolution, composition and emission. Stages run one after the
 * other on immutable inputs and the first error aborts the whole compilation.
 *
 * Notes for users:<br>
 * 1. the compiler holds no per-network state, compiling is thread-safe apart from the statistics
 * which are only ever updated as a whole<br>
 *
 * 2. a description that overrides the array capacity gets its own copy of the configuration, the
 * compiler's configuration never changes<br>
 */
public final class StatechartCompilerImpl implements StatechartCompiler {
  private static final Logger logger =
      LogManager.getLogger(StatechartCompilerImpl.class.getSimpleName());

  private final String compilerId = UUID.randomUUID().toString();
  private final CompilerConfiguration config;
  private final CompilationStatistics compilerStats;

  StatechartCompilerImpl(final CompilerConfiguration config) {
    this.config = config;
    this.compilerStats = new CompilationStatistics(compilerId);
    logInfo(null, null, "Created compiler " + compilerId + " with " + config);
  }

  @Override
  public AutomataNetwork compile(final NetworkDescription description)
      throws CompilerException {
    final long startMillis = System.currentTimeMillis();
    final String network = description.getName();
    synchronized (compilerStats) {
      compilerStats.totalCompilations++;
    }
    try {
      final CompilerConfiguration effective = description.getMaxArraySize() == null ? config
          : config.withMaxArraySize(description.getMaxArraySize());
      final Set<String> closedEvents = new LinkedHashSet<>();
      final List<Statechart> statecharts = parseStatecharts(network, description, closedEvents);

      final Map<String, ExpressionType> globalTypes = new LinkedHashMap<>();
      for (DataVariable global : description.getGlobals()) {
        if (globalTypes.put(global.getId(), global.getType()) != null) {
          throw new CompilerException(Code.COMPOSITION_INCONSISTENCY,
              "Global variable '" + global.getId() + "' declared twice");
        }
      }
      final EventRegistry events = EventRegistry.build(statecharts, globalTypes, closedEvents);
      logDebug(network, null, events.toString());

      final List<ResolvedAutomaton> resolved = new ArrayList<>();
      for (Statechart statechart : statecharts) {
        final ResolvedAutomaton automaton =
            StatechartResolver.resolve(statechart, globalTypes, events, effective);
        logDebug(network, statechart.getName(), "Resolved " + automaton.getLocations().size()
            + " locations and " + automaton.getMicrosteps().size() + " microsteps");
        resolved.add(automaton);
      }

      final AutomataNetwork composed = NetworkComposer.compose(network, resolved,
          description.getGlobals(), events, description.getProperties(), effective);
      final long elapsedMillis = System.currentTimeMillis() - startMillis;
      compilerStats.replaceAutomatonStats(network, statistics(resolved, composed),
          elapsedMillis);
      logInfo(network, null, "Compiled " + composed.getAutomata().size() + " automata in "
          + elapsedMillis + " millis");
      for (AutomatonStatistics stats : compilerStats.getLatestAutomatonStats()) {
        logDebug(network, stats.getAutomaton(), stats.toString());
      }
      return composed;
    } catch (CompilerException problem) {
      synchronized (compilerStats) {
        compilerStats.totalFailures++;
      }
      logError(network, null, "Compilation failed", problem);
      throw problem;
    }
  }

  @Override
  public ObjectNode compileToJani(final NetworkDescription description)
      throws CompilerException {
    final AutomataNetwork network = compile(description);
    final ObjectNode model = JaniModelEmitter.emit(network);
    try {
      JaniSchemaValidator.validate(model);
    } catch (CompilerException problem) {
      logError(network.getName(), null, "Emitted model failed validation", problem);
      throw problem;
    }
    logDebug(network.getName(), null, "Emitted model is valid");
    return model;
  }

  @Override
  public void compile(final NetworkDescription description, final Path output)
      throws CompilerException {
    final ObjectNode model = compileToJani(description);
    JaniModelEmitter.write(model, output);
    logInfo(description.getName(), null, "Wrote JANI model to " + output);
  }

  private List<Statechart> parseStatecharts(final String network,
      final NetworkDescription description, final Set<String> closedEvents)
      throws CompilerException {
    final List<AutomatonInstance> instances = new ArrayList<>(description.getAutomata());
    final BehaviorTreeInput behaviorTree = description.getBehaviorTree();
    if (behaviorTree != null) {
      final BehaviorTreeTemplates templates = BehaviorTreeTemplates.withBuiltins();
      for (StatechartDocument plugin : behaviorTree.getPlugins()) {
        templates.addPlugin(plugin);
      }
      final BehaviorTreeNode root =
          BehaviorTreeParser.parse(behaviorTree.getId(), behaviorTree.getDocument());
      final List<StatechartDocument> expanded = BehaviorTreeExpander.expand(root, templates);
      closedEvents.addAll(BehaviorTreeExpander.closedEvents(root));
      logInfo(network, null, "Expanded behavior tree " + behaviorTree.getId() + " into "
          + expanded.size() + " automata");
      for (StatechartDocument document : expanded) {
        instances.add(new AutomatonInstance(document, document.getId(),
            new HashMap<String, String>()));
      }
    }
    final List<Statechart> statecharts = new ArrayList<>();
    final Map<String, String> documentsByName = new HashMap<>();
    for (AutomatonInstance instance : instances) {
      final Statechart statechart = StatechartParser.parse(instance.getDocument(),
          instance.getId(), instance.getParameters());
      final String previous =
          documentsByName.put(statechart.getName(), instance.getDocument().getId());
      if (previous != null) {
        throw new CompilerException(Code.COMPOSITION_INCONSISTENCY,
            instance.getDocument().getId(), null, "Automaton name '" + statechart.getName()
                + "' is already used by an instance of " + previous);
      }
      statecharts.add(statechart);
    }
    logInfo(network, null, "Parsed " + statecharts.size() + " statecharts");
    return statecharts;
  }

  private static List<AutomatonStatistics> statistics(final List<ResolvedAutomaton> resolved,
      final AutomataNetwork network) {
    final List<AutomatonStatistics> stats = new ArrayList<>();
    for (ResolvedAutomaton automaton : resolved) {
      final AutomatonStatistics automatonStats = new AutomatonStatistics();
      automatonStats.automaton = automaton.getName();
      automatonStats.resolvedLocations = automaton.getLocations().size();
      automatonStats.microsteps = automaton.getMicrosteps().size();
      final NetworkAutomaton composed = network.findAutomaton(automaton.getName());
      if (composed != null) {
        automatonStats.locations = composed.getLocations().size();
        automatonStats.edges = composed.getEdges().size();
      }
      stats.add(automatonStats);
    }
    return stats;
  }

  @Override
  public String getId() {
    return compilerId;
  }

  @Override
  public CompilerConfiguration getConfiguration() {
    return config;
  }

  @Override
  public CompilationStatistics getStatistics() {
    return compilerStats;
  }

  private static String prefix(final String network, final String automaton) {
    return new StringBuilder().append("[n:").append(network).append("][a:").append(automaton)
        .append("] ").toString();
  }

  private static void logError(final String network, final String automaton,
      final String message, final Throwable error) {
    logger.error(prefix(network, automaton) + message, error);
  }

  private static void logInfo(final String network, final String automaton,
      final String message) {
    logger.info(prefix(network, automaton) + message);
  }

  private static void logDebug(final String network, final String automaton,
      final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(prefix(network, automaton) + message);
    }
  }

}
