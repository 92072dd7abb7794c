package com.github.scxmljani;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import java.util.TreeSet;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.scxmljani.CompilerException.Code;

/**
 * Serializes an {@link AutomataNetwork} into a JANI model, version 1. All variables are global,
 * every automaton of the network is one element of the system.
 */
public final class JaniModelEmitter {
  private static final Logger logger =
      LogManager.getLogger(JaniModelEmitter.class.getSimpleName());

  static final int janiVersion = 1;

  private static final JsonNodeFactory nodes = JsonNodeFactory.instance;
  private static final ObjectMapper objectMapper = new ObjectMapper();

  private JaniModelEmitter() {}

  public static ObjectNode emit(final AutomataNetwork network) throws CompilerException {
    final Set<String> features = new TreeSet<>();
    features.add("derived-operators");
    final ObjectNode model = nodes.objectNode();
    model.put("jani-version", janiVersion);
    model.put("name", network.getName());
    model.put("type", network.getModelType().getJaniName());
    final ArrayNode featureList = model.putArray("features");

    final ArrayNode variables = model.putArray("variables");
    for (NetworkVariable variable : network.getVariables()) {
      final ObjectNode declaration = variables.addObject();
      declaration.put("name", variable.getName());
      declaration.set("type", type(variable.getType()));
      declaration.set("initial-value", lower(variable.getInitialValue(), features));
      if (variable.getType().isArray()) {
        features.add("arrays");
      }
    }

    final ArrayNode actions = model.putArray("actions");
    for (String action : network.getActions()) {
      actions.addObject().put("name", action);
    }

    final ArrayNode automata = model.putArray("automata");
    for (NetworkAutomaton automaton : network.getAutomata()) {
      automata.add(automaton(automaton, features));
    }

    final ObjectNode system = model.putObject("system");
    final ArrayNode elements = system.putArray("elements");
    for (NetworkAutomaton automaton : network.getAutomata()) {
      elements.addObject().put("automaton", automaton.getName());
    }
    final ArrayNode syncs = system.putArray("syncs");
    for (SyncVector vector : network.getSyncVectors()) {
      final ObjectNode sync = syncs.addObject();
      final ArrayNode synchronise = sync.putArray("synchronise");
      for (String participant : vector.getParticipants()) {
        if (participant == null) {
          synchronise.addNull();
        } else {
          synchronise.add(participant);
        }
      }
      sync.put("result", vector.getResult());
    }

    final ArrayNode properties = model.putArray("properties");
    for (AutomataNetwork.Property property : network.getProperties()) {
      properties.add(property(property, features));
    }
    for (String feature : features) {
      featureList.add(feature);
    }
    if (logger.isDebugEnabled()) {
      logger.debug("[n:" + network.getName() + "] Emitted JANI model with features " + features);
    }
    return model;
  }

  /**
   * Pretty printed JANI document.
   */
  public static String render(final JsonNode model) throws CompilerException {
    try {
      return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(model);
    } catch (IOException problem) {
      throw new CompilerException(Code.INTERNAL_CONSISTENCY, problem);
    }
  }

  public static void write(final JsonNode model, final Path output) throws CompilerException {
    try (Writer writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(writer, model);
    } catch (IOException problem) {
      throw new CompilerException(Code.IO_FAILURE, null, output.toString(),
          "Failed to write JANI model", problem);
    }
  }

  private static ObjectNode automaton(final NetworkAutomaton automaton, final Set<String> features)
      throws CompilerException {
    final ObjectNode node = nodes.objectNode();
    node.put("name", automaton.getName());
    final ArrayNode locations = node.putArray("locations");
    for (String location : automaton.getLocations()) {
      locations.addObject().put("name", location);
    }
    node.putArray("initial-locations").add(automaton.getInitialLocation());
    final ArrayNode edges = node.putArray("edges");
    for (NetworkEdge edge : automaton.getEdges()) {
      final ObjectNode edgeNode = edges.addObject();
      edgeNode.put("location", edge.getLocation());
      if (!edge.isSilent()) {
        edgeNode.put("action", edge.getAction());
      }
      if (!Expressions.isTrue(edge.getGuard())) {
        edgeNode.putObject("guard").set("exp", lower(edge.getGuard(), features));
      }
      final ArrayNode destinations = edgeNode.putArray("destinations");
      for (NetworkDestination destination : edge.getDestinations()) {
        final ObjectNode destinationNode = destinations.addObject();
        destinationNode.put("location", destination.getLocation());
        if (destination.getProbability() != null) {
          destinationNode.putObject("probability").set("exp",
              lower(destination.getProbability(), features));
        }
        final ArrayNode assignments = destinationNode.putArray("assignments");
        for (NetworkAssignment assignment : destination.getAssignments()) {
          final ObjectNode assignmentNode = assignments.addObject();
          if (assignment.getIndex() == null) {
            assignmentNode.put("ref", assignment.getTarget());
          } else {
            final ObjectNode ref = assignmentNode.putObject("ref");
            ref.put("op", "aa");
            ref.put("exp", assignment.getTarget());
            ref.set("index", lower(assignment.getIndex(), features));
          }
          assignmentNode.set("value", lower(assignment.getValue(), features));
          if (assignment.getLevel() > 0) {
            assignmentNode.put("index", assignment.getLevel());
          }
        }
      }
    }
    return node;
  }

  // filter(max, P(true U goal), initial)
  private static ObjectNode property(final AutomataNetwork.Property property,
      final Set<String> features) throws CompilerException {
    final ObjectNode node = nodes.objectNode();
    node.put("name", property.getName());
    final ObjectNode filter = node.putObject("expression");
    filter.put("op", "filter");
    filter.put("fun", "max");
    final ObjectNode probability = filter.putObject("values");
    probability.put("op", property.getKind().getJaniName());
    final ObjectNode until = probability.putObject("exp");
    until.put("op", "U");
    until.put("left", true);
    until.set("right", lower(property.getGoal(), features));
    filter.putObject("states").put("op", "initial");
    return node;
  }

  private static JsonNode lower(final Expression expression, final Set<String> features)
      throws CompilerException {
    if (Expressions.containsTrigonometry(expression)) {
      features.add("trigonometric-functions");
    }
    return ExpressionTranslator.toJani(expression);
  }

  static JsonNode type(final ExpressionType type) {
    switch (type.getKind()) {
      case BOOL:
        return nodes.textNode("bool");
      case REAL:
        return nodes.textNode("real");
      case ARRAY: {
        final ObjectNode node = nodes.objectNode();
        node.put("kind", "array");
        node.set("base", type(type.getBase()));
        return node;
      }
      default: {
        if (!type.isBounded()) {
          return nodes.textNode("int");
        }
        final ObjectNode node = nodes.objectNode();
        node.put("kind", "bounded");
        node.put("base", "int");
        if (type.getLowerBound() != null) {
          node.put("lower-bound", type.getLowerBound());
        }
        if (type.getUpperBound() != null) {
          node.put("upper-bound", type.getUpperBound());
        }
        return node;
      }
    }
  }
}
