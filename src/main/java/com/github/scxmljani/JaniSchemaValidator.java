package com.github.scxmljani;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.scxmljani.CompilerException.Code;

/**
 * Structural check of an emitted JANI document: required members, unique and declared
 * identifiers, known operators with their operands, location and action references, and the
 * arity of synchronization vectors. Any violation means the compiler produced a broken model and
 * is reported as INTERNAL_CONSISTENCY.
 */
public final class JaniSchemaValidator {
  private static final Set<String> modelTypes =
      new HashSet<>(Arrays.asList("lts", "dtmc", "ctmc", "mdp", "ctmdp", "ma", "ta", "pta", "sta",
          "ha", "pha", "sha"));
  private static final Set<String> unaryOperators = new HashSet<>(Arrays.asList("¬", "abs",
      "floor", "ceil", "sgn", "trc", "sin", "cos", "tan", "initial"));
  private static final Set<String> binaryOperators = new HashSet<>(Arrays.asList("∧", "∨", "⇒",
      "=", "≠", "<", "≤", ">", "≥", "+", "-", "*", "/", "%", "pow", "log", "min", "max", "U"));

  private final JsonNode model;
  private final Set<String> variables = new HashSet<>();
  private final Set<String> actions = new HashSet<>();
  private final Set<String> automata = new HashSet<>();

  private JaniSchemaValidator(final JsonNode model) {
    this.model = model;
  }

  public static void validate(final JsonNode model) throws CompilerException {
    new JaniSchemaValidator(model).check();
  }

  private void check() throws CompilerException {
    require(model.isObject(), "model", "document is not an object");
    require(model.path("jani-version").isInt(), "model", "missing integer jani-version");
    require(model.path("name").isTextual(), "model", "missing name");
    require(modelTypes.contains(model.path("type").asText()), "model",
        "unknown model type '" + model.path("type").asText() + "'");
    for (JsonNode variable : array(model, "variables", "model")) {
      final String name = text(variable, "name", "variable");
      require(variables.add(name), "variable " + name, "declared twice");
      require(variable.has("type"), "variable " + name, "missing type");
      checkType(variable.get("type"), "variable " + name);
    }
    for (JsonNode variable : model.path("variables")) {
      if (variable.has("initial-value")) {
        checkExpression(variable.get("initial-value"), "variable " + variable.get("name"));
      }
    }
    for (JsonNode action : array(model, "actions", "model")) {
      final String name = text(action, "name", "action");
      require(actions.add(name), "action " + name, "declared twice");
    }
    for (JsonNode automaton : array(model, "automata", "model")) {
      checkAutomaton(automaton);
    }
    checkSystem();
    for (JsonNode property : model.path("properties")) {
      final String name = text(property, "name", "property");
      require(property.has("expression"), "property " + name, "missing expression");
      checkExpression(property.get("expression"), "property " + name);
    }
  }

  private void checkAutomaton(final JsonNode automaton) throws CompilerException {
    final String name = text(automaton, "name", "automaton");
    final String where = "automaton " + name;
    require(automata.add(name), where, "declared twice");
    final Set<String> locations = new HashSet<>();
    for (JsonNode location : array(automaton, "locations", where)) {
      final String locationName = text(location, "name", where);
      require(locations.add(locationName), where, "location '" + locationName
          + "' declared twice");
    }
    final JsonNode initial = array(automaton, "initial-locations", where);
    require(initial.size() > 0, where, "no initial location");
    for (JsonNode location : initial) {
      require(locations.contains(location.asText()), where,
          "undeclared initial location '" + location.asText() + "'");
    }
    int index = 0;
    for (JsonNode edge : array(automaton, "edges", where)) {
      final String edgeWhere = where + " edge " + index++;
      require(locations.contains(edge.path("location").asText()), edgeWhere,
          "undeclared source location '" + edge.path("location").asText() + "'");
      if (edge.has("action")) {
        require(actions.contains(edge.get("action").asText()), edgeWhere,
            "undeclared action '" + edge.get("action").asText() + "'");
      }
      if (edge.has("guard")) {
        require(edge.get("guard").has("exp"), edgeWhere, "guard without exp");
        checkExpression(edge.get("guard").get("exp"), edgeWhere);
      }
      final JsonNode destinations = array(edge, "destinations", edgeWhere);
      require(destinations.size() > 0, edgeWhere, "no destination");
      for (JsonNode destination : destinations) {
        require(locations.contains(destination.path("location").asText()), edgeWhere,
            "undeclared target location '" + destination.path("location").asText() + "'");
        if (destination.has("probability")) {
          checkExpression(destination.get("probability").path("exp"), edgeWhere);
        }
        for (JsonNode assignment : destination.path("assignments")) {
          checkReference(assignment.path("ref"), edgeWhere);
          require(assignment.has("value"), edgeWhere, "assignment without value");
          checkExpression(assignment.get("value"), edgeWhere);
          if (assignment.has("index")) {
            require(assignment.get("index").isInt(), edgeWhere, "non-integer assignment index");
          }
        }
      }
    }
  }

  private void checkSystem() throws CompilerException {
    final JsonNode system = model.path("system");
    require(system.isObject(), "system", "missing system");
    final JsonNode elements = array(system, "elements", "system");
    for (JsonNode element : elements) {
      require(automata.contains(element.path("automaton").asText()), "system",
          "undeclared automaton '" + element.path("automaton").asText() + "'");
    }
    int index = 0;
    for (JsonNode sync : system.path("syncs")) {
      final String where = "sync " + index++;
      final JsonNode synchronise = array(sync, "synchronise", where);
      require(synchronise.size() == elements.size(), where, "has " + synchronise.size()
          + " entries for " + elements.size() + " elements");
      boolean participant = false;
      for (JsonNode entry : synchronise) {
        if (!entry.isNull()) {
          require(actions.contains(entry.asText()), where,
              "undeclared action '" + entry.asText() + "'");
          participant = true;
        }
      }
      require(participant, where, "no participant");
      if (sync.has("result")) {
        require(actions.contains(sync.get("result").asText()), where,
            "undeclared result action '" + sync.get("result").asText() + "'");
      }
    }
  }

  private void checkType(final JsonNode type, final String where) throws CompilerException {
    if (type.isTextual()) {
      require(Arrays.asList("bool", "int", "real").contains(type.asText()), where,
          "unknown type '" + type.asText() + "'");
      return;
    }
    final String kind = type.path("kind").asText();
    if ("bounded".equals(kind)) {
      require("int".equals(type.path("base").asText()) || "real".equals(type.path("base")
          .asText()), where, "bounded type with base '" + type.path("base").asText() + "'");
      require(type.has("lower-bound") || type.has("upper-bound"), where,
          "bounded type without bounds");
      return;
    }
    require("array".equals(kind), where, "unknown type kind '" + kind + "'");
    require(type.has("base"), where, "array type without base");
    checkType(type.get("base"), where);
  }

  private void checkReference(final JsonNode ref, final String where) throws CompilerException {
    if (ref.isTextual()) {
      require(variables.contains(ref.asText()), where,
          "assignment to undeclared variable '" + ref.asText() + "'");
      return;
    }
    require("aa".equals(ref.path("op").asText()), where, "malformed assignment reference");
    checkReference(ref.path("exp"), where);
    checkExpression(ref.path("index"), where);
  }

  private void checkExpression(final JsonNode expression, final String where)
      throws CompilerException {
    if (expression.isBoolean() || expression.isNumber()) {
      return;
    }
    if (expression.isTextual()) {
      require(variables.contains(expression.asText()), where,
          "reference to undeclared identifier '" + expression.asText() + "'");
      return;
    }
    require(expression.isObject() && expression.has("op"), where,
        "malformed expression " + expression);
    final String op = expression.get("op").asText();
    if (unaryOperators.contains(op)) {
      if (!"initial".equals(op)) {
        operand(expression, "exp", where);
      }
      return;
    }
    if (binaryOperators.contains(op)) {
      operand(expression, "left", where);
      operand(expression, "right", where);
      return;
    }
    switch (op) {
      case "ite":
        operand(expression, "if", where);
        operand(expression, "then", where);
        operand(expression, "else", where);
        return;
      case "aa":
        operand(expression, "exp", where);
        operand(expression, "index", where);
        return;
      case "av":
        require(expression.path("elements").isArray(), where, "av without elements");
        for (JsonNode element : expression.get("elements")) {
          checkExpression(element, where);
        }
        return;
      case "Pmax":
      case "Pmin":
        operand(expression, "exp", where);
        return;
      case "filter":
        require(expression.path("fun").isTextual(), where, "filter without fun");
        operand(expression, "values", where);
        operand(expression, "states", where);
        return;
      default:
        throw new CompilerException(Code.INTERNAL_CONSISTENCY,
            "Invalid JANI model at " + where + ": unknown operator '" + op + "'");
    }
  }

  private void operand(final JsonNode expression, final String member, final String where)
      throws CompilerException {
    require(expression.has(member), where,
        "operator '" + expression.get("op").asText() + "' without " + member);
    checkExpression(expression.get(member), where);
  }

  private static JsonNode array(final JsonNode parent, final String member, final String where)
      throws CompilerException {
    final JsonNode node = parent.path(member);
    require(node.isArray(), where, "missing array '" + member + "'");
    return node;
  }

  private static String text(final JsonNode parent, final String member, final String where)
      throws CompilerException {
    final JsonNode node = parent.path(member);
    require(node.isTextual(), where, "missing " + member);
    return node.asText();
  }

  private static void require(final boolean condition, final String where, final String message)
      throws CompilerException {
    if (!condition) {
      throw new CompilerException(Code.INTERNAL_CONSISTENCY,
          "Invalid JANI model at " + where + ": " + message);
    }
  }
}
