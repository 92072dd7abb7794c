package com.github.scxmljani;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.w3c.dom.Element;

import com.github.scxmljani.CompilerException.Code;

/**
 * Builds a {@link Statechart} out of one SCXML document and validates its structure. Expressions
 * are parsed here, never evaluated or type checked.
 *
 * Notes:<br>
 * 1. states without an id get a generated one, {@code _state<n>}<br>
 * 2. a compound state without initial attribute or element starts in its first child<br>
 * 3. {@code <log>} is accepted and dropped<br>
 */
public final class StatechartParser {
  private static final Logger logger = LogManager.getLogger(StatechartParser.class.getSimpleName());

  private static final Set<String> unsupportedElements = new HashSet<>(Arrays.asList("history",
      "script", "foreach", "cancel", "invoke", "donedata", "content", "finalize"));
  private static final Set<String> stateElements =
      new HashSet<>(Arrays.asList("state", "parallel", "final"));

  private final StatechartDocument document;
  private final String name;
  private final Map<String, String> parameters;
  private final Map<String, StateNode> states = new LinkedHashMap<>();
  private final List<TransitionNode> transitions = new ArrayList<>();
  private final Map<String, DataVariable> dataVariables = new LinkedHashMap<>();
  // states whose targets are linked once every state is known
  private final List<TransitionNode> initialTransitions = new ArrayList<>();
  private int stateCounter;
  private int transitionCounter;

  private StatechartParser(final StatechartDocument document, final String name,
      final Map<String, String> parameters) {
    this.document = document;
    this.name = name;
    this.parameters = parameters;
  }

  public static Statechart parse(final StatechartDocument document) throws CompilerException {
    return parse(document, null, Collections.<String, String>emptyMap());
  }

  /**
   * Parses the document as the automaton instance {@code instanceName} (the document's own name
   * when null), overriding the initial values of the named data variables.
   */
  public static Statechart parse(final StatechartDocument document, final String instanceName,
      final Map<String, String> parameters) throws CompilerException {
    final StatechartParser parser = new StatechartParser(document, instanceName, parameters);
    final Statechart statechart = parser.parseDocument();
    if (logger.isDebugEnabled()) {
      logger.debug("Parsed " + statechart);
    }
    return statechart;
  }

  private Statechart parseDocument() throws CompilerException {
    final Element scxml = document.getDocument().getDocumentElement();
    if (scxml == null || !"scxml".equals(XmlDocuments.localName(scxml))) {
      throw error(Code.STRUCTURAL_VALIDITY, scxml,
          "Root element must be <scxml>, found " + (scxml == null ? "nothing"
              : "<" + XmlDocuments.localName(scxml) + ">"));
    }
    final String datamodel = XmlDocuments.attribute(scxml, "datamodel");
    if (datamodel != null && !"ecmascript".equals(datamodel)) {
      throw error(Code.UNSUPPORTED_CONSTRUCT, scxml, "Unsupported datamodel '" + datamodel + "'");
    }
    final StateNode root = new StateNode(Statechart.rootId, StateKind.COMPOUND, null, 0);
    for (Element child : XmlDocuments.childElements(scxml)) {
      final String tag = XmlDocuments.localName(child);
      if ("datamodel".equals(tag)) {
        parseDatamodel(child);
      } else if (stateElements.contains(tag)) {
        parseState(child, root);
      } else {
        rejectElement(child);
      }
    }
    if (root.getChildren().isEmpty()) {
      throw error(Code.STRUCTURAL_VALIDITY, scxml, "Statechart declares no state");
    }
    setInitial(root, scxml);
    for (TransitionNode transition : transitions) {
      linkTargets(transition);
    }
    for (TransitionNode initial : initialTransitions) {
      linkTargets(initial);
      for (StateNode target : initial.getTargets()) {
        if (!target.isDescendantOf(initial.getSource())) {
          throw new CompilerException(Code.STRUCTURAL_VALIDITY, document.getId(),
              initial.getElementPath(), "Initial state '" + target.getId()
                  + "' is not a descendant of '" + initial.getSource().getId() + "'");
        }
      }
    }
    applyParameters(scxml);
    String automatonName = name;
    if (automatonName == null) {
      automatonName = XmlDocuments.attribute(scxml, "name");
    }
    if (automatonName == null) {
      automatonName = stripExtension(document.getId());
    }
    return new Statechart(automatonName, document.getId(), root, states, transitions,
        dataVariables);
  }

  private void parseDatamodel(final Element datamodel) throws CompilerException {
    for (Element data : XmlDocuments.childElements(datamodel)) {
      if (!"data".equals(XmlDocuments.localName(data))) {
        throw error(Code.STRUCTURAL_VALIDITY, data,
            "Unexpected <" + XmlDocuments.localName(data) + "> in <datamodel>");
      }
      final DataVariable variable = parseData(document.getId(), data);
      if (dataVariables.containsKey(variable.getId())) {
        throw error(Code.STRUCTURAL_VALIDITY, data,
            "Duplicate data variable '" + variable.getId() + "'");
      }
      dataVariables.put(variable.getId(), variable);
    }
  }

  /**
   * Reads one {@code <data id expr type lower_bound upper_bound>} declaration. Also used for the
   * global variables of a network description.
   */
  static DataVariable parseData(final String documentId, final Element data)
      throws CompilerException {
    final String path = XmlDocuments.path(data);
    final String id = XmlDocuments.attribute(data, "id");
    if (id == null) {
      throw new CompilerException(Code.STRUCTURAL_VALIDITY, documentId, path,
          "<data> without id");
    }
    if (XmlDocuments.attribute(data, "src") != null) {
      throw new CompilerException(Code.UNSUPPORTED_CONSTRUCT, documentId, path,
          "External data source of '" + id + "'");
    }
    try {
      final String text = XmlDocuments.attribute(data, "expr");
      final Expression initialValue = text == null ? null : ExpressionParser.parse(text);
      final String typeName = XmlDocuments.attribute(data, "type");
      ExpressionType type;
      if (typeName != null) {
        type = ExpressionType.parse(typeName);
      } else if (initialValue != null) {
        type = inferType(initialValue);
      } else {
        throw new CompilerException(Code.STRUCTURAL_VALIDITY,
            "Data variable '" + id + "' has neither type nor initial value");
      }
      final Long lower = parseBound(data, "lower_bound");
      final Long upper = parseBound(data, "upper_bound");
      if (lower != null || upper != null) {
        if (type.getKind() != ExpressionType.Kind.INT) {
          throw new CompilerException(Code.UNSUPPORTED_CONSTRUCT,
              "Bounds on non-integer data variable '" + id + "'");
        }
        if (lower != null && upper != null && lower > upper) {
          throw new CompilerException(Code.STRUCTURAL_VALIDITY,
              "Empty range [" + lower + ", " + upper + "] of '" + id + "'");
        }
        type = ExpressionType.boundedInt(lower != null ? lower : type.getLowerBound(), upper);
      }
      return new DataVariable(id, type, initialValue);
    } catch (CompilerException problem) {
      throw problem.locate(documentId, path);
    }
  }

  private static Long parseBound(final Element data, final String attribute)
      throws CompilerException {
    final String text = XmlDocuments.attribute(data, attribute);
    if (text == null) {
      return null;
    }
    try {
      return Long.valueOf(text);
    } catch (NumberFormatException malformed) {
      throw new CompilerException(Code.STRUCTURAL_VALIDITY,
          "Malformed " + attribute + " '" + text + "'");
    }
  }

  private static ExpressionType inferType(final Expression value) throws CompilerException {
    if (value instanceof Expression.ArrayLiteral) {
      final List<Expression> elements = ((Expression.ArrayLiteral) value).getElements();
      if (elements.isEmpty()) {
        throw new CompilerException(Code.STRUCTURAL_VALIDITY,
            "Cannot infer the element type of an empty array, declare a type");
      }
      return ExpressionType.arrayOf(inferType(elements.get(0)), 0);
    }
    if (value instanceof Expression.Literal) {
      final Expression.Literal literal = (Expression.Literal) value;
      if (literal.isBoolean()) {
        return ExpressionType.BOOL;
      }
      if (literal.isInteger()) {
        return ExpressionType.INT;
      }
      if (literal.isReal()) {
        return ExpressionType.REAL;
      }
    }
    throw new CompilerException(Code.STRUCTURAL_VALIDITY,
        "Cannot infer a type from '" + value + "', declare a type");
  }

  private StateNode parseState(final Element element, final StateNode parent)
      throws CompilerException {
    final String tag = XmlDocuments.localName(element);
    final int index = ++stateCounter;
    String id = XmlDocuments.attribute(element, "id");
    if (id == null) {
      id = "_state" + index;
    }
    if (states.containsKey(id)) {
      throw error(Code.STRUCTURAL_VALIDITY, element, "Duplicate state id '" + id + "'");
    }
    boolean hasChildStates = false;
    for (Element child : XmlDocuments.childElements(element)) {
      hasChildStates |= stateElements.contains(XmlDocuments.localName(child));
    }
    final StateKind kind;
    if ("parallel".equals(tag)) {
      kind = StateKind.PARALLEL;
    } else if ("final".equals(tag)) {
      kind = StateKind.FINAL;
    } else {
      kind = hasChildStates ? StateKind.COMPOUND : StateKind.ATOMIC;
    }
    if (kind == StateKind.FINAL && hasChildStates) {
      throw error(Code.STRUCTURAL_VALIDITY, element, "Final state '" + id + "' has children");
    }
    if (kind == StateKind.PARALLEL && !hasChildStates) {
      throw error(Code.STRUCTURAL_VALIDITY, element, "Parallel state '" + id + "' has no region");
    }
    if (kind == StateKind.PARALLEL && XmlDocuments.attribute(element, "initial") != null) {
      throw error(Code.STRUCTURAL_VALIDITY, element,
          "Parallel state '" + id + "' cannot declare an initial state");
    }
    if (kind == StateKind.ATOMIC && XmlDocuments.attribute(element, "initial") != null) {
      throw error(Code.STRUCTURAL_VALIDITY, element,
          "Atomic state '" + id + "' cannot declare an initial state");
    }
    final StateNode state = new StateNode(id, kind, parent, index);
    states.put(id, state);
    for (Element child : XmlDocuments.childElements(element)) {
      final String childTag = XmlDocuments.localName(child);
      switch (childTag) {
        case "state":
        case "parallel":
        case "final":
          parseState(child, state);
          break;
        case "transition":
          if (kind == StateKind.FINAL) {
            throw error(Code.STRUCTURAL_VALIDITY, child,
                "Final state '" + id + "' cannot have transitions");
          }
          final TransitionNode transition = parseTransition(child, state);
          state.addTransition(transition);
          transitions.add(transition);
          break;
        case "onentry":
          state.addOnEntry(parseContent(child));
          break;
        case "onexit":
          state.addOnExit(parseContent(child));
          break;
        case "datamodel":
          parseDatamodel(child);
          break;
        case "initial":
          break;
        default:
          rejectElement(child);
      }
    }
    if (kind == StateKind.COMPOUND) {
      setInitial(state, element);
    } else if (!XmlDocuments.childElements(element, "initial").isEmpty()) {
      throw error(Code.STRUCTURAL_VALIDITY, element,
          "Only compound states may contain <initial>, '" + id + "' is " + kind);
    }
    return state;
  }

  private void setInitial(final StateNode state, final Element element) throws CompilerException {
    final String attribute = XmlDocuments.attribute(element, "initial");
    final List<Element> initialElements = XmlDocuments.childElements(element, "initial");
    if (attribute != null && !initialElements.isEmpty()) {
      throw error(Code.STRUCTURAL_VALIDITY, element,
          "Both an initial attribute and an <initial> element on '" + state.getId() + "'");
    }
    if (initialElements.size() > 1) {
      throw error(Code.STRUCTURAL_VALIDITY, element,
          "More than one <initial> element in '" + state.getId() + "'");
    }
    final TransitionNode initial;
    if (attribute != null) {
      initial = new TransitionNode(state, Collections.<String>emptyList(), null,
          splitTokens(attribute), false, Collections.<ExecutableContent>emptyList(), -1,
          XmlDocuments.path(element));
    } else if (!initialElements.isEmpty()) {
      final Element initialElement = initialElements.get(0);
      final List<Element> initialTransitionElements =
          XmlDocuments.childElements(initialElement, "transition");
      if (initialTransitionElements.size() != 1
          || XmlDocuments.childElements(initialElement).size() != 1) {
        throw error(Code.STRUCTURAL_VALIDITY, initialElement,
            "<initial> must contain exactly one <transition>");
      }
      final Element transitionElement = initialTransitionElements.get(0);
      if (XmlDocuments.attribute(transitionElement, "event") != null
          || XmlDocuments.attribute(transitionElement, "cond") != null
          || XmlDocuments.attribute(transitionElement, "target") == null) {
        throw error(Code.STRUCTURAL_VALIDITY, transitionElement,
            "The <initial> transition needs a target and no event or condition");
      }
      initial = new TransitionNode(state, Collections.<String>emptyList(), null,
          splitTokens(XmlDocuments.attribute(transitionElement, "target")), false,
          parseContent(transitionElement), -1, XmlDocuments.path(transitionElement));
    } else {
      initial = new TransitionNode(state, Collections.<String>emptyList(), null,
          Collections.singletonList(state.getChildren().get(0).getId()), false,
          Collections.<ExecutableContent>emptyList(), -1, XmlDocuments.path(element));
    }
    state.setInitialTransition(initial);
    initialTransitions.add(initial);
  }

  private TransitionNode parseTransition(final Element element, final StateNode source)
      throws CompilerException {
    final String path = XmlDocuments.path(element);
    if (XmlDocuments.attribute(element, "eventexpr") != null
        || XmlDocuments.attribute(element, "targetexpr") != null) {
      throw error(Code.UNSUPPORTED_CONSTRUCT, element, "Computed transition event or target");
    }
    final String type = XmlDocuments.attribute(element, "type");
    if (type != null && !"internal".equals(type) && !"external".equals(type)) {
      throw error(Code.STRUCTURAL_VALIDITY, element, "Unknown transition type '" + type + "'");
    }
    final String event = XmlDocuments.attribute(element, "event");
    final String condition = XmlDocuments.attribute(element, "cond");
    final String target = XmlDocuments.attribute(element, "target");
    Expression guard = null;
    if (condition != null) {
      try {
        guard = ExpressionParser.parse(condition);
      } catch (CompilerException problem) {
        throw problem.locate(document.getId(), path);
      }
    }
    return new TransitionNode(source,
        event == null ? Collections.<String>emptyList() : splitTokens(event), guard,
        target == null ? Collections.<String>emptyList() : splitTokens(target),
        "internal".equals(type), parseContent(element), transitionCounter++, path);
  }

  private void linkTargets(final TransitionNode transition) throws CompilerException {
    for (String targetId : transition.getTargetIds()) {
      final StateNode target = states.get(targetId);
      if (target == null) {
        throw new CompilerException(Code.STRUCTURAL_VALIDITY, document.getId(),
            transition.getElementPath(), "Transition target '" + targetId + "' does not exist");
      }
      transition.linkTarget(target);
    }
  }

  private List<ExecutableContent> parseContent(final Element block) throws CompilerException {
    final List<ExecutableContent> content = new ArrayList<>();
    for (Element element : XmlDocuments.childElements(block)) {
      final ExecutableContent parsed = parseExecutable(element);
      if (parsed != null) {
        content.add(parsed);
      }
    }
    return content;
  }

  private ExecutableContent parseExecutable(final Element element) throws CompilerException {
    final String path = XmlDocuments.path(element);
    try {
      switch (XmlDocuments.localName(element)) {
        case "assign":
          return parseAssign(element, path);
        case "raise": {
          final String event = XmlDocuments.attribute(element, "event");
          if (event == null) {
            throw new CompilerException(Code.STRUCTURAL_VALIDITY, "<raise> without event");
          }
          return new ExecutableContent.Raise(event, path);
        }
        case "send":
          return parseSend(element, path);
        case "if":
          return parseIf(element, path);
        case "log":
          return null;
        default:
          rejectElement(element);
          return null;
      }
    } catch (CompilerException problem) {
      throw problem.locate(document.getId(), path);
    }
  }

  private ExecutableContent parseAssign(final Element element, final String path)
      throws CompilerException {
    final String location = XmlDocuments.attribute(element, "location");
    final String value = XmlDocuments.attribute(element, "expr");
    if (location == null || value == null) {
      throw new CompilerException(Code.STRUCTURAL_VALIDITY,
          "<assign> needs both location and expr");
    }
    final Expression target = ExpressionParser.parse(location);
    if (target instanceof Expression.VariableRef) {
      return new ExecutableContent.Assign(((Expression.VariableRef) target).getName(), null,
          ExpressionParser.parse(value), path);
    }
    if (target instanceof Expression.Index
        && ((Expression.Index) target).getArray() instanceof Expression.VariableRef) {
      final Expression.Index index = (Expression.Index) target;
      return new ExecutableContent.Assign(
          ((Expression.VariableRef) index.getArray()).getName(), index.getPosition(),
          ExpressionParser.parse(value), path);
    }
    throw new CompilerException(Code.UNSUPPORTED_CONSTRUCT,
        "Assignment location '" + location + "' is neither a variable nor an array element");
  }

  private ExecutableContent parseSend(final Element element, final String path)
      throws CompilerException {
    for (String attribute : Arrays.asList("eventexpr", "targetexpr", "delay", "delayexpr",
        "idlocation", "namelist", "type", "typeexpr")) {
      if (XmlDocuments.attribute(element, attribute) != null) {
        throw new CompilerException(Code.UNSUPPORTED_CONSTRUCT,
            "<send> attribute '" + attribute + "'");
      }
    }
    final String event = XmlDocuments.attribute(element, "event");
    if (event == null) {
      throw new CompilerException(Code.STRUCTURAL_VALIDITY, "<send> without event");
    }
    final String target = XmlDocuments.attribute(element, "target");
    final Map<String, Expression> parameters = new LinkedHashMap<>();
    for (Element child : XmlDocuments.childElements(element)) {
      if (!"param".equals(XmlDocuments.localName(child))) {
        rejectElement(child);
      }
      final String parameter = XmlDocuments.attribute(child, "name");
      String expression = XmlDocuments.attribute(child, "expr");
      if (expression == null) {
        expression = XmlDocuments.attribute(child, "location");
      }
      if (parameter == null || expression == null) {
        throw new CompilerException(Code.STRUCTURAL_VALIDITY,
            "<param> needs a name and an expr or location");
      }
      if (parameters.put(parameter, ExpressionParser.parse(expression)) != null) {
        throw new CompilerException(Code.STRUCTURAL_VALIDITY,
            "Duplicate parameter '" + parameter + "' of event '" + event + "'");
      }
    }
    if ("#_internal".equals(target)) {
      if (!parameters.isEmpty()) {
        throw new CompilerException(Code.UNSUPPORTED_CONSTRUCT,
            "Parameters on internal event '" + event + "'");
      }
      return new ExecutableContent.Raise(event, path);
    }
    if (target != null) {
      throw new CompilerException(Code.UNSUPPORTED_CONSTRUCT, "<send> target '" + target
          + "', events are broadcast to the network");
    }
    return new ExecutableContent.Send(event, parameters, path);
  }

  private ExecutableContent parseIf(final Element element, final String path)
      throws CompilerException {
    final String condition = XmlDocuments.attribute(element, "cond");
    if (condition == null) {
      throw new CompilerException(Code.STRUCTURAL_VALIDITY, "<if> without cond");
    }
    final List<ExecutableContent.Branch> branches = new ArrayList<>();
    Expression branchCondition = ExpressionParser.parse(condition);
    List<ExecutableContent> branchContent = new ArrayList<>();
    boolean sawElse = false;
    for (Element child : XmlDocuments.childElements(element)) {
      final String tag = XmlDocuments.localName(child);
      if ("elseif".equals(tag) || "else".equals(tag)) {
        if (sawElse) {
          throw new CompilerException(Code.STRUCTURAL_VALIDITY,
              "<" + tag + "> after <else> in <if>");
        }
        branches.add(new ExecutableContent.Branch(branchCondition, branchContent));
        branchContent = new ArrayList<>();
        if ("else".equals(tag)) {
          sawElse = true;
          branchCondition = null;
        } else {
          final String elseCondition = XmlDocuments.attribute(child, "cond");
          if (elseCondition == null) {
            throw new CompilerException(Code.STRUCTURAL_VALIDITY, "<elseif> without cond");
          }
          branchCondition = ExpressionParser.parse(elseCondition);
        }
      } else {
        final ExecutableContent parsed = parseExecutable(child);
        if (parsed != null) {
          branchContent.add(parsed);
        }
      }
    }
    branches.add(new ExecutableContent.Branch(branchCondition, branchContent));
    return new ExecutableContent.If(branches, path);
  }

  private void applyParameters(final Element scxml) throws CompilerException {
    for (Map.Entry<String, String> parameter : parameters.entrySet()) {
      final DataVariable variable = dataVariables.get(parameter.getKey());
      if (variable == null) {
        throw error(Code.STRUCTURAL_VALIDITY, scxml,
            "Instance parameter '" + parameter.getKey() + "' names no data variable");
      }
      final Expression value;
      try {
        value = ExpressionParser.parse(parameter.getValue());
      } catch (CompilerException problem) {
        throw problem.locate(document.getId(), "param " + parameter.getKey());
      }
      dataVariables.put(variable.getId(), new DataVariable(variable.getId(), variable.getType(),
          value));
    }
  }

  private void rejectElement(final Element element) throws CompilerException {
    final String tag = XmlDocuments.localName(element);
    if (unsupportedElements.contains(tag)) {
      throw error(Code.UNSUPPORTED_CONSTRUCT, element, "Unsupported element <" + tag + ">");
    }
    throw error(Code.STRUCTURAL_VALIDITY, element, "Unexpected element <" + tag + ">");
  }

  private CompilerException error(final Code code, final Element element, final String message) {
    return new CompilerException(code, document.getId(),
        element == null ? null : XmlDocuments.path(element), message);
  }

  static List<String> splitTokens(final String text) {
    final List<String> tokens = new ArrayList<>();
    for (String token : text.trim().split("\\s+")) {
      if (!token.isEmpty()) {
        tokens.add(token);
      }
    }
    return tokens;
  }

  private static String stripExtension(final String id) {
    final int dot = id.lastIndexOf('.');
    return dot > 0 ? id.substring(0, dot) : id;
  }
}
