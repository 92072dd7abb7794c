package com.github.scxmljani;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import com.github.scxmljani.CompilerException.Code;

/**
 * Instantiates one statechart per behavior-tree node from the node type's template.
 *
 * Templates are plain statecharts with a few elements and attributes of the
 * {@code urn:scxmljani:behavior-tree} namespace, rewritten per instance:<br>
 * 1. {@code event="bt:tick"} becomes the instance's tick event<br>
 * 2. a transition on {@code bt:child-status} is repeated for every child and status, with
 * {@code _bt.child} and {@code _bt.status} replaced by the child index and status code<br>
 * 3. {@code <bt:tick-child index>} and {@code <bt:tick-children>} send the children's ticks<br>
 * 4. {@code <bt:return status>} sends the instance's status event<br>
 * 5. {@code <bt:param name default>} declares a parameter, {@code ${param.NAME}} uses it<br>
 * 6. {@code _bt.children}, {@code _bt.SUCCESS}, {@code _bt.FAILURE} and {@code _bt.RUNNING} are
 * constants<br>
 * 7. {@code bt:min-children} and {@code bt:max-children} on the root limit the child count<br>
 */
public final class BehaviorTreeExpander {
  private static final Logger logger =
      LogManager.getLogger(BehaviorTreeExpander.class.getSimpleName());

  public static final String namespace = "urn:scxmljani:behavior-tree";
  static final String scxmlNamespace = "http://www.w3.org/2005/07/scxml";

  private static final Pattern parameterReference = Pattern.compile("\\$\\{param\\.(\\w+)\\}");
  private static final Pattern childReference = Pattern.compile("_bt\\.child(?![\\w])");
  private static final Pattern statusReference = Pattern.compile("_bt\\.status(?![\\w])");
  private static final Pattern childrenReference = Pattern.compile("_bt\\.children(?![\\w])");

  private final BehaviorTreeTemplates templates;

  private BehaviorTreeExpander(final BehaviorTreeTemplates templates) {
    this.templates = templates;
  }

  /**
   * One statechart document per node, parents before children and siblings in document order.
   * Each document's id is the automaton name of its node.
   */
  public static List<StatechartDocument> expand(final BehaviorTreeNode root,
      final BehaviorTreeTemplates templates) throws CompilerException {
    final BehaviorTreeExpander expander = new BehaviorTreeExpander(templates);
    final List<StatechartDocument> documents = new ArrayList<>();
    for (BehaviorTreeNode node : BehaviorTreeParser.preOrder(root)) {
      documents.add(expander.instantiate(node));
    }
    if (logger.isDebugEnabled()) {
      logger.debug("Expanded behavior tree rooted at " + root.getAutomatonName() + " into "
          + documents.size() + " statecharts");
    }
    return documents;
  }

  /**
   * Ticks and statuses exchanged inside the tree. Only the tick of the root comes from outside.
   */
  public static Set<String> closedEvents(final BehaviorTreeNode root) {
    final Set<String> events = new LinkedHashSet<>();
    for (BehaviorTreeNode node : BehaviorTreeParser.preOrder(root)) {
      if (node != root) {
        events.add(node.getTickEvent());
      }
      for (BehaviorTreeNode.Status status : BehaviorTreeNode.Status.values()) {
        events.add(node.getStatusEvent(status));
      }
    }
    return events;
  }

  private StatechartDocument instantiate(final BehaviorTreeNode node) throws CompilerException {
    final StatechartDocument template = templates.get(node.getType());
    if (template == null) {
      throw new CompilerException(Code.UNSUPPORTED_CONSTRUCT, "Unsupported behavior-tree node '"
          + node.getType() + "' at " + node.getTreePath());
    }
    final Document document = XmlDocuments.newDocumentBuilder().newDocument();
    document.appendChild(document.importNode(template.getDocument().getDocumentElement(), true));
    final Element scxml = document.getDocumentElement();
    final String where = node.getAutomatonName() + " (" + template.getId() + ")";
    try {
      checkChildCount(node, scxml);
      final Map<String, String> parameters = collectParameters(node, scxml);
      replaceText(scxml, parameters, node);
      expandChildStatus(node, scxml);
      renameTickEvents(node, scxml);
      expandActions(node, scxml);
      scxml.setAttribute("name", node.getAutomatonName());
      rejectLeftovers(scxml);
    } catch (CompilerException problem) {
      throw problem.locate(where, node.getTreePath());
    }
    return new StatechartDocument(node.getAutomatonName(), document);
  }

  private static void checkChildCount(final BehaviorTreeNode node, final Element scxml)
      throws CompilerException {
    final int children = node.getChildren().size();
    final Integer min = intAttribute(scxml, "min-children");
    final Integer max = intAttribute(scxml, "max-children");
    if ((min != null && children < min) || (max != null && children > max)) {
      throw new CompilerException(Code.STRUCTURAL_VALIDITY, "Behavior-tree node '"
          + node.getType() + "' has " + children + " children, expected "
          + (min == null ? 0 : min) + ".." + (max == null ? "*" : max));
    }
    scxml.removeAttributeNS(namespace, "min-children");
    scxml.removeAttributeNS(namespace, "max-children");
  }

  private static Integer intAttribute(final Element element, final String name)
      throws CompilerException {
    final String value = element.getAttributeNS(namespace, name);
    if (value == null || value.trim().isEmpty()) {
      return null;
    }
    try {
      return Integer.valueOf(value.trim());
    } catch (NumberFormatException malformed) {
      throw new CompilerException(Code.STRUCTURAL_VALIDITY,
          "Malformed bt:" + name + " '" + value + "'");
    }
  }

  private static Map<String, String> collectParameters(final BehaviorTreeNode node,
      final Element scxml) throws CompilerException {
    final Map<String, String> parameters = new LinkedHashMap<>();
    for (Element declaration : btChildren(scxml, "param")) {
      final String name = XmlDocuments.attribute(declaration, "name");
      if (name == null) {
        throw new CompilerException(Code.STRUCTURAL_VALIDITY,
            "<bt:param> without name in template of '" + node.getType() + "'");
      }
      String value = node.getPorts().get(name);
      if (value == null && declaration.hasAttribute("default")) {
        value = declaration.getAttribute("default");
      }
      if (value == null) {
        throw new CompilerException(Code.STRUCTURAL_VALIDITY,
            "Missing parameter '" + name + "' of behavior-tree node '" + node.getType() + "'");
      }
      parameters.put(name, value);
      scxml.removeChild(declaration);
    }
    return parameters;
  }

  private static List<Element> btChildren(final Element parent, final String localName) {
    final List<Element> elements = new ArrayList<>();
    for (Element child : XmlDocuments.childElements(parent)) {
      if (namespace.equals(child.getNamespaceURI()) && localName.equals(child.getLocalName())) {
        elements.add(child);
      }
    }
    return elements;
  }

  /**
   * Substitutes parameters and constants in every attribute and text node below the element.
   */
  private static void replaceText(final Element element, final Map<String, String> parameters,
      final BehaviorTreeNode node) throws CompilerException {
    final NamedNodeMap attributes = element.getAttributes();
    for (int i = 0; i < attributes.getLength(); i++) {
      final Attr attribute = (Attr) attributes.item(i);
      attribute.setValue(substitute(attribute.getValue(), parameters, node));
    }
    final NodeList children = element.getChildNodes();
    for (int i = 0; i < children.getLength(); i++) {
      final Node child = children.item(i);
      if (child instanceof Element) {
        replaceText((Element) child, parameters, node);
      } else if (child.getNodeType() == Node.TEXT_NODE) {
        child.setNodeValue(substitute(child.getNodeValue(), parameters, node));
      }
    }
  }

  private static String substitute(final String text, final Map<String, String> parameters,
      final BehaviorTreeNode node) throws CompilerException {
    final Matcher matcher = parameterReference.matcher(text);
    final StringBuffer replaced = new StringBuffer();
    while (matcher.find()) {
      final String value = parameters.get(matcher.group(1));
      if (value == null) {
        throw new CompilerException(Code.STRUCTURAL_VALIDITY, "Undeclared parameter '"
            + matcher.group(1) + "' used in template of '" + node.getType() + "'");
      }
      matcher.appendReplacement(replaced, Matcher.quoteReplacement(value));
    }
    matcher.appendTail(replaced);
    String result = childrenReference.matcher(replaced.toString())
        .replaceAll(String.valueOf(node.getChildren().size()));
    for (BehaviorTreeNode.Status status : BehaviorTreeNode.Status.values()) {
      result = result.replaceAll("_bt\\." + status.name() + "(?![\\w])",
          String.valueOf(status.getCode()));
    }
    return result;
  }

  private static void expandChildStatus(final BehaviorTreeNode node, final Element element) {
    for (Element child : XmlDocuments.childElements(element)) {
      if ("transition".equals(XmlDocuments.localName(child))
          && "bt:child-status".equals(XmlDocuments.attribute(child, "event"))) {
        for (int index = 0; index < node.getChildren().size(); index++) {
          for (BehaviorTreeNode.Status status : BehaviorTreeNode.Status.values()) {
            final Element copy = (Element) child.cloneNode(true);
            copy.setAttribute("event", node.getChildren().get(index).getStatusEvent(status));
            bindChild(copy, index, status);
            element.insertBefore(copy, child);
          }
        }
        element.removeChild(child);
      } else {
        expandChildStatus(node, child);
      }
    }
  }

  private static void bindChild(final Element element, final int index,
      final BehaviorTreeNode.Status status) {
    final NamedNodeMap attributes = element.getAttributes();
    for (int i = 0; i < attributes.getLength(); i++) {
      final Attr attribute = (Attr) attributes.item(i);
      attribute.setValue(bind(attribute.getValue(), index, status));
    }
    final NodeList children = element.getChildNodes();
    for (int i = 0; i < children.getLength(); i++) {
      final Node child = children.item(i);
      if (child instanceof Element) {
        bindChild((Element) child, index, status);
      } else if (child.getNodeType() == Node.TEXT_NODE) {
        child.setNodeValue(bind(child.getNodeValue(), index, status));
      }
    }
  }

  private static String bind(final String text, final int index,
      final BehaviorTreeNode.Status status) {
    final String withChild = childReference.matcher(text).replaceAll(String.valueOf(index));
    return statusReference.matcher(withChild).replaceAll(String.valueOf(status.getCode()));
  }

  private static void renameTickEvents(final BehaviorTreeNode node, final Element element) {
    for (Element child : XmlDocuments.childElements(element)) {
      if ("transition".equals(XmlDocuments.localName(child)) && child.hasAttribute("event")) {
        final StringBuilder events = new StringBuilder();
        for (String token : StatechartParser.splitTokens(child.getAttribute("event"))) {
          if (events.length() > 0) {
            events.append(' ');
          }
          events.append("bt:tick".equals(token) ? node.getTickEvent() : token);
        }
        child.setAttribute("event", events.toString());
      }
      renameTickEvents(node, child);
    }
  }

  private void expandActions(final BehaviorTreeNode node, final Element element)
      throws CompilerException {
    for (Element child : XmlDocuments.childElements(element)) {
      if (!namespace.equals(child.getNamespaceURI())) {
        expandActions(node, child);
        continue;
      }
      final List<Element> replacement = new ArrayList<>();
      switch (child.getLocalName()) {
        case "tick-child":
          replacement.addAll(tickChild(node, child));
          break;
        case "tick-children":
          for (BehaviorTreeNode tree : node.getChildren()) {
            replacement.add(send(element.getOwnerDocument(), tree.getTickEvent()));
          }
          break;
        case "return":
          replacement.add(send(element.getOwnerDocument(),
              node.getStatusEvent(status(child.getAttribute("status")))));
          break;
        default:
          throw new CompilerException(Code.UNSUPPORTED_CONSTRUCT,
              "Unsupported behavior-tree template element <bt:" + child.getLocalName() + ">");
      }
      for (Element added : replacement) {
        element.insertBefore(added, child);
      }
      element.removeChild(child);
    }
  }

  private static List<Element> tickChild(final BehaviorTreeNode node, final Element tickChild)
      throws CompilerException {
    final Document document = tickChild.getOwnerDocument();
    final List<Element> result = new ArrayList<>();
    final String text = XmlDocuments.attribute(tickChild, "index");
    if (text == null) {
      throw new CompilerException(Code.STRUCTURAL_VALIDITY, "<bt:tick-child> without index");
    }
    final Expression index = Expressions.fold(ExpressionParser.parse(text));
    final List<BehaviorTreeNode> children = node.getChildren();
    if (index instanceof Expression.Literal
        && ((Expression.Literal) index).getValue() instanceof Long) {
      // out of range only on transitions whose condition already excludes them
      final long position = (Long) ((Expression.Literal) index).getValue();
      if (position >= 0 && position < children.size()) {
        result.add(send(document, children.get((int) position).getTickEvent()));
      }
      return result;
    }
    if (children.isEmpty()) {
      return result;
    }
    final Element choice = document.createElementNS(scxmlNamespace, "if");
    for (int i = 0; i < children.size(); i++) {
      if (i > 0) {
        final Element alternative = document.createElementNS(scxmlNamespace, "elseif");
        alternative.setAttribute("cond", "(" + text + ") == " + i);
        choice.appendChild(alternative);
      } else {
        choice.setAttribute("cond", "(" + text + ") == " + i);
      }
      choice.appendChild(send(document, children.get(i).getTickEvent()));
    }
    result.add(choice);
    return result;
  }

  private static Element send(final Document document, final String event) {
    final Element send = document.createElementNS(scxmlNamespace, "send");
    send.setAttribute("event", event);
    return send;
  }

  private static BehaviorTreeNode.Status status(final String text) throws CompilerException {
    for (BehaviorTreeNode.Status status : BehaviorTreeNode.Status.values()) {
      if (status.name().equals(text.trim())) {
        return status;
      }
    }
    throw new CompilerException(Code.STRUCTURAL_VALIDITY,
        "Unknown behavior-tree status '" + text + "' in <bt:return>");
  }

  private static void rejectLeftovers(final Element element) throws CompilerException {
    for (Element child : XmlDocuments.childElements(element)) {
      if (namespace.equals(child.getNamespaceURI())) {
        throw new CompilerException(Code.UNSUPPORTED_CONSTRUCT,
            "Unsupported behavior-tree template element <bt:" + child.getLocalName() + ">");
      }
      final String event = XmlDocuments.attribute(child, "event");
      if (event != null && event.contains("bt:")) {
        throw new CompilerException(Code.UNSUPPORTED_CONSTRUCT,
            "Unsupported behavior-tree event '" + event + "'");
      }
      rejectLeftovers(child);
    }
  }
}
