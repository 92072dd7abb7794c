package com.github.scxmljani;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;

import com.github.scxmljani.CompilerException.Code;

/**
 * Reads a BehaviorTree.CPP style description into a tree of numbered node instances.
 *
 * A node is written either as its type ({@code <Sequence>}) or generically as
 * {@code <Action|Condition|Control|Decorator ID="type">}. {@code <SubTree ID>} is replaced by the
 * root node of the referenced tree. The executed tree is the one named by
 * {@code main_tree_to_execute}, or the only tree of the document.
 */
public final class BehaviorTreeParser {
  private static final Set<String> genericTags =
      new HashSet<>(Arrays.asList("Action", "Condition", "Control", "Decorator"));
  // attributes that describe the node rather than parameterize it
  private static final Set<String> reservedAttributes = new HashSet<>(Arrays.asList("ID", "name"));

  private final String documentId;
  private final Map<String, Element> trees = new LinkedHashMap<>();
  // subtrees being inlined, to catch cycles
  private final Set<String> inlining = new LinkedHashSet<>();
  private int counter;

  private BehaviorTreeParser(final String documentId) {
    this.documentId = documentId;
  }

  public static BehaviorTreeNode parse(final String documentId, final Document document)
      throws CompilerException {
    return new BehaviorTreeParser(documentId).parseDocument(document.getDocumentElement());
  }

  private BehaviorTreeNode parseDocument(final Element root) throws CompilerException {
    if (root == null || !"root".equals(XmlDocuments.localName(root))) {
      throw new CompilerException(Code.STRUCTURAL_VALIDITY, documentId, "/",
          "Root element of a behavior tree must be <root>");
    }
    for (Element tree : XmlDocuments.childElements(root, "BehaviorTree")) {
      final String id = XmlDocuments.attribute(tree, "ID");
      if (id == null) {
        throw error(tree, "<BehaviorTree> without ID");
      }
      if (trees.put(id, tree) != null) {
        throw error(tree, "Duplicate behavior tree '" + id + "'");
      }
    }
    String main = XmlDocuments.attribute(root, "main_tree_to_execute");
    if (main == null) {
      if (trees.size() != 1) {
        throw new CompilerException(Code.STRUCTURAL_VALIDITY, documentId, "/root",
            "No main_tree_to_execute among " + trees.size() + " behavior trees");
      }
      main = trees.keySet().iterator().next();
    }
    return parseTree(main, root);
  }

  private BehaviorTreeNode parseTree(final String id, final Element reference)
      throws CompilerException {
    final Element tree = trees.get(id);
    if (tree == null) {
      throw error(reference, "Unknown behavior tree '" + id + "'");
    }
    if (!inlining.add(id)) {
      throw error(reference, "Cyclic subtree reference through " + inlining + " to '" + id + "'");
    }
    final List<Element> roots = XmlDocuments.childElements(tree);
    if (roots.size() != 1) {
      throw error(tree, "Behavior tree '" + id + "' must have exactly one root node");
    }
    final BehaviorTreeNode node = parseNode(roots.get(0));
    inlining.remove(id);
    return node;
  }

  private BehaviorTreeNode parseNode(final Element element) throws CompilerException {
    final String tag = XmlDocuments.localName(element);
    if ("SubTree".equals(tag)) {
      final String id = XmlDocuments.attribute(element, "ID");
      if (id == null) {
        throw error(element, "<SubTree> without ID");
      }
      return parseTree(id, element);
    }
    String type = tag;
    if (genericTags.contains(tag)) {
      type = XmlDocuments.attribute(element, "ID");
      if (type == null) {
        throw error(element, "<" + tag + "> without ID");
      }
    }
    final Map<String, String> ports = new LinkedHashMap<>();
    final NamedNodeMap attributes = element.getAttributes();
    for (int i = 0; i < attributes.getLength(); i++) {
      final Attr attribute = (Attr) attributes.item(i);
      if (!reservedAttributes.contains(attribute.getName())) {
        ports.put(attribute.getName(), attribute.getValue());
      }
    }
    final BehaviorTreeNode node =
        new BehaviorTreeNode(counter++, type, ports, XmlDocuments.path(element));
    for (Element child : XmlDocuments.childElements(element)) {
      node.addChild(parseNode(child));
    }
    return node;
  }

  private CompilerException error(final Element element, final String message) {
    return new CompilerException(Code.STRUCTURAL_VALIDITY, documentId, XmlDocuments.path(element),
        message);
  }

  /**
   * Every node of the tree in pre-order.
   */
  static List<BehaviorTreeNode> preOrder(final BehaviorTreeNode root) {
    final List<BehaviorTreeNode> nodes = new ArrayList<>();
    collect(root, nodes);
    return nodes;
  }

  private static void collect(final BehaviorTreeNode node, final List<BehaviorTreeNode> nodes) {
    nodes.add(node);
    for (BehaviorTreeNode child : node.getChildren()) {
      collect(child, nodes);
    }
  }
}
