package com.github.scxmljani;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.w3c.dom.Document;

import com.github.scxmljani.CompilerException.Code;

/**
 * Statechart templates behavior-tree nodes are instantiated from, keyed by node type. The
 * control nodes ship with the compiler as classpath resources; leaf nodes come from plugin
 * documents whose {@code <scxml name>} is the node type. A plugin may replace a built-in.
 *
 * Template documents are shared and must only ever be cloned, never modified.
 */
public final class BehaviorTreeTemplates {
  private static final Logger logger =
      LogManager.getLogger(BehaviorTreeTemplates.class.getSimpleName());

  static final String builtinDirectory = "/bt_control_nodes/";
  static final List<String> builtinTypes =
      Collections.unmodifiableList(Arrays.asList("Sequence", "Fallback", "Parallel", "Inverter"));

  private final Map<String, StatechartDocument> templates = new LinkedHashMap<>();

  private BehaviorTreeTemplates() {}

  /**
   * Templates of the built-in control nodes.
   */
  public static BehaviorTreeTemplates withBuiltins() throws CompilerException {
    final BehaviorTreeTemplates templates = new BehaviorTreeTemplates();
    for (String type : builtinTypes) {
      final String resource = builtinDirectory + type + ".scxml";
      try (InputStream stream = BehaviorTreeTemplates.class.getResourceAsStream(resource)) {
        if (stream == null) {
          throw new CompilerException(Code.IO_FAILURE, resource, null,
              "Missing built-in behavior-tree template");
        }
        templates.templates.put(type, StatechartDocument.fromStream(type + ".scxml", stream));
      } catch (IOException problem) {
        throw new CompilerException(Code.IO_FAILURE, resource, null,
            "Failed to read built-in behavior-tree template", problem);
      }
    }
    return templates;
  }

  /**
   * Registers a leaf or replacement template under the name of its {@code <scxml>} root.
   */
  public BehaviorTreeTemplates addPlugin(final StatechartDocument plugin)
      throws CompilerException {
    final Document document = plugin.getDocument();
    final String type = document.getDocumentElement() == null ? null
        : XmlDocuments.attribute(document.getDocumentElement(), "name");
    if (type == null) {
      throw new CompilerException(Code.STRUCTURAL_VALIDITY, plugin.getId(), "/scxml",
          "Behavior-tree plugin without a name attribute");
    }
    if (templates.put(type, plugin) != null && logger.isDebugEnabled()) {
      logger.debug("Plugin " + plugin.getId() + " replaces the template of '" + type + "'");
    }
    return this;
  }

  public StatechartDocument get(final String type) {
    return templates.get(type);
  }

  public boolean contains(final String type) {
    return templates.containsKey(type);
  }

  @Override
  public String toString() {
    return "BehaviorTreeTemplates " + templates.keySet();
  }
}
