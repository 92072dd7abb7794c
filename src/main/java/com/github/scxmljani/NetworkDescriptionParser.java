package com.github.scxmljani;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import com.github.scxmljani.CompilerException.Code;
import com.github.scxmljani.NetworkDescription.NetworkDescriptionBuilder;

/**
 * Loads a network description file:
 *
 * <pre>
 * &lt;network name="..."&gt;
 *   &lt;max_array_size value="10"/&gt;
 *   &lt;global_variables&gt; &lt;data id type expr/&gt; ... &lt;/global_variables&gt;
 *   &lt;automaton src="a.scxml" id="A"&gt; &lt;param name value/&gt; &lt;/automaton&gt;
 *   &lt;behavior_tree src="bt.xml"&gt; &lt;plugin src="leaf.scxml"/&gt; &lt;/behavior_tree&gt;
 *   &lt;property name expr kind="Pmax"/&gt;
 * &lt;/network&gt;
 * </pre>
 *
 * Referenced files are resolved against the directory of the description.
 */
public final class NetworkDescriptionParser {
  private static final Logger logger =
      LogManager.getLogger(NetworkDescriptionParser.class.getSimpleName());

  private final String documentId;
  private final Path baseDirectory;

  private NetworkDescriptionParser(final String documentId, final Path baseDirectory) {
    this.documentId = documentId;
    this.baseDirectory = baseDirectory;
  }

  public static NetworkDescription parse(final Path file) throws CompilerException {
    final String id = file.getFileName().toString();
    final Document document = read(id, file);
    return parse(id, document, file.toAbsolutePath().getParent());
  }

  /**
   * Reads an already parsed description whose relative paths point into {@code baseDirectory}.
   */
  public static NetworkDescription parse(final String documentId, final Document document,
      final Path baseDirectory) throws CompilerException {
    final NetworkDescription description =
        new NetworkDescriptionParser(documentId, baseDirectory).parseNetwork(document);
    logger.info("[n:" + description.getName() + "] Loaded " + description);
    return description;
  }

  private NetworkDescription parseNetwork(final Document document) throws CompilerException {
    final Element network = document.getDocumentElement();
    if (network == null || !"network".equals(XmlDocuments.localName(network))) {
      throw new CompilerException(Code.STRUCTURAL_VALIDITY, documentId, "/",
          "Root element of a network description must be <network>");
    }
    final NetworkDescriptionBuilder builder =
        NetworkDescriptionBuilder.newBuilder().name(required(network, "name"));
    boolean behaviorTree = false;
    for (Element child : XmlDocuments.childElements(network)) {
      final String tag = XmlDocuments.localName(child);
      switch (tag) {
        case "max_array_size":
          builder.maxArraySize(parseInt(child, required(child, "value")));
          break;
        case "global_variables":
          for (Element data : XmlDocuments.childElements(child)) {
            if (!"data".equals(XmlDocuments.localName(data))) {
              throw error(data, "Unexpected <" + XmlDocuments.localName(data)
                  + "> in <global_variables>");
            }
            builder.global(StatechartParser.parseData(documentId, data));
          }
          break;
        case "automaton":
          parseAutomaton(child, builder);
          break;
        case "behavior_tree":
          if (behaviorTree) {
            throw error(child, "More than one <behavior_tree>");
          }
          behaviorTree = true;
          parseBehaviorTree(child, builder);
          break;
        case "property":
          builder.property(parseProperty(child));
          break;
        default:
          throw error(child, "Unexpected <" + tag + "> in <network>");
      }
    }
    try {
      return builder.build();
    } catch (CompilerException problem) {
      throw problem.locate(documentId, "/network");
    }
  }

  private PropertyDeclaration parseProperty(final Element property) throws CompilerException {
    final String kind = XmlDocuments.attribute(property, "kind");
    try {
      return new PropertyDeclaration(required(property, "name"), required(property, "expr"),
          kind == null ? PropertyDeclaration.Kind.PMAX : PropertyDeclaration.Kind.parse(kind));
    } catch (CompilerException problem) {
      throw problem.locate(documentId, XmlDocuments.path(property));
    }
  }

  private void parseAutomaton(final Element automaton, final NetworkDescriptionBuilder builder)
      throws CompilerException {
    final Path source = resolve(required(automaton, "src"));
    final Map<String, String> parameters = new LinkedHashMap<>();
    for (Element param : XmlDocuments.childElements(automaton)) {
      if (!"param".equals(XmlDocuments.localName(param))) {
        throw error(param, "Unexpected <" + XmlDocuments.localName(param) + "> in <automaton>");
      }
      final String name = required(param, "name");
      if (parameters.put(name, required(param, "value")) != null) {
        throw error(param, "Parameter '" + name + "' given twice");
      }
    }
    builder.automaton(StatechartDocument.fromFile(source), XmlDocuments.attribute(automaton, "id"),
        parameters);
  }

  private void parseBehaviorTree(final Element behaviorTree,
      final NetworkDescriptionBuilder builder) throws CompilerException {
    final Path source = resolve(required(behaviorTree, "src"));
    final List<StatechartDocument> plugins = new ArrayList<>();
    for (Element plugin : XmlDocuments.childElements(behaviorTree)) {
      if (!"plugin".equals(XmlDocuments.localName(plugin))) {
        throw error(plugin, "Unexpected <" + XmlDocuments.localName(plugin)
            + "> in <behavior_tree>");
      }
      plugins.add(StatechartDocument.fromFile(resolve(required(plugin, "src"))));
    }
    final String id = source.getFileName().toString();
    builder.behaviorTree(id, read(id, source), plugins);
  }

  private Path resolve(final String source) {
    return baseDirectory == null ? Path.of(source) : baseDirectory.resolve(source);
  }

  private static Document read(final String id, final Path file) throws CompilerException {
    try (InputStream stream = Files.newInputStream(file)) {
      return XmlDocuments.parse(id, stream);
    } catch (IOException problem) {
      throw new CompilerException(Code.IO_FAILURE, id, null,
          "Failed to read " + file + ": " + problem.getMessage(), problem);
    }
  }

  private int parseInt(final Element element, final String text) throws CompilerException {
    try {
      return Integer.parseInt(text.trim());
    } catch (NumberFormatException malformed) {
      throw error(element, "Malformed integer '" + text + "'");
    }
  }

  private String required(final Element element, final String attribute)
      throws CompilerException {
    final String value = XmlDocuments.attribute(element, attribute);
    if (value == null) {
      throw error(element, "<" + XmlDocuments.localName(element) + "> without " + attribute);
    }
    return value;
  }

  private CompilerException error(final Element element, final String message) {
    return new CompilerException(Code.STRUCTURAL_VALIDITY, documentId, XmlDocuments.path(element),
        message);
  }
}
