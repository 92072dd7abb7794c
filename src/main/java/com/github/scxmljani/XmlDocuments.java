package com.github.scxmljani;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import com.github.scxmljani.CompilerException.Code;

/**
 * DOM plumbing shared by every XML reader of the compiler.
 */
final class XmlDocuments {
  private XmlDocuments() {}

  static DocumentBuilder newDocumentBuilder() throws CompilerException {
    final DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
    factory.setNamespaceAware(true);
    factory.setIgnoringComments(true);
    factory.setCoalescing(true);
    try {
      return factory.newDocumentBuilder();
    } catch (ParserConfigurationException problem) {
      throw new CompilerException(Code.INTERNAL_CONSISTENCY, problem);
    }
  }

  static Document parse(final String documentId, final InputStream stream)
      throws CompilerException {
    try {
      return newDocumentBuilder().parse(stream);
    } catch (SAXException malformed) {
      throw new CompilerException(Code.STRUCTURAL_VALIDITY, documentId, null,
          "Malformed XML: " + malformed.getMessage(), malformed);
    } catch (IOException problem) {
      throw new CompilerException(Code.IO_FAILURE, documentId, null,
          "Failed to read document: " + problem.getMessage(), problem);
    }
  }

  static Document parse(final String documentId, final String xml) throws CompilerException {
    try {
      return newDocumentBuilder().parse(new InputSource(new StringReader(xml)));
    } catch (SAXException malformed) {
      throw new CompilerException(Code.STRUCTURAL_VALIDITY, documentId, null,
          "Malformed XML: " + malformed.getMessage(), malformed);
    } catch (IOException problem) {
      throw new CompilerException(Code.IO_FAILURE, documentId, null,
          "Failed to read document: " + problem.getMessage(), problem);
    }
  }

  static List<Element> childElements(final Element parent) {
    final List<Element> elements = new ArrayList<>();
    final NodeList children = parent.getChildNodes();
    for (int i = 0; i < children.getLength(); i++) {
      final Node child = children.item(i);
      if (child instanceof Element) {
        elements.add((Element) child);
      }
    }
    return elements;
  }

  static List<Element> childElements(final Element parent, final String localName) {
    final List<Element> elements = new ArrayList<>();
    for (Element child : childElements(parent)) {
      if (localName.equals(localName(child))) {
        elements.add(child);
      }
    }
    return elements;
  }

  static Element childElement(final Element parent, final String localName) {
    final List<Element> elements = childElements(parent, localName);
    return elements.isEmpty() ? null : elements.get(0);
  }

  static String localName(final Element element) {
    return element.getLocalName() != null ? element.getLocalName() : element.getTagName();
  }

  /**
   * Attribute value, or null when absent or blank.
   */
  static String attribute(final Element element, final String name) {
    final String value = element.getAttribute(name);
    if (value == null || value.trim().isEmpty()) {
      return null;
    }
    return value.trim();
  }

  /**
   * Slash-separated path of local names with sibling positions and ids, eg.
   * /scxml/state[0]#idle/transition[1].
   */
  static String path(final Element element) {
    final StringBuilder path = new StringBuilder();
    Node current = element;
    while (current instanceof Element) {
      final Element currentElement = (Element) current;
      final StringBuilder segment = new StringBuilder("/").append(localName(currentElement));
      final Node parent = currentElement.getParentNode();
      if (parent instanceof Element) {
        int position = 0;
        for (Element sibling : childElements((Element) parent, localName(currentElement))) {
          if (sibling == currentElement) {
            break;
          }
          position++;
        }
        segment.append('[').append(position).append(']');
      }
      final String id = attribute(currentElement, "id");
      if (id != null) {
        segment.append('#').append(id);
      }
      path.insert(0, segment);
      current = parent;
    }
    return path.toString();
  }
}
