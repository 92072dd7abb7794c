package com.github.scxmljani;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import org.w3c.dom.Document;

import com.github.scxmljani.CompilerException.Code;

/**
 * A statechart input: the id used in diagnostics and the DOM tree it was read into. Behavior-tree
 * expansion produces these too, one per node instance.
 */
public final class StatechartDocument {
  private final String id;
  private final Document document;

  public StatechartDocument(final String id, final Document document) {
    this.id = id;
    this.document = document;
  }

  public static StatechartDocument fromString(final String id, final String xml)
      throws CompilerException {
    return new StatechartDocument(id, XmlDocuments.parse(id, xml));
  }

  public static StatechartDocument fromStream(final String id, final InputStream stream)
      throws CompilerException {
    return new StatechartDocument(id, XmlDocuments.parse(id, stream));
  }

  public static StatechartDocument fromFile(final Path path) throws CompilerException {
    final String id = path.getFileName().toString();
    try (InputStream stream = Files.newInputStream(path)) {
      return fromStream(id, stream);
    } catch (IOException problem) {
      throw new CompilerException(Code.IO_FAILURE, id, null,
          "Failed to read " + path + ": " + problem.getMessage(), problem);
    }
  }

  public String getId() {
    return id;
  }

  public Document getDocument() {
    return document;
  }

  @Override
  public String toString() {
    return "StatechartDocument [id=" + id + "]";
  }
}
