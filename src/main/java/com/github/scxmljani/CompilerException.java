package com.github.scxmljani;

/**
 * Unified single exception that's thrown by every stage of the compiler. The code enum
 * encapsulates the kind of failure so that callers can tell user input defects apart from
 * compiler defects without parsing messages.
 *
 * Located failures also carry the id of the offending document and the location of the element
 * or expression within it. Both are optional since some failures (configuration, composition)
 * have no single document to blame.
 */
public final class CompilerException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;
  private final String documentId;
  private final String location;

  public CompilerException(final Code code) {
    super(code.getDescription());
    this.code = code;
    this.documentId = null;
    this.location = null;
  }

  public CompilerException(final Code code, final String message) {
    super(message);
    this.code = code;
    this.documentId = null;
    this.location = null;
  }

  public CompilerException(final Code code, final Throwable throwable) {
    super(code.getDescription(), throwable);
    this.code = code;
    this.documentId = null;
    this.location = null;
  }

  public CompilerException(final Code code, final String documentId, final String location,
      final String message) {
    super(format(documentId, location, message));
    this.code = code;
    this.documentId = documentId;
    this.location = location;
  }

  public CompilerException(final Code code, final String documentId, final String location,
      final String message, final Throwable throwable) {
    super(format(documentId, location, message), throwable);
    this.code = code;
    this.documentId = documentId;
    this.location = location;
  }

  public Code getCode() {
    return code;
  }

  public String getDocumentId() {
    return documentId;
  }

  public String getLocation() {
    return location;
  }

  /**
   * Re-throws an unlocated failure with the given document and location attached. Failures that
   * already know where they come from are returned unchanged.
   */
  public CompilerException locate(final String documentId, final String location) {
    if (this.documentId != null) {
      return this;
    }
    return new CompilerException(code, documentId, location, getMessage(), this);
  }

  private static String format(final String documentId, final String location,
      final String message) {
    final StringBuilder builder = new StringBuilder();
    if (documentId != null) {
      builder.append('[').append(documentId);
      if (location != null) {
        builder.append(' ').append(location);
      }
      builder.append("] ");
    }
    return builder.append(message).toString();
  }

  public static enum Code {
    // 1.
    STRUCTURAL_VALIDITY(
        "Malformed statechart document: duplicate ids, dangling targets or missing initial states"),
    // 2.
    UNRESOLVED_REFERENCE("Reference to an undeclared variable, state or event"),
    // 3.
    UNSUPPORTED_CONSTRUCT("Construct is not part of the supported statechart or expression subset"),
    // 4.
    SEMANTIC_NONTERMINATION("Eventless closure or internal event queue does not terminate"),
    // 5.
    COMPOSITION_INCONSISTENCY(
        "Automata cannot be composed: namespace collision or inconsistent event use"),
    // 6.
    INTERNAL_CONSISTENCY(
        "Emitted model violates the target format. This is a compiler defect, not an input defect"),
    // 7.
    INVALID_CONFIGURATION("Compiler configuration is invalid"),
    // 8.
    IO_FAILURE("Failed to read or write a model file");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
