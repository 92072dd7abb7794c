package com.github.scxmljani;

import java.util.Objects;

import com.github.scxmljani.CompilerException.Code;

/**
 * Immutable type of a data variable or expression. Scalars are boolean, integer (optionally
 * bounded) and real; arrays are fixed-capacity, one-dimensional and typed by their base scalar.
 */
public final class ExpressionType {
  public static final ExpressionType BOOL = new ExpressionType(Kind.BOOL, null, null, null, 0);
  public static final ExpressionType INT = new ExpressionType(Kind.INT, null, null, null, 0);
  public static final ExpressionType REAL = new ExpressionType(Kind.REAL, null, null, null, 0);

  private final Kind kind;
  private final Long lowerBound;
  private final Long upperBound;
  // only set for arrays
  private final ExpressionType base;
  // 0 means "use the configured maxArraySize"
  private final int capacity;

  public static enum Kind {
    BOOL, INT, REAL, ARRAY;
  }

  private ExpressionType(final Kind kind, final Long lowerBound, final Long upperBound,
      final ExpressionType base, final int capacity) {
    this.kind = kind;
    this.lowerBound = lowerBound;
    this.upperBound = upperBound;
    this.base = base;
    this.capacity = capacity;
  }

  public static ExpressionType boundedInt(final Long lowerBound, final Long upperBound) {
    if (lowerBound == null && upperBound == null) {
      return INT;
    }
    return new ExpressionType(Kind.INT, lowerBound, upperBound, null, 0);
  }

  public static ExpressionType arrayOf(final ExpressionType base, final int capacity) {
    return new ExpressionType(Kind.ARRAY, null, null, base, capacity);
  }

  /**
   * Parses the type attribute of a data declaration: bool, int8..int64, uint8..uint64, int,
   * float32, float64, double, real and arrays thereof written as T[] or T[N].
   */
  public static ExpressionType parse(final String text) throws CompilerException {
    if (text == null || text.trim().isEmpty()) {
      throw new CompilerException(Code.STRUCTURAL_VALIDITY, "Missing data type");
    }
    final String trimmed = text.trim();
    if (trimmed.endsWith("]")) {
      final int open = trimmed.indexOf('[');
      if (open <= 0) {
        throw new CompilerException(Code.STRUCTURAL_VALIDITY, "Malformed array type: " + text);
      }
      final ExpressionType base = parse(trimmed.substring(0, open));
      if (base.isArray()) {
        throw new CompilerException(Code.UNSUPPORTED_CONSTRUCT,
            "Multi-dimensional arrays are not supported: " + text);
      }
      final String size = trimmed.substring(open + 1, trimmed.length() - 1).trim();
      int capacity = 0;
      if (!size.isEmpty()) {
        try {
          capacity = Integer.parseInt(size);
        } catch (NumberFormatException malformed) {
          throw new CompilerException(Code.STRUCTURAL_VALIDITY, "Malformed array size: " + text);
        }
        if (capacity <= 0) {
          throw new CompilerException(Code.STRUCTURAL_VALIDITY,
              "Array size must be positive: " + text);
        }
      }
      return arrayOf(base, capacity);
    }
    switch (trimmed) {
      case "bool":
      case "boolean":
        return BOOL;
      case "int":
      case "int8":
      case "int16":
      case "int32":
      case "int64":
      case "integer":
        return INT;
      case "uint8":
      case "uint16":
      case "uint32":
      case "uint64":
        return boundedInt(0L, null);
      case "float":
      case "float32":
      case "float64":
      case "double":
      case "real":
        return REAL;
      default:
        throw new CompilerException(Code.UNSUPPORTED_CONSTRUCT, "Unsupported data type: " + text);
    }
  }

  public Kind getKind() {
    return kind;
  }

  public Long getLowerBound() {
    return lowerBound;
  }

  public Long getUpperBound() {
    return upperBound;
  }

  public ExpressionType getBase() {
    return base;
  }

  public int getCapacity() {
    return capacity;
  }

  public boolean isArray() {
    return kind == Kind.ARRAY;
  }

  public boolean isBool() {
    return kind == Kind.BOOL;
  }

  public boolean isNumeric() {
    return kind == Kind.INT || kind == Kind.REAL;
  }

  public boolean isBounded() {
    return lowerBound != null || upperBound != null;
  }

  /**
   * Same type without bounds or capacity, which is what type checking compares.
   */
  public ExpressionType erased() {
    switch (kind) {
      case BOOL:
        return BOOL;
      case INT:
        return INT;
      case REAL:
        return REAL;
      default:
        if (base == null || (capacity == 0 && base == base.erased())) {
          return this;
        }
        return arrayOf(base.erased(), 0);
    }
  }

  /**
   * Numeric promotion: the wider of two numeric types.
   */
  public static ExpressionType widen(final ExpressionType left, final ExpressionType right) {
    if (left.kind == Kind.REAL || right.kind == Kind.REAL) {
      return REAL;
    }
    return INT;
  }

  /**
   * True iff a value of type {@code source} may be stored in a variable of this type. Integers
   * widen to reals; nothing narrows.
   */
  public boolean isAssignableFrom(final ExpressionType source) {
    if (kind == Kind.ARRAY) {
      return source.kind == Kind.ARRAY && (source.base == null || base == null
          || base.erased().equals(source.base.erased())
          || (base.kind == Kind.REAL && source.base.kind == Kind.INT));
    }
    if (kind == Kind.REAL) {
      return source.isNumeric();
    }
    return kind == source.kind;
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, lowerBound, upperBound, base, capacity);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof ExpressionType)) {
      return false;
    }
    final ExpressionType other = (ExpressionType) obj;
    return kind == other.kind && capacity == other.capacity
        && Objects.equals(lowerBound, other.lowerBound)
        && Objects.equals(upperBound, other.upperBound) && Objects.equals(base, other.base);
  }

  @Override
  public String toString() {
    switch (kind) {
      case BOOL:
        return "bool";
      case REAL:
        return "real";
      case INT:
        return isBounded() ? "int[" + lowerBound + ".." + upperBound + "]" : "int";
      default:
        return (base == null ? "?" : base.toString()) + "[" + (capacity > 0 ? capacity : "") + "]";
    }
  }
}
