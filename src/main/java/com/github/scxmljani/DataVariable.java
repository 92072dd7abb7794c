package com.github.scxmljani;

import java.util.Collections;

/**
 * Immutable declaration of a data variable, either local to one automaton or global to the
 * network. The initial expression is parsed but not yet checked.
 */
public final class DataVariable {
  private final String id;
  private final ExpressionType type;
  // optional, defaults to the zero value of the type
  private final Expression initialValue;

  public DataVariable(final String id, final ExpressionType type,
      final Expression initialValue) {
    this.id = id;
    this.type = type;
    this.initialValue = initialValue;
  }

  public String getId() {
    return id;
  }

  public ExpressionType getType() {
    return type;
  }

  public Expression getInitialValue() {
    return initialValue;
  }

  /**
   * Initial value, or the zero value of the type when none was declared.
   */
  public Expression getInitialValueOrDefault() {
    if (initialValue != null) {
      return initialValue;
    }
    return defaultValue(type);
  }

  public static Expression defaultValue(final ExpressionType type) {
    switch (type.getKind()) {
      case BOOL:
        return Expressions.FALSE;
      case REAL:
        return Expression.literal(0.0d);
      case ARRAY:
        return Expression.array(Collections.<Expression>emptyList());
      default:
        if (type.getLowerBound() != null && type.getLowerBound() > 0) {
          return Expression.literal(type.getLowerBound());
        }
        return Expression.literal(0L);
    }
  }

  @Override
  public String toString() {
    return "DataVariable [id=" + id + ", type=" + type + ", initialValue=" + initialValue + "]";
  }
}
