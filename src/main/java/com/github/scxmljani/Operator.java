package com.github.scxmljani;

/**
 * Fixed operator mapping table between the scripting subset and the JANI expression algebra.
 * Precedence follows ECMAScript, higher binds tighter.
 */
public enum Operator {
  NOT("!", "¬", Category.LOGICAL, 0),
  NEGATE("-", "-", Category.ARITHMETIC, 0),

  MULTIPLY("*", "*", Category.ARITHMETIC, 12),
  DIVIDE("/", "/", Category.ARITHMETIC, 12),
  MODULO("%", "%", Category.ARITHMETIC, 12),
  ADD("+", "+", Category.ARITHMETIC, 11),
  SUBTRACT("-", "-", Category.ARITHMETIC, 11),
  LESS("<", "<", Category.COMPARISON, 9),
  LESS_EQUAL("<=", "≤", Category.COMPARISON, 9),
  GREATER(">", ">", Category.COMPARISON, 9),
  GREATER_EQUAL(">=", "≥", Category.COMPARISON, 9),
  EQUAL("==", "=", Category.EQUALITY, 8),
  NOT_EQUAL("!=", "≠", Category.EQUALITY, 8),
  AND("&&", "∧", Category.LOGICAL, 4),
  OR("||", "∨", Category.LOGICAL, 3);

  public static enum Category {
    ARITHMETIC, COMPARISON, EQUALITY, LOGICAL;
  }

  private final String symbol;
  private final String janiSymbol;
  private final Category category;
  private final int precedence;

  private Operator(final String symbol, final String janiSymbol, final Category category,
      final int precedence) {
    this.symbol = symbol;
    this.janiSymbol = janiSymbol;
    this.category = category;
    this.precedence = precedence;
  }

  public String getSymbol() {
    return symbol;
  }

  public String getJaniSymbol() {
    return janiSymbol;
  }

  public Category getCategory() {
    return category;
  }

  public int getPrecedence() {
    return precedence;
  }

  public boolean isUnary() {
    return precedence == 0;
  }

  /**
   * Binary operator for a source token, null if the token is not a binary operator. The strict
   * equality operators are treated like the loose ones since the subset has no type coercion.
   */
  public static Operator binary(final String token) {
    switch (token) {
      case "===":
        return EQUAL;
      case "!==":
        return NOT_EQUAL;
      default:
        for (Operator operator : values()) {
          if (!operator.isUnary() && operator.symbol.equals(token)) {
            return operator;
          }
        }
        return null;
    }
  }

  /**
   * Math functions of the subset, with their JANI counterpart. SQRT has none and is lowered to a
   * power, RANDOM is expanded into probabilistic destinations and IN is folded against the
   * active configuration before lowering.
   */
  public static enum Function {
    ABS("Math.abs", "abs", 1),
    FLOOR("Math.floor", "floor", 1),
    CEIL("Math.ceil", "ceil", 1),
    MIN("Math.min", "min", 2),
    MAX("Math.max", "max", 2),
    POW("Math.pow", "pow", 2),
    SQRT("Math.sqrt", "pow", 1),
    SIN("Math.sin", "sin", 1),
    COS("Math.cos", "cos", 1),
    TAN("Math.tan", "tan", 1),
    RANDOM("Math.random", null, 0),
    IN("In", null, 1);

    private final String sourceName;
    private final String janiSymbol;
    private final int arity;

    private Function(final String sourceName, final String janiSymbol, final int arity) {
      this.sourceName = sourceName;
      this.janiSymbol = janiSymbol;
      this.arity = arity;
    }

    public String getSourceName() {
      return sourceName;
    }

    public String getJaniSymbol() {
      return janiSymbol;
    }

    public int getArity() {
      return arity;
    }

    public boolean isTrigonometric() {
      return this == SIN || this == COS || this == TAN;
    }

    public static Function bySourceName(final String name) {
      for (Function function : values()) {
        if (function.sourceName.equals(name)) {
          return function;
        }
      }
      return null;
    }
  }
}
