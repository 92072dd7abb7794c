package com.github.scxmljani;

import com.github.scxmljani.CompilerException.Code;

/**
 * Eager, single-pass type checker. Numeric operands widen int to real, {@code /} always yields a
 * real and nothing is ever coerced between booleans and numbers.
 */
public final class ExpressionTypeChecker implements Expression.Visitor<ExpressionType> {
  private final Scope scope;
  private final boolean randomAllowed;

  private ExpressionTypeChecker(final Scope scope, final boolean randomAllowed) {
    this.scope = scope;
    this.randomAllowed = randomAllowed;
  }

  /**
   * Type of a condition or value expression. Math.random() is rejected.
   */
  public static ExpressionType check(final Expression expression, final Scope scope)
      throws CompilerException {
    return expression.accept(new ExpressionTypeChecker(scope, false));
  }

  /**
   * Type of the right-hand side of an assignment, where Math.random() is allowed.
   */
  public static ExpressionType checkAssigned(final Expression expression, final Scope scope)
      throws CompilerException {
    return expression.accept(new ExpressionTypeChecker(scope, true));
  }

  public static void checkCondition(final Expression expression, final Scope scope)
      throws CompilerException {
    final ExpressionType type = check(expression, scope);
    if (!type.isBool()) {
      throw mismatch("condition '" + expression + "' is " + type + ", expected bool",
          expression);
    }
  }

  /**
   * Checks that {@code value} may be stored into {@code target}; reals never narrow into ints.
   */
  public static void checkAssignable(final ExpressionType target, final Expression value,
      final Scope scope) throws CompilerException {
    final ExpressionType type = checkAssigned(value, scope);
    if (!target.isAssignableFrom(type)) {
      throw mismatch("cannot assign " + type + " value '" + value + "' to " + target, value);
    }
  }

  @Override
  public ExpressionType visitLiteral(Expression.Literal literal) throws CompilerException {
    if (literal.isBoolean()) {
      return ExpressionType.BOOL;
    }
    if (literal.isInteger()) {
      return ExpressionType.INT;
    }
    if (literal.isReal()) {
      return ExpressionType.REAL;
    }
    throw new CompilerException(Code.UNSUPPORTED_CONSTRUCT, "Unsupported expression construct "
        + "string literal " + literal + " at column " + literal.getColumn());
  }

  @Override
  public ExpressionType visitVariable(Expression.VariableRef variable) throws CompilerException {
    return scope.resolve(variable.getName()).getType();
  }

  @Override
  public ExpressionType visitUnary(Expression.UnaryOp unary) throws CompilerException {
    final ExpressionType operand = unary.getOperand().accept(this);
    if (unary.getOperator() == Operator.NOT) {
      if (!operand.isBool()) {
        throw mismatch("operand of '!' is " + operand, unary);
      }
      return ExpressionType.BOOL;
    }
    if (!operand.isNumeric()) {
      throw mismatch(operand + " operand of unary '-'", unary);
    }
    return operand.erased();
  }

  @Override
  public ExpressionType visitBinary(Expression.BinaryOp binary) throws CompilerException {
    final ExpressionType left = binary.getLeft().accept(this);
    final ExpressionType right = binary.getRight().accept(this);
    final Operator operator = binary.getOperator();
    switch (operator.getCategory()) {
      case LOGICAL:
        if (!left.isBool() || !right.isBool()) {
          throw mismatch("operands of '" + operator.getSymbol() + "' are " + left + " and "
              + right + ", expected bool", binary);
        }
        return ExpressionType.BOOL;
      case COMPARISON:
        requireNumeric(operator, left, right, binary);
        return ExpressionType.BOOL;
      case EQUALITY:
        if ((left.isNumeric() && right.isNumeric()) || (left.isBool() && right.isBool())
            || (left.isArray() && right.isArray() && (left.isAssignableFrom(right)
                || right.isAssignableFrom(left)))) {
          return ExpressionType.BOOL;
        }
        throw mismatch("cannot compare " + left + " with " + right, binary);
      default:
        requireNumeric(operator, left, right, binary);
        if (operator == Operator.DIVIDE || operator == Operator.MODULO) {
          rejectConstantZero(binary);
        }
        if (operator == Operator.DIVIDE) {
          return ExpressionType.REAL;
        }
        return ExpressionType.widen(left, right);
    }
  }

  private static void requireNumeric(final Operator operator, final ExpressionType left,
      final ExpressionType right, final Expression node) throws CompilerException {
    if (left.isBool() || right.isBool()) {
      throw mismatch("boolean in arithmetic position of '" + operator.getSymbol() + "'", node);
    }
    if (!left.isNumeric() || !right.isNumeric()) {
      throw mismatch("operands of '" + operator.getSymbol() + "' are " + left + " and " + right
          + ", expected numbers", node);
    }
  }

  private static void rejectConstantZero(final Expression.BinaryOp binary)
      throws CompilerException {
    final Expression divisor = Expressions.fold(binary.getRight());
    if (divisor instanceof Expression.Literal
        && ((Expression.Literal) divisor).getValue() instanceof Number
        && ((Number) ((Expression.Literal) divisor).getValue()).doubleValue() == 0.0d) {
      throw new CompilerException(Code.UNSUPPORTED_CONSTRUCT, "Division by constant zero in '"
          + binary + "' at column " + binary.getColumn());
    }
  }

  @Override
  public ExpressionType visitConditional(Expression.Conditional conditional)
      throws CompilerException {
    final ExpressionType condition = conditional.getCondition().accept(this);
    if (!condition.isBool()) {
      throw mismatch("condition of '?:' is " + condition, conditional);
    }
    final ExpressionType whenTrue = conditional.getWhenTrue().accept(this);
    final ExpressionType whenFalse = conditional.getWhenFalse().accept(this);
    if (whenTrue.isNumeric() && whenFalse.isNumeric()) {
      return ExpressionType.widen(whenTrue, whenFalse);
    }
    if (whenTrue.isBool() && whenFalse.isBool()) {
      return ExpressionType.BOOL;
    }
    throw mismatch("branches of '?:' are " + whenTrue + " and " + whenFalse, conditional);
  }

  @Override
  public ExpressionType visitIndex(Expression.Index index) throws CompilerException {
    final ExpressionType array = index.getArray().accept(this);
    if (!array.isArray() || array.getBase() == null) {
      throw mismatch("indexing a value of type " + array, index);
    }
    final ExpressionType position = index.getPosition().accept(this);
    if (position.getKind() != ExpressionType.Kind.INT) {
      throw mismatch("array index is " + position + ", expected int", index);
    }
    return array.getBase().erased();
  }

  @Override
  public ExpressionType visitArray(Expression.ArrayLiteral array) throws CompilerException {
    ExpressionType base = null;
    for (Expression element : array.getElements()) {
      final ExpressionType type = element.accept(this);
      if (type.isArray()) {
        throw new CompilerException(Code.UNSUPPORTED_CONSTRUCT,
            "Unsupported expression construct nested array at column " + element.getColumn());
      }
      if (base == null) {
        base = type;
      } else if (base.isNumeric() && type.isNumeric()) {
        base = ExpressionType.widen(base, type);
      } else if (base.getKind() != type.getKind()) {
        throw mismatch("array literal mixes " + base + " and " + type, array);
      }
    }
    return ExpressionType.arrayOf(base, 0);
  }

  @Override
  public ExpressionType visitCall(Expression.Call call) throws CompilerException {
    final Operator.Function function = call.getFunction();
    if (function == Operator.Function.IN) {
      return ExpressionType.BOOL;
    }
    if (function == Operator.Function.RANDOM) {
      if (!randomAllowed) {
        throw new CompilerException(Code.UNSUPPORTED_CONSTRUCT, "Unsupported expression construct "
            + "Math.random() outside the right-hand side of an assignment at column "
            + call.getColumn());
      }
      return ExpressionType.REAL;
    }
    ExpressionType widest = null;
    for (Expression argument : call.getArguments()) {
      final ExpressionType type = argument.accept(this);
      if (!type.isNumeric()) {
        throw mismatch(type + " argument of " + function.getSourceName(), call);
      }
      widest = widest == null ? type.erased() : ExpressionType.widen(widest, type);
    }
    switch (function) {
      case ABS:
      case MIN:
      case MAX:
        return widest;
      case FLOOR:
      case CEIL:
        return ExpressionType.INT;
      default:
        return ExpressionType.REAL;
    }
  }

  private static CompilerException mismatch(final String message, final Expression node) {
    return new CompilerException(Code.UNSUPPORTED_CONSTRUCT,
        "Type mismatch: " + message + (node.getColumn() > 0 ? " at column " + node.getColumn() : ""));
  }
}
