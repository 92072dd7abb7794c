package com.github.scxmljani;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Static helpers over expression trees: boolean connectives with constant folding, bottom-up
 * rewriting, substitution and free variable queries. Nothing here type checks.
 */
public final class Expressions {
  public static final Expression.Literal TRUE = Expression.literal(Boolean.TRUE);
  public static final Expression.Literal FALSE = Expression.literal(Boolean.FALSE);

  /**
   * Bottom-up rewrite step, applied to a node after its children have been rewritten.
   */
  public interface Rewrite {
    Expression apply(Expression expression) throws CompilerException;
  }

  private Expressions() {}

  public static boolean isTrue(final Expression expression) {
    return expression instanceof Expression.Literal
        && Boolean.TRUE.equals(((Expression.Literal) expression).getValue());
  }

  public static boolean isFalse(final Expression expression) {
    return expression instanceof Expression.Literal
        && Boolean.FALSE.equals(((Expression.Literal) expression).getValue());
  }

  public static Expression and(final Expression left, final Expression right) {
    if (left == null || isTrue(left)) {
      return right == null ? TRUE : right;
    }
    if (right == null || isTrue(right)) {
      return left;
    }
    if (isFalse(left) || isFalse(right)) {
      return FALSE;
    }
    return Expression.binary(Operator.AND, left, right);
  }

  public static Expression and(final List<Expression> conjuncts) {
    Expression result = TRUE;
    for (Expression conjunct : conjuncts) {
      result = and(result, conjunct);
    }
    return result;
  }

  public static Expression or(final Expression left, final Expression right) {
    if (isFalse(left)) {
      return right;
    }
    if (isFalse(right)) {
      return left;
    }
    if (isTrue(left) || isTrue(right)) {
      return TRUE;
    }
    return Expression.binary(Operator.OR, left, right);
  }

  public static Expression not(final Expression operand) {
    if (isTrue(operand)) {
      return FALSE;
    }
    if (isFalse(operand)) {
      return TRUE;
    }
    if (operand instanceof Expression.UnaryOp
        && ((Expression.UnaryOp) operand).getOperator() == Operator.NOT) {
      return ((Expression.UnaryOp) operand).getOperand();
    }
    return Expression.unary(Operator.NOT, operand);
  }

  /**
   * Rebuilds the tree bottom-up, handing every rebuilt node to the rewrite step. Untouched
   * subtrees are shared, not copied.
   */
  public static Expression rewrite(final Expression expression, final Rewrite rewrite)
      throws CompilerException {
    switch (expression.getKind()) {
      case UNARY: {
        final Expression.UnaryOp unary = (Expression.UnaryOp) expression;
        final Expression operand = rewrite(unary.getOperand(), rewrite);
        return rewrite.apply(operand == unary.getOperand() ? unary
            : new Expression.UnaryOp(unary.getOperator(), operand, unary.getColumn()));
      }
      case BINARY: {
        final Expression.BinaryOp binary = (Expression.BinaryOp) expression;
        final Expression left = rewrite(binary.getLeft(), rewrite);
        final Expression right = rewrite(binary.getRight(), rewrite);
        return rewrite.apply(left == binary.getLeft() && right == binary.getRight() ? binary
            : new Expression.BinaryOp(binary.getOperator(), left, right, binary.getColumn()));
      }
      case CONDITIONAL: {
        final Expression.Conditional conditional = (Expression.Conditional) expression;
        final Expression condition = rewrite(conditional.getCondition(), rewrite);
        final Expression whenTrue = rewrite(conditional.getWhenTrue(), rewrite);
        final Expression whenFalse = rewrite(conditional.getWhenFalse(), rewrite);
        if (condition == conditional.getCondition() && whenTrue == conditional.getWhenTrue()
            && whenFalse == conditional.getWhenFalse()) {
          return rewrite.apply(conditional);
        }
        return rewrite.apply(new Expression.Conditional(condition, whenTrue, whenFalse,
            conditional.getColumn()));
      }
      case INDEX: {
        final Expression.Index index = (Expression.Index) expression;
        final Expression array = rewrite(index.getArray(), rewrite);
        final Expression position = rewrite(index.getPosition(), rewrite);
        return rewrite.apply(array == index.getArray() && position == index.getPosition() ? index
            : new Expression.Index(array, position, index.getColumn()));
      }
      case ARRAY: {
        final Expression.ArrayLiteral literal = (Expression.ArrayLiteral) expression;
        final List<Expression> elements = rewriteAll(literal.getElements(), rewrite);
        return rewrite.apply(elements == null ? literal
            : new Expression.ArrayLiteral(elements, literal.getColumn()));
      }
      case CALL: {
        final Expression.Call call = (Expression.Call) expression;
        final List<Expression> arguments = rewriteAll(call.getArguments(), rewrite);
        return rewrite.apply(arguments == null ? call
            : new Expression.Call(call.getFunction(), arguments, call.getColumn()));
      }
      default:
        return rewrite.apply(expression);
    }
  }

  // null when nothing changed
  private static List<Expression> rewriteAll(final List<Expression> expressions,
      final Rewrite rewrite) throws CompilerException {
    final List<Expression> rewritten = new ArrayList<>(expressions.size());
    boolean changed = false;
    for (Expression expression : expressions) {
      final Expression result = rewrite(expression, rewrite);
      changed |= result != expression;
      rewritten.add(result);
    }
    return changed ? rewritten : null;
  }

  /**
   * Replaces variable references by the mapped expressions. Unmapped variables are kept.
   */
  public static Expression substitute(final Expression expression,
      final Map<String, Expression> values) throws CompilerException {
    if (values.isEmpty()) {
      return expression;
    }
    return rewrite(expression, new Rewrite() {
      @Override
      public Expression apply(Expression node) {
        if (node instanceof Expression.VariableRef) {
          final Expression value = values.get(((Expression.VariableRef) node).getName());
          if (value != null) {
            return value;
          }
        }
        return node;
      }
    });
  }

  /**
   * Renames every variable reference through the given mapping.
   */
  public static Expression rename(final Expression expression, final Map<String, String> names)
      throws CompilerException {
    return rewrite(expression, new Rewrite() {
      @Override
      public Expression apply(Expression node) {
        if (node instanceof Expression.VariableRef) {
          final String renamed = names.get(((Expression.VariableRef) node).getName());
          if (renamed != null) {
            return new Expression.VariableRef(renamed, node.getColumn());
          }
        }
        return node;
      }
    });
  }

  /**
   * Replaces In('id') by true or false according to the given set of active state ids, then
   * folds.
   */
  public static Expression foldIn(final Expression expression, final Set<String> activeStates)
      throws CompilerException {
    if (!containsCall(expression, Operator.Function.IN)) {
      return expression;
    }
    return fold(rewrite(expression, new Rewrite() {
      @Override
      public Expression apply(Expression node) {
        if (node instanceof Expression.Call
            && ((Expression.Call) node).getFunction() == Operator.Function.IN) {
          final Object stateId =
              ((Expression.Literal) ((Expression.Call) node).getArguments().get(0)).getValue();
          return activeStates.contains(stateId) ? TRUE : FALSE;
        }
        return node;
      }
    }));
  }

  /**
   * Constant folding of boolean connectives, comparisons and integer arithmetic over literals.
   */
  public static Expression fold(final Expression expression) throws CompilerException {
    return rewrite(expression, new Rewrite() {
      @Override
      public Expression apply(Expression node) {
        return foldNode(node);
      }
    });
  }

  private static Expression foldNode(final Expression node) {
    if (node instanceof Expression.UnaryOp) {
      final Expression.UnaryOp unary = (Expression.UnaryOp) node;
      if (unary.getOperator() == Operator.NOT) {
        return not(unary.getOperand());
      }
      if (unary.getOperand() instanceof Expression.Literal) {
        final Object value = ((Expression.Literal) unary.getOperand()).getValue();
        if (value instanceof Long) {
          return Expression.literal(-((Long) value));
        }
        if (value instanceof Double) {
          return Expression.literal(-((Double) value));
        }
      }
      return node;
    }
    if (node instanceof Expression.Conditional) {
      final Expression.Conditional conditional = (Expression.Conditional) node;
      if (isTrue(conditional.getCondition())) {
        return conditional.getWhenTrue();
      }
      if (isFalse(conditional.getCondition())) {
        return conditional.getWhenFalse();
      }
      return node;
    }
    if (!(node instanceof Expression.BinaryOp)) {
      return node;
    }
    final Expression.BinaryOp binary = (Expression.BinaryOp) node;
    final Expression left = binary.getLeft();
    final Expression right = binary.getRight();
    switch (binary.getOperator()) {
      case AND:
        return and(left, right);
      case OR:
        return or(left, right);
      default:
        break;
    }
    if (!(left instanceof Expression.Literal) || !(right instanceof Expression.Literal)) {
      return node;
    }
    final Object l = ((Expression.Literal) left).getValue();
    final Object r = ((Expression.Literal) right).getValue();
    switch (binary.getOperator()) {
      case EQUAL:
        return Expression.literal(literalEquals(l, r));
      case NOT_EQUAL:
        return Expression.literal(!literalEquals(l, r));
      default:
        break;
    }
    if (!(l instanceof Number) || !(r instanceof Number)) {
      return node;
    }
    final double ld = ((Number) l).doubleValue();
    final double rd = ((Number) r).doubleValue();
    switch (binary.getOperator()) {
      case LESS:
        return Expression.literal(ld < rd);
      case LESS_EQUAL:
        return Expression.literal(ld <= rd);
      case GREATER:
        return Expression.literal(ld > rd);
      case GREATER_EQUAL:
        return Expression.literal(ld >= rd);
      default:
        break;
    }
    if (l instanceof Long && r instanceof Long) {
      final long li = (Long) l;
      final long ri = (Long) r;
      switch (binary.getOperator()) {
        case ADD:
          return Expression.literal(li + ri);
        case SUBTRACT:
          return Expression.literal(li - ri);
        case MULTIPLY:
          return Expression.literal(li * ri);
        default:
          break;
      }
    }
    return node;
  }

  private static boolean literalEquals(final Object left, final Object right) {
    if (left instanceof Number && right instanceof Number) {
      return ((Number) left).doubleValue() == ((Number) right).doubleValue();
    }
    return left.equals(right);
  }

  /**
   * Names of all variables read by the expression, in first occurrence order.
   */
  public static Set<String> variablesRead(final Expression expression) throws CompilerException {
    final Set<String> names = new LinkedHashSet<>();
    rewrite(expression, new Rewrite() {
      @Override
      public Expression apply(Expression node) {
        if (node instanceof Expression.VariableRef) {
          names.add(((Expression.VariableRef) node).getName());
        }
        return node;
      }
    });
    return names;
  }

  public static boolean containsCall(final Expression expression,
      final Operator.Function function) {
    switch (expression.getKind()) {
      case CALL: {
        final Expression.Call call = (Expression.Call) expression;
        if (function == null || call.getFunction() == function) {
          return true;
        }
        return containsCall(call.getArguments(), function);
      }
      case UNARY:
        return containsCall(((Expression.UnaryOp) expression).getOperand(), function);
      case BINARY:
        return containsCall(((Expression.BinaryOp) expression).getLeft(), function)
            || containsCall(((Expression.BinaryOp) expression).getRight(), function);
      case CONDITIONAL: {
        final Expression.Conditional conditional = (Expression.Conditional) expression;
        return containsCall(conditional.getCondition(), function)
            || containsCall(conditional.getWhenTrue(), function)
            || containsCall(conditional.getWhenFalse(), function);
      }
      case INDEX:
        return containsCall(((Expression.Index) expression).getArray(), function)
            || containsCall(((Expression.Index) expression).getPosition(), function);
      case ARRAY:
        return containsCall(((Expression.ArrayLiteral) expression).getElements(), function);
      default:
        return false;
    }
  }

  private static boolean containsCall(final List<Expression> expressions,
      final Operator.Function function) {
    for (Expression expression : expressions) {
      if (containsCall(expression, function)) {
        return true;
      }
    }
    return false;
  }

  public static boolean containsTrigonometry(final Expression expression) {
    return containsCall(expression, Operator.Function.SIN)
        || containsCall(expression, Operator.Function.COS)
        || containsCall(expression, Operator.Function.TAN);
  }
}
