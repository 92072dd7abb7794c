package com.github.scxmljani;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.scxmljani.CompilerException.Code;

/**
 * Front door of the expression pipeline: parse, type check against a scope, rename into the
 * network namespace, and lower to the JANI expression algebra.
 *
 * Lowering expects a closed tree: In() must already be folded and Math.random() expanded,
 * otherwise the composer is broken and INTERNAL_CONSISTENCY is raised.
 */
public final class ExpressionTranslator implements Expression.Visitor<JsonNode> {
  private static final JsonNodeFactory nodes = JsonNodeFactory.instance;

  private static final ExpressionTranslator instance = new ExpressionTranslator();

  private ExpressionTranslator() {}

  /**
   * Parses and type checks a boolean condition.
   */
  public static Expression translateCondition(final String text, final Scope scope)
      throws CompilerException {
    final Expression condition = ExpressionParser.parse(text);
    ExpressionTypeChecker.checkCondition(condition, scope);
    return condition;
  }

  /**
   * Rewrites every reference into its network-wide name and expands comparisons between arrays.
   * The result only refers to qualified names and is no longer checkable against the scope.
   */
  public static Expression qualify(final Expression expression, final Scope scope,
      final int maxArraySize) throws CompilerException {
    final Expression expanded = expandArrayComparisons(expression, scope, maxArraySize);
    return Expressions.rewrite(expanded, new Expressions.Rewrite() {
      @Override
      public Expression apply(Expression node) throws CompilerException {
        if (node instanceof Expression.VariableRef) {
          final String qualified =
              scope.resolve(((Expression.VariableRef) node).getName()).getQualifiedName();
          return new Expression.VariableRef(qualified, node.getColumn());
        }
        return node;
      }
    });
  }

  /**
   * Expands {@code a == [..]} and {@code a == b} over arrays into length and element checks.
   */
  static Expression expandArrayComparisons(final Expression expression, final Scope scope,
      final int maxArraySize) throws CompilerException {
    return Expressions.rewrite(expression, new Expressions.Rewrite() {
      @Override
      public Expression apply(Expression node) throws CompilerException {
        if (!(node instanceof Expression.BinaryOp)) {
          return node;
        }
        final Expression.BinaryOp binary = (Expression.BinaryOp) node;
        if (binary.getOperator().getCategory() != Operator.Category.EQUALITY) {
          return node;
        }
        final Expression left = binary.getLeft();
        final Expression right = binary.getRight();
        if (!isArrayValued(left, scope) && !isArrayValued(right, scope)) {
          return node;
        }
        final Expression equal = arrayEquality(left, right, scope, maxArraySize);
        return binary.getOperator() == Operator.EQUAL ? equal : Expressions.not(equal);
      }
    });
  }

  private static boolean isArrayValued(final Expression expression, final Scope scope)
      throws CompilerException {
    if (expression instanceof Expression.ArrayLiteral) {
      return true;
    }
    return expression instanceof Expression.VariableRef
        && scope.resolve(((Expression.VariableRef) expression).getName()).getType().isArray();
  }

  private static Expression arrayEquality(final Expression left, final Expression right,
      final Scope scope, final int maxArraySize) throws CompilerException {
    if (left instanceof Expression.ArrayLiteral && right instanceof Expression.ArrayLiteral) {
      return Expression.literal(left.equals(right));
    }
    if (left instanceof Expression.ArrayLiteral) {
      return arrayEquality(right, left, scope, maxArraySize);
    }
    if (!(left instanceof Expression.VariableRef)) {
      throw new CompilerException(Code.UNSUPPORTED_CONSTRUCT, "Unsupported expression construct "
          + "comparison of computed arrays at column " + left.getColumn());
    }
    final String name = ((Expression.VariableRef) left).getName();
    final Expression length = Expression.variable(name + Scope.lengthSuffix);
    final List<Expression> conjuncts = new ArrayList<>();
    if (right instanceof Expression.ArrayLiteral) {
      final List<Expression> elements = ((Expression.ArrayLiteral) right).getElements();
      conjuncts.add(Expression.binary(Operator.EQUAL, length,
          Expression.literal((long) elements.size())));
      for (int i = 0; i < elements.size(); i++) {
        conjuncts.add(Expression.binary(Operator.EQUAL,
            Expression.index(left, Expression.literal((long) i)), elements.get(i)));
      }
      return Expressions.and(conjuncts);
    }
    if (!(right instanceof Expression.VariableRef)) {
      throw new CompilerException(Code.UNSUPPORTED_CONSTRUCT, "Unsupported expression construct "
          + "comparison of computed arrays at column " + right.getColumn());
    }
    final String other = ((Expression.VariableRef) right).getName();
    conjuncts.add(Expression.binary(Operator.EQUAL, length,
        Expression.variable(other + Scope.lengthSuffix)));
    final int capacity = Math.min(capacityOf(name, scope, maxArraySize),
        capacityOf(other, scope, maxArraySize));
    for (int i = 0; i < capacity; i++) {
      final Expression position = Expression.literal((long) i);
      conjuncts.add(Expressions.or(
          Expression.binary(Operator.GREATER_EQUAL, position, length),
          Expression.binary(Operator.EQUAL, Expression.index(left, position),
              Expression.index(right, position))));
    }
    return Expressions.and(conjuncts);
  }

  private static int capacityOf(final String name, final Scope scope, final int maxArraySize)
      throws CompilerException {
    final int capacity = scope.resolve(name).getType().getCapacity();
    return capacity > 0 ? capacity : maxArraySize;
  }

  /**
   * Lowers a closed, qualified expression into JANI JSON.
   */
  public static JsonNode toJani(final Expression expression) throws CompilerException {
    return expression.accept(instance);
  }

  @Override
  public JsonNode visitLiteral(Expression.Literal literal) throws CompilerException {
    final Object value = literal.getValue();
    if (value instanceof Boolean) {
      return nodes.booleanNode((Boolean) value);
    }
    if (value instanceof Long) {
      return nodes.numberNode((Long) value);
    }
    if (value instanceof Double) {
      return nodes.numberNode((Double) value);
    }
    throw new CompilerException(Code.INTERNAL_CONSISTENCY,
        "Literal " + literal + " has no JANI representation");
  }

  @Override
  public JsonNode visitVariable(Expression.VariableRef variable) {
    return nodes.textNode(variable.getName());
  }

  @Override
  public JsonNode visitUnary(Expression.UnaryOp unary) throws CompilerException {
    final ObjectNode node = nodes.objectNode();
    if (unary.getOperator() == Operator.NOT) {
      node.put("op", Operator.NOT.getJaniSymbol());
      node.set("exp", unary.getOperand().accept(this));
      return node;
    }
    node.put("op", Operator.SUBTRACT.getJaniSymbol());
    node.put("left", 0);
    node.set("right", unary.getOperand().accept(this));
    return node;
  }

  @Override
  public JsonNode visitBinary(Expression.BinaryOp binary) throws CompilerException {
    final ObjectNode node = nodes.objectNode();
    node.put("op", binary.getOperator().getJaniSymbol());
    node.set("left", binary.getLeft().accept(this));
    node.set("right", binary.getRight().accept(this));
    return node;
  }

  @Override
  public JsonNode visitConditional(Expression.Conditional conditional)
      throws CompilerException {
    final ObjectNode node = nodes.objectNode();
    node.put("op", "ite");
    node.set("if", conditional.getCondition().accept(this));
    node.set("then", conditional.getWhenTrue().accept(this));
    node.set("else", conditional.getWhenFalse().accept(this));
    return node;
  }

  @Override
  public JsonNode visitIndex(Expression.Index index) throws CompilerException {
    final ObjectNode node = nodes.objectNode();
    node.put("op", "aa");
    node.set("exp", index.getArray().accept(this));
    node.set("index", index.getPosition().accept(this));
    return node;
  }

  @Override
  public JsonNode visitArray(Expression.ArrayLiteral array) throws CompilerException {
    final ObjectNode node = nodes.objectNode();
    node.put("op", "av");
    final ArrayNode elements = node.putArray("elements");
    for (Expression element : array.getElements()) {
      elements.add(element.accept(this));
    }
    return node;
  }

  @Override
  public JsonNode visitCall(Expression.Call call) throws CompilerException {
    final Operator.Function function = call.getFunction();
    if (function.getJaniSymbol() == null) {
      throw new CompilerException(Code.INTERNAL_CONSISTENCY,
          "Call " + call + " must be eliminated before lowering");
    }
    final ObjectNode node = nodes.objectNode();
    node.put("op", function.getJaniSymbol());
    final List<Expression> arguments = call.getArguments();
    if (function == Operator.Function.SQRT) {
      node.set("left", arguments.get(0).accept(this));
      node.put("right", 0.5d);
    } else if (function.getArity() == 2) {
      node.set("left", arguments.get(0).accept(this));
      node.set("right", arguments.get(1).accept(this));
    } else {
      node.set("exp", arguments.get(0).accept(this));
    }
    return node;
  }
}
