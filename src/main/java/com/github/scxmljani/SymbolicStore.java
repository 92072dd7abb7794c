package com.github.scxmljani;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.github.scxmljani.CompilerException.Code;

/**
 * Values written so far by a microstep, in terms of the values the variables had before the step.
 * Used to rewrite branch conditions of {@code <if>} blocks so that they can be evaluated as part
 * of the edge guard, ahead of the assignments.
 */
final class SymbolicStore {
  private final Map<String, Expression> scalars;
  private final Map<String, ArrayValue> arrays;

  SymbolicStore() {
    this.scalars = new HashMap<>();
    this.arrays = new HashMap<>();
  }

  private SymbolicStore(final SymbolicStore other) {
    this.scalars = new HashMap<>(other.scalars);
    this.arrays = new HashMap<>();
    for (Map.Entry<String, ArrayValue> entry : other.arrays.entrySet()) {
      arrays.put(entry.getKey(), new ArrayValue(entry.getValue()));
    }
  }

  SymbolicStore copy() {
    return new SymbolicStore(this);
  }

  boolean isEmpty() {
    return scalars.isEmpty() && arrays.isEmpty();
  }

  /**
   * Records {@code target := value}, where value is in source terms of the current step.
   */
  void assign(final String target, final Expression value, final boolean array)
      throws CompilerException {
    final Expression current = substitute(value);
    if (!array) {
      scalars.put(target, current);
      return;
    }
    final ArrayValue assigned = new ArrayValue();
    if (current instanceof Expression.ArrayLiteral) {
      assigned.whole = current;
      assigned.length =
          Expression.literal((long) ((Expression.ArrayLiteral) current).getElements().size());
    } else if (current instanceof Expression.VariableRef) {
      assigned.whole = current;
      assigned.length =
          Expression.variable(((Expression.VariableRef) current).getName() + Scope.lengthSuffix);
    } else {
      throw new CompilerException(Code.UNSUPPORTED_CONSTRUCT,
          "Unsupported expression construct computed array value '" + value + "'");
    }
    arrays.put(target, assigned);
  }

  /**
   * Records {@code target[index] := value}; the length grows to cover the index.
   */
  void assignElement(final String target, final Expression index, final Expression value)
      throws CompilerException {
    final Expression position = substitute(index);
    final Expression element = substitute(value);
    ArrayValue current = arrays.get(target);
    if (current == null) {
      current = new ArrayValue();
      arrays.put(target, current);
    }
    final Expression length = current.length != null ? current.length
        : Expression.variable(target + Scope.lengthSuffix);
    current.length = Expressions.fold(Expression.conditional(
        Expression.binary(Operator.GREATER, length, position), length,
        Expression.binary(Operator.ADD, position, Expression.literal(1L))));
    current.writes.add(new Expression[] {position, element});
  }

  /**
   * Rewrites the expression in terms of the values before the step.
   */
  Expression substitute(final Expression expression) throws CompilerException {
    if (isEmpty()) {
      return expression;
    }
    switch (expression.getKind()) {
      case VARIABLE:
        return substituteVariable((Expression.VariableRef) expression);
      case INDEX: {
        final Expression.Index index = (Expression.Index) expression;
        final Expression position = substitute(index.getPosition());
        if (index.getArray() instanceof Expression.VariableRef) {
          return readElement(((Expression.VariableRef) index.getArray()).getName(), position);
        }
        return Expression.index(substitute(index.getArray()), position);
      }
      case UNARY: {
        final Expression.UnaryOp unary = (Expression.UnaryOp) expression;
        return Expression.unary(unary.getOperator(), substitute(unary.getOperand()));
      }
      case BINARY: {
        final Expression.BinaryOp binary = (Expression.BinaryOp) expression;
        return Expression.binary(binary.getOperator(), substitute(binary.getLeft()),
            substitute(binary.getRight()));
      }
      case CONDITIONAL: {
        final Expression.Conditional conditional = (Expression.Conditional) expression;
        return Expression.conditional(substitute(conditional.getCondition()),
            substitute(conditional.getWhenTrue()), substitute(conditional.getWhenFalse()));
      }
      case ARRAY: {
        final List<Expression> elements = new ArrayList<>();
        for (Expression element : ((Expression.ArrayLiteral) expression).getElements()) {
          elements.add(substitute(element));
        }
        return Expression.array(elements);
      }
      case CALL: {
        final Expression.Call call = (Expression.Call) expression;
        final List<Expression> arguments = new ArrayList<>();
        for (Expression argument : call.getArguments()) {
          arguments.add(substitute(argument));
        }
        return Expression.call(call.getFunction(), arguments);
      }
      default:
        return expression;
    }
  }

  private Expression substituteVariable(final Expression.VariableRef variable)
      throws CompilerException {
    final String name = variable.getName();
    final Expression scalar = scalars.get(name);
    if (scalar != null) {
      return scalar;
    }
    if (name.endsWith(Scope.lengthSuffix)) {
      final ArrayValue array =
          arrays.get(name.substring(0, name.length() - Scope.lengthSuffix.length()));
      if (array != null && array.length != null) {
        return array.length;
      }
    }
    final ArrayValue array = arrays.get(name);
    if (array != null) {
      if (!array.writes.isEmpty()) {
        throw new CompilerException(Code.UNSUPPORTED_CONSTRUCT, "Unsupported expression "
            + "construct whole array '" + name + "' read after an element assignment");
      }
      return array.whole;
    }
    return variable;
  }

  private Expression readElement(final String name, final Expression position)
      throws CompilerException {
    final ArrayValue array = arrays.get(name);
    if (array == null) {
      return Expression.index(Expression.variable(name), position);
    }
    Expression value;
    if (array.whole instanceof Expression.ArrayLiteral) {
      value = select(((Expression.ArrayLiteral) array.whole).getElements(), position);
    } else if (array.whole != null) {
      value = Expression.index(array.whole, position);
    } else {
      value = Expression.index(Expression.variable(name), position);
    }
    for (Expression[] write : array.writes) {
      value = Expressions.fold(Expression.conditional(
          Expression.binary(Operator.EQUAL, position, write[0]), write[1], value));
    }
    return value;
  }

  // reads past the end are undefined, they yield the last element
  private static Expression select(final List<Expression> elements, final Expression position)
      throws CompilerException {
    if (elements.isEmpty()) {
      throw new CompilerException(Code.UNSUPPORTED_CONSTRUCT,
          "Unsupported expression construct element read of an empty array literal");
    }
    if (position instanceof Expression.Literal
        && ((Expression.Literal) position).getValue() instanceof Long) {
      final long index = (Long) ((Expression.Literal) position).getValue();
      if (index >= 0 && index < elements.size()) {
        return elements.get((int) index);
      }
      return elements.get(elements.size() - 1);
    }
    Expression value = elements.get(elements.size() - 1);
    for (int i = elements.size() - 2; i >= 0; i--) {
      value = Expression.conditional(
          Expression.binary(Operator.EQUAL, position, Expression.literal((long) i)),
          elements.get(i), value);
    }
    return Expressions.fold(value);
  }

  private static final class ArrayValue {
    // array literal or another array variable, null while only elements were written
    private Expression whole;
    private Expression length;
    private final List<Expression[]> writes = new ArrayList<>();

    private ArrayValue() {}

    private ArrayValue(final ArrayValue other) {
      this.whole = other.whole;
      this.length = other.length;
      this.writes.addAll(other.writes);
    }
  }
}
