package com.github.scxmljani;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Closed expression tree of the scripting subset. Nodes are immutable and compare structurally.
 * The column is the 1-based source position of the node, -1 for nodes made up by the compiler.
 */
public abstract class Expression {
  private final int column;

  public static enum Kind {
    LITERAL, VARIABLE, UNARY, BINARY, CONDITIONAL, INDEX, ARRAY, CALL;
  }

  private Expression(final int column) {
    this.column = column;
  }

  public int getColumn() {
    return column;
  }

  public abstract Kind getKind();

  public abstract <R> R accept(Visitor<R> visitor) throws CompilerException;

  public interface Visitor<R> {
    R visitLiteral(Literal literal) throws CompilerException;

    R visitVariable(VariableRef variable) throws CompilerException;

    R visitUnary(UnaryOp unary) throws CompilerException;

    R visitBinary(BinaryOp binary) throws CompilerException;

    R visitConditional(Conditional conditional) throws CompilerException;

    R visitIndex(Index index) throws CompilerException;

    R visitArray(ArrayLiteral array) throws CompilerException;

    R visitCall(Call call) throws CompilerException;
  }

  public static Literal literal(final Object value) {
    return new Literal(value, -1);
  }

  public static VariableRef variable(final String name) {
    return new VariableRef(name, -1);
  }

  public static UnaryOp unary(final Operator operator, final Expression operand) {
    return new UnaryOp(operator, operand, -1);
  }

  public static BinaryOp binary(final Operator operator, final Expression left,
      final Expression right) {
    return new BinaryOp(operator, left, right, -1);
  }

  public static Conditional conditional(final Expression condition, final Expression whenTrue,
      final Expression whenFalse) {
    return new Conditional(condition, whenTrue, whenFalse, -1);
  }

  public static Index index(final Expression array, final Expression position) {
    return new Index(array, position, -1);
  }

  public static ArrayLiteral array(final List<Expression> elements) {
    return new ArrayLiteral(elements, -1);
  }

  public static Call call(final Operator.Function function, final List<Expression> arguments) {
    return new Call(function, arguments, -1);
  }

  /**
   * Boolean, Long or Double constant. Strings only occur as the argument of In().
   */
  public static final class Literal extends Expression {
    private final Object value;

    Literal(final Object value, final int column) {
      super(column);
      if (value instanceof Integer) {
        this.value = Long.valueOf((Integer) value);
      } else if (value instanceof Float) {
        this.value = Double.valueOf((Float) value);
      } else {
        this.value = value;
      }
    }

    public Object getValue() {
      return value;
    }

    public boolean isBoolean() {
      return value instanceof Boolean;
    }

    public boolean isInteger() {
      return value instanceof Long;
    }

    public boolean isReal() {
      return value instanceof Double;
    }

    public boolean isString() {
      return value instanceof String;
    }

    @Override
    public Kind getKind() {
      return Kind.LITERAL;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) throws CompilerException {
      return visitor.visitLiteral(this);
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(value);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Literal && Objects.equals(value, ((Literal) obj).value);
    }

    @Override
    public String toString() {
      return isString() ? "'" + value + "'" : String.valueOf(value);
    }
  }

  /**
   * Reference to a variable by its (possibly dotted) name, eg. x, _event.data.speed or A.x.
   */
  public static final class VariableRef extends Expression {
    private final String name;

    VariableRef(final String name, final int column) {
      super(column);
      this.name = name;
    }

    public String getName() {
      return name;
    }

    @Override
    public Kind getKind() {
      return Kind.VARIABLE;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) throws CompilerException {
      return visitor.visitVariable(this);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof VariableRef && name.equals(((VariableRef) obj).name);
    }

    @Override
    public String toString() {
      return name;
    }
  }

  public static final class UnaryOp extends Expression {
    private final Operator operator;
    private final Expression operand;

    UnaryOp(final Operator operator, final Expression operand, final int column) {
      super(column);
      this.operator = operator;
      this.operand = operand;
    }

    public Operator getOperator() {
      return operator;
    }

    public Expression getOperand() {
      return operand;
    }

    @Override
    public Kind getKind() {
      return Kind.UNARY;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) throws CompilerException {
      return visitor.visitUnary(this);
    }

    @Override
    public int hashCode() {
      return Objects.hash(operator, operand);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof UnaryOp)) {
        return false;
      }
      final UnaryOp other = (UnaryOp) obj;
      return operator == other.operator && operand.equals(other.operand);
    }

    @Override
    public String toString() {
      return operator.getSymbol() + "(" + operand + ")";
    }
  }

  public static final class BinaryOp extends Expression {
    private final Operator operator;
    private final Expression left;
    private final Expression right;

    BinaryOp(final Operator operator, final Expression left, final Expression right,
        final int column) {
      super(column);
      this.operator = operator;
      this.left = left;
      this.right = right;
    }

    public Operator getOperator() {
      return operator;
    }

    public Expression getLeft() {
      return left;
    }

    public Expression getRight() {
      return right;
    }

    @Override
    public Kind getKind() {
      return Kind.BINARY;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) throws CompilerException {
      return visitor.visitBinary(this);
    }

    @Override
    public int hashCode() {
      return Objects.hash(operator, left, right);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof BinaryOp)) {
        return false;
      }
      final BinaryOp other = (BinaryOp) obj;
      return operator == other.operator && left.equals(other.left) && right.equals(other.right);
    }

    @Override
    public String toString() {
      return "(" + left + " " + operator.getSymbol() + " " + right + ")";
    }
  }

  public static final class Conditional extends Expression {
    private final Expression condition;
    private final Expression whenTrue;
    private final Expression whenFalse;

    Conditional(final Expression condition, final Expression whenTrue, final Expression whenFalse,
        final int column) {
      super(column);
      this.condition = condition;
      this.whenTrue = whenTrue;
      this.whenFalse = whenFalse;
    }

    public Expression getCondition() {
      return condition;
    }

    public Expression getWhenTrue() {
      return whenTrue;
    }

    public Expression getWhenFalse() {
      return whenFalse;
    }

    @Override
    public Kind getKind() {
      return Kind.CONDITIONAL;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) throws CompilerException {
      return visitor.visitConditional(this);
    }

    @Override
    public int hashCode() {
      return Objects.hash(condition, whenTrue, whenFalse);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Conditional)) {
        return false;
      }
      final Conditional other = (Conditional) obj;
      return condition.equals(other.condition) && whenTrue.equals(other.whenTrue)
          && whenFalse.equals(other.whenFalse);
    }

    @Override
    public String toString() {
      return "(" + condition + " ? " + whenTrue + " : " + whenFalse + ")";
    }
  }

  public static final class Index extends Expression {
    private final Expression array;
    private final Expression position;

    Index(final Expression array, final Expression position, final int column) {
      super(column);
      this.array = array;
      this.position = position;
    }

    public Expression getArray() {
      return array;
    }

    public Expression getPosition() {
      return position;
    }

    @Override
    public Kind getKind() {
      return Kind.INDEX;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) throws CompilerException {
      return visitor.visitIndex(this);
    }

    @Override
    public int hashCode() {
      return Objects.hash(array, position);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Index)) {
        return false;
      }
      final Index other = (Index) obj;
      return array.equals(other.array) && position.equals(other.position);
    }

    @Override
    public String toString() {
      return array + "[" + position + "]";
    }
  }

  public static final class ArrayLiteral extends Expression {
    private final List<Expression> elements;

    ArrayLiteral(final List<Expression> elements, final int column) {
      super(column);
      this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
    }

    public List<Expression> getElements() {
      return elements;
    }

    @Override
    public Kind getKind() {
      return Kind.ARRAY;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) throws CompilerException {
      return visitor.visitArray(this);
    }

    @Override
    public int hashCode() {
      return elements.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof ArrayLiteral && elements.equals(((ArrayLiteral) obj).elements);
    }

    @Override
    public String toString() {
      return elements.toString();
    }
  }

  public static final class Call extends Expression {
    private final Operator.Function function;
    private final List<Expression> arguments;

    Call(final Operator.Function function, final List<Expression> arguments, final int column) {
      super(column);
      this.function = function;
      this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
    }

    public Operator.Function getFunction() {
      return function;
    }

    public List<Expression> getArguments() {
      return arguments;
    }

    @Override
    public Kind getKind() {
      return Kind.CALL;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) throws CompilerException {
      return visitor.visitCall(this);
    }

    @Override
    public int hashCode() {
      return Objects.hash(function, arguments);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Call)) {
        return false;
      }
      final Call other = (Call) obj;
      return function == other.function && arguments.equals(other.arguments);
    }

    @Override
    public String toString() {
      final StringBuilder builder = new StringBuilder(function.getSourceName()).append('(');
      for (int i = 0; i < arguments.size(); i++) {
        if (i > 0) {
          builder.append(", ");
        }
        builder.append(arguments.get(i));
      }
      return builder.append(')').toString();
    }
  }
}
