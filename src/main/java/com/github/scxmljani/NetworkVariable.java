package com.github.scxmljani;

/**
 * One variable of the composed network, under its network-wide name. Every variable is global in
 * the emitted model; automaton locals are told apart by their {@code <automaton>.} prefix.
 */
public final class NetworkVariable {
  private final String name;
  private final ExpressionType type;
  // closed constant, array values padded to the capacity of the type
  private final Expression initialValue;

  NetworkVariable(final String name, final ExpressionType type, final Expression initialValue) {
    this.name = name;
    this.type = type;
    this.initialValue = initialValue;
  }

  public String getName() {
    return name;
  }

  public ExpressionType getType() {
    return type;
  }

  public Expression getInitialValue() {
    return initialValue;
  }

  @Override
  public String toString() {
    return "NetworkVariable [name=" + name + ", type=" + type + ", initialValue=" + initialValue
        + "]";
  }
}
