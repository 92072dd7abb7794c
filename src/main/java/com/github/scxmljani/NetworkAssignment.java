package com.github.scxmljani;

/**
 * {@code target := value} or {@code target[index] := value} over network-wide names. Assignments
 * of one destination with the same level happen simultaneously, levels run in ascending order.
 */
public final class NetworkAssignment {
  private final String target;
  private final Expression index;
  private final Expression value;
  private final int level;

  NetworkAssignment(final String target, final Expression index, final Expression value,
      final int level) {
    this.target = target;
    this.index = index;
    this.value = value;
    this.level = level;
  }

  public String getTarget() {
    return target;
  }

  /**
   * Element position for array element writes, null for whole variable writes.
   */
  public Expression getIndex() {
    return index;
  }

  public Expression getValue() {
    return value;
  }

  public int getLevel() {
    return level;
  }

  @Override
  public String toString() {
    return target + (index == null ? "" : "[" + index + "]") + " :=" + level + " " + value;
  }
}
