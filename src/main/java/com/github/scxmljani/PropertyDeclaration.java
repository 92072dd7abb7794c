package com.github.scxmljani;

/**
 * Reachability property over the network: the maximal or minimal probability of eventually
 * reaching a state where the goal holds, starting from the initial state.
 */
public final class PropertyDeclaration {
  private final String name;
  private final String goal;
  private final Kind kind;

  public PropertyDeclaration(final String name, final String goal, final Kind kind) {
    this.name = name;
    this.goal = goal;
    this.kind = kind;
  }

  public String getName() {
    return name;
  }

  /**
   * Goal condition as written, over network-wide variable names.
   */
  public String getGoal() {
    return goal;
  }

  public Kind getKind() {
    return kind;
  }

  @Override
  public String toString() {
    return "PropertyDeclaration [name=" + name + ", kind=" + kind + ", goal=" + goal + "]";
  }

  public static enum Kind {
    PMAX("Pmax"), PMIN("Pmin");

    private final String janiName;

    private Kind(final String janiName) {
      this.janiName = janiName;
    }

    public String getJaniName() {
      return janiName;
    }

    public static Kind parse(final String text) throws CompilerException {
      for (Kind kind : values()) {
        if (kind.janiName.equalsIgnoreCase(text) || kind.name().equalsIgnoreCase(text)) {
          return kind;
        }
      }
      throw new CompilerException(CompilerException.Code.STRUCTURAL_VALIDITY,
          "Unknown property kind '" + text + "', expected Pmax or Pmin");
    }
  }
}
