package com.github.scxmljani;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Composed network: flat automata over one shared variable namespace, the action labels they
 * synchronize on and the synchronization vectors. This is what gets emitted as a JANI model.
 */
public final class AutomataNetwork {
  private final String name;
  private final CompilerConfiguration.ModelType modelType;
  private final List<NetworkVariable> variables;
  private final List<NetworkAutomaton> automata;
  private final List<String> actions;
  private final List<SyncVector> syncVectors;
  private final List<Property> properties;

  AutomataNetwork(final String name, final CompilerConfiguration.ModelType modelType,
      final List<NetworkVariable> variables, final List<NetworkAutomaton> automata,
      final List<String> actions, final List<SyncVector> syncVectors,
      final List<Property> properties) {
    this.name = name;
    this.modelType = modelType;
    this.variables = Collections.unmodifiableList(new ArrayList<>(variables));
    this.automata = Collections.unmodifiableList(new ArrayList<>(automata));
    this.actions = Collections.unmodifiableList(new ArrayList<>(actions));
    this.syncVectors = Collections.unmodifiableList(new ArrayList<>(syncVectors));
    this.properties = Collections.unmodifiableList(new ArrayList<>(properties));
  }

  public String getName() {
    return name;
  }

  public CompilerConfiguration.ModelType getModelType() {
    return modelType;
  }

  public List<NetworkVariable> getVariables() {
    return variables;
  }

  public NetworkVariable findVariable(final String variableName) {
    for (NetworkVariable variable : variables) {
      if (variable.getName().equals(variableName)) {
        return variable;
      }
    }
    return null;
  }

  public List<NetworkAutomaton> getAutomata() {
    return automata;
  }

  public NetworkAutomaton findAutomaton(final String automatonName) {
    for (NetworkAutomaton automaton : automata) {
      if (automaton.getName().equals(automatonName)) {
        return automaton;
      }
    }
    return null;
  }

  public List<String> getActions() {
    return actions;
  }

  public List<SyncVector> getSyncVectors() {
    return syncVectors;
  }

  public List<Property> getProperties() {
    return properties;
  }

  @Override
  public String toString() {
    return "AutomataNetwork [name=" + name + ", automata=" + automata.size() + ", variables="
        + variables.size() + ", syncVectors=" + syncVectors.size() + "]";
  }

  /**
   * A property whose goal was checked against the network variables.
   */
  public static final class Property {
    private final String name;
    private final PropertyDeclaration.Kind kind;
    private final Expression goal;

    Property(final String name, final PropertyDeclaration.Kind kind, final Expression goal) {
      this.name = name;
      this.kind = kind;
      this.goal = goal;
    }

    public String getName() {
      return name;
    }

    public PropertyDeclaration.Kind getKind() {
      return kind;
    }

    public Expression getGoal() {
      return goal;
    }
  }
}
