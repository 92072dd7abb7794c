package com.github.scxmljani;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.w3c.dom.Document;

/**
 * Everything one compilation needs: the statechart instances, an optional behavior tree with its
 * leaf plugins, network-wide variables and the properties to check. Built programmatically or
 * read from a file by {@link NetworkDescriptionParser}.
 */
public final class NetworkDescription {
  private final String name;
  private final Integer maxArraySize;
  private final List<DataVariable> globals;
  private final List<AutomatonInstance> automata;
  private final BehaviorTreeInput behaviorTree;
  private final List<PropertyDeclaration> properties;

  private NetworkDescription(final String name, final Integer maxArraySize,
      final List<DataVariable> globals, final List<AutomatonInstance> automata,
      final BehaviorTreeInput behaviorTree, final List<PropertyDeclaration> properties) {
    this.name = name;
    this.maxArraySize = maxArraySize;
    this.globals = Collections.unmodifiableList(globals);
    this.automata = Collections.unmodifiableList(automata);
    this.behaviorTree = behaviorTree;
    this.properties = Collections.unmodifiableList(properties);
  }

  public String getName() {
    return name;
  }

  /**
   * Array capacity overriding the compiler configuration, null when not set.
   */
  public Integer getMaxArraySize() {
    return maxArraySize;
  }

  public List<DataVariable> getGlobals() {
    return globals;
  }

  public List<AutomatonInstance> getAutomata() {
    return automata;
  }

  public BehaviorTreeInput getBehaviorTree() {
    return behaviorTree;
  }

  public List<PropertyDeclaration> getProperties() {
    return properties;
  }

  @Override
  public String toString() {
    return "NetworkDescription [name=" + name + ", maxArraySize=" + maxArraySize + ", globals="
        + globals.size() + ", automata=" + automata + ", behaviorTree=" + behaviorTree
        + ", properties=" + properties.size() + "]";
  }

  /**
   * One statechart document instantiated under a name, with data variable overrides.
   */
  public static final class AutomatonInstance {
    private final StatechartDocument document;
    private final String id;
    private final Map<String, String> parameters;

    public AutomatonInstance(final StatechartDocument document, final String id,
        final Map<String, String> parameters) {
      this.document = document;
      this.id = id;
      this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public StatechartDocument getDocument() {
      return document;
    }

    /**
     * Instance name, null to use the name the document declares.
     */
    public String getId() {
      return id;
    }

    public Map<String, String> getParameters() {
      return parameters;
    }

    @Override
    public String toString() {
      return "AutomatonInstance [id=" + id + ", document=" + document.getId() + "]";
    }
  }

  public static final class BehaviorTreeInput {
    private final String id;
    private final Document document;
    private final List<StatechartDocument> plugins;

    public BehaviorTreeInput(final String id, final Document document,
        final List<StatechartDocument> plugins) {
      this.id = id;
      this.document = document;
      this.plugins = Collections.unmodifiableList(new ArrayList<>(plugins));
    }

    public String getId() {
      return id;
    }

    public Document getDocument() {
      return document;
    }

    public List<StatechartDocument> getPlugins() {
      return plugins;
    }

    @Override
    public String toString() {
      return "BehaviorTreeInput [id=" + id + ", plugins=" + plugins.size() + "]";
    }
  }

  public final static class NetworkDescriptionBuilder {
    private String name;
    private Integer maxArraySize;
    private final List<DataVariable> globals = new ArrayList<>();
    private final List<AutomatonInstance> automata = new ArrayList<>();
    private BehaviorTreeInput behaviorTree;
    private final List<PropertyDeclaration> properties = new ArrayList<>();

    public static NetworkDescriptionBuilder newBuilder() {
      return new NetworkDescriptionBuilder();
    }

    public NetworkDescriptionBuilder name(final String name) {
      this.name = name;
      return this;
    }

    public NetworkDescriptionBuilder maxArraySize(final int maxArraySize) {
      this.maxArraySize = maxArraySize;
      return this;
    }

    public NetworkDescriptionBuilder global(final DataVariable global) {
      this.globals.add(global);
      return this;
    }

    public NetworkDescriptionBuilder automaton(final StatechartDocument document) {
      return automaton(document, null, Collections.<String, String>emptyMap());
    }

    public NetworkDescriptionBuilder automaton(final StatechartDocument document, final String id,
        final Map<String, String> parameters) {
      this.automata.add(new AutomatonInstance(document, id, parameters));
      return this;
    }

    public NetworkDescriptionBuilder behaviorTree(final String id, final Document document,
        final List<StatechartDocument> plugins) {
      this.behaviorTree = new BehaviorTreeInput(id, document, plugins);
      return this;
    }

    public NetworkDescriptionBuilder property(final PropertyDeclaration property) {
      this.properties.add(property);
      return this;
    }

    public NetworkDescription build() throws CompilerException {
      final StringBuilder messages = new StringBuilder();
      if (name == null || name.trim().isEmpty()) {
        messages.append("Network name cannot be empty. ");
      }
      if (maxArraySize != null && maxArraySize <= 0) {
        messages.append("maxArraySize must be positive. ");
      }
      if (automata.isEmpty() && behaviorTree == null) {
        messages.append("Network has neither automata nor a behavior tree. ");
      }
      if (messages.length() > 0) {
        throw new CompilerException(CompilerException.Code.STRUCTURAL_VALIDITY,
            messages.toString().trim());
      }
      return new NetworkDescription(name, maxArraySize, globals, automata, behaviorTree,
          properties);
    }

    private NetworkDescriptionBuilder() {}
  }

}
