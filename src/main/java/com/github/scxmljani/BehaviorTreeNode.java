package com.github.scxmljani;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One node instance of an expanded behavior tree. Instances are numbered in pre-order and every
 * instance gets its own event namespace {@code bt_<n>}.
 */
public final class BehaviorTreeNode {
  static final String namespacePrefix = "bt_";

  private final int instanceId;
  private final String type;
  private final Map<String, String> ports;
  private final String treePath;
  private final List<BehaviorTreeNode> children = new ArrayList<>();

  BehaviorTreeNode(final int instanceId, final String type, final Map<String, String> ports,
      final String treePath) {
    this.instanceId = instanceId;
    this.type = type;
    this.ports = Collections.unmodifiableMap(new LinkedHashMap<>(ports));
    this.treePath = treePath;
  }

  void addChild(final BehaviorTreeNode child) {
    children.add(child);
  }

  public int getInstanceId() {
    return instanceId;
  }

  /**
   * Event namespace of the instance, eg. {@code bt_3}.
   */
  public String getNamespace() {
    return namespacePrefix + instanceId;
  }

  /**
   * Automaton name of the instance, eg. {@code bt_3_Sequence}.
   */
  public String getAutomatonName() {
    return getNamespace() + "_" + type;
  }

  public String getTickEvent() {
    return getNamespace() + "_tick";
  }

  public String getStatusEvent(final Status status) {
    return getNamespace() + "_" + status.getEventSuffix();
  }

  public String getType() {
    return type;
  }

  /**
   * Attributes given on the node in the tree description, used as template parameters.
   */
  public Map<String, String> getPorts() {
    return ports;
  }

  public String getTreePath() {
    return treePath;
  }

  public List<BehaviorTreeNode> getChildren() {
    return Collections.unmodifiableList(children);
  }

  @Override
  public String toString() {
    return "BehaviorTreeNode [" + getAutomatonName() + ", children=" + children.size() + "]";
  }

  /**
   * Result of a tick, with the integer code templates compare against.
   */
  public static enum Status {
    RUNNING(0, "running"), SUCCESS(1, "success"), FAILURE(2, "failure");

    private final int code;
    private final String eventSuffix;

    private Status(final int code, final String eventSuffix) {
      this.code = code;
      this.eventSuffix = eventSuffix;
    }

    public int getCode() {
      return code;
    }

    public String getEventSuffix() {
      return eventSuffix;
    }
  }
}
