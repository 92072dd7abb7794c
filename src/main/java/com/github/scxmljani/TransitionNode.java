package com.github.scxmljani;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A statechart transition. The source is set at construction, targets are linked once the whole
 * document is parsed. An empty event list means the transition is eventless, an empty target
 * list means it is targetless.
 */
public final class TransitionNode {
  private final StateNode source;
  private final List<String> events;
  private final Expression guard;
  private final List<String> targetIds;
  private final List<StateNode> targets = new ArrayList<>();
  private final boolean internal;
  private final List<ExecutableContent> content;
  private final int documentIndex;
  private final String elementPath;

  TransitionNode(final StateNode source, final List<String> events, final Expression guard,
      final List<String> targetIds, final boolean internal, final List<ExecutableContent> content,
      final int documentIndex, final String elementPath) {
    this.source = source;
    this.events = Collections.unmodifiableList(new ArrayList<>(events));
    this.guard = guard;
    this.targetIds = Collections.unmodifiableList(new ArrayList<>(targetIds));
    this.internal = internal;
    this.content = Collections.unmodifiableList(new ArrayList<>(content));
    this.documentIndex = documentIndex;
    this.elementPath = elementPath;
  }

  void linkTarget(final StateNode target) {
    targets.add(target);
  }

  public StateNode getSource() {
    return source;
  }

  public List<String> getEvents() {
    return events;
  }

  public boolean isEventless() {
    return events.isEmpty();
  }

  public Expression getGuard() {
    return guard;
  }

  public List<String> getTargetIds() {
    return targetIds;
  }

  public List<StateNode> getTargets() {
    return Collections.unmodifiableList(targets);
  }

  public boolean isTargetless() {
    return targetIds.isEmpty();
  }

  public boolean isInternal() {
    return internal;
  }

  public List<ExecutableContent> getContent() {
    return content;
  }

  public int getDocumentIndex() {
    return documentIndex;
  }

  public String getElementPath() {
    return elementPath;
  }

  /**
   * SCXML event descriptor matching: a descriptor matches an event equal to it or any event it is
   * a dot-separated prefix of; {@code *} matches everything.
   */
  public boolean matches(final String event) {
    for (String descriptor : events) {
      if (descriptorMatches(descriptor, event)) {
        return true;
      }
    }
    return false;
  }

  public static boolean descriptorMatches(final String descriptor, final String event) {
    String normalized = descriptor;
    if (normalized.endsWith(".*")) {
      normalized = normalized.substring(0, normalized.length() - 2);
    }
    if ("*".equals(normalized)) {
      return true;
    }
    return event.equals(normalized) || event.startsWith(normalized + ".");
  }

  @Override
  public String toString() {
    return "TransitionNode [source=" + source.getId() + ", events=" + events + ", guard=" + guard
        + ", targets=" + targetIds + ", documentIndex=" + documentIndex + "]";
  }
}
