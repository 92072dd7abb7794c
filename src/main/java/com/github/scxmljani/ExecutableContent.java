package com.github.scxmljani;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Supported executable content of onentry, onexit and transition blocks. Instances are immutable
 * and remember the element path they were parsed from, for diagnostics.
 */
public abstract class ExecutableContent {
  private final String elementPath;

  public static enum Kind {
    ASSIGN, RAISE, SEND, IF;
  }

  private ExecutableContent(final String elementPath) {
    this.elementPath = elementPath;
  }

  public String getElementPath() {
    return elementPath;
  }

  public abstract Kind getKind();

  /**
   * {@code <assign location="x" expr="..."/>}, where the location may also be an element
   * {@code a[i]}.
   */
  public static final class Assign extends ExecutableContent {
    private final String target;
    // null unless an array element is written
    private final Expression index;
    private final Expression value;

    public Assign(final String target, final Expression index, final Expression value,
        final String elementPath) {
      super(elementPath);
      this.target = target;
      this.index = index;
      this.value = value;
    }

    public String getTarget() {
      return target;
    }

    public Expression getIndex() {
      return index;
    }

    public Expression getValue() {
      return value;
    }

    @Override
    public Kind getKind() {
      return Kind.ASSIGN;
    }

    @Override
    public String toString() {
      return target + (index == null ? "" : "[" + index + "]") + " = " + value;
    }
  }

  /**
   * {@code <raise event>} or {@code <send event target="#_internal">}: an internal event.
   */
  public static final class Raise extends ExecutableContent {
    private final String event;

    public Raise(final String event, final String elementPath) {
      super(elementPath);
      this.event = event;
    }

    public String getEvent() {
      return event;
    }

    @Override
    public Kind getKind() {
      return Kind.RAISE;
    }

    @Override
    public String toString() {
      return "raise " + event;
    }
  }

  /**
   * {@code <send event>} to the network, with optional parameters.
   */
  public static final class Send extends ExecutableContent {
    private final String event;
    private final Map<String, Expression> parameters;

    public Send(final String event, final Map<String, Expression> parameters,
        final String elementPath) {
      super(elementPath);
      this.event = event;
      this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public String getEvent() {
      return event;
    }

    public Map<String, Expression> getParameters() {
      return parameters;
    }

    @Override
    public Kind getKind() {
      return Kind.SEND;
    }

    @Override
    public String toString() {
      return "send " + event + (parameters.isEmpty() ? "" : " " + parameters);
    }
  }

  /**
   * {@code <if>/<elseif>/<else>}; an else branch has a null condition and is always last.
   */
  public static final class If extends ExecutableContent {
    private final List<Branch> branches;

    public If(final List<Branch> branches, final String elementPath) {
      super(elementPath);
      this.branches = Collections.unmodifiableList(new ArrayList<>(branches));
    }

    public List<Branch> getBranches() {
      return branches;
    }

    public boolean hasElse() {
      return !branches.isEmpty() && branches.get(branches.size() - 1).getCondition() == null;
    }

    @Override
    public Kind getKind() {
      return Kind.IF;
    }

    @Override
    public String toString() {
      return "if " + branches;
    }
  }

  public static final class Branch {
    private final Expression condition;
    private final List<ExecutableContent> content;

    public Branch(final Expression condition, final List<ExecutableContent> content) {
      this.condition = condition;
      this.content = Collections.unmodifiableList(new ArrayList<>(content));
    }

    public Expression getCondition() {
      return condition;
    }

    public List<ExecutableContent> getContent() {
      return content;
    }

    @Override
    public String toString() {
      return (condition == null ? "else" : condition.toString()) + " -> " + content;
    }
  }
}
