package com.github.scxmljani;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.github.scxmljani.CompilerException.Code;

/**
 * Variables visible to an expression of one automaton: the data of the event being processed,
 * then the automaton's locals, then the network globals. Locals shadow globals.
 *
 * Resolution also yields the network-wide name a reference is renamed to when automata are
 * merged: locals become {@code <automaton>.<name>}, event data becomes
 * {@code <event>.<param>} and globals keep their name.
 */
public final class Scope {
  public static final String eventDataPrefix = "_event.data.";
  public static final String lengthSuffix = ".length";

  private final String automatonId;
  private final Map<String, ExpressionType> locals;
  private final Map<String, ExpressionType> globals;
  private final String eventName;
  private final Map<String, ExpressionType> eventData;

  public Scope(final String automatonId, final Map<String, ExpressionType> locals,
      final Map<String, ExpressionType> globals) {
    this(automatonId, locals, globals, null, Collections.<String, ExpressionType>emptyMap());
  }

  private Scope(final String automatonId, final Map<String, ExpressionType> locals,
      final Map<String, ExpressionType> globals, final String eventName,
      final Map<String, ExpressionType> eventData) {
    this.automatonId = automatonId;
    this.locals = Collections.unmodifiableMap(new LinkedHashMap<>(locals));
    this.globals = Collections.unmodifiableMap(new LinkedHashMap<>(globals));
    this.eventName = eventName;
    this.eventData = Collections.unmodifiableMap(new LinkedHashMap<>(eventData));
  }

  /**
   * Same scope while processing the given event, so that {@code _event.data.*} resolves.
   */
  public Scope withEvent(final String eventName, final Map<String, ExpressionType> eventData) {
    return new Scope(automatonId, locals, globals, eventName,
        eventData == null ? Collections.<String, ExpressionType>emptyMap() : eventData);
  }

  public Scope withoutEvent() {
    return new Scope(automatonId, locals, globals);
  }

  public String getAutomatonId() {
    return automatonId;
  }

  public String getEventName() {
    return eventName;
  }

  public Map<String, ExpressionType> getLocals() {
    return locals;
  }

  public Map<String, ExpressionType> getGlobals() {
    return globals;
  }

  public boolean isDeclared(final String name) {
    return locals.containsKey(name) || globals.containsKey(name);
  }

  /**
   * Resolves a possibly dotted variable name.
   */
  public Binding resolve(final String name) throws CompilerException {
    if (name.startsWith(eventDataPrefix)) {
      final String parameter = name.substring(eventDataPrefix.length());
      if (parameter.endsWith(lengthSuffix)) {
        final ExpressionType array =
            eventData.get(parameter.substring(0, parameter.length() - lengthSuffix.length()));
        if (eventName != null && array != null && array.isArray()) {
          return new Binding(name, eventName + "." + parameter, ExpressionType.boundedInt(0L, null),
              Binding.Origin.EVENT_DATA);
        }
      }
      final ExpressionType type = eventData.get(parameter);
      if (eventName == null || type == null) {
        throw new CompilerException(Code.UNRESOLVED_REFERENCE, "Unresolved reference '" + name
            + "'" + (eventName == null ? ": no event data in this context"
                : ": event '" + eventName + "' carries no parameter '" + parameter + "'"));
      }
      return new Binding(name, eventName + "." + parameter, type, Binding.Origin.EVENT_DATA);
    }
    if (name.endsWith(lengthSuffix)) {
      final String array = name.substring(0, name.length() - lengthSuffix.length());
      final Binding arrayBinding = resolveDeclared(array);
      if (arrayBinding != null && arrayBinding.getType().isArray()) {
        return new Binding(name, arrayBinding.getQualifiedName() + lengthSuffix,
            ExpressionType.boundedInt(0L, null), arrayBinding.getOrigin());
      }
    }
    final Binding binding = resolveDeclared(name);
    if (binding == null) {
      throw new CompilerException(Code.UNRESOLVED_REFERENCE,
          "Unresolved reference to undeclared variable '" + name + "'");
    }
    return binding;
  }

  private Binding resolveDeclared(final String name) {
    ExpressionType type = locals.get(name);
    if (type != null) {
      return new Binding(name, automatonId + "." + name, type, Binding.Origin.LOCAL);
    }
    type = globals.get(name);
    if (type != null) {
      return new Binding(name, name, type, Binding.Origin.GLOBAL);
    }
    return null;
  }

  @Override
  public String toString() {
    return "Scope [automatonId=" + automatonId + ", locals=" + locals.keySet() + ", globals="
        + globals.keySet() + ", eventName=" + eventName + "]";
  }

  /**
   * One resolved variable reference.
   */
  public static final class Binding {
    public static enum Origin {
      LOCAL, GLOBAL, EVENT_DATA;
    }

    private final String sourceName;
    private final String qualifiedName;
    private final ExpressionType type;
    private final Origin origin;

    Binding(final String sourceName, final String qualifiedName, final ExpressionType type,
        final Origin origin) {
      this.sourceName = sourceName;
      this.qualifiedName = qualifiedName;
      this.type = type;
      this.origin = origin;
    }

    public String getSourceName() {
      return sourceName;
    }

    public String getQualifiedName() {
      return qualifiedName;
    }

    public ExpressionType getType() {
      return type;
    }

    public Origin getOrigin() {
      return origin;
    }

    @Override
    public String toString() {
      return "Binding [" + sourceName + "->" + qualifiedName + ": " + type + "]";
    }
  }
}
