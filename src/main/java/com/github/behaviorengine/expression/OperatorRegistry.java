package com.github.behaviorengine.expression;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.github.behaviorengine.BehaviorEngineException;
import com.github.behaviorengine.BehaviorEngineException.Code;

/**
 * Two-layer operator table: the built-in pure library and effect operators, plus whatever the host
 * registers on top. Immutable once built.
 */
public final class OperatorRegistry {
  // effect names are reserved even when a host registry leaves them out, so guards stay pure
  private static final Set<String> reservedEffects = Collections.unmodifiableSet(
      new HashSet<>(Arrays.asList("set", "set-dynamic", "increment", "decrement", "emit",
          "render", "render-ui", "notify", "persist", "navigate")));
  private static final String asyncNamespace = "async/";

  private static final OperatorRegistry standardRegistry = buildStandard();

  private final Map<String, Operator> operators;

  private OperatorRegistry(final Map<String, Operator> operators) {
    this.operators = Collections.unmodifiableMap(operators);
  }

  /**
   * Built-in operators only. Shared, since it is immutable.
   */
  public static OperatorRegistry standard() {
    return standardRegistry;
  }

  public static OperatorRegistryBuilder newBuilder() {
    return new OperatorRegistryBuilder();
  }

  public Operator lookup(final String name) {
    return operators.get(name);
  }

  public boolean isKnown(final String name) {
    return operators.containsKey(name);
  }

  public boolean isEffectOperator(final String name) {
    final Operator operator = operators.get(name);
    if (operator != null && !operator.isPure()) {
      return true;
    }
    return reservedEffects.contains(name) || (name != null && name.startsWith(asyncNamespace));
  }

  public Set<String> names() {
    return operators.keySet();
  }

  public int size() {
    return operators.size();
  }

  private static OperatorRegistry buildStandard() {
    final Map<String, Operator> table = new LinkedHashMap<>();
    for (final Operator operator : builtIns()) {
      table.put(operator.getName(), operator);
    }
    return new OperatorRegistry(table);
  }

  private static List<Operator> builtIns() {
    final List<Operator> builtIns = new ArrayList<>();
    builtIns.addAll(CoreOperators.all());
    builtIns.addAll(LibraryOperators.all());
    builtIns.addAll(EffectOperators.all());
    return builtIns;
  }

  public final static class OperatorRegistryBuilder {
    private final List<Operator> hostOperators = new ArrayList<>();

    public OperatorRegistryBuilder operator(final Operator operator) {
      hostOperators.add(operator);
      return this;
    }

    /**
     * Host operators may not shadow built-ins or each other.
     */
    public OperatorRegistry build() throws BehaviorEngineException {
      final Map<String, Operator> table = new LinkedHashMap<>(standardRegistry.operators);
      final StringBuilder messages = new StringBuilder();
      for (final Operator operator : hostOperators) {
        if (operator == null || operator.getName() == null) {
          messages.append("Operator and its name cannot be null. ");
          continue;
        }
        if (table.containsKey(operator.getName())) {
          messages.append("Operator ").append(operator.getName())
              .append(" is already registered. ");
          continue;
        }
        table.put(operator.getName(), operator);
      }
      if (messages.length() > 0) {
        throw new BehaviorEngineException(Code.INVALID_ENGINE_CONFIG, messages.toString());
      }
      return new OperatorRegistry(table);
    }

    private OperatorRegistryBuilder() {}
  }

}
