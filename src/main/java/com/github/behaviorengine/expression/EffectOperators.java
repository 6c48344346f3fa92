package com.github.behaviorengine.expression;

import static com.github.behaviorengine.expression.Coercions.isNullish;
import static com.github.behaviorengine.expression.Coercions.normalize;
import static com.github.behaviorengine.expression.Coercions.toNumber;
import static com.github.behaviorengine.expression.Coercions.toStored;
import static com.github.behaviorengine.expression.Coercions.toText;
import static com.github.behaviorengine.expression.Operator.UNBOUNDED;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.github.behaviorengine.BehaviorEngineException;
import com.github.behaviorengine.BehaviorEngineException.Code;
import com.github.behaviorengine.NotificationType;
import com.github.behaviorengine.PersistOperation;
import com.github.behaviorengine.expression.Expression.Reference;

/**
 * Effect operators. Each evaluates its own arguments and hands the result to the context's
 * {@link Effects}; none of them produce a value.
 */
final class EffectOperators {
  private static final String componentTypeKey = "type";

  static List<Operator> all() {
    final List<Operator> operators = new ArrayList<>();
    mutation(operators);
    events(operators);
    host(operators);
    timers(operators);
    return operators;
  }

  private static void mutation(final List<Operator> operators) {
    // ["set", "@entity.field", value] or ["set", "@entity.field", value, op]
    operators.add(Operator.effect("set", 2, 3, (evaluator, args, context) -> {
      final Reference target = targetOf("set", args.get(0));
      final Object value = evaluator.evaluate(args.get(1), context);
      if (args.size() == 2) {
        context.getEffects().assign(target, toStored(value));
        return Undefined.INSTANCE;
      }
      final String operation = toText(evaluator.evaluate(args.get(2), context));
      final Object current = context.resolve(target);
      context.getEffects().assign(target, combine(operation, current, value));
      return Undefined.INSTANCE;
    }));
    operators.add(Operator.effect("set-dynamic", 2, 2, (evaluator, args, context) -> {
      final String path = toText(evaluator.evaluate(args.get(0), context));
      if (path.isEmpty()) {
        throw new BehaviorEngineException(Code.INVALID_EFFECT,
            "set-dynamic requires a non-empty field path");
      }
      final Reference target = Reference.parse(path.startsWith("@") ? path : "@entity." + path);
      context.getEffects().assign(target, toStored(evaluator.evaluate(args.get(1), context)));
      return Undefined.INSTANCE;
    }));
    operators.add(Operator.effect("increment", 1, 2,
        (evaluator, args, context) -> step("increment", 1.0, evaluator, args, context)));
    operators.add(Operator.effect("decrement", 1, 2,
        (evaluator, args, context) -> step("decrement", -1.0, evaluator, args, context)));
  }

  private static Object step(final String operator, final double sign,
      final Evaluator evaluator, final List<Expression> args, final EvaluationContext context)
      throws BehaviorEngineException {
    final Reference target = targetOf(operator, args.get(0));
    final double amount =
        args.size() > 1 ? toNumber(evaluator.evaluate(args.get(1), context)) : 1.0;
    final double current = toNumber(context.resolve(target));
    context.getEffects().assign(target, normalize(current + sign * amount));
    return Undefined.INSTANCE;
  }

  private static Reference targetOf(final String operator, final Expression target)
      throws BehaviorEngineException {
    if (target instanceof Reference && !((Reference) target).getPath().isEmpty()) {
      return (Reference) target;
    }
    throw new BehaviorEngineException(Code.INVALID_EFFECT,
        operator + " requires a field binding such as @entity.field, got: " + target);
  }

  static Object combine(final String operation, final Object current, final Object value)
      throws BehaviorEngineException {
    switch (operation) {
      case "increment":
        return normalize(toNumber(current) + toNumber(value));
      case "decrement":
        return normalize(toNumber(current) - toNumber(value));
      case "multiply":
        return normalize(toNumber(current) * toNumber(value));
      case "append": {
        final List<Object> items = current instanceof List ? Coercions.copyOf(current)
            : new ArrayList<Object>();
        items.add(toStored(value));
        return items;
      }
      case "remove": {
        final List<Object> items = new ArrayList<>();
        for (final Object item : Coercions.toList(current instanceof List ? current : null)) {
          if (!Coercions.deepEquals(item, value)) {
            items.add(item);
          }
        }
        return items;
      }
      default:
        throw new BehaviorEngineException(Code.INVALID_EFFECT,
            "Unsupported set operation: " + operation);
    }
  }

  private static void events(final List<Operator> operators) {
    operators.add(Operator.effect("emit", 1, 2, (evaluator, args, context) -> {
      final String event = toText(evaluator.evaluate(args.get(0), context));
      if (event.isEmpty()) {
        throw new BehaviorEngineException(Code.INVALID_EFFECT, "emit requires an event key");
      }
      final Object payload =
          args.size() > 1 ? toStored(evaluator.evaluate(args.get(1), context)) : null;
      context.getEffects().emit(event, payload);
      return Undefined.INSTANCE;
    }));
  }

  private static void host(final List<Operator> operators) {
    final Operator.LazyFunction render = (evaluator, args, context) -> {
      final String slot = toText(evaluator.evaluate(args.get(0), context));
      final Object pattern = evaluator.evaluate(args.get(1), context);
      final Object props = args.size() > 2 ? evaluator.evaluate(args.get(2), context) : null;
      if (isNullish(pattern)) {
        context.getEffects().render(slot, null, null);
        return Undefined.INSTANCE;
      }
      final Map<String, Object> merged = new LinkedHashMap<>();
      final String componentType;
      if (pattern instanceof String) {
        componentType = (String) pattern;
      } else if (pattern instanceof Map) {
        final Map<?, ?> members = (Map<?, ?>) pattern;
        componentType = toText(members.get(componentTypeKey));
        for (final Map.Entry<?, ?> member : members.entrySet()) {
          if (!componentTypeKey.equals(member.getKey())) {
            merged.put(String.valueOf(member.getKey()), member.getValue());
          }
        }
      } else {
        throw new BehaviorEngineException(Code.INVALID_EFFECT,
            "render pattern must be a component type or an object with a type, got: " + pattern);
      }
      if (componentType.isEmpty()) {
        throw new BehaviorEngineException(Code.INVALID_EFFECT,
            "render pattern is missing its component type: " + pattern);
      }
      merged.putAll(mapOf("render", props));
      context.getEffects().render(slot, componentType, merged);
      return Undefined.INSTANCE;
    };
    // ["render-ui", slot, pattern, props?, priority?]
    operators.add(Operator.effect("render", 2, 4, render));
    operators.add(Operator.effect("render-ui", 2, 4, render));

    // ["persist", op], ["persist", op, entityName | data], ["persist", op, entityName, data]
    operators.add(Operator.effect("persist", 1, 3, (evaluator, args, context) -> {
      final String operationId = toText(evaluator.evaluate(args.get(0), context));
      final PersistOperation operation = PersistOperation.fromId(operationId);
      if (operation == null) {
        throw new BehaviorEngineException(Code.INVALID_EFFECT,
            "Unsupported persist operation: " + operationId);
      }
      String entityName = null;
      Object payload = context.getPayload();
      if (args.size() == 3) {
        entityName = toText(evaluator.evaluate(args.get(1), context));
        payload = evaluator.evaluate(args.get(2), context);
      } else if (args.size() == 2) {
        final Object second = evaluator.evaluate(args.get(1), context);
        if (second instanceof String) {
          entityName = (String) second;
        } else {
          payload = second;
        }
      }
      context.getEffects().persist(operation, entityName, toStored(payload));
      return Undefined.INSTANCE;
    }));

    // ["notify", {"type": ..., "message": ..., "action": ...}] or ["notify", message, type?]
    operators.add(Operator.effect("notify", 1, 3, (evaluator, args, context) -> {
      final Object first = evaluator.evaluate(args.get(0), context);
      final String typeId;
      final String message;
      Object action = null;
      if (first instanceof Map) {
        final Map<?, ?> notification = (Map<?, ?>) first;
        typeId = notification.containsKey("type") ? toText(notification.get("type")) : "info";
        message = toText(notification.get("message"));
        action = notification.get("action");
      } else {
        message = toText(first);
        typeId = args.size() > 1 ? toText(evaluator.evaluate(args.get(1), context)) : "info";
        if (args.size() > 2) {
          action = toStored(evaluator.evaluate(args.get(2), context));
        }
      }
      final NotificationType type = NotificationType.fromId(typeId);
      if (type == null) {
        throw new BehaviorEngineException(Code.INVALID_EFFECT,
            "Unsupported notification type: " + typeId);
      }
      context.getEffects().notify(type, message, action);
      return Undefined.INSTANCE;
    }));

    operators.add(Operator.effect("navigate", 1, 2, (evaluator, args, context) -> {
      final String path = toText(evaluator.evaluate(args.get(0), context));
      final Object params = args.size() > 1 ? evaluator.evaluate(args.get(1), context) : null;
      context.getEffects().navigate(path, mapOf("navigate", params));
      return Undefined.INSTANCE;
    }));
  }

  private static Map<String, Object> mapOf(final String operator, final Object value)
      throws BehaviorEngineException {
    final Map<String, Object> members = new LinkedHashMap<>();
    if (isNullish(value)) {
      return members;
    }
    if (!(value instanceof Map)) {
      throw new BehaviorEngineException(Code.INVALID_EFFECT,
          operator + " expects an object of properties, got: " + value);
    }
    for (final Map.Entry<?, ?> member : ((Map<?, ?>) value).entrySet()) {
      members.put(String.valueOf(member.getKey()), member.getValue());
    }
    return members;
  }

  private static void timers(final List<Operator> operators) {
    // ["async/delay", ms, effect...]
    operators.add(Operator.effect("async/delay", 2, UNBOUNDED, (evaluator, args, context) -> {
      final long delay = millisOf("async/delay", evaluator.evaluate(args.get(0), context), 0L);
      context.getEffects().schedule(delay, 0L, args.subList(1, args.size()), context);
      return Undefined.INSTANCE;
    }));
    // ["async/interval", ms, effect...]
    operators.add(Operator.effect("async/interval", 2, UNBOUNDED, (evaluator, args, context) -> {
      final long period = millisOf("async/interval", evaluator.evaluate(args.get(0), context), 1L);
      context.getEffects().schedule(period, period, args.subList(1, args.size()),
          context);
      return Undefined.INSTANCE;
    }));
  }

  private static long millisOf(final String operator, final Object value, final long minimum)
      throws BehaviorEngineException {
    final double millis = toNumber(value);
    if (Double.isNaN(millis) || Double.isInfinite(millis) || millis < minimum) {
      throw new BehaviorEngineException(Code.INVALID_EFFECT,
          operator + " requires a duration of at least " + minimum + "ms, got: " + value);
    }
    return (long) millis;
  }

  private EffectOperators() {}
}
