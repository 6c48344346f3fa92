package com.github.behaviorengine.expression;

import static com.github.behaviorengine.expression.Coercions.compare;
import static com.github.behaviorengine.expression.Coercions.deepEquals;
import static com.github.behaviorengine.expression.Coercions.normalize;
import static com.github.behaviorengine.expression.Coercions.toBoolean;
import static com.github.behaviorengine.expression.Coercions.toList;
import static com.github.behaviorengine.expression.Coercions.toNumber;
import static com.github.behaviorengine.expression.Coercions.toText;
import static com.github.behaviorengine.expression.Operator.UNBOUNDED;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import com.github.behaviorengine.BehaviorEngineException;
import com.github.behaviorengine.BehaviorEngineException.Code;
import com.github.behaviorengine.expression.Expression.Literal;

/**
 * Arithmetic, comparison, logic, control and collection operators. All pure.
 */
final class CoreOperators {

  static List<Operator> all() {
    final List<Operator> operators = new ArrayList<>();
    arithmetic(operators);
    comparison(operators);
    logic(operators);
    control(operators);
    collections(operators);
    return operators;
  }

  private static void arithmetic(final List<Operator> operators) {
    operators.add(Operator.eager("+", 0, UNBOUNDED, (values, context) -> {
      double sum = 0.0;
      for (final Object value : values) {
        sum += toNumber(value);
      }
      return normalize(sum);
    }));
    operators.add(Operator.eager("-", 1, UNBOUNDED, (values, context) -> {
      if (values.size() == 1) {
        return normalize(-toNumber(values.get(0)));
      }
      double difference = toNumber(values.get(0));
      for (int iter = 1; iter < values.size(); iter++) {
        difference -= toNumber(values.get(iter));
      }
      return normalize(difference);
    }));
    operators.add(Operator.eager("*", 0, UNBOUNDED, (values, context) -> {
      double product = 1.0;
      for (final Object value : values) {
        product *= toNumber(value);
      }
      return normalize(product);
    }));
    operators.add(Operator.eager("/", 2, 2,
        (values, context) -> normalize(divide(toNumber(values.get(0)), toNumber(values.get(1))))));
    operators.add(Operator.eager("%", 2, 2,
        (values, context) -> normalize(toNumber(values.get(0)) % toNumber(values.get(1)))));
    operators.add(Operator.eager("abs", 1, 1,
        (values, context) -> normalize(Math.abs(toNumber(values.get(0))))));
    operators.add(Operator.eager("min", 1, UNBOUNDED, (values, context) -> {
      double min = Double.POSITIVE_INFINITY;
      for (final Object value : values) {
        min = Math.min(min, toNumber(value));
      }
      return normalize(min);
    }));
    operators.add(Operator.eager("max", 1, UNBOUNDED, (values, context) -> {
      double max = Double.NEGATIVE_INFINITY;
      for (final Object value : values) {
        max = Math.max(max, toNumber(value));
      }
      return normalize(max);
    }));
    operators.add(Operator.eager("floor", 1, 1,
        (values, context) -> normalize(Math.floor(toNumber(values.get(0))))));
    operators.add(Operator.eager("ceil", 1, 1,
        (values, context) -> normalize(Math.ceil(toNumber(values.get(0))))));
    operators.add(Operator.eager("round", 1, 1,
        (values, context) -> normalize(Math.floor(toNumber(values.get(0)) + 0.5))));
    operators.add(Operator.eager("clamp", 3, 3, (values, context) -> normalize(
        clamp(toNumber(values.get(0)), toNumber(values.get(1)), toNumber(values.get(2))))));
  }

  static double divide(final double dividend, final double divisor) {
    if (divisor == 0.0) {
      return dividend >= 0.0 ? Double.POSITIVE_INFINITY : Double.NEGATIVE_INFINITY;
    }
    return dividend / divisor;
  }

  static double clamp(final double value, final double min, final double max) {
    return Math.min(Math.max(value, min), max);
  }

  private static void comparison(final List<Operator> operators) {
    operators.add(Operator.eager("=", 2, 2,
        (values, context) -> deepEquals(values.get(0), values.get(1))));
    operators.add(Operator.eager("!=", 2, 2,
        (values, context) -> !deepEquals(values.get(0), values.get(1))));
    operators.add(Operator.eager("<", 2, 2,
        (values, context) -> compare(values.get(0), values.get(1)) < 0));
    operators.add(Operator.eager(">", 2, 2,
        (values, context) -> compare(values.get(0), values.get(1)) > 0));
    operators.add(Operator.eager("<=", 2, 2,
        (values, context) -> compare(values.get(0), values.get(1)) <= 0));
    operators.add(Operator.eager(">=", 2, 2,
        (values, context) -> compare(values.get(0), values.get(1)) >= 0));
    operators.add(Operator.eager("matches", 2, 2, (values, context) -> {
      try {
        return Pattern.compile(toText(values.get(1))).matcher(toText(values.get(0))).find();
      } catch (PatternSyntaxException badPattern) {
        throw new BehaviorEngineException(Code.MALFORMED_EXPRESSION,
            "Invalid pattern for matches: " + badPattern.getPattern(), badPattern);
      }
    }));
  }

  private static void logic(final List<Operator> operators) {
    operators.add(Operator.lazy("and", 0, UNBOUNDED, (evaluator, args, context) -> {
      for (final Expression arg : args) {
        if (!toBoolean(evaluator.evaluate(arg, context))) {
          return Boolean.FALSE;
        }
      }
      return Boolean.TRUE;
    }));
    operators.add(Operator.lazy("or", 0, UNBOUNDED, (evaluator, args, context) -> {
      for (final Expression arg : args) {
        if (toBoolean(evaluator.evaluate(arg, context))) {
          return Boolean.TRUE;
        }
      }
      return Boolean.FALSE;
    }));
    operators.add(Operator.eager("not", 1, 1, (values, context) -> !toBoolean(values.get(0))));
    operators.add(Operator.lazy("if", 2, 3, (evaluator, args, context) -> {
      if (toBoolean(evaluator.evaluate(args.get(0), context))) {
        return evaluator.evaluate(args.get(1), context);
      }
      return args.size() > 2 ? evaluator.evaluate(args.get(2), context) : Undefined.INSTANCE;
    }));
  }

  private static void control(final List<Operator> operators) {
    operators.add(Operator.lazy("do", 0, UNBOUNDED, (evaluator, args, context) -> {
      Object result = Undefined.INSTANCE;
      for (final Expression arg : args) {
        result = evaluator.evaluate(arg, context);
      }
      return result;
    }));
    operators.add(Operator.lazy("when", 2, UNBOUNDED, (evaluator, args, context) -> {
      Object result = Undefined.INSTANCE;
      if (toBoolean(evaluator.evaluate(args.get(0), context))) {
        for (int iter = 1; iter < args.size(); iter++) {
          result = evaluator.evaluate(args.get(iter), context);
        }
      }
      return result;
    }));
    // ["let", [["name", value], ...], body]; later bindings see earlier ones
    operators.add(Operator.lazy("let", 2, 2, (evaluator, args, context) -> {
      EvaluationContext scope = context;
      for (final Expression binding : bindingsOf(args.get(0))) {
        final List<Expression> pair = ((Literal) binding).getElements();
        final String name = (String) ((Literal) pair.get(0)).getValue();
        final Map<String, Object> local = new HashMap<>();
        local.put(name, evaluator.evaluate(pair.get(1), scope));
        scope = scope.child(local);
      }
      return evaluator.evaluate(args.get(1), scope);
    }));
    operators.add(Operator.lazy("fn", 2, 2, (evaluator, args, context) -> new Lambda(
        paramsOf(args.get(0)), args.get(1), evaluator, context)));
  }

  /**
   * The parser guarantees the shape; anything else reaching here was built by hand.
   */
  private static List<Expression> bindingsOf(final Expression bindings)
      throws BehaviorEngineException {
    if (bindings instanceof Literal && ((Literal) bindings).isList()) {
      for (final Expression binding : ((Literal) bindings).getElements()) {
        if (!isBindingPair(binding)) {
          throw new BehaviorEngineException(Code.MALFORMED_EXPRESSION,
              "let bindings must be [name, value] pairs, got: " + binding);
        }
      }
      return ((Literal) bindings).getElements();
    }
    throw new BehaviorEngineException(Code.MALFORMED_EXPRESSION,
        "let expects a list of bindings, got: " + bindings);
  }

  private static boolean isBindingPair(final Expression binding) {
    if (!(binding instanceof Literal) || !((Literal) binding).isList()) {
      return false;
    }
    final List<Expression> pair = ((Literal) binding).getElements();
    return pair.size() == 2 && pair.get(0) instanceof Literal
        && ((Literal) pair.get(0)).isString();
  }

  private static List<String> paramsOf(final Expression params) throws BehaviorEngineException {
    final List<String> names = new ArrayList<>();
    if (params instanceof Literal && ((Literal) params).isString()) {
      names.add((String) ((Literal) params).getValue());
      return names;
    }
    if (params instanceof Literal && ((Literal) params).isList()) {
      for (final Expression param : ((Literal) params).getElements()) {
        if (!(param instanceof Literal) || !((Literal) param).isString()) {
          throw new BehaviorEngineException(Code.MALFORMED_EXPRESSION,
              "fn parameters must be names, got: " + param);
        }
        names.add((String) ((Literal) param).getValue());
      }
      if (!names.isEmpty()) {
        return names;
      }
    }
    throw new BehaviorEngineException(Code.MALFORMED_EXPRESSION,
        "fn expects a parameter name or a list of names, got: " + params);
  }

  private static void collections(final List<Operator> operators) {
    operators.add(Operator.higherOrder("map", 2, 2, (values, context) -> {
      final Lambda mapper = lambdaOf("map", values.get(1));
      final List<Object> mapped = new ArrayList<>();
      for (final Object item : toList(values.get(0))) {
        mapped.add(Coercions.toStored(mapper.invoke(item)));
      }
      return mapped;
    }));
    operators.add(Operator.higherOrder("filter", 2, 2, (values, context) -> {
      final Lambda predicate = lambdaOf("filter", values.get(1));
      final List<Object> kept = new ArrayList<>();
      for (final Object item : toList(values.get(0))) {
        if (toBoolean(predicate.invoke(item))) {
          kept.add(item);
        }
      }
      return kept;
    }));
    operators.add(Operator.higherOrder("find", 2, 2, (values, context) -> {
      final Lambda predicate = lambdaOf("find", values.get(1));
      for (final Object item : toList(values.get(0))) {
        if (toBoolean(predicate.invoke(item))) {
          return item;
        }
      }
      return Undefined.INSTANCE;
    }));
    operators.add(Operator.eager("count", 1, 1,
        (values, context) -> Long.valueOf(toList(values.get(0)).size())));
    operators.add(Operator.higherOrder("sum", 1, 2, (values, context) -> {
      final Lambda mapper = values.size() > 1 ? lambdaOf("sum", values.get(1)) : null;
      double sum = 0.0;
      for (final Object item : toList(values.get(0))) {
        sum += toNumber(mapper == null ? item : mapper.invoke(item));
      }
      return normalize(sum);
    }));
    operators.add(Operator.eager("first", 1, 1, (values, context) -> {
      final List<Object> items = toList(values.get(0));
      return items.isEmpty() ? Undefined.INSTANCE : items.get(0);
    }));
    operators.add(Operator.eager("last", 1, 1, (values, context) -> {
      final List<Object> items = toList(values.get(0));
      return items.isEmpty() ? Undefined.INSTANCE : items.get(items.size() - 1);
    }));
    operators.add(Operator.eager("nth", 2, 2,
        (values, context) -> nth(toList(values.get(0)), toNumber(values.get(1)))));
    operators.add(Operator.eager("concat", 0, UNBOUNDED, (values, context) -> {
      final List<Object> joined = new ArrayList<>();
      for (final Object value : values) {
        joined.addAll(toList(value));
      }
      return joined;
    }));
    operators.add(Operator.eager("includes", 2, 2,
        (values, context) -> contains(toList(values.get(0)), values.get(1))));
    operators.add(Operator.eager("empty", 1, 1,
        (values, context) -> toList(values.get(0)).isEmpty()));
  }

  static Lambda lambdaOf(final String operator, final Object value)
      throws BehaviorEngineException {
    if (value instanceof Lambda) {
      return (Lambda) value;
    }
    throw new BehaviorEngineException(Code.MALFORMED_EXPRESSION,
        operator + " expects a lambda built with fn, got: " + value);
  }

  static Object nth(final List<Object> items, final double position) {
    final int index = (int) position;
    if (index != position || index < 0 || index >= items.size()) {
      return Undefined.INSTANCE;
    }
    return items.get(index);
  }

  static boolean contains(final List<Object> items, final Object candidate) {
    for (final Object item : items) {
      if (deepEquals(item, candidate)) {
        return true;
      }
    }
    return false;
  }

  private CoreOperators() {}
}
