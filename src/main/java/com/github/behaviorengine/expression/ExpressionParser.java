package com.github.behaviorengine.expression;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.github.behaviorengine.BehaviorEngineException;
import com.github.behaviorengine.BehaviorEngineException.Code;
import com.github.behaviorengine.expression.Expression.Literal;
import com.github.behaviorengine.expression.Expression.Reference;

/**
 * Turns plain JSON-like values (maps, lists, strings, numbers, booleans, null) into
 * {@link Expression} trees.
 *
 * Rules:<br>
 * 1. a string starting with {@code @} is a reference, any other string is a literal<br>
 * 2. in expression position (a guard, an effect, an operator argument) a list headed by a plain
 * string is a call of that operator<br>
 * 3. inside object and list literals a string-headed list is a call only when the head names a
 * registered operator; otherwise it stays data, so {@code "columns": ["name", "email"]} is a list
 * of two strings<br>
 * 4. {@code let} bindings and {@code fn} parameters are names, never references<br>
 */
public final class ExpressionParser {
  private final OperatorRegistry operators;

  public ExpressionParser(final OperatorRegistry operators) {
    this.operators = operators;
  }

  public static ExpressionParser standard() {
    return new ExpressionParser(OperatorRegistry.standard());
  }

  public OperatorRegistry getOperators() {
    return operators;
  }

  public Expression parse(final Object raw) throws BehaviorEngineException {
    if (raw instanceof Expression) {
      return (Expression) raw;
    }
    if (raw instanceof List) {
      final List<?> items = (List<?>) raw;
      if (isCallShaped(items)) {
        return parseCall(items);
      }
      return parseListLiteral(items);
    }
    return parseData(raw);
  }

  /**
   * Parses an ordered effect list. A null list is empty.
   */
  public List<Expression> parseAll(final List<?> raws) throws BehaviorEngineException {
    final List<Expression> parsed = new ArrayList<>();
    if (raws != null) {
      for (final Object raw : raws) {
        parsed.add(parse(raw));
      }
    }
    return parsed;
  }

  private Expression parseData(final Object raw) throws BehaviorEngineException {
    if (raw == null) {
      return Literal.NULL;
    }
    if (raw instanceof Expression) {
      return (Expression) raw;
    }
    if (raw instanceof String) {
      return Reference.isBinding(raw) ? Reference.parse((String) raw)
          : Expression.literal(raw);
    }
    if (raw instanceof Boolean) {
      return Expression.literal(raw);
    }
    if (raw instanceof Number) {
      return Expression.literal(numberOf((Number) raw));
    }
    if (raw instanceof Map) {
      final Map<String, Expression> members = new LinkedHashMap<>();
      for (final Map.Entry<?, ?> member : ((Map<?, ?>) raw).entrySet()) {
        members.put(String.valueOf(member.getKey()), parseData(member.getValue()));
      }
      return Literal.object(members);
    }
    if (raw instanceof List) {
      final List<?> items = (List<?>) raw;
      if (isCallShaped(items) && isOperatorName(items.get(0))) {
        return parseCall(items);
      }
      return parseListLiteral(items);
    }
    throw new BehaviorEngineException(Code.MALFORMED_EXPRESSION,
        "Unsupported expression value of type " + raw.getClass().getSimpleName() + ": " + raw);
  }

  private Expression parseListLiteral(final List<?> items) throws BehaviorEngineException {
    final List<Expression> elements = new ArrayList<>();
    for (final Object item : items) {
      elements.add(parseData(item));
    }
    return Literal.list(elements);
  }

  private Expression parseCall(final List<?> items) throws BehaviorEngineException {
    final String operator = (String) items.get(0);
    final List<?> rawArgs = items.subList(1, items.size());
    final List<Expression> args = new ArrayList<>();
    for (int iter = 0; iter < rawArgs.size(); iter++) {
      final Object rawArg = rawArgs.get(iter);
      if (iter == 0 && "let".equals(operator)) {
        args.add(parseBindings(rawArg));
      } else if (iter == 0 && "fn".equals(operator)) {
        args.add(parseParams(rawArg));
      } else {
        args.add(parse(rawArg));
      }
    }
    return Expression.call(operator, args);
  }

  private Expression parseBindings(final Object raw) throws BehaviorEngineException {
    if (!(raw instanceof List)) {
      throw new BehaviorEngineException(Code.MALFORMED_EXPRESSION,
          "let expects a list of [name, value] bindings, got: " + raw);
    }
    final List<Expression> bindings = new ArrayList<>();
    for (final Object binding : (List<?>) raw) {
      if (!(binding instanceof List) || ((List<?>) binding).size() != 2
          || !(((List<?>) binding).get(0) instanceof String)) {
        throw new BehaviorEngineException(Code.MALFORMED_EXPRESSION,
            "let binding must be a [name, value] pair, got: " + binding);
      }
      final List<?> pair = (List<?>) binding;
      final List<Expression> parsedPair = new ArrayList<>();
      parsedPair.add(Expression.literal(localName((String) pair.get(0))));
      parsedPair.add(parse(pair.get(1)));
      bindings.add(Literal.list(parsedPair));
    }
    return Literal.list(bindings);
  }

  private Expression parseParams(final Object raw) throws BehaviorEngineException {
    if (raw instanceof String) {
      return Expression.literal(localName((String) raw));
    }
    if (raw instanceof List && !((List<?>) raw).isEmpty()) {
      final List<Expression> params = new ArrayList<>();
      for (final Object param : (List<?>) raw) {
        if (!(param instanceof String)) {
          throw new BehaviorEngineException(Code.MALFORMED_EXPRESSION,
              "fn parameter must be a name, got: " + param);
        }
        params.add(Expression.literal(localName((String) param)));
      }
      return Literal.list(params);
    }
    throw new BehaviorEngineException(Code.MALFORMED_EXPRESSION,
        "fn expects a parameter name or a list of names, got: " + raw);
  }

  // locals are referenced as @name, declared with or without the @
  private static String localName(final String declared) {
    return declared.startsWith("@") ? declared.substring(1) : declared;
  }

  private static boolean isCallShaped(final List<?> items) {
    return !items.isEmpty() && items.get(0) instanceof String && !((String) items.get(0)).isEmpty()
        && !Reference.isBinding(items.get(0));
  }

  private boolean isOperatorName(final Object head) {
    final String name = (String) head;
    return operators.isKnown(name) || operators.isEffectOperator(name);
  }

  private static Object numberOf(final Number number) {
    if (number instanceof Integer || number instanceof Long || number instanceof Short
        || number instanceof Byte) {
      return Long.valueOf(number.longValue());
    }
    if (number instanceof BigInteger || number instanceof BigDecimal) {
      return Coercions.normalize(number.doubleValue());
    }
    return Double.valueOf(number.doubleValue());
  }

}
