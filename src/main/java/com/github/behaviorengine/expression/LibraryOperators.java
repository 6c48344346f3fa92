package com.github.behaviorengine.expression;

import static com.github.behaviorengine.expression.Coercions.copyOf;
import static com.github.behaviorengine.expression.Coercions.deepEquals;
import static com.github.behaviorengine.expression.Coercions.isNullish;
import static com.github.behaviorengine.expression.Coercions.normalize;
import static com.github.behaviorengine.expression.Coercions.toList;
import static com.github.behaviorengine.expression.Coercions.toNumber;
import static com.github.behaviorengine.expression.Coercions.toText;
import static com.github.behaviorengine.expression.Operator.UNBOUNDED;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Namespaced standard library: math/, str/, array/, object/ and time/ operators. All pure.
 */
final class LibraryOperators {

  static List<Operator> all() {
    final List<Operator> operators = new ArrayList<>();
    math(operators);
    strings(operators);
    arrays(operators);
    objects(operators);
    time(operators);
    return operators;
  }

  private static void math(final List<Operator> operators) {
    operators.add(Operator.eager("math/abs", 1, 1,
        (values, context) -> normalize(Math.abs(toNumber(values.get(0))))));
    operators.add(Operator.eager("math/min", 1, UNBOUNDED, (values, context) -> {
      double min = Double.POSITIVE_INFINITY;
      for (final Object value : values) {
        min = Math.min(min, toNumber(value));
      }
      return normalize(min);
    }));
    operators.add(Operator.eager("math/max", 1, UNBOUNDED, (values, context) -> {
      double max = Double.NEGATIVE_INFINITY;
      for (final Object value : values) {
        max = Math.max(max, toNumber(value));
      }
      return normalize(max);
    }));
    operators.add(Operator.eager("math/clamp", 3, 3, (values, context) -> normalize(CoreOperators
        .clamp(toNumber(values.get(0)), toNumber(values.get(1)), toNumber(values.get(2))))));
    operators.add(Operator.eager("math/floor", 1, 1,
        (values, context) -> normalize(Math.floor(toNumber(values.get(0))))));
    operators.add(Operator.eager("math/ceil", 1, 1,
        (values, context) -> normalize(Math.ceil(toNumber(values.get(0))))));
    operators.add(Operator.eager("math/round", 1, 2, (values, context) -> {
      final double value = toNumber(values.get(0));
      final double scale = values.size() > 1 ? Math.pow(10, toNumber(values.get(1))) : 1.0;
      return normalize(Math.floor(value * scale + 0.5) / scale);
    }));
    operators.add(Operator.eager("math/pow", 2, 2, (values, context) -> normalize(
        Math.pow(toNumber(values.get(0)), toNumber(values.get(1))))));
    operators.add(Operator.eager("math/sqrt", 1, 1,
        (values, context) -> normalize(Math.sqrt(toNumber(values.get(0))))));
    // mathematical modulo, always takes the sign of the divisor
    operators.add(Operator.eager("math/mod", 2, 2, (values, context) -> {
      final double dividend = toNumber(values.get(0));
      final double divisor = toNumber(values.get(1));
      return normalize(((dividend % divisor) + divisor) % divisor);
    }));
    operators.add(Operator.eager("math/sign", 1, 1,
        (values, context) -> normalize(Math.signum(toNumber(values.get(0))))));
    operators.add(Operator.eager("math/lerp", 3, 3, (values, context) -> {
      final double from = toNumber(values.get(0));
      final double to = toNumber(values.get(1));
      return normalize(from + (to - from) * toNumber(values.get(2)));
    }));
    operators.add(Operator.eager("math/default", 2, 2, (values, context) -> {
      final Object value = values.get(0);
      if (isNullish(value) || (value instanceof Double && ((Double) value).isNaN())) {
        return values.get(1);
      }
      return value;
    }));
  }

  private static void strings(final List<Operator> operators) {
    operators.add(Operator.eager("str/len", 1, 1,
        (values, context) -> Long.valueOf(toText(values.get(0)).length())));
    operators.add(Operator.eager("str/upper", 1, 1,
        (values, context) -> toText(values.get(0)).toUpperCase(Locale.ROOT)));
    operators.add(Operator.eager("str/lower", 1, 1,
        (values, context) -> toText(values.get(0)).toLowerCase(Locale.ROOT)));
    operators.add(
        Operator.eager("str/trim", 1, 1, (values, context) -> toText(values.get(0)).trim()));
    operators.add(Operator.eager("str/split", 2, 2, (values, context) -> {
      final String text = toText(values.get(0));
      final String separator = toText(values.get(1));
      final List<Object> parts = new ArrayList<>();
      if (separator.isEmpty()) {
        for (final char character : text.toCharArray()) {
          parts.add(String.valueOf(character));
        }
        return parts;
      }
      int start = 0;
      int found;
      while ((found = text.indexOf(separator, start)) >= 0) {
        parts.add(text.substring(start, found));
        start = found + separator.length();
      }
      parts.add(text.substring(start));
      return parts;
    }));
    operators.add(Operator.eager("str/join", 1, 2, (values, context) -> {
      final String separator = values.size() > 1 ? toText(values.get(1)) : ",";
      final StringBuilder joined = new StringBuilder();
      for (final Object item : toList(values.get(0))) {
        if (joined.length() > 0) {
          joined.append(separator);
        }
        joined.append(toText(item));
      }
      return joined.toString();
    }));
    operators.add(Operator.eager("str/concat", 0, UNBOUNDED, (values, context) -> {
      final StringBuilder joined = new StringBuilder();
      for (final Object value : values) {
        joined.append(toText(value));
      }
      return joined.toString();
    }));
    operators.add(Operator.eager("str/includes", 2, 2,
        (values, context) -> toText(values.get(0)).contains(toText(values.get(1)))));
    operators.add(Operator.eager("str/startsWith", 2, 2,
        (values, context) -> toText(values.get(0)).startsWith(toText(values.get(1)))));
    operators.add(Operator.eager("str/endsWith", 2, 2,
        (values, context) -> toText(values.get(0)).endsWith(toText(values.get(1)))));
    operators.add(Operator.eager("str/slice", 2, 3, (values, context) -> {
      final String text = toText(values.get(0));
      final int start = boundedIndex(toNumber(values.get(1)), text.length());
      final int end = values.size() > 2 ? boundedIndex(toNumber(values.get(2)), text.length())
          : text.length();
      return start >= end ? "" : text.substring(start, end);
    }));
    operators.add(Operator.eager("str/replace", 3, 3, (values, context) -> toText(values.get(0))
        .replace(toText(values.get(1)), toText(values.get(2)))));
    operators.add(Operator.eager("str/capitalize", 1, 1, (values, context) -> {
      final String text = toText(values.get(0));
      return text.isEmpty() ? text
          : text.substring(0, 1).toUpperCase(Locale.ROOT) + text.substring(1);
    }));
    operators.add(Operator.eager("str/default", 2, 2, (values, context) -> {
      final String text = toText(values.get(0));
      return text.isEmpty() ? values.get(1) : text;
    }));
    operators.add(Operator.eager("str/truncate", 2, 3, (values, context) -> {
      final String text = toText(values.get(0));
      final int length = (int) Math.max(0, toNumber(values.get(1)));
      final String suffix = values.size() > 2 ? toText(values.get(2)) : "...";
      return text.length() <= length ? text : text.substring(0, length) + suffix;
    }));
  }

  /**
   * Negative positions count back from the end.
   */
  private static int boundedIndex(final double position, final int length) {
    int index = (int) position;
    if (index < 0) {
      index = Math.max(0, length + index);
    }
    return Math.min(index, length);
  }

  private static void arrays(final List<Operator> operators) {
    operators.add(Operator.eager("array/len", 1, 1,
        (values, context) -> Long.valueOf(toList(values.get(0)).size())));
    operators.add(Operator.eager("array/empty?", 1, 1,
        (values, context) -> toList(values.get(0)).isEmpty()));
    operators.add(Operator.eager("array/first", 1, 1, (values, context) -> {
      final List<Object> items = toList(values.get(0));
      return items.isEmpty() ? Undefined.INSTANCE : items.get(0);
    }));
    operators.add(Operator.eager("array/last", 1, 1, (values, context) -> {
      final List<Object> items = toList(values.get(0));
      return items.isEmpty() ? Undefined.INSTANCE : items.get(items.size() - 1);
    }));
    operators.add(Operator.eager("array/nth", 2, 2,
        (values, context) -> CoreOperators.nth(toList(values.get(0)), toNumber(values.get(1)))));
    operators.add(Operator.eager("array/slice", 2, 3, (values, context) -> {
      final List<Object> items = toList(values.get(0));
      final int start = boundedIndex(toNumber(values.get(1)), items.size());
      final int end = values.size() > 2 ? boundedIndex(toNumber(values.get(2)), items.size())
          : items.size();
      if (start >= end) {
        return new ArrayList<Object>();
      }
      return new ArrayList<Object>(items.subList(start, end));
    }));
    operators.add(Operator.eager("array/append", 2, 2, (values, context) -> {
      final List<Object> items = copyOf(values.get(0));
      items.add(Coercions.toStored(values.get(1)));
      return items;
    }));
    operators.add(Operator.eager("array/prepend", 2, 2, (values, context) -> {
      final List<Object> items = copyOf(values.get(0));
      items.add(0, Coercions.toStored(values.get(1)));
      return items;
    }));
    operators.add(Operator.eager("array/remove", 2, 2, (values, context) -> {
      final List<Object> items = copyOf(values.get(0));
      final double position = toNumber(values.get(1));
      final int index = (int) position;
      if (index == position && index >= 0 && index < items.size()) {
        items.remove(index);
      }
      return items;
    }));
    operators.add(Operator.eager("array/removeItem", 2, 2, (values, context) -> {
      final List<Object> kept = new ArrayList<>();
      for (final Object item : toList(values.get(0))) {
        if (!deepEquals(item, values.get(1))) {
          kept.add(item);
        }
      }
      return kept;
    }));
    operators.add(Operator.eager("array/includes", 2, 2,
        (values, context) -> CoreOperators.contains(toList(values.get(0)), values.get(1))));
    operators.add(Operator.eager("array/reverse", 1, 1, (values, context) -> {
      final List<Object> items = copyOf(values.get(0));
      Collections.reverse(items);
      return items;
    }));
    operators.add(Operator.eager("array/unique", 1, 1, (values, context) -> {
      final List<Object> unique = new ArrayList<>();
      for (final Object item : toList(values.get(0))) {
        if (!CoreOperators.contains(unique, item)) {
          unique.add(item);
        }
      }
      return unique;
    }));
    operators.add(Operator.eager("array/range", 2, 2, (values, context) -> {
      final List<Object> range = new ArrayList<>();
      final long to = (long) toNumber(values.get(1));
      for (long iter = (long) toNumber(values.get(0)); iter < to; iter++) {
        range.add(Long.valueOf(iter));
      }
      return range;
    }));
  }

  private static void objects(final List<Operator> operators) {
    operators.add(Operator.eager("object/get", 2, 3, (values, context) -> {
      final Object found = EvaluationContext.navigate(values.get(0),
          Arrays.asList(toText(values.get(1)).split("\\.")));
      if (isNullish(found) && values.size() > 2) {
        return values.get(2);
      }
      return found;
    }));
    operators.add(Operator.eager("object/has", 2, 2,
        (values, context) -> values.get(0) instanceof Map
            && ((Map<?, ?>) values.get(0)).containsKey(toText(values.get(1)))));
    operators.add(Operator.eager("object/keys", 1, 1, (values, context) -> {
      final List<Object> keys = new ArrayList<>();
      if (values.get(0) instanceof Map) {
        keys.addAll(((Map<?, ?>) values.get(0)).keySet());
      }
      return keys;
    }));
    operators.add(Operator.eager("object/values", 1, 1, (values, context) -> {
      final List<Object> members = new ArrayList<>();
      if (values.get(0) instanceof Map) {
        members.addAll(((Map<?, ?>) values.get(0)).values());
      }
      return members;
    }));
    operators.add(Operator.eager("object/merge", 0, UNBOUNDED, (values, context) -> {
      final Map<String, Object> merged = new LinkedHashMap<>();
      for (final Object value : values) {
        if (value instanceof Map) {
          for (final Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
            merged.put(String.valueOf(entry.getKey()), entry.getValue());
          }
        }
      }
      return merged;
    }));
    operators.add(Operator.eager("object/pick", 2, 2, (values, context) -> {
      final Map<String, Object> picked = new LinkedHashMap<>();
      if (values.get(0) instanceof Map) {
        final Map<?, ?> source = (Map<?, ?>) values.get(0);
        for (final Object key : new LinkedHashSet<>(toList(values.get(1)))) {
          final String name = toText(key);
          if (source.containsKey(name)) {
            picked.put(name, source.get(name));
          }
        }
      }
      return picked;
    }));
  }

  private static void time(final List<Operator> operators) {
    operators.add(
        Operator.eager("time/now", 0, 0, (values, context) -> Long.valueOf(context.getNow())));
    operators.add(Operator.eager("time/diff", 2, 2, (values, context) -> normalize(
        toNumber(values.get(1)) - toNumber(values.get(0)))));
    operators.add(Operator.eager("time/isPast", 1, 1,
        (values, context) -> toNumber(values.get(0)) < context.getNow()));
    operators.add(Operator.eager("time/isFuture", 1, 1,
        (values, context) -> toNumber(values.get(0)) > context.getNow()));
  }

  private LibraryOperators() {}
}
