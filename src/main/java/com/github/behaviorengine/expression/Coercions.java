package com.github.behaviorengine.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Value coercions shared by every operator family. Each family has exactly one policy for null and
 * {@link Undefined}:<br>
 * numeric: 0<br>
 * boolean: false<br>
 * string: ""<br>
 * collection: empty list<br>
 * equality: null and undefined are equal to each other and to nothing else<br>
 */
public final class Coercions {
  // largest magnitude at which a double still represents every integer exactly
  private static final double maxExactLong = 9007199254740992.0;

  public static boolean isNullish(final Object value) {
    return value == null || value == Undefined.INSTANCE;
  }

  public static double toNumber(final Object value) {
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    if (value instanceof Boolean) {
      return ((Boolean) value) ? 1.0 : 0.0;
    }
    if (value instanceof String) {
      final String text = ((String) value).trim();
      if (text.isEmpty()) {
        return 0.0;
      }
      try {
        return Double.parseDouble(text);
      } catch (NumberFormatException notNumeric) {
        return 0.0;
      }
    }
    return 0.0;
  }

  /**
   * Integral results come back as Long, everything else as Double.
   */
  public static Object normalize(final double number) {
    if (!Double.isNaN(number) && !Double.isInfinite(number) && number == Math.rint(number)
        && Math.abs(number) <= maxExactLong) {
      return Long.valueOf((long) number);
    }
    return Double.valueOf(number);
  }

  public static boolean toBoolean(final Object value) {
    if (isNullish(value)) {
      return false;
    }
    if (value instanceof Boolean) {
      return (Boolean) value;
    }
    if (value instanceof Number) {
      final double number = ((Number) value).doubleValue();
      return number != 0.0 && !Double.isNaN(number);
    }
    if (value instanceof String) {
      return !((String) value).isEmpty();
    }
    return true;
  }

  public static String toText(final Object value) {
    if (isNullish(value)) {
      return "";
    }
    if (value instanceof Double || value instanceof Float) {
      final Object normalized = normalize(((Number) value).doubleValue());
      return String.valueOf(normalized);
    }
    return String.valueOf(value);
  }

  /**
   * Read-only view of the value as a list.
   */
  public static List<Object> toList(final Object value) {
    if (isNullish(value)) {
      return Collections.emptyList();
    }
    if (value instanceof List) {
      return Collections.unmodifiableList((List<?>) value);
    }
    return Collections.singletonList(value);
  }

  /**
   * Mutable copy, for operators that build new collections.
   */
  public static List<Object> copyOf(final Object value) {
    return new ArrayList<>(toList(value));
  }

  public static boolean deepEquals(final Object left, final Object right) {
    if (isNullish(left) || isNullish(right)) {
      return isNullish(left) && isNullish(right);
    }
    if (left instanceof Number && right instanceof Number) {
      return ((Number) left).doubleValue() == ((Number) right).doubleValue();
    }
    if (left instanceof List && right instanceof List) {
      final List<?> leftList = (List<?>) left;
      final List<?> rightList = (List<?>) right;
      if (leftList.size() != rightList.size()) {
        return false;
      }
      final Iterator<?> leftItems = leftList.iterator();
      final Iterator<?> rightItems = rightList.iterator();
      while (leftItems.hasNext()) {
        if (!deepEquals(leftItems.next(), rightItems.next())) {
          return false;
        }
      }
      return true;
    }
    if (left instanceof Map && right instanceof Map) {
      final Map<?, ?> leftMap = (Map<?, ?>) left;
      final Map<?, ?> rightMap = (Map<?, ?>) right;
      if (!leftMap.keySet().equals(rightMap.keySet())) {
        return false;
      }
      for (final Map.Entry<?, ?> entry : leftMap.entrySet()) {
        if (!deepEquals(entry.getValue(), rightMap.get(entry.getKey()))) {
          return false;
        }
      }
      return true;
    }
    return left.equals(right);
  }

  /**
   * Two strings order lexicographically, anything else numerically.
   */
  public static int compare(final Object left, final Object right) {
    if (left instanceof String && right instanceof String) {
      return ((String) left).compareTo((String) right);
    }
    return Double.compare(toNumber(left), toNumber(right));
  }

  /**
   * Undefined never leaks into stored data.
   */
  public static Object toStored(final Object value) {
    return value == Undefined.INSTANCE ? null : value;
  }

  private Coercions() {}
}
