package com.github.behaviorengine.expression;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.Test;

/**
 * Tests the value coercions every operator relies on.
 */
public class CoercionsTest {

  @Test
  public void testTruthiness() {
    assertFalse(Coercions.toBoolean(null));
    assertFalse(Coercions.toBoolean(Undefined.INSTANCE));
    assertFalse(Coercions.toBoolean(0L));
    assertFalse(Coercions.toBoolean(Double.NaN));
    assertFalse(Coercions.toBoolean(""));
    assertTrue(Coercions.toBoolean("false"));
    assertTrue(Coercions.toBoolean(-1L));
    // empty containers are truthy
    assertTrue(Coercions.toBoolean(Collections.emptyList()));
    assertTrue(Coercions.toBoolean(Collections.emptyMap()));
  }

  @Test
  public void testNumbers() {
    assertEquals(12.5, Coercions.toNumber(" 12.5 "), 0.0);
    assertEquals(0.0, Coercions.toNumber("twelve"), 0.0);
    assertEquals(1.0, Coercions.toNumber(Boolean.TRUE), 0.0);
    assertEquals(0.0, Coercions.toNumber(null), 0.0);

    // integral results normalize to Long
    assertEquals(Long.valueOf(3L), Coercions.normalize(3.0));
    assertEquals(Double.valueOf(3.5), Coercions.normalize(3.5));
    assertEquals(Double.valueOf(Double.POSITIVE_INFINITY),
        Coercions.normalize(Double.POSITIVE_INFINITY));
  }

  @Test
  public void testText() {
    assertEquals("", Coercions.toText(null));
    assertEquals("", Coercions.toText(Undefined.INSTANCE));
    assertEquals("3", Coercions.toText(3.0));
    assertEquals("2.5", Coercions.toText(2.5));
    assertEquals("true", Coercions.toText(Boolean.TRUE));
  }

  @Test
  public void testDeepEquality() {
    assertTrue(Coercions.deepEquals(null, Undefined.INSTANCE));
    assertTrue(Coercions.deepEquals(1L, 1.0));
    assertFalse(Coercions.deepEquals(1L, "1"));
    assertTrue(Coercions.deepEquals(Arrays.asList(1L, "a"), Arrays.asList(1.0, "a")));
    assertFalse(Coercions.deepEquals(Arrays.asList(1L), Arrays.asList(1L, 2L)));

    final Map<String, Object> one = new LinkedHashMap<>();
    one.put("id", 7L);
    one.put("tags", Arrays.asList("x"));
    final Map<String, Object> two = new LinkedHashMap<>();
    two.put("tags", Arrays.asList("x"));
    two.put("id", 7.0);
    assertTrue(Coercions.deepEquals(one, two));
    two.put("extra", null);
    assertFalse(Coercions.deepEquals(one, two));
  }

  @Test
  public void testOrdering() {
    assertTrue(Coercions.compare("apple", "banana") < 0);
    // mixed operands compare numerically
    assertTrue(Coercions.compare("10", 9L) > 0);
    assertEquals(0, Coercions.compare(2L, 2.0));
  }

  @Test
  public void testStoredValuesNeverHoldUndefined() {
    assertEquals(null, Coercions.toStored(Undefined.INSTANCE));
    assertEquals("kept", Coercions.toStored("kept"));
    assertEquals(Collections.singletonList("x"), Coercions.toList("x"));
    assertTrue(Coercions.toList(null).isEmpty());
  }
}
