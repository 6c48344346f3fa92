package com.github.behaviorengine;

import static com.github.behaviorengine.Fixtures.map;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Map;

import org.junit.Test;

import com.github.behaviorengine.BehaviorEngineException.Code;

/**
 * Tests activation config resolution.
 */
public class ConfigSchemaTest {
  private final ConfigSchema schema = new ConfigSchema(
      Arrays.asList(new ConfigField("entity", FieldType.ENTITY, "Entity to list")),
      Arrays.asList(new ConfigField("pageSize", FieldType.NUMBER, "Rows per page", 20, null),
          new ConfigField("density", FieldType.STRING, "Row density", "normal",
              Arrays.asList("compact", "normal")),
          new ConfigField("columns", FieldType.ARRAY, "Visible columns")));

  @Test
  public void testDefaultsAreApplied() throws BehaviorEngineException {
    final Map<String, Object> resolved = schema.resolve(map("entity", "User"));
    assertEquals("User", resolved.get("entity"));
    assertEquals(20, resolved.get("pageSize"));
    assertEquals("normal", resolved.get("density"));
    // no default, not supplied
    assertFalse(resolved.containsKey("columns"));
  }

  @Test
  public void testSuppliedValuesWinAndExtrasPassThrough() throws BehaviorEngineException {
    final Map<String, Object> resolved = schema.resolve(
        map("entity", "Order", "pageSize", 50, "density", "compact", "theme", "dark"));
    assertEquals(50, resolved.get("pageSize"));
    assertEquals("compact", resolved.get("density"));
    assertEquals("dark", resolved.get("theme"));
  }

  @Test
  public void testEveryProblemIsReported() {
    try {
      schema.resolve(map("pageSize", "many", "density", "airy"));
      fail("Expected an invalid activation config");
    } catch (BehaviorEngineException problem) {
      assertEquals(Code.INVALID_ACTIVATION_CONFIG, problem.getCode());
      final String message = problem.getMessage();
      assertTrue(message, message.contains("Missing required config field: entity"));
      assertTrue(message,
          message.contains("Config field pageSize must be of type number (got: many)"));
      assertTrue(message, message
          .contains("Config field density must be one of [compact, normal] (got: airy)"));
    }
  }

  @Test
  public void testEmptySchema() throws BehaviorEngineException {
    assertTrue(ConfigSchema.EMPTY.resolve(null).isEmpty());
    assertEquals("x", ConfigSchema.EMPTY.resolve(map("any", "x")).get("any"));
  }
}
