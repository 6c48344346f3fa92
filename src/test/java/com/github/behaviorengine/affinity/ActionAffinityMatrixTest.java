package com.github.behaviorengine.affinity;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

/**
 * Tests the component vs action compatibility table.
 */
public class ActionAffinityMatrixTest {
  private final ActionAffinityMatrix matrix = ActionAffinityMatrix.defaults();

  @Test
  public void testForbiddenActionIsReportedWithAlternatives() {
    final List<String> errors = matrix.validateActionsForComponent(
        Arrays.asList(ItemAction.forEvent("VIEW"), ItemAction.forEvent("SAVE")), "entity-table");
    assertEquals(1, errors.size());
    assertEquals("Action \"SAVE\" is not valid on \"entity-table\". "
        + "Valid actions: VIEW, EDIT, DELETE, SELECT, SORT, PAGE", errors.get(0));
  }

  @Test
  public void testSameActionElsewhere() {
    assertTrue(matrix.validateActionsForComponent(
        Collections.singletonList(ItemAction.forEvent("SAVE")), "form").isEmpty());
    assertTrue(matrix.isActionValidForComponent("SAVE", "form"));
    assertTrue(matrix.isActionInvalidForComponent("SAVE", "entity-table"));
  }

  @Test
  public void testUnlistedActionsAndComponentsPass() {
    // neither valid nor invalid: not an error
    assertTrue(matrix.validateActionsForComponent(
        Collections.singletonList(ItemAction.forEvent("ARCHIVE")), "entity-table").isEmpty());
    // unknown component: nothing to check against
    assertTrue(matrix.validateActionsForComponent(
        Collections.singletonList(ItemAction.forEvent("SAVE")), "sparkline").isEmpty());
    // navigation-only actions carry no event
    assertTrue(matrix.validateActionsForComponent(Collections.singletonList(
        new ItemAction("Open", null, "/records", "row", "ghost")), "entity-table").isEmpty());
    assertTrue(matrix.isActionValidForComponent("SAVE", "sparkline"));
    assertTrue(matrix.getValidActionsForComponent("sparkline").isEmpty());
  }

  @Test
  public void testEventAndCategoryLookups() {
    assertTrue(matrix.getComponentsForEvent("SAVE").contains("form-actions"));
    assertEquals("Save form data", matrix.getUiEvent("SAVE").getDescription());
    assertNull(matrix.getUiEvent("NOT_AN_EVENT"));
    assertTrue(matrix.getComponentsByCategory().get("game").contains("game-hud"));
    assertTrue(matrix.getAllKnownComponents().contains("pagination"));
  }

  @Test
  public void testCustomMatrix() {
    final ActionAffinityMatrix custom = ActionAffinityMatrix.newBuilder()
        .component("kanban", Arrays.asList("MOVE"), Arrays.asList("DELETE")).build();
    assertEquals(Arrays.asList("MOVE"), custom.getValidActionsForComponent("kanban"));
    assertEquals(1, custom.validateActionsForComponent(
        Collections.singletonList(ItemAction.forEvent("DELETE")), "kanban").size());
  }
}
