package com.github.behaviorengine;

import static com.github.behaviorengine.Fixtures.expr;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import com.github.behaviorengine.BehaviorDefinition.BehaviorDefinitionBuilder;
import com.github.behaviorengine.StateMachineSpec.StateMachineSpecBuilder;
import com.github.behaviorengine.Transition.TransitionBuilder;
import com.github.behaviorengine.affinity.ActionAffinityMatrix;
import com.github.behaviorengine.expression.OperatorRegistry;

/**
 * Tests the static checks run over behavior definitions.
 */
public class BehaviorValidatorTest {
  private final OperatorRegistry operators = OperatorRegistry.standard();

  @Test
  public void testWellFormedDefinitionPasses() throws BehaviorEngineException {
    final BehaviorDefinition toggle = Fixtures.toggle();
    assertTrue(BehaviorValidator.validateAll(toggle, operators).isEmpty());
    assertTrue(BehaviorValidator.validateActionAffinity(toggle, ActionAffinityMatrix.defaults())
        .isEmpty());
  }

  @Test
  public void testStructure() {
    final BehaviorDefinition noName = BehaviorDefinitionBuilder.newBuilder().category("bogus")
        .stateMachine(StateMachineSpecBuilder.newBuilder().initial("Ghost").states("Idle").build())
        .build();
    assertEquals(Arrays.asList("Behavior must have a name", "Invalid category: bogus",
        "Initial state is not declared: Ghost"), BehaviorValidator.validateStructure(noName));

    final BehaviorDefinition outsideNamespace = BehaviorDefinitionBuilder.newBuilder()
        .name("custom/Thing").stateMachine(StateMachineSpecBuilder.newBuilder().build()).build();
    assertEquals(Arrays.asList("Behavior name should start with 'std/' (got: custom/Thing)",
        "Behavior must have a category", "State machine must have at least one state",
        "State machine must have an initial state"),
        BehaviorValidator.validateStructure(outsideNamespace));
  }

  @Test
  public void testUndeclaredEventsAndStates() {
    final BehaviorDefinition definition = Fixtures.machine("std/Sloppy",
        Arrays.asList("Idle", "Busy"), Arrays.asList("GO"),
        TransitionBuilder.newBuilder().from("Idle").to("Busy").event("START").build(),
        TransitionBuilder.newBuilder().from("Busy").to("Done").event("START").build(),
        TransitionBuilder.newBuilder().from("Nowhere").to("Idle").event("GO").build(),
        TransitionBuilder.newBuilder().from("*").to("Idle").event("GO").build(),
        TransitionBuilder.newBuilder().from("Idle").to("Idle").build());

    // each undeclared event is reported once
    assertEquals(Arrays.asList("Transition uses undeclared event: START",
        "Transition must have an event"), BehaviorValidator.validateEvents(definition));
    // the wildcard source is fine
    assertEquals(Arrays.asList("Transition to undeclared state: Done",
        "Transition from undeclared state: Nowhere"), BehaviorValidator.validateStates(definition));
  }

  @Test
  public void testExpressions() throws BehaviorEngineException {
    final BehaviorDefinition definition = Fixtures.machine("std/Exprs",
        Arrays.asList("Idle"), Arrays.asList("GO"),
        TransitionBuilder.newBuilder().from("Idle").event("GO")
            .guard(expr("['and', ['emit', 'SNEAKY'], true]"))
            .effect(expr("['frobnicate', 1]"))
            .effect(expr("['not', 1, 2]"))
            .effect(expr("['count', ['fn', 'x', '@x']]"))
            .effect(expr("['async/delay', 10, ['emit', 'LATER']]")).build());

    final List<String> errors = BehaviorValidator.validateExpressions(definition, operators);
    assertEquals(Arrays.asList(
        "Effect operator 'emit' is not allowed in transition [Idle] -[GO]-> (self) guard",
        "Unknown operator 'frobnicate' in transition [Idle] -[GO]-> (self) effect #1",
        "Operator 'not' expects 1 arguments, got 2 in transition [Idle] -[GO]-> (self) effect #2",
        "Operator 'count' does not accept a lambda in transition [Idle] -[GO]-> (self) effect #3"),
        errors);
  }

  @Test
  public void testTickAndListenerGuardsMustBePure() throws BehaviorEngineException {
    final BehaviorDefinition definition = BehaviorDefinitionBuilder.newBuilder()
        .name("std/Ticker").category(BehaviorCategory.GAME_CORE)
        .stateMachine(StateMachineSpecBuilder.newBuilder().initial("On").states("On")
            .events("STOP").build())
        .tick(new Tick("move", null, Tick.FRAME, 0, Collections.<String>emptyList(),
            expr("['set', '@entity.x', 1]"), Collections.singletonList(expr("['emit', 'X']"))))
        .listen(new Listener("GAME_OVER", "STOP", expr("['persist', 'save']")))
        .initialEffect(expr("['unknownInit']")).build();

    assertEquals(Arrays.asList("Effect operator 'set' is not allowed in tick 'move' guard",
        "Effect operator 'persist' is not allowed in listener 'GAME_OVER' guard",
        "Unknown operator 'unknownInit' in initial effect #1"),
        BehaviorValidator.validateExpressions(definition, operators));
  }

  @Test
  public void testActionAffinity() throws BehaviorEngineException {
    final BehaviorDefinition definition = Fixtures.machine("std/Table",
        Arrays.asList("Browsing"), Arrays.asList("INIT"),
        TransitionBuilder.newBuilder().from("Browsing").event("INIT")
            .effect(expr("['render-ui', 'main', {'type': 'entity-table', "
                + "'itemActions': [{'label': 'Save', 'event': 'SAVE'}, 'VIEW']}]"))
            .effect(expr("['when', true, ['render', 'footer', 'form', {'actions': ['SAVE']}]]"))
            .effect(expr("['render', 'modal', 'modal', {'actions': ['DELETE']}]")).build());

    final List<String> errors =
        BehaviorValidator.validateActionAffinity(definition, ActionAffinityMatrix.defaults());
    assertEquals(2, errors.size());
    assertEquals("transition [Browsing] -[INIT]-> (self): Action \"SAVE\" is not valid on "
        + "\"entity-table\". Valid actions: VIEW, EDIT, DELETE, SELECT, SORT, PAGE", errors.get(0));
    assertTrue(errors.get(1),
        errors.get(1).contains("Action \"DELETE\" is not valid on \"modal\""));
    // affinity findings never block registration
    assertTrue(BehaviorValidator.validateAll(definition, operators).isEmpty());
  }
}
