package com.github.behaviorengine;

import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.github.behaviorengine.BehaviorDefinition.BehaviorDefinitionBuilder;
import com.github.behaviorengine.StateMachineSpec.StateMachineSpecBuilder;
import com.github.behaviorengine.Transition.TransitionBuilder;
import com.github.behaviorengine.expression.Expression;
import com.github.behaviorengine.expression.ExpressionParser;

/**
 * Shared test definitions and a compact way to write expressions: single-quoted JSON.
 */
public final class Fixtures {
  private static final JsonMapper mapper =
      JsonMapper.builder().enable(JsonReadFeature.ALLOW_SINGLE_QUOTES).build();
  private static final ExpressionParser parser = ExpressionParser.standard();

  public static Object json(final String text) {
    try {
      return mapper.readValue(text, Object.class);
    } catch (JsonProcessingException problem) {
      throw new UncheckedIOException(problem);
    }
  }

  public static Expression expr(final String text) throws BehaviorEngineException {
    return parser.parse(json(text));
  }

  public static Map<String, Object> map(final String text) {
    try {
      return mapper.readValue(text, new TypeReference<Map<String, Object>>() {});
    } catch (JsonProcessingException problem) {
      throw new UncheckedIOException(problem);
    }
  }

  public static Map<String, Object> map(final Object... keysAndValues) {
    final Map<String, Object> map = new LinkedHashMap<>();
    for (int iter = 0; iter + 1 < keysAndValues.length; iter += 2) {
      map.put((String) keysAndValues[iter], keysAndValues[iter + 1]);
    }
    return map;
  }

  /**
   * Off and On, flipped by FLIP, which also counts the flips. NOOP is declared but unused.
   */
  public static BehaviorDefinition toggle() throws BehaviorEngineException {
    return BehaviorDefinitionBuilder.newBuilder().name("std/Toggle")
        .category(BehaviorCategory.UI_INTERACTION).description("Two-state switch")
        .suggestedFor("toggle", "switch")
        .dataEntity(new DataEntity("ToggleState", false, false,
            Arrays.asList(new EntityField("flips", "number", 0)), "Flip counter"))
        .stateMachine(StateMachineSpecBuilder.newBuilder().initial("Off").states("Off", "On")
            .events("FLIP", "NOOP")
            .transition(TransitionBuilder.newBuilder().from("Off").to("On").event("FLIP")
                .effect(expr("['increment', '@entity.flips']")).build())
            .transition(TransitionBuilder.newBuilder().from("On").to("Off").event("FLIP")
                .effect(expr("['increment', '@entity.flips']")).build())
            .build())
        .build();
  }

  /**
   * A behavior over the given states and events, starting in the first state, with a
   * {@code Data} record holding {@code count} and {@code log}.
   */
  public static BehaviorDefinition machine(final String name, final List<String> states,
      final List<String> events, final Transition... transitions) {
    final StateMachineSpecBuilder machine = StateMachineSpecBuilder.newBuilder()
        .initial(states.get(0)).states(states.toArray(new String[states.size()]))
        .events(events.toArray(new String[events.size()]));
    for (final Transition transition : transitions) {
      machine.transition(transition);
    }
    return BehaviorDefinitionBuilder.newBuilder().name(name).category(BehaviorCategory.ASYNC)
        .dataEntity(new DataEntity("Data", false, false,
            Arrays.asList(new EntityField("count", "number", 0),
                new EntityField("log", "array", Arrays.asList())),
            null))
        .stateMachine(machine.build()).build();
  }

  private Fixtures() {}
}
