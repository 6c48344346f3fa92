package com.github.behaviorengine;

import static com.github.behaviorengine.Fixtures.expr;
import static com.github.behaviorengine.Fixtures.map;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.Test;

import com.github.behaviorengine.BehaviorDefinition.BehaviorDefinitionBuilder;
import com.github.behaviorengine.BehaviorEngine.BehaviorEngineBuilder;
import com.github.behaviorengine.BehaviorEngineException.Code;
import com.github.behaviorengine.BehaviorRegistry.BehaviorRegistryBuilder;
import com.github.behaviorengine.DispatchResult.Outcome;
import com.github.behaviorengine.EngineConfiguration.EngineConfigurationBuilder;
import com.github.behaviorengine.InstanceStatistics.StateTimePair;
import com.github.behaviorengine.StateMachineSpec.StateMachineSpecBuilder;
import com.github.behaviorengine.Transition.TransitionBuilder;

/**
 * Tests to maintain the sanity and correctness of the BehaviorEngine.
 */
public class BehaviorEngineTest {

  private static BehaviorEngine engine(final EffectSink sink, final Scheduler scheduler,
      final EngineConfiguration config, final BehaviorDefinition... extra)
      throws BehaviorEngineException {
    final BehaviorRegistry registry = BehaviorRegistryBuilder.newBuilder()
        .registerAll(new BehaviorCatalogLoader().loadResource("behaviors/sample-catalog.json")
            .getDefinitions())
        .registerAll(Arrays.asList(extra)).build();
    return BehaviorEngineBuilder.newBuilder().registry(registry).sink(sink).scheduler(scheduler)
        .config(config).build();
  }

  private static BehaviorEngine engine(final EffectSink sink, final BehaviorDefinition... extra)
      throws BehaviorEngineException {
    return engine(sink, new DeterministicScheduler(), null, extra);
  }

  @Test
  public void testToggleFlow() throws BehaviorEngineException {
    // 1. fire up the engine
    final BehaviorEngine engine = engine(new RecordingEffectSink());
    assertTrue(engine.alive());

    // 2. activate an instance
    final String instanceId = engine.activate("std/Toggle", null, null);
    assertEquals("Off", engine.readCurrentState(instanceId));
    assertEquals(0, ((Number) engine.readEntity(instanceId).get("flips")).intValue());

    // 3a. Off->On
    DispatchResult result = engine.dispatch(instanceId, "FLIP", null);
    assertEquals(Outcome.TRANSITIONED, result.getOutcome());
    assertEquals("Off", result.getFromState());
    assertEquals("On", result.getToState());
    assertEquals(1, result.getEffectsExecuted());
    assertEquals(1, result.getEventsProcessed());

    // 3b. On->Off
    result = engine.dispatch(instanceId, "FLIP", null);
    assertEquals("Off", result.getToState());
    assertEquals("Off", engine.readCurrentState(instanceId));
    assertEquals(2L, engine.readEntity(instanceId).get("flips"));

    // 4. the route remembers every state entered
    final StateTimePair[] route = engine.getStateTransitionRoute(instanceId);
    assertEquals(3, route.length);
    assertEquals("Off", route[0].state);
    assertEquals("On", route[1].state);
    assertEquals("Off", route[2].state);

    // 5. destroy the instance
    assertTrue(engine.destroy(instanceId));
    assertFalse(engine.destroy(instanceId));
    assertEquals(1, engine.getStatistics().getTotalActivated());
    assertEquals(1, engine.getStatistics().getTotalDestroyed());

    // 6. stop the engine
    assertTrue(engine.alive());
    assertTrue(engine.demolish());
    assertFalse(engine.alive());
  }

  @Test
  public void testMissIsANoOp() throws BehaviorEngineException {
    final RecordingEffectSink sink = new RecordingEffectSink();
    final BehaviorEngine engine = engine(sink);
    final String instanceId = engine.activate("std/Toggle", null, null);

    // declared but unused event
    DispatchResult result = engine.dispatch(instanceId, "NOOP", null);
    assertEquals(Outcome.MISS, result.getOutcome());
    assertTrue(result.isSuccessful());
    assertFalse(result.isTransitioned());
    assertEquals("Off", result.getFromState());
    assertEquals("Off", result.getToState());
    assertEquals(0, result.getEffectsExecuted());

    // undeclared event
    result = engine.dispatch(instanceId, "BOGUS", map("any", "thing"));
    assertEquals(Outcome.MISS, result.getOutcome());
    assertEquals(0, ((Number) engine.readEntity(instanceId).get("flips")).intValue());
    assertEquals(1, engine.getStateTransitionRoute(instanceId).length);

    // same from On
    engine.dispatch(instanceId, "FLIP", null);
    for (final String event : Arrays.asList("NOOP", "BOGUS")) {
      result = engine.dispatch(instanceId, event, null);
      assertEquals(Outcome.MISS, result.getOutcome());
      assertEquals("On", result.getFromState());
      assertEquals("On", result.getToState());
      assertEquals(0, result.getEffectsExecuted());
    }
    assertEquals("On", engine.readCurrentState(instanceId));
    assertEquals(1L, engine.readEntity(instanceId).get("flips"));
    assertEquals(2, engine.getStateTransitionRoute(instanceId).length);
    assertTrue(sink.getEffects().isEmpty());
    assertTrue(engine.demolish());
  }

  @Test
  public void testSelfLoopsWildcardsAndFirstMatchWins() throws BehaviorEngineException {
    final BehaviorDefinition route = Fixtures.machine("std/Route", Arrays.asList("Idle", "Busy"),
        Arrays.asList("GO"),
        TransitionBuilder.newBuilder().from("Idle").to("Busy").event("GO")
            .guard(expr("['>', '@payload.n', 10]")).build(),
        TransitionBuilder.newBuilder().from("*").event("GO")
            .effect(expr("['increment', '@entity.count']")).build());
    final BehaviorEngine engine = engine(new RecordingEffectSink(), route);
    final String instanceId = engine.activate("std/Route", null, null);

    // 1. guard fails, the wildcard self-loop takes the event
    DispatchResult result = engine.dispatch(instanceId, "GO", map("n", 5));
    assertEquals(Outcome.TRANSITIONED, result.getOutcome());
    assertEquals("Idle", result.getToState());
    assertEquals(1L, engine.readEntity(instanceId).get("count"));
    // a self-loop enters no new state
    assertEquals(1, engine.getStateTransitionRoute(instanceId).length);

    // 2. both match, the first declared wins
    result = engine.dispatch(instanceId, "GO", map("n", 50));
    assertEquals("Busy", result.getToState());
    assertEquals(0, result.getEffectsExecuted());
    assertEquals(1L, engine.readEntity(instanceId).get("count"));

    // 3. the wildcard also applies from Busy
    result = engine.dispatch(instanceId, "GO", map("n", 50));
    assertEquals("Busy", result.getToState());
    assertEquals(2L, engine.readEntity(instanceId).get("count"));
    assertTrue(engine.demolish());
  }

  @Test
  public void testNestedFieldWrites() throws BehaviorEngineException {
    final BehaviorDefinition profile = Fixtures.machine("std/Profile", Arrays.asList("Idle"),
        Arrays.asList("MOVE"), TransitionBuilder.newBuilder().from("Idle").event("MOVE")
            .effect(expr("['set', '@entity.profile.city', '@payload.city']"))
            .effect(expr("['set', '@entity.address.zip', '0150']")).build());
    final BehaviorEngine engine = engine(new RecordingEffectSink(), profile);
    final Map<String, Object> subject = map("profile", map("{'name': 'ada'}"));
    final String instanceId = engine.activate("std/Profile", subject, null);

    engine.dispatch(instanceId, "MOVE", map("city", "Oslo"));
    final Map<String, Object> entity = engine.readEntity(instanceId);
    assertEquals(map("{'name': 'ada', 'city': 'Oslo'}"), entity.get("profile"));
    // missing intermediate records are created
    assertEquals(map("{'zip': '0150'}"), entity.get("address"));
    assertEquals(map("{'name': 'ada'}"), subject.get("profile"));
    assertTrue(engine.demolish());
  }

  @Test
  public void testEmittedEventsCompleteBeforeDispatchReturns() throws BehaviorEngineException {
    final BehaviorDefinition chain = Fixtures.machine("std/Chain",
        Arrays.asList("A", "B", "C"), Arrays.asList("START", "NEXT", "DONE"),
        TransitionBuilder.newBuilder().from("A").to("B").event("START")
            .effect(expr("['emit', 'NEXT']"))
            .effect(expr("['set', '@entity.log', 'start', 'append']")).build(),
        TransitionBuilder.newBuilder().from("B").to("C").event("NEXT")
            .effect(expr("['set', '@entity.log', 'next', 'append']"))
            .effect(expr("['emit', 'DONE']")).build(),
        TransitionBuilder.newBuilder().from("C").event("DONE")
            .effect(expr("['set', '@entity.log', 'done', 'append']")).build());
    final BehaviorEngine engine = engine(new RecordingEffectSink(), chain);
    final String instanceId = engine.activate("std/Chain", null, null);

    final DispatchResult result = engine.dispatch(instanceId, "START", null);
    assertEquals(Outcome.TRANSITIONED, result.getOutcome());
    assertEquals("A", result.getFromState());
    assertEquals("C", result.getToState());
    assertEquals(3, result.getEventsProcessed());
    assertEquals(5, result.getEffectsExecuted());
    // an emitted event waits for the rest of its effect list
    assertEquals(Arrays.asList("start", "next", "done"),
        engine.readEntity(instanceId).get("log"));
    assertTrue(engine.demolish());
  }

  @Test
  public void testRunawayCascadeIsCut() throws BehaviorEngineException {
    final BehaviorDefinition loop = Fixtures.machine("std/Loop", Arrays.asList("Idle"),
        Arrays.asList("PING"), TransitionBuilder.newBuilder().from("*").event("PING")
            .effect(expr("['increment', '@entity.count']")).effect(expr("['emit', 'PING']"))
            .build());
    final EngineConfiguration config =
        EngineConfigurationBuilder.newBuilder().maxCascadeDepth(5).build();
    final BehaviorEngine engine =
        engine(new RecordingEffectSink(), new DeterministicScheduler(), config, loop);
    final String instanceId = engine.activate("std/Loop", null, null);

    final DispatchResult result = engine.dispatch(instanceId, "PING", null);
    assertEquals(Outcome.FAULT, result.getOutcome());
    assertFalse(result.isSuccessful());
    assertEquals(Code.CASCADE_LIMIT, result.getError().getCode());
    assertEquals(5, result.getEventsProcessed());
    assertEquals(5L, engine.readEntity(instanceId).get("count"));

    // the dropped queue does not leak into the next dispatch
    assertEquals(Code.CASCADE_LIMIT, engine.dispatch(instanceId, "PING", null).getError()
        .getCode());
    assertEquals(10L, engine.readEntity(instanceId).get("count"));
    assertTrue(engine.demolish());
  }

  @Test
  public void testFaultKeepsAppliedChanges() throws BehaviorEngineException {
    final BehaviorDefinition faulty = Fixtures.machine("std/Faulty",
        Arrays.asList("Idle", "Broken"), Arrays.asList("BREAK", "RESET"),
        TransitionBuilder.newBuilder().from("Idle").to("Broken").event("BREAK")
            .effect(expr("['set', '@entity.count', 1]"))
            .effect(expr("['persist', 'explode']"))
            .effect(expr("['set', '@entity.count', 2]")).build(),
        TransitionBuilder.newBuilder().from("Broken").to("Idle").event("RESET").build());
    final BehaviorEngine engine = engine(new RecordingEffectSink(), faulty);
    final String instanceId = engine.activate("std/Faulty", null, null);

    // 1. the fault stops the effect list, the state change and the first effect stay
    final DispatchResult result = engine.dispatch(instanceId, "BREAK", null);
    assertEquals(Outcome.FAULT, result.getOutcome());
    assertEquals(Code.INVALID_EFFECT, result.getError().getCode());
    assertEquals("Broken", result.getToState());
    assertEquals(1L, engine.readEntity(instanceId).get("count"));

    // 2. the instance keeps working
    assertEquals(Outcome.TRANSITIONED, engine.dispatch(instanceId, "RESET", null).getOutcome());
    assertEquals("Idle", engine.readCurrentState(instanceId));
    assertEquals(1, engine.getStatistics().getActiveInstanceStats().get(0).getFaults());
    assertTrue(engine.demolish());
  }

  @Test
  public void testSinkFailureIsAFault() throws BehaviorEngineException {
    final RecordingEffectSink sink = new RecordingEffectSink();
    final BehaviorEngine engine = engine(sink);
    final String instanceId = engine.activate("std/List", null, map("entity", "User"));
    sink.failWith(new IllegalStateException("display gone"));

    final DispatchResult result = engine.dispatch(instanceId, "INIT", null);
    assertEquals(Outcome.FAULT, result.getOutcome());
    assertEquals(Code.SINK_FAILURE, result.getError().getCode());
    assertTrue(result.getError().getMessage(),
        result.getError().getMessage().contains("display gone"));
    assertTrue(engine.demolish());
  }

  @Test
  public void testHostEffectsReachTheSink() throws BehaviorEngineException {
    final RecordingEffectSink sink = new RecordingEffectSink();
    final BehaviorEngine engine = engine(sink);
    final String instanceId = engine.activate("std/List", null, map("entity", "User"));

    // 1. render, with config resolved into the props
    assertEquals(Outcome.TRANSITIONED, engine.dispatch(instanceId, "INIT", null).getOutcome());
    assertEquals(Arrays.asList("render main entity-table"), sink.getEffects());
    final Map<String, Object> props = sink.getRenderedProps().get(0);
    assertEquals("User", props.get("entity"));
    assertEquals(Arrays.asList("name", "email"), props.get("columns"));

    // 2. navigate
    DispatchResult result = engine.dispatch(instanceId, "VIEW", map("id", 7));
    assertEquals("Viewing", result.getToState());
    assertEquals("navigate /records/7", sink.getEffects().get(1));

    // 3. guarded out without a payload
    engine.dispatch(instanceId, "BACK", null);
    result = engine.dispatch(instanceId, "VIEW", null);
    assertEquals(Outcome.MISS, result.getOutcome());
    assertEquals("Browsing", engine.readCurrentState(instanceId));

    // 4. data effects stay in the instance
    engine.dispatch(instanceId, "SELECT", map("id", 3));
    engine.dispatch(instanceId, "SELECT", map("id", 4));
    assertEquals(Arrays.asList(3, 4), engine.readEntity(instanceId).get("selected"));
    assertEquals(2, sink.getEffects().size());
    assertTrue(engine.demolish());
  }

  @Test
  public void testActivation() throws BehaviorEngineException {
    final BehaviorEngine engine = engine(new RecordingEffectSink());

    // 1. subject values overlay the defaults
    final Map<String, Object> subject = map("flips", 10, "owner", "ada");
    final String instanceId = engine.activate("std/Toggle", subject, null);
    assertEquals(10, engine.readEntity(instanceId).get("flips"));
    assertEquals("ada", engine.readEntity(instanceId).get("owner"));
    // the host's map is copied, not shared
    engine.dispatch(instanceId, "FLIP", null);
    assertEquals(10, subject.get("flips"));

    // 2. bad config
    try {
      engine.activate("std/List", null, map("pageSize", "many"));
      fail("Expected an invalid activation config");
    } catch (BehaviorEngineException problem) {
      assertEquals(Code.INVALID_ACTIVATION_CONFIG, problem.getCode());
    }

    // 3. unknown behavior and instance
    try {
      engine.activate("std/Nope", null, null);
      fail("Expected an unknown behavior");
    } catch (BehaviorEngineException problem) {
      assertEquals(Code.UNKNOWN_BEHAVIOR, problem.getCode());
    }
    try {
      engine.dispatch("no-such-instance", "FLIP", null);
      fail("Expected an illegal instance id");
    } catch (BehaviorEngineException problem) {
      assertEquals(Code.ILLEGAL_INSTANCE_ID, problem.getCode());
    }
    assertEquals(1, engine.getStatistics().getTotalActivated());
    assertTrue(engine.demolish());
  }

  @Test
  public void testDelayedEffects() throws BehaviorEngineException {
    final BehaviorDefinition timeout = Fixtures.machine("std/Timeout",
        Arrays.asList("Waiting", "TimedOut"), Arrays.asList("START", "TIMEOUT"),
        TransitionBuilder.newBuilder().from("Waiting").event("START")
            .effect(expr("['async/delay', 500, ['emit', 'TIMEOUT']]")).build(),
        TransitionBuilder.newBuilder().from("Waiting").to("TimedOut").event("TIMEOUT").build());
    final DeterministicScheduler scheduler = new DeterministicScheduler();
    final BehaviorEngine engine = engine(new RecordingEffectSink(), scheduler, null, timeout);
    final String instanceId = engine.activate("std/Timeout", null, null);

    engine.dispatch(instanceId, "START", null);
    assertEquals(1, scheduler.pendingTasks());
    scheduler.advance(499);
    assertEquals("Waiting", engine.readCurrentState(instanceId));
    scheduler.advance(1);
    assertEquals("TimedOut", engine.readCurrentState(instanceId));
    assertEquals(0, scheduler.pendingTasks());
    assertTrue(engine.demolish());
  }

  @Test
  public void testDelayedEffectsKeepTheirScope() throws BehaviorEngineException {
    final BehaviorDefinition notice = Fixtures.machine("std/Notice", Arrays.asList("Shown"),
        Arrays.asList("SHOW", "AUTO_DISMISS"),
        TransitionBuilder.newBuilder().from("Shown").event("SHOW")
            .effect(expr("['let', [['id', 42]], ['async/delay', 100, "
                + "['emit', 'AUTO_DISMISS', {'id': '@id', 'msg': '@payload.message'}]]]"))
            .build(),
        TransitionBuilder.newBuilder().from("*").event("AUTO_DISMISS")
            .effect(expr("['set', '@entity.dismissed', '@payload.id']"))
            .effect(expr("['set', '@entity.msg', '@payload.msg']")).build());
    final DeterministicScheduler scheduler = new DeterministicScheduler();
    final BehaviorEngine engine = engine(new RecordingEffectSink(), scheduler, null, notice);
    final String instanceId = engine.activate("std/Notice", null, null);

    // 1. the let binding and the payload are gone by the time the timer fires
    engine.dispatch(instanceId, "SHOW", map("message", "hello"));
    assertNull(engine.readEntity(instanceId).get("dismissed"));

    // 2. the delayed effect still sees both
    scheduler.advance(100);
    final Map<String, Object> entity = engine.readEntity(instanceId);
    assertEquals(42L, entity.get("dismissed"));
    assertEquals("hello", entity.get("msg"));
    assertTrue(engine.demolish());
  }

  @Test
  public void testTimersWaitForABusyInstance() throws Exception {
    final BehaviorDefinition slow = Fixtures.machine("std/Slow",
        Arrays.asList("Waiting", "Done"), Arrays.asList("START", "TIMEOUT"),
        TransitionBuilder.newBuilder().from("Waiting").event("START")
            .effect(expr("['async/delay', 10, ['emit', 'TIMEOUT']]"))
            .effect(expr("['render', 'main', 'spinner']")).build(),
        TransitionBuilder.newBuilder().from("Waiting").to("Done").event("TIMEOUT").build());
    final BlockingSink sink = new BlockingSink();
    final DeterministicScheduler scheduler = new DeterministicScheduler();
    final EngineConfiguration config =
        EngineConfigurationBuilder.newBuilder().lockAcquisitionMillis(50L).build();
    final BehaviorEngine engine = engine(sink, scheduler, config, slow);
    final String instanceId = engine.activate("std/Slow", null, null);

    // 1. START parks in the sink while holding the instance
    final List<Throwable> problems = Collections.synchronizedList(new ArrayList<Throwable>());
    final Thread starter = new Thread(() -> {
      try {
        engine.dispatch(instanceId, "START", null);
      } catch (BehaviorEngineException problem) {
        problems.add(problem);
      }
    });
    starter.setName("starter");
    starter.start();
    assertTrue(sink.entered.await(5, TimeUnit.SECONDS));

    // 2. the timer cannot get in and is put back on the scheduler
    scheduler.advance(10);
    assertEquals(1, scheduler.pendingTasks());

    // 3. once the instance is free the retry delivers the timeout
    sink.release.countDown();
    starter.join();
    assertTrue(problems.toString(), problems.isEmpty());
    assertEquals("Waiting", engine.readCurrentState(instanceId));
    scheduler.advance(50);
    assertEquals("Done", engine.readCurrentState(instanceId));
    assertEquals(0, scheduler.pendingTasks());
    assertTrue(engine.demolish());
  }

  @Test
  public void testIntervalsStopWhenTheInstanceIsDestroyed() throws BehaviorEngineException {
    final BehaviorDefinition heartbeat = BehaviorDefinitionBuilder.newBuilder()
        .name("std/Heartbeat").category(BehaviorCategory.ASYNC)
        .dataEntity(new DataEntity("Beat", false, false,
            Arrays.asList(new EntityField("count", "number", 0)), null))
        .stateMachine(StateMachineSpecBuilder.newBuilder().initial("On").states("On").build())
        .tick(new Tick("poll", null, 250L, 0, null, null,
            Collections.singletonList(expr("['notify', 'polled']"))))
        .initialEffect(expr("['async/interval', 100, ['increment', '@entity.count']]")).build();
    final RecordingEffectSink sink = new RecordingEffectSink();
    final DeterministicScheduler scheduler = new DeterministicScheduler();
    final BehaviorEngine engine = engine(sink, scheduler, null, heartbeat);
    final String instanceId = engine.activate("std/Heartbeat", null, null);
    assertEquals(2, scheduler.pendingTasks());

    scheduler.advance(500);
    assertEquals(5L, engine.readEntity(instanceId).get("count"));
    assertEquals(Arrays.asList("notify INFO polled", "notify INFO polled"), sink.getEffects());

    assertTrue(engine.destroy(instanceId));
    assertEquals(0, scheduler.pendingTasks());
    scheduler.advance(1000);
    assertEquals(2, sink.getEffects().size());
    assertTrue(engine.demolish());
  }

  @Test
  public void testFrameTicksRunByPriority() throws BehaviorEngineException {
    final BehaviorDefinition frames = BehaviorDefinitionBuilder.newBuilder()
        .name("std/Frames").category(BehaviorCategory.GAME_CORE)
        .dataEntity(new DataEntity("Data", false, false,
            Arrays.asList(new EntityField("log", "array", new ArrayList<Object>())), null))
        .stateMachine(StateMachineSpecBuilder.newBuilder().initial("Live").states("Live").build())
        .tick(frameTick("low", 1)).tick(frameTick("high", 5)).tick(frameTick("high2", 5))
        .build();
    final BehaviorEngine engine = engine(new RecordingEffectSink(), frames);
    final String instanceId = engine.activate("std/Frames", null, null);

    final DispatchResult result = engine.frame(instanceId);
    assertEquals(Outcome.TICKED, result.getOutcome());
    assertEquals(3, result.getEffectsExecuted());
    // equal priorities keep declaration order
    assertEquals(Arrays.asList("high", "high2", "low"), engine.readEntity(instanceId).get("log"));
    assertTrue(engine.demolish());
  }

  private static Tick frameTick(final String name, final int priority)
      throws BehaviorEngineException {
    return new Tick(name, null, Tick.FRAME, priority, null, null, Collections.singletonList(
        expr("['set', '@entity.log', '" + name + "', 'append']")));
  }

  @Test
  public void testSingletonsAreSharedPerBehavior() throws BehaviorEngineException {
    final BehaviorEngine engine = engine(new RecordingEffectSink());
    final String first = engine.activate("std/GameLoop", null, null);
    final String second = engine.activate("std/GameLoop", null, null);

    // 1. a frame on one instance is visible from the other
    assertEquals(Outcome.TICKED, engine.frame(first).getOutcome());
    Map<String, Object> game = engine.readSingleton(second, "GameState");
    assertEquals(10L, game.get("score"));
    assertEquals(1L, game.get("frames"));

    // 2. tick guards see the instance's own state
    engine.dispatch(first, "PAUSE", null);
    assertEquals(Outcome.MISS, engine.frame(first).getOutcome());
    engine.frame(second);
    game = engine.readSingleton(first, "GameState");
    assertEquals(20L, game.get("score"));
    assertEquals(2L, game.get("frames"));

    // 3. reads are copies
    game.put("score", 999L);
    assertEquals(20L, engine.readSingleton(first, "GameState").get("score"));
    assertNull(engine.readSingleton(first, "Nope"));

    // 4. the records go away with the last instance
    engine.destroy(first);
    engine.destroy(second);
    final String fresh = engine.activate("std/GameLoop", null, null);
    assertEquals(0, ((Number) engine.readSingleton(fresh, "GameState").get("score")).intValue());
    assertTrue(engine.demolish());
  }

  @Test
  public void testBroadcastReachesListeners() throws BehaviorEngineException {
    final BehaviorEngine engine = engine(new RecordingEffectSink());
    final String first = engine.activate("std/GameLoop", null, null);
    final String toggle = engine.activate("std/Toggle", null, null);
    final String second = engine.activate("std/GameLoop", null, null);

    List<DispatchResult> results = engine.broadcast("GAME_PAUSED", null);
    assertEquals(2, results.size());
    // activation order
    assertEquals(first, results.get(0).getInstanceId());
    assertEquals(second, results.get(1).getInstanceId());
    assertEquals(Outcome.TRANSITIONED, results.get(0).getOutcome());
    assertEquals("Paused", engine.readCurrentState(first));
    assertEquals("Paused", engine.readCurrentState(second));
    assertEquals("Off", engine.readCurrentState(toggle));

    // already paused
    results = engine.broadcast("GAME_PAUSED", null);
    assertEquals(Outcome.MISS, results.get(0).getOutcome());
    assertEquals(Outcome.MISS, results.get(1).getOutcome());

    assertTrue(engine.broadcast("NOBODY_LISTENS", null).isEmpty());
    assertTrue(engine.demolish());
  }

  @Test
  public void testReentrantDispatchIsQueued() throws BehaviorEngineException {
    final BehaviorDefinition wizard = Fixtures.machine("std/Wizard",
        Arrays.asList("Step1", "Step2"), Arrays.asList("INIT", "NEXT"),
        TransitionBuilder.newBuilder().from("Step1").event("INIT")
            .effect(expr("['render', 'main', 'form']")).build(),
        TransitionBuilder.newBuilder().from("Step1").to("Step2").event("NEXT").build());
    final CallbackSink sink = new CallbackSink();
    final BehaviorEngine engine = engine(sink, wizard);
    sink.engine = engine;
    final String instanceId = engine.activate("std/Wizard", null, null);

    final DispatchResult result = engine.dispatch(instanceId, "INIT", null);
    assertEquals(Outcome.QUEUED, sink.callbackResult.getOutcome());
    assertEquals(Outcome.TRANSITIONED, result.getOutcome());
    assertEquals("Step2", result.getToState());
    assertEquals(2, result.getEventsProcessed());
    assertTrue(engine.demolish());
  }

  @Test
  public void testPurgeExpiredInstances() throws BehaviorEngineException {
    final ManualClock clock = new ManualClock(1_000_000L);
    final EngineConfiguration config = EngineConfigurationBuilder.newBuilder().clock(clock)
        .instanceExpirationMillis(1000L).build();
    final BehaviorEngineImpl engine = (BehaviorEngineImpl) engine(new RecordingEffectSink(),
        new DeterministicScheduler(), config);
    final String instanceId = engine.activate("std/Toggle", null, null);

    // 1. use keeps the instance alive
    clock.advance(500L);
    engine.dispatch(instanceId, "FLIP", null);
    clock.advance(800L);
    engine.purgeExpiredInstances();
    assertEquals("On", engine.readCurrentState(instanceId));

    // 2. idle past expiry
    clock.advance(300L);
    engine.purgeExpiredInstances();
    try {
      engine.readCurrentState(instanceId);
      fail("Expected an illegal instance id");
    } catch (BehaviorEngineException problem) {
      assertEquals(Code.ILLEGAL_INSTANCE_ID, problem.getCode());
    }
    assertEquals(1, engine.getStatistics().getTotalPurged());
    assertTrue(engine.demolish());
  }

  @Test
  public void testConcurrentDispatch() throws Exception {
    final EngineConfiguration config =
        EngineConfigurationBuilder.newBuilder().lockAcquisitionMillis(5000L).build();
    final BehaviorEngine engine =
        engine(new RecordingEffectSink(), new DeterministicScheduler(), config);
    final String shared = engine.activate("std/Toggle", null, null);
    final int workers = 4, flips = 50;
    final List<String> own = new ArrayList<>();
    final List<Thread> threads = new ArrayList<>();
    final List<Throwable> problems = Collections.synchronizedList(new ArrayList<Throwable>());
    for (int iter = 0; iter < workers; iter++) {
      final String instanceId = engine.activate("std/Toggle", null, null);
      own.add(instanceId);
      final Thread thread = new Thread(() -> {
        try {
          for (int flip = 0; flip < flips; flip++) {
            engine.dispatch(instanceId, "FLIP", null);
            engine.dispatch(shared, "FLIP", null);
          }
        } catch (BehaviorEngineException problem) {
          problems.add(problem);
        }
      });
      thread.setName("flipper-" + iter);
      threads.add(thread);
      thread.start();
    }
    for (final Thread thread : threads) {
      thread.join();
    }
    assertTrue(problems.toString(), problems.isEmpty());
    for (final String instanceId : own) {
      assertEquals("Off", engine.readCurrentState(instanceId));
      assertEquals((long) flips, engine.readEntity(instanceId).get("flips"));
    }
    assertEquals((long) workers * flips, engine.readEntity(shared).get("flips"));
    assertEquals(workers + 1, engine.getStatistics().getActiveInstanceStats().size());
    assertTrue(engine.demolish());
  }

  @Test
  public void testDemolishedEngineRefusesWork() throws BehaviorEngineException {
    final BehaviorEngine engine = engine(new RecordingEffectSink());
    final String instanceId = engine.activate("std/Toggle", null, null);
    assertTrue(engine.demolish());
    assertFalse(engine.alive());
    // demolish is idempotent
    assertTrue(engine.demolish());
    try {
      engine.activate("std/Toggle", null, null);
      fail("Expected a dead engine");
    } catch (BehaviorEngineException problem) {
      assertEquals(Code.ENGINE_NOT_ALIVE, problem.getCode());
    }
    try {
      engine.dispatch(instanceId, "FLIP", null);
      fail("Expected a dead engine");
    } catch (BehaviorEngineException problem) {
      assertEquals(Code.ENGINE_NOT_ALIVE, problem.getCode());
    }
  }

  @Test
  public void testEngineConfiguration() throws BehaviorEngineException {
    try {
      BehaviorEngineBuilder.newBuilder().build();
      fail("Expected an invalid engine config");
    } catch (BehaviorEngineException problem) {
      assertEquals(Code.INVALID_ENGINE_CONFIG, problem.getCode());
    }
    try {
      EngineConfigurationBuilder.newBuilder().maxCascadeDepth(0).lockAcquisitionMillis(0L)
          .build();
      fail("Expected an invalid engine config");
    } catch (BehaviorEngineException problem) {
      assertEquals(Code.INVALID_ENGINE_CONFIG, problem.getCode());
      assertTrue(problem.getMessage().contains("maxCascadeDepth must be positive"));
    }
    final EngineConfiguration config = EngineConfigurationBuilder.newBuilder().build();
    assertEquals(10 * 60 * 1000L, config.getInstanceExpirationMillis());
  }

  /**
   * Holds the first render until released.
   */
  private static final class BlockingSink implements EffectSink {
    private final CountDownLatch entered = new CountDownLatch(1);
    private final CountDownLatch release = new CountDownLatch(1);

    @Override
    public void render(final String instanceId, final String slot, final String componentType,
        final Map<String, Object> props) {
      entered.countDown();
      try {
        release.await(5, TimeUnit.SECONDS);
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
      }
    }

    @Override
    public void persist(final String instanceId, final PersistOperation operation,
        final String entityName, final Object payload) {}

    @Override
    public void notify(final String instanceId, final NotificationType type, final String message,
        final Object action) {}

    @Override
    public void navigate(final String instanceId, final String path,
        final Map<String, Object> params) {}
  }

  /**
   * Calls back into the engine from inside a render, as a UI layer reacting synchronously would.
   */
  private static final class CallbackSink implements EffectSink {
    private volatile BehaviorEngine engine;
    private volatile DispatchResult callbackResult;

    @Override
    public void render(final String instanceId, final String slot, final String componentType,
        final Map<String, Object> props) throws BehaviorEngineException {
      callbackResult = engine.dispatch(instanceId, "NEXT", null);
    }

    @Override
    public void persist(final String instanceId, final PersistOperation operation,
        final String entityName, final Object payload) {}

    @Override
    public void notify(final String instanceId, final NotificationType type, final String message,
        final Object action) {}

    @Override
    public void navigate(final String instanceId, final String path,
        final Map<String, Object> params) {}
  }
}
