package com.github.behaviorengine;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.github.behaviorengine.BehaviorDefinition.BehaviorDefinitionBuilder;
import com.github.behaviorengine.BehaviorEngineException.Code;
import com.github.behaviorengine.StateMachineSpec.StateMachineSpecBuilder;
import com.github.behaviorengine.Transition.TransitionBuilder;
import com.github.behaviorengine.expression.Expression;
import com.github.behaviorengine.expression.ExpressionParser;

/**
 * Reads behavior catalogs from JSON. A catalog is either an array of behavior objects or an object
 * with a {@code behaviors} array.
 *
 * Every entry is converted on its own: a malformed entry is reported in the
 * {@link CatalogLoadResult} and the remaining entries still load. Only an unreadable document
 * fails the whole load.
 */
public final class BehaviorCatalogLoader {
  private static final Logger logger =
      LogManager.getLogger(BehaviorCatalogLoader.class.getSimpleName());

  private static final String frameInterval = "frame";

  private final ObjectMapper mapper = JsonMapper.builder()
      .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
      .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
      .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
      .build();

  private final ExpressionParser parser;

  public BehaviorCatalogLoader(final ExpressionParser parser) {
    this.parser = parser;
  }

  public BehaviorCatalogLoader() {
    this(ExpressionParser.standard());
  }

  public CatalogLoadResult load(final InputStream stream) throws BehaviorEngineException {
    final Object document;
    try {
      document = mapper.readValue(stream, Object.class);
    } catch (IOException exception) {
      throw new BehaviorEngineException(Code.CATALOG_PARSE_FAILURE, exception);
    }
    return convert(document);
  }

  public CatalogLoadResult load(final String json) throws BehaviorEngineException {
    final Object document;
    try {
      document = mapper.readValue(json, Object.class);
    } catch (IOException exception) {
      throw new BehaviorEngineException(Code.CATALOG_PARSE_FAILURE, exception);
    }
    return convert(document);
  }

  public CatalogLoadResult loadResource(final String resource) throws BehaviorEngineException {
    final InputStream stream =
        BehaviorCatalogLoader.class.getClassLoader().getResourceAsStream(resource);
    if (stream == null) {
      throw new BehaviorEngineException(Code.CATALOG_PARSE_FAILURE,
          "Catalog resource not found: " + resource);
    }
    try {
      return load(stream);
    } finally {
      try {
        stream.close();
      } catch (IOException exception) {
        logger.warn("Failed to close catalog resource " + resource, exception);
      }
    }
  }

  private CatalogLoadResult convert(final Object document) throws BehaviorEngineException {
    final List<?> entries;
    if (document instanceof List) {
      entries = (List<?>) document;
    } else if (document instanceof Map
        && ((Map<?, ?>) document).get("behaviors") instanceof List) {
      entries = (List<?>) ((Map<?, ?>) document).get("behaviors");
    } else {
      throw new BehaviorEngineException(Code.CATALOG_PARSE_FAILURE,
          "Catalog must be an array of behaviors or an object with a behaviors array");
    }
    final List<BehaviorDefinition> definitions = new ArrayList<>();
    final Map<String, String> errors = new LinkedHashMap<>();
    for (int iter = 0; iter < entries.size(); iter++) {
      final Object entry = entries.get(iter);
      final String label = labelOf(entry, iter);
      try {
        definitions.add(toDefinition(entry));
      } catch (BehaviorEngineException | RuntimeException exception) {
        final String reason = exception.getMessage();
        logger.warn(String.format("Skipped catalog entry %s: %s", label, reason));
        errors.put(errors.containsKey(label) ? label + "#" + iter : label, reason);
      }
    }
    logger.info(String.format("Loaded %d behavior definitions, skipped %d", definitions.size(),
        errors.size()));
    return new CatalogLoadResult(definitions, errors);
  }

  private static String labelOf(final Object entry, final int index) {
    if (entry instanceof Map && ((Map<?, ?>) entry).get("name") instanceof String) {
      return (String) ((Map<?, ?>) entry).get("name");
    }
    return "#" + index;
  }

  BehaviorDefinition toDefinition(final Object entry) throws BehaviorEngineException {
    final Map<?, ?> raw = asMap(entry, "behavior");
    final BehaviorDefinitionBuilder builder = BehaviorDefinitionBuilder.newBuilder()
        .name(text(raw, "name")).category(text(raw, "category"))
        .description(text(raw, "description")).suggestedFor(strings(raw.get("suggestedFor")));
    if (raw.get("configSchema") != null) {
      builder.configSchema(toConfigSchema(asMap(raw.get("configSchema"), "configSchema")));
    }
    if (raw.get("stateMachine") != null) {
      builder.stateMachine(toStateMachine(asMap(raw.get("stateMachine"), "stateMachine")));
    }
    for (final Object entity : list(raw.get("dataEntities"))) {
      builder.dataEntity(toDataEntity(asMap(entity, "dataEntity")));
    }
    for (final Object tick : list(raw.get("ticks"))) {
      builder.tick(toTick(asMap(tick, "tick")));
    }
    for (final Object listen : list(raw.get("listens"))) {
      final Map<?, ?> listener = asMap(listen, "listener");
      builder.listen(new Listener(text(listener, "event"), text(listener, "triggers"),
          guardOf(listener)));
    }
    for (final Expression effect : parser.parseAll(list(raw.get("initialEffects")))) {
      builder.initialEffect(effect);
    }
    return builder.build();
  }

  private ConfigSchema toConfigSchema(final Map<?, ?> raw) throws BehaviorEngineException {
    return new ConfigSchema(toConfigFields(raw.get("required")),
        toConfigFields(raw.get("optional")));
  }

  private static List<ConfigField> toConfigFields(final Object raw)
      throws BehaviorEngineException {
    final List<ConfigField> fields = new ArrayList<>();
    for (final Object item : list(raw)) {
      final Map<?, ?> field = asMap(item, "config field");
      final String typeId = text(field, "type");
      final FieldType type = FieldType.fromId(typeId);
      if (type == null) {
        throw new BehaviorEngineException(Code.CATALOG_PARSE_FAILURE,
            "Unknown config field type " + typeId + " for " + text(field, "name"));
      }
      fields.add(new ConfigField(text(field, "name"), type, text(field, "description"),
          field.get("default"), field.get("enum") == null ? null : strings(field.get("enum"))));
    }
    return fields;
  }

  private StateMachineSpec toStateMachine(final Map<?, ?> raw) throws BehaviorEngineException {
    final StateMachineSpecBuilder builder = StateMachineSpecBuilder.newBuilder();
    if (raw.get("initial") != null) {
      builder.initial(text(raw, "initial"));
    }
    for (final Object state : list(raw.get("states"))) {
      if (state instanceof String) {
        builder.state(new State((String) state));
      } else {
        final Map<?, ?> declared = asMap(state, "state");
        builder.state(new State(text(declared, "name"), flag(declared, "isInitial"),
            flag(declared, "isFinal"), text(declared, "description")));
      }
    }
    for (final Object event : list(raw.get("events"))) {
      if (event instanceof String) {
        builder.event(new Event((String) event));
      } else {
        final Map<?, ?> declared = asMap(event, "event");
        builder.event(new Event(text(declared, "key"), text(declared, "name"),
            text(declared, "description")));
      }
    }
    for (final Object transition : list(raw.get("transitions"))) {
      builder.transition(toTransition(asMap(transition, "transition")));
    }
    return builder.build();
  }

  private Transition toTransition(final Map<?, ?> raw) throws BehaviorEngineException {
    final TransitionBuilder builder = TransitionBuilder.newBuilder().to(text(raw, "to"))
        .event(text(raw, "event")).guard(guardOf(raw))
        .effects(parser.parseAll(list(raw.get("effects"))));
    final Object from = raw.get("from");
    if (from instanceof String) {
      builder.from((String) from);
    } else if (from != null) {
      builder.from(strings(from));
    }
    return builder.build();
  }

  private static DataEntity toDataEntity(final Map<?, ?> raw) throws BehaviorEngineException {
    final List<EntityField> fields = new ArrayList<>();
    for (final Object item : list(raw.get("fields"))) {
      final Map<?, ?> field = asMap(item, "entity field");
      fields.add(new EntityField(text(field, "name"), text(field, "type"), field.get("default"),
          flag(field, "required"), text(field, "description")));
    }
    return new DataEntity(text(raw, "name"), flag(raw, "singleton"), flag(raw, "runtime"), fields,
        text(raw, "description"));
  }

  private Tick toTick(final Map<?, ?> raw) throws BehaviorEngineException {
    final Object interval = raw.get("interval");
    final long intervalMillis;
    if (interval == null || frameInterval.equals(interval)) {
      intervalMillis = Tick.FRAME;
    } else if (interval instanceof Number && ((Number) interval).longValue() > 0L) {
      intervalMillis = ((Number) interval).longValue();
    } else {
      throw new BehaviorEngineException(Code.CATALOG_PARSE_FAILURE,
          "Tick interval must be 'frame' or a positive number of millis, got: " + interval);
    }
    final Object priority = raw.get("priority");
    return new Tick(text(raw, "name"), text(raw, "description"), intervalMillis,
        priority instanceof Number ? ((Number) priority).intValue() : 0,
        raw.get("appliesTo") == null ? null : strings(raw.get("appliesTo")), guardOf(raw),
        parser.parseAll(list(raw.get("effects"))));
  }

  private Expression guardOf(final Map<?, ?> raw) throws BehaviorEngineException {
    return raw.get("guard") == null ? null : parser.parse(raw.get("guard"));
  }

  private static Map<?, ?> asMap(final Object raw, final String what)
      throws BehaviorEngineException {
    if (!(raw instanceof Map)) {
      throw new BehaviorEngineException(Code.CATALOG_PARSE_FAILURE,
          what + " must be an object, got: " + raw);
    }
    return (Map<?, ?>) raw;
  }

  private static List<?> list(final Object raw) throws BehaviorEngineException {
    if (raw == null) {
      return Collections.emptyList();
    }
    if (!(raw instanceof List)) {
      throw new BehaviorEngineException(Code.CATALOG_PARSE_FAILURE,
          "Expected an array, got: " + raw);
    }
    return (List<?>) raw;
  }

  private static List<String> strings(final Object raw) throws BehaviorEngineException {
    final List<String> values = new ArrayList<>();
    for (final Object item : list(raw)) {
      if (!(item instanceof String)) {
        throw new BehaviorEngineException(Code.CATALOG_PARSE_FAILURE,
            "Expected an array of strings, got element: " + item);
      }
      values.add((String) item);
    }
    return values;
  }

  private static String text(final Map<?, ?> raw, final String key)
      throws BehaviorEngineException {
    final Object value = raw.get(key);
    if (value == null || value instanceof String) {
      return (String) value;
    }
    throw new BehaviorEngineException(Code.CATALOG_PARSE_FAILURE,
        key + " must be a string, got: " + value);
  }

  private static boolean flag(final Map<?, ?> raw, final String key) {
    return Boolean.TRUE.equals(raw.get(key));
  }

  /**
   * Definitions converted from a catalog, plus the entries that could not be converted keyed by
   * their name (or {@code #index} when unnamed).
   */
  public final static class CatalogLoadResult {
    private final List<BehaviorDefinition> definitions;
    private final Map<String, String> errors;

    CatalogLoadResult(final List<BehaviorDefinition> definitions,
        final Map<String, String> errors) {
      this.definitions = Collections.unmodifiableList(definitions);
      this.errors = Collections.unmodifiableMap(errors);
    }

    public List<BehaviorDefinition> getDefinitions() {
      return definitions;
    }

    public Map<String, String> getErrors() {
      return errors;
    }

    @Override
    public String toString() {
      return "CatalogLoadResult [definitions=" + definitions.size() + ", errors=" + errors + "]";
    }
  }
}
