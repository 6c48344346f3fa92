package com.github.behaviorengine;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.behaviorengine.affinity.ActionAffinityMatrix;
import com.github.behaviorengine.expression.OperatorRegistry;

/**
 * Immutable catalog of validated behavior definitions.
 *
 * Notes for users:<br>
 * 1. a registry is a plain value owned by whoever builds it; there is no process-wide instance<br>
 * 2. definitions failing {@link BehaviorValidator#validateAll} are kept out and reported through
 * {@link #getRejected()}; they never block the rest of the catalog<br>
 * 3. action-affinity findings do not reject a definition, they are kept as warnings<br>
 * 4. a definition whose name is already registered is rejected<br>
 */
public final class BehaviorRegistry {
  private static final Logger logger = LogManager.getLogger(BehaviorRegistry.class.getSimpleName());

  private static final int maxSuggestionDistance = 3;

  private final Map<String, BehaviorDefinition> behaviors;
  private final Map<BehaviorCategory, List<BehaviorDefinition>> byCategory;
  private final Map<String, List<String>> rejected;
  private final Map<String, List<String>> warnings;
  private final OperatorRegistry operators;
  private final ActionAffinityMatrix affinity;

  private BehaviorRegistry(final BehaviorRegistryBuilder builder) {
    this.operators = builder.operators;
    this.affinity = builder.affinity;
    final Map<String, BehaviorDefinition> accepted = new LinkedHashMap<>();
    final Map<String, List<String>> rejects = new LinkedHashMap<>();
    final Map<String, List<String>> findings = new LinkedHashMap<>();
    for (final BehaviorDefinition definition : builder.definitions) {
      final String name = String.valueOf(definition.getName());
      final List<String> errors = BehaviorValidator.validateAll(definition, operators);
      if (errors.isEmpty() && accepted.containsKey(name)) {
        errors.add("Duplicate behavior name: " + name);
      }
      if (!errors.isEmpty()) {
        logger.warn(String.format("Rejected behavior %s: %s", name, errors));
        rejects.put(rejects.containsKey(name) ? name + "#" + rejects.size() : name,
            Collections.unmodifiableList(errors));
        continue;
      }
      final List<String> affinityFindings =
          BehaviorValidator.validateActionAffinity(definition, affinity);
      if (!affinityFindings.isEmpty()) {
        logger.warn(String.format("Behavior %s has action affinity findings: %s", name,
            affinityFindings));
        findings.put(name, Collections.unmodifiableList(affinityFindings));
      }
      accepted.put(name, definition);
    }
    this.behaviors = Collections.unmodifiableMap(accepted);
    this.rejected = Collections.unmodifiableMap(rejects);
    this.warnings = Collections.unmodifiableMap(findings);

    final Map<BehaviorCategory, List<BehaviorDefinition>> grouped =
        new EnumMap<>(BehaviorCategory.class);
    for (final BehaviorCategory category : BehaviorCategory.values()) {
      grouped.put(category, new ArrayList<BehaviorDefinition>());
    }
    for (final BehaviorDefinition definition : accepted.values()) {
      grouped.get(definition.getCategory()).add(definition);
    }
    for (final Map.Entry<BehaviorCategory, List<BehaviorDefinition>> entry : grouped.entrySet()) {
      entry.setValue(Collections.unmodifiableList(entry.getValue()));
    }
    this.byCategory = Collections.unmodifiableMap(grouped);
    logger.info(String.format("Built behavior registry with %d behaviors, %d rejected",
        behaviors.size(), rejected.size()));
  }

  public BehaviorDefinition get(final String name) {
    return behaviors.get(name);
  }

  public boolean has(final String name) {
    return behaviors.containsKey(name);
  }

  /**
   * Names of all registered behaviors in registration order.
   */
  public List<String> list() {
    return Collections.unmodifiableList(new ArrayList<>(behaviors.keySet()));
  }

  public List<BehaviorDefinition> listByCategory(final BehaviorCategory category) {
    final List<BehaviorDefinition> definitions = byCategory.get(category);
    return definitions == null ? Collections.<BehaviorDefinition>emptyList() : definitions;
  }

  public Collection<BehaviorDefinition> getAll() {
    return behaviors.values();
  }

  public List<BehaviorMetadata> getAllMetadata() {
    final List<BehaviorMetadata> metadata = new ArrayList<>();
    for (final BehaviorDefinition definition : behaviors.values()) {
      metadata.add(BehaviorMetadata.of(definition));
    }
    return metadata;
  }

  /**
   * Behaviors whose hints contain the use case, or are contained in it, ignoring case.
   */
  public List<BehaviorDefinition> findBehaviorsForUseCase(final String useCase) {
    final List<BehaviorDefinition> matches = new ArrayList<>();
    if (useCase == null) {
      return matches;
    }
    final String needle = useCase.toLowerCase(Locale.ROOT);
    for (final BehaviorDefinition definition : behaviors.values()) {
      for (final String hint : definition.getSuggestedFor()) {
        final String lowered = hint.toLowerCase(Locale.ROOT);
        if (lowered.contains(needle) || needle.contains(lowered)) {
          matches.add(definition);
          break;
        }
      }
    }
    return matches;
  }

  /**
   * Behaviors whose state machine declares the event.
   */
  public List<BehaviorDefinition> getBehaviorsForEvent(final String eventKey) {
    final List<BehaviorDefinition> matches = new ArrayList<>();
    for (final BehaviorDefinition definition : behaviors.values()) {
      if (definition.hasStateMachine() && definition.getStateMachine().hasEvent(eventKey)) {
        matches.add(definition);
      }
    }
    return matches;
  }

  /**
   * Behaviors whose state machine declares the state.
   */
  public List<BehaviorDefinition> getBehaviorsWithState(final String stateName) {
    final List<BehaviorDefinition> matches = new ArrayList<>();
    for (final BehaviorDefinition definition : behaviors.values()) {
      if (definition.hasStateMachine() && definition.getStateMachine().hasState(stateName)) {
        matches.add(definition);
      }
    }
    return matches;
  }

  /**
   * Checks a behavior name used by some authored artifact. Empty when the name is registered,
   * otherwise a message, with close matches when there are any.
   */
  public Optional<String> validateBehaviorReference(final String name) {
    if (name == null || !name.startsWith(BehaviorDefinition.NAMESPACE)) {
      return Optional.of("Behavior name must start with 'std/': " + name);
    }
    if (behaviors.containsKey(name)) {
      return Optional.empty();
    }
    final List<String> similar = findSimilar(name);
    if (!similar.isEmpty()) {
      return Optional.of(String.format("Unknown behavior '%s'. Did you mean: %s?", name,
          String.join(", ", similar)));
    }
    return Optional.of("Unknown behavior: " + name);
  }

  List<String> findSimilar(final String name) {
    final String target = stripNamespace(name);
    final List<String> similar = new ArrayList<>();
    for (final String candidate : behaviors.keySet()) {
      final String stripped = stripNamespace(candidate);
      if (stripped.contains(target) || target.contains(stripped)
          || levenshtein(stripped, target) <= maxSuggestionDistance) {
        similar.add(candidate);
      }
    }
    return similar;
  }

  private static String stripNamespace(final String name) {
    return name.toLowerCase(Locale.ROOT).replaceFirst(BehaviorDefinition.NAMESPACE, "");
  }

  static int levenshtein(final String one, final String two) {
    int[] previous = new int[two.length() + 1];
    int[] current = new int[two.length() + 1];
    for (int col = 0; col <= two.length(); col++) {
      previous[col] = col;
    }
    for (int row = 1; row <= one.length(); row++) {
      current[0] = row;
      for (int col = 1; col <= two.length(); col++) {
        final int cost = one.charAt(row - 1) == two.charAt(col - 1) ? 0 : 1;
        current[col] = Math.min(Math.min(current[col - 1] + 1, previous[col] + 1),
            previous[col - 1] + cost);
      }
      final int[] swap = previous;
      previous = current;
      current = swap;
    }
    return previous[two.length()];
  }

  public LibraryStats getBehaviorLibraryStats() {
    final Map<String, Integer> countsByCategory = new TreeMap<>();
    int states = 0, events = 0, transitions = 0, ticks = 0;
    for (final BehaviorDefinition definition : behaviors.values()) {
      final String category = definition.getCategoryId();
      final Integer count = countsByCategory.get(category);
      countsByCategory.put(category, count == null ? 1 : count + 1);
      if (definition.hasStateMachine()) {
        states += definition.getStateMachine().getStates().size();
        events += definition.getStateMachine().getEvents().size();
        transitions += definition.getStateMachine().getTransitions().size();
      }
      ticks += definition.getTicks().size();
    }
    return new LibraryStats(behaviors.size(), countsByCategory, states, events, transitions,
        ticks);
  }

  /**
   * Names of rejected definitions with the reasons they were rejected. A repeated rejected name is
   * suffixed with {@code #n}.
   */
  public Map<String, List<String>> getRejected() {
    return rejected;
  }

  /**
   * Action-affinity findings of registered behaviors, by behavior name.
   */
  public Map<String, List<String>> getWarnings() {
    return warnings;
  }

  public OperatorRegistry getOperators() {
    return operators;
  }

  public ActionAffinityMatrix getAffinity() {
    return affinity;
  }

  public int size() {
    return behaviors.size();
  }

  @Override
  public String toString() {
    return "BehaviorRegistry [behaviors=" + behaviors.keySet() + ", rejected=" + rejected.keySet()
        + "]";
  }

  /**
   * Aggregate counts over a registry.
   */
  public final static class LibraryStats {
    private final int totalBehaviors;
    private final Map<String, Integer> byCategory;
    private final int totalStates;
    private final int totalEvents;
    private final int totalTransitions;
    private final int totalTicks;

    LibraryStats(final int totalBehaviors, final Map<String, Integer> byCategory,
        final int totalStates, final int totalEvents, final int totalTransitions,
        final int totalTicks) {
      this.totalBehaviors = totalBehaviors;
      this.byCategory = Collections.unmodifiableMap(byCategory);
      this.totalStates = totalStates;
      this.totalEvents = totalEvents;
      this.totalTransitions = totalTransitions;
      this.totalTicks = totalTicks;
    }

    public int getTotalBehaviors() {
      return totalBehaviors;
    }

    public Map<String, Integer> getByCategory() {
      return byCategory;
    }

    public int getTotalStates() {
      return totalStates;
    }

    public int getTotalEvents() {
      return totalEvents;
    }

    public int getTotalTransitions() {
      return totalTransitions;
    }

    public int getTotalTicks() {
      return totalTicks;
    }

    @Override
    public String toString() {
      return "LibraryStats [totalBehaviors=" + totalBehaviors + ", byCategory=" + byCategory
          + ", totalStates=" + totalStates + ", totalEvents=" + totalEvents
          + ", totalTransitions=" + totalTransitions + ", totalTicks=" + totalTicks + "]";
    }
  }

  public final static class BehaviorRegistryBuilder {
    private OperatorRegistry operators = OperatorRegistry.standard();
    private ActionAffinityMatrix affinity = ActionAffinityMatrix.defaults();
    private final List<BehaviorDefinition> definitions = new ArrayList<>();

    public static BehaviorRegistryBuilder newBuilder() {
      return new BehaviorRegistryBuilder();
    }

    public BehaviorRegistryBuilder operators(final OperatorRegistry operators) {
      this.operators = operators;
      return this;
    }

    public BehaviorRegistryBuilder affinity(final ActionAffinityMatrix affinity) {
      this.affinity = affinity;
      return this;
    }

    public BehaviorRegistryBuilder register(final BehaviorDefinition definition) {
      if (definition != null) {
        this.definitions.add(definition);
      }
      return this;
    }

    public BehaviorRegistryBuilder registerAll(final List<BehaviorDefinition> definitions) {
      for (final BehaviorDefinition definition : definitions) {
        register(definition);
      }
      return this;
    }

    public BehaviorRegistry build() throws BehaviorEngineException {
      final StringBuilder messages = new StringBuilder();
      if (operators == null) {
        messages.append("OperatorRegistry cannot be null. ");
      }
      if (affinity == null) {
        messages.append("ActionAffinityMatrix cannot be null. ");
      }
      if (messages.length() > 0) {
        throw new BehaviorEngineException(BehaviorEngineException.Code.INVALID_ENGINE_CONFIG,
            messages.toString());
      }
      return new BehaviorRegistry(this);
    }

    private BehaviorRegistryBuilder() {}
  }
}
