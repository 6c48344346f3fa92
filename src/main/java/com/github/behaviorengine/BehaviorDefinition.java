package com.github.behaviorengine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.github.behaviorengine.expression.Expression;

/**
 * Static, immutable description of a reusable behavior: its identity, activation parameters, state
 * machine, data entities, ticks, listeners and activation effects.
 *
 * Definitions are plain data. Nothing here checks well-formedness; see {@link BehaviorValidator}.
 */
public final class BehaviorDefinition {
  public static final String NAMESPACE = "std/";

  private final String name;
  private final String category;
  private final String description;
  private final List<String> suggestedFor;
  private final ConfigSchema configSchema;
  private final StateMachineSpec stateMachine;
  private final List<DataEntity> dataEntities;
  private final List<Tick> ticks;
  private final List<Listener> listens;
  private final List<Expression> initialEffects;

  private BehaviorDefinition(final BehaviorDefinitionBuilder builder) {
    this.name = builder.name;
    this.category = builder.category;
    this.description = builder.description == null ? "" : builder.description;
    this.suggestedFor = Collections.unmodifiableList(new ArrayList<>(builder.suggestedFor));
    this.configSchema = builder.configSchema == null ? ConfigSchema.EMPTY : builder.configSchema;
    this.stateMachine = builder.stateMachine;
    this.dataEntities = Collections.unmodifiableList(new ArrayList<>(builder.dataEntities));
    this.ticks = Collections.unmodifiableList(new ArrayList<>(builder.ticks));
    this.listens = Collections.unmodifiableList(new ArrayList<>(builder.listens));
    this.initialEffects = Collections.unmodifiableList(new ArrayList<>(builder.initialEffects));
  }

  public String getName() {
    return name;
  }

  /**
   * The category exactly as declared, which may be outside the fixed set.
   */
  public String getCategoryId() {
    return category;
  }

  /**
   * Null when the declared category is not one of {@link BehaviorCategory}.
   */
  public BehaviorCategory getCategory() {
    return BehaviorCategory.fromId(category);
  }

  public String getDescription() {
    return description;
  }

  public List<String> getSuggestedFor() {
    return suggestedFor;
  }

  public ConfigSchema getConfigSchema() {
    return configSchema;
  }

  public StateMachineSpec getStateMachine() {
    return stateMachine;
  }

  public boolean hasStateMachine() {
    return stateMachine != null;
  }

  public List<DataEntity> getDataEntities() {
    return dataEntities;
  }

  public DataEntity getDataEntity(final String entityName) {
    for (final DataEntity entity : dataEntities) {
      if (entity.getName().equals(entityName)) {
        return entity;
      }
    }
    return null;
  }

  public boolean hasSingletonEntities() {
    for (final DataEntity entity : dataEntities) {
      if (entity.isSingleton()) {
        return true;
      }
    }
    return false;
  }

  public List<Tick> getTicks() {
    return ticks;
  }

  public List<Listener> getListens() {
    return listens;
  }

  public List<Expression> getInitialEffects() {
    return initialEffects;
  }

  @Override
  public String toString() {
    return "BehaviorDefinition [name=" + name + ", category=" + category + ", stateMachine="
        + stateMachine + ", dataEntities=" + dataEntities.size() + ", ticks=" + ticks.size()
        + ", listens=" + listens.size() + "]";
  }

  /**
   * A simple builder to let users use fluent APIs to author behaviors in code.
   */
  public final static class BehaviorDefinitionBuilder {
    private String name;
    private String category;
    private String description;
    private final List<String> suggestedFor = new ArrayList<>();
    private ConfigSchema configSchema;
    private StateMachineSpec stateMachine;
    private final List<DataEntity> dataEntities = new ArrayList<>();
    private final List<Tick> ticks = new ArrayList<>();
    private final List<Listener> listens = new ArrayList<>();
    private final List<Expression> initialEffects = new ArrayList<>();

    public static BehaviorDefinitionBuilder newBuilder() {
      return new BehaviorDefinitionBuilder();
    }

    public BehaviorDefinitionBuilder name(final String name) {
      this.name = name;
      return this;
    }

    public BehaviorDefinitionBuilder category(final BehaviorCategory category) {
      this.category = category == null ? null : category.getId();
      return this;
    }

    public BehaviorDefinitionBuilder category(final String category) {
      this.category = category;
      return this;
    }

    public BehaviorDefinitionBuilder description(final String description) {
      this.description = description;
      return this;
    }

    public BehaviorDefinitionBuilder suggestedFor(final String... hints) {
      this.suggestedFor.addAll(Arrays.asList(hints));
      return this;
    }

    public BehaviorDefinitionBuilder suggestedFor(final List<String> hints) {
      this.suggestedFor.addAll(hints);
      return this;
    }

    public BehaviorDefinitionBuilder configSchema(final ConfigSchema configSchema) {
      this.configSchema = configSchema;
      return this;
    }

    public BehaviorDefinitionBuilder stateMachine(final StateMachineSpec stateMachine) {
      this.stateMachine = stateMachine;
      return this;
    }

    public BehaviorDefinitionBuilder dataEntity(final DataEntity dataEntity) {
      this.dataEntities.add(dataEntity);
      return this;
    }

    public BehaviorDefinitionBuilder tick(final Tick tick) {
      this.ticks.add(tick);
      return this;
    }

    public BehaviorDefinitionBuilder listen(final Listener listener) {
      this.listens.add(listener);
      return this;
    }

    public BehaviorDefinitionBuilder initialEffect(final Expression effect) {
      this.initialEffects.add(effect);
      return this;
    }

    public BehaviorDefinition build() {
      return new BehaviorDefinition(this);
    }

    private BehaviorDefinitionBuilder() {}
  }
}
