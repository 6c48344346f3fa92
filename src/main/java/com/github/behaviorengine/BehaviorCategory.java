package com.github.behaviorengine;

/**
 * The fixed set of behavior categories. Definitions carry the raw category string so that the
 * structural validator can report unknown ones.
 */
public enum BehaviorCategory {
  UI_INTERACTION("ui-interaction"), DATA_MANAGEMENT("data-management"), ASYNC("async"),
  FEEDBACK("feedback"), GAME_CORE("game-core"), GAME_ENTITY("game-entity"), GAME_UI("game-ui");

  private final String id;

  private BehaviorCategory(final String id) {
    this.id = id;
  }

  public String getId() {
    return id;
  }

  public boolean isGame() {
    return this == GAME_CORE || this == GAME_ENTITY || this == GAME_UI;
  }

  /**
   * Returns null for ids outside the fixed set.
   */
  public static BehaviorCategory fromId(final String id) {
    for (final BehaviorCategory category : values()) {
      if (category.id.equals(id)) {
        return category;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return id;
  }
}
