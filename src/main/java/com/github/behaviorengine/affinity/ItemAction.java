package com.github.behaviorengine.affinity;

/**
 * An action attached to a rendered component, e.g. a row button on a table.
 */
public final class ItemAction {
  private final String label;
  private final String event;
  private final String navigatesTo;
  private final String placement;
  private final String variant;

  public ItemAction(final String label, final String event, final String navigatesTo,
      final String placement, final String variant) {
    this.label = label;
    this.event = event;
    this.navigatesTo = navigatesTo;
    this.placement = placement;
    this.variant = variant;
  }

  public static ItemAction forEvent(final String event) {
    return new ItemAction(event, event, null, null, null);
  }

  public String getLabel() {
    return label;
  }

  /**
   * Null for navigation-only actions.
   */
  public String getEvent() {
    return event;
  }

  public String getNavigatesTo() {
    return navigatesTo;
  }

  /**
   * One of row, bulk, card, footer, header, or null.
   */
  public String getPlacement() {
    return placement;
  }

  public String getVariant() {
    return variant;
  }

  @Override
  public String toString() {
    return "ItemAction [label=" + label + ", event=" + event + "]";
  }
}
