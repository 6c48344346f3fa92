package com.github.behaviorengine.affinity;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The "Closed Circuit" contract between behaviors and renderers: which actions are legal on which
 * component types, and which components emit which UI events.
 *
 * Unknown components are open: every action is permitted on them and nothing is reported.
 * Immutable; use {@link #defaults()} for the standard matrix or the builder for a custom one.
 */
public final class ActionAffinityMatrix {
  private static final ActionAffinityMatrix defaultMatrix = buildDefaults();

  private final Map<String, ActionAffinity> affinities;
  private final Map<String, UiEvent> uiEvents;
  private final Map<String, List<String>> componentCategories;

  private ActionAffinityMatrix(final Map<String, ActionAffinity> affinities,
      final Map<String, UiEvent> uiEvents, final Map<String, List<String>> componentCategories) {
    this.affinities = Collections.unmodifiableMap(affinities);
    this.uiEvents = Collections.unmodifiableMap(uiEvents);
    this.componentCategories = Collections.unmodifiableMap(componentCategories);
  }

  public static ActionAffinityMatrix defaults() {
    return defaultMatrix;
  }

  public static ActionAffinityMatrixBuilder newBuilder() {
    return new ActionAffinityMatrixBuilder();
  }

  public ActionAffinity getAffinity(final String component) {
    return affinities.get(component);
  }

  public boolean isActionValidForComponent(final String action, final String component) {
    final ActionAffinity affinity = affinities.get(component);
    return affinity == null || affinity.permits(action);
  }

  public boolean isActionInvalidForComponent(final String action, final String component) {
    final ActionAffinity affinity = affinities.get(component);
    return affinity != null && affinity.forbids(action);
  }

  public List<String> getValidActionsForComponent(final String component) {
    final ActionAffinity affinity = affinities.get(component);
    return affinity == null ? Collections.<String>emptyList() : affinity.getValid();
  }

  public List<String> getInvalidActionsForComponent(final String component) {
    final ActionAffinity affinity = affinities.get(component);
    return affinity == null ? Collections.<String>emptyList() : affinity.getInvalid();
  }

  public List<String> getComponentsForEvent(final String event) {
    final UiEvent uiEvent = uiEvents.get(event);
    return uiEvent == null ? Collections.<String>emptyList() : uiEvent.getEmittedBy();
  }

  public UiEvent getUiEvent(final String event) {
    return uiEvents.get(event);
  }

  /**
   * One message per explicitly forbidden action, naming the valid alternatives. Actions without
   * an event (pure navigation) are never checked.
   */
  public List<String> validateActionsForComponent(final List<ItemAction> actions,
      final String component) {
    final List<String> errors = new ArrayList<>();
    final ActionAffinity affinity = affinities.get(component);
    if (affinity == null || actions == null) {
      return errors;
    }
    for (final ItemAction action : actions) {
      if (action.getEvent() != null && affinity.forbids(action.getEvent())) {
        errors.add(String.format("Action \"%s\" is not valid on \"%s\". Valid actions: %s",
            action.getEvent(), component, String.join(", ", affinity.getValid())));
      }
    }
    return errors;
  }

  public List<String> getAllKnownComponents() {
    return new ArrayList<>(affinities.keySet());
  }

  public Map<String, List<String>> getComponentsByCategory() {
    return componentCategories;
  }

  @Override
  public String toString() {
    return "ActionAffinityMatrix [components=" + affinities.size() + ", uiEvents="
        + uiEvents.size() + "]";
  }

  private static ActionAffinityMatrix buildDefaults() {
    final List<String> crudDisallowed = list("SAVE", "CANCEL", "SUBMIT", "CREATE", "CLOSE");
    final List<String> mutatingDisallowed = list("SAVE", "CREATE", "DELETE", "VIEW", "EDIT");
    final List<String> nothing = Collections.emptyList();

    return newBuilder()
        // display
        .component("entity-table", list("VIEW", "EDIT", "DELETE", "SELECT", "SORT", "PAGE"),
            crudDisallowed)
        .component("entity-list", list("VIEW", "EDIT", "DELETE", "SELECT"), crudDisallowed)
        .component("entity-cards", list("VIEW", "EDIT", "DELETE", "SELECT"), crudDisallowed)
        .component("card-grid", list("VIEW", "EDIT", "DELETE", "SELECT"), crudDisallowed)
        // header
        .component("page-header", list("CREATE", "REFRESH", "EXPORT", "IMPORT", "BACK", "FILTER"),
            list("SAVE", "VIEW", "EDIT", "DELETE", "SUBMIT"))
        // form
        .component("form",
            list("SAVE", "CANCEL", "SUBMIT", "CLOSE", "RESET", "FIELD_CHANGE", "FIELD_BLUR"),
            list("VIEW", "DELETE", "CREATE", "SELECT", "EDIT"))
        .component("form-section", list("FIELD_CHANGE", "FIELD_BLUR"),
            list("SAVE", "VIEW", "DELETE", "CREATE", "SELECT", "EDIT"))
        .component("form-actions", list("SAVE", "CANCEL", "SUBMIT", "RESET"),
            list("VIEW", "DELETE", "CREATE", "SELECT", "EDIT"))
        // detail
        .component("detail-panel", list("EDIT", "DELETE", "CLOSE", "BACK"),
            list("SAVE", "CREATE", "SELECT", "SUBMIT"))
        .component("entity-detail", list("EDIT", "DELETE", "CLOSE", "BACK"),
            list("SAVE", "CREATE", "SELECT", "SUBMIT"))
        // container
        .component("modal", list("CLOSE", "CONFIRM", "CANCEL"),
            list("VIEW", "CREATE", "EDIT", "DELETE"))
        .component("modal-container", list("CLOSE", "CONFIRM", "CANCEL"),
            list("VIEW", "CREATE", "EDIT", "DELETE"))
        .component("drawer", list("CLOSE"), list("VIEW", "CREATE", "DELETE"))
        // navigation
        .component("tabs", list("SELECT_TAB"), mutatingDisallowed)
        .component("tab-bar", list("SELECT_TAB"), mutatingDisallowed)
        .component("wizard-navigation", list("NEXT", "PREV", "GO_TO", "COMPLETE"),
            mutatingDisallowed)
        .component("wizard-progress", list("GO_TO"),
            list("SAVE", "CREATE", "DELETE", "VIEW", "EDIT", "NEXT", "PREV"))
        // filter
        .component("filter-group", list("SET_FILTER", "CLEAR_FILTER", "CLEAR_ALL"),
            mutatingDisallowed)
        .component("search-bar", list("SEARCH", "CLEAR_SEARCH"), mutatingDisallowed)
        .component("search-input", list("SEARCH", "CLEAR_SEARCH"), mutatingDisallowed)
        // pagination
        .component("pagination", list("NEXT_PAGE", "PREV_PAGE", "GO_TO_PAGE", "SET_PAGE_SIZE"),
            mutatingDisallowed)
        // confirmation
        .component("confirm-dialog", list("CONFIRM", "CANCEL"),
            list("VIEW", "CREATE", "EDIT", "DELETE", "SAVE"))
        // state
        .component("empty-state", list("CREATE"), list("SAVE", "VIEW", "EDIT", "DELETE", "CANCEL"))
        .component("loading-state", nothing,
            list("SAVE", "VIEW", "EDIT", "DELETE", "CREATE", "CANCEL"))
        // dashboard
        .component("stats", nothing, list("SAVE", "VIEW", "EDIT", "DELETE", "CREATE", "CANCEL"))
        // game
        .component("game-canvas", list("INPUT", "PAUSE", "UNPAUSE"),
            list("SAVE", "CREATE", "DELETE"))
        .component("game-hud", list("PAUSE"), mutatingDisallowed)
        .component("game-controls", list("INPUT", "ACTION"), mutatingDisallowed)
        .component("game-menu", list("START", "OPTIONS", "QUIT", "SELECT"), mutatingDisallowed)
        .component("game-pause-overlay", list("RESUME", "QUIT", "OPTIONS"), mutatingDisallowed)
        .component("game-over-screen", list("RETRY", "QUIT", "MAIN_MENU"), mutatingDisallowed)

        .uiEvent(new UiEvent("VIEW", list("entity-table", "entity-list", "entity-cards",
            "card-grid"), payload("row", "object", "entity", "string"), "View item detail"))
        .uiEvent(new UiEvent("EDIT", list("entity-table", "entity-list", "entity-cards",
            "detail-panel"), payload("row", "object", "entity", "string"), "Edit item"))
        .uiEvent(new UiEvent("DELETE", list("entity-table", "entity-list", "entity-cards",
            "detail-panel"), payload("row", "object", "entity", "string"), "Delete item"))
        .uiEvent(new UiEvent("CREATE", list("page-header", "empty-state"),
            payload("entity", "string"), "Create new item"))
        .uiEvent(new UiEvent("SAVE", list("form", "form-actions"),
            payload("data", "object", "entity", "string"), "Save form data"))
        .uiEvent(new UiEvent("CANCEL", list("form", "form-actions", "modal", "confirm-dialog"),
            payload(), "Cancel form/modal"))
        .uiEvent(new UiEvent("CLOSE", list("modal", "drawer", "detail-panel"), payload(),
            "Close modal/drawer"))
        .uiEvent(new UiEvent("SELECT", list("entity-table", "entity-list", "entity-cards"),
            payload("selectedIds", "string[]"), "Selection change"))
        .uiEvent(new UiEvent("SEARCH", list("search-bar", "search-input"),
            payload("searchTerm", "string"), "Search filter"))
        .uiEvent(new UiEvent("CONFIRM", list("modal", "confirm-dialog"), payload(),
            "Confirm action"))
        .uiEvent(new UiEvent("SELECT_TAB", list("tabs", "tab-bar"), payload("tabId", "string"),
            "Tab selection"))
        .uiEvent(new UiEvent("NEXT", list("wizard-navigation"), payload(), "Wizard next step"))
        .uiEvent(new UiEvent("PREV", list("wizard-navigation"), payload(),
            "Wizard previous step"))

        .category("display", "entity-table", "entity-list", "entity-cards", "card-grid")
        .category("header", "page-header")
        .category("form", "form", "form-section", "form-actions")
        .category("detail", "detail-panel", "entity-detail")
        .category("container", "modal", "modal-container", "drawer")
        .category("navigation", "tabs", "tab-bar", "wizard-navigation", "wizard-progress")
        .category("filter", "filter-group", "search-bar", "search-input")
        .category("pagination", "pagination")
        .category("confirmation", "confirm-dialog")
        .category("state", "empty-state", "loading-state")
        .category("dashboard", "stats")
        .category("game", "game-canvas", "game-hud", "game-controls", "game-menu",
            "game-pause-overlay", "game-over-screen")
        .build();
  }

  private static List<String> list(final String... items) {
    return Arrays.asList(items);
  }

  private static Map<String, String> payload(final String... fieldsAndTypes) {
    final Map<String, String> payload = new LinkedHashMap<>();
    for (int iter = 0; iter + 1 < fieldsAndTypes.length; iter += 2) {
      payload.put(fieldsAndTypes[iter], fieldsAndTypes[iter + 1]);
    }
    return payload;
  }

  public final static class ActionAffinityMatrixBuilder {
    private final Map<String, ActionAffinity> affinities = new LinkedHashMap<>();
    private final Map<String, UiEvent> uiEvents = new LinkedHashMap<>();
    private final Map<String, List<String>> componentCategories = new LinkedHashMap<>();

    public ActionAffinityMatrixBuilder component(final String component, final List<String> valid,
        final List<String> invalid) {
      affinities.put(component, new ActionAffinity(valid, invalid));
      return this;
    }

    public ActionAffinityMatrixBuilder uiEvent(final UiEvent uiEvent) {
      uiEvents.put(uiEvent.getEvent(), uiEvent);
      return this;
    }

    public ActionAffinityMatrixBuilder category(final String category,
        final String... components) {
      componentCategories.put(category, Collections.unmodifiableList(Arrays.asList(components)));
      return this;
    }

    public ActionAffinityMatrix build() {
      return new ActionAffinityMatrix(new LinkedHashMap<>(affinities),
          new LinkedHashMap<>(uiEvents), new LinkedHashMap<>(componentCategories));
    }

    private ActionAffinityMatrixBuilder() {}
  }

}
