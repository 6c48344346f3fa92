package com.github.behaviorengine.affinity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Which actions belong on one component type. An action in neither list is permitted.
 */
public final class ActionAffinity {
  private final List<String> valid;
  private final List<String> invalid;

  public ActionAffinity(final List<String> valid, final List<String> invalid) {
    this.valid = Collections.unmodifiableList(new ArrayList<>(valid));
    this.invalid = Collections.unmodifiableList(new ArrayList<>(invalid));
  }

  /**
   * Declaration order is kept, since error messages list these.
   */
  public List<String> getValid() {
    return valid;
  }

  public List<String> getInvalid() {
    return invalid;
  }

  public boolean permits(final String action) {
    return valid.contains(action) || !invalid.contains(action);
  }

  public boolean forbids(final String action) {
    return invalid.contains(action);
  }

  @Override
  public String toString() {
    return "ActionAffinity [valid=" + valid + ", invalid=" + invalid + "]";
  }
}
