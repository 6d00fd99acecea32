package org.neurobagel.api.core.pojo;

import java.util.Arrays;
import java.util.Optional;

/**
 * Enumerated sex values a subject can be annotated with. Matching against request values is exact.
 */
public enum Sex {
  MALE("male"),
  FEMALE("female"),
  OTHER("other");

  private final String label;

  Sex(String label) {
    this.label = label;
  }

  /**
   * @return the label as it appears in requests and in the graph
   */
  public String getLabel() {
    return label;
  }

  public static Optional<Sex> fromLabel(String label) {
    return Arrays.stream(values()).filter(s -> s.label.equals(label)).findFirst();
  }
}
