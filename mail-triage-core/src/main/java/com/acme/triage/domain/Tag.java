package com.acme.triage.domain;

/**
 * One category of the classification taxonomy, named {@code parent.child}. Inactive tags stay in
 * storage but are not offered to the classifier or accepted from it.
 */
public record Tag(
    String name, String description, CategoryType categoryType, boolean active, int priorityOrder) {

  /** The part before the dot, e.g. {@code finance} for {@code finance.aid}. */
  public String parent() {
    int dot = name.indexOf('.');
    return dot < 0 ? name : name.substring(0, dot);
  }
}
