package com.acme.triage.classification;

import com.acme.triage.domain.Tag;
import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Known category parents, taken from the active tags. A category is accepted when it is well
 * formed and its parent is known, so classifiers may coin new subcategories under an existing
 * parent but not new parents. An empty taxonomy accepts every well-formed category.
 */
public final class Taxonomy {

  private static final Taxonomy OPEN = new Taxonomy(Set.of());

  private final Set<String> parents;

  private Taxonomy(Set<String> parents) {
    this.parents = parents;
  }

  public static Taxonomy open() {
    return OPEN;
  }

  public static Taxonomy of(Collection<Tag> tags) {
    Set<String> parents = new TreeSet<>();
    for (Tag tag : tags) {
      if (tag.active()) {
        parents.add(tag.parent());
      }
    }
    return parents.isEmpty() ? OPEN : new Taxonomy(Collections.unmodifiableSet(parents));
  }

  public boolean isOpen() {
    return parents.isEmpty();
  }

  public boolean knows(String category) {
    if (isOpen()) {
      return true;
    }
    int dot = category.indexOf('.');
    return dot > 0 && parents.contains(category.substring(0, dot));
  }

  public Set<String> parents() {
    return parents;
  }
}
