package com.cario.phiguard.app.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.EqualsAndHashCode;

/**
 * Final entity set after threshold filtering and overlap resolution.
 *
 * <p>Invariants, enforced on construction: entities are sorted by {@code startOffset} ascending
 * and no two entities overlap. Every downstream component relies on both.
 */
@EqualsAndHashCode
public final class ResolvedEntitySet implements Iterable<PiiEntity> {

  private static final ResolvedEntitySet EMPTY = new ResolvedEntitySet(List.of());

  private final List<PiiEntity> entities;

  private ResolvedEntitySet(List<PiiEntity> entities) {
    this.entities = entities;
  }

  public static ResolvedEntitySet empty() {
    return EMPTY;
  }

  /**
   * Wraps an already sorted, disjoint list.
   *
   * @throws IllegalArgumentException if the list is unsorted or contains overlapping spans
   */
  public static ResolvedEntitySet of(List<PiiEntity> sortedDisjoint) {
    if (sortedDisjoint.isEmpty()) {
      return EMPTY;
    }
    List<PiiEntity> copy = List.copyOf(sortedDisjoint);
    for (int i = 1; i < copy.size(); i++) {
      PiiEntity prev = copy.get(i - 1);
      PiiEntity cur = copy.get(i);
      if (cur.getStartOffset() < prev.endOffset()) {
        throw new IllegalArgumentException(
            "entities must be sorted and disjoint: " + prev.describe() + " / " + cur.describe());
      }
    }
    return new ResolvedEntitySet(copy);
  }

  public int size() {
    return entities.size();
  }

  public boolean isEmpty() {
    return entities.isEmpty();
  }

  @JsonValue
  public List<PiiEntity> asList() {
    return entities;
  }

  /** Number of entities per category, in order of first appearance. */
  public Map<String, Integer> countByCategory() {
    Map<String, Integer> summary = new LinkedHashMap<>();
    for (PiiEntity e : entities) {
      summary.merge(e.getCategory().getName(), 1, Integer::sum);
    }
    return summary;
  }

  @Override
  public Iterator<PiiEntity> iterator() {
    return entities.iterator();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("[");
    for (int i = 0; i < entities.size(); i++) {
      if (i > 0) sb.append(", ");
      sb.append(entities.get(i).describe());
    }
    return sb.append(']').toString();
  }
}
