package com.cario.phiguard.app.service;

import com.cario.phiguard.app.model.PiiEntity;
import com.cario.phiguard.app.model.PolicySettings;
import com.cario.phiguard.app.model.ResolvedEntitySet;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.extern.log4j.Log4j2;

/**
 * Confidence filter and overlap resolver.
 *
 * <ol>
 *   <li>Entities scoring below the threshold are dropped as if never detected.
 *   <li>Remaining entities are ranked: higher confidence first, then longer span, then earlier
 *       start. Walking the ranking, an entity is kept only if it does not intersect an entity kept
 *       before it. Losers are discarded, never merged.
 *   <li>The survivors are returned sorted by start offset.
 * </ol>
 */
@Log4j2
public class SpanResolver {

  static final Comparator<PiiEntity> PRIORITY =
      Comparator.comparingDouble(PiiEntity::getConfidenceScore)
          .reversed()
          .thenComparing(Comparator.comparingInt(PiiEntity::getLength).reversed())
          .thenComparingInt(PiiEntity::getStartOffset);

  /**
   * @throws com.cario.phiguard.app.exception.ConfigurationException if the threshold is outside
   *     [0,1]
   */
  public ResolvedEntitySet resolve(List<PiiEntity> rawEntities, double threshold) {
    PolicySettings.checkThreshold(threshold);

    List<PiiEntity> ranked = new ArrayList<>();
    for (PiiEntity e : rawEntities) {
      if (e.getConfidenceScore() >= threshold) {
        ranked.add(e);
      }
    }
    int belowThreshold = rawEntities.size() - ranked.size();
    ranked.sort(PRIORITY);

    List<PiiEntity> kept = new ArrayList<>(ranked.size());
    int overlapping = 0;
    for (PiiEntity candidate : ranked) {
      if (intersectsAny(candidate, kept)) {
        overlapping++;
        continue;
      }
      kept.add(candidate);
    }
    kept.sort(Comparator.comparingInt(PiiEntity::getStartOffset));

    if (belowThreshold > 0 || overlapping > 0) {
      log.debug(
          "phiguard.resolve raw={} belowThreshold={} overlapping={} kept={}",
          rawEntities.size(),
          belowThreshold,
          overlapping,
          kept.size());
    }
    return ResolvedEntitySet.of(kept);
  }

  private static boolean intersectsAny(PiiEntity candidate, List<PiiEntity> kept) {
    for (PiiEntity k : kept) {
      if (k.overlaps(candidate)) return true;
    }
    return false;
  }
}
