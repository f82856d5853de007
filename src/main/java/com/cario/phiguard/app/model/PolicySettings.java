package com.cario.phiguard.app.model;

import com.cario.phiguard.app.exception.ConfigurationException;
import com.cario.phiguard.app.exception.ConfigurationException.Reason;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Validated, immutable configuration snapshot used for one query.
 *
 * <p>Instances are only obtained through {@link #of} or {@link #withOverrides}, both of which
 * validate every field and fail with an enumerated {@link ConfigurationException}.
 */
@Value
@Builder(access = AccessLevel.PRIVATE, toBuilder = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PolicySettings {

  PolicyMode mode;
  double confidenceThreshold;
  DomainFilter domainFilter;
  String language;
  boolean enableGrounding;

  public static PolicySettings of(
      String mode,
      double confidenceThreshold,
      String domainFilter,
      String language,
      boolean enableGrounding) {
    return PolicySettings.builder()
        .mode(parseMode(mode))
        .confidenceThreshold(checkThreshold(confidenceThreshold))
        .domainFilter(parseDomain(domainFilter))
        .language(checkLanguage(language))
        .enableGrounding(enableGrounding)
        .build();
  }

  /**
   * Returns a new snapshot with the non-null overrides applied. This instance is left untouched.
   */
  public PolicySettings withOverrides(String mode, Double confidenceThreshold, Boolean grounding) {
    PolicySettingsBuilder b = toBuilder();
    if (mode != null) b.mode(parseMode(mode));
    if (confidenceThreshold != null) b.confidenceThreshold(checkThreshold(confidenceThreshold));
    if (grounding != null) b.enableGrounding(grounding);
    return b.build();
  }

  public static double checkThreshold(double threshold) {
    if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
      throw new ConfigurationException(
          Reason.THRESHOLD_OUT_OF_RANGE,
          "confidenceThreshold must be within [0,1] but was " + threshold);
    }
    return threshold;
  }

  private static PolicyMode parseMode(String mode) {
    PolicyMode parsed = PolicyMode.parse(mode);
    if (parsed == null) {
      throw new ConfigurationException(
          Reason.UNSUPPORTED_MODE, "mode must be one of redact|reject but was '" + mode + "'");
    }
    return parsed;
  }

  private static DomainFilter parseDomain(String domain) {
    DomainFilter parsed = DomainFilter.parse(domain);
    if (parsed == null) {
      throw new ConfigurationException(
          Reason.UNSUPPORTED_DOMAIN,
          "domainFilter must be one of general|healthcare but was '" + domain + "'");
    }
    return parsed;
  }

  private static String checkLanguage(String language) {
    if (language == null || language.isBlank()) {
      throw new ConfigurationException(Reason.MISSING_LANGUAGE, "language must not be blank");
    }
    return language.trim();
  }
}
