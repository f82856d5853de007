package com.cario.phiguard.app.service;

import com.cario.phiguard.app.model.DomainFilter;
import com.cario.phiguard.app.model.PiiEntity;
import java.util.List;

/**
 * Boundary to the external PII/PHI span classifier.
 *
 * <p>Implementations do not retry and do not filter: every candidate the classifier returns is
 * passed on, whatever its score. Scores for ambiguous text may shift slightly between calls.
 */
public interface EntityDetector {

  /**
   * @throws com.cario.phiguard.app.exception.ServiceException on network, auth, throttling or
   *     malformed responses
   * @throws com.cario.phiguard.app.exception.ConfigurationException when the domain filter is not
   *     supported by the endpoint
   */
  List<PiiEntity> detect(String text, DomainFilter domainFilter, String language);
}
