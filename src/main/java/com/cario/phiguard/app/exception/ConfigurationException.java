package com.cario.phiguard.app.exception;

import lombok.Getter;

/** Fatal for the current request: the configuration or the request parameters are unusable. */
@Getter
public class ConfigurationException extends PhiGuardException {

  public enum Reason {
    UNSUPPORTED_MODE,
    THRESHOLD_OUT_OF_RANGE,
    UNSUPPORTED_DOMAIN,
    MISSING_LANGUAGE,
    MISSING_ENDPOINT,
    MISSING_CREDENTIALS,
    INVALID_TIMEOUT,
    REQUEST_REJECTED,
    GROUNDING_DISABLED
  }

  private final Reason reason;

  public ConfigurationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public ConfigurationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }
}
