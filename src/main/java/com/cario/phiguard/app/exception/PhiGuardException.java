package com.cario.phiguard.app.exception;

/**
 * Root of the service's failure hierarchy.
 *
 * <p>Only true faults are signalled through this hierarchy. A policy rejection is a normal result
 * carried on {@link com.cario.phiguard.app.model.DetectionResult#isShouldReject()}.
 */
public abstract class PhiGuardException extends RuntimeException {

  protected PhiGuardException(String message) {
    super(message);
  }

  protected PhiGuardException(String message, Throwable cause) {
    super(message, cause);
  }
}
