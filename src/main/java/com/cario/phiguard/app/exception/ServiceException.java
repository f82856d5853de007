package com.cario.phiguard.app.exception;

import lombok.Getter;

/**
 * A remote service (entity detection or agent service) was unreachable, refused our credentials,
 * throttled us, or answered with something we could not use.
 *
 * <p>No retries happen inside the service; {@link #isRetryable()} tells the caller whether a
 * retry with backoff makes sense.
 */
@Getter
public class ServiceException extends PhiGuardException {

  /** Name of the remote service, e.g. {@code language} or {@code agents}. */
  private final String service;

  /** HTTP status returned by the remote service, or 0 when no response was received. */
  private final int statusCode;

  private final boolean retryable;

  public ServiceException(String service, int statusCode, boolean retryable, String message) {
    super(message);
    this.service = service;
    this.statusCode = statusCode;
    this.retryable = retryable;
  }

  public ServiceException(
      String service, int statusCode, boolean retryable, String message, Throwable cause) {
    super(message, cause);
    this.service = service;
    this.statusCode = statusCode;
    this.retryable = retryable;
  }

  public boolean isThrottled() {
    return statusCode == 429;
  }
}
