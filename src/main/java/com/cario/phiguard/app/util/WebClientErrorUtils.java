package com.cario.phiguard.app.util;

import com.cario.phiguard.app.exception.ServiceException;
import java.util.concurrent.TimeoutException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

/** Maps failures of blocking {@code WebClient} calls onto {@link ServiceException}. */
public final class WebClientErrorUtils {

  private WebClientErrorUtils() {}

  /**
   * Translate a failure raised by {@code Mono.block()}.
   *
   * <ul>
   *   <li>401/403/404 and other 4xx: not retryable
   *   <li>408, 429 and 5xx: retryable
   *   <li>no response (connect/read failure, client side timeout): retryable, status 0
   * </ul>
   */
  public static ServiceException toServiceException(String service, Throwable failure) {
    Throwable t = Exceptions.unwrap(failure);
    if (t instanceof ServiceException se) {
      return se;
    }
    if (t instanceof WebClientResponseException wre) {
      int status = wre.getStatusCode().value();
      boolean retryable = status == 408 || status == 429 || status >= 500;
      String detail = describeStatus(status);
      return new ServiceException(
          service,
          status,
          retryable,
          service + " service answered HTTP " + status + " (" + detail + ")",
          wre);
    }
    if (t instanceof WebClientRequestException) {
      return new ServiceException(
          service, 0, true, service + " service unreachable: " + t.getMessage(), t);
    }
    if (t instanceof TimeoutException) {
      return new ServiceException(service, 0, true, service + " service call timed out", t);
    }
    return new ServiceException(
        service, 0, false, service + " service call failed: " + t.getMessage(), t);
  }

  /** Response body of an HTTP error, or empty when the failure carried none. */
  public static String responseBody(Throwable failure) {
    Throwable t = Exceptions.unwrap(failure);
    if (t instanceof WebClientResponseException wre) {
      return wre.getResponseBodyAsString();
    }
    return "";
  }

  public static int statusOf(Throwable failure) {
    Throwable t = Exceptions.unwrap(failure);
    return t instanceof WebClientResponseException wre ? wre.getStatusCode().value() : 0;
  }

  private static String describeStatus(int status) {
    if (status == 401 || status == 403) return "authentication rejected";
    if (status == 429) return "throttled";
    if (status >= 500) return "server error";
    return "request rejected";
  }
}
