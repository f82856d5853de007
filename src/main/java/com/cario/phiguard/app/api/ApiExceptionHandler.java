package com.cario.phiguard.app.api;

import com.cario.phiguard.app.exception.ConfigurationException;
import com.cario.phiguard.app.exception.GroundingException;
import com.cario.phiguard.app.exception.GroundingTimeoutException;
import com.cario.phiguard.app.exception.QueryRejectedException;
import com.cario.phiguard.app.exception.ServiceException;
import com.cario.phiguard.app.exception.ThreadBusyException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps the service's failure hierarchy onto HTTP responses. */
@Log4j2
@RestControllerAdvice
public class ApiExceptionHandler {

  @ExceptionHandler(ConfigurationException.class)
  public ResponseEntity<Map<String, Object>> configuration(ConfigurationException ex) {
    log.warn("phiguard.api.configuration reason={} message={}", ex.getReason(), ex.getMessage());
    Map<String, Object> body = body("configuration_error", ex.getMessage());
    body.put("reason", ex.getReason().name());
    return ResponseEntity.badRequest().body(body);
  }

  @ExceptionHandler(ServiceException.class)
  public ResponseEntity<Map<String, Object>> service(ServiceException ex) {
    log.error(
        "phiguard.api.service service={} status={} retryable={} message={}",
        ex.getService(),
        ex.getStatusCode(),
        ex.isRetryable(),
        ex.getMessage());
    HttpStatus status = statusFor(ex);
    Map<String, Object> body = body("service_error", ex.getMessage());
    body.put("service", ex.getService());
    body.put("retryable", ex.isRetryable());
    return ResponseEntity.status(status).body(body);
  }

  @ExceptionHandler(QueryRejectedException.class)
  public ResponseEntity<Map<String, Object>> rejected(QueryRejectedException ex) {
    return ResponseEntity.unprocessableEntity().body(body("rejected", ex.getMessage()));
  }

  @ExceptionHandler(GroundingException.class)
  public ResponseEntity<Map<String, Object>> grounding(GroundingException ex) {
    HttpStatus status = HttpStatus.BAD_GATEWAY;
    String error = "grounding_error";
    if (ex instanceof GroundingTimeoutException) {
      status = HttpStatus.GATEWAY_TIMEOUT;
      error = "grounding_timeout";
    } else if (ex instanceof ThreadBusyException) {
      status = HttpStatus.CONFLICT;
      error = "thread_busy";
    }
    Map<String, Object> body = body(error, ex.getMessage());
    if (ex.getThreadId() != null) body.put("threadId", ex.getThreadId());
    return ResponseEntity.status(status).body(body);
  }

  /**
   * Retryable failures are reported as 503 (429 when throttled). A resource the remote service does
   * not know is a 404; any other permanent failure of the remote call is a 502.
   */
  static HttpStatus statusFor(ServiceException ex) {
    if (ex.isThrottled()) return HttpStatus.TOO_MANY_REQUESTS;
    if (ex.isRetryable()) return HttpStatus.SERVICE_UNAVAILABLE;
    if (ex.getStatusCode() == 404) return HttpStatus.NOT_FOUND;
    return HttpStatus.BAD_GATEWAY;
  }

  private static Map<String, Object> body(String error, String message) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("timestamp", Instant.now().toString());
    body.put("error", error);
    body.put("message", message);
    return body;
  }
}
