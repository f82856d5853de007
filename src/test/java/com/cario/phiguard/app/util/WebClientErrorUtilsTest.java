package com.cario.phiguard.app.util;

import static org.junit.jupiter.api.Assertions.*;

import com.cario.phiguard.app.exception.ServiceException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

class WebClientErrorUtilsTest {

  private static WebClientResponseException http(HttpStatus status, String body) {
    return WebClientResponseException.create(
        status.value(),
        status.getReasonPhrase(),
        HttpHeaders.EMPTY,
        body.getBytes(StandardCharsets.UTF_8),
        StandardCharsets.UTF_8);
  }

  @Test
  void serverErrorsAndThrottlingAreRetryable() {
    assertTrue(
        WebClientErrorUtils.toServiceException("agents", http(HttpStatus.BAD_GATEWAY, ""))
            .isRetryable());
    ServiceException throttled =
        WebClientErrorUtils.toServiceException("agents", http(HttpStatus.TOO_MANY_REQUESTS, ""));
    assertTrue(throttled.isRetryable());
    assertTrue(throttled.isThrottled());
  }

  @Test
  void clientErrorsAreNotRetryable() {
    ServiceException ex =
        WebClientErrorUtils.toServiceException("language", http(HttpStatus.FORBIDDEN, ""));
    assertFalse(ex.isRetryable());
    assertEquals(403, ex.getStatusCode());
    assertTrue(ex.getMessage().contains("authentication rejected"));
  }

  @Test
  void timeoutWrappedByBlockIsUnwrapped() {
    RuntimeException blocked = Exceptions.propagate(new TimeoutException("slow"));
    ServiceException ex = WebClientErrorUtils.toServiceException("agents", blocked);
    assertEquals(0, ex.getStatusCode());
    assertTrue(ex.isRetryable());
  }

  @Test
  void existingServiceExceptionPassesThrough() {
    ServiceException original = new ServiceException("agents", 200, false, "bad body");
    assertSame(original, WebClientErrorUtils.toServiceException("agents", original));
  }

  @Test
  void exposesStatusAndBody() {
    WebClientResponseException ex = http(HttpStatus.BAD_REQUEST, "{\"error\":\"domain\"}");
    assertEquals(400, WebClientErrorUtils.statusOf(ex));
    assertEquals("{\"error\":\"domain\"}", WebClientErrorUtils.responseBody(ex));
    assertEquals(0, WebClientErrorUtils.statusOf(new IllegalStateException()));
    assertEquals("", WebClientErrorUtils.responseBody(new IllegalStateException()));
  }
}
