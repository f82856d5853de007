package com.cario.phiguard.app;

import com.cario.phiguard.app.config.PhiGuardProperties;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Entry point for the PHI Guard grounding service.
 *
 * <p>Every query is screened for PII/PHI before it may reach the web-grounded agent: it is either
 * forwarded redacted or rejected, depending on the configured policy.
 *
 * <pre>
 *   mvn spring-boot:run
 * </pre>
 */
@Log4j2
@SpringBootApplication
@EnableConfigurationProperties(PhiGuardProperties.class)
public class PhiGuardServiceApplication {

  public static void main(String[] args) {
    log.info("Starting PHI Guard grounding service...");
    SpringApplication.run(PhiGuardServiceApplication.class, args);
    log.info("PHI Guard grounding service started.");
  }
}
