package com.cario.phiguard.app.config;

import static org.junit.jupiter.api.Assertions.*;

import com.cario.phiguard.app.model.PolicyMode;
import com.cario.phiguard.app.model.PolicySettings;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.bind.PropertySourcesPlaceholdersResolver;
import org.springframework.boot.context.properties.source.ConfigurationPropertySources;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.PropertySource;
import org.springframework.core.io.ClassPathResource;

class PhiGuardPropertiesTest {

  private static PhiGuardProperties props;

  @BeforeAll
  static void bindApplicationYaml() throws Exception {
    List<PropertySource<?>> sources =
        new YamlPropertySourceLoader()
            .load("application", new ClassPathResource("application.yaml"));
    Binder binder =
        new Binder(
            ConfigurationPropertySources.from(sources),
            new PropertySourcesPlaceholdersResolver(sources));
    props = binder.bind("phiguard", PhiGuardProperties.class).get();
  }

  @Test
  void promptsComeFromApplicationYaml() {
    assertTrue(
        props.getAgent().getInstructions().startsWith("You are a knowledgeable healthcare"));
    assertTrue(props.getAgent().getInstructions().contains("Clearly cite your sources"));
    assertTrue(props.getDirect().getSystemPrompt().contains("acknowledge the limitation"));
  }

  @Test
  void defaultsProduceValidPolicy() {
    PolicySettings settings = props.toPolicySettings();
    assertEquals(PolicyMode.REDACT, settings.getMode());
    assertEquals(0.8, settings.getConfidenceThreshold());
    assertEquals(Duration.ofSeconds(60), props.getAgent().getRunTimeout());
    assertEquals(List.of("general", "healthcare"), props.getDetection().getSupportedDomains());
  }
}
