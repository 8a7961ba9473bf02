package com.gentoro.tangle;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.tangle.exception.ConfigException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationProviderTest {

  @TempDir Path tempDir;

  @Test
  void loadsBundledDefaults() {
    Configuration config = new ConfigurationProvider("classpath:application.yaml").config();
    assertEquals("flexmark", config.getString("extractor.provider"));
    assertEquals(64, config.getInt("extractor.cache.max-entries"));
    assertEquals(1_000_000, config.getInt("parser.max-block-size"));
  }

  @Test
  void missingClasspathResourceYieldsEmptyConfiguration() {
    Configuration config = new ConfigurationProvider("classpath:does-not-exist.yaml").config();
    assertTrue(config.isEmpty());
    assertEquals("fallback", config.getString("extractor.provider", "fallback"));
  }

  @Test
  void loadsFileByPathAndUri() throws Exception {
    Path file = tempDir.resolve("custom.yaml");
    Files.writeString(file, "extractor:\n  provider: pandoc\nscheduler:\n  threads: 4\n");

    Configuration byPath = new ConfigurationProvider(file.toString()).config();
    assertEquals("pandoc", byPath.getString("extractor.provider"));

    Configuration byUri = new ConfigurationProvider(file.toUri().toString()).config();
    assertEquals(4, byUri.getInt("scheduler.threads"));
  }

  @Test
  void missingFileIsAConfigurationError() {
    assertThrows(
        ConfigException.class,
        () -> new ConfigurationProvider(tempDir.resolve("nope.yaml").toString()));
  }

  @Test
  void envFileLinesAreParsed() throws Exception {
    Path env = tempDir.resolve(".env.local");
    Files.writeString(env, "# comment\nPANDOC=\"/opt/pandoc\"\nMODE='x'\nBROKEN\n\nA=1\nA=2\n");

    Map<String, String> values = ConfigurationProvider.FallbackEnvLookup.readKeyValueFile(env);

    assertEquals(Map.of("PANDOC", "/opt/pandoc", "MODE", "x", "A", "2"), values);
  }
}
