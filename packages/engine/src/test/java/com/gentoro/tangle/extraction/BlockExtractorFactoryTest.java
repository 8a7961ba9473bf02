package com.gentoro.tangle.extraction;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.tangle.exception.ConfigException;
import com.gentoro.tangle.extraction.flexmark.FlexmarkBlockExtractor;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.Test;

class BlockExtractorFactoryTest {

  @Test
  void defaultsToCachedFlexmark() {
    BlockExtractor extractor = BlockExtractorFactory.create(new BaseConfiguration());
    assertInstanceOf(CachingBlockExtractor.class, extractor);
    assertEquals("flexmark", extractor.name());
  }

  @Test
  void cacheCanBeDisabled() {
    BaseConfiguration config = new BaseConfiguration();
    config.addProperty("extractor.cache.enabled", false);
    assertInstanceOf(FlexmarkBlockExtractor.class, BlockExtractorFactory.create(config));
  }

  @Test
  void selectsPandocProvider() {
    BaseConfiguration config = new BaseConfiguration();
    config.addProperty("extractor.provider", "Pandoc");
    config.addProperty("extractor.pandoc.timeout-seconds", 3);
    assertEquals("pandoc", BlockExtractorFactory.create(config).name());
  }

  @Test
  void rejectsInvalidPandocTimeout() {
    BaseConfiguration config = new BaseConfiguration();
    config.addProperty("extractor.provider", "pandoc");
    config.addProperty("extractor.pandoc.timeout-seconds", 0);
    assertThrows(ConfigException.class, () -> BlockExtractorFactory.create(config));
  }

  @Test
  void unknownProviderIsAConfigurationError() {
    BaseConfiguration config = new BaseConfiguration();
    config.addProperty("extractor.provider", "asciidoc");
    ConfigException e =
        assertThrows(ConfigException.class, () -> BlockExtractorFactory.create(config));
    assertTrue(e.getMessage().contains("asciidoc"));
  }
}
