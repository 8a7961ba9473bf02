package com.gentoro.tangle.extraction.pandoc;

import com.gentoro.tangle.exception.ConfigException;
import com.gentoro.tangle.extraction.BlockExtractor;
import com.gentoro.tangle.extraction.BlockExtractorProvider;
import java.time.Duration;
import org.apache.commons.configuration2.Configuration;

/** SPI provider for the pandoc-backed extractor. */
public final class PandocBlockExtractorProvider implements BlockExtractorProvider {
  static final String ID = "pandoc";

  @Override
  public String providerId() {
    return ID;
  }

  @Override
  public BlockExtractor create(Configuration subConfiguration) {
    long timeoutSeconds = subConfiguration.getLong("timeout-seconds", 30L);
    if (timeoutSeconds <= 0) {
      throw new ConfigException(
          "extractor.pandoc.timeout-seconds must be positive: " + timeoutSeconds);
    }
    return new PandocBlockExtractor(
        subConfiguration.getString("executable", "pandoc"),
        subConfiguration.getString("format", "markdown"),
        Duration.ofSeconds(timeoutSeconds));
  }
}
