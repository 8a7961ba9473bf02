package com.gentoro.tangle.extraction;

import com.gentoro.tangle.exception.ConfigException;
import com.gentoro.tangle.logging.LoggingService;
import java.util.ServiceLoader;
import org.apache.commons.configuration2.Configuration;

/**
 * Creates the configured {@link BlockExtractor}.
 *
 * <p>Example configuration:
 *
 * <pre>
 *   extractor.provider = pandoc
 *   extractor.pandoc.executable = /usr/local/bin/pandoc
 *   extractor.cache.enabled = true
 *   extractor.cache.max-entries = 64
 * </pre>
 */
public final class BlockExtractorFactory {
  private static final org.slf4j.Logger log =
      LoggingService.getLogger(BlockExtractorFactory.class);

  public static final String DEFAULT_PROVIDER = "flexmark";

  private BlockExtractorFactory() {}

  public static BlockExtractor create(Configuration configuration) {
    String provider =
        configuration.getString("extractor.provider", DEFAULT_PROVIDER).trim().toLowerCase();
    Configuration subConfig = configuration.subset("extractor." + provider);

    BlockExtractor extractor = null;
    for (BlockExtractorProvider p : ServiceLoader.load(BlockExtractorProvider.class)) {
      if (provider.equals(p.providerId())) {
        extractor = p.create(subConfig);
        break;
      }
    }
    if (extractor == null) {
      throw new ConfigException("Unknown extractor.provider: " + provider);
    }

    if (configuration.getBoolean("extractor.cache.enabled", true)) {
      int maxEntries =
          configuration.getInt("extractor.cache.max-entries", CachingBlockExtractor.DEFAULT_SIZE);
      extractor = new CachingBlockExtractor(extractor, maxEntries);
    }
    log.info("Using block extractor '{}'", extractor.name());
    return extractor;
  }
}
