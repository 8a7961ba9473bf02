package com.gentoro.tangle.extraction;

import org.apache.commons.configuration2.Configuration;

/**
 * Service Provider Interface (SPI) for pluggable block extractors.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} and registered in {@code
 * META-INF/services/com.gentoro.tangle.extraction.BlockExtractorProvider}. The factory selects one
 * by matching {@code extractor.provider} to {@link #providerId()}.
 */
public interface BlockExtractorProvider {

  /** A stable, lowercase identifier for this provider (e.g. "pandoc"). */
  String providerId();

  /**
   * Creates a configured extractor.
   *
   * @param subConfiguration provider-specific subset (e.g. {@code extractor.pandoc.*})
   * @throws IllegalArgumentException when the configuration is invalid
   */
  BlockExtractor create(Configuration subConfiguration);
}
