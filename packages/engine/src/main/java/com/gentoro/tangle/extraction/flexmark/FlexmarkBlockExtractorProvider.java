package com.gentoro.tangle.extraction.flexmark;

import com.gentoro.tangle.extraction.BlockExtractor;
import com.gentoro.tangle.extraction.BlockExtractorProvider;
import org.apache.commons.configuration2.Configuration;

/** SPI provider for the in-process flexmark extractor. Takes no settings. */
public final class FlexmarkBlockExtractorProvider implements BlockExtractorProvider {
  static final String ID = "flexmark";

  @Override
  public String providerId() {
    return ID;
  }

  @Override
  public BlockExtractor create(Configuration subConfiguration) {
    return new FlexmarkBlockExtractor();
  }
}
