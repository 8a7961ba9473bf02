package com.gentoro.tangle.engine;

import com.gentoro.tangle.exception.ConfigException;
import org.apache.commons.configuration2.Configuration;

/**
 * Tunables of {@link LiterateEngine}.
 *
 * @param maxBlockSize blocks whose raw content is longer than this many characters are dropped
 */
public record EngineSettings(int maxBlockSize) {
  public static final int DEFAULT_MAX_BLOCK_SIZE = 1_000_000;

  public EngineSettings {
    if (maxBlockSize <= 0) {
      throw new ConfigException("parser.max-block-size must be positive: " + maxBlockSize);
    }
  }

  public static EngineSettings defaults() {
    return new EngineSettings(DEFAULT_MAX_BLOCK_SIZE);
  }

  public static EngineSettings fromConfiguration(Configuration configuration) {
    return new EngineSettings(
        configuration.getInt("parser.max-block-size", DEFAULT_MAX_BLOCK_SIZE));
  }
}
