package com.gentoro.tangle.extraction;

import com.gentoro.tangle.logging.LoggingService;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Remembers the conversion result of recently seen document texts. Access ordered, evicts the
 * least recently used entry once {@code maxEntries} is exceeded. Failed conversions are not cached.
 */
public class CachingBlockExtractor implements BlockExtractor {
  private static final org.slf4j.Logger log =
      LoggingService.getLogger(CachingBlockExtractor.class);

  public static final int DEFAULT_SIZE = 64;

  private final BlockExtractor delegate;
  private final Map<String, List<RawBlock>> cache;

  public CachingBlockExtractor(BlockExtractor delegate, int maxEntries) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    if (maxEntries <= 0) {
      throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
    }
    this.cache =
        new LinkedHashMap<>(16, 0.75f, true) {
          @Override
          protected boolean removeEldestEntry(Map.Entry<String, List<RawBlock>> eldest) {
            return size() > maxEntries;
          }
        };
  }

  @Override
  public List<RawBlock> extract(String documentText) {
    String key = documentText == null ? "" : documentText;
    synchronized (cache) {
      List<RawBlock> hit = cache.get(key);
      if (hit != null) {
        log.debug("Conversion cache hit ({} chars)", key.length());
        return hit;
      }
    }
    List<RawBlock> blocks = List.copyOf(delegate.extract(key));
    synchronized (cache) {
      cache.put(key, blocks);
    }
    return blocks;
  }

  @Override
  public String name() {
    return delegate.name();
  }

  public int size() {
    synchronized (cache) {
      return cache.size();
    }
  }

  public void clear() {
    synchronized (cache) {
      cache.clear();
    }
  }
}
