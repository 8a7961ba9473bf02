package com.gentoro.tangle.expansion;

import com.gentoro.tangle.exception.BlockNotFoundException;
import com.gentoro.tangle.logging.LoggingService;
import com.gentoro.tangle.model.Block;
import com.gentoro.tangle.registry.BlockRegistry;
import com.gentoro.tangle.syntax.LiterateSyntax;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Tangles an identifier: every {@code <<ref>>} marker is replaced by the expansion of {@code ref},
 * all occurrences of an identifier are concatenated, each followed by a newline.
 *
 * <p>Every recursive call receives its own copy of the identifiers on the path from the root, so
 * two siblings may both expand the same identifier while a true cycle degrades to the literal
 * {@code <<circular reference to X>>}. An unknown nested reference becomes {@code <<X not found>>}.
 * Neither case throws.
 */
public class ContentExpander {
  private static final org.slf4j.Logger log = LoggingService.getLogger(ContentExpander.class);

  private final BlockRegistry registry;

  public ContentExpander(BlockRegistry registry) {
    this.registry = registry;
  }

  /**
   * Expanded body of {@code identifier}.
   *
   * @throws BlockNotFoundException when {@code identifier} itself has no occurrence
   */
  public String getExpandedContent(String identifier) {
    if (registry.lookup(identifier).isEmpty()) {
      throw new BlockNotFoundException(identifier);
    }
    return expand(identifier, Set.of());
  }

  /** Expand {@code identifier} given the identifiers already on the path from the root. */
  public String expand(String identifier, Set<String> visitedOnPath) {
    if (visitedOnPath.contains(identifier)) {
      log.warn("Circular reference to {} during expansion", identifier);
      return LiterateSyntax.circularReferenceMarker(identifier);
    }
    List<Block> blocks = registry.lookup(identifier);
    if (blocks.isEmpty()) {
      log.warn("Block {} not found during expansion", identifier);
      return LiterateSyntax.notFoundMarker(identifier);
    }

    Set<String> path = new HashSet<>(visitedOnPath);
    path.add(identifier);

    StringBuilder out = new StringBuilder();
    for (Block block : blocks) {
      Matcher m = LiterateSyntax.REFERENCE.matcher(block.content());
      StringBuilder body = new StringBuilder();
      while (m.find()) {
        m.appendReplacement(body, Matcher.quoteReplacement(expand(m.group(1), path)));
      }
      m.appendTail(body);
      out.append(body).append('\n');
    }
    return out.toString();
  }
}
