package com.gentoro.tangle.graph;

import com.gentoro.tangle.logging.LoggingService;
import com.gentoro.tangle.model.Block;
import com.gentoro.tangle.registry.BlockRegistry;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Forward and reverse edges between identifiers, derived from the references recorded on blocks.
 *
 * <p>Forward edges are each block's references. Reverse edges ({@link Block#dependents()}) are
 * never patched: {@link #rebuild} clears all of them and recomputes them from the current
 * references, so deleting or editing a block cannot leave a stale back edge.
 */
public class DependencyGraph {
  private static final org.slf4j.Logger log = LoggingService.getLogger(DependencyGraph.class);

  private final BlockRegistry registry;

  public DependencyGraph(BlockRegistry registry) {
    this.registry = registry;
  }

  /** Clear every block's dependents, then add B to each occurrence of D for every B -> D. */
  public void rebuild() {
    int edges = 0;
    for (List<Block> blocks : registry.occurrenceLists()) {
      for (Block block : blocks) {
        block.clearDependents();
      }
    }
    for (List<Block> blocks : registry.occurrenceLists()) {
      for (Block block : blocks) {
        for (String dependency : block.dependencies()) {
          for (Block target : registry.lookup(dependency)) {
            target.addDependent(block.identifier());
            edges++;
          }
        }
      }
    }
    log.debug("Dependency graph rebuilt: {} reverse edge(s)", edges);
  }

  /** Union of the references of every occurrence of {@code identifier}, in first-seen order. */
  public Set<String> dependencies(String identifier) {
    Set<String> out = new LinkedHashSet<>();
    for (Block block : registry.lookup(identifier)) {
      out.addAll(block.dependencies());
    }
    return out;
  }

  /** Identifiers whose blocks reference {@code identifier}. */
  public Set<String> dependents(String identifier) {
    Set<String> out = new LinkedHashSet<>();
    for (Block block : registry.lookup(identifier)) {
      out.addAll(block.dependents());
    }
    return out;
  }
}
