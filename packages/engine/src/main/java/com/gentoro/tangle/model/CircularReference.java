package com.gentoro.tangle.model;

import java.util.List;

/**
 * A cycle in the identifier graph.
 *
 * @param path identifiers along the cycle, starting at {@code start}; the edge from the last
 *     element back to {@code start} closes it
 * @param start identifier at which the back edge was found
 */
public record CircularReference(List<String> path, String start) {

  public CircularReference {
    path = List.copyOf(path);
  }

  @Override
  public String toString() {
    return String.join(" -> ", path) + " -> " + start;
  }
}
