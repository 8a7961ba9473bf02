package com.gentoro.tangle.graph;

import com.gentoro.tangle.logging.LoggingService;
import com.gentoro.tangle.model.CircularReference;
import com.gentoro.tangle.registry.BlockRegistry;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Finds cycles in the identifier graph with a three-colour depth-first search.
 *
 * <p>Every identifier starts unvisited, is on-stack while its successors are explored and done
 * afterwards. An edge into an on-stack identifier is a back edge: the path from that identifier
 * to the top of the stack is reported as one cycle and the edge is not followed. Edges into done
 * identifiers are skipped. The search is started from every registry identifier in insertion order
 * and uses an explicit stack, so the result is deterministic and long chains cannot overflow the
 * call stack.
 */
public class CycleDetector {
  private static final org.slf4j.Logger log = LoggingService.getLogger(CycleDetector.class);

  private enum State {
    ON_STACK,
    DONE
  }

  private final DependencyGraph graph;
  private final BlockRegistry registry;

  public CycleDetector(BlockRegistry registry, DependencyGraph graph) {
    this.registry = registry;
    this.graph = graph;
  }

  public List<CircularReference> findCycles() {
    Map<String, State> states = new HashMap<>();
    List<CircularReference> cycles = new ArrayList<>();

    for (String root : registry.allIdentifiers()) {
      if (states.containsKey(root)) continue;

      List<String> path = new ArrayList<>();
      Map<String, Integer> positionOnPath = new HashMap<>();
      Deque<Frame> stack = new ArrayDeque<>();

      enter(root, states, path, positionOnPath, stack);
      while (!stack.isEmpty()) {
        Frame frame = stack.peek();
        if (frame.successors.hasNext()) {
          String next = frame.successors.next();
          State state = states.get(next);
          if (state == State.ON_STACK) {
            int k = positionOnPath.get(next);
            CircularReference cycle =
                new CircularReference(new ArrayList<>(path.subList(k, path.size())), next);
            cycles.add(cycle);
            log.debug("Found circular reference {}", cycle);
          } else if (state == null) {
            enter(next, states, path, positionOnPath, stack);
          }
        } else {
          stack.pop();
          states.put(frame.identifier, State.DONE);
          path.remove(path.size() - 1);
          positionOnPath.remove(frame.identifier);
        }
      }
    }
    return cycles;
  }

  private void enter(
      String identifier,
      Map<String, State> states,
      List<String> path,
      Map<String, Integer> positionOnPath,
      Deque<Frame> stack) {
    states.put(identifier, State.ON_STACK);
    positionOnPath.put(identifier, path.size());
    path.add(identifier);
    stack.push(new Frame(identifier, graph.dependencies(identifier).iterator()));
  }

  private static final class Frame {
    final String identifier;
    final Iterator<String> successors;

    Frame(String identifier, Iterator<String> successors) {
      this.identifier = identifier;
      this.successors = successors;
    }
  }
}
