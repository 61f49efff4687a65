package io.trielex.table.impl;

import io.trielex.table.api.TableException;
import io.trielex.table.api.ValueAlreadyDefinedException;
import io.trielex.table.internal_api.collections.IntGrowableArray;
import it.unimi.dsi.fastutil.chars.Char2IntMap;
import it.unimi.dsi.fastutil.chars.Char2IntOpenHashMap;
import it.unimi.dsi.fastutil.chars.CharIterator;
import it.unimi.dsi.fastutil.chars.CharSet;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.longs.Long2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Character-labelled deterministic automaton stored as an arena of nodes addressed by {@code int}
 * handles.
 *
 * <p>Node {@link #ROOT} is the start state. A node maps each character to at most one target and
 * may carry a value marking it accepting. Several edges may lead to the same node (class members
 * share one successor) and an edge may lead back to its own node (repetition), so the structure
 * is a graph rather than a tree.
 *
 * <p>Insertion walks the graph and the pattern together, one node per pair of (existing node,
 * pattern state). An existing node is changed in place only when every path into it reaches the
 * same pattern state; otherwise the pattern gets its own copy of the node, and the other paths
 * keep the original.
 *
 * <p>Not thread-safe for writers. Reads ({@link #step}, {@link #valueAt}) never mutate and may run
 * concurrently once no more insertions happen.
 *
 * @param <T> value type
 */
public final class TrieGraph<T> {
  private static final Logger log = LoggerFactory.getLogger(TrieGraph.class);

  public static final int ROOT = 0;
  public static final int NONE = -1;

  private static final int OP_EDGE = 1;
  private static final int OP_VALUE = 2;

  private final ObjectArrayList<Node<T>> nodes;
  // (op << 16 | char, node, previous target) triples touching nodes that existed before the
  // running insertion
  private final IntGrowableArray journal = new IntGrowableArray(48);
  private int watermark;

  public TrieGraph(int initialCapacity) {
    nodes = new ObjectArrayList<>(initialCapacity);
    nodes.add(new Node<>());
  }

  /**
   * Merges the language of {@code atoms} into the graph, accepting it with {@code value}. On
   * failure the graph is restored to its state before the call.
   *
   * @param pattern source text of the atoms, for error reporting
   * @param atoms parsed atoms, never empty
   * @param value non-null value
   * @return number of nodes created
   * @throws ValueAlreadyDefinedException if some string of the pattern is already accepted
   */
  public int insert(String pattern, List<Atom> atoms, T value) throws TableException {
    watermark = nodes.size();
    journal.clear();
    try {
      new Merge(pattern, new AtomAutomaton(atoms), value).run();
      return nodes.size() - watermark;
    } catch (TableException e) {
      rollback(pattern);
      throw e;
    } finally {
      journal.clear();
    }
  }

  /** One insertion: a breadth-first walk over (existing node, pattern state) pairs. */
  private final class Merge {
    private final String pattern;
    private final AtomAutomaton automaton;
    private final T value;

    private final Long2IntOpenHashMap placed = new Long2IntOpenHashMap();
    private final IntArrayList oldNodes = new IntArrayList();
    private final IntArrayList states = new IntArrayList();
    private final IntArrayList targets = new IntArrayList();

    Merge(String pattern, AtomAutomaton automaton, T value) {
      this.pattern = pattern;
      this.automaton = automaton;
      this.value = value;
      placed.defaultReturnValue(NONE);
    }

    void run() throws ValueAlreadyDefinedException {
      enqueue(ROOT, automaton.start(), ROOT);
      for (int i = 0; i < oldNodes.size(); i++) {
        expand(oldNodes.getInt(i), states.getInt(i), targets.getInt(i));
      }
    }

    private void expand(int old, int state, int node) throws ValueAlreadyDefinedException {
      if (automaton.isAccepting(state)) {
        Node<T> n = nodes.get(node);
        if (n.value != null) {
          throw new ValueAlreadyDefinedException(pattern, n.value, value);
        }
        n.value = value;
        record(OP_VALUE, '\0', node, NONE);
      }
      CharSet chars = automaton.chars(state);
      char[] labels = new char[chars.size()];
      int[] next = new int[chars.size()];
      int k = 0;
      // resolve every successor before relinking, so exclusivity checks see the old edges
      for (CharIterator it = chars.iterator(); it.hasNext(); k++) {
        char c = it.nextChar();
        int oldTarget = old == NONE ? NONE : nodes.get(old).edges.get(c);
        labels[k] = c;
        next[k] = resolve(old, state, node, oldTarget, automaton.next(state, c));
      }
      for (int j = 0; j < labels.length; j++) {
        link(node, labels[j], next[j]);
      }
    }

    private int resolve(int parentOld, int parentState, int parentNode, int old, int state) {
      long key = (long) (old + 1) << 32 | state;
      int node = placed.get(key);
      if (node != NONE) {
        return node;
      }
      if (old == NONE) {
        node = newNode();
      } else if (isExclusive(parentOld, parentState, parentNode, old, state)) {
        node = old;
      } else {
        node = copyOf(old);
      }
      placed.put(key, node);
      enqueue(old, state, node);
      return node;
    }

    private void enqueue(int old, int state, int node) {
      oldNodes.add(old);
      states.add(state);
      targets.add(node);
    }

    /**
     * Returns {@code true} if every path into {@code old} reaches {@code state}: all of its
     * incoming edges come from the in-place parent on characters leading to {@code state}, or are
     * self-loops on characters that keep {@code state}.
     */
    private boolean isExclusive(int parentOld, int parentState, int parentNode, int old, int state) {
      if (parentOld == NONE || parentNode != parentOld || old == parentOld) {
        return false;
      }
      int accounted = 0;
      for (Char2IntMap.Entry e : nodes.get(parentOld).edges.char2IntEntrySet()) {
        if (e.getIntValue() == old) {
          if (automaton.next(parentState, e.getCharKey()) != state) {
            return false;
          }
          accounted++;
        }
      }
      Node<T> n = nodes.get(old);
      for (Char2IntMap.Entry e : n.edges.char2IntEntrySet()) {
        if (e.getIntValue() == old) {
          if (automaton.next(state, e.getCharKey()) != state) {
            return false;
          }
          accounted++;
        }
      }
      return accounted == n.refs;
    }
  }

  private int newNode() {
    nodes.add(new Node<>());
    return nodes.size() - 1;
  }

  private int copyOf(int source) {
    int copy = newNode();
    Node<T> src = nodes.get(source);
    nodes.get(copy).value = src.value;
    for (Char2IntMap.Entry e : src.edges.char2IntEntrySet()) {
      link(copy, e.getCharKey(), e.getIntValue());
    }
    return copy;
  }

  private void link(int from, char c, int to) {
    int previous = nodes.get(from).edges.put(c, to);
    if (previous == to) {
      return;
    }
    if (previous != NONE) {
      nodes.get(previous).refs--;
    }
    nodes.get(to).refs++;
    record(OP_EDGE, c, from, previous);
  }

  private void record(int op, char c, int node, int previous) {
    // changes to nodes created by this insertion are discarded with the nodes themselves
    if (node < watermark) {
      journal.add(op << 16 | c);
      journal.add(node);
      journal.add(previous);
    }
  }

  private void rollback(String pattern) {
    int entries = journal.size() / 3;
    for (int i = journal.size() - 3; i >= 0; i -= 3) {
      int opAndChar = journal.get(i);
      Node<T> n = nodes.get(journal.get(i + 1));
      int previous = journal.get(i + 2);
      char c = (char) (opAndChar & 0xFFFF);
      switch (opAndChar >>> 16) {
        case OP_EDGE -> {
          nodes.get(n.edges.get(c)).refs--;
          if (previous == NONE) {
            n.edges.remove(c);
          } else {
            n.edges.put(c, previous);
            nodes.get(previous).refs++;
          }
        }
        case OP_VALUE -> n.value = null;
        default -> throw new IllegalStateException("corrupt journal entry: " + opAndChar);
      }
    }
    int discarded = nodes.size() - watermark;
    for (int i = watermark; i < nodes.size(); i++) {
      for (Char2IntMap.Entry e : nodes.get(i).edges.char2IntEntrySet()) {
        if (e.getIntValue() < watermark) {
          nodes.get(e.getIntValue()).refs--;
        }
      }
    }
    nodes.size(watermark);
    log.debug(
        "Rolled back insertion of '{}': {} changes undone, {} nodes discarded",
        pattern,
        entries,
        discarded);
  }

  /**
   * Follows the transition on {@code c} from {@code node}.
   *
   * @return the target node, or {@link #NONE} if there is no transition
   */
  public int step(int node, char c) {
    return nodes.get(node).edges.get(c);
  }

  /** Returns the value of an accepting node, or {@code null}. */
  public T valueAt(int node) {
    return nodes.get(node).value;
  }

  public boolean isAccepting(int node) {
    return nodes.get(node).value != null;
  }

  /** Returns {@code true} if {@code node} loops on {@code c}. */
  public boolean hasSelfLoop(int node, char c) {
    return nodes.get(node).edges.get(c) == node;
  }

  public int nodeCount() {
    return nodes.size();
  }

  private static final class Node<T> {
    final Char2IntOpenHashMap edges = new Char2IntOpenHashMap(4);
    // incoming edges, self-loops included
    int refs;
    T value;

    Node() {
      edges.defaultReturnValue(NONE);
    }
  }
}
