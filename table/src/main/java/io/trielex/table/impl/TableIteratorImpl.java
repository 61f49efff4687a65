package io.trielex.table.impl;

import io.trielex.table.api.LexerException;
import io.trielex.table.api.TableIterator;
import io.trielex.table.api.Token;
import io.trielex.table.internal_api.collections.AsciiSet;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Longest-match scanner over a {@link TrieGraph}.
 *
 * <p>Each token attempt walks the graph from the root starting at {@code cursor}, remembering the
 * last accepting node seen (the mark). When the walk dies or the input ends, the token up to the
 * mark is emitted and the next attempt restarts right after it; characters read past the mark are
 * scanned again.
 *
 * <p>Every (node, position) pair walked past the mark of a finished attempt can never reach an
 * accepting node, so it is remembered and later attempts stop as soon as they hit one. Each pair
 * is replayed at most once, which keeps the scan linear in the input length.
 */
public final class TableIteratorImpl<T> implements TableIterator<T> {
  private static final Logger log = LoggerFactory.getLogger(TableIteratorImpl.class);

  private final TrieGraph<T> graph;
  private final AsciiSet alphabet;
  private final String input;

  private int cursor = 0;
  private State state;
  private LexerException failure;
  private Token<T> pending;
  private final LongOpenHashSet deadEnds = new LongOpenHashSet();
  private final LongArrayList trail = new LongArrayList();

  public TableIteratorImpl(TrieGraph<T> graph, AsciiSet alphabet, String input) {
    this.graph = graph;
    this.alphabet = alphabet;
    this.input = input;
    this.state = input.isEmpty() ? State.DONE : State.SCANNING;
  }

  @Override
  public boolean hasNext() {
    if (pending != null || failure != null) {
      return true;
    }
    if (state != State.SCANNING) {
      return false;
    }
    scanToken();
    return pending != null || failure != null;
  }

  @Override
  public Token<T> next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    if (failure != null) {
      LexerException e = failure;
      failure = null;
      throw e;
    }
    Token<T> token = pending;
    pending = null;
    return token;
  }

  private void scanToken() {
    int start = cursor;
    int node = TrieGraph.ROOT;
    int markEnd = -1; // exclusive end of the longest accepted prefix
    T markValue = null;
    for (int pos = start; pos < input.length(); pos++) {
      char c = input.charAt(pos);
      if (!alphabet.contains(c)) {
        fail(LexerException.unknownChar(c, pos));
        return;
      }
      node = graph.step(node, c);
      if (node == TrieGraph.NONE) {
        break;
      }
      T value = graph.valueAt(node);
      if (value != null) {
        markEnd = pos + 1;
        markValue = value;
        trail.clear();
      } else {
        long key = (long) node << 32 | (pos + 1);
        if (deadEnds.contains(key)) {
          break;
        }
        trail.add(key);
      }
    }
    if (!trail.isEmpty()) {
      deadEnds.addAll(trail);
      if (markEnd >= 0 && log.isTraceEnabled()) {
        log.trace("Backtracking from {} to {}", markEnd + trail.size(), markEnd);
      }
      trail.clear();
    }
    if (markEnd < 0) {
      fail(LexerException.unexpectedEnd(start));
      return;
    }
    pending = new Token<>(markValue, input.substring(start, markEnd), start);
    cursor = markEnd;
    if (cursor == input.length()) {
      state = State.DONE;
    }
    if (log.isTraceEnabled()) {
      log.trace("Token '{}' -> {} at [{}, {})", pending.text(), markValue, start, markEnd);
    }
  }

  private void fail(LexerException e) {
    log.trace("Scan failed: {}", e.getMessage());
    failure = e;
    state = State.FAILED;
  }

  @Override
  public State state() {
    return state;
  }

  @Override
  public int position() {
    return cursor;
  }
}
