package io.trielex.table.api;

import java.util.Iterator;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Pull-based longest-match tokenizer over one input string.
 *
 * <h2>Basic Usage</h2>
 *
 * <pre>{@code
 * TableIterator<Kind> it = table.lexer("x == 42");
 * while (it.hasNext()) {
 *   Token<Kind> token = it.next(); // may throw LexerException
 *   emit(token.value(), token.text());
 * }
 * }</pre>
 *
 * <p>Each call to {@link #next()} returns the longest prefix of the remaining input accepted by
 * some pattern. When no prefix is accepted, or a character outside the alphabet is met, {@link
 * #next()} throws a {@link LexerException} once and the iteration is over ({@link #hasNext()}
 * returns {@code false} from then on).
 *
 * <p><b>Threading:</b> an iterator is a single-threaded cursor. Any number of iterators may scan
 * the same {@link Table} concurrently once the table is no longer being modified.
 *
 * <p>An iterator is not restartable; call {@link Table#lexer(String)} again to rescan.
 *
 * @param <T> value type
 */
public interface TableIterator<T> extends Iterator<Token<T>> {

  /** Scanner state. */
  enum State {
    /** More input remains to be tokenized. */
    SCANNING,
    /** All input has been tokenized. */
    DONE,
    /** Scanning stopped on a {@link LexerException}. */
    FAILED
  }

  /**
   * Returns the next token.
   *
   * @return the next token
   * @throws LexerException if the remaining input cannot be tokenized
   * @throws java.util.NoSuchElementException if the iteration has ended
   */
  @Override
  Token<T> next();

  State state();

  /**
   * Returns the 0-based offset at which the next token attempt starts.
   *
   * @return the current cursor
   */
  int position();

  /**
   * Adapts the remaining tokens to a sequential stream. A {@link LexerException} surfaces from
   * the terminal operation consuming the stream.
   *
   * @return a stream over the remaining tokens
   */
  default Stream<Token<T>> stream() {
    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL),
        false);
  }
}
