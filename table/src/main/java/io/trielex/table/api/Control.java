package io.trielex.table.api;

/**
 * Control utilities available to a {@link TokenHandler} during a scan. Meaningful only while the
 * handler is being invoked.
 */
public interface Control {
  /**
   * Returns the 0-based offset at which the next token attempt will start.
   *
   * @return the scan cursor
   */
  int position();

  /** Stops the scan once the current handler invocation returns. */
  void abort();

  /** Returns {@code true} if {@link #abort()} was called. */
  boolean isAborted();
}
