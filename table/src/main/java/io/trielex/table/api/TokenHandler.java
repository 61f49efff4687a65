package io.trielex.table.api;

/**
 * Callback receiving tokens from {@link Table#scan(String, TokenHandler)}.
 *
 * @param <T> value type
 */
@FunctionalInterface
public interface TokenHandler<T> {
  /**
   * Called once per token, in input order, on the scanning thread.
   *
   * @param token the matched token
   * @param ctl scan control; call {@link Control#abort()} to stop after this token
   */
  void onToken(Token<T> token, Control ctl);
}
