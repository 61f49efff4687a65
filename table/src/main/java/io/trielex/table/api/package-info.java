/**
 * Public API for the Trielex pattern table.
 *
 * <p><b>Building</b>
 *
 * <ul>
 *   <li>Create a {@link io.trielex.table.api.Table} over a fixed alphabet and register patterns
 *       with {@link io.trielex.table.api.Table#add(String, Object)}.
 *   <li>Failed insertions throw a {@link io.trielex.table.api.TableException} subtype and leave
 *       the table untouched.
 * </ul>
 *
 * <p><b>Matching</b>
 *
 * <ul>
 *   <li>{@link io.trielex.table.api.Table#get(String)} matches one whole string.
 *   <li>{@link io.trielex.table.api.Table#lexer(String)} returns a pull-based {@link
 *       io.trielex.table.api.TableIterator}; {@link
 *       io.trielex.table.api.Table#scan(String, io.trielex.table.api.TokenHandler)} pushes tokens
 *       to a {@link io.trielex.table.api.TokenHandler}.
 *   <li>Scan failures surface as unchecked {@link io.trielex.table.api.LexerException}s.
 * </ul>
 *
 * <p><b>Example</b>
 *
 * <pre>{@code
 * Table<String> t = Table.create("abcdefghijklmnopqrstuvwxyz ");
 * t.add("[abcdefghijklmnopqrstuvwxyz]+", "WORD");
 * t.add(" +", "SPACE");
 * for (Token<String> tok : t.tokenize("hello world")) {
 *   // WORD "hello", SPACE " ", WORD "world"
 * }
 * }</pre>
 */
package io.trielex.table.api;
