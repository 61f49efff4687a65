package io.trielex.table.api;

import io.trielex.table.impl.Atom;
import io.trielex.table.impl.PatternParser;
import io.trielex.table.impl.TableIteratorImpl;
import io.trielex.table.impl.TrieGraph;
import io.trielex.table.internal_api.collections.AsciiSet;
import it.unimi.dsi.fastutil.chars.CharIterator;
import it.unimi.dsi.fastutil.chars.CharLinkedOpenHashSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A fixed set of patterns over an ASCII alphabet, matched exactly by {@link #get(String)} and
 * tokenized with longest-match semantics by {@link #lexer(String)}.
 *
 * <p>Pattern syntax:
 *
 * <ul>
 *   <li>{@code c} matches the alphabet character {@code c};
 *   <li>{@code [abc]} matches any one of the listed characters;
 *   <li>a trailing {@code +} repeats the preceding character or class one or more times.
 * </ul>
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * Table<Kind> table = Table.create("=0123456789");
 * table.add("=", Kind.EQ);
 * table.add("==", Kind.EQ_EQ);
 * table.add("[0123456789]+", Kind.NUMBER);
 *
 * table.get("42");              // Optional[NUMBER]
 * table.tokenize("===12");      // [EQ_EQ "==", EQ "=", NUMBER "12"]
 * }</pre>
 *
 * <p><strong>Threading:</strong> {@link #add(String, Object)} needs exclusive access. Once all
 * patterns are added the table is only read, and may be shared by any number of threads calling
 * {@link #get(String)}, {@link #lexer(String)} or {@link #scan(String, TokenHandler)}.
 *
 * @param <T> value type; values must not be {@code null}
 */
public final class Table<T> {
  private static final Logger log = LoggerFactory.getLogger(Table.class);

  private final String alphabet;
  private final AsciiSet members;
  private final TrieGraph<T> graph;
  private int size;

  private Table(String alphabet, TableOptions options) {
    this.alphabet = distinctAscii(alphabet);
    this.members = AsciiSet.of(this.alphabet);
    this.graph = new TrieGraph<>(options.initialNodeCapacity());
  }

  /**
   * Creates an empty table over the characters of {@code alphabet}. Never fails: duplicate
   * characters are ignored, and non-ASCII characters are dropped since no pattern or query may
   * contain them.
   *
   * @param alphabet allowed characters
   * @return a new table
   * @throws NullPointerException if alphabet is null
   */
  public static <T> Table<T> create(String alphabet) {
    return create(alphabet, TableOptions.DEFAULT);
  }

  /**
   * Creates an empty table with custom options.
   *
   * @param alphabet allowed characters
   * @param options table options
   * @return a new table
   * @throws NullPointerException if alphabet or options is null
   */
  public static <T> Table<T> create(String alphabet, TableOptions options) {
    Objects.requireNonNull(alphabet, "alphabet must not be null");
    Objects.requireNonNull(options, "options must not be null");
    return new Table<>(alphabet, options);
  }

  private static String distinctAscii(String alphabet) {
    CharLinkedOpenHashSet seen = new CharLinkedOpenHashSet(alphabet.length());
    StringBuilder dropped = new StringBuilder();
    for (int i = 0; i < alphabet.length(); i++) {
      char c = alphabet.charAt(i);
      if (c > 127) {
        dropped.append(c);
      } else {
        seen.add(c);
      }
    }
    if (dropped.length() > 0) {
      log.warn("Ignoring non-ASCII alphabet characters: '{}'", dropped);
    }
    StringBuilder sb = new StringBuilder(seen.size());
    for (CharIterator it = seen.iterator(); it.hasNext(); ) {
      sb.append(it.nextChar());
    }
    return sb.toString();
  }

  /**
   * Adds a pattern. Either the whole pattern is added or, on failure, the table is left exactly
   * as it was.
   *
   * @param pattern the pattern, at least one atom long
   * @param value value returned for inputs matching the pattern
   * @throws InvalidPatternException if the pattern is malformed or uses characters outside the
   *     alphabet
   * @throws ValueAlreadyDefinedException if some input matched by the pattern already has a value
   * @throws NullPointerException if pattern or value is null
   */
  public void add(String pattern, T value) throws TableException {
    Objects.requireNonNull(pattern, "pattern must not be null");
    Objects.requireNonNull(value, "value must not be null");
    List<Atom> atoms = PatternParser.parse(pattern, members);
    int created = graph.insert(pattern, atoms, value);
    size++;
    log.debug(
        "Added pattern '{}' -> {} ({} atoms, {} new nodes, {} total)",
        pattern,
        value,
        atoms.size(),
        created,
        graph.nodeCount());
  }

  /**
   * Matches the whole of {@code query} against the added patterns.
   *
   * @param query the string to match
   * @return the value of the pattern accepting {@code query}, or empty if none does
   * @throws InvalidQueryException if {@code query} is not ASCII or uses characters outside the
   *     alphabet
   */
  public Optional<T> get(String query) throws InvalidQueryException {
    validate(query);
    int node = TrieGraph.ROOT;
    for (int i = 0; i < query.length(); i++) {
      node = graph.step(node, query.charAt(i));
      if (node == TrieGraph.NONE) {
        return Optional.empty();
      }
    }
    return Optional.ofNullable(graph.valueAt(node));
  }

  /**
   * Returns {@code true} if some pattern accepts the whole of {@code query}.
   *
   * @throws InvalidQueryException if {@code query} is not ASCII or uses characters outside the
   *     alphabet
   */
  public boolean contains(String query) throws InvalidQueryException {
    return get(query).isPresent();
  }

  private void validate(String query) throws InvalidQueryException {
    Objects.requireNonNull(query, "query must not be null");
    if (!AsciiSet.isAscii(query)) {
      throw InvalidQueryException.invalidString(query);
    }
    for (int i = 0; i < query.length(); i++) {
      char c = query.charAt(i);
      if (!members.contains(c)) {
        throw InvalidQueryException.invalidCharacter(query, c, i);
      }
    }
  }

  /**
   * Starts a longest-match scan of {@code input}. Characters outside the alphabet are reported
   * lazily, by the iterator, when the scan reaches them.
   *
   * @param input the text to tokenize
   * @return a lazy iterator over the tokens of {@code input}
   * @throws InvalidQueryException if {@code input} contains non-ASCII characters
   */
  public TableIterator<T> lexer(String input) throws InvalidQueryException {
    Objects.requireNonNull(input, "input must not be null");
    if (!AsciiSet.isAscii(input)) {
      throw InvalidQueryException.invalidString(input);
    }
    return new TableIteratorImpl<>(graph, members, input);
  }

  /**
   * Tokenizes all of {@code input}.
   *
   * @param input the text to tokenize
   * @return the tokens in input order
   * @throws InvalidQueryException if {@code input} contains non-ASCII characters
   * @throws LexerException if some part of {@code input} cannot be tokenized
   */
  public List<Token<T>> tokenize(String input) throws InvalidQueryException {
    List<Token<T>> tokens = new ArrayList<>();
    lexer(input).forEachRemaining(tokens::add);
    return tokens;
  }

  /**
   * Pushes the tokens of {@code input} to {@code handler} until the input is exhausted or the
   * handler aborts.
   *
   * @param input the text to tokenize
   * @param handler token callback
   * @return number of tokens delivered
   * @throws InvalidQueryException if {@code input} contains non-ASCII characters
   * @throws LexerException if some part of {@code input} cannot be tokenized
   */
  public int scan(String input, TokenHandler<T> handler) throws InvalidQueryException {
    Objects.requireNonNull(handler, "handler must not be null");
    TableIterator<T> it = lexer(input);
    ScanControl ctl = new ScanControl(it);
    int delivered = 0;
    while (!ctl.isAborted() && it.hasNext()) {
      handler.onToken(it.next(), ctl);
      delivered++;
    }
    return delivered;
  }

  /** Returns the alphabet: distinct ASCII characters in first-occurrence order. */
  public String alphabet() {
    return alphabet;
  }

  /** Returns the number of patterns successfully added. */
  public int size() {
    return size;
  }

  /** Returns the number of automaton states, including the root. */
  public int nodeCount() {
    return graph.nodeCount();
  }

  @Override
  public String toString() {
    return "Table{alphabet='" + alphabet + "', patterns=" + size + ", nodes=" + nodeCount() + "}";
  }

  private static final class ScanControl implements Control {
    private final TableIterator<?> it;
    private boolean aborted;

    ScanControl(TableIterator<?> it) {
      this.it = it;
    }

    @Override
    public int position() {
      return it.position();
    }

    @Override
    public void abort() {
      aborted = true;
    }

    @Override
    public boolean isAborted() {
      return aborted;
    }
  }
}
