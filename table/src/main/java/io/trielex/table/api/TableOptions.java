package io.trielex.table.api;

/**
 * Table configuration options.
 *
 * @param initialNodeCapacity number of trie nodes to pre-allocate; the arena grows past it
 */
public record TableOptions(int initialNodeCapacity) {

  /** System property overriding the default {@link #initialNodeCapacity()}. */
  public static final String INITIAL_NODE_CAPACITY_PROPERTY =
      "io.trielex.table.initial_node_capacity";

  static final int FALLBACK_NODE_CAPACITY = 64;

  /** Default options; honours {@value #INITIAL_NODE_CAPACITY_PROPERTY} when set. */
  public static final TableOptions DEFAULT =
      new TableOptions(
          Math.max(1, Integer.getInteger(INITIAL_NODE_CAPACITY_PROPERTY, FALLBACK_NODE_CAPACITY)));

  public TableOptions {
    if (initialNodeCapacity < 1) {
      throw new IllegalArgumentException(
          "initialNodeCapacity must be at least 1: " + initialNodeCapacity);
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  public static class Builder {
    private int initialNodeCapacity = DEFAULT.initialNodeCapacity;

    public Builder initialNodeCapacity(int value) {
      this.initialNodeCapacity = value;
      return this;
    }

    public TableOptions build() {
      return new TableOptions(initialNodeCapacity);
    }
  }
}
