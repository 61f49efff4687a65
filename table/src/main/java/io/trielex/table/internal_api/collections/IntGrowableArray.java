package io.trielex.table.internal_api.collections;

import java.util.Arrays;

/**
 * Growable {@code int[]} wrapper used as an append-only record of insertion steps.
 *
 * <p>Supports append, bounds-checked indexed read and reset. Doubles capacity on overflow.
 */
public final class IntGrowableArray {
  private int[] data;
  private int size;

  public IntGrowableArray(int initialCapacity) {
    if (initialCapacity < 0) {
      throw new IllegalArgumentException("negative capacity: " + initialCapacity);
    }
    this.data = new int[initialCapacity];
  }

  public void add(int value) {
    if (size == data.length) {
      data = Arrays.copyOf(data, Math.max(1, data.length << 1));
    }
    data[size++] = value;
  }

  public int get(int index) {
    if (index < 0 || index >= size) {
      throw new IndexOutOfBoundsException("index " + index + " out of bounds for size " + size);
    }
    return data[index];
  }

  public void clear() {
    size = 0;
  }

  public int size() {
    return size;
  }
}
