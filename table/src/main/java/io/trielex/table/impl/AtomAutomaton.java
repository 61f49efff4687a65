package io.trielex.table.impl;

import it.unimi.dsi.fastutil.chars.CharLinkedOpenHashSet;
import it.unimi.dsi.fastutil.chars.CharList;
import it.unimi.dsi.fastutil.chars.CharSet;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import java.util.List;

/**
 * Deterministic view of one atom sequence, built lazily.
 *
 * <p>Position {@code i} means "the first {@code i} atoms are consumed". From position {@code i} a
 * member of atom {@code i} leads to {@code i + 1}, and a member of atom {@code i - 1} leads back to
 * {@code i} when that atom is repeated. A state is the sorted set of positions reachable by the
 * input read so far, interned to a small {@code int} id.
 */
final class AtomAutomaton {
  static final int DEAD = -1;

  private final List<Atom> atoms;
  private final ObjectArrayList<IntList> states = new ObjectArrayList<>();
  private final Object2IntOpenHashMap<IntList> ids = new Object2IntOpenHashMap<>();

  AtomAutomaton(List<Atom> atoms) {
    this.atoms = atoms;
    ids.defaultReturnValue(DEAD);
    IntArrayList start = new IntArrayList(1);
    start.add(0);
    intern(start);
  }

  int start() {
    return 0;
  }

  boolean isAccepting(int state) {
    IntList positions = states.get(state);
    return positions.getInt(positions.size() - 1) == atoms.size();
  }

  /** Characters with a transition out of {@code state}, in pattern order. */
  CharSet chars(int state) {
    CharSet out = new CharLinkedOpenHashSet();
    IntList positions = states.get(state);
    for (int i = 0; i < positions.size(); i++) {
      int p = positions.getInt(i);
      if (p > 0 && atoms.get(p - 1).repeated()) {
        out.addAll(atoms.get(p - 1).chars());
      }
      if (p < atoms.size()) {
        out.addAll(atoms.get(p).chars());
      }
    }
    return out;
  }

  /** Returns the state reached from {@code state} on {@code c}, or {@link #DEAD}. */
  int next(int state, char c) {
    IntList positions = states.get(state);
    IntArrayList target = new IntArrayList(positions.size() + 1);
    // ascending input positions produce ascending output, with at most one adjacent duplicate
    for (int i = 0; i < positions.size(); i++) {
      int p = positions.getInt(i);
      if (p > 0 && atoms.get(p - 1).repeated() && contains(atoms.get(p - 1).chars(), c)) {
        append(target, p);
      }
      if (p < atoms.size() && contains(atoms.get(p).chars(), c)) {
        append(target, p + 1);
      }
    }
    return target.isEmpty() ? DEAD : intern(target);
  }

  private static boolean contains(CharList chars, char c) {
    return chars.indexOf(c) >= 0;
  }

  private static void append(IntArrayList target, int p) {
    if (target.isEmpty() || target.getInt(target.size() - 1) != p) {
      target.add(p);
    }
  }

  private int intern(IntList positions) {
    int id = ids.getInt(positions);
    if (id == DEAD) {
      id = states.size();
      states.add(positions);
      ids.put(positions, id);
    }
    return id;
  }
}
