package io.lacuna.kleene;

import io.lacuna.bifurcan.*;

import java.util.Objects;
import java.util.function.IntFunction;

final class Utils {

  private Utils() {
  }

  static int checkIndex(int index, int size) {
    if (index < 0 || index >= size) {
      throw new IndexOutOfBoundsException("state " + index + " is not within [0, " + size + ")");
    }
    return index;
  }

  static <V> LinearList<V> tabulate(int size, IntFunction<V> f) {
    LinearList<V> list = new LinearList<>();
    for (int i = 0; i < size; i++) {
      list.addLast(Objects.requireNonNull(f.apply(i), "null label"));
    }
    return list;
  }

  static <V> LinearSet<V> toSet(Iterable<V> vals) {
    LinearSet<V> set = new LinearSet<>();
    vals.forEach(set::add);
    return set;
  }

  /**
   * @return the elements of {@code vals} in iteration order, with duplicates after the first occurrence removed
   */
  static <V> LinearList<V> distinct(Iterable<V> vals) {
    LinearSet<V> seen = new LinearSet<>();
    LinearList<V> list = new LinearList<>();
    for (V v : vals) {
      Objects.requireNonNull(v, "null symbol");
      if (!seen.contains(v)) {
        seen.add(v);
        list.addLast(v);
      }
    }
    return list;
  }
}
