package com.onthegomap.wayedit.util;

import com.carrotsearch.hppc.IntArrayList;
import com.carrotsearch.hppc.LongArrayList;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.function.ToIntFunction;

/** Index-based helpers for ordered lists. */
public class Lists {

  private Lists() {}

  /**
   * Returns copies of the ranges of {@code list} between each of the {@code indices}, where adjacent chunks share the
   * element at the index they were split at.
   * <p>
   * For example splitting {@code [1, 2, 3, 4, 5]} at index 2 returns {@code [1, 2, 3]} and {@code [3, 4, 5]}.
   *
   * @param list    the list to split
   * @param indices ascending indices to split at
   */
  public static List<LongArrayList> splitIntoChunks(LongArrayList list, IntArrayList indices) {
    List<LongArrayList> result = new ArrayList<>(indices.size() + 1);
    int lastIndex = 0;
    for (var index : indices) {
      if (index.value < lastIndex || index.value >= list.size()) {
        throw new IllegalArgumentException("Invalid split index " + index.value + " for list of " + list.size());
      }
      result.add(slice(list, lastIndex, index.value + 1));
      lastIndex = index.value;
    }
    result.add(slice(list, lastIndex, list.size()));
    return result;
  }

  /** Returns a copy of the elements of {@code list} from {@code from} (inclusive) to {@code to} (exclusive). */
  public static LongArrayList slice(LongArrayList list, int from, int to) {
    LongArrayList result = new LongArrayList(Math.max(0, to - from));
    for (int i = from; i < to; i++) {
      result.add(list.get(i));
    }
    return result;
  }

  /** Returns the index of the first element with the greatest {@code value}, or -1 if the list is empty. */
  public static <T> int indexOfMaxBy(List<T> list, ToIntFunction<? super T> value) {
    int result = -1;
    int max = Integer.MIN_VALUE;
    for (int i = 0; i < list.size(); i++) {
      int current = value.applyAsInt(list.get(i));
      if (result < 0 || current > max) {
        max = current;
        result = i;
      }
    }
    return result;
  }

  /** Returns the closest element before {@code index} that matches {@code predicate}, or {@code null} if none do. */
  public static <T> T findPrevious(List<T> list, int index, Predicate<? super T> predicate) {
    for (int i = Math.min(index, list.size()) - 1; i >= 0; i--) {
      T item = list.get(i);
      if (predicate.test(item)) {
        return item;
      }
    }
    return null;
  }

  /** Returns the closest element at or after {@code index} that matches {@code predicate}, or {@code null}. */
  public static <T> T findNext(List<T> list, int index, Predicate<? super T> predicate) {
    for (int i = Math.max(index, 0); i < list.size(); i++) {
      T item = list.get(i);
      if (predicate.test(item)) {
        return item;
      }
    }
    return null;
  }

  /** Returns a copy of {@code list} with the element at {@code index} replaced by {@code replacements}. */
  public static <T> List<T> splice(List<T> list, int index, List<? extends T> replacements) {
    List<T> result = new ArrayList<>(list.size() - 1 + replacements.size());
    result.addAll(list.subList(0, index));
    result.addAll(replacements);
    result.addAll(list.subList(index + 1, list.size()));
    return result;
  }
}
