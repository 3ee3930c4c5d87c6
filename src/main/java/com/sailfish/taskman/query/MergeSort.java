package com.sailfish.taskman.query;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Top-down merge sort.
 *
 * <p>The input is split at its midpoint, each half is sorted recursively, and the halves are
 * merged by repeatedly taking the smaller head. On a tie the left head wins, which keeps the
 * sort stable: elements that compare equal stay in their input order. O(n log n) time,
 * O(n) extra space.
 */
public final class MergeSort {

    private MergeSort() {
    }

    /**
     * Returns a new sorted list; the input is not modified.
     *
     * @param items      elements to sort
     * @param comparator ordering to apply
     */
    public static <T> List<T> sort(List<? extends T> items, Comparator<? super T> comparator) {
        Objects.requireNonNull(items, "items cannot be null");
        Objects.requireNonNull(comparator, "comparator cannot be null");
        return sortRange(items, 0, items.size(), comparator);
    }

    private static <T> List<T> sortRange(List<? extends T> items, int from, int to, Comparator<? super T> comparator) {
        if (to - from <= 1) {
            List<T> single = new ArrayList<>(1);
            if (to > from) {
                single.add(items.get(from));
            }
            return single;
        }
        int mid = from + (to - from) / 2;
        List<T> left = sortRange(items, from, mid, comparator);
        List<T> right = sortRange(items, mid, to, comparator);
        return merge(left, right, comparator);
    }

    private static <T> List<T> merge(List<T> left, List<T> right, Comparator<? super T> comparator) {
        List<T> result = new ArrayList<>(left.size() + right.size());
        int i = 0;
        int j = 0;
        while (i < left.size() && j < right.size()) {
            if (comparator.compare(left.get(i), right.get(j)) <= 0) {
                result.add(left.get(i++));
            } else {
                result.add(right.get(j++));
            }
        }
        while (i < left.size()) {
            result.add(left.get(i++));
        }
        while (j < right.size()) {
            result.add(right.get(j++));
        }
        return result;
    }
}
