package com.sailfish.taskman.query;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class MergeSortTest {

    /** Sort key plus original position, to observe stability. */
    private static final class Item {
        final int key;
        final int position;

        Item(int key, int position) {
            this.key = key;
            this.position = position;
        }
    }

    private static final Comparator<Item> BY_KEY = Comparator.comparingInt(i -> i.key);

    @Test
    void emptyAndSingletonInputs() {
        assertThat(MergeSort.sort(List.<Integer>of(), Comparator.naturalOrder())).isEmpty();
        assertThat(MergeSort.sort(List.of(42), Comparator.<Integer>naturalOrder())).containsExactly(42);
    }

    @Test
    void doesNotModifyInput() {
        List<Integer> input = new ArrayList<>(List.of(3, 1, 2));

        List<Integer> sorted = MergeSort.sort(input, Comparator.naturalOrder());

        assertThat(sorted).containsExactly(1, 2, 3);
        assertThat(input).containsExactly(3, 1, 2);
    }

    @Test
    void matchesLibrarySortOnRandomInputs() {
        Random random = new Random(20250101L);
        for (int round = 0; round < 50; round++) {
            int size = random.nextInt(200);
            List<Integer> input = new ArrayList<>(size);
            for (int i = 0; i < size; i++) {
                input.add(random.nextInt(20));
            }
            List<Integer> expected = new ArrayList<>(input);
            Collections.sort(expected);

            assertThat(MergeSort.sort(input, Comparator.naturalOrder())).isEqualTo(expected);
        }
    }

    @Test
    void equalKeysKeepInputOrder() {
        Random random = new Random(7L);
        List<Item> input = new ArrayList<>();
        for (int i = 0; i < 500; i++) {
            input.add(new Item(random.nextInt(5), i));
        }

        List<Item> sorted = MergeSort.sort(input, BY_KEY);

        for (int i = 1; i < sorted.size(); i++) {
            Item previous = sorted.get(i - 1);
            Item current = sorted.get(i);
            assertThat(previous.key).isLessThanOrEqualTo(current.key);
            if (previous.key == current.key) {
                assertThat(previous.position).isLessThan(current.position);
            }
        }
    }

    @Test
    void reversedComparatorStaysStable() {
        List<Item> input = List.of(new Item(1, 0), new Item(2, 1), new Item(1, 2), new Item(2, 3));

        List<Item> sorted = MergeSort.sort(input, BY_KEY.reversed());

        assertThat(sorted).extracting(i -> i.position).containsExactly(1, 3, 0, 2);
    }
}
