package com.grigorchuk.core.algebra;

import com.grigorchuk.core.Generator;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Interning context for canonical group elements. Every element is a triple
 * {@code (swapped, left, right)} of a swap flag and the handles of the elements acting on the two
 * subtrees. The store hands out exactly one handle per distinct triple, so two handles are equal
 * if and only if they denote the same element.
 *
 * <p>Handles {@code 0..4} are fixed: the identity {@code (false, I, I)}, {@code a = (true, I, I)},
 * {@code b = (false, a, c)}, {@code c = (false, a, d)} and {@code d = (false, I, b)}. The store is
 * append-only and not thread-safe.
 */
public final class ElementStore {

    public static final int IDENTITY = 0;
    public static final int A = 1;
    public static final int B = 2;
    public static final int C = 3;
    public static final int D = 4;
    public static final int FIXED_COUNT = 5;

    private static final Logger LOGGER = Logger.getLogger(ElementStore.class.getName());
    private static final int INITIAL_CAPACITY = 1024;
    private static final String[] FIXED_NAMES = {"I", "a", "b", "c", "d"};

    private final Map<Long, Integer> index = new HashMap<>();
    private boolean[] swapped = new boolean[INITIAL_CAPACITY];
    private int[] left = new int[INITIAL_CAPACITY];
    private int[] right = new int[INITIAL_CAPACITY];
    private int size;

    public ElementStore() {
        // identity first, so that it can refer to itself
        allocate(false, IDENTITY, IDENTITY);
        allocate(true, IDENTITY, IDENTITY);
        allocate(false, A, C);
        allocate(false, A, D);
        allocate(false, IDENTITY, B);
    }

    /**
     * Returns the unique handle for the given triple, interning it on first use.
     */
    public int lookup(boolean swapped, int left, int right) {
        checkHandle(left);
        checkHandle(right);
        for (int fixed = 0; fixed < FIXED_COUNT; fixed++) {
            if (this.swapped[fixed] == swapped && this.left[fixed] == left && this.right[fixed] == right) {
                return fixed;
            }
        }
        long key = key(swapped, left, right);
        Integer existing = index.get(key);
        if (existing != null) {
            return existing;
        }
        int handle = allocate(swapped, left, right);
        index.put(key, handle);
        return handle;
    }

    public boolean isSwapped(int handle) {
        checkHandle(handle);
        return swapped[handle];
    }

    public int left(int handle) {
        checkHandle(handle);
        return left[handle];
    }

    public int right(int handle) {
        checkHandle(handle);
        return right[handle];
    }

    /**
     * Returns the fixed handle of a generator.
     */
    public static int handleOf(Generator generator) {
        return switch (generator) {
            case A -> A;
            case B -> B;
            case C -> C;
            case D -> D;
        };
    }

    /**
     * Returns {@code true} for the identity and the four generators.
     */
    public static boolean isFixed(int handle) {
        return handle >= 0 && handle < FIXED_COUNT;
    }

    public boolean contains(int handle) {
        return handle >= 0 && handle < size;
    }

    /**
     * Returns the number of interned elements, including the fixed ones.
     */
    public int size() {
        return size;
    }

    /**
     * Returns the wreath notation of an element, such as {@code a(d,I)}.
     */
    public String describe(int handle) {
        checkHandle(handle);
        if (isFixed(handle)) {
            return FIXED_NAMES[handle];
        }
        StringBuilder builder = new StringBuilder();
        describe(handle, builder);
        return builder.toString();
    }

    private void describe(int handle, StringBuilder builder) {
        if (isFixed(handle)) {
            builder.append(FIXED_NAMES[handle]);
            return;
        }
        if (swapped[handle]) {
            builder.append('a');
        }
        builder.append('(');
        describe(left[handle], builder);
        builder.append(',');
        describe(right[handle], builder);
        builder.append(')');
    }

    private int allocate(boolean swappedValue, int leftValue, int rightValue) {
        if (size == swapped.length) {
            int capacity = swapped.length * 2;
            swapped = Arrays.copyOf(swapped, capacity);
            left = Arrays.copyOf(left, capacity);
            right = Arrays.copyOf(right, capacity);
            LOGGER.fine(() -> String.format("Element store grown to capacity %d", capacity));
        }
        int handle = size++;
        swapped[handle] = swappedValue;
        left[handle] = leftValue;
        right[handle] = rightValue;
        return handle;
    }

    private void checkHandle(int handle) {
        if (handle < 0 || handle >= size) {
            throw new IllegalArgumentException("Unknown element handle: " + handle);
        }
    }

    private static long key(boolean swapped, int left, int right) {
        return (swapped ? Long.MIN_VALUE : 0L) | ((long) left << 32) | (right & 0xFFFFFFFFL);
    }
}
