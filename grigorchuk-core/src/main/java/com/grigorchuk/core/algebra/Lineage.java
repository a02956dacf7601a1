package com.grigorchuk.core.algebra;

import java.util.Arrays;

/**
 * Scratch data attached to element handles: the step that last produced an element and its
 * breadth-first distance from the identity. Neither is part of an element's identity.
 */
public final class Lineage {

    private static final int INITIAL_CAPACITY = 1024;

    private PathStep[] steps = new PathStep[INITIAL_CAPACITY];
    private int[] distances = newDistances(INITIAL_CAPACITY);

    public Lineage() {
        steps[ElementStore.A] = PathStep.A;
        steps[ElementStore.B] = PathStep.B;
        steps[ElementStore.C] = PathStep.C;
        steps[ElementStore.D] = PathStep.D;
    }

    /**
     * Returns the step that produced {@code handle}, or {@code null} if none was recorded.
     */
    public PathStep step(int handle) {
        checkHandle(handle);
        return handle < steps.length ? steps[handle] : null;
    }

    public void label(int handle, PathStep step) {
        ensureCapacity(handle);
        steps[handle] = step;
    }

    /**
     * Returns the breadth-first distance of {@code handle} from the identity, or {@code -1} if the
     * element has not been visited.
     */
    public int distance(int handle) {
        checkHandle(handle);
        return handle < distances.length ? distances[handle] : -1;
    }

    public boolean isVisited(int handle) {
        return distance(handle) >= 0;
    }

    /**
     * Marks {@code handle} as visited at the given distance unless it has been visited already.
     *
     * @return {@code true} if the element was newly visited
     */
    public boolean visit(int handle, PathStep step, int distance) {
        if (distance < 0) {
            throw new IllegalArgumentException("Distance must be non-negative: " + distance);
        }
        if (isVisited(handle)) {
            return false;
        }
        ensureCapacity(handle);
        steps[handle] = step;
        distances[handle] = distance;
        return true;
    }

    private void ensureCapacity(int handle) {
        checkHandle(handle);
        if (handle < steps.length) {
            return;
        }
        int capacity = steps.length;
        while (capacity <= handle) {
            capacity *= 2;
        }
        int oldLength = distances.length;
        steps = Arrays.copyOf(steps, capacity);
        distances = Arrays.copyOf(distances, capacity);
        Arrays.fill(distances, oldLength, capacity, -1);
    }

    private static void checkHandle(int handle) {
        if (handle < 0) {
            throw new IllegalArgumentException("Negative element handle: " + handle);
        }
    }

    private static int[] newDistances(int capacity) {
        int[] values = new int[capacity];
        Arrays.fill(values, -1);
        return values;
    }
}
