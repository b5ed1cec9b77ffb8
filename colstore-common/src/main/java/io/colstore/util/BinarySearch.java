package io.colstore.util;

/**
 * Searches over sorted int arrays.
 */
public class BinarySearch {

    /**
     * Returns the index of the first element in <code>[0, count)</code> strictly greater than the key,
     * or <code>count</code> if there is none. The array must be sorted ascending.
     */
    public static int upperBoundInts(int[] array, int count, int key) {
        int from = 0;
        int to = count;
        while (from < to) {
            int mid = from + to >>> 1;
            if (array[mid] <= key) {
                from = mid + 1;
            } else {
                to = mid;
            }
        }
        return from;
    }
}
