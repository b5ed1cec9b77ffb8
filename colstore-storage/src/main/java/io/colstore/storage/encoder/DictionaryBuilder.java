package io.colstore.storage.encoder;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.ObjectArrays;
import it.unimi.dsi.fastutil.objects.ObjectRBTreeSet;

import io.colstore.storage.column.ValueColumn;

/**
 * Builds the sorted dictionary of a column and the value id of every row.
 * Null rows get the id <code>dictionary.size()</code>.
 */
public final class DictionaryBuilder<T> {
    private final ImmutableList<T> dictionary;
    private final IntArrayList valueIds;

    private DictionaryBuilder(ImmutableList<T> dictionary, IntArrayList valueIds) {
        this.dictionary = dictionary;
        this.valueIds = valueIds;
    }

    @SuppressWarnings("unchecked")
    public static <T> DictionaryBuilder<T> build(ValueColumn<T> column) {
        Ordering<T> ordering = column.dataType().ordering();
        int valCount = column.size();

        ObjectRBTreeSet<T> dict = new ObjectRBTreeSet<>(ordering);
        for (int i = 0; i < valCount; i++) {
            T v = column.get(i);
            if (v != null) {
                dict.add(v);
            }
        }
        T[] entries = (T[]) dict.toArray();
        dict.clear();

        int nullValueId = entries.length;
        IntArrayList valueIds = new IntArrayList(valCount);
        for (int i = 0; i < valCount; i++) {
            T v = column.get(i);
            if (v == null) {
                valueIds.add(nullValueId);
            } else {
                int vid = ObjectArrays.binarySearch(entries, v, ordering);
                assert vid >= 0;
                valueIds.add(vid);
            }
        }
        return new DictionaryBuilder<>(ImmutableList.copyOf(entries), valueIds);
    }

    public ImmutableList<T> dictionary() {
        return dictionary;
    }

    public IntArrayList valueIds() {
        return valueIds;
    }

    public int nullValueId() {
        return dictionary.size();
    }
}
