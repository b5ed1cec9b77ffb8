package io.colstore.storage.column;

import com.google.common.collect.ImmutableList;

import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;

import it.unimi.dsi.fastutil.booleans.BooleanArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

import io.colstore.data.DataType;
import io.colstore.storage.pack.FixedSizeByteAlignedVector;
import io.colstore.storage.pack.PackedIntVectors;
import io.colstore.storage.pack.ZsType;

public class ValueColumnTest {

    @Test
    public void testAppend() {
        ValueColumn<String> column = new ValueColumn<>(DataType.STRING, true);
        column.append("a");
        column.append(null);
        column.append("c");
        Assert.assertEquals(3, column.size());
        Assert.assertEquals(EncodingType.UNENCODED, column.encodingType());
        Assert.assertTrue(column.isNullAt(1));
        Assert.assertFalse(column.isNullAt(2));
        Assert.assertEquals("c", column.get(2));
        Assert.assertEquals(Arrays.asList("a", null, "c"), column.values());
        Assert.assertEquals(8 * 3 + 42 * 2, column.estimateMemoryUsage());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testWrongType() {
        @SuppressWarnings({"unchecked", "rawtypes"})
        ValueColumn<Object> column = (ValueColumn) new ValueColumn<Integer>(DataType.INT, true);
        column.append(1L);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNullNotAllowed() {
        new ValueColumn<Integer>(DataType.INT, false).append(null);
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testValuesUnmodifiable() {
        ValueColumn.of(DataType.INT, 1, 2).values().add(3);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testLegacyLayoutNeedsByteAligned() {
        new DeprecatedDictionaryColumn<>(DataType.INT, ImmutableList.of(1, 2),
                PackedIntVectors.encode(ZsType.BIT_PACKED, IntArrayList.wrap(new int[]{0, 1})));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testLegacyLayoutWidth() {
        // 2 entries use the null value id 0xFF, which needs 8 bits.
        new DeprecatedDictionaryColumn<>(DataType.INT, ImmutableList.of(1, 2),
                PackedIntVectors.encode(ZsType.FIXED_SIZE_BYTE_ALIGNED, IntArrayList.wrap(new int[]{0, 1}), FixedSizeByteAlignedVector.MAX_SHORT_VALUE));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRunsMismatch() {
        new RunLengthColumn<>(DataType.INT, new ObjectArrayList<Integer>(), new BooleanArrayList(), IntArrayList.wrap(new int[]{3}));
    }

    @Test
    public void testRunsCopied() {
        ObjectArrayList<Integer> values = ObjectArrayList.wrap(new Integer[]{1, 2});
        BooleanArrayList nullValues = BooleanArrayList.wrap(new boolean[]{false, false});
        IntArrayList ends = IntArrayList.wrap(new int[]{2, 4});
        RunLengthColumn<Integer> column = new RunLengthColumn<>(DataType.INT, values, nullValues, ends);

        values.set(0, 2);
        nullValues.set(1, true);
        ends.set(1, 3);
        Assert.assertEquals(Arrays.asList(1, 1, 2, 2),
                Arrays.asList(column.valueAt(0), column.valueAt(1), column.valueAt(2), column.valueAt(3)));
        Assert.assertFalse(column.isNullRun(1));
        Assert.assertEquals(4, column.size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRunEndsNotIncreasing() {
        new RunLengthColumn<>(DataType.INT, ObjectArrayList.wrap(new Integer[]{1, 2}),
                BooleanArrayList.wrap(new boolean[]{false, false}), IntArrayList.wrap(new int[]{4, 2}));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyRun() {
        new RunLengthColumn<>(DataType.INT, ObjectArrayList.wrap(new Integer[]{1}),
                BooleanArrayList.wrap(new boolean[]{false}), IntArrayList.wrap(new int[]{0}));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRunNullFlagMismatch() {
        new RunLengthColumn<>(DataType.INT, ObjectArrayList.wrap(new Integer[]{1, null}),
                BooleanArrayList.wrap(new boolean[]{false, false}), IntArrayList.wrap(new int[]{2, 4}));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRunValueType() {
        new RunLengthColumn<>(DataType.INT, ObjectArrayList.wrap(new Object[]{1, "2"}),
                BooleanArrayList.wrap(new boolean[]{false, false}), IntArrayList.wrap(new int[]{2, 4}));
    }
}
