package io.colstore.storage.encoder;

import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.Objects;
import java.util.Random;

import io.colstore.data.DataType;
import io.colstore.storage.column.EncodingType;
import io.colstore.storage.column.RunLengthColumn;
import io.colstore.storage.column.ValueColumn;

public class RunLengthEncoderTest {
    private Random random = new Random();

    @Test
    public void testSimple() {
        ValueColumn<Integer> column = ValueColumn.of(DataType.INT, 1, 1, 1, 2, 2, null, null, 1);
        RunLengthColumn<Integer> encoded = new RunLengthEncoder().encode(column);
        Assert.assertEquals(EncodingType.RUN_LENGTH, encoded.encodingType());
        Assert.assertNull(encoded.zsType());
        Assert.assertEquals(4, encoded.runCount());
        Assert.assertEquals(Arrays.asList(1, 2, null, 1), encoded.values());
        Assert.assertEquals(Arrays.asList(false, false, true, false), encoded.nullValues());
        Assert.assertEquals(Arrays.asList(3, 5, 7, 8), encoded.endPositions());
        Assert.assertEquals(8, encoded.size());

        Assert.assertEquals(0, encoded.runIndexOf(0));
        Assert.assertEquals(0, encoded.runIndexOf(2));
        Assert.assertEquals(1, encoded.runIndexOf(3));
        Assert.assertEquals(2, encoded.runIndexOf(6));
        Assert.assertEquals(3, encoded.runIndexOf(7));
        for (int i = 0; i < column.size(); i++) {
            Assert.assertEquals(column.get(i), encoded.valueAt(i));
        }
    }

    @Test
    public void testEmpty() {
        RunLengthColumn<String> encoded = new RunLengthEncoder().encode(new ValueColumn<String>(DataType.STRING, true));
        Assert.assertEquals(0, encoded.runCount());
        Assert.assertEquals(0, encoded.size());
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void testOutOfRange() {
        new RunLengthEncoder().encode(ValueColumn.of(DataType.INT, 1, 2)).runIndexOf(2);
    }

    @Test
    public void testSingleRun() {
        RunLengthColumn<String> encoded = new RunLengthEncoder().encode(ValueColumn.of(DataType.STRING, "a", "a", "a"));
        Assert.assertEquals(1, encoded.runCount());
        Assert.assertEquals(3, encoded.endPosition(0));

        encoded = new RunLengthEncoder().encode(ValueColumn.of(DataType.STRING, null, null));
        Assert.assertEquals(1, encoded.runCount());
        Assert.assertTrue(encoded.isNullRun(0));
        Assert.assertNull(encoded.runValue(0));
    }

    @Test
    public void testCoverage() {
        for (int time = 0; time < 20; time++) {
            int count = random.nextInt(3000) + 1;
            ValueColumn<Long> column = new ValueColumn<>(DataType.LONG, true);
            Long v = 0L;
            for (int i = 0; i < count; i++) {
                // Long runs of few distinct values.
                if (random.nextInt(8) == 0) {
                    int r = random.nextInt(4);
                    v = r == 0 ? null : Long.valueOf(r);
                }
                column.append(v);
            }
            RunLengthColumn<Long> encoded = new RunLengthEncoder().encode(column);

            int runCount = encoded.runCount();
            Assert.assertEquals(count, encoded.endPosition(runCount - 1));
            int start = 0;
            for (int run = 0; run < runCount; run++) {
                int end = encoded.endPosition(run);
                Assert.assertTrue(end > start);
                Assert.assertEquals(encoded.runValue(run) == null, encoded.isNullRun(run));
                for (int i = start; i < end; i++) {
                    Assert.assertEquals(column.get(i), encoded.runValue(run));
                }
                // Runs are maximal.
                if (run > 0) {
                    Assert.assertFalse(Objects.equals(encoded.runValue(run - 1), encoded.runValue(run)));
                }
                start = end;
            }
        }
    }
}
