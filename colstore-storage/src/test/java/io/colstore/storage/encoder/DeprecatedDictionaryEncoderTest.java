package io.colstore.storage.encoder;

import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import io.colstore.data.DataType;
import io.colstore.storage.column.DeprecatedDictionaryColumn;
import io.colstore.storage.column.EncodingType;
import io.colstore.storage.column.ValueColumn;
import io.colstore.storage.pack.ZsType;

public class DeprecatedDictionaryEncoderTest {

    @Test
    public void testSimple() {
        ValueColumn<Integer> column = ValueColumn.of(DataType.INT, 5, 3, 5, 5, null, 3);
        DeprecatedDictionaryColumn<Integer> encoded = new DeprecatedDictionaryEncoder().encode(column);
        Assert.assertEquals(EncodingType.DEPRECATED_DICTIONARY, encoded.encodingType());
        Assert.assertEquals(ZsType.FIXED_SIZE_BYTE_ALIGNED, encoded.zsType());
        Assert.assertEquals(Arrays.asList(3, 5), encoded.dictionary());
        Assert.assertEquals(0xFF, encoded.nullValueId());
        Assert.assertEquals(8, encoded.attributeVector().bitWidth());
        int[] ids = new int[]{1, 0, 1, 1, 0xFF, 0};
        for (int i = 0; i < ids.length; i++) {
            Assert.assertEquals(ids[i], encoded.attributeVector().get(i));
            Assert.assertEquals(column.get(i), encoded.valueAt(i));
        }
    }

    @Test
    public void testNullValueId() {
        Assert.assertEquals(0xFF, DeprecatedDictionaryColumn.nullValueIdFor(0));
        Assert.assertEquals(0xFF, DeprecatedDictionaryColumn.nullValueIdFor(255));
        Assert.assertEquals(0xFFFF, DeprecatedDictionaryColumn.nullValueIdFor(256));
        Assert.assertEquals(0xFFFF, DeprecatedDictionaryColumn.nullValueIdFor(65535));
        Assert.assertEquals(Integer.MAX_VALUE, DeprecatedDictionaryColumn.nullValueIdFor(65536));
    }

    @Test
    public void testWideDictionary() {
        List<String> values = new ArrayList<>();
        for (int i = 0; i < 300; i++) {
            values.add(String.format("%05d", i));
        }
        values.add(null);
        DeprecatedDictionaryColumn<String> encoded = new DeprecatedDictionaryEncoder().encode(ValueColumn.of(DataType.STRING, values));
        Assert.assertEquals(16, encoded.attributeVector().bitWidth());
        Assert.assertEquals(0xFFFF, encoded.attributeVector().get(300));
        Assert.assertNull(encoded.valueAt(300));
        Assert.assertEquals("00299", encoded.valueAt(299));
    }

    @Test
    public void testEmpty() {
        DeprecatedDictionaryColumn<Integer> encoded = new DeprecatedDictionaryEncoder().encode(new ValueColumn<Integer>(DataType.INT, true));
        Assert.assertEquals(0, encoded.size());
        Assert.assertTrue(encoded.dictionary().isEmpty());
    }
}
