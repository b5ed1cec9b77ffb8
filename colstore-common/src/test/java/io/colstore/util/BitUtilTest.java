package io.colstore.util;

import org.junit.Assert;
import org.junit.Test;

public class BitUtilTest {

    @Test
    public void testBitWidth() {
        Assert.assertEquals(0, BitUtil.bitWidth(0));
        Assert.assertEquals(1, BitUtil.bitWidth(1));
        Assert.assertEquals(2, BitUtil.bitWidth(2));
        Assert.assertEquals(2, BitUtil.bitWidth(3));
        Assert.assertEquals(8, BitUtil.bitWidth(255));
        Assert.assertEquals(9, BitUtil.bitWidth(256));
        Assert.assertEquals(31, BitUtil.bitWidth(Integer.MAX_VALUE));
        for (int w = 0; w <= 31; w++) {
            Assert.assertEquals(w, BitUtil.bitWidth((int) BitUtil.maxValue(w)));
        }
    }

    @Test
    public void testWords() {
        Assert.assertEquals(0, BitUtil.words(0));
        Assert.assertEquals(1, BitUtil.words(1));
        Assert.assertEquals(1, BitUtil.words(64));
        Assert.assertEquals(2, BitUtil.words(65));
    }
}
