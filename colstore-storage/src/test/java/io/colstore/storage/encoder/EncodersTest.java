package io.colstore.storage.encoder;

import org.junit.Assert;
import org.junit.Test;

import io.colstore.storage.EncodingException;
import io.colstore.storage.ErrorCode;
import io.colstore.storage.column.EncodingType;
import io.colstore.storage.pack.ZsType;

public class EncodersTest {

    @Test
    public void testCreate() {
        for (EncodingType type : EncodingType.values()) {
            if (type == EncodingType.UNENCODED) {
                continue;
            }
            Assert.assertEquals(type, Encoders.create(type).type());
        }
        ColumnEncoder encoder = Encoders.create(EncodingType.DICTIONARY, ZsType.BIT_PACKED);
        Assert.assertEquals(ZsType.BIT_PACKED, ((DictionaryEncoder) encoder).zsType());

        encoder = Encoders.create(EncodingType.DICTIONARY);
        Assert.assertEquals(Encoders.defaultZsType(), ((DictionaryEncoder) encoder).zsType());
        Assert.assertEquals(ZsType.FIXED_SIZE_BYTE_ALIGNED, Encoders.defaultZsType());
    }

    @Test
    public void testUnsupported() {
        _testUnsupported(EncodingType.UNENCODED, null);
        _testUnsupported(EncodingType.RUN_LENGTH, ZsType.BIT_PACKED);
        _testUnsupported(EncodingType.DEPRECATED_DICTIONARY, ZsType.FIXED_SIZE_BYTE_ALIGNED);
    }

    private void _testUnsupported(EncodingType type, ZsType zsType) {
        try {
            Encoders.create(type, zsType);
            Assert.fail();
        } catch (EncodingException e) {
            Assert.assertEquals(ErrorCode.UNSUPPORTED_COMBINATION, e.code());
        }
    }

    @Test
    public void testEncodingTypeNames() {
        for (EncodingType type : EncodingType.values()) {
            Assert.assertEquals(type, EncodingType.fromId(type.id));
            Assert.assertEquals(type, EncodingType.fromName(type.alias));
            Assert.assertEquals(type, EncodingType.fromName(type.name()));
        }
        Assert.assertTrue(EncodingType.DICTIONARY.usesZeroSuppression);
        Assert.assertFalse(EncodingType.RUN_LENGTH.usesZeroSuppression);
    }
}
