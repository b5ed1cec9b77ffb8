package io.colstore.storage;

import org.junit.Assert;
import org.junit.Test;

import java.io.IOException;

import io.colstore.storage.column.EncodingType;
import io.colstore.storage.pack.ZsType;
import io.colstore.util.JsonUtil;

public class EncodingSpecTest {

    @Test
    public void testJson() {
        ChunkEncodingSpec spec = JsonUtil.fromJson(
                "{\"columns\": [{\"encoding\": \"dictionary\", \"zs\": \"bit_packed\"}, {\"encoding\": \"run_length\"}, {\"encoding\": \"unencoded\"}]}",
                ChunkEncodingSpec.class);
        Assert.assertEquals(3, spec.size());
        Assert.assertEquals(new ColumnEncodingSpec(EncodingType.DICTIONARY, ZsType.BIT_PACKED), spec.get(0));
        Assert.assertEquals(new ColumnEncodingSpec(EncodingType.RUN_LENGTH), spec.get(1));
        Assert.assertEquals(ColumnEncodingSpec.UNENCODED, spec.get(2));

        Assert.assertEquals(spec, JsonUtil.fromJson(JsonUtil.toJson(spec), ChunkEncodingSpec.class));
        Assert.assertEquals("{\"encoding\":\"run_length\"}", JsonUtil.toJson(spec.get(1)));
    }

    @Test
    public void testLoadResource() throws IOException {
        ChunkEncodingSpec spec = JsonUtil.loadResource("encoding_spec.json", ChunkEncodingSpec.class);
        Assert.assertEquals(3, spec.size());
        Assert.assertEquals(EncodingType.DICTIONARY, spec.get(0).encodingType);
        Assert.assertNull(spec.get(0).zsType);
        Assert.assertEquals(EncodingType.DEPRECATED_DICTIONARY, spec.get(1).encodingType);
        Assert.assertEquals(ZsType.FIXED_SIZE_BYTE_ALIGNED, spec.get(2).zsType);
    }

    @Test
    public void testUnknownEncoding() {
        _testUnknown("{\"columns\": [{\"encoding\": \"lz4\"}]}");
        _testUnknown("{\"columns\": [{\"encoding\": \"dictionary\", \"zs\": \"simd_bp128\"}]}");
    }

    private void _testUnknown(String json) {
        try {
            JsonUtil.fromJson(json, ChunkEncodingSpec.class);
            Assert.fail();
        } catch (EncodingException e) {
            Assert.assertEquals(ErrorCode.UNSUPPORTED_COMBINATION, e.code());
        }
    }

    @Test
    public void testUniform() {
        ChunkEncodingSpec spec = ChunkEncodingSpec.uniform(4, new ColumnEncodingSpec(EncodingType.RUN_LENGTH));
        Assert.assertEquals(4, spec.size());
        for (ColumnEncodingSpec c : spec.columns()) {
            Assert.assertEquals(EncodingType.RUN_LENGTH, c.encodingType);
        }
    }
}
