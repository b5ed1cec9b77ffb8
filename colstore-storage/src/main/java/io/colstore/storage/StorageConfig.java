package io.colstore.storage;

public enum StorageConfig {
    DEFAULT_ENCODING("colstore.encoding.default", "dictionary"),
    DEFAULT_ZS_TYPE("colstore.zs.default", "fixed_size_byte_aligned"),
    CHUNK_SIZE("colstore.chunk.size", "65536");

    public final String key;
    public final String defaultValue;

    private StorageConfig(String key, String defaultValue) {
        this.key = key;
        this.defaultValue = defaultValue;
    }

    public int getInt() {
        return Integer.parseInt(System.getProperty(key, defaultValue));
    }

    public String get() {
        return System.getProperty(key, defaultValue);
    }
}
