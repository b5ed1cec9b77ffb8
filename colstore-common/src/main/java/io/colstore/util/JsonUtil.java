package io.colstore.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.exc.ValueInstantiationException;

import java.io.IOException;
import java.io.InputStream;

/**
 * This class should only be used in config loading or debug.
 * Don't use in high performance required scenario.
 *
 * Unchecked exceptions thrown by a creator while reading are rethrown as they are,
 * not wrapped by Jackson.
 */
public class JsonUtil {
    public static final ObjectMapper jsonMapper = new ObjectMapper();

    static {
        jsonMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        jsonMapper.configure(SerializationFeature.INDENT_OUTPUT, false);
    }

    public static String toJson(Object v) {
        try {
            return jsonMapper.writeValueAsString(v);
        } catch (JsonProcessingException e) {
            throw new RuntimeException(e);
        }
    }

    public static <T> T fromJson(String json, Class<T> clazz) {
        try {
            return jsonMapper.readValue(json, clazz);
        } catch (IOException e) {
            rethrowCreatorFailure(e);
            throw new RuntimeException(e);
        }
    }

    public static <T> T loadResource(String filePath, Class<T> clazz) throws IOException {
        try (InputStream in = Thread.currentThread().getContextClassLoader().getResourceAsStream(filePath)) {
            if (in == null) {
                throw new IOException(String.format("resource[%s] not found", filePath));
            }
            try {
                return jsonMapper.readValue(in, clazz);
            } catch (IOException e) {
                rethrowCreatorFailure(e);
                throw e;
            }
        }
    }

    private static void rethrowCreatorFailure(IOException e) {
        if (e instanceof ValueInstantiationException && e.getCause() instanceof RuntimeException) {
            throw (RuntimeException) e.getCause();
        }
    }
}
