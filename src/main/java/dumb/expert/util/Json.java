package dumb.expert.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

public class Json {

    public static final ObjectMapper the = JsonMapper.builder()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    public static String str(Object obj) throws JsonProcessingException {
        return the.writeValueAsString(obj);
    }

    public static <T> T obj(Path file, Class<T> valueType) throws IOException {
        return the.readValue(file.toFile(), valueType);
    }

    public static <T> T obj(InputStream in, Class<T> valueType) throws IOException {
        return the.readValue(in, valueType);
    }
}
