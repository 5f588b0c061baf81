package quokka.adapter.out.storage.redis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import quokka.spi.StorageProviderException;

/**
 * JSON codec for records kept in Redis.
 *
 * @param <T> the record type
 */
final class RedisRecordCodec<T> {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .registerModule(new Jdk8Module())
            .registerModule(new JavaTimeModule())
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final Class<T> type;

    RedisRecordCodec(Class<T> type) {
        this.type = type;
    }

    String encode(T value) {
        try {
            return OBJECT_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StorageProviderException("Failed to serialize " + type.getSimpleName(), e);
        }
    }

    T decode(String json) {
        try {
            return OBJECT_MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StorageProviderException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }
}
