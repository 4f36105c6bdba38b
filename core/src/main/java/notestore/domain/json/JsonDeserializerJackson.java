package notestore.domain.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import notestore.domain.exceptions.DeserializationFailed;
import notestore.domain.exceptions.SerializationFailed;

import java.util.List;
import java.util.logging.Logger;

/**
 * A service for serializing and deserializing JSON. Timestamps are written as ISO-8601 strings.
 */
@ApplicationScoped
public class JsonDeserializerJackson implements JsonDeserializer {

    private static final ObjectMapper OBJECT_MAPPER = createObjectMapper();

    @Inject
    private Logger logger;

    @Override
    public String serialize(final Object object) {
        return Try.of(() -> OBJECT_MAPPER.writeValueAsString(object))
                .onFailure(ex -> logger.warning("Failed to serialize object of type " + object.getClass().getSimpleName() + ": " + ex.getMessage()))
                .getOrElseThrow(ex -> new SerializationFailed(ex));
    }

    @Override
    public <T> T deserialize(final String json, final Class<T> clazz) {
        return Try.of(() -> OBJECT_MAPPER.readValue(json, clazz))
                .onFailure(ex -> logger.warning("Failed to deserialize object of type " + clazz.getSimpleName() + ": " + ex.getMessage()))
                .getOrElseThrow(ex -> new DeserializationFailed(ex));
    }

    @Override
    public <U> List<U> deserializeCollection(final String json, final Class<U> value) {
        return Try.of(() -> OBJECT_MAPPER.<List<U>>readValue(
                        json,
                        OBJECT_MAPPER.getTypeFactory().constructCollectionType(List.class, value)))
                .onFailure(ex -> logger.warning("Failed to deserialize collection of type " + value.getSimpleName() + ": " + ex.getMessage()))
                .getOrElseThrow(ex -> new DeserializationFailed(ex));
    }

    private static ObjectMapper createObjectMapper() {
        final ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        return objectMapper;
    }
}
