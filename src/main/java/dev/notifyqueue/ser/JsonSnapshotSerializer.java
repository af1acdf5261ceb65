package dev.notifyqueue.ser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.notifyqueue.api.QueueSnapshot;

import java.io.IOException;
import java.util.Objects;

/**
 * Jackson-backed snapshot serializer. Unknown fields are ignored on read so listings written by a newer
 * version stay readable.
 */
public class JsonSnapshotSerializer implements SnapshotSerializer {
    private final ObjectMapper mapper;

    public JsonSnapshotSerializer() {
        this(new ObjectMapper().disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
    }

    public JsonSnapshotSerializer(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper cannot be null");
    }

    @Override
    public byte[] serialize(QueueSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot cannot be null");
        try {
            return mapper.writeValueAsBytes(snapshot);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to write queue snapshot as JSON", e);
        }
    }

    @Override
    public QueueSnapshot deserialize(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        try {
            return mapper.readValue(bytes, QueueSnapshot.class);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read queue snapshot from JSON (" + bytes.length + " bytes)", e);
        }
    }
}
