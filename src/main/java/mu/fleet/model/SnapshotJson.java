package mu.fleet.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import mu.fleet.error.DeserializationException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * JSON wire format shared by the bee, the hive and the viewers.
 */
public final class SnapshotJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .findAndRegisterModules();

    private SnapshotJson() {
    }

    /**
     * Get the shared ObjectMapper.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static byte[] writeSnapshot(Snapshot snapshot) throws JsonProcessingException {
        return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsBytes(snapshot);
    }

    public static byte[] writeCluster(ClusterSnapshot snapshot) throws JsonProcessingException {
        return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsBytes(snapshot);
    }

    /**
     * Parse the output of one sampler run.
     *
     * @throws DeserializationException if the bytes are not a valid snapshot
     */
    public static Snapshot readSnapshot(byte[] bytes) {
        return read(bytes, Snapshot.class, "snapshot");
    }

    /**
     * Parse a persisted cluster snapshot.
     *
     * @throws DeserializationException if the bytes are not a valid cluster snapshot
     */
    public static ClusterSnapshot readCluster(byte[] bytes) {
        return read(bytes, ClusterSnapshot.class, "cluster snapshot");
    }

    private static <T> T read(byte[] bytes, Class<T> type, String what) {
        if (bytes == null || bytes.length == 0) {
            throw new DeserializationException("empty " + what, null);
        }
        try {
            T value = MAPPER.readValue(bytes, type);
            if (value == null) {
                throw new DeserializationException("null " + what, null);
            }
            return value;
        } catch (IOException | IllegalArgumentException | NullPointerException e) {
            throw new DeserializationException("could not parse " + what + ": " + preview(bytes), e);
        }
    }

    private static String preview(byte[] bytes) {
        String s = new String(bytes, StandardCharsets.UTF_8).strip();
        return s.length() > 80 ? s.substring(0, 80) + "..." : s;
    }
}
