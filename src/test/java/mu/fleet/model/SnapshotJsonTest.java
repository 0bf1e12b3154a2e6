package mu.fleet.model;

import com.fasterxml.jackson.databind.JsonNode;
import mu.fleet.error.DeserializationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotJsonTest {

    private static Snapshot snapshot(String host) {
        return new Snapshot(host, 37.5, List.of(90.0, 5.0),
                new LoadAverage(1.2, 0.9, 0.4),
                new Memory(2_000_000L, 8_000_000L),
                List.of(new Sample("python", "ann", 55.0)));
    }

    @Test
    @DisplayName("Cluster snapshot survives serialization unchanged")
    void clusterRoundTrip() throws Exception {
        ClusterSnapshot cluster = new ClusterSnapshot(1_700_000_000L, List.of(
                new ClusterEntry(MachineIdentity.of("m1", "lab", "Ann (Student)"), snapshot("m1")),
                new ClusterEntry(MachineIdentity.of("m2", "lab", "Reservation Required"), snapshot("m2"))));

        ClusterSnapshot read = SnapshotJson.readCluster(SnapshotJson.writeCluster(cluster));

        assertEquals(cluster, read);
    }

    @Test
    void snapshotUsesSnakeCaseFieldNames() throws Exception {
        JsonNode node = SnapshotJson.mapper().readTree(SnapshotJson.writeSnapshot(snapshot("m1")));

        assertEquals(37.5, node.get("global_cpu_percent").asDouble());
        assertEquals(2, node.get("per_core_percent").size());
        assertEquals(0.9, node.get("load_avg").get("five").asDouble());
        assertEquals("python", node.get("samples").get(0).get("process_name").asText());
        assertEquals(55.0, node.get("samples").get(0).get("cpu_percent").asDouble());
    }

    @Test
    void unknownFieldsAreIgnored() {
        String json = """
                {"hostname":"m1","global_cpu_percent":1.0,"per_core_percent":[1.0],
                 "load_avg":{"one":0,"five":0,"fifteen":0},"memory":{"used":1,"total":2},
                 "samples":[],"extra":"field"}
                """;
        Snapshot read = SnapshotJson.readSnapshot(json.getBytes(StandardCharsets.UTF_8));
        assertEquals("m1", read.hostname());
        assertEquals(1, read.coreCount());
    }

    @Test
    void emptyOutputIsDeserializationError() {
        assertThrows(DeserializationException.class, () -> SnapshotJson.readSnapshot(new byte[0]));
    }

    @Test
    void garbageIsDeserializationError() {
        DeserializationException e = assertThrows(DeserializationException.class,
                () -> SnapshotJson.readSnapshot("bash: mu: command not found".getBytes(StandardCharsets.UTF_8)));
        assertTrue(e.getMessage().contains("command not found"));
    }

    @Test
    void duplicateHostnamesAreRejected() {
        MachineIdentity m1 = MachineIdentity.of("m1", "lab", "");
        assertThrows(IllegalArgumentException.class, () -> new ClusterSnapshot(1L, List.of(
                new ClusterEntry(m1, snapshot("m1")),
                new ClusterEntry(m1, snapshot("m1")))));
    }
}
