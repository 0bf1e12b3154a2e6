package mu.fleet.config;

import mu.fleet.error.ConfigException;
import mu.fleet.model.FilterPolicy;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PolicyParserTest {

    @Test
    void parsesAllKeywords() {
        FilterPolicy policy = PolicyParser.parse(List.of(
                "# system accounts",
                "ignore-user: root",
                "ignore-user: sshuser",
                "ignore-proc: sshd",
                "rename-proc: python3.11 -> python   # normalize",
                ""));

        assertEquals(Set.of("root", "sshuser"), policy.ignoredUsers());
        assertEquals(Set.of("sshd"), policy.ignoredProcesses());
        assertEquals(Map.of("python3.11", "python"), policy.renames());
        assertTrue(policy.isIgnoredUser("root"));
        assertFalse(policy.isIgnoredUser("ann"));
        assertEquals("python", policy.canonicalName("python3.11").orElseThrow());
        assertTrue(policy.canonicalName("vim").isEmpty());
    }

    @Test
    void emptyFileGivesEmptyPolicy() {
        FilterPolicy policy = PolicyParser.parse(List.of());
        assertTrue(policy.ignoredUsers().isEmpty());
        assertTrue(policy.renames().isEmpty());
    }

    @Test
    void unknownKeyword() {
        ConfigException e = assertThrows(ConfigException.class,
                () -> PolicyParser.parse(List.of("ignore-user: root", "ignore-host: m1")));
        assertEquals(2, e.line());
    }

    @Test
    void missingColon() {
        assertThrows(ConfigException.class, () -> PolicyParser.parse(List.of("ignore-user root")));
    }

    @Test
    void missingValue() {
        assertThrows(ConfigException.class, () -> PolicyParser.parse(List.of("ignore-proc:")));
        assertThrows(ConfigException.class, () -> PolicyParser.parse(List.of("rename-proc: -> python")));
        assertThrows(ConfigException.class, () -> PolicyParser.parse(List.of("rename-proc: python ->")));
    }

    @Test
    void renameWithoutArrow() {
        assertThrows(ConfigException.class, () -> PolicyParser.parse(List.of("rename-proc: python")));
    }
}
