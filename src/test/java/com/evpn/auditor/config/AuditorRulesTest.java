package com.evpn.auditor.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AuditorRulesTest {

    @TempDir
    Path tempDir;

    private Path write(String... lines) throws IOException {
        Path file = tempDir.resolve("rules.yaml");
        Files.writeString(file, String.join("\n", lines) + "\n");
        return file;
    }

    @Test
    void readsAllSections() throws IOException {
        AuditorRules rules = AuditorRules.load(write(
            "performance:",
            "  max_concurrent_devices: 25",
            "  connection_timeout: 45",
            "logging:",
            "  enabled: true",
            "  level: DEBUG",
            "  file: logs/evpn_{timestamp}.log",
            "  max_size_mb: 3",
            "  backup_count: 2",
            "  console: false",
            "netconf:",
            "  host_key_algorithms: [ssh-ed25519]",
            "  strict_host_key_checking: true",
            "  rpc_timeout: 60",
            "evpn_rules:",
            "  ignored: true"));

        assertEquals(25, rules.getPerformance().getMaxConcurrentDevices());
        assertEquals(45, rules.getPerformance().getConnectionTimeout());
        assertTrue(rules.getLogging().isEnabled());
        assertEquals("DEBUG", rules.getLogging().getLevel());
        assertEquals("logs/evpn_{timestamp}.log", rules.getLogging().getFile());
        assertEquals(3, rules.getLogging().getMaxSizeMb());
        assertEquals(2, rules.getLogging().getBackupCount());
        assertFalse(rules.getLogging().isConsole());
        assertEquals(List.of("ssh-ed25519"), rules.getNetconf().getHostKeyAlgorithms());
        assertTrue(rules.getNetconf().isStrictHostKeyChecking());
        assertEquals(60, rules.getNetconf().getRpcTimeout());
    }

    @Test
    void emptyFileGivesDefaults() throws IOException {
        AuditorRules rules = AuditorRules.load(write(""));

        assertNull(rules.getPerformance().getMaxConcurrentDevices());
        assertFalse(rules.getLogging().isEnabled());
        assertEquals(300, rules.getNetconf().getRpcTimeout());
        assertEquals(AuditorRules.Netconf.DEFAULT_HOST_KEY_ALGORITHMS, rules.getNetconf().getHostKeyAlgorithms());
    }

    @Test
    void nullSectionsAreRestored() throws IOException {
        AuditorRules rules = AuditorRules.load(write(
            "performance:",
            "logging:",
            "netconf:",
            "  host_key_algorithms: []"));

        assertNotNull(rules.getPerformance());
        assertNotNull(rules.getLogging());
        assertFalse(rules.getNetconf().getHostKeyAlgorithms().isEmpty());
    }

    @Test
    void brokenFileFallsBackToDefaults() throws IOException {
        AuditorRules rules = AuditorRules.load(write("performance: [1, 2"));

        assertNotNull(rules.getPerformance());
        assertNull(rules.getPerformance().getMaxConcurrentDevices());
        assertNotNull(AuditorRules.load(tempDir.resolve("absent.yaml")));
    }
}
