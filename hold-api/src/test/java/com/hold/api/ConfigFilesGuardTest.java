package com.hold.api;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

public class ConfigFilesGuardTest {

    @Test
    void heldHookRequestsMustNotTimeOut() throws Exception {
        var content = read("src/main/resources/application.yml");

        // a timed-out hook request would make the node fail a held HTLC on its own
        assertThat(content).contains("request-timeout: -1");
    }

    @Test
    void databaseAndNodeKeyAreOverridableFromEnvironment() throws Exception {
        var content = read("src/main/resources/application.yml");

        assertThat(content)
                .contains("url: ${HOLD_DATABASE_URL:jdbc:sqlite:hold/hold.sqlite}")
                .contains("private-key: ${HOLD_NODE_PRIVATE_KEY:}")
                .contains("default-property-inclusion: non_null");
    }

    private static String read(String path) throws Exception {
        return java.nio.file.Files.readString(java.nio.file.Path.of(path), StandardCharsets.UTF_8);
    }
}
