// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.hub;

import static org.junit.jupiter.api.Assertions.*;

import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.chainweave.core.types.Address;
import io.chainweave.core.types.Wei;

class HubConfigLoaderTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static HubConfig parse(String json) throws Exception {
        return HubConfigLoader.fromJson(MAPPER.readTree(json));
    }

    @Test
    void loadsFullConfigFromClasspath() throws Exception {
        HubConfig config;
        try (InputStream in = getClass().getResourceAsStream("/hub-config.json")) {
            assertNotNull(in);
            config = HubConfigLoader.load(in);
        }

        assertEquals(7001L, config.hubChainId());
        assertEquals(new Address("0x" + "1".repeat(40)), config.owner());
        assertEquals(new Address("0x" + "2".repeat(40)), config.trustedWorker());
        assertEquals(new Address("0x" + "3".repeat(40)), config.gatewayIdentity());
        assertEquals(Wei.fromEther("0.002"), config.minimumFee());
        assertEquals(Wei.fromEther("0.5"), config.maxFee());
        assertEquals(5, config.maxRetries());
        assertEquals(300, config.maxPromptLength());
        assertEquals(250, config.defaultRoyaltyBps());
        assertEquals(2, config.chains().size());
        assertTrue(config.chains().get(0).enabled());
        assertFalse(config.chains().get(1).enabled());
    }

    @Test
    void optionalFieldsFallBackToDefaults() throws Exception {
        HubConfig config = parse("""
                {
                  "hubChainId": 1,
                  "owner": "0x1111111111111111111111111111111111111111",
                  "trustedWorker": "0x2222222222222222222222222222222222222222",
                  "gatewayIdentity": "0x3333333333333333333333333333333333333333"
                }
                """);

        assertEquals(HubConfig.DEFAULT_MINIMUM_FEE, config.minimumFee());
        assertEquals(HubConfig.DEFAULT_MAX_FEE, config.maxFee());
        assertEquals(HubConfig.DEFAULT_MAX_RETRIES, config.maxRetries());
        assertEquals(HubConfig.DEFAULT_MAX_PROMPT_LENGTH, config.maxPromptLength());
        assertEquals(HubConfig.DEFAULT_ROYALTY_BPS, config.defaultRoyaltyBps());
        assertTrue(config.chains().isEmpty());
    }

    @Test
    void missingRequiredFieldIsNamed() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> parse("""
                {
                  "hubChainId": 1,
                  "owner": "0x1111111111111111111111111111111111111111",
                  "gatewayIdentity": "0x3333333333333333333333333333333333333333"
                }
                """));

        assertEquals("Missing required field: trustedWorker", ex.getMessage());
    }

    @Test
    void rejectsMalformedValues() {
        assertThrows(IllegalArgumentException.class, () -> parse("[]"));
        assertThrows(IllegalArgumentException.class, () -> parse("""
                {
                  "hubChainId": 1,
                  "owner": "not-an-address",
                  "trustedWorker": "0x2222222222222222222222222222222222222222",
                  "gatewayIdentity": "0x3333333333333333333333333333333333333333"
                }
                """));
        assertThrows(IllegalArgumentException.class, () -> parse("""
                {
                  "hubChainId": 1,
                  "owner": "0x1111111111111111111111111111111111111111",
                  "trustedWorker": "0x2222222222222222222222222222222222222222",
                  "gatewayIdentity": "0x3333333333333333333333333333333333333333",
                  "chains": { "chainId": 137 }
                }
                """));
        assertThrows(IllegalArgumentException.class, () -> parse("""
                {
                  "hubChainId": 1,
                  "owner": "0x1111111111111111111111111111111111111111",
                  "trustedWorker": "0x2222222222222222222222222222222222222222",
                  "gatewayIdentity": "0x3333333333333333333333333333333333333333",
                  "minimumFee": "2",
                  "maxFee": "1"
                }
                """));
    }

    @Test
    void unreadableFileIsUnchecked(@TempDir Path dir) {
        assertThrows(UncheckedIOException.class, () -> HubConfigLoader.load(dir.resolve("missing.json")));
    }

    @Test
    void loadsFromPath(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("hub.json");
        try (InputStream in = getClass().getResourceAsStream("/hub-config.json")) {
            Files.copy(in, file);
        }

        assertEquals(7001L, HubConfigLoader.load(file).hubChainId());
    }
}
