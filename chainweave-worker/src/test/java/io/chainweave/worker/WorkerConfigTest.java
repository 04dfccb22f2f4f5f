// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.worker;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;

import org.junit.jupiter.api.Test;

import io.chainweave.core.types.Address;

class WorkerConfigTest {

    private static final Address WORKER = new Address("0x" + "2".repeat(40));

    @Test
    void defaults() {
        WorkerConfig config = WorkerConfig.defaults(WORKER);

        assertEquals(WORKER, config.worker());
        assertEquals(5, config.batchSize());
        assertEquals(Duration.ofSeconds(10), config.pollInterval());
        assertEquals(Duration.ofMinutes(15), config.processingTimeout());
    }

    @Test
    void builderOverrides() {
        WorkerConfig config = WorkerConfig.builder()
                .worker(WORKER)
                .batchSize(20)
                .pollInterval(Duration.ofMillis(250))
                .processingTimeout(Duration.ofMinutes(2))
                .build();

        assertEquals(20, config.batchSize());
        assertEquals(Duration.ofMillis(250), config.pollInterval());
        assertEquals(Duration.ofMinutes(2), config.processingTimeout());
    }

    @Test
    void rejectsInvalidValues() {
        Duration minute = Duration.ofMinutes(1);
        assertThrows(IllegalArgumentException.class, () -> new WorkerConfig(WORKER, 0, Duration.ofSeconds(1), minute));
        assertThrows(IllegalArgumentException.class, () -> new WorkerConfig(WORKER, 5, Duration.ZERO, minute));
        assertThrows(IllegalArgumentException.class,
                () -> new WorkerConfig(WORKER, 5, minute, Duration.ofSeconds(-1)));
        assertThrows(IllegalArgumentException.class, () -> WorkerConfig.defaults(Address.ZERO));
        assertThrows(NullPointerException.class, () -> WorkerConfig.builder().build());
    }

    @Test
    void artworkRequiresTokenUri() {
        assertThrows(IllegalArgumentException.class, () -> GeneratedArtwork.of(" "));
        assertNull(GeneratedArtwork.of("ipfs://x").imageUri());
    }
}
