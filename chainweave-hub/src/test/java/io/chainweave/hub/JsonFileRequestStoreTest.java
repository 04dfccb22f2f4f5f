// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.hub;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.chainweave.core.types.Address;
import io.chainweave.core.types.HexData;
import io.chainweave.core.types.RequestId;
import io.chainweave.core.types.Wei;
import io.chainweave.gateway.MessagingGateway;

class JsonFileRequestStoreTest {

    private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");
    private static final Address USER = new Address("0x" + "4".repeat(40));

    @TempDir
    Path dir;

    private static MintRequest pending(int n) {
        RequestId id = RequestRegistry.requestId(USER, "prompt " + n, n, 7001L);
        return MintRequest.pending(id, USER, "prompt " + n, 137L,
                HexData.of(USER.value()), Wei.fromEther("0.001"), T0);
    }

    @Test
    void missingFileStartsEmpty() {
        JsonFileRequestStore store = new JsonFileRequestStore(dir.resolve("requests.json"));

        assertEquals(0, store.size());
        assertEquals(Wei.ZERO, store.withdrawnFees());
        assertFalse(Files.exists(store.path()));
    }

    @Test
    void reloadRestoresRequestsInSubmissionOrder() {
        Path file = dir.resolve("state/requests.json");
        JsonFileRequestStore store = new JsonFileRequestStore(file);
        MintRequest first = pending(0);
        MintRequest second = pending(1);
        MintRequest completed = first.generated("ipfs://a", T0.plusSeconds(1))
                .dispatched("msg-1", T0.plusSeconds(2))
                .completed(12, T0.plusSeconds(3));
        MintRequest failed = second.failed("model unavailable", T0.plusSeconds(4));

        store.save(first);
        store.save(second);
        store.save(completed);
        store.save(failed);
        store.saveWithdrawnFees(Wei.fromEther("0.001"));

        JsonFileRequestStore reloaded = new JsonFileRequestStore(file);

        assertEquals(List.of(completed, failed), reloaded.findAll());
        assertEquals(completed, reloaded.find(first.requestId()).orElseThrow());
        assertEquals(Wei.fromEther("0.001"), reloaded.withdrawnFees());
        assertFalse(Files.exists(file.resolveSibling("requests.json.tmp")));
    }

    @Test
    void registryResumesFromFile() {
        Path file = dir.resolve("requests.json");
        Address owner = new Address("0x" + "1".repeat(40));
        Address worker = new Address("0x" + "2".repeat(40));
        Address gateway = new Address("0x" + "3".repeat(40));
        HubConfig config = HubConfig.builder()
                .hubChainId(7001L).owner(owner).trustedWorker(worker).gatewayIdentity(gateway)
                .chain(new ChainRegistration(137L, new Address("0x" + "6".repeat(40)), true))
                .build();
        MessagingGateway noGateway = mock(MessagingGateway.class);
        MutableClock clock = new MutableClock(T0);

        RequestRegistry registry = new RequestRegistry(config, noGateway, new JsonFileRequestStore(file), clock);
        RequestId id = registry.submit(USER, "a red fox", 137L, HexData.of(USER.value()), Wei.fromEther("0.001"))
                .requestId();
        registry.failGeneration(worker, id, "timeout");

        RequestRegistry resumed = new RequestRegistry(config, noGateway, new JsonFileRequestStore(file), clock);

        assertEquals(RequestStatus.FAILED, resumed.getRequest(id).orElseThrow().status());
        assertEquals(1, resumed.stats().totalRequests());
        resumed.retry(USER, id);
        assertEquals(RequestStatus.PENDING, resumed.getRequest(id).orElseThrow().status());
    }

    @Test
    void rejectsUnknownFormatVersion() throws Exception {
        Path file = dir.resolve("requests.json");
        Files.writeString(file, "{\"version\":99,\"requests\":[]}");

        assertThrows(IllegalStateException.class, () -> new JsonFileRequestStore(file));
    }

    @Test
    void corruptFileIsUnchecked() throws Exception {
        Path file = dir.resolve("requests.json");
        Files.writeString(file, "{not json");

        assertThrows(UncheckedIOException.class, () -> new JsonFileRequestStore(file));
    }

    @Test
    void documentWithoutWithdrawnTotalDefaultsToZero() throws Exception {
        Path file = dir.resolve("requests.json");
        Files.writeString(file, "{\"version\":1,\"requests\":[]}");

        assertEquals(Wei.ZERO, new JsonFileRequestStore(file).withdrawnFees());
    }

    @Test
    void failedWriteKeepsPreviousState() throws Exception {
        Path blocker = dir.resolve("blocker");
        Files.writeString(blocker, "file, not a directory");
        JsonFileRequestStore store = new JsonFileRequestStore(blocker.resolve("requests.json"));

        assertThrows(UncheckedIOException.class, () -> store.save(pending(0)));

        assertEquals(0, store.size());
    }
}
