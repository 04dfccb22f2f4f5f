// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.hub;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.chainweave.core.types.RequestId;
import io.chainweave.core.types.Wei;

/**
 * {@link RequestStore} persisted as a single JSON document.
 *
 * <p>The whole document is rewritten on every save: it is written to a sibling
 * temporary file which then atomically replaces the previous version, so a
 * crash leaves either the old or the new state on disk, never a torn file.
 * Requests are held in memory between writes.
 *
 * <p>Document format:
 * <pre>{@code
 * {"version":1,"withdrawnFees":"0","requests":[{"requestId":"0x..","status":"PENDING", ...}]}
 * }</pre>
 */
public final class JsonFileRequestStore implements RequestStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileRequestStore.class);

    static final int FORMAT_VERSION = 1;

    static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);

    private final Path path;
    private final Map<RequestId, MintRequest> requests = new LinkedHashMap<>();
    private Wei withdrawnFees = Wei.ZERO;

    /**
     * Opens the store at {@code path}, loading existing requests if the file exists.
     *
     * @throws UncheckedIOException if the file exists but cannot be read or parsed
     */
    public JsonFileRequestStore(final Path path) {
        this.path = Objects.requireNonNull(path, "path").toAbsolutePath();
        if (Files.exists(this.path)) {
            load();
        }
    }

    private void load() {
        final StoreDocument document;
        try {
            document = MAPPER.readValue(path.toFile(), StoreDocument.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read request store " + path, e);
        }
        if (document.version() != FORMAT_VERSION) {
            throw new IllegalStateException(
                    "Unsupported request store version " + document.version() + " in " + path);
        }
        for (final MintRequest request : document.requests()) {
            requests.put(request.requestId(), request);
        }
        withdrawnFees = document.withdrawnFees();
        log.info("Loaded {} requests from {}", requests.size(), path);
    }

    @Override
    public synchronized void save(final MintRequest request) {
        Objects.requireNonNull(request, "request");
        final MintRequest previous = requests.put(request.requestId(), request);
        try {
            write();
        } catch (IOException e) {
            if (previous == null) {
                requests.remove(request.requestId());
            } else {
                requests.put(request.requestId(), previous);
            }
            throw new UncheckedIOException("Failed to write request store " + path, e);
        }
    }

    private void write() throws IOException {
        final Path parent = path.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        final Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        MAPPER.writeValue(tmp.toFile(), new StoreDocument(FORMAT_VERSION, withdrawnFees, List.copyOf(requests.values())));
        try {
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}, falling back to plain replace", path);
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Override
    public synchronized Optional<MintRequest> find(final RequestId requestId) {
        return Optional.ofNullable(requests.get(requestId));
    }

    @Override
    public synchronized List<MintRequest> findAll() {
        return List.copyOf(requests.values());
    }

    @Override
    public synchronized int size() {
        return requests.size();
    }

    @Override
    public synchronized Wei withdrawnFees() {
        return withdrawnFees;
    }

    @Override
    public synchronized void saveWithdrawnFees(final Wei total) {
        Objects.requireNonNull(total, "total");
        final Wei previous = withdrawnFees;
        withdrawnFees = total;
        try {
            write();
        } catch (IOException e) {
            withdrawnFees = previous;
            throw new UncheckedIOException("Failed to write request store " + path, e);
        }
    }

    public Path path() {
        return path;
    }

    record StoreDocument(int version, Wei withdrawnFees, List<MintRequest> requests) {

        StoreDocument {
            withdrawnFees = withdrawnFees == null ? Wei.ZERO : withdrawnFees;
            requests = requests == null ? List.of() : List.copyOf(requests);
        }
    }
}
