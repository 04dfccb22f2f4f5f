// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.minter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.TreeMap;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.chainweave.core.types.RequestId;

/**
 * {@link ProcessedRequestStore} persisted as a single JSON document.
 *
 * <p>Every change rewrites the document through a sibling temporary file that
 * atomically replaces the previous version. The processed-id index is rebuilt
 * from the tokens on load; every processed request has exactly one token.
 *
 * <p>Document format:
 * <pre>{@code
 * {"version":1,"totalVolume":3,"tokens":[{"tokenId":1,"owner":"0x..","sourceRequestId":"0x..", ...}]}
 * }</pre>
 */
public final class JsonFileProcessedRequestStore implements ProcessedRequestStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileProcessedRequestStore.class);

    static final int FORMAT_VERSION = 1;

    static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);

    private final Path path;
    private final Map<RequestId, Long> processed = new HashMap<>();
    private final TreeMap<Long, MintedToken> tokens = new TreeMap<>();
    private long totalVolume;

    /**
     * Opens the store at {@code path}, loading existing tokens if the file exists.
     *
     * @throws UncheckedIOException  if the file exists but cannot be read or parsed
     * @throws IllegalStateException if the file has another format version or repeats a request id
     */
    public JsonFileProcessedRequestStore(final Path path) {
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
            throw new UncheckedIOException("Failed to read minter store " + path, e);
        }
        if (document.version() != FORMAT_VERSION) {
            throw new IllegalStateException(
                    "Unsupported minter store version " + document.version() + " in " + path);
        }
        for (final MintedToken token : document.tokens()) {
            if (processed.put(token.sourceRequestId(), token.tokenId()) != null) {
                throw new IllegalStateException(
                        "Request " + token.sourceRequestId() + " has more than one token in " + path);
            }
            tokens.put(token.tokenId(), token);
        }
        totalVolume = document.totalVolume();
        log.info("Loaded {} tokens from {}", tokens.size(), path);
    }

    @Override
    public synchronized boolean markProcessed(final MintedToken token) {
        Objects.requireNonNull(token, "token");
        if (processed.containsKey(token.sourceRequestId())) {
            return false;
        }
        if (tokens.containsKey(token.tokenId())) {
            throw new IllegalStateException("Token " + token.tokenId() + " already exists");
        }
        processed.put(token.sourceRequestId(), token.tokenId());
        tokens.put(token.tokenId(), token);
        totalVolume++;
        try {
            write();
        } catch (IOException e) {
            processed.remove(token.sourceRequestId());
            tokens.remove(token.tokenId());
            totalVolume--;
            throw new UncheckedIOException("Failed to write minter store " + path, e);
        }
        return true;
    }

    @Override
    public synchronized void update(final List<MintedToken> changed, final int movements) {
        final List<MintedToken> previous = new ArrayList<>(changed.size());
        for (final MintedToken token : changed) {
            final MintedToken existing = tokens.get(token.tokenId());
            if (existing == null) {
                throw new IllegalArgumentException("Token " + token.tokenId() + " does not exist");
            }
            previous.add(existing);
        }
        for (final MintedToken token : changed) {
            tokens.put(token.tokenId(), token);
        }
        totalVolume += movements;
        try {
            write();
        } catch (IOException e) {
            for (final MintedToken token : previous) {
                tokens.put(token.tokenId(), token);
            }
            totalVolume -= movements;
            throw new UncheckedIOException("Failed to write minter store " + path, e);
        }
    }

    private void write() throws IOException {
        final Path parent = path.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        final Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        MAPPER.writeValue(tmp.toFile(), new StoreDocument(FORMAT_VERSION, totalVolume, List.copyOf(tokens.values())));
        try {
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}, falling back to plain replace", path);
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Override
    public synchronized OptionalLong tokenFor(final RequestId requestId) {
        final Long tokenId = processed.get(requestId);
        return tokenId == null ? OptionalLong.empty() : OptionalLong.of(tokenId);
    }

    @Override
    public synchronized Optional<MintedToken> token(final long tokenId) {
        return Optional.ofNullable(tokens.get(tokenId));
    }

    @Override
    public synchronized List<MintedToken> tokens() {
        return List.copyOf(tokens.values());
    }

    @Override
    public synchronized long maxTokenId() {
        return tokens.isEmpty() ? 0 : tokens.lastKey();
    }

    @Override
    public synchronized long totalVolume() {
        return totalVolume;
    }

    public Path path() {
        return path;
    }

    record StoreDocument(int version, long totalVolume, List<MintedToken> tokens) {

        StoreDocument {
            tokens = tokens == null ? List.of() : List.copyOf(tokens);
        }
    }
}
