// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.hub;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.chainweave.core.types.Address;
import io.chainweave.core.types.Wei;

/**
 * Reads a {@link HubConfig} from JSON.
 *
 * <p>Fees are given in ether as decimal strings. Optional fields fall back to
 * the {@link HubConfig} defaults:
 * <pre>{@code
 * {
 *   "hubChainId": 7001,
 *   "owner": "0x...",
 *   "trustedWorker": "0x...",
 *   "gatewayIdentity": "0x...",
 *   "minimumFee": "0.001",
 *   "maxFee": "1",
 *   "maxRetries": 3,
 *   "maxPromptLength": 500,
 *   "defaultRoyaltyBps": 500,
 *   "chains": [ {"chainId": 137, "minterEndpoint": "0x...", "enabled": true} ]
 * }
 * }</pre>
 */
public final class HubConfigLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private HubConfigLoader() {
    }

    /**
     * @throws UncheckedIOException     if the file cannot be read or is not JSON
     * @throws IllegalArgumentException if a field is missing or invalid
     */
    public static HubConfig load(final Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read hub config " + path, e);
        }
    }

    public static HubConfig load(final InputStream in) throws IOException {
        return fromJson(MAPPER.readTree(in));
    }

    static HubConfig fromJson(final JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Hub config must be a JSON object");
        }
        final HubConfig.Builder builder = HubConfig.builder()
                .hubChainId(required(root, "hubChainId").asLong())
                .owner(address(root, "owner"))
                .trustedWorker(address(root, "trustedWorker"))
                .gatewayIdentity(address(root, "gatewayIdentity"));
        if (root.hasNonNull("minimumFee")) {
            builder.minimumFee(Wei.fromEther(root.get("minimumFee").asText()));
        }
        if (root.hasNonNull("maxFee")) {
            builder.maxFee(Wei.fromEther(root.get("maxFee").asText()));
        }
        if (root.hasNonNull("maxRetries")) {
            builder.maxRetries(root.get("maxRetries").asInt());
        }
        if (root.hasNonNull("maxPromptLength")) {
            builder.maxPromptLength(root.get("maxPromptLength").asInt());
        }
        if (root.hasNonNull("defaultRoyaltyBps")) {
            builder.defaultRoyaltyBps(root.get("defaultRoyaltyBps").asInt());
        }
        final JsonNode chains = root.path("chains");
        if (!chains.isMissingNode() && !chains.isArray()) {
            throw new IllegalArgumentException("'chains' must be an array");
        }
        for (final JsonNode chain : chains) {
            builder.chain(new ChainRegistration(
                    required(chain, "chainId").asLong(),
                    address(chain, "minterEndpoint"),
                    chain.path("enabled").asBoolean(true)));
        }
        return builder.build();
    }

    private static JsonNode required(final JsonNode node, final String field) {
        final JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("Missing required field: " + field);
        }
        return value;
    }

    private static Address address(final JsonNode node, final String field) {
        return new Address(required(node, field).asText());
    }
}
