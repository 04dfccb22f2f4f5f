// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.worker;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * Output of a {@link GenerationPipeline} run.
 *
 * @param tokenUri metadata URI stored on the request and minted into the token
 * @param imageUri URI of the generated image, if the pipeline reports it separately
 */
public record GeneratedArtwork(String tokenUri, @Nullable String imageUri) {

    public GeneratedArtwork {
        Objects.requireNonNull(tokenUri, "tokenUri");
        if (tokenUri.isBlank()) {
            throw new IllegalArgumentException("tokenUri must not be blank");
        }
    }

    public static GeneratedArtwork of(final String tokenUri) {
        return new GeneratedArtwork(tokenUri, null);
    }
}
