// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.worker;

/**
 * The off-chain AI pipeline: turns a prompt into an image and a metadata
 * document and returns where the metadata was published.
 *
 * <p>Implementations may block for as long as generation takes. Any runtime
 * exception is treated as a generation failure for that request.
 */
@FunctionalInterface
public interface GenerationPipeline {

    GeneratedArtwork generate(String prompt);
}
