// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.minter;

/**
 * Aggregate figures for one minter's collection.
 *
 * @param totalSupply  tokens currently in existence
 * @param totalMinted  tokens ever minted
 * @param uniqueOwners distinct accounts holding at least one token
 * @param totalVolume  token movements: mints plus transfers
 */
public record CollectionStats(long totalSupply, long totalMinted, long uniqueOwners, long totalVolume) {
}
