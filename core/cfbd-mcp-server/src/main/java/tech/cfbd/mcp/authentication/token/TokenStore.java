package tech.cfbd.mcp.authentication.token;

import io.smallrye.mutiny.Uni;

/**
 * Process-wide set of issued bearer tokens.
 *
 * <p>Tokens carry no expiry or scope: any token in the store authorizes every
 * tool invocation. Implementations persist on every insertion so tokens stay
 * valid across restarts, and degrade to memory-only when persistence fails.
 */
public interface TokenStore {

    /**
     * Add a token and persist the store.
     *
     * <p>The returned Uni completes once the write has been attempted. It never
     * fails because of a persistence error; the token remains valid in memory.
     *
     * @param token The newly minted bearer token
     */
    Uni<Void> issue(String token);

    /**
     * O(1) membership check, no I/O.
     */
    boolean contains(String token);

    /**
     * Number of tokens currently accepted.
     */
    int size();

    /**
     * Whether the last load or write of the durable store succeeded.
     */
    boolean isPersistent();
}
