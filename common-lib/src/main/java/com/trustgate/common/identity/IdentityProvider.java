package com.trustgate.common.identity;

import com.trustgate.common.model.Identity;

/**
 * Source of the current trust identity.
 *
 * <p>{@link #get()} is called on every permission check and every prediction creation, so
 * implementations must return a cached value and never block. {@link #reload()} pulls a fresh
 * identity from the external trust computation and swaps it in atomically.
 */
public interface IdentityProvider {

    /** The identity currently in effect; never {@code null}. */
    Identity get();

    /**
     * Replaces the current identity with a freshly loaded one and returns it.
     *
     * @throws com.trustgate.common.exception.IdentityLoadException when the feed cannot be read;
     *         the previous identity stays in effect
     */
    Identity reload();
}
