package com.trustgate.common.identity;

import com.trustgate.common.model.Identity;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * In-memory {@link IdentityProvider}. {@link #reload()} pulls from the supplied feed;
 * {@link #set(Identity)} swaps directly. Used for fixtures and embedded hosts.
 */
public class StaticIdentityProvider implements IdentityProvider {

    private final AtomicReference<Identity> current;
    private final Supplier<Identity> feed;

    public StaticIdentityProvider(Identity initial) {
        this(initial, null);
    }

    public StaticIdentityProvider(Identity initial, Supplier<Identity> feed) {
        this.current = new AtomicReference<>(initial);
        this.feed    = feed;
    }

    @Override
    public Identity get() {
        return current.get();
    }

    @Override
    public Identity reload() {
        if (feed == null) return current.get();
        Identity fresh = feed.get();
        current.set(fresh);
        return fresh;
    }

    public void set(Identity identity) {
        current.set(identity);
    }
}
