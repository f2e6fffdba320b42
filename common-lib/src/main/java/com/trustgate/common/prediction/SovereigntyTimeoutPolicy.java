package com.trustgate.common.prediction;

import com.trustgate.common.identity.IdentityProvider;

import java.time.Duration;

/**
 * Maps the current sovereignty to an ask-and-predict countdown. Higher earned trust means a
 * shorter window for human intervention.
 *
 * <ul>
 *   <li>sovereignty ≥ 0.8 → 5 s</li>
 *   <li>sovereignty ≥ 0.6 → 30 s</li>
 *   <li>otherwise         → 60 s</li>
 * </ul>
 *
 * <p>When disabled, every countdown uses the fixed timeout and the identity is not consulted.
 */
public final class SovereigntyTimeoutPolicy {

    public static final Duration HIGH_TRUST_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration MODERATE_TIMEOUT   = Duration.ofSeconds(30);
    public static final Duration LOW_TRUST_TIMEOUT  = Duration.ofSeconds(60);

    private final IdentityProvider identityProvider;
    private final boolean sovereigntyScaled;
    private final Duration fixedTimeout;

    public SovereigntyTimeoutPolicy(IdentityProvider identityProvider) {
        this(identityProvider, true, MODERATE_TIMEOUT);
    }

    public SovereigntyTimeoutPolicy(IdentityProvider identityProvider, boolean sovereigntyScaled, Duration fixedTimeout) {
        this.identityProvider  = identityProvider;
        this.sovereigntyScaled = sovereigntyScaled;
        this.fixedTimeout      = fixedTimeout;
    }

    public Duration currentTimeout() {
        if (!sovereigntyScaled) return fixedTimeout;
        return forSovereignty(identityProvider.get().sovereignty());
    }

    public static Duration forSovereignty(double sovereignty) {
        if (sovereignty >= 0.8) return HIGH_TRUST_TIMEOUT;
        if (sovereignty >= 0.6) return MODERATE_TIMEOUT;
        return LOW_TRUST_TIMEOUT;
    }
}
