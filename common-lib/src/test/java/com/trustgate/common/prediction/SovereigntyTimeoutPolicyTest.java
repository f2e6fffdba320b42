package com.trustgate.common.prediction;

import com.trustgate.common.identity.StaticIdentityProvider;
import com.trustgate.common.model.Identity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class SovereigntyTimeoutPolicyTest {

    @Test
    @DisplayName("band edges: 0.8 → 5 s, 0.6 → 30 s, below → 60 s")
    void bands() {
        assertEquals(Duration.ofSeconds(5),  SovereigntyTimeoutPolicy.forSovereignty(1.0));
        assertEquals(Duration.ofSeconds(5),  SovereigntyTimeoutPolicy.forSovereignty(0.8));
        assertEquals(Duration.ofSeconds(30), SovereigntyTimeoutPolicy.forSovereignty(0.79));
        assertEquals(Duration.ofSeconds(30), SovereigntyTimeoutPolicy.forSovereignty(0.6));
        assertEquals(Duration.ofSeconds(60), SovereigntyTimeoutPolicy.forSovereignty(0.59));
        assertEquals(Duration.ofSeconds(60), SovereigntyTimeoutPolicy.forSovereignty(0.0));
    }

    @Test
    @DisplayName("reads the current identity on every call")
    void followsIdentity() {
        StaticIdentityProvider provider = new StaticIdentityProvider(Identity.uniform(0.5, 0.3));
        SovereigntyTimeoutPolicy policy = new SovereigntyTimeoutPolicy(provider);
        assertEquals(Duration.ofSeconds(60), policy.currentTimeout());

        provider.set(Identity.uniform(0.5, 0.85));
        assertEquals(Duration.ofSeconds(5), policy.currentTimeout());
    }

    @Test
    @DisplayName("scaling disabled → fixed timeout regardless of sovereignty")
    void fixed() {
        SovereigntyTimeoutPolicy policy = new SovereigntyTimeoutPolicy(
            new StaticIdentityProvider(Identity.uniform(1.0, 1.0)), false, Duration.ofSeconds(45));
        assertEquals(Duration.ofSeconds(45), policy.currentTimeout());
    }
}
