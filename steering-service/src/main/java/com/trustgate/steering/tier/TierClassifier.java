package com.trustgate.steering.tier;

import com.trustgate.common.prediction.ExecutionTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Maps an event author to an {@link ExecutionTier} from configured handle lists.
 *
 * <ul>
 *   <li>admin handle   → {@code PRIVILEGED}</li>
 *   <li>trusted handle → {@code ORDINARY}</li>
 *   <li>anyone else    → {@code SUGGESTION}</li>
 * </ul>
 *
 * Handles compare case-insensitively with any leading {@code @} ignored.
 */
@Component
public class TierClassifier {

    private static final Logger log = LoggerFactory.getLogger(TierClassifier.class);

    private final Set<String> adminHandles;
    private final Set<String> trustedHandles;

    public TierClassifier(@Value("${steering.admin-handles:}") String adminHandles,
                          @Value("${steering.trusted-handles:}") String trustedHandles) {
        this.adminHandles   = parse(adminHandles);
        this.trustedHandles = parse(trustedHandles);
        if (this.adminHandles.isEmpty()) {
            log.warn("[TierClassifier] no admin handles configured; nobody can bless or run privileged");
        }
    }

    public ExecutionTier classify(String author) {
        String handle = normalize(author);
        if (adminHandles.contains(handle))   return ExecutionTier.PRIVILEGED;
        if (trustedHandles.contains(handle)) return ExecutionTier.ORDINARY;
        return ExecutionTier.SUGGESTION;
    }

    public boolean canBless(String actor) {
        return adminHandles.contains(normalize(actor));
    }

    private static Set<String> parse(String csv) {
        if (csv == null || csv.isBlank()) return Set.of();
        return Arrays.stream(csv.split(","))
            .map(TierClassifier::normalize)
            .filter(h -> !h.isEmpty())
            .collect(Collectors.toUnmodifiableSet());
    }

    private static String normalize(String handle) {
        if (handle == null) return "";
        String h = handle.trim().toLowerCase(Locale.ROOT);
        return h.startsWith("@") ? h.substring(1) : h;
    }
}
