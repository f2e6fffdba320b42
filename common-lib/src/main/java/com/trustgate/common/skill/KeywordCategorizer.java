package com.trustgate.common.skill;

import com.trustgate.common.model.TrustCategory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static com.trustgate.common.model.TrustCategory.*;

/**
 * Keyword-based alignment of a proposed action with trust categories.
 *
 * <p>Tokens are lower-cased words of at least {@value #MIN_TOKEN_LENGTH} characters. A category
 * scores one hit per distinct token that maps to it; results are ordered by hits, then by
 * category order, and capped at {@value #MAX_CATEGORIES}.
 *
 * <p>Thread-safe; {@link #learn} may run concurrently with {@link #categorize}.
 */
public final class KeywordCategorizer {

    static final int MIN_TOKEN_LENGTH = 3;
    static final int MAX_CATEGORIES   = 3;

    private final Map<String, Set<TrustCategory>> keywords = new ConcurrentHashMap<>();

    public KeywordCategorizer() {
        seed(SECURITY,          "security", "auth", "secret", "token", "permission", "vulnerability");
        seed(RELIABILITY,       "restart", "uptime", "retry", "outage", "incident", "stable");
        seed(DATA_INTEGRITY,    "database", "migration", "schema", "backup", "record", "lead");
        seed(PROCESS_ADHERENCE, "process", "checklist", "review", "approval", "workflow");
        seed(CODE_QUALITY,      "refactor", "lint", "commit", "push", "merge", "branch");
        seed(TESTING,           "test", "tests", "coverage", "regression", "pipeline");
        seed(DOCUMENTATION,     "docs", "readme", "document", "changelog");
        seed(COMMUNICATION,     "email", "message", "tweet", "post", "sms", "announce");
        seed(TIME_MANAGEMENT,   "deadline", "schedule", "calendar", "remind");
        seed(RESOURCE_EFFICIENCY, "cost", "budget", "quota", "spend");
        seed(RISK_ASSESSMENT,   "risk", "rollback", "impact");
        seed(COMPLIANCE,        "compliance", "policy", "audit", "license", "gdpr");
        seed(INNOVATION,        "prototype", "experiment", "idea", "research");
        seed(COLLABORATION,     "team", "pair", "handoff", "share");
        seed(ACCOUNTABILITY,    "owner", "report", "status", "delete");
        seed(TRANSPARENCY,      "publish", "public", "disclose", "log");
        seed(ADAPTABILITY,      "pivot", "redirect", "change", "switch");
        seed(DOMAIN_EXPERTISE,  "design", "architecture", "model", "algorithm");
        seed(USER_FOCUS,        "user", "customer", "feedback", "support");
        seed(ETHICAL_ALIGNMENT, "ethics", "consent", "privacy", "fair");
        seed(RELIABILITY,       "deploy", "production");
        seed(SECURITY,          "deploy", "shell");
    }

    public List<TrustCategory> categorize(String text) {
        if (text == null || text.isBlank()) return List.of();

        Map<TrustCategory, Integer> hits = new EnumMap<>(TrustCategory.class);
        for (String token : tokens(text)) {
            Set<TrustCategory> mapped = keywords.get(token);
            if (mapped == null) continue;
            mapped.forEach(c -> hits.merge(c, 1, Integer::sum));
        }

        return hits.entrySet().stream()
            .sorted(Map.Entry.<TrustCategory, Integer>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()))
            .limit(MAX_CATEGORIES)
            .map(Map.Entry::getKey)
            .toList();
    }

    /**
     * Associates every token of {@code example} with each of {@code labels}.
     *
     * @return number of token→category associations that were not known before
     */
    public int learn(String example, List<TrustCategory> labels) {
        if (example == null || labels == null || labels.isEmpty()) return 0;
        int learned = 0;
        for (String token : tokens(example)) {
            Set<TrustCategory> mapped = keywords.computeIfAbsent(token, k -> ConcurrentHashMap.newKeySet());
            for (TrustCategory label : labels) {
                if (mapped.add(label)) learned++;
            }
        }
        return learned;
    }

    public int vocabularySize() {
        return keywords.size();
    }

    private void seed(TrustCategory category, String... words) {
        for (String w : words) {
            keywords.computeIfAbsent(w, k -> ConcurrentHashMap.newKeySet()).add(category);
        }
    }

    private static List<String> tokens(String text) {
        List<String> out = new ArrayList<>();
        for (String raw : text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
            if (raw.length() >= MIN_TOKEN_LENGTH && !out.contains(raw)) out.add(raw);
        }
        return out;
    }
}
