package com.trustgate.common.permission;

import com.trustgate.common.model.ActionRequirement;
import com.trustgate.common.model.TrustCategory;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static com.trustgate.common.model.TrustCategory.*;

/**
 * Static action → requirement lookup, built once at startup and never mutated.
 *
 * <p>Risk bands by {@code minSovereignty}:
 * <ul>
 *   <li>0.1–0.3: low risk, reversible (reads, lead creation)</li>
 *   <li>0.4–0.6: medium risk (writes, outbound messages, staging deploys)</li>
 *   <li>0.7–0.8: high risk (push, production deploy, destructive database work)</li>
 *   <li>0.9+   : critical, destructive (force push)</li>
 * </ul>
 */
public final class RequirementTable {

    private final Map<String, ActionRequirement> byAction;

    private RequirementTable(Map<String, ActionRequirement> byAction) {
        this.byAction = Collections.unmodifiableMap(byAction);
    }

    public static RequirementTable of(Collection<ActionRequirement> requirements) {
        Map<String, ActionRequirement> map = new LinkedHashMap<>();
        for (ActionRequirement r : requirements) {
            if (map.putIfAbsent(r.action(), r) != null) {
                throw new IllegalArgumentException("Duplicate requirement for action " + r.action());
            }
        }
        return new RequirementTable(map);
    }

    /**
     * Returns a table with every entry of {@code this}, replaced or extended by {@code overrides}.
     */
    public RequirementTable withOverrides(Collection<ActionRequirement> overrides) {
        Map<String, ActionRequirement> map = new LinkedHashMap<>(byAction);
        overrides.forEach(r -> map.put(r.action(), r));
        return new RequirementTable(map);
    }

    public Optional<ActionRequirement> find(String action) {
        return Optional.ofNullable(byAction.get(action));
    }

    public Collection<ActionRequirement> all() {
        return byAction.values();
    }

    public int size() {
        return byAction.size();
    }

    public static RequirementTable defaults() {
        return of(java.util.List.of(
            req("shell_execute",     0.6, "Execute arbitrary shell commands",
                SECURITY, 0.7, RELIABILITY, 0.5),
            req("file_read",         0.1, "Read files from disk",
                SECURITY, 0.3),
            req("file_write",        0.2, "Write files to disk",
                RELIABILITY, 0.4, DATA_INTEGRITY, 0.3),
            req("file_delete",       0.5, "Delete files from disk",
                SECURITY, 0.6, RELIABILITY, 0.6),
            req("git_commit",        0.4, "Create local git commit",
                CODE_QUALITY, 0.5, DOCUMENTATION, 0.4),
            req("git_push",          0.7, "Push commits to git remote",
                CODE_QUALITY, 0.7, TESTING, 0.6, SECURITY, 0.5),
            req("git_force_push",    0.9, "Force push to git remote (rewrites history)",
                CODE_QUALITY, 0.9, TESTING, 0.8, SECURITY, 0.8, RELIABILITY, 0.7),
            req("git_branch_delete", 0.6, "Delete git branch",
                RELIABILITY, 0.6, CODE_QUALITY, 0.5),
            req("crm_create_lead",   0.2, "Create new CRM lead",
                DATA_INTEGRITY, 0.4, PROCESS_ADHERENCE, 0.3),
            req("crm_update_lead",   0.3, "Update CRM lead data",
                DATA_INTEGRITY, 0.5, PROCESS_ADHERENCE, 0.4),
            req("crm_delete_lead",   0.6, "Delete CRM lead",
                DATA_INTEGRITY, 0.7, SECURITY, 0.5, ACCOUNTABILITY, 0.6),
            req("database_write",    0.6, "Write to database",
                DATA_INTEGRITY, 0.7, SECURITY, 0.6, RELIABILITY, 0.5),
            req("database_delete",   0.7, "Delete from database",
                DATA_INTEGRITY, 0.8, SECURITY, 0.7, ACCOUNTABILITY, 0.7),
            req("send_message",      0.3, "Send message to external channel",
                COMMUNICATION, 0.5, ACCOUNTABILITY, 0.4),
            req("send_email",        0.5, "Send outbound email",
                COMMUNICATION, 0.6, ACCOUNTABILITY, 0.5, TRANSPARENCY, 0.4),
            req("post_tweet",        0.6, "Post to a public social feed",
                COMMUNICATION, 0.7, ACCOUNTABILITY, 0.6, TRANSPARENCY, 0.5),
            req("send_sms",          0.5, "Send SMS message",
                COMMUNICATION, 0.6, ACCOUNTABILITY, 0.5),
            req("deploy",            0.8, "Deploy to production",
                CODE_QUALITY, 0.8, TESTING, 0.7, SECURITY, 0.6, RELIABILITY, 0.7),
            req("deploy_staging",    0.5, "Deploy to staging environment",
                CODE_QUALITY, 0.6, TESTING, 0.5, SECURITY, 0.5),
            req("restart_service",   0.6, "Restart production service",
                RELIABILITY, 0.7, SECURITY, 0.5),
            req("modify_config",     0.6, "Modify production configuration",
                SECURITY, 0.7, RELIABILITY, 0.6, PROCESS_ADHERENCE, 0.5)
        ));
    }

    private static ActionRequirement req(String action, double minSovereignty, String description,
                                         Object... categoryMinimums) {
        Map<TrustCategory, Double> scores = new EnumMap<>(TrustCategory.class);
        for (int i = 0; i < categoryMinimums.length; i += 2) {
            scores.put((TrustCategory) categoryMinimums[i], (Double) categoryMinimums[i + 1]);
        }
        return new ActionRequirement(action, scores, minSovereignty, description);
    }
}
