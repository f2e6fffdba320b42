package com.trustgate.steering.skill;

import com.trustgate.common.skill.CategorizerSkill;
import com.trustgate.common.skill.ExecutableSkill;
import com.trustgate.common.skill.KeywordCategorizer;
import com.trustgate.common.skill.Skill;
import com.trustgate.common.skill.TrainerSkill;
import com.trustgate.steering.client.WorkerDispatchClient;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The skills this host exposes and the requirement-table action each one needs.
 *
 * <p>Worker-backed skills dispatch to the worker only after the gateway allowed them.
 * {@value #CATEGORIZE} and {@value #TRAIN} are in-process and exempt.
 */
public final class WorkerSkills {

    public static final String AGENT_DISPATCH     = "agent-dispatch";
    public static final String SYSTEM_CONTROL     = "system-control";
    public static final String EMAIL_OUTBOUND     = "email-outbound";
    public static final String ARTIFACT_GENERATOR = "artifact-generator";
    public static final String LEDGER_WRITER      = "ledger-writer";
    public static final String CATEGORIZE         = "categorize";
    public static final String TRAIN              = "train";

    private WorkerSkills() {}

    /**
     * @param dispatchPermission action checked before a prediction reaches the worker
     */
    public static List<Skill> build(WorkerDispatchClient worker, KeywordCategorizer categorizer,
                                    String dispatchPermission) {
        Map<String, String> permissions = new LinkedHashMap<>();
        permissions.put(AGENT_DISPATCH,     dispatchPermission);
        permissions.put(SYSTEM_CONTROL,     "shell_execute");
        permissions.put(EMAIL_OUTBOUND,     "send_email");
        permissions.put(ARTIFACT_GENERATOR, "file_write");
        permissions.put(LEDGER_WRITER,      "file_write");

        List<Skill> skills = new ArrayList<>();
        permissions.forEach((name, permission) ->
            skills.add(new ExecutableSkill(name, permission, payload -> worker.dispatch(name, payload))));
        skills.add(new CategorizerSkill(CATEGORIZE, null, categorizer::categorize));
        skills.add(new TrainerSkill(TRAIN, null, categorizer::learn));
        return skills;
    }
}
