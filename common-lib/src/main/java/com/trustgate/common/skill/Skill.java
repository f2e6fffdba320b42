package com.trustgate.common.skill;

/**
 * A privileged or internal action the gateway can run.
 *
 * <p>The set of variants is closed; the gateway routes through {@link Visitor}, so adding a
 * variant fails compilation until every dispatcher handles it.
 *
 * <p>{@link #permission()} names the requirement-table action that must pass before the skill
 * runs. {@code null} marks an exempt internal skill (no side effects outside the process).
 */
public sealed interface Skill permits ExecutableSkill, CategorizerSkill, TrainerSkill {

    String name();

    String permission();

    default boolean exempt() {
        return permission() == null;
    }

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R executable(ExecutableSkill skill);
        R categorizer(CategorizerSkill skill);
        R trainer(TrainerSkill skill);
    }
}
