package com.trustgate.common.skill;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/** Skill with external side effects; dispatches the payload to its handler. */
public record ExecutableSkill(
    String name,
    String permission,
    Function<Map<String, Object>, SkillResult> handler
) implements Skill {

    public ExecutableSkill {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(handler, "handler");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.executable(this);
    }
}
