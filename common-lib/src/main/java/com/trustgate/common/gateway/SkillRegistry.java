package com.trustgate.common.gateway;

import com.trustgate.common.skill.Skill;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Immutable name → skill lookup. */
public final class SkillRegistry {

    private final Map<String, Skill> skills;

    public SkillRegistry(List<Skill> skills) {
        Map<String, Skill> map = new LinkedHashMap<>();
        for (Skill s : skills) {
            if (map.putIfAbsent(s.name(), s) != null) {
                throw new IllegalArgumentException("Duplicate skill name " + s.name());
            }
        }
        this.skills = Collections.unmodifiableMap(map);
    }

    public Optional<Skill> find(String name) {
        return Optional.ofNullable(skills.get(name));
    }

    public Collection<Skill> all() {
        return skills.values();
    }
}
