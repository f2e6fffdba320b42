package com.trustgate.common.skill;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record SkillResult(
    @JsonProperty("success") boolean success,
    @JsonProperty("message") String message,
    @JsonProperty("data")    Map<String, Object> data
) {

    public SkillResult {
        data = data != null ? Map.copyOf(data) : Map.of();
    }

    public static SkillResult ok(String message) {
        return new SkillResult(true, message, Map.of());
    }

    public static SkillResult ok(String message, Map<String, Object> data) {
        return new SkillResult(true, message, data);
    }

    public static SkillResult failure(String message) {
        return new SkillResult(false, message, Map.of());
    }
}
