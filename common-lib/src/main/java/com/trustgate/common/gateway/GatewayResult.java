package com.trustgate.common.gateway;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.trustgate.common.permission.PermissionDecision;
import com.trustgate.common.skill.SkillResult;

/**
 * What {@link ActionGateway#invoke} hands back. {@code permission} is {@code null} for
 * exempt skills and unknown skills.
 */
public record GatewayResult(
    @JsonProperty("skill")      String skill,
    @JsonProperty("status")     GatewayStatus status,
    @JsonProperty("permission") PermissionDecision permission,
    @JsonProperty("result")     SkillResult result
) {

    @JsonIgnore
    public boolean success() {
        return status == GatewayStatus.EXECUTED && result != null && result.success();
    }

    @JsonIgnore
    public boolean denied() {
        return status == GatewayStatus.DENIED;
    }

    static GatewayResult executed(String skill, PermissionDecision permission, SkillResult result) {
        return new GatewayResult(skill, GatewayStatus.EXECUTED, permission, result);
    }

    static GatewayResult denied(String skill, PermissionDecision permission) {
        String message = "Permission denied: " + permission.denial().summary();
        return new GatewayResult(skill, GatewayStatus.DENIED, permission, SkillResult.failure(message));
    }

    static GatewayResult unknown(String skill) {
        return new GatewayResult(skill, GatewayStatus.UNKNOWN_SKILL, null,
            SkillResult.failure("Unknown skill: " + skill));
    }
}
