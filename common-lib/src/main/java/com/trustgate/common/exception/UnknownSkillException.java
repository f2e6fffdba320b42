package com.trustgate.common.exception;

public class UnknownSkillException extends TrustGateException {
    private final String skill;

    public UnknownSkillException(String skill) {
        super("ActionGateway", "No skill registered under '" + skill + "'");
        this.skill = skill;
    }

    public String getSkill() {
        return skill;
    }
}
