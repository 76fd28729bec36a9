package com.sharpskill.search.exception;

import lombok.Getter;

@Getter
public class SkillNotFoundException extends RuntimeException {
    private final String skillId;

    public SkillNotFoundException(String skillId) {
        super("Skill not found: " + skillId);
        this.skillId = skillId;
    }
}
