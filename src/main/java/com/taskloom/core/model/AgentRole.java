package com.taskloom.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Fixed agent roles that can run against a task.
 * <p>
 * IMPLEMENTATION and REVIEW are complementary: a successful run of one
 * may chain into a run of the other until the task's workflow is complete.
 */
public enum AgentRole {
    PLANNING("planification"),
    IMPLEMENTATION("implementation"),
    REVIEW("review");

    private final String wireName;

    AgentRole(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** True for the roles that take part in the implementation/review loop. */
    public boolean isChainable() {
        return this == IMPLEMENTATION || this == REVIEW;
    }

    /**
     * Returns the role that follows this one in the implementation/review loop.
     *
     * @throws IllegalStateException for roles outside the loop
     */
    public AgentRole complement() {
        return switch (this) {
            case IMPLEMENTATION -> REVIEW;
            case REVIEW -> IMPLEMENTATION;
            case PLANNING -> throw new IllegalStateException("PLANNING has no complementary role");
        };
    }

    public static AgentRole fromWireName(String name) {
        for (AgentRole role : values()) {
            if (role.wireName.equalsIgnoreCase(name) || role.name().equalsIgnoreCase(name)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown agent role: " + name);
    }
}
