package com.taskloom.core.agent;

import com.taskloom.core.model.AgentRole;

/**
 * First messages sent to each agent role.
 */
public final class AgentPrompts {

    private AgentPrompts() {}

    public static String forRole(AgentRole role, long taskId) {
        String taskDoc = ContextPromptBuilder.taskDocPath(taskId);
        return switch (role) {
            case PLANNING -> planning(taskDoc);
            case IMPLEMENTATION -> implementation(taskDoc, taskId);
            case REVIEW -> review(taskDoc, taskId);
        };
    }

    static String planning(String taskDoc) {
        return """
                @agent-Plan Help me plan this task. Explore the codebase, ask only about decisions \
                that substantially change the implementation, then write an onboarding plan to \
                `%s` with an overview, a phased implementation plan, a testing strategy and a \
                checkbox to-do list.""".formatted(taskDoc);
    }

    static String implementation(String taskDoc, long taskId) {
        return """
                Implement task %d. Read `%s`, pick up the first unchecked items of the to-do list, \
                implement and test them, then tick them off in the document. If every item is done \
                and verified, mark the workflow complete for task %d.""".formatted(taskId, taskDoc, taskId);
    }

    static String review(String taskDoc, long taskId) {
        return """
                Review the work done on task %d against `%s`. Run the tests, check the changes for \
                defects and missing cases, and add any follow-up items to the to-do list. If nothing \
                remains, mark the workflow complete for task %d.""".formatted(taskId, taskDoc, taskId);
    }
}
