package dev.workflows.engine;

import dev.workflows.model.WorkflowStep;

/**
 * Builds the literal text sent to the agent for a step, and the fixed prompts of the
 * summarize-and-handoff protocol.
 */
public final class StepMessageBuilder {

    static final String SUMMARY_PROMPT = String.join(" ",
        "Summarize the conversation so far for a clean handoff to the next step.",
        "Return concise bullet points covering goals, decisions, constraints, key outputs, and open questions.",
        "Use the same language as the conversation. Do not add extra commentary.");

    private StepMessageBuilder() {}

    /**
     * Build the message for a step. Returns an empty string when there is nothing to send,
     * which includes skill, agent and command steps without a name.
     */
    public static String build(WorkflowStep step) {
        switch (step.kind()) {
            case COMMAND:
                if (isBlank(step.name())) {
                    return "";
                }
                return ("/" + step.name() + suffix(step.input())).trim();
            case SKILL:
                if (isBlank(step.name())) {
                    return "";
                }
                return ("/" + step.name() + suffix(step.args()) + suffix(step.input())).trim();
            case AGENT:
                if (isBlank(step.name())) {
                    return "";
                }
                return ("@" + step.name() + suffix(step.input())).trim();
            case MESSAGE:
            default:
                return step.input() != null ? step.input() : "";
        }
    }

    /** The prompt asking the agent to condense the conversation before a handoff. */
    public static String buildSummaryPrompt() {
        return SUMMARY_PROMPT;
    }

    /** The first message of a handoff conversation. */
    public static String buildSummaryInjection(String summary) {
        var sb = new StringBuilder();
        sb.append("Context summary from previous steps:\n\n");
        sb.append(summary.trim());
        sb.append("\n\nAcknowledge briefly and wait.");
        return sb.toString();
    }

    private static String suffix(String part) {
        return part != null && !part.isEmpty() ? " " + part : "";
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
