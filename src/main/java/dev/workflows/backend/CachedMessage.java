package dev.workflows.backend;

public record CachedMessage(String role, String content) {

    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_USER = "user";

    public boolean isAssistant() {
        return ROLE_ASSISTANT.equals(role);
    }
}
