package dev.workflows.backend;

public record ConversationRef(String id) {}
