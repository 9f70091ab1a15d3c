package com.delta.resumeextractor.extraction.model;

import java.util.List;

public record BatchWorkItem(String customId, long recordId, List<ChatMessage> messages) {
    public BatchWorkItem {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }
}
