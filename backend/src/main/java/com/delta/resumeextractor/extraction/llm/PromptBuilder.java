package com.delta.resumeextractor.extraction.llm;

import com.delta.resumeextractor.extraction.model.ChatMessage;
import com.delta.resumeextractor.extraction.model.TaxonomyMatch;

import java.util.List;

public interface PromptBuilder {

    List<ChatMessage> build(String resumeText, TaxonomyMatch taxonomy);
}
