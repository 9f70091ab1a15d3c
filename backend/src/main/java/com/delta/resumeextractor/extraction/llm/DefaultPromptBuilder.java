package com.delta.resumeextractor.extraction.llm;

import com.delta.resumeextractor.config.ExtractorProperties;
import com.delta.resumeextractor.extraction.model.CandidateField;
import com.delta.resumeextractor.extraction.model.ChatMessage;
import com.delta.resumeextractor.extraction.model.TaxonomyMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Asks one question per line, each worded the way the response parser expects to find its
 * answer: {@code Question: answer}, with NULL for anything the resume does not state.
 */
@Component
public class DefaultPromptBuilder implements PromptBuilder {
    private static final Logger log = LoggerFactory.getLogger(DefaultPromptBuilder.class);
    static final String TRUNCATION_MARKER = "\n\n... [content truncated due to length] ...\n\n";
    private static final String[] JOB_ORDINALS = {
        "", "Second ", "Third ", "Fourth ", "Fifth ", "Sixth ", "Seventh "
    };
    private static final String[] USAGE_ORDINALS = {
        "most", "second most", "third most", "fourth most", "fifth most"
    };

    private static final String INSTRUCTIONS = """
        You are reading a candidate's resume and answering questions about it.
        Answer every question on its own line in the form "Question: answer".
        Use NULL when the resume does not contain the answer. Do not guess.
        Dates must be written as YYYY-MM-DD when the day is known, otherwise YYYY-MM or YYYY.
        Use "Present" as the end date of a current position.
        Numerical questions take a number only.
        """;

    private final String questions = buildQuestions();
    private final ExtractorProperties properties;

    public DefaultPromptBuilder(ExtractorProperties properties) {
        this.properties = properties;
    }

    @Override
    public List<ChatMessage> build(String resumeText, TaxonomyMatch taxonomy) {
        String text = fitToBudget(resumeText == null ? "" : resumeText);
        List<ChatMessage> messages = new ArrayList<>();
        messages.add(ChatMessage.system(INSTRUCTIONS + "\nRESUME:\n" + text));
        if (taxonomy != null && !taxonomy.isEmpty()) {
            messages.add(ChatMessage.system(
                taxonomy.context() + "Prefer job titles and skills from these categories when they fit."
            ));
        }
        messages.add(ChatMessage.user(questions));
        return messages;
    }

    /**
     * Keeps the head and tail of an oversized resume around a truncation marker, never exceeding
     * the configured character budget.
     */
    String fitToBudget(String text) {
        int max = properties.getLlm().getMaxInputChars();
        if (text.length() <= max) {
            return text;
        }
        int keep = Math.max(0, max - TRUNCATION_MARKER.length());
        int head = keep / 2;
        int tail = keep - head;
        log.warn("Resume text truncated from {} to {} characters", text.length(), keep);
        return text.substring(0, head) + TRUNCATION_MARKER + text.substring(text.length() - tail);
    }

    String questions() {
        return questions;
    }

    private static String buildQuestions() {
        StringBuilder q = new StringBuilder();
        q.append("First Name:\nMiddle Name:\nLast Name:\n");
        q.append("Street Address:\nCity:\nState:\nZip Code:\n");
        q.append("Phone 1:\nPhone 2:\nEmail 1:\nEmail 2:\nLinkedIn URL:\n");
        q.append("Bachelor's Degree:\nMaster's Degree:\nCertifications:\n");
        q.append("Best job title that fits their primary experience:\n");
        q.append("Best secondary job title that fits their secondary experience:\n");
        q.append("Best tertiary job title that fits their tertiary experience:\n");
        for (int rank = 1; rank <= CandidateField.MAX_JOBS; rank++) {
            String ordinal = JOB_ORDINALS[rank - 1];
            q.append(ordinal).append("Most Recent Company Worked for:\n");
            q.append(ordinal).append("Most Recent Start Date (YYYY-MM-DD):\n");
            q.append(ordinal).append("Most Recent End Date (YYYY-MM-DD):\n");
            q.append(ordinal).append("Most Recent Job Location:\n");
        }
        q.append("Best industry that fits their primary experience:\n");
        q.append("Best industry that fits their secondary experience:\n");
        q.append("What is the primary software language they use:\n");
        q.append("What is the secondary software language they use:\n");
        q.append("What is the tertiary software language they use:\n");
        for (String usage : USAGE_ORDINALS) {
            q.append("What software do they talk about using the ").append(usage).append("?:\n");
        }
        for (String usage : USAGE_ORDINALS) {
            q.append("What physical hardware do they talk about using the ").append(usage).append("?:\n");
        }
        q.append("Best category that fits their primary experience:\n");
        q.append("Best category that fits their secondary experience:\n");
        q.append("What types of projects have they worked on:\n");
        q.append("How long have they lived in the United States (numerical answer only):\n");
        q.append("Total years of professional experience (numerical answer only):\n");
        q.append("Average tenure at companies in years (numerical answer only):\n");
        q.append("Top 10 Technical Skills (comma separated):\n");
        return q.toString();
    }
}
