package com.delta.resumeextractor.extraction.llm;

import com.delta.resumeextractor.config.ExtractorProperties;
import com.delta.resumeextractor.extraction.model.BatchResultItem;
import com.delta.resumeextractor.extraction.model.BatchWorkItem;
import com.delta.resumeextractor.extraction.model.ChatMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON Lines request and result files exchanged with the batch service.
 */
@Component
public class BatchFileCodec {
    private static final Logger log = LoggerFactory.getLogger(BatchFileCodec.class);

    private final ObjectMapper objectMapper;
    private final ExtractorProperties properties;

    public BatchFileCodec(ObjectMapper objectMapper, ExtractorProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public String writeRequests(List<BatchWorkItem> items) {
        ExtractorProperties.Llm llm = properties.getLlm();
        StringBuilder jsonl = new StringBuilder();
        for (BatchWorkItem item : items) {
            ObjectNode line = objectMapper.createObjectNode();
            line.put("custom_id", item.customId());
            line.put("method", "POST");
            line.put("url", llm.getEndpoint());
            ObjectNode body = line.putObject("body");
            body.put("model", llm.getModel());
            ArrayNode messages = body.putArray("messages");
            for (ChatMessage message : item.messages()) {
                messages.addObject()
                    .put("role", message.role())
                    .put("content", message.content());
            }
            if (llm.isSendTemperature()) {
                body.put("temperature", llm.getTemperature());
            }
            try {
                jsonl.append(objectMapper.writeValueAsString(line)).append('\n');
            } catch (JsonProcessingException e) {
                throw new LlmClientException("Failed to encode batch item " + item.customId(), e);
            }
        }
        return jsonl.toString();
    }

    /**
     * Reads an output or error file. Lines that are not valid JSON are logged and skipped; the
     * affected records surface as missing results.
     */
    public List<BatchResultItem> readResults(String jsonl) {
        List<BatchResultItem> items = new ArrayList<>();
        if (jsonl == null || jsonl.isBlank()) {
            return items;
        }
        int lineNumber = 0;
        for (String line : jsonl.split("\\r?\\n")) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            JsonNode node;
            try {
                node = objectMapper.readTree(line);
            } catch (JsonProcessingException e) {
                log.warn("Skipping malformed batch result line {}: {}", lineNumber, e.getOriginalMessage());
                continue;
            }
            items.add(toResultItem(node));
        }
        return items;
    }

    private BatchResultItem toResultItem(JsonNode node) {
        String customId = node.path("custom_id").asText(null);
        JsonNode response = node.path("response");
        int statusCode = response.path("status_code").asInt(0);
        JsonNode body = response.path("body");

        String errorMessage = null;
        JsonNode error = node.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            errorMessage = error.path("message").asText(error.toString());
        } else if (statusCode < 200 || statusCode >= 300) {
            JsonNode bodyError = body.path("error");
            errorMessage = bodyError.isMissingNode() || bodyError.isNull()
                ? "status " + statusCode
                : bodyError.path("message").asText(bodyError.toString());
        }

        JsonNode content = body.path("choices").path(0).path("message").path("content");
        String text = content.isMissingNode() || content.isNull() ? null : content.asText();
        return new BatchResultItem(customId, statusCode, text, errorMessage);
    }
}
