package com.delta.resumeextractor.extraction.llm;

import com.delta.resumeextractor.config.ExtractorConfigurationException;
import com.delta.resumeextractor.config.ExtractorProperties;
import com.delta.resumeextractor.extraction.model.BatchJobStatus;
import com.delta.resumeextractor.extraction.model.BatchResultItem;
import com.delta.resumeextractor.extraction.model.BatchStatusSnapshot;
import com.delta.resumeextractor.extraction.model.BatchWorkItem;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadLocalRandom;

@Service
public class OpenAiBatchClient implements LlmBatchClient {
    private static final Logger log = LoggerFactory.getLogger(OpenAiBatchClient.class);

    private final ExtractorProperties properties;
    private final HttpClient client;
    private final ObjectMapper objectMapper;
    private final BatchFileCodec codec;

    public OpenAiBatchClient(
        ExtractorProperties properties,
        @Qualifier("llmHttpExecutor") ExecutorService httpExecutor,
        ObjectMapper objectMapper,
        BatchFileCodec codec
    ) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.codec = codec;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getLlm().getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    @Override
    public String submit(List<BatchWorkItem> items) {
        requireApiKey();
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("Cannot submit an empty batch");
        }
        String jsonl = codec.writeRequests(items);
        String inputFileId = uploadBatchFile(jsonl);

        ObjectNode request = objectMapper.createObjectNode();
        request.put("input_file_id", inputFileId);
        request.put("endpoint", properties.getLlm().getEndpoint());
        request.put("completion_window", properties.getLlm().getCompletionWindow());
        request.putObject("metadata").put("item_count", String.valueOf(items.size()));
        LlmHttpResult result = send("POST", "/batches", jsonBody(request), "application/json");
        JsonNode batch = readSuccessful(result, "create batch");
        String jobId = batch.path("id").asText(null);
        if (jobId == null || jobId.isBlank()) {
            throw new LlmClientException("Batch creation returned no id", result.statusCode(), "missing_id");
        }
        log.info("Created batch {} with {} items from file {}", jobId, items.size(), inputFileId);
        return jobId;
    }

    @Override
    public BatchStatusSnapshot getStatus(String jobId) {
        requireApiKey();
        LlmHttpResult result = send("GET", "/batches/" + jobId, null, null);
        JsonNode batch = readSuccessful(result, "retrieve batch " + jobId);
        BatchJobStatus status;
        try {
            status = BatchJobStatus.fromApiValue(batch.path("status").asText(null));
        } catch (IllegalArgumentException e) {
            throw new LlmClientException(
                "Unrecognized status for batch " + jobId + ": " + batch.path("status").asText(),
                result.statusCode(),
                "unknown_status"
            );
        }
        JsonNode counts = batch.path("request_counts");
        return new BatchStatusSnapshot(
            jobId,
            status,
            textOrNull(batch.path("output_file_id")),
            textOrNull(batch.path("error_file_id")),
            counts.path("total").asInt(0),
            counts.path("completed").asInt(0),
            counts.path("failed").asInt(0)
        );
    }

    @Override
    public List<BatchResultItem> fetchOutput(String jobId) {
        BatchStatusSnapshot snapshot = getStatus(jobId);
        List<BatchResultItem> items = new ArrayList<>();
        if (snapshot.outputFileId() != null) {
            items.addAll(codec.readResults(downloadFile(snapshot.outputFileId())));
        }
        if (snapshot.errorFileId() != null) {
            items.addAll(codec.readResults(downloadFile(snapshot.errorFileId())));
        }
        log.info(
            "Batch {} returned {} result items (output={}, errors={})",
            jobId,
            items.size(),
            snapshot.outputFileId(),
            snapshot.errorFileId()
        );
        return items;
    }

    private String uploadBatchFile(String jsonl) {
        String boundary = "----extractor" + UUID.randomUUID().toString().replace("-", "");
        ByteArrayOutputStream body = new ByteArrayOutputStream();
        writePart(body, boundary, "Content-Disposition: form-data; name=\"purpose\"\r\n\r\nbatch\r\n");
        writePart(
            body,
            boundary,
            "Content-Disposition: form-data; name=\"file\"; filename=\"batch_input.jsonl\"\r\n"
                + "Content-Type: application/jsonl\r\n\r\n"
                + jsonl
                + "\r\n"
        );
        body.writeBytes(("--" + boundary + "--\r\n").getBytes(StandardCharsets.UTF_8));

        LlmHttpResult result = send(
            "POST",
            "/files",
            body.toByteArray(),
            "multipart/form-data; boundary=" + boundary
        );
        JsonNode file = readSuccessful(result, "upload batch file");
        String fileId = file.path("id").asText(null);
        if (fileId == null || fileId.isBlank()) {
            throw new LlmClientException("File upload returned no id", result.statusCode(), "missing_id");
        }
        return fileId;
    }

    private String downloadFile(String fileId) {
        LlmHttpResult result = send("GET", "/files/" + fileId + "/content", null, null);
        if (!result.isSuccessful()) {
            throw new LlmClientException(
                "Download of file " + fileId + " failed: " + result.describeFailure(),
                result.statusCode(),
                result.errorCode()
            );
        }
        return result.body();
    }

    private void writePart(ByteArrayOutputStream body, String boundary, String part) {
        body.writeBytes(("--" + boundary + "\r\n" + part).getBytes(StandardCharsets.UTF_8));
    }

    private byte[] jsonBody(ObjectNode node) {
        try {
            return objectMapper.writeValueAsBytes(node);
        } catch (JsonProcessingException e) {
            throw new LlmClientException("Failed to encode request", e);
        }
    }

    private JsonNode readSuccessful(LlmHttpResult result, String operation) {
        if (!result.isSuccessful()) {
            throw new LlmClientException(
                operation + " failed: " + result.describeFailure(),
                result.statusCode(),
                result.errorCode()
            );
        }
        try {
            return objectMapper.readTree(result.body());
        } catch (JsonProcessingException e) {
            throw new LlmClientException(operation + " returned invalid JSON", e);
        }
    }

    private LlmHttpResult send(String method, String path, byte[] body, String contentType) {
        int maxAttempts = Math.max(1, 1 + properties.getLlm().getMaxRetries());
        LlmHttpResult lastResult = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            lastResult = executeOnce(method, path, body, contentType);
            if (!shouldRetry(lastResult) || attempt >= maxAttempts) {
                return lastResult;
            }
            log.warn("{} {} attempt {}/{} failed: {}", method, path, attempt, maxAttempts, lastResult.describeFailure());
            if (!sleepBackoff(attempt)) {
                return lastResult;
            }
        }
        return lastResult;
    }

    private LlmHttpResult executeOnce(String method, String path, byte[] body, String contentType) {
        Instant startedAt = Instant.now();
        String url = properties.getLlm().getBaseUrl() + path;
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(url))
                .timeout(Duration.ofSeconds(properties.getLlm().getRequestTimeoutSeconds()))
                .header("Authorization", "Bearer " + properties.getLlm().getApiKey())
                .header("Accept", "application/json");
            HttpRequest request;
            if ("POST".equals(method)) {
                request = builder
                    .header("Content-Type", contentType)
                    .POST(HttpRequest.BodyPublishers.ofByteArray(body == null ? new byte[0] : body))
                    .build();
            } else {
                request = builder.GET().build();
            }
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            return new LlmHttpResult(
                url,
                response.statusCode(),
                response.body(),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, "interrupted", e.getMessage());
        } catch (IllegalArgumentException e) {
            return errorResult(url, startedAt, "invalid_url", e.getMessage());
        }
    }

    private boolean shouldRetry(LlmHttpResult result) {
        if (result == null) {
            return false;
        }
        String errorCode = result.errorCode();
        if (errorCode != null) {
            return !errorCode.equals("invalid_url") && !errorCode.equals("interrupted");
        }
        int status = result.statusCode();
        return status == 408 || status == 429 || status >= 500;
    }

    private boolean sleepBackoff(int attempt) {
        int baseDelayMs = properties.getLlm().getRetryBaseDelayMs();
        if (baseDelayMs <= 0) {
            return true;
        }
        long delay = (long) baseDelayMs * (1L << Math.max(0, attempt - 1));
        int maxDelayMs = properties.getLlm().getRetryMaxDelayMs();
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        long jitter = ThreadLocalRandom.current().nextLong(Math.max(1L, delay / 2));
        try {
            Thread.sleep((delay / 2) + jitter);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void requireApiKey() {
        if (!properties.getLlm().hasApiKey()) {
            throw new ExtractorConfigurationException("extractor.llm.api-key is not set (OPENAI_API_KEY)");
        }
    }

    private LlmHttpResult errorResult(String url, Instant startedAt, String code, String message) {
        return new LlmHttpResult(url, 0, null, Instant.now(), Duration.between(startedAt, Instant.now()), code, message);
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isMissingNode() || node.isNull() ? null : node.asText();
    }
}
