package com.delta.resumeextractor.extraction.llm;

import com.delta.resumeextractor.config.ExtractorConfigurationException;
import com.delta.resumeextractor.config.ExtractorProperties;
import com.delta.resumeextractor.extraction.model.BatchJobStatus;
import com.delta.resumeextractor.extraction.model.BatchResultItem;
import com.delta.resumeextractor.extraction.model.BatchStatusSnapshot;
import com.delta.resumeextractor.extraction.model.BatchWorkItem;
import com.delta.resumeextractor.extraction.model.ChatMessage;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenAiBatchClientTest {
    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockWebServer server;
    private ExecutorService executor;
    private ExtractorProperties properties;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(1);
        properties = new ExtractorProperties();
        properties.getLlm().setBaseUrl(server.url("/v1").toString());
        properties.getLlm().setApiKey("sk-test");
        properties.getLlm().setRequestTimeoutSeconds(5);
        properties.getLlm().setMaxRetries(2);
        properties.getLlm().setRetryBaseDelayMs(1);
        properties.getLlm().setRetryMaxDelayMs(5);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void statusRequestRetriesAfterRateLimit() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(429).setBody("slow down"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody(
            "{\"id\":\"batch_1\",\"status\":\"in_progress\",\"request_counts\":{\"total\":2,\"completed\":1,\"failed\":0}}"
        ));

        BatchStatusSnapshot snapshot = client().getStatus("batch_1");

        assertThat(snapshot.status()).isEqualTo(BatchJobStatus.IN_PROGRESS);
        assertThat(snapshot.totalRequests()).isEqualTo(2);
        assertThat(snapshot.completedRequests()).isEqualTo(1);
        assertThat(server.getRequestCount()).isEqualTo(2);
        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v1/batches/batch_1");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer sk-test");
    }

    @Test
    void clientErrorsAreNotRetried() {
        server.enqueue(new MockResponse().setResponseCode(400).setBody("{\"error\":{\"message\":\"bad\"}}"));

        assertThatThrownBy(() -> client().getStatus("batch_1"))
            .isInstanceOf(LlmClientException.class)
            .satisfies(e -> assertThat(((LlmClientException) e).getStatusCode()).isEqualTo(400));
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void submitUploadsFileThenCreatesBatch() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"id\":\"file-1\"}"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"id\":\"batch_9\",\"status\":\"validating\"}"));

        String jobId = client().submit(List.of(
            new BatchWorkItem("user_5", 5L, List.of(ChatMessage.user("First Name:")))
        ));

        assertThat(jobId).isEqualTo("batch_9");
        RecordedRequest upload = server.takeRequest();
        assertThat(upload.getPath()).isEqualTo("/v1/files");
        assertThat(upload.getHeader("Content-Type")).startsWith("multipart/form-data; boundary=");
        String uploadBody = upload.getBody().readUtf8();
        assertThat(uploadBody).contains("name=\"purpose\"").contains("\"custom_id\":\"user_5\"");

        RecordedRequest create = server.takeRequest();
        assertThat(create.getPath()).isEqualTo("/v1/batches");
        JsonNode body = objectMapper.readTree(create.getBody().readUtf8());
        assertThat(body.path("input_file_id").asText()).isEqualTo("file-1");
        assertThat(body.path("endpoint").asText()).isEqualTo("/v1/chat/completions");
        assertThat(body.path("completion_window").asText()).isEqualTo("24h");
    }

    @Test
    void fetchOutputReadsOutputFile() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody(
            "{\"id\":\"batch_2\",\"status\":\"completed\",\"output_file_id\":\"file-out\",\"error_file_id\":null}"
        ));
        server.enqueue(new MockResponse().setResponseCode(200).setBody(
            "{\"custom_id\":\"user_1\",\"response\":{\"status_code\":200,\"body\":{\"choices\":[{\"message\":{\"content\":\"First Name: Jane\"}}]}}}\n"
        ));

        List<BatchResultItem> items = client().fetchOutput("batch_2");

        assertThat(items).hasSize(1);
        assertThat(items.get(0).customId()).isEqualTo("user_1");
        assertThat(items.get(0).content()).isEqualTo("First Name: Jane");
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void missingApiKeyFailsBeforeAnyRequest() {
        properties.getLlm().setApiKey("");

        assertThatThrownBy(() -> client().getStatus("batch_1"))
            .isInstanceOf(ExtractorConfigurationException.class);
        assertThat(server.getRequestCount()).isZero();
    }

    private OpenAiBatchClient client() {
        return new OpenAiBatchClient(properties, executor, objectMapper, new BatchFileCodec(objectMapper, properties));
    }
}
