package com.delta.resumeextractor.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.lang.management.ManagementFactory;

@ConfigurationProperties(prefix = "extractor")
public class ExtractorProperties {
    private static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";
    private static final String DEFAULT_MODEL = "gpt-4o-mini";

    private Queue queue = new Queue();
    private Workers workers = new Workers();
    private Llm llm = new Llm();
    private Poller poller = new Poller();
    private Persistence persistence = new Persistence();
    private Taxonomy taxonomy = new Taxonomy();
    private Claims claims = new Claims();
    private Cli cli = new Cli();

    public Queue getQueue() {
        return queue;
    }

    public void setQueue(Queue queue) {
        this.queue = queue;
    }

    public Workers getWorkers() {
        return workers;
    }

    public void setWorkers(Workers workers) {
        this.workers = workers;
    }

    public Llm getLlm() {
        return llm;
    }

    public void setLlm(Llm llm) {
        this.llm = llm;
    }

    public Poller getPoller() {
        return poller;
    }

    public void setPoller(Poller poller) {
        this.poller = poller;
    }

    public Persistence getPersistence() {
        return persistence;
    }

    public void setPersistence(Persistence persistence) {
        this.persistence = persistence;
    }

    public Taxonomy getTaxonomy() {
        return taxonomy;
    }

    public void setTaxonomy(Taxonomy taxonomy) {
        this.taxonomy = taxonomy;
    }

    public Claims getClaims() {
        return claims;
    }

    public void setClaims(Claims claims) {
        this.claims = claims;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static class Queue {
        private int recencyDays = 3;
        private int batchSize = 25;
        private String claimOwner;

        public int getRecencyDays() {
            return Math.max(1, recencyDays);
        }

        public void setRecencyDays(int recencyDays) {
            this.recencyDays = Math.max(1, recencyDays);
        }

        public int getBatchSize() {
            return Math.max(1, batchSize);
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = Math.max(1, batchSize);
        }

        public String getClaimOwner() {
            if (claimOwner == null || claimOwner.isBlank()) {
                return "extractor-" + ManagementFactory.getRuntimeMXBean().getName();
            }
            return claimOwner.trim();
        }

        public void setClaimOwner(String claimOwner) {
            this.claimOwner = claimOwner;
        }
    }

    public static class Workers {
        private int count = 4;

        public int getCount() {
            return Math.max(1, count);
        }

        public void setCount(int count) {
            this.count = Math.max(1, count);
        }
    }

    public static class Llm {
        static final int DEFAULT_MAX_INPUT_CHARS = 480_000;
        static final int MIN_MAX_INPUT_CHARS = 1_000;

        private String baseUrl = DEFAULT_BASE_URL;
        private String apiKey;
        private String model = DEFAULT_MODEL;
        private double temperature = 0.3;
        private boolean sendTemperature = true;
        private String endpoint = "/v1/chat/completions";
        private String completionWindow = "24h";
        private int requestTimeoutSeconds = 60;
        private int maxRetries = 2;
        private int retryBaseDelayMs = 500;
        private int retryMaxDelayMs = 8000;
        private int maxInputChars = DEFAULT_MAX_INPUT_CHARS;

        public String getBaseUrl() {
            if (baseUrl == null || baseUrl.isBlank()) {
                return DEFAULT_BASE_URL;
            }
            String trimmed = baseUrl.trim();
            return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }

        public String getModel() {
            return model == null || model.isBlank() ? DEFAULT_MODEL : model.trim();
        }

        public void setModel(String model) {
            this.model = model;
        }

        public double getTemperature() {
            return Math.min(2.0, Math.max(0.0, temperature));
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public boolean isSendTemperature() {
            return sendTemperature;
        }

        public void setSendTemperature(boolean sendTemperature) {
            this.sendTemperature = sendTemperature;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getCompletionWindow() {
            return completionWindow == null || completionWindow.isBlank() ? "24h" : completionWindow.trim();
        }

        public void setCompletionWindow(String completionWindow) {
            this.completionWindow = completionWindow;
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }

        public int getMaxRetries() {
            return Math.max(0, maxRetries);
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = Math.max(0, maxRetries);
        }

        public int getRetryBaseDelayMs() {
            return Math.max(0, retryBaseDelayMs);
        }

        public void setRetryBaseDelayMs(int retryBaseDelayMs) {
            this.retryBaseDelayMs = Math.max(0, retryBaseDelayMs);
        }

        public int getRetryMaxDelayMs() {
            return Math.max(0, retryMaxDelayMs);
        }

        public void setRetryMaxDelayMs(int retryMaxDelayMs) {
            this.retryMaxDelayMs = Math.max(0, retryMaxDelayMs);
        }

        /**
         * Resume characters sent per request. About four characters per token, so the default
         * keeps a resume near 120k tokens.
         */
        public int getMaxInputChars() {
            return Math.max(MIN_MAX_INPUT_CHARS, maxInputChars);
        }

        public void setMaxInputChars(int maxInputChars) {
            this.maxInputChars = Math.max(MIN_MAX_INPUT_CHARS, maxInputChars);
        }
    }

    public static class Poller {
        private boolean enabled = true;
        private int intervalSeconds = 60;
        private int initialDelaySeconds = 5;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getIntervalSeconds() {
            return Math.max(1, intervalSeconds);
        }

        public void setIntervalSeconds(int intervalSeconds) {
            this.intervalSeconds = Math.max(1, intervalSeconds);
        }

        public int getInitialDelaySeconds() {
            return Math.max(0, initialDelaySeconds);
        }

        public void setInitialDelaySeconds(int initialDelaySeconds) {
            this.initialDelaySeconds = Math.max(0, initialDelaySeconds);
        }
    }

    public static class Persistence {
        private int maxAttempts = 3;
        private long baseDelayMs = 1000;
        private long maxDelayMs = 10000;

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public long getBaseDelayMs() {
            return Math.max(0, baseDelayMs);
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = Math.max(0, baseDelayMs);
        }

        public long getMaxDelayMs() {
            return Math.max(getBaseDelayMs(), maxDelayMs);
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = Math.max(0, maxDelayMs);
        }
    }

    public static class Taxonomy {
        private String location = "classpath:taxonomy/skills-taxonomy.csv";
        private int maxCategories = 3;
        private int maxJobTitles = 10;
        private int maxSkillTerms = 20;
        private int headerLines = 10;

        public String getLocation() {
            return location;
        }

        public void setLocation(String location) {
            this.location = location;
        }

        public int getMaxCategories() {
            return Math.max(1, maxCategories);
        }

        public void setMaxCategories(int maxCategories) {
            this.maxCategories = Math.max(1, maxCategories);
        }

        public int getMaxJobTitles() {
            return Math.max(1, maxJobTitles);
        }

        public void setMaxJobTitles(int maxJobTitles) {
            this.maxJobTitles = Math.max(1, maxJobTitles);
        }

        public int getMaxSkillTerms() {
            return Math.max(1, maxSkillTerms);
        }

        public void setMaxSkillTerms(int maxSkillTerms) {
            this.maxSkillTerms = Math.max(1, maxSkillTerms);
        }

        public int getHeaderLines() {
            return Math.max(1, headerLines);
        }

        public void setHeaderLines(int headerLines) {
            this.headerLines = Math.max(1, headerLines);
        }
    }

    public static class Claims {
        private boolean releaseOnJobFailure;

        public boolean isReleaseOnJobFailure() {
            return releaseOnJobFailure;
        }

        public void setReleaseOnJobFailure(boolean releaseOnJobFailure) {
            this.releaseOnJobFailure = releaseOnJobFailure;
        }
    }

    public static class Cli {
        private boolean run;
        private Long recordId;
        private boolean continuous;
        private int intervalSeconds = 300;
        private boolean awaitCompletion;
        private int awaitTimeoutMinutes = 1440;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public Long getRecordId() {
            return recordId;
        }

        public void setRecordId(Long recordId) {
            this.recordId = recordId;
        }

        public boolean isContinuous() {
            return continuous;
        }

        public void setContinuous(boolean continuous) {
            this.continuous = continuous;
        }

        public int getIntervalSeconds() {
            return Math.max(1, intervalSeconds);
        }

        public void setIntervalSeconds(int intervalSeconds) {
            this.intervalSeconds = Math.max(1, intervalSeconds);
        }

        public boolean isAwaitCompletion() {
            return awaitCompletion;
        }

        public void setAwaitCompletion(boolean awaitCompletion) {
            this.awaitCompletion = awaitCompletion;
        }

        public int getAwaitTimeoutMinutes() {
            return Math.max(1, awaitTimeoutMinutes);
        }

        public void setAwaitTimeoutMinutes(int awaitTimeoutMinutes) {
            this.awaitTimeoutMinutes = Math.max(1, awaitTimeoutMinutes);
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
