package agents.bridge.config;

import io.vertx.core.json.JsonObject;

/**
 * Settings for the LLM completion endpoint used by the query router.
 */
public class LlmProviderConfig {

    public static final String OPENAI = "openai";
    public static final String ANTHROPIC = "anthropic";
    public static final String LOCAL = "local";

    public static final String DEFAULT_MODEL = "gpt-4";
    public static final int DEFAULT_MAX_TOKENS = 1000;
    public static final double DEFAULT_TEMPERATURE = 0.1;
    public static final long DEFAULT_TIMEOUT = 30000;

    private final String provider;
    private final String apiKey;
    private final String model;
    private final String baseUrl;
    private final int maxTokens;
    private final double temperature;
    private final long timeout;

    public LlmProviderConfig(String provider, String apiKey, String model, String baseUrl,
                             int maxTokens, double temperature, long timeout) {
        this.provider = provider == null ? null : provider.trim().toLowerCase();
        this.apiKey = apiKey;
        this.model = model == null || model.isBlank() ? DEFAULT_MODEL : model;
        this.baseUrl = baseUrl;
        this.maxTokens = maxTokens;
        this.temperature = temperature;
        this.timeout = timeout;
    }

    public static LlmProviderConfig none() {
        return new LlmProviderConfig(null, null, null, null, DEFAULT_MAX_TOKENS, DEFAULT_TEMPERATURE, DEFAULT_TIMEOUT);
    }

    public static LlmProviderConfig fromJson(JsonObject json) {
        if (json == null) {
            return none();
        }
        return new LlmProviderConfig(
            json.getString("provider"),
            json.getString("apiKey"),
            json.getString("model"),
            json.getString("baseUrl"),
            json.getInteger("maxTokens", DEFAULT_MAX_TOKENS),
            json.getDouble("temperature", DEFAULT_TEMPERATURE),
            json.getLong("timeout", DEFAULT_TIMEOUT));
    }

    /**
     * A provider counts as configured when it is named and has credentials.
     * The local provider only needs a base URL.
     */
    public boolean isConfigured() {
        if (provider == null || provider.isEmpty()) {
            return false;
        }
        if (LOCAL.equals(provider)) {
            return baseUrl != null && !baseUrl.isBlank();
        }
        return (OPENAI.equals(provider) || ANTHROPIC.equals(provider))
            && apiKey != null && !apiKey.isBlank();
    }

    /**
     * Full URL of the completion endpoint for the configured provider.
     */
    public String endpoint() {
        String root;
        if (baseUrl != null && !baseUrl.isBlank()) {
            root = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        } else if (ANTHROPIC.equals(provider)) {
            root = "https://api.anthropic.com";
        } else {
            root = "https://api.openai.com";
        }
        return ANTHROPIC.equals(provider) ? root + "/v1/messages" : root + "/v1/chat/completions";
    }

    public String getProvider() {
        return provider;
    }

    public String getApiKey() {
        return apiKey;
    }

    public String getModel() {
        return model;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public double getTemperature() {
        return temperature;
    }

    public long getTimeout() {
        return timeout;
    }

    /** Masked form for status output. */
    public JsonObject toSafeJson() {
        return new JsonObject()
            .put("provider", provider)
            .put("model", model)
            .put("baseUrl", baseUrl)
            .put("configured", isConfigured());
    }
}
