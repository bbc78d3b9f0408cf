package agents.bridge.services;

import agents.bridge.BridgeContext;
import agents.bridge.config.LlmProviderConfig;
import agents.bridge.exception.LlmProviderException;
import io.vertx.core.Future;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpRequest;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;

import static agents.bridge.services.LogUtil.*;

/**
 * Client for the LLM completion endpoint used by the query router.
 * Supports OpenAI, Anthropic and any OpenAI-compatible local server.
 */
public class LlmAPIService {

    public static final String ANTHROPIC_VERSION = "2023-06-01";
    public static final String DEFAULT_ANTHROPIC_MODEL = "claude-3-sonnet-20240229";

    private final BridgeContext ctx;
    private final LlmProviderConfig config;
    private final WebClient webClient;

    public LlmAPIService(BridgeContext ctx, LlmProviderConfig config) {
        this.ctx = ctx;
        this.config = config;
        this.webClient = WebClient.create(ctx.getVertx(), new WebClientOptions()
            .setUserAgent("mcp-bridge/0.1.1")
            .setConnectTimeout(5000));

        if (config.isConfigured()) {
            logInfo(ctx, "LLM provider configured: " + config.getProvider() + " model " + config.getModel(),
                "LlmAPIService", "Configuration", "LLM");
            logDetail(ctx, "LLM endpoint: " + config.endpoint(), "LlmAPIService", "Configuration", "LLM");
        } else {
            logInfo(ctx, "No LLM provider configured, routing will use keyword fallback",
                "LlmAPIService", "Configuration", "LLM");
        }
    }

    public boolean isConfigured() {
        return config.isConfigured();
    }

    public LlmProviderConfig getConfig() {
        return config;
    }

    /**
     * Send a single user message and return the text of the completion.
     */
    public Future<String> complete(String prompt) {
        if (!isConfigured()) {
            return Future.failedFuture(new LlmProviderException("LLM provider not configured"));
        }
        boolean anthropic = LlmProviderConfig.ANTHROPIC.equals(config.getProvider());
        JsonObject body = anthropic ? anthropicBody(prompt) : chatCompletionBody(prompt);

        HttpRequest<Buffer> request = webClient.postAbs(config.endpoint())
            .timeout(config.getTimeout())
            .putHeader("Content-Type", "application/json");
        if (anthropic) {
            request.putHeader("x-api-key", config.getApiKey())
                .putHeader("anthropic-version", ANTHROPIC_VERSION);
        } else if (config.getApiKey() != null && !config.getApiKey().isBlank()) {
            request.putHeader("Authorization", "Bearer " + config.getApiKey());
        }

        logDetail(ctx, "Calling LLM API at " + config.endpoint(), "LlmAPIService", "API", "Request");
        logData(ctx, "LLM request body: " + body.encode(), "LlmAPIService", "API", "Request");

        return request.sendJsonObject(body)
            .recover(err -> {
                String message = err.getMessage() == null ? err.getClass().getSimpleName() : err.getMessage();
                if (message.toLowerCase().contains("timeout")) {
                    logError(ctx, "LLM API request timeout", "LlmAPIService", "API", "Timeout");
                    return Future.failedFuture(new LlmProviderException(
                        "Request timeout - LLM API took too long to respond", err));
                }
                logError(ctx, "LLM API connection failed: " + message, "LlmAPIService", "API", "Network");
                return Future.failedFuture(new LlmProviderException("Failed to connect to LLM API: " + message, err));
            })
            .compose(response -> handleResponse(response, anthropic));
    }

    private JsonObject chatCompletionBody(String prompt) {
        return new JsonObject()
            .put("model", config.getModel())
            .put("messages", new JsonArray().add(new JsonObject().put("role", "user").put("content", prompt)))
            .put("max_tokens", config.getMaxTokens())
            .put("temperature", config.getTemperature());
    }

    private JsonObject anthropicBody(String prompt) {
        String model = LlmProviderConfig.DEFAULT_MODEL.equals(config.getModel())
            ? DEFAULT_ANTHROPIC_MODEL
            : config.getModel();
        return new JsonObject()
            .put("model", model)
            .put("max_tokens", config.getMaxTokens())
            .put("messages", new JsonArray().add(new JsonObject().put("role", "user").put("content", prompt)))
            .put("temperature", config.getTemperature());
    }

    private Future<String> handleResponse(HttpResponse<Buffer> response, boolean anthropic) {
        int status = response.statusCode();
        if (status == 200) {
            try {
                JsonObject responseBody = response.bodyAsJsonObject();
                logData(ctx, "LLM response body: " + responseBody.encode(), "LlmAPIService", "API", "Response");
                return Future.succeededFuture(anthropic ? anthropicText(responseBody) : chatCompletionText(responseBody));
            } catch (RuntimeException e) {
                return Future.failedFuture(new LlmProviderException("Failed to parse LLM API response: " + e.getMessage(), e));
            }
        }
        if (status == 429) {
            logError(ctx, "LLM API rate limit exceeded", "LlmAPIService", "API", "RateLimit");
            return Future.failedFuture(new LlmProviderException("Rate limit: " + errorMessage(response, "Rate limit exceeded")));
        }
        if (status == 401 || status == 403) {
            logError(ctx, "LLM API authentication failed - invalid API key", "LlmAPIService", "API", "Auth");
            return Future.failedFuture(new LlmProviderException("Invalid LLM API key"));
        }
        String error = errorMessage(response, "Unknown error");
        logError(ctx, "LLM API error " + status + ": " + error, "LlmAPIService", "API", "Error");
        return Future.failedFuture(new LlmProviderException("LLM API error (" + status + "): " + error));
    }

    private static String chatCompletionText(JsonObject body) {
        JsonArray choices = body.getJsonArray("choices", new JsonArray());
        if (choices.isEmpty()) {
            return "";
        }
        JsonObject message = choices.getJsonObject(0).getJsonObject("message", new JsonObject());
        return message.getString("content", "");
    }

    private static String anthropicText(JsonObject body) {
        JsonArray content = body.getJsonArray("content", new JsonArray());
        if (content.isEmpty()) {
            return "";
        }
        return content.getJsonObject(0).getString("text", "");
    }

    private static String errorMessage(HttpResponse<Buffer> response, String fallback) {
        try {
            JsonObject error = response.bodyAsJsonObject();
            if (error == null) {
                return fallback;
            }
            Object nested = error.getValue("error");
            if (nested instanceof JsonObject) {
                return ((JsonObject) nested).getString("message", fallback);
            }
            return nested == null ? fallback : String.valueOf(nested);
        } catch (RuntimeException e) {
            String raw = response.bodyAsString();
            return raw == null || raw.isBlank() ? fallback : raw;
        }
    }

    public void close() {
        webClient.close();
    }
}
