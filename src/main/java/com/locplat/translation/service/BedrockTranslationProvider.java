package com.locplat.translation.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.util.concurrent.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.model.BedrockRuntimeException;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelRequest;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelResponse;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Translates text with an Anthropic model hosted on Amazon Bedrock.
 */
@Service
@ConditionalOnProperty(name = "app.providers.bedrock.enabled", havingValue = "true", matchIfMissing = true)
public class BedrockTranslationProvider implements TranslationProvider {

    private static final Logger logger = LoggerFactory.getLogger(BedrockTranslationProvider.class);

    public static final String NAME = "bedrock";

    private final BedrockRuntimeClient bedrockClient;
    private final ObjectMapper objectMapper;
    private final TranslationPromptBuilder promptBuilder;
    private final RateLimiter rateLimiter;
    private final String defaultModelId;
    private final int maxTokens;
    private final int maxAttempts;
    private final long baseBackoffMs;
    private final Set<String> supportedLanguages;

    /**
     * @param defaultModelId     Bedrock model id used when a request names none
     * @param maxTokens          response token cap per translation
     * @param maxAttempts        attempts per call when Bedrock throttles
     * @param baseBackoffMs      first backoff delay, doubled per attempt
     * @param supportedLanguages comma-separated language codes
     */
    public BedrockTranslationProvider(BedrockRuntimeClient bedrockClient,
                                      ObjectMapper objectMapper,
                                      TranslationPromptBuilder promptBuilder,
                                      @Qualifier("translationRateLimiter") RateLimiter rateLimiter,
                                      @Value("${aws.bedrock.modelId:anthropic.claude-3-haiku-20240307-v1:0}") String defaultModelId,
                                      @Value("${app.bedrock.maxTokens:2000}") int maxTokens,
                                      @Value("${app.bedrock.maxAttempts:6}") int maxAttempts,
                                      @Value("${app.bedrock.baseBackoffMs:800}") long baseBackoffMs,
                                      @Value("${app.translation.supported-languages:en,ar,bs,he,fa,ur,es,fr,de,it,pt,ru,zh,ja,ko,hi,tr,pl,nl,sv,da,no,fi}") String supportedLanguages) {
        this.bedrockClient = bedrockClient;
        this.objectMapper = objectMapper;
        this.promptBuilder = promptBuilder;
        this.rateLimiter = rateLimiter;
        this.defaultModelId = defaultModelId;
        this.maxTokens = Math.max(128, maxTokens);
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseBackoffMs = Math.max(0, baseBackoffMs);
        this.supportedLanguages = new LinkedHashSet<>();
        for (String code : supportedLanguages.split(",")) {
            if (!code.isBlank()) {
                this.supportedLanguages.add(code.trim().toLowerCase(Locale.ROOT));
            }
        }
        logger.info("BedrockTranslationProvider initialized with default model ID: {}", defaultModelId);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDefaultModel() {
        return defaultModelId;
    }

    @Override
    public boolean supportsLanguagePair(String sourceLang, String targetLang) {
        return sourceLang != null && targetLang != null
                && supportedLanguages.contains(sourceLang.toLowerCase(Locale.ROOT))
                && supportedLanguages.contains(targetLang.toLowerCase(Locale.ROOT));
    }

    @Override
    public String translate(String text, String sourceLang, String targetLang, String model, String context) {
        String effectiveModelId = model == null || model.isBlank() ? defaultModelId : model;
        String prompt = promptBuilder.buildPrompt(NAME, text, sourceLang, targetLang, context);

        try {
            ObjectNode payload = objectMapper.createObjectNode();
            payload.put("anthropic_version", "bedrock-2023-05-31");
            payload.put("max_tokens", maxTokens);
            payload.put("temperature", 0.3);
            ObjectNode userMessage = payload.putArray("messages").addObject();
            userMessage.put("role", "user");
            userMessage.put("content", prompt);

            InvokeModelRequest request = InvokeModelRequest.builder()
                    .modelId(effectiveModelId)
                    .contentType("application/json")
                    .accept("application/json")
                    .body(SdkBytes.fromUtf8String(objectMapper.writeValueAsString(payload)))
                    .build();

            rateLimiter.acquire();
            InvokeModelResponse response = invokeWithRetry(request);
            JsonNode responseJson = objectMapper.readTree(response.body().asUtf8String());
            JsonNode contentBlock = responseJson.path("content");

            if (contentBlock.isArray() && contentBlock.size() > 0) {
                String textContent = stripFences(contentBlock.get(0).path("text").asText("").trim());
                if (textContent.isEmpty()) {
                    throw new TranslationException(NAME, "Empty translation returned by model " + effectiveModelId);
                }
                return textContent;
            }
            throw new TranslationException(NAME, "Bedrock response missing content block");
        } catch (TranslationException te) {
            throw te; // includes ThrottledException
        } catch (BedrockRuntimeException e) {
            String detail = e.awsErrorDetails() != null ? e.awsErrorDetails().errorMessage() : e.getMessage();
            logger.error("Bedrock API error during translation for model {}: {}", effectiveModelId, detail, e);
            throw new TranslationException(NAME, "Bedrock API error: " + detail, e);
        } catch (JsonProcessingException e) {
            throw new TranslationException(NAME, "Unreadable Bedrock response: " + e.getOriginalMessage(), e);
        } catch (RuntimeException e) {
            throw new TranslationException(NAME, "Unexpected error during translation: " + e.getMessage(), e);
        }
    }

    private String stripFences(String textContent) {
        if (textContent.startsWith("```") && textContent.endsWith("```") && textContent.length() >= 6) {
            String inner = textContent.substring(3, textContent.length() - 3);
            int firstBreak = inner.indexOf('\n');
            // Drop a language tag such as ```text
            if (firstBreak > 0 && !inner.substring(0, firstBreak).contains(" ")) {
                inner = inner.substring(firstBreak + 1);
            }
            return inner.trim();
        }
        return textContent;
    }

    /**
     * Repeatedly invokes Bedrock with exponential backoff, surfacing throttling as {@link ThrottledException}.
     */
    private InvokeModelResponse invokeWithRetry(InvokeModelRequest request) {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return bedrockClient.invokeModel(request);
            } catch (BedrockRuntimeException e) {
                int statusCode = e.statusCode();
                String code = e.awsErrorDetails() != null ? e.awsErrorDetails().errorCode() : null;
                boolean throttled = statusCode == 429
                        || "ThrottlingException".equalsIgnoreCase(code)
                        || "TooManyRequestsException".equalsIgnoreCase(code)
                        || "ProvisionedThroughputExceededException".equalsIgnoreCase(code);

                if (!throttled) {
                    throw e;
                }

                if (attempt == maxAttempts) {
                    logger.warn("Bedrock throttled after {} attempts; surfacing throttling.", maxAttempts);
                    throw new ThrottledException(NAME, "Bedrock throttling after retries", e);
                }

                long jitter = baseBackoffMs == 0 ? 0 : ThreadLocalRandom.current().nextLong(50, 200);
                long sleepMs = (long) Math.min(10_000, baseBackoffMs * Math.pow(2, attempt - 1) + jitter);
                logger.warn("Bedrock throttled (attempt {}/{}). Backing off for {} ms. Error: {}",
                        attempt, maxAttempts, sleepMs, e.awsErrorDetails() != null ? e.awsErrorDetails().errorMessage() : e.getMessage());
                try {
                    Thread.sleep(sleepMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new TranslationException(NAME, "Interrupted during backoff", ie);
                }
            }
        }
        throw new IllegalStateException("Unreachable");
    }
}
