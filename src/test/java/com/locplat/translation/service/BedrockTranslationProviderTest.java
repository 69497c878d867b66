package com.locplat.translation.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.RateLimiter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.model.BedrockRuntimeException;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelRequest;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelResponse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BedrockTranslationProviderTest {

    private static final String MODEL = "anthropic.claude-3-haiku-20240307-v1:0";

    @Mock
    private BedrockRuntimeClient bedrockClient;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private BedrockTranslationProvider provider;

    @BeforeEach
    void setUp() {
        provider = new BedrockTranslationProvider(bedrockClient, objectMapper, new TranslationPromptBuilder(),
                RateLimiter.create(1_000), MODEL, 512, 3, 0, "en, fr,ar");
    }

    @Test
    void sendsAnthropicPayloadAndReturnsFirstTextBlock() throws Exception {
        when(bedrockClient.invokeModel(any(InvokeModelRequest.class))).thenReturn(response("  Bonjour  "));

        String result = provider.translate("Hello", "en", "fr", null, null);

        assertThat(result).isEqualTo("Bonjour");
        ArgumentCaptor<InvokeModelRequest> captor = ArgumentCaptor.forClass(InvokeModelRequest.class);
        verify(bedrockClient).invokeModel(captor.capture());
        assertThat(captor.getValue().modelId()).isEqualTo(MODEL);
        JsonNode payload = objectMapper.readTree(captor.getValue().body().asUtf8String());
        assertThat(payload.get("anthropic_version").asText()).isEqualTo("bedrock-2023-05-31");
        assertThat(payload.get("max_tokens").asInt()).isEqualTo(512);
        assertThat(payload.at("/messages/0/content").asText())
                .contains("English text to French")
                .contains("Text to translate: Hello");
    }

    @Test
    void modelOverrideIsUsed() {
        when(bedrockClient.invokeModel(any(InvokeModelRequest.class))).thenReturn(response("Salut"));

        provider.translate("Hi", "en", "fr", "custom-model", null);

        ArgumentCaptor<InvokeModelRequest> captor = ArgumentCaptor.forClass(InvokeModelRequest.class);
        verify(bedrockClient).invokeModel(captor.capture());
        assertThat(captor.getValue().modelId()).isEqualTo("custom-model");
    }

    @Test
    void stripsCodeFences() {
        when(bedrockClient.invokeModel(any(InvokeModelRequest.class))).thenReturn(response("```text\nBonjour\n```"));

        assertThat(provider.translate("Hello", "en", "fr", null, null)).isEqualTo("Bonjour");
    }

    @Test
    void retriesWhenThrottled() {
        when(bedrockClient.invokeModel(any(InvokeModelRequest.class)))
                .thenThrow(throttling())
                .thenReturn(response("Bonjour"));

        assertThat(provider.translate("Hello", "en", "fr", null, null)).isEqualTo("Bonjour");
        verify(bedrockClient, times(2)).invokeModel(any(InvokeModelRequest.class));
    }

    @Test
    void surfacesThrottlingAfterLastAttempt() {
        when(bedrockClient.invokeModel(any(InvokeModelRequest.class))).thenThrow(throttling());

        assertThatThrownBy(() -> provider.translate("Hello", "en", "fr", null, null))
                .isInstanceOf(ThrottledException.class);
        verify(bedrockClient, times(3)).invokeModel(any(InvokeModelRequest.class));
    }

    @Test
    void otherApiErrorsAreNotRetried() {
        BedrockRuntimeException validation = (BedrockRuntimeException) BedrockRuntimeException.builder()
                .statusCode(400)
                .awsErrorDetails(AwsErrorDetails.builder().errorCode("ValidationException")
                        .errorMessage("bad input").build())
                .build();
        when(bedrockClient.invokeModel(any(InvokeModelRequest.class))).thenThrow(validation);

        assertThatThrownBy(() -> provider.translate("Hello", "en", "fr", null, null))
                .isInstanceOf(TranslationException.class)
                .isNotInstanceOf(ThrottledException.class)
                .hasMessageContaining("bad input");
        verify(bedrockClient, times(1)).invokeModel(any(InvokeModelRequest.class));
    }

    @Test
    void emptyResponseIsAnError() {
        when(bedrockClient.invokeModel(any(InvokeModelRequest.class))).thenReturn(InvokeModelResponse.builder()
                .body(SdkBytes.fromUtf8String("{\"content\":[]}"))
                .build());

        assertThatThrownBy(() -> provider.translate("Hello", "en", "fr", null, null))
                .isInstanceOf(TranslationException.class)
                .hasMessageContaining("missing content");
    }

    @Test
    void blankTextNeverReachesBedrock() {
        assertThatThrownBy(() -> provider.translate("\u0001\u0002", "en", "fr", null, null))
                .isInstanceOf(TranslationException.class);
        verify(bedrockClient, times(0)).invokeModel(any(InvokeModelRequest.class));
    }

    @Test
    void supportsConfiguredLanguagesOnly() {
        assertThat(provider.supportsLanguagePair("en", "fr")).isTrue();
        assertThat(provider.supportsLanguagePair("EN", "ar")).isTrue();
        assertThat(provider.supportsLanguagePair("en", "de")).isFalse();
        assertThat(provider.supportsLanguagePair(null, "fr")).isFalse();
    }

    private InvokeModelResponse response(String text) {
        String body = objectMapper.createObjectNode()
                .set("content", objectMapper.createArrayNode().add(objectMapper.createObjectNode()
                        .put("type", "text").put("text", text)))
                .toString();
        return InvokeModelResponse.builder().body(SdkBytes.fromUtf8String(body)).build();
    }

    private static BedrockRuntimeException throttling() {
        return (BedrockRuntimeException) BedrockRuntimeException.builder()
                .statusCode(429)
                .awsErrorDetails(AwsErrorDetails.builder().errorCode("ThrottlingException")
                        .errorMessage("Too many requests").build())
                .build();
    }
}
