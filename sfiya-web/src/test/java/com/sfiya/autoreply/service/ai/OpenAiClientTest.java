package com.sfiya.autoreply.service.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpEntity;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OpenAiClientTest {

    private static final String ENDPOINT = "https://api.test/v1/chat/completions";

    @Mock
    private RestTemplate restTemplate;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private OpenAiClient client;

    @BeforeEach
    void setUp() {
        client = new OpenAiClient("test-key", "org-1", "https://api.test/v1", "gpt-4-turbo", restTemplate);
    }

    @Test
    @SuppressWarnings({"unchecked", "rawtypes"})
    void complete_shouldReturnTrimmedContent_AndSendRequestParameters() throws Exception {
        // Arrange
        when(restTemplate.postForObject(eq(ENDPOINT), any(), eq(JsonNode.class)))
                .thenReturn(objectMapper.readTree(
                        "{\"choices\":[{\"message\":{\"content\":\"  Hello there  \"},\"finish_reason\":\"stop\"}]}"));

        // Act
        AiResult<String> result = client.complete(new ChatRequest("system", "user", 0.7, 500, 0.5));

        // Assert
        assertTrue(result.isOk());
        assertEquals("Hello there", result.value());

        ArgumentCaptor<HttpEntity> captor = ArgumentCaptor.forClass(HttpEntity.class);
        verify(restTemplate).postForObject(eq(ENDPOINT), captor.capture(), eq(JsonNode.class));
        HttpEntity<Map<String, Object>> entity = captor.getValue();
        assertEquals("Bearer test-key", entity.getHeaders().getFirst("Authorization"));
        assertEquals("org-1", entity.getHeaders().getFirst("OpenAI-Organization"));
        assertEquals("gpt-4-turbo", entity.getBody().get("model"));
        assertEquals(500, entity.getBody().get("max_tokens"));
        assertEquals(0.5, entity.getBody().get("frequency_penalty"));
    }

    @Test
    void complete_shouldReturnFailure_WhenApiTimesOut() {
        // Arrange
        when(restTemplate.postForObject(anyString(), any(), eq(JsonNode.class)))
                .thenThrow(new ResourceAccessException("Read timed out"));

        // Act
        AiResult<String> result = client.complete(new ChatRequest("system", "user", 0.3, 100));

        // Assert
        assertFalse(result.isOk());
        assertNull(result.value());
    }

    @Test
    void complete_shouldReturnFailure_WhenContentFiltered() throws Exception {
        when(restTemplate.postForObject(anyString(), any(), eq(JsonNode.class)))
                .thenReturn(objectMapper.readTree(
                        "{\"choices\":[{\"message\":{\"content\":\"\"},\"finish_reason\":\"content_filter\"}]}"));

        AiResult<String> result = client.complete(new ChatRequest("system", "user", 0.3, 100));

        assertFalse(result.isOk());
        assertTrue(result.error().contains("content filter"));
    }

    @Test
    void complete_shouldReturnFailure_WhenResponseHasNoChoices() throws Exception {
        when(restTemplate.postForObject(anyString(), any(), eq(JsonNode.class)))
                .thenReturn(objectMapper.readTree("{\"error\":{\"message\":\"quota\"}}"));

        AiResult<String> result = client.complete(new ChatRequest("system", "user", 0.3, 100));

        assertFalse(result.isOk());
    }

    @Test
    void complete_shouldNotCallApi_WhenKeyIsNotConfigured() {
        OpenAiClient disabled = new OpenAiClient("", "", "https://api.test/v1", "gpt-4-turbo", restTemplate);

        AiResult<String> result = disabled.complete(new ChatRequest("system", "user", 0.3, 100));

        assertFalse(disabled.isEnabled());
        assertFalse(result.isOk());
        verifyNoInteractions(restTemplate);
    }
}
