package com.sfiya.autoreply.service.ai;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sfiya.autoreply.model.LeadTemperature;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LeadDetectorTest {

    @Mock
    private OpenAiClient openAiClient;

    private LeadDetector leadDetector;

    @BeforeEach
    void setUp() {
        leadDetector = new LeadDetector(openAiClient, new StructuredOutputParser(new ObjectMapper()));
    }

    @Test
    void detectLead_shouldReturnHotLead() {
        when(openAiClient.complete(any(ChatRequest.class)))
                .thenReturn(AiResult.ok("{\"is_lead\": true, \"temperature\": \"hot\"}"));

        LeadResult result = leadDetector.detectLead("How do I order 50 of these today?");

        assertTrue(result.lead());
        assertEquals(LeadTemperature.HOT, result.temperature());
    }

    @Test
    void detectLead_shouldReturnNotALead_WhenApiFails() {
        when(openAiClient.complete(any(ChatRequest.class))).thenReturn(AiResult.failure("Connection refused"));

        assertEquals(LeadResult.NOT_A_LEAD, leadDetector.detectLead("Price?"));
    }

    @Test
    void detectLead_shouldReturnNotALead_WhenIsLeadIsNotBoolean() {
        when(openAiClient.complete(any(ChatRequest.class)))
                .thenReturn(AiResult.ok("{\"is_lead\": \"yes\", \"temperature\": \"hot\"}"));

        assertEquals(LeadResult.NOT_A_LEAD, leadDetector.detectLead("Price?"));
    }

    @Test
    void detectLead_shouldDefaultToCold_WhenTemperatureMissingOrUnknown() {
        when(openAiClient.complete(any(ChatRequest.class)))
                .thenReturn(AiResult.ok("{\"is_lead\": true}"))
                .thenReturn(AiResult.ok("{\"is_lead\": true, \"temperature\": \"lukewarm\"}"));

        assertEquals(new LeadResult(true, LeadTemperature.COLD), leadDetector.detectLead("Interested"));
        assertEquals(new LeadResult(true, LeadTemperature.COLD), leadDetector.detectLead("Interested"));
    }

    @Test
    void detectLead_shouldTreatMissingFlagAsNoLead() {
        when(openAiClient.complete(any(ChatRequest.class)))
                .thenReturn(AiResult.ok("{\"temperature\": \"warm\"}"));

        LeadResult result = leadDetector.detectLead("Cool video");

        assertFalse(result.lead());
        assertEquals(LeadTemperature.WARM, result.temperature());
    }
}
