package com.sfiya.autoreply.service;

import com.sfiya.autoreply.dto.BrandVoiceUpdateRequest;
import com.sfiya.autoreply.exception.ResourceNotFoundException;
import com.sfiya.autoreply.exception.SettingsNotFoundException;
import com.sfiya.autoreply.model.BrandVoice;
import com.sfiya.autoreply.repository.BrandVoiceRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BrandVoiceServiceTest {

    @Mock
    private BrandVoiceRepository brandVoiceRepository;

    @Mock
    private AutoReplySettingsService settingsService;

    @InjectMocks
    private BrandVoiceService brandVoiceService;

    @Test
    void getBrandVoice_shouldThrowNotFound_WhenMissing() {
        when(brandVoiceRepository.findById("user-1")).thenReturn(Optional.empty());

        ResourceNotFoundException ex = assertThrows(ResourceNotFoundException.class,
                () -> brandVoiceService.getBrandVoice("user-1"));
        assertEquals("Brand voice not found", ex.getMessage());
    }

    @Test
    void updateBrandVoice_shouldCreateRecord_OnFirstUpdate() {
        // Arrange
        when(brandVoiceRepository.findById("user-1")).thenReturn(Optional.empty());
        when(brandVoiceRepository.save(any(BrandVoice.class))).thenAnswer(invocation -> invocation.getArgument(0));

        BrandVoiceUpdateRequest request = new BrandVoiceUpdateRequest();
        request.setBrandName("  Trail Kitchen ");
        request.setBrandValues(List.of("sustainability", " "));
        request.setCatchphrases(List.of("Cook wild"));
        request.setIntroLine("Hey campers!");

        // Act
        BrandVoice saved = brandVoiceService.updateBrandVoice("user-1", request);

        // Assert
        assertEquals("user-1", saved.getUserId());
        assertEquals("Trail Kitchen", saved.getBrandName());
        assertEquals(List.of("sustainability"), saved.getBrandValues());
        assertTrue(saved.getPersonalityTraits().isEmpty());
        verify(settingsService).updateVoiceDetails("user-1", List.of("Cook wild"), null, "Hey campers!", null);
    }

    @Test
    void updateBrandVoice_shouldKeepName_WhenNotProvided() {
        BrandVoice existing = new BrandVoice("user-1");
        existing.setBrandName("Trail Kitchen");
        when(brandVoiceRepository.findById("user-1")).thenReturn(Optional.of(existing));
        when(brandVoiceRepository.save(any(BrandVoice.class))).thenAnswer(invocation -> invocation.getArgument(0));

        BrandVoiceUpdateRequest request = new BrandVoiceUpdateRequest();
        request.setPersonalityTraits(List.of("calm"));

        BrandVoice saved = brandVoiceService.updateBrandVoice("user-1", request);

        assertEquals("Trail Kitchen", saved.getBrandName());
        assertEquals(List.of("calm"), saved.getPersonalityTraits());
    }

    @Test
    void updateBrandVoice_shouldFail_WhenSettingsMissing() {
        BrandVoiceUpdateRequest request = new BrandVoiceUpdateRequest();
        when(settingsService.updateVoiceDetails("user-1", null, null, null, null))
                .thenThrow(new SettingsNotFoundException("user-1"));

        assertThrows(SettingsNotFoundException.class, () -> brandVoiceService.updateBrandVoice("user-1", request));
        verifyNoInteractions(brandVoiceRepository);
    }
}
