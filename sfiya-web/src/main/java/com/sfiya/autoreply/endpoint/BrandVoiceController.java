package com.sfiya.autoreply.endpoint;

import com.sfiya.autoreply.dto.BrandVoiceUpdateRequest;
import com.sfiya.autoreply.dto.BrandVoiceView;
import com.sfiya.autoreply.model.BrandVoice;
import com.sfiya.autoreply.service.BrandVoiceService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.security.Principal;
import java.util.Map;

@RestController
@RequestMapping("/api/brand-voice")
@RequiredArgsConstructor
public class BrandVoiceController {

    private final BrandVoiceService brandVoiceService;

    @GetMapping
    public ResponseEntity<?> getBrandVoice(Principal principal) {
        if (principal == null) return ResponseEntity.status(401).body(Map.of("error", "Not authenticated"));
        return ResponseEntity.ok(BrandVoiceView.from(brandVoiceService.getBrandVoice(principal.getName())));
    }

    @PutMapping
    public ResponseEntity<?> updateBrandVoice(Principal principal, @Valid @RequestBody BrandVoiceUpdateRequest request) {
        if (principal == null) return ResponseEntity.status(401).body(Map.of("error", "Not authenticated"));
        BrandVoice brandVoice = brandVoiceService.updateBrandVoice(principal.getName(), request);
        return ResponseEntity.ok(Map.of("success", true, "brand_voice", BrandVoiceView.from(brandVoice)));
    }
}
