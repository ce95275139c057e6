package com.sfiya.autoreply.endpoint;

import com.sfiya.autoreply.dto.SettingsUpdateRequest;
import com.sfiya.autoreply.dto.SettingsView;
import com.sfiya.autoreply.model.AutoReplySettings;
import com.sfiya.autoreply.service.AutoReplySettingsService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.security.Principal;
import java.util.Map;

@RestController
@RequestMapping("/api/auto-reply/settings")
@RequiredArgsConstructor
public class AutoReplySettingsController {

    private final AutoReplySettingsService settingsService;

    @GetMapping
    public ResponseEntity<?> getSettings(Principal principal) {
        if (principal == null) return ResponseEntity.status(401).body(Map.of("error", "Not authenticated"));
        AutoReplySettings settings = settingsService.getSettings(principal.getName());
        return ResponseEntity.ok(SettingsView.from(settings));
    }

    @PutMapping
    public ResponseEntity<?> updateSettings(Principal principal, @RequestBody SettingsUpdateRequest request) {
        if (principal == null) return ResponseEntity.status(401).body(Map.of("error", "Not authenticated"));
        AutoReplySettings settings = settingsService.updateSettings(principal.getName(), request);
        return ResponseEntity.ok(Map.of("success", true, "settings", SettingsView.from(settings)));
    }
}
