package com.sfiya.autoreply.repository;

import com.sfiya.autoreply.model.AutoReplySettings;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AutoReplySettingsRepository extends JpaRepository<AutoReplySettings, String> {
}
