package com.sfiya.autoreply.repository;

import com.sfiya.autoreply.model.BrandVoice;
import org.springframework.data.jpa.repository.JpaRepository;

public interface BrandVoiceRepository extends JpaRepository<BrandVoice, String> {
}
