package com.sfiya.autoreply.repository;

import com.sfiya.autoreply.model.EngagementActivity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface EngagementActivityRepository extends JpaRepository<EngagementActivity, Long> {
}
