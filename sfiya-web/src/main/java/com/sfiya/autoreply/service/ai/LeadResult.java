package com.sfiya.autoreply.service.ai;

import com.sfiya.autoreply.model.LeadTemperature;

public record LeadResult(boolean lead, LeadTemperature temperature) {
    public static final LeadResult NOT_A_LEAD = new LeadResult(false, LeadTemperature.COLD);
}
