package com.safepocket.subscriptions.controller.dto;

import java.time.Instant;
import java.util.List;

public record EmailResponseDto(
        String id,
        String subject,
        String body,
        Instant timestamp,
        List<String> tags
) {
}
