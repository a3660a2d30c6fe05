package com.safepocket.subscriptions.controller.dto;

import jakarta.validation.constraints.NotBlank;

public record DecisionRequestDto(@NotBlank String decision) {
}
