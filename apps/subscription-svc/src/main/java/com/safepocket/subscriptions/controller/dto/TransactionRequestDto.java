package com.safepocket.subscriptions.controller.dto;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.Instant;

public record TransactionRequestDto(
        @NotBlank @Size(max = 512) String description,
        @NotNull BigDecimal amount,
        @NotNull @JsonDeserialize(using = LenientInstantDeserializer.class) Instant timestamp
) {
}
