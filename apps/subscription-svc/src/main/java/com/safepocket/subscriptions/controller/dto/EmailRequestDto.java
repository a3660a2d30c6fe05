package com.safepocket.subscriptions.controller.dto;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;

public record EmailRequestDto(
        @NotNull @Size(max = 998) String subject,
        @NotNull String body,
        @NotNull @JsonDeserialize(using = LenientInstantDeserializer.class) Instant timestamp
) {
}
