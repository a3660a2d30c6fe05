package com.safepocket.subscriptions.controller;

import com.safepocket.subscriptions.controller.dto.SubscriptionResponseDto;
import com.safepocket.subscriptions.controller.dto.TransactionRequestDto;
import com.safepocket.subscriptions.service.SubscriptionAssistantService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/transactions")
public class TransactionsController {

    private final SubscriptionAssistantService assistantService;

    public TransactionsController(SubscriptionAssistantService assistantService) {
        this.assistantService = assistantService;
    }

    /**
     * Records a statement line. Responds with the detected or updated subscription, or 204 when the
     * charge did not (yet) form a monthly cadence.
     */
    @PostMapping
    public ResponseEntity<SubscriptionResponseDto> registerTransaction(@Valid @RequestBody TransactionRequestDto request) {
        return assistantService.registerTransaction(request.description(), request.amount(), request.timestamp())
                .map(SubscriptionMapper::toDto)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }
}
