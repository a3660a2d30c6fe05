package com.safepocket.subscriptions.controller;

import com.safepocket.subscriptions.controller.dto.DecisionRequestDto;
import com.safepocket.subscriptions.controller.dto.SubscriptionResponseDto;
import com.safepocket.subscriptions.model.Subscription;
import com.safepocket.subscriptions.model.SubscriptionDecision;
import com.safepocket.subscriptions.model.SubscriptionNotFoundException;
import com.safepocket.subscriptions.service.SubscriptionAssistantService;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/subscriptions")
public class SubscriptionsController {

    private final SubscriptionAssistantService assistantService;

    public SubscriptionsController(SubscriptionAssistantService assistantService) {
        this.assistantService = assistantService;
    }

    @GetMapping
    public ResponseEntity<List<SubscriptionResponseDto>> listSubscriptions() {
        return ResponseEntity.ok(SubscriptionMapper.toDtos(assistantService.listSubscriptions()));
    }

    @GetMapping("/{subscriptionId}")
    public ResponseEntity<SubscriptionResponseDto> getSubscription(@PathVariable("subscriptionId") long subscriptionId) {
        Subscription subscription = assistantService.findSubscription(subscriptionId)
                .orElseThrow(() -> new SubscriptionNotFoundException(subscriptionId));
        return ResponseEntity.ok(SubscriptionMapper.toDto(subscription));
    }

    @PostMapping("/{subscriptionId}/decision")
    public ResponseEntity<SubscriptionResponseDto> applyDecision(
            @PathVariable("subscriptionId") long subscriptionId,
            @Valid @RequestBody DecisionRequestDto request
    ) {
        SubscriptionDecision decision = SubscriptionDecision.fromValue(request.decision());
        Subscription updated = assistantService.applyDecision(subscriptionId, decision);
        return ResponseEntity.ok(SubscriptionMapper.toDto(updated));
    }
}
