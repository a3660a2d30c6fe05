package com.safepocket.subscriptions.controller;

import com.safepocket.subscriptions.controller.dto.EmailRequestDto;
import com.safepocket.subscriptions.controller.dto.EmailResponseDto;
import com.safepocket.subscriptions.model.EmailRecord;
import com.safepocket.subscriptions.model.EmailTag;
import com.safepocket.subscriptions.service.SubscriptionAssistantService;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/emails")
public class EmailsController {

    private final SubscriptionAssistantService assistantService;

    public EmailsController(SubscriptionAssistantService assistantService) {
        this.assistantService = assistantService;
    }

    @PostMapping
    public ResponseEntity<EmailResponseDto> ingestEmail(@Valid @RequestBody EmailRequestDto request) {
        EmailRecord email = assistantService.ingestEmail(request.subject(), request.body(), request.timestamp());
        return ResponseEntity.ok(map(email));
    }

    @GetMapping
    public ResponseEntity<List<EmailResponseDto>> listEmails() {
        return ResponseEntity.ok(assistantService.listEmails().stream()
                .map(this::map)
                .toList());
    }

    private EmailResponseDto map(EmailRecord email) {
        List<String> tags = email.tags().stream()
                .sorted()
                .map(EmailTag::value)
                .toList();
        return new EmailResponseDto(email.id().toString(), email.subject(), email.body(), email.receivedAt(), tags);
    }
}
