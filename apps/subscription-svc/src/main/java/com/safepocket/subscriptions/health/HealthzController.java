package com.safepocket.subscriptions.health;

import com.safepocket.subscriptions.service.SubscriptionAssistantService;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Lightweight unauthenticated health endpoint. Reports how many subscriptions the in-memory
 * registry currently holds, which resets with the process.
 */
@RestController
public class HealthzController {

    private final SubscriptionAssistantService assistantService;

    public HealthzController(SubscriptionAssistantService assistantService) {
        this.assistantService = assistantService;
    }

    @GetMapping(path = "/healthz", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> healthz() {
        return Map.of(
                "status", "UP",
                "subscriptions", assistantService.listSubscriptions().size()
        );
    }
}
