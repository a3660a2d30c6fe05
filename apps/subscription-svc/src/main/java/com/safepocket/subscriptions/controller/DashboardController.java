package com.safepocket.subscriptions.controller;

import com.safepocket.subscriptions.controller.dto.DashboardResponseDto;
import com.safepocket.subscriptions.model.DashboardSummary;
import com.safepocket.subscriptions.web.RequestContextHolder;
import com.safepocket.subscriptions.service.SubscriptionAssistantService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/dashboard")
public class DashboardController {

    private final SubscriptionAssistantService assistantService;

    public DashboardController(SubscriptionAssistantService assistantService) {
        this.assistantService = assistantService;
    }

    @GetMapping
    public ResponseEntity<DashboardResponseDto> getDashboard(
            @RequestParam(value = "horizonDays", required = false) Integer horizonDays
    ) {
        DashboardSummary summary = horizonDays == null
                ? assistantService.dashboard()
                : assistantService.dashboard(horizonDays);
        String traceId = RequestContextHolder.get().map(RequestContextHolder.RequestContext::traceId).orElse(null);
        return ResponseEntity.ok(new DashboardResponseDto(
                summary.activeSubscriptions(),
                summary.cancelledSubscriptions(),
                summary.monthlyCommitment(),
                summary.totalSavings(),
                SubscriptionMapper.toDtos(summary.upcomingRenewals()),
                traceId
        ));
    }
}
