package com.givebridge.payment.controller;

import com.givebridge.common.dto.ApiResponse;
import com.givebridge.common.outbox.OutboxRelay;
import com.givebridge.common.outbox.OutboxService;
import com.givebridge.payment.dto.OutboxEventResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Operator endpoints for the outbox: force a sweep, list cancelled events that need manual
 * redelivery.
 */
@Slf4j
@RestController
@RequestMapping("/api/admin/outbox")
@RequiredArgsConstructor
public class OutboxAdminController {

    private final OutboxRelay outboxRelay;
    private final OutboxService outboxService;

    @PostMapping("/process")
    public ApiResponse<Integer> process() {
        int delivered = outboxRelay.sweep();
        log.info("Manual outbox sweep: delivered={}", delivered);
        return ApiResponse.ok(delivered, "Outbox sweep finished");
    }

    @GetMapping("/cancelled")
    public ApiResponse<List<OutboxEventResponse>> cancelled(@RequestParam(defaultValue = "50") int limit) {
        return ApiResponse.ok(outboxService.findCancelled(limit).stream()
                .map(OutboxEventResponse::from)
                .toList());
    }
}
