package com.givebridge.payment.dto;

import java.time.LocalDateTime;
import java.util.List;

public record ServiceInfoResponse(
        String service,
        String version,
        String description,
        List<String> features,
        LocalDateTime timestamp
) {
}
