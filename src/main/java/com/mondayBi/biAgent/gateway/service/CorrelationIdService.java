package com.mondayBi.biAgent.gateway.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * Hands out the id that ties together every log line of one question.
 * Ids look like {@code q-20260310T090000-1a2b3c4d}: UTC time of arrival, then 8 random hex digits,
 * so they sort by arrival when grepping logs.
 */
@Service
@RequiredArgsConstructor
public class CorrelationIdService {

    private static final DateTimeFormatter ARRIVAL = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss")
            .withZone(ZoneOffset.UTC);

    private final Clock clock;

    public String generateCorrelationId() {
        String random = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        return "q-" + ARRIVAL.format(clock.instant()) + "-" + random;
    }
}
