package com.fieldpilot.lifecycle.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fieldpilot.lifecycle.service.NewJob;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Request body for POST /jobs.
 *
 * Required: clientId, title
 * Optional: scheduling window, crew and the quote's cost payload
 *   ({"lineItems":[{"description":..,"price":..,"quantity":..}]}), kept as JSON.
 */
public record OpenJobRequest(UUID clientId, UUID propertyId, String title,
                             Instant scheduledStart, Instant scheduledEnd,
                             List<String> assignedCrew, JsonNode costPayload) {

    public NewJob toNewJob() {
        String payload = costPayload == null || costPayload.isNull() ? null : costPayload.toString();
        return new NewJob(clientId, propertyId, title, scheduledStart, scheduledEnd, assignedCrew, payload);
    }
}
