package com.fieldpilot.lifecycle.api.dto;

import java.util.List;
import java.util.UUID;

public record AllowedTransitionsResponse(UUID jobId, String currentState, List<String> allowed, String tableVersion) {}
