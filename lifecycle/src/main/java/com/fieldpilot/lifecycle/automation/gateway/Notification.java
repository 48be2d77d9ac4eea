package com.fieldpilot.lifecycle.automation.gateway;

import java.util.Map;
import java.util.UUID;

/**
 * @param channel  "email", "sms" or "in_app"
 * @param audience "client", "crew" or "office"
 * @param template template key resolved by the messaging module
 */
public record Notification(UUID jobId, String channel, String audience, String template, Map<String, Object> data) {}
