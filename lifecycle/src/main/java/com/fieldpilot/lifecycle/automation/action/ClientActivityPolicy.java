package com.fieldpilot.lifecycle.automation.action;

import java.util.UUID;

/**
 * Decides whether a client still counts as active once one of its jobs is
 * cancelled. Swappable because "active" is a business call (same client
 * only, or the whole account, open quotes, ...).
 */
public interface ClientActivityPolicy {

    boolean hasOtherActiveWork(UUID clientId, UUID cancelledJobId);
}
