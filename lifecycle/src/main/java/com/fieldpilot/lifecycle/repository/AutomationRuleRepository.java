package com.fieldpilot.lifecycle.repository;

import com.fieldpilot.lifecycle.model.AutomationRule;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface AutomationRuleRepository extends JpaRepository<AutomationRule, UUID> {

    /** Rules the automation engine evaluates for one event type, in evaluation order. */
    List<AutomationRule> findByTriggerEventAndEnabledTrueOrderByPriorityAscNameAsc(String triggerEvent);

    List<AutomationRule> findAllByOrderByPriorityAscNameAsc();
}
