package com.fieldpilot.lifecycle.api;

import com.fieldpilot.lifecycle.api.dto.RuleRequest;
import com.fieldpilot.lifecycle.api.dto.RuleResponse;
import com.fieldpilot.lifecycle.api.dto.RunResponse;
import com.fieldpilot.lifecycle.automation.AutomationAdminService;
import com.fieldpilot.lifecycle.model.AutomationRule;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;

/**
 * Admin API for automation rules and their run log.
 *
 * GET/POST          /automation/rules
 * GET/PUT/DELETE    /automation/rules/{id}
 * POST              /automation/rules/{id}/enable | /disable
 * GET               /automation/runs?jobId=&eventId=
 */
@RestController
@RequestMapping("/automation")
public class AutomationRuleController {

    private final AutomationAdminService admin;

    public AutomationRuleController(AutomationAdminService admin) {
        this.admin = admin;
    }

    @GetMapping("/rules")
    public List<RuleResponse> rules() {
        return admin.rules().stream().map(this::toResponse).toList();
    }

    @PostMapping("/rules")
    public ResponseEntity<RuleResponse> create(@RequestBody RuleRequest req) {
        AutomationRule rule = admin.create(req.toDefinition());
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(rule));
    }

    @GetMapping("/rules/{id}")
    public RuleResponse rule(@PathVariable UUID id) {
        return admin.rule(id)
                .map(this::toResponse)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Rule not found: " + id));
    }

    @PutMapping("/rules/{id}")
    public RuleResponse update(@PathVariable UUID id, @RequestBody RuleRequest req) {
        return toResponse(admin.update(id, req.toDefinition()));
    }

    @DeleteMapping("/rules/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        admin.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/rules/{id}/enable")
    public RuleResponse enable(@PathVariable UUID id) {
        return toResponse(admin.setEnabled(id, true));
    }

    @PostMapping("/rules/{id}/disable")
    public RuleResponse disable(@PathVariable UUID id) {
        return toResponse(admin.setEnabled(id, false));
    }

    @GetMapping("/runs")
    public List<RunResponse> runs(@RequestParam(required = false) UUID jobId,
                                  @RequestParam(required = false) UUID eventId) {
        return admin.runs(jobId, eventId).stream()
                .map(run -> RunResponse.from(run, admin.outcomesOf(run)))
                .toList();
    }

    private RuleResponse toResponse(AutomationRule rule) {
        return RuleResponse.from(rule, admin.conditionsOf(rule), admin.actionsOf(rule));
    }
}
