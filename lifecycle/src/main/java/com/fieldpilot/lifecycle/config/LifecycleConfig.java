package com.fieldpilot.lifecycle.config;

import com.fieldpilot.lifecycle.statemachine.TransitionTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Shared beans: the active transition table and the clock every component
 * reads time from (tests replace it with a fixed one).
 */
@Configuration
public class LifecycleConfig {

    private static final Logger log = LoggerFactory.getLogger(LifecycleConfig.class);

    @Bean
    public TransitionTable transitionTable() {
        TransitionTable table = TransitionTable.standard();
        log.info("Job transition table v{} loaded ({} edges)", table.version(), table.allRules().size());
        return table;
    }

    /** Zone used to turn local visit times into instants. */
    @Bean
    public Clock clock(@Value("${fieldpilot.timezone:UTC}") String zone) {
        return Clock.system(ZoneId.of(zone));
    }
}
