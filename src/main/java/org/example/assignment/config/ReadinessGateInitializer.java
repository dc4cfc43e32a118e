package org.example.assignment.config;

import org.example.assignment.service.gate.ReadinessGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
public class ReadinessGateInitializer {

    private static final Logger log = LoggerFactory.getLogger(ReadinessGateInitializer.class);

    private final ReadinessGate readinessGate;

    public ReadinessGateInitializer(ReadinessGate readinessGate) {
        this.readinessGate = readinessGate;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void connectOnStartup() {
        if (!readinessGate.start()) {
            log.info("Backend connection already in progress at startup");
        }
    }
}
