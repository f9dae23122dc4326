package com.github.dimitryivaniuta.cmdb.resource;

import com.github.dimitryivaniuta.cmdb.audit.AuditTrail;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Collaborators every resource service needs, bundled so subclasses take two constructor arguments.
 */
@Component
@RequiredArgsConstructor
public class ResourceServiceSupport {

    private final Validator validator;
    private final AuditTrail audit;
    private final ApplicationEventPublisher events;
    private final Clock clock;

    Validator validator() {
        return validator;
    }

    AuditTrail audit() {
        return audit;
    }

    ApplicationEventPublisher events() {
        return events;
    }

    public Clock clock() {
        return clock;
    }
}
