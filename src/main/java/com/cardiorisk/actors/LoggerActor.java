package com.cardiorisk.actors;

import akka.actor.typed.*;
import akka.actor.typed.javadsl.*;
import com.cardiorisk.messages.Messages.*;
import com.cardiorisk.scoring.RiskCategory;
import org.slf4j.Logger;
import org.slf4j.MDC;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * LoggerActor - Audit log for the assessment service.
 *
 * Component events are written at their declared level. Assessment audits
 * carry the request, patient and category as MDC fields (requestId,
 * patientId, riskCategory) and are logged at a level chosen by category:
 * HIGH at WARN, CRITICAL at ERROR, everything else at INFO.
 */
public class LoggerActor extends AbstractBehavior<LogCommand> {

    private final Map<RiskCategory, Integer> auditedByCategory = new EnumMap<>(RiskCategory.class);

    public static Behavior<LogCommand> create() {
        return Behaviors.setup(LoggerActor::new);
    }

    private LoggerActor(ActorContext<LogCommand> context) {
        super(context);
        getContext().getLog().info("LoggerActor initialized");
    }

    @Override
    public Receive<LogCommand> createReceive() {
        return newReceiveBuilder()
                .onMessage(LogEvent.class, this::onLogEvent)
                .onMessage(AssessmentAudit.class, this::onAssessmentAudit)
                .build();
    }

    private Behavior<LogCommand> onLogEvent(LogEvent msg) {
        Logger log = getContext().getLog();
        String level = msg.level != null ? msg.level.toUpperCase(Locale.ROOT) : "INFO";

        MDC.put("requestId", msg.requestId);
        try {
            switch (level) {
                case "ERROR":
                case "CRITICAL":
                    log.error("{}: {}", msg.component, msg.event);
                    break;
                case "WARNING":
                case "WARN":
                    log.warn("{}: {}", msg.component, msg.event);
                    break;
                case "DEBUG":
                    log.debug("{}: {}", msg.component, msg.event);
                    break;
                default:
                    log.info("{}: {}", msg.component, msg.event);
            }
        } finally {
            MDC.remove("requestId");
        }
        return this;
    }

    private Behavior<LogCommand> onAssessmentAudit(AssessmentAudit msg) {
        Logger log = getContext().getLog();
        int seen = auditedByCategory.merge(msg.category, 1, Integer::sum);

        MDC.put("requestId", msg.requestId);
        MDC.put("patientId", msg.patientId != null ? msg.patientId : "-");
        MDC.put("riskCategory", msg.category.name());
        try {
            String pattern = "Likelihood {} x Impact {} = {} ({}), {} [#{} in category]";
            Object[] args = {msg.likelihoodScore, msg.impactScore, msg.finalRiskScore,
                msg.category.label(), msg.recommendedAction, seen};
            switch (msg.category) {
                case CRITICAL:
                    log.error(pattern, args);
                    break;
                case HIGH:
                    log.warn(pattern, args);
                    break;
                default:
                    log.info(pattern, args);
            }
        } finally {
            MDC.remove("requestId");
            MDC.remove("patientId");
            MDC.remove("riskCategory");
        }
        return this;
    }
}
