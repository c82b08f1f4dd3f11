package com.cardiorisk.actors;

import akka.actor.typed.*;
import akka.actor.typed.javadsl.*;
import com.cardiorisk.history.AssessmentRecord;
import com.cardiorisk.messages.Messages.*;
import com.cardiorisk.scoring.AssessmentOutcome;
import com.cardiorisk.scoring.AssessmentResult;
import com.cardiorisk.scoring.RiskAssessmentEngine;

/**
 * AssessmentActor - Runs the risk engine for each request.
 * Replies to the caller, hands successful results to the history store and
 * sends an audit entry to the logger.
 */
public class AssessmentActor extends AbstractBehavior<AssessmentCommand> {

    private final RiskAssessmentEngine engine;
    private final ActorRef<HistoryCommand> history;
    private final ActorRef<LogCommand> logger;

    public static Behavior<AssessmentCommand> create(RiskAssessmentEngine engine,
                                                     ActorRef<HistoryCommand> history,
                                                     ActorRef<LogCommand> logger) {
        return Behaviors.setup(context -> new AssessmentActor(context, engine, history, logger));
    }

    private AssessmentActor(ActorContext<AssessmentCommand> context,
                            RiskAssessmentEngine engine,
                            ActorRef<HistoryCommand> history,
                            ActorRef<LogCommand> logger) {
        super(context);
        this.engine = engine;
        this.history = history;
        this.logger = logger;

        getContext().getLog().info("AssessmentActor initialized, missing demographics policy: {}",
            engine.demographicsPolicy());
    }

    @Override
    public Receive<AssessmentCommand> createReceive() {
        return newReceiveBuilder()
                .onMessage(RunAssessment.class, this::onRunAssessment)
                .build();
    }

    private Behavior<AssessmentCommand> onRunAssessment(RunAssessment msg) {
        getContext().getLog().debug("Assessing request [{}] for patient [{}]: {}",
            msg.requestId, msg.patientId, msg.input);

        AssessmentOutcome outcome = engine.assess(msg.input);

        if (!outcome.success) {
            logger.tell(new LogEvent(msg.requestId, "AssessmentActor",
                "Assessment rejected: " + outcome.failure.message, "WARNING"));
            msg.replyTo.tell(AssessmentReply.failure(msg.requestId, msg.patientId, outcome.failure));
            return this;
        }

        AssessmentResult result = outcome.result;
        logger.tell(new AssessmentAudit(msg.requestId, msg.patientId, result));

        // Stored vitals must be the ones the scores were computed from
        if (msg.patientId != null && !msg.patientId.isBlank()) {
            history.tell(new RecordAssessment(
                new AssessmentRecord(msg.requestId, msg.patientId, msg.timestamp, outcome.scoredInput, result)));
        }

        msg.replyTo.tell(AssessmentReply.success(msg.requestId, msg.patientId, result));
        return this;
    }
}
