package com.cardiorisk.actors;

import akka.actor.testkit.typed.javadsl.ActorTestKit;
import akka.actor.testkit.typed.javadsl.TestProbe;
import akka.actor.typed.ActorRef;
import com.cardiorisk.history.AssessmentRecord;
import com.cardiorisk.messages.Messages.*;
import com.cardiorisk.scoring.BreathlessnessLevel;
import com.cardiorisk.scoring.ChestPainType;
import com.cardiorisk.scoring.PatientAssessmentInput;
import com.cardiorisk.scoring.RiskAssessmentEngine;
import com.cardiorisk.scoring.RiskCategory;
import com.cardiorisk.scoring.Sex;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class AssessmentActorTest {

    private static final ActorTestKit testKit = ActorTestKit.create();

    private TestProbe<HistoryCommand> history;
    private TestProbe<LogCommand> logger;
    private TestProbe<AssessmentReply> replies;
    private ActorRef<AssessmentCommand> actor;

    @AfterAll
    static void shutdown() {
        testKit.shutdownTestKit();
    }

    @BeforeEach
    void setUp() {
        history = testKit.createTestProbe(HistoryCommand.class);
        logger = testKit.createTestProbe(LogCommand.class);
        replies = testKit.createTestProbe(AssessmentReply.class);
        actor = testKit.spawn(AssessmentActor.create(new RiskAssessmentEngine(), history.getRef(), logger.getRef()));
    }

    @Test
    void repliesWithResultAndRecordsHistory() {
        PatientAssessmentInput input = PatientAssessmentInput.builder().age(45).sex(Sex.MALE).build();

        actor.tell(new RunAssessment("req-1", "patient-7", input, replies.getRef()));

        AssessmentReply reply = replies.receiveMessage();
        assertThat(reply.success).isTrue();
        assertThat(reply.requestId).isEqualTo("req-1");
        assertThat(reply.patientId).isEqualTo("patient-7");
        assertThat(reply.result.riskCategory).isEqualTo(RiskCategory.LOW);

        RecordAssessment recorded = history.expectMessageClass(RecordAssessment.class);
        assertThat(recorded.record.id).isEqualTo("req-1");
        assertThat(recorded.record.patientId).isEqualTo("patient-7");
        assertThat(recorded.record.finalRiskScore).isEqualTo(1);

        AssessmentAudit audit = logger.expectMessageClass(AssessmentAudit.class);
        assertThat(audit.requestId).isEqualTo("req-1");
        assertThat(audit.patientId).isEqualTo("patient-7");
        assertThat(audit.category).isEqualTo(RiskCategory.LOW);
    }

    @Test
    void historyStoresTheVitalsTheScoresWereComputedFrom() {
        PatientAssessmentInput input = PatientAssessmentInput.builder()
            .age(150).sex(Sex.MALE)
            .systolicBP(400).heartRate(10).oxygenSaturation(97)
            .build();

        actor.tell(new RunAssessment("req-4", "patient-8", input, replies.getRef()));

        AssessmentReply reply = replies.receiveMessage();
        assertThat(reply.result.impactScore).isEqualTo(1);

        AssessmentRecord record = history.expectMessageClass(RecordAssessment.class).record;
        assertThat(record.age).isEqualTo(120);
        assertThat(record.systolicBP).isNull();
        assertThat(record.heartRate).isNull();
        assertThat(record.oxygenSaturation).isEqualTo(97);
    }

    @Test
    void missingDemographicsAreRejectedWithoutHistory() {
        PatientAssessmentInput input = PatientAssessmentInput.builder().sex(Sex.FEMALE).build();

        actor.tell(new RunAssessment("req-2", "patient-7", input, replies.getRef()));

        AssessmentReply reply = replies.receiveMessage();
        assertThat(reply.success).isFalse();
        assertThat(reply.result).isNull();
        assertThat(reply.failure.missingFields).containsExactly("age");

        assertThat(logger.expectMessageClass(LogEvent.class).level).isEqualTo("WARNING");
        history.expectNoMessage(Duration.ofMillis(200));
    }

    @Test
    void anonymousAssessmentIsNotStored() {
        PatientAssessmentInput input = PatientAssessmentInput.builder().age(30).sex(Sex.FEMALE).build();

        actor.tell(new RunAssessment(null, null, input, replies.getRef()));

        AssessmentReply reply = replies.receiveMessage();
        assertThat(reply.success).isTrue();
        assertThat(reply.requestId).isNotBlank();
        history.expectNoMessage(Duration.ofMillis(200));
    }

    @Test
    void criticalResultIsAuditedWithItsCategory() {
        PatientAssessmentInput input = PatientAssessmentInput.builder()
            .age(60).sex(Sex.MALE)
            .chestPainType(ChestPainType.TYPICAL)
            .chestPainExertional(true)
            .shortnessOfBreathLevel(BreathlessnessLevel.SEVERE)
            .syncope(true)
            .systolicBP(190).oxygenSaturation(88)
            .build();

        actor.tell(new RunAssessment("req-3", "patient-9", input, replies.getRef()));

        assertThat(replies.receiveMessage().result.riskCategory).isEqualTo(RiskCategory.CRITICAL);
        AssessmentAudit audit = logger.expectMessageClass(AssessmentAudit.class);
        assertThat(audit.category).isEqualTo(RiskCategory.CRITICAL);
        assertThat(audit.finalRiskScore).isEqualTo(25);
    }
}
