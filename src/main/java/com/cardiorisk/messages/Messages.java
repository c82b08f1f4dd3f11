package com.cardiorisk.messages;

import akka.actor.typed.ActorRef;
import com.cardiorisk.history.AssessmentRecord;
import com.cardiorisk.history.RiskFactorAnalysis;
import com.cardiorisk.history.RiskTrendStats;
import com.cardiorisk.history.VitalSign;
import com.cardiorisk.history.VitalSignPoint;
import com.cardiorisk.scoring.AssessmentResult;
import com.cardiorisk.scoring.PatientAssessmentInput;
import com.cardiorisk.scoring.PreconditionFailure;
import com.cardiorisk.scoring.RiskCategory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Centralized message definitions for the risk assessment actors
 */
public class Messages {

    public static String newRequestId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    // ========== ASSESSMENT MESSAGES ==========
    public interface AssessmentCommand {}

    public static class RunAssessment implements AssessmentCommand {
        public final String requestId;
        public final String patientId;
        public final PatientAssessmentInput input;
        public final ActorRef<AssessmentReply> replyTo;
        public final Instant timestamp;

        public RunAssessment(String requestId, String patientId, PatientAssessmentInput input,
                             ActorRef<AssessmentReply> replyTo) {
            this.requestId = requestId != null && !requestId.isEmpty() ? requestId : newRequestId();
            this.patientId = patientId;
            this.input = input;
            this.replyTo = replyTo;
            this.timestamp = Instant.now();
        }
    }

    public static class AssessmentReply {
        public final String requestId;
        public final String patientId;
        public final AssessmentResult result;
        public final PreconditionFailure failure;
        public final boolean success;

        private AssessmentReply(String requestId, String patientId, AssessmentResult result,
                                PreconditionFailure failure) {
            this.requestId = requestId;
            this.patientId = patientId;
            this.result = result;
            this.failure = failure;
            this.success = result != null;
        }

        public static AssessmentReply success(String requestId, String patientId, AssessmentResult result) {
            return new AssessmentReply(requestId, patientId, result, null);
        }

        public static AssessmentReply failure(String requestId, String patientId, PreconditionFailure failure) {
            return new AssessmentReply(requestId, patientId, null, failure);
        }
    }

    // ========== HISTORY MESSAGES ==========
    public interface HistoryCommand {}

    public static class RecordAssessment implements HistoryCommand {
        public final AssessmentRecord record;

        public RecordAssessment(AssessmentRecord record) {
            this.record = record;
        }
    }

    public static class GetHistory implements HistoryCommand {
        public final String patientId;
        public final ActorRef<History> replyTo;

        public GetHistory(String patientId, ActorRef<History> replyTo) {
            this.patientId = patientId;
            this.replyTo = replyTo;
        }
    }

    public static class History {
        public final String patientId;
        public final List<AssessmentRecord> records;   // oldest first

        public History(String patientId, List<AssessmentRecord> records) {
            this.patientId = patientId;
            this.records = records;
        }
    }

    public static class GetTrend implements HistoryCommand {
        public final String patientId;
        public final ActorRef<Trend> replyTo;

        public GetTrend(String patientId, ActorRef<Trend> replyTo) {
            this.patientId = patientId;
            this.replyTo = replyTo;
        }
    }

    public static class Trend {
        public final String patientId;
        public final RiskTrendStats stats;

        public Trend(String patientId, RiskTrendStats stats) {
            this.patientId = patientId;
            this.stats = stats;
        }
    }

    public static class GetCategoryDistribution implements HistoryCommand {
        public final String patientId;
        public final ActorRef<CategoryDistribution> replyTo;

        public GetCategoryDistribution(String patientId, ActorRef<CategoryDistribution> replyTo) {
            this.patientId = patientId;
            this.replyTo = replyTo;
        }
    }

    public static class CategoryDistribution {
        public final String patientId;
        public final Map<RiskCategory, Integer> counts;

        public CategoryDistribution(String patientId, Map<RiskCategory, Integer> counts) {
            this.patientId = patientId;
            this.counts = counts;
        }
    }

    public static class GetVitalSignTrends implements HistoryCommand {
        public final String patientId;
        public final ActorRef<VitalSignTrends> replyTo;

        public GetVitalSignTrends(String patientId, ActorRef<VitalSignTrends> replyTo) {
            this.patientId = patientId;
            this.replyTo = replyTo;
        }
    }

    public static class VitalSignTrends {
        public final String patientId;
        public final Map<VitalSign, List<VitalSignPoint>> series;

        public VitalSignTrends(String patientId, Map<VitalSign, List<VitalSignPoint>> series) {
            this.patientId = patientId;
            this.series = series;
        }
    }

    public static class GetRiskFactorAnalysis implements HistoryCommand {
        public final String patientId;
        public final ActorRef<RiskFactorReport> replyTo;

        public GetRiskFactorAnalysis(String patientId, ActorRef<RiskFactorReport> replyTo) {
            this.patientId = patientId;
            this.replyTo = replyTo;
        }
    }

    public static class RiskFactorReport {
        public final String patientId;
        public final RiskFactorAnalysis analysis;

        public RiskFactorReport(String patientId, RiskFactorAnalysis analysis) {
            this.patientId = patientId;
            this.analysis = analysis;
        }
    }

    // ========== LOGGING MESSAGES ==========
    public interface LogCommand {}

    public static class LogEvent implements LogCommand {
        public final String requestId;
        public final String component;
        public final String event;
        public final String level;
        public final Instant timestamp;

        public LogEvent(String requestId, String component, String event, String level) {
            this.requestId = requestId;
            this.component = component;
            this.event = event;
            this.level = level;
            this.timestamp = Instant.now();
        }
    }

    /**
     * Audit entry for a completed assessment. The logger picks the level from
     * the category.
     */
    public static class AssessmentAudit implements LogCommand {
        public final String requestId;
        public final String patientId;
        public final int likelihoodScore;
        public final int impactScore;
        public final int finalRiskScore;
        public final RiskCategory category;
        public final String recommendedAction;

        public AssessmentAudit(String requestId, String patientId, AssessmentResult result) {
            this.requestId = requestId;
            this.patientId = patientId;
            this.likelihoodScore = result.likelihoodScore;
            this.impactScore = result.impactScore;
            this.finalRiskScore = result.finalRiskScore;
            this.category = result.riskCategory;
            this.recommendedAction = result.recommendedAction;
        }
    }
}
