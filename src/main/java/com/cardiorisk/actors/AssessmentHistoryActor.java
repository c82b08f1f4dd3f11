package com.cardiorisk.actors;

import akka.actor.typed.*;
import akka.actor.typed.javadsl.*;
import com.cardiorisk.history.AssessmentRecord;
import com.cardiorisk.history.HistoryAnalytics;
import com.cardiorisk.history.RiskTrendStats;
import com.cardiorisk.history.TrendAnalyzer;
import com.cardiorisk.messages.Messages.*;

import java.util.*;

/**
 * AssessmentHistoryActor - In-memory assessment history per patient.
 * Keeps the most recent records up to a fixed limit and answers history,
 * trend and chart queries.
 */
public class AssessmentHistoryActor extends AbstractBehavior<HistoryCommand> {

    private final Map<String, List<AssessmentRecord>> historyByPatient;
    private final ActorRef<LogCommand> logger;
    private final TrendAnalyzer trendAnalyzer;
    private final HistoryAnalytics analytics;
    private final int maxRecordsPerPatient;

    public static Behavior<HistoryCommand> create(ActorRef<LogCommand> logger, int maxRecordsPerPatient) {
        return Behaviors.setup(context -> new AssessmentHistoryActor(context, logger, maxRecordsPerPatient));
    }

    private AssessmentHistoryActor(ActorContext<HistoryCommand> context, ActorRef<LogCommand> logger,
                                   int maxRecordsPerPatient) {
        super(context);
        this.historyByPatient = new HashMap<>();
        this.logger = logger;
        this.trendAnalyzer = new TrendAnalyzer();
        this.analytics = new HistoryAnalytics();
        this.maxRecordsPerPatient = maxRecordsPerPatient;

        getContext().getLog().info("AssessmentHistoryActor initialized (limit {} per patient)", maxRecordsPerPatient);
    }

    @Override
    public Receive<HistoryCommand> createReceive() {
        return newReceiveBuilder()
                .onMessage(RecordAssessment.class, this::onRecordAssessment)
                .onMessage(GetHistory.class, this::onGetHistory)
                .onMessage(GetTrend.class, this::onGetTrend)
                .onMessage(GetCategoryDistribution.class, this::onGetCategoryDistribution)
                .onMessage(GetVitalSignTrends.class, this::onGetVitalSignTrends)
                .onMessage(GetRiskFactorAnalysis.class, this::onGetRiskFactorAnalysis)
                .build();
    }

    private Behavior<HistoryCommand> onRecordAssessment(RecordAssessment msg) {
        AssessmentRecord record = msg.record;
        getContext().getLog().debug("Recording assessment {} for patient [{}]", record.id, record.patientId);

        List<AssessmentRecord> history = historyByPatient.computeIfAbsent(record.patientId, k -> new ArrayList<>());
        history.add(record);

        while (history.size() > maxRecordsPerPatient) {
            history.remove(0);
        }

        logger.tell(new LogEvent(record.id, "AssessmentHistoryActor",
            "Recorded assessment for patient " + record.patientId + ", total: " + history.size(), "DEBUG"));

        return this;
    }

    private Behavior<HistoryCommand> onGetHistory(GetHistory msg) {
        List<AssessmentRecord> copy = List.copyOf(
            historyByPatient.getOrDefault(msg.patientId, Collections.emptyList()));
        msg.replyTo.tell(new History(msg.patientId, copy));

        logger.tell(new LogEvent("HISTORY", "AssessmentHistoryActor",
            "History retrieved for patient " + msg.patientId + ": " + copy.size() + " records", "DEBUG"));
        return this;
    }

    private Behavior<HistoryCommand> onGetTrend(GetTrend msg) {
        RiskTrendStats stats = trendAnalyzer.analyze(historyOf(msg.patientId));
        msg.replyTo.tell(new Trend(msg.patientId, stats));
        return this;
    }

    private Behavior<HistoryCommand> onGetCategoryDistribution(GetCategoryDistribution msg) {
        msg.replyTo.tell(new CategoryDistribution(msg.patientId,
            analytics.categoryDistribution(historyOf(msg.patientId))));
        return this;
    }

    private Behavior<HistoryCommand> onGetVitalSignTrends(GetVitalSignTrends msg) {
        msg.replyTo.tell(new VitalSignTrends(msg.patientId, analytics.vitalSignTrends(historyOf(msg.patientId))));
        return this;
    }

    private Behavior<HistoryCommand> onGetRiskFactorAnalysis(GetRiskFactorAnalysis msg) {
        msg.replyTo.tell(new RiskFactorReport(msg.patientId, analytics.riskFactorAnalysis(historyOf(msg.patientId))));
        return this;
    }

    private List<AssessmentRecord> historyOf(String patientId) {
        return historyByPatient.getOrDefault(patientId, Collections.emptyList());
    }
}
