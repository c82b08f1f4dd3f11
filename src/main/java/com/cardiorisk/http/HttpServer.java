package com.cardiorisk.http;

import akka.actor.typed.ActorRef;
import akka.actor.typed.ActorSystem;
import akka.actor.typed.javadsl.AskPattern;
import akka.http.javadsl.Http;
import akka.http.javadsl.ServerBinding;
import akka.http.javadsl.marshallers.jackson.Jackson;
import akka.http.javadsl.model.StatusCodes;
import akka.http.javadsl.server.AllDirectives;
import akka.http.javadsl.server.PathMatchers;
import akka.http.javadsl.server.Route;
import com.cardiorisk.http.ApiModels.*;
import com.cardiorisk.messages.Messages;
import com.cardiorisk.messages.Messages.*;
import com.cardiorisk.scoring.PatientAssessmentInput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * HttpServer - JSON endpoints in front of the assessment and history actors.
 * History routes: /api/history/{id}[/trend|/distribution|/vitals|/risk-factors]
 */
public class HttpServer extends AllDirectives {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final ActorSystem<?> system;
    private final ActorRef<AssessmentCommand> assessmentActor;
    private final ActorRef<HistoryCommand> historyActor;
    private final Duration askTimeout;

    public HttpServer(ActorSystem<?> system,
                      ActorRef<AssessmentCommand> assessmentActor,
                      ActorRef<HistoryCommand> historyActor,
                      Duration askTimeout) {
        this.system = system;
        this.assessmentActor = assessmentActor;
        this.historyActor = historyActor;
        this.askTimeout = askTimeout;
    }

    public Route createRoutes() {
        return concat(
            path("health", () ->
                get(() -> complete(StatusCodes.OK, "Risk assessment service is up"))
            ),

            pathPrefix("api", () -> concat(
                path("assessment", () ->
                    post(() ->
                        entity(Jackson.unmarshaller(AssessmentRequest.class), this::handleAssessment)
                    )
                ),

                pathPrefix("history", () ->
                    pathPrefix(PathMatchers.segment(), patientId -> concat(
                        pathEndOrSingleSlash(() -> get(() -> handleHistory(patientId))),
                        path("trend", () -> get(() -> handleTrend(patientId))),
                        path("distribution", () -> get(() -> handleDistribution(patientId))),
                        path("vitals", () -> get(() -> handleVitalSignTrends(patientId))),
                        path("risk-factors", () -> get(() -> handleRiskFactors(patientId)))
                    ))
                )
            ))
        );
    }

    private Route handleAssessment(AssessmentRequest request) {
        PatientAssessmentInput input;
        try {
            input = request.toInput();
        } catch (IllegalArgumentException e) {
            log.info("Rejected assessment request: {}", e.getMessage());
            return complete(StatusCodes.BAD_REQUEST, new ErrorResponse(e.getMessage(), List.of()), Jackson.marshaller());
        }

        String requestId = Messages.newRequestId();
        CompletionStage<AssessmentReply> reply = AskPattern.ask(
            assessmentActor,
            replyTo -> new RunAssessment(requestId, request.patientId, input, replyTo),
            askTimeout,
            system.scheduler()
        );

        return onComplete(reply, result -> {
            if (result.isFailure()) {
                log.error("Assessment [{}] failed", requestId, result.failed().get());
                return complete(StatusCodes.INTERNAL_SERVER_ERROR,
                    new ErrorResponse("Assessment temporarily unavailable", List.of()), Jackson.marshaller());
            }
            AssessmentReply assessment = result.get();
            if (!assessment.success) {
                return complete(StatusCodes.BAD_REQUEST,
                    new ErrorResponse(assessment.failure.message, assessment.failure.missingFields),
                    Jackson.marshaller());
            }
            return completeOK(new AssessmentResponse(assessment.requestId, assessment.patientId, assessment.result),
                Jackson.marshaller());
        });
    }

    private Route handleHistory(String patientId) {
        return askHistory(patientId, "History", replyTo -> new GetHistory(patientId, replyTo),
            (History history) -> new HistoryResponse(patientId, history.records));
    }

    private Route handleTrend(String patientId) {
        return askHistory(patientId, "Trend", replyTo -> new GetTrend(patientId, replyTo),
            (Trend trend) -> new TrendResponse(patientId, trend.stats));
    }

    private Route handleDistribution(String patientId) {
        return askHistory(patientId, "Distribution", replyTo -> new GetCategoryDistribution(patientId, replyTo),
            (CategoryDistribution distribution) -> new DistributionResponse(patientId, distribution.counts));
    }

    private Route handleVitalSignTrends(String patientId) {
        return askHistory(patientId, "Vital sign trends", replyTo -> new GetVitalSignTrends(patientId, replyTo),
            (VitalSignTrends trends) -> new VitalSignTrendsResponse(patientId, trends.series));
    }

    private Route handleRiskFactors(String patientId) {
        return askHistory(patientId, "Risk factor analysis", replyTo -> new GetRiskFactorAnalysis(patientId, replyTo),
            (RiskFactorReport report) -> new RiskFactorAnalysisResponse(patientId, report.analysis));
    }

    private <T> Route askHistory(String patientId, String what,
                                 Function<ActorRef<T>, HistoryCommand> query,
                                 Function<T, Object> toResponse) {
        CompletionStage<T> reply = AskPattern.ask(historyActor, query::apply, askTimeout, system.scheduler());
        return onComplete(reply, result -> {
            if (result.isFailure()) {
                log.error("{} lookup for patient [{}] failed", what, patientId, result.failed().get());
                return complete(StatusCodes.INTERNAL_SERVER_ERROR,
                    new ErrorResponse(what + " temporarily unavailable", List.of()), Jackson.marshaller());
            }
            return completeOK(toResponse.apply(result.get()), Jackson.marshaller());
        });
    }

    public CompletionStage<ServerBinding> start(String host, int port) {
        return Http.get(system).newServerAt(host, port).bind(createRoutes())
            .thenApply(binding -> {
                log.info("HTTP server listening on http://{}:{}", host, port);
                return binding;
            });
    }
}
