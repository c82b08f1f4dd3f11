package com.cardiorisk;

import akka.actor.typed.*;
import akka.actor.typed.javadsl.*;
import com.cardiorisk.actors.*;
import com.cardiorisk.config.AssessmentConfig;
import com.cardiorisk.http.HttpServer;
import com.cardiorisk.messages.Messages.*;
import com.cardiorisk.scoring.RiskAssessmentEngine;

/**
 * Cardiovascular risk triage service.
 * Starts the actor system and the HTTP interface.
 */
public class Main {

    public static void main(String[] args) {
        AssessmentConfig config = new AssessmentConfig();

        ActorSystem<Void> system = ActorSystem.create(createBehavior(config), "CardioRiskSystem");
        system.getWhenTerminated().toCompletableFuture().join();
    }

    public static Behavior<Void> createBehavior(AssessmentConfig config) {
        return Behaviors.setup(context -> {
            context.getLog().info("Initializing cardiovascular risk service: {}", config);

            ActorRef<LogCommand> loggerRef = context.spawn(LoggerActor.create(), "logger");

            ActorRef<HistoryCommand> historyActor = context.spawn(
                AssessmentHistoryActor.create(loggerRef, config.historyLimit), "assessment-history");

            RiskAssessmentEngine engine = new RiskAssessmentEngine(config.demographicsPolicy());
            ActorRef<AssessmentCommand> assessmentActor = context.spawn(
                AssessmentActor.create(engine, historyActor, loggerRef), "assessment");

            loggerRef.tell(new LogEvent("SYSTEM", "Main", "All actors initialized", "INFO"));

            ActorSystem<Void> system = context.getSystem();
            HttpServer httpServer = new HttpServer(system, assessmentActor, historyActor, config.askTimeout);
            httpServer.start(config.httpHost, config.httpPort)
                .whenComplete((binding, throwable) -> {
                    if (throwable == null) {
                        loggerRef.tell(new LogEvent("SYSTEM", "HttpServer",
                            "Listening on http://" + config.httpHost + ":" + config.httpPort, "INFO"));
                    } else {
                        system.log().error("HTTP server failed to start, shutting down", throwable);
                        system.terminate();
                    }
                });

            return Behaviors.empty();
        });
    }
}
