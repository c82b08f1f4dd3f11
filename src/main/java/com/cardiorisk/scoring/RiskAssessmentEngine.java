package com.cardiorisk.scoring;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Entry point of the risk engine.
 *
 * Checks that age and sex are present, discards implausible vital signs,
 * scores likelihood and impact, classifies the product and builds the
 * recommendations. Holds no mutable state and may be shared between
 * threads.
 */
public class RiskAssessmentEngine {

    private static final Logger log = LoggerFactory.getLogger(RiskAssessmentEngine.class);

    private final LikelihoodScorer likelihoodScorer;
    private final ImpactScorer impactScorer;
    private final RiskClassifier classifier;
    private final RecommendationGenerator recommendationGenerator;
    private final MissingDemographicsPolicy demographicsPolicy;

    public RiskAssessmentEngine() {
        this(MissingDemographicsPolicy.REJECT);
    }

    public RiskAssessmentEngine(MissingDemographicsPolicy demographicsPolicy) {
        this(new LikelihoodScorer(), new ImpactScorer(), new RiskClassifier(),
            new RecommendationGenerator(), demographicsPolicy);
    }

    public RiskAssessmentEngine(LikelihoodScorer likelihoodScorer,
                                ImpactScorer impactScorer,
                                RiskClassifier classifier,
                                RecommendationGenerator recommendationGenerator,
                                MissingDemographicsPolicy demographicsPolicy) {
        this.likelihoodScorer = likelihoodScorer;
        this.impactScorer = impactScorer;
        this.classifier = classifier;
        this.recommendationGenerator = recommendationGenerator;
        this.demographicsPolicy = demographicsPolicy;
    }

    public MissingDemographicsPolicy demographicsPolicy() {
        return demographicsPolicy;
    }

    public AssessmentOutcome assess(PatientAssessmentInput input) {
        Objects.requireNonNull(input, "input");

        List<String> missing = new ArrayList<>();
        if (input.age == null) missing.add("age");
        if (input.sex == null) missing.add("sex");
        if (!missing.isEmpty() && demographicsPolicy == MissingDemographicsPolicy.REJECT) {
            log.debug("Rejecting assessment, missing {}", missing);
            return AssessmentOutcome.failure(new PreconditionFailure(missing));
        }

        PatientAssessmentInput sanitized = sanitize(input);

        LikelihoodLevel likelihood = likelihoodScorer.score(sanitized);
        ImpactLevel impact = impactScorer.score(sanitized);
        RiskClassification classification = classifier.classify(likelihood, impact);
        RecommendationPlan plan = recommendationGenerator.generate(classification, sanitized);

        log.debug("Assessed likelihood={} impact={} final={} category={}",
            likelihood.score(), impact.score(), classification.finalRiskScore, classification.category);
        return AssessmentOutcome.success(new AssessmentResult(classification, plan), sanitized);
    }

    /**
     * Clamps age into range and drops vital signs outside plausible bounds.
     * Missing age under the legacy policy becomes 0.
     */
    PatientAssessmentInput sanitize(PatientAssessmentInput input) {
        PatientAssessmentInput.Builder b = input.toBuilder();

        int age = input.age != null ? input.age : 0;
        int clamped = VitalSignBounds.clampAge(age);
        if (clamped != age) {
            log.warn("Age {} outside [{}, {}], clamped to {}", age,
                VitalSignBounds.MIN_AGE, VitalSignBounds.MAX_AGE, clamped);
        }
        b.age(clamped);

        if (input.systolicBP != null && !VitalSignBounds.plausibleSystolic(input.systolicBP)) {
            log.warn("Ignoring implausible systolic BP {}", input.systolicBP);
            b.systolicBP(null);
        }
        if (input.diastolicBP != null && !VitalSignBounds.plausibleDiastolic(input.diastolicBP)) {
            log.warn("Ignoring implausible diastolic BP {}", input.diastolicBP);
            b.diastolicBP(null);
        }
        if (input.heartRate != null && !VitalSignBounds.plausibleHeartRate(input.heartRate)) {
            log.warn("Ignoring implausible heart rate {}", input.heartRate);
            b.heartRate(null);
        }
        if (input.oxygenSaturation != null && !VitalSignBounds.plausibleOxygenSaturation(input.oxygenSaturation)) {
            log.warn("Ignoring implausible oxygen saturation {}", input.oxygenSaturation);
            b.oxygenSaturation(null);
        }
        if (input.temperature != null && !VitalSignBounds.plausibleTemperature(input.temperature)) {
            log.warn("Ignoring implausible temperature {}", input.temperature);
            b.temperature(null);
        }
        return b.build();
    }
}
