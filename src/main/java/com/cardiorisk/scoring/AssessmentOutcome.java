package com.cardiorisk.scoring;

/**
 * Either a result or the precondition that prevented one.
 *
 * A successful outcome also carries the input the scores were computed from,
 * after age clamping and removal of implausible vital signs.
 */
public final class AssessmentOutcome {
    public final AssessmentResult result;
    public final PatientAssessmentInput scoredInput;
    public final PreconditionFailure failure;
    public final boolean success;

    private AssessmentOutcome(AssessmentResult result, PatientAssessmentInput scoredInput,
                              PreconditionFailure failure) {
        this.result = result;
        this.scoredInput = scoredInput;
        this.failure = failure;
        this.success = result != null;
    }

    public static AssessmentOutcome success(AssessmentResult result, PatientAssessmentInput scoredInput) {
        return new AssessmentOutcome(result, scoredInput, null);
    }

    public static AssessmentOutcome failure(PreconditionFailure failure) {
        return new AssessmentOutcome(null, null, failure);
    }
}
