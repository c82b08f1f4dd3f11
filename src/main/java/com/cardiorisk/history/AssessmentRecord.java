package com.cardiorisk.history;

import com.cardiorisk.scoring.AssessmentResult;
import com.cardiorisk.scoring.PatientAssessmentInput;
import com.cardiorisk.scoring.RiskCategory;
import com.cardiorisk.scoring.RiskFactor;
import com.cardiorisk.scoring.Sex;

import java.time.Instant;
import java.util.Set;

/**
 * One stored assessment: scores, category, and the vitals and risk factors
 * the scores were computed from.
 */
public final class AssessmentRecord {
    public final String id;
    public final String patientId;
    public final Instant timestamp;
    public final int finalRiskScore;
    public final int likelihoodScore;
    public final int impactScore;
    public final RiskCategory riskCategory;
    public final String likelihoodLevel;
    public final String impactLevel;
    public final String recommendedAction;

    public final Integer systolicBP;
    public final Integer diastolicBP;
    public final Integer heartRate;
    public final Integer oxygenSaturation;
    public final Double temperature;

    public final Integer age;
    public final Sex sex;
    public final Set<RiskFactor> riskFactors;

    public AssessmentRecord(String id, String patientId, Instant timestamp,
                            PatientAssessmentInput input, AssessmentResult result) {
        this.id = id;
        this.patientId = patientId;
        this.timestamp = timestamp;
        this.finalRiskScore = result.finalRiskScore;
        this.likelihoodScore = result.likelihoodScore;
        this.impactScore = result.impactScore;
        this.riskCategory = result.riskCategory;
        this.likelihoodLevel = result.likelihoodLevel.label();
        this.impactLevel = result.impactLevel.label();
        this.recommendedAction = result.recommendedAction;
        this.systolicBP = input.systolicBP;
        this.diastolicBP = input.diastolicBP;
        this.heartRate = input.heartRate;
        this.oxygenSaturation = input.oxygenSaturation;
        this.temperature = input.temperature;
        this.age = input.age;
        this.sex = input.sex;
        this.riskFactors = input.riskFactors;
    }
}
