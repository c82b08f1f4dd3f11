package com.cardiorisk.scoring;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Patient data for a single assessment.
 *
 * Age and sex are required by the engine but nullable here so that an
 * incomplete form can still be passed in and rejected with a precondition
 * failure. Vital signs are null when not measured.
 */
public final class PatientAssessmentInput {

    // Demographics
    public final Integer age;
    public final Sex sex;

    // Chest pain
    public final ChestPainType chestPainType;
    public final Integer chestPainDurationMinutes;
    public final boolean chestPainRadiation;
    public final boolean chestPainExertional;

    // Other symptoms
    public final BreathlessnessLevel shortnessOfBreathLevel;
    public final boolean palpitations;
    public final boolean syncope;
    public final boolean fainting;
    public final boolean neurologicalSymptoms;
    public final boolean legSwelling;
    public final boolean sweating;
    public final boolean dizziness;
    public final boolean nausea;

    // Vital signs
    public final Integer systolicBP;
    public final Integer diastolicBP;
    public final Integer heartRate;
    public final Integer oxygenSaturation;
    public final Double temperature;

    public final Set<RiskFactor> riskFactors;

    private PatientAssessmentInput(Builder b) {
        this.age = b.age;
        this.sex = b.sex;
        this.chestPainType = b.chestPainType != null ? b.chestPainType : ChestPainType.NONE;
        this.chestPainDurationMinutes = b.chestPainDurationMinutes;
        this.chestPainRadiation = b.chestPainRadiation;
        this.chestPainExertional = b.chestPainExertional;
        this.shortnessOfBreathLevel = b.shortnessOfBreathLevel != null
            ? b.shortnessOfBreathLevel : BreathlessnessLevel.NONE;
        this.palpitations = b.palpitations;
        this.syncope = b.syncope;
        this.fainting = b.fainting;
        this.neurologicalSymptoms = b.neurologicalSymptoms;
        this.legSwelling = b.legSwelling;
        this.sweating = b.sweating;
        this.dizziness = b.dizziness;
        this.nausea = b.nausea;
        this.systolicBP = b.systolicBP;
        this.diastolicBP = b.diastolicBP;
        this.heartRate = b.heartRate;
        this.oxygenSaturation = b.oxygenSaturation;
        this.temperature = b.temperature;
        this.riskFactors = Collections.unmodifiableSet(b.riskFactors.isEmpty()
            ? EnumSet.noneOf(RiskFactor.class) : EnumSet.copyOf(b.riskFactors));
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean hasRiskFactor(RiskFactor factor) {
        return riskFactors.contains(factor);
    }

    /** Chest pain duration in minutes, 0 when not reported or negative. */
    public int chestPainMinutes() {
        return chestPainDurationMinutes != null && chestPainDurationMinutes > 0 ? chestPainDurationMinutes : 0;
    }

    public boolean hasAnyVitalSign() {
        return systolicBP != null || diastolicBP != null || heartRate != null
            || oxygenSaturation != null || temperature != null;
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.age = age;
        b.sex = sex;
        b.chestPainType = chestPainType;
        b.chestPainDurationMinutes = chestPainDurationMinutes;
        b.chestPainRadiation = chestPainRadiation;
        b.chestPainExertional = chestPainExertional;
        b.shortnessOfBreathLevel = shortnessOfBreathLevel;
        b.palpitations = palpitations;
        b.syncope = syncope;
        b.fainting = fainting;
        b.neurologicalSymptoms = neurologicalSymptoms;
        b.legSwelling = legSwelling;
        b.sweating = sweating;
        b.dizziness = dizziness;
        b.nausea = nausea;
        b.systolicBP = systolicBP;
        b.diastolicBP = diastolicBP;
        b.heartRate = heartRate;
        b.oxygenSaturation = oxygenSaturation;
        b.temperature = temperature;
        b.riskFactors.addAll(riskFactors);
        return b;
    }

    @Override
    public String toString() {
        return String.format(
            "PatientAssessmentInput{age=%s, sex=%s, chestPain=%s/%smin, sob=%s, bp=%s/%s, hr=%s, spo2=%s, temp=%s, riskFactors=%s}",
            age, sex, chestPainType, chestPainDurationMinutes, shortnessOfBreathLevel,
            systolicBP, diastolicBP, heartRate, oxygenSaturation, temperature, riskFactors);
    }

    public static final class Builder {
        private Integer age;
        private Sex sex;
        private ChestPainType chestPainType;
        private Integer chestPainDurationMinutes;
        private boolean chestPainRadiation;
        private boolean chestPainExertional;
        private BreathlessnessLevel shortnessOfBreathLevel;
        private boolean palpitations;
        private boolean syncope;
        private boolean fainting;
        private boolean neurologicalSymptoms;
        private boolean legSwelling;
        private boolean sweating;
        private boolean dizziness;
        private boolean nausea;
        private Integer systolicBP;
        private Integer diastolicBP;
        private Integer heartRate;
        private Integer oxygenSaturation;
        private Double temperature;
        private final Set<RiskFactor> riskFactors = EnumSet.noneOf(RiskFactor.class);

        private Builder() {
        }

        public Builder age(Integer age) {
            this.age = age;
            return this;
        }

        public Builder sex(Sex sex) {
            this.sex = sex;
            return this;
        }

        public Builder chestPainType(ChestPainType chestPainType) {
            this.chestPainType = chestPainType;
            return this;
        }

        public Builder chestPainDurationMinutes(Integer minutes) {
            this.chestPainDurationMinutes = minutes;
            return this;
        }

        public Builder chestPainRadiation(boolean chestPainRadiation) {
            this.chestPainRadiation = chestPainRadiation;
            return this;
        }

        public Builder chestPainExertional(boolean chestPainExertional) {
            this.chestPainExertional = chestPainExertional;
            return this;
        }

        public Builder shortnessOfBreathLevel(BreathlessnessLevel level) {
            this.shortnessOfBreathLevel = level;
            return this;
        }

        public Builder palpitations(boolean palpitations) {
            this.palpitations = palpitations;
            return this;
        }

        public Builder syncope(boolean syncope) {
            this.syncope = syncope;
            return this;
        }

        public Builder fainting(boolean fainting) {
            this.fainting = fainting;
            return this;
        }

        public Builder neurologicalSymptoms(boolean neurologicalSymptoms) {
            this.neurologicalSymptoms = neurologicalSymptoms;
            return this;
        }

        public Builder legSwelling(boolean legSwelling) {
            this.legSwelling = legSwelling;
            return this;
        }

        public Builder sweating(boolean sweating) {
            this.sweating = sweating;
            return this;
        }

        public Builder dizziness(boolean dizziness) {
            this.dizziness = dizziness;
            return this;
        }

        public Builder nausea(boolean nausea) {
            this.nausea = nausea;
            return this;
        }

        public Builder systolicBP(Integer systolicBP) {
            this.systolicBP = systolicBP;
            return this;
        }

        public Builder diastolicBP(Integer diastolicBP) {
            this.diastolicBP = diastolicBP;
            return this;
        }

        public Builder heartRate(Integer heartRate) {
            this.heartRate = heartRate;
            return this;
        }

        public Builder oxygenSaturation(Integer oxygenSaturation) {
            this.oxygenSaturation = oxygenSaturation;
            return this;
        }

        public Builder temperature(Double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder riskFactor(RiskFactor factor) {
            this.riskFactors.add(factor);
            return this;
        }

        public Builder riskFactors(Set<RiskFactor> factors) {
            this.riskFactors.clear();
            if (factors != null) {
                this.riskFactors.addAll(factors);
            }
            return this;
        }

        public PatientAssessmentInput build() {
            return new PatientAssessmentInput(this);
        }
    }
}
