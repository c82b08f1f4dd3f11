package com.cardiorisk.http;

import com.cardiorisk.history.AssessmentRecord;
import com.cardiorisk.history.RiskFactorAnalysis;
import com.cardiorisk.history.RiskFactorContribution;
import com.cardiorisk.history.RiskTrendStats;
import com.cardiorisk.history.VitalSign;
import com.cardiorisk.history.VitalSignPoint;
import com.cardiorisk.scoring.AssessmentResult;
import com.cardiorisk.scoring.BreathlessnessLevel;
import com.cardiorisk.scoring.ChestPainType;
import com.cardiorisk.scoring.PatientAssessmentInput;
import com.cardiorisk.scoring.RiskCategory;
import com.cardiorisk.scoring.RiskFactor;
import com.cardiorisk.scoring.Sex;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * ApiModels - Data Transfer Objects for the HTTP API
 */
public final class ApiModels {

    private ApiModels() {
    }

    /**
     * AssessmentRequest - Form data posted by the client. Enumerated values
     * are accepted case-insensitively and in camelCase, kebab-case or with
     * spaces ("typical", "SEVERE", "highCholesterol", "family-history").
     */
    public static final class AssessmentRequest {
        private static final Pattern CAMEL_CASE_BOUNDARY = Pattern.compile("([a-z0-9])([A-Z])");

        public final String patientId;
        public final Integer age;
        public final String sex;
        public final String chestPainType;
        public final Integer chestPainDurationMinutes;
        public final Boolean chestPainRadiation;
        public final Boolean chestPainExertional;
        public final String shortnessOfBreathLevel;
        public final Boolean palpitations;
        public final Boolean syncope;
        public final Boolean fainting;
        public final Boolean neurologicalSymptoms;
        public final Boolean legSwelling;
        public final Boolean sweating;
        public final Boolean dizziness;
        public final Boolean nausea;
        public final Integer systolicBP;
        public final Integer diastolicBP;
        public final Integer heartRate;
        public final Integer oxygenSaturation;
        public final Double temperature;
        public final List<String> riskFactors;

        @JsonCreator
        public AssessmentRequest(
                @JsonProperty("patientId") String patientId,
                @JsonProperty("age") Integer age,
                @JsonProperty("sex") String sex,
                @JsonProperty("chestPainType") String chestPainType,
                @JsonProperty("chestPainDurationMinutes") Integer chestPainDurationMinutes,
                @JsonProperty("chestPainRadiation") Boolean chestPainRadiation,
                @JsonProperty("chestPainExertional") Boolean chestPainExertional,
                @JsonProperty("shortnessOfBreathLevel") String shortnessOfBreathLevel,
                @JsonProperty("palpitations") Boolean palpitations,
                @JsonProperty("syncope") Boolean syncope,
                @JsonProperty("fainting") Boolean fainting,
                @JsonProperty("neurologicalSymptoms") Boolean neurologicalSymptoms,
                @JsonProperty("legSwelling") Boolean legSwelling,
                @JsonProperty("sweating") Boolean sweating,
                @JsonProperty("dizziness") Boolean dizziness,
                @JsonProperty("nausea") Boolean nausea,
                @JsonProperty("systolicBP") Integer systolicBP,
                @JsonProperty("diastolicBP") Integer diastolicBP,
                @JsonProperty("heartRate") Integer heartRate,
                @JsonProperty("oxygenSaturation") Integer oxygenSaturation,
                @JsonProperty("temperature") Double temperature,
                @JsonProperty("riskFactors") List<String> riskFactors) {
            this.patientId = patientId;
            this.age = age;
            this.sex = sex;
            this.chestPainType = chestPainType;
            this.chestPainDurationMinutes = chestPainDurationMinutes;
            this.chestPainRadiation = chestPainRadiation;
            this.chestPainExertional = chestPainExertional;
            this.shortnessOfBreathLevel = shortnessOfBreathLevel;
            this.palpitations = palpitations;
            this.syncope = syncope;
            this.fainting = fainting;
            this.neurologicalSymptoms = neurologicalSymptoms;
            this.legSwelling = legSwelling;
            this.sweating = sweating;
            this.dizziness = dizziness;
            this.nausea = nausea;
            this.systolicBP = systolicBP;
            this.diastolicBP = diastolicBP;
            this.heartRate = heartRate;
            this.oxygenSaturation = oxygenSaturation;
            this.temperature = temperature;
            this.riskFactors = riskFactors != null ? riskFactors : List.of();
        }

        /**
         * @throws IllegalArgumentException if an enumerated field holds an unknown value
         */
        public PatientAssessmentInput toInput() {
            PatientAssessmentInput.Builder b = PatientAssessmentInput.builder()
                .age(age)
                .sex(parse(Sex.class, "sex", sex))
                .chestPainType(parse(ChestPainType.class, "chestPainType", chestPainType))
                .chestPainDurationMinutes(chestPainDurationMinutes)
                .chestPainRadiation(isTrue(chestPainRadiation))
                .chestPainExertional(isTrue(chestPainExertional))
                .shortnessOfBreathLevel(parse(BreathlessnessLevel.class, "shortnessOfBreathLevel", shortnessOfBreathLevel))
                .palpitations(isTrue(palpitations))
                .syncope(isTrue(syncope))
                .fainting(isTrue(fainting))
                .neurologicalSymptoms(isTrue(neurologicalSymptoms))
                .legSwelling(isTrue(legSwelling))
                .sweating(isTrue(sweating))
                .dizziness(isTrue(dizziness))
                .nausea(isTrue(nausea))
                .systolicBP(systolicBP)
                .diastolicBP(diastolicBP)
                .heartRate(heartRate)
                .oxygenSaturation(oxygenSaturation)
                .temperature(temperature);
            for (String factor : riskFactors) {
                if (factor == null || factor.isBlank()) {
                    throw new IllegalArgumentException("riskFactors must not contain empty entries");
                }
                b.riskFactor(parse(RiskFactor.class, "riskFactors", factor));
            }
            return b.build();
        }

        private static boolean isTrue(Boolean value) {
            return Boolean.TRUE.equals(value);
        }

        static <E extends Enum<E>> E parse(Class<E> type, String field, String raw) {
            if (raw == null || raw.isBlank()) {
                return null;
            }
            String normalized = CAMEL_CASE_BOUNDARY.matcher(raw.trim()).replaceAll("$1_$2")
                .toUpperCase(Locale.ROOT)
                .replace('-', '_')
                .replace(' ', '_');
            try {
                return Enum.valueOf(type, normalized);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown value for " + field + ": " + raw, e);
            }
        }
    }

    public static final class HeatmapCell {
        public final int x;
        public final int y;

        @JsonCreator
        public HeatmapCell(@JsonProperty("x") int x, @JsonProperty("y") int y) {
            this.x = x;
            this.y = y;
        }
    }

    /**
     * AssessmentResponse - Scores, category and advice
     */
    public static final class AssessmentResponse {
        public final String requestId;
        public final String patientId;
        public final int likelihoodScore;
        public final String likelihoodLevel;
        public final int impactScore;
        public final String impactLevel;
        public final int finalRiskScore;
        public final String riskCategory;
        public final String colorCode;
        public final HeatmapCell heatmapPosition;
        public final String recommendedAction;
        public final String explanation;
        public final List<String> recommendations;
        public final List<String> recommendationKeys;
        public final String safetyMessage;

        public AssessmentResponse(String requestId, String patientId, AssessmentResult result) {
            this.requestId = requestId;
            this.patientId = patientId;
            this.likelihoodScore = result.likelihoodScore;
            this.likelihoodLevel = result.likelihoodLevel.label();
            this.impactScore = result.impactScore;
            this.impactLevel = result.impactLevel.label();
            this.finalRiskScore = result.finalRiskScore;
            this.riskCategory = result.riskCategory.label();
            this.colorCode = result.colorCode;
            this.heatmapPosition = new HeatmapCell(result.heatmapPosition.x, result.heatmapPosition.y);
            this.recommendedAction = result.recommendedAction;
            this.explanation = result.explanation;
            this.recommendations = result.recommendationTexts();
            this.recommendationKeys = result.recommendationKeys();
            this.safetyMessage = result.safetyMessage;
        }
    }

    public static final class RecordView {
        public final String id;
        public final String date;
        public final int finalRiskScore;
        public final int likelihoodScore;
        public final int impactScore;
        public final String riskCategory;
        public final String likelihoodLevel;
        public final String impactLevel;
        public final String recommendedAction;
        public final Integer systolicBP;
        public final Integer diastolicBP;
        public final Integer heartRate;
        public final Integer oxygenSaturation;
        public final Double temperature;
        public final List<String> riskFactors;

        public RecordView(AssessmentRecord record) {
            this.id = record.id;
            this.date = record.timestamp.toString();
            this.finalRiskScore = record.finalRiskScore;
            this.likelihoodScore = record.likelihoodScore;
            this.impactScore = record.impactScore;
            this.riskCategory = record.riskCategory.label();
            this.likelihoodLevel = record.likelihoodLevel;
            this.impactLevel = record.impactLevel;
            this.recommendedAction = record.recommendedAction;
            this.systolicBP = record.systolicBP;
            this.diastolicBP = record.diastolicBP;
            this.heartRate = record.heartRate;
            this.oxygenSaturation = record.oxygenSaturation;
            this.temperature = record.temperature;
            this.riskFactors = record.riskFactors.stream().map(RiskFactor::name).collect(Collectors.toList());
        }
    }

    public static final class HistoryResponse {
        public final String patientId;
        public final List<RecordView> records;

        public HistoryResponse(String patientId, List<AssessmentRecord> records) {
            this.patientId = patientId;
            this.records = records.stream().map(RecordView::new).collect(Collectors.toList());
        }
    }

    public static final class TrendResponse {
        public final String patientId;
        public final double averageRiskScore;
        public final String trendDirection;
        public final double changePercent;
        public final int totalAssessments;
        public final String lastAssessmentDate;
        public final String mostCommonCategory;

        public TrendResponse(String patientId, RiskTrendStats stats) {
            this.patientId = patientId;
            this.averageRiskScore = stats.averageRiskScore;
            this.trendDirection = stats.trendDirection.name();
            this.changePercent = stats.changePercent;
            this.totalAssessments = stats.totalAssessments;
            this.lastAssessmentDate = stats.lastAssessment != null ? stats.lastAssessment.toString() : null;
            this.mostCommonCategory = stats.mostCommonCategory != null ? stats.mostCommonCategory.label() : null;
        }
    }

    /**
     * DistributionResponse - Assessments per category label, in severity order
     */
    public static final class DistributionResponse {
        public final String patientId;
        public final Map<String, Integer> counts;
        public final int total;

        public DistributionResponse(String patientId, Map<RiskCategory, Integer> counts) {
            this.patientId = patientId;
            this.counts = new LinkedHashMap<>();
            int sum = 0;
            for (RiskCategory category : RiskCategory.values()) {
                int count = counts.getOrDefault(category, 0);
                this.counts.put(category.label(), count);
                sum += count;
            }
            this.total = sum;
        }
    }

    public static final class VitalPointView {
        public final String date;
        public final double value;
        public final boolean normal;

        public VitalPointView(VitalSignPoint point) {
            this.date = point.timestamp.toString();
            this.value = point.value;
            this.normal = point.normal;
        }
    }

    /**
     * VitalSignTrendsResponse - One series per vital sign, keyed systolicBP,
     * diastolicBP, heartRate, oxygenSaturation and temperature
     */
    public static final class VitalSignTrendsResponse {
        public final String patientId;
        public final Map<String, List<VitalPointView>> series;

        public VitalSignTrendsResponse(String patientId, Map<VitalSign, List<VitalSignPoint>> series) {
            this.patientId = patientId;
            this.series = new LinkedHashMap<>();
            for (VitalSign vital : VitalSign.values()) {
                this.series.put(vital.key(), series.getOrDefault(vital, List.of()).stream()
                    .map(VitalPointView::new)
                    .collect(Collectors.toList()));
            }
        }
    }

    public static final class ContributionView {
        public final String factor;
        public final String factorName;
        public final int occurrences;
        public final String status;
        public final String description;

        public ContributionView(RiskFactorContribution contribution) {
            this.factor = contribution.factor.name();
            this.factorName = contribution.factor.label();
            this.occurrences = contribution.occurrences;
            this.status = contribution.status.name();
            this.description = contribution.status.description();
        }
    }

    public static final class RiskFactorAnalysisResponse {
        public final String patientId;
        public final List<ContributionView> contributors;
        public final List<ContributionView> improved;
        public final List<ContributionView> stable;

        public RiskFactorAnalysisResponse(String patientId, RiskFactorAnalysis analysis) {
            this.patientId = patientId;
            this.contributors = views(analysis.contributors);
            this.improved = views(analysis.improved);
            this.stable = views(analysis.stable);
        }

        private static List<ContributionView> views(List<RiskFactorContribution> contributions) {
            return contributions.stream().map(ContributionView::new).collect(Collectors.toList());
        }
    }

    /**
     * ErrorResponse - Validation or processing failure
     */
    public static final class ErrorResponse {
        public final String error;
        public final List<String> missingFields;

        @JsonCreator
        public ErrorResponse(
                @JsonProperty("error") String error,
                @JsonProperty("missingFields") List<String> missingFields) {
            this.error = error;
            this.missingFields = missingFields != null ? missingFields : List.of();
        }
    }
}
