package com.cardiorisk.history;

import com.cardiorisk.scoring.AssessmentResult;
import com.cardiorisk.scoring.PatientAssessmentInput;
import com.cardiorisk.scoring.RecommendationGenerator;
import com.cardiorisk.scoring.RiskCategory;
import com.cardiorisk.scoring.RiskClassification;
import com.cardiorisk.scoring.RiskClassifier;
import com.cardiorisk.scoring.Sex;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TrendAnalyzerTest {

    private static final Instant START = Instant.parse("2024-03-01T09:00:00Z");

    private final TrendAnalyzer analyzer = new TrendAnalyzer();

    // Each pair is (likelihood, impact); records are one day apart, oldest first
    static List<AssessmentRecord> history(int[]... scores) {
        RiskClassifier classifier = new RiskClassifier();
        RecommendationGenerator generator = new RecommendationGenerator();
        PatientAssessmentInput input = PatientAssessmentInput.builder().age(58).sex(Sex.MALE).build();

        List<AssessmentRecord> records = new ArrayList<>();
        for (int i = 0; i < scores.length; i++) {
            RiskClassification classification = classifier.classify(scores[i][0], scores[i][1]);
            AssessmentResult result = new AssessmentResult(classification, generator.generate(classification, input));
            records.add(new AssessmentRecord("a" + i, "patient-1", START.plusSeconds(86400L * i), input, result));
        }
        return records;
    }

    @Test
    void emptyHistoryIsStable() {
        RiskTrendStats stats = analyzer.analyze(List.of());

        assertThat(stats.totalAssessments).isZero();
        assertThat(stats.trendDirection).isEqualTo(TrendDirection.STABLE);
        assertThat(stats.lastAssessment).isNull();
        assertThat(stats.mostCommonCategory).isNull();
    }

    @Test
    void singleAssessmentIsStable() {
        RiskTrendStats stats = analyzer.analyze(history(new int[]{3, 4}));

        assertThat(stats.totalAssessments).isEqualTo(1);
        assertThat(stats.averageRiskScore).isEqualTo(12.0);
        assertThat(stats.trendDirection).isEqualTo(TrendDirection.STABLE);
        assertThat(stats.changePercent).isZero();
        assertThat(stats.mostCommonCategory).isEqualTo(RiskCategory.MODERATE);
    }

    @Test
    void fallingScoresAreImproving() {
        RiskTrendStats stats = analyzer.analyze(history(
            new int[]{2, 5}, new int[]{2, 5}, new int[]{2, 5},
            new int[]{2, 2}, new int[]{2, 2}, new int[]{2, 2}));

        assertThat(stats.trendDirection).isEqualTo(TrendDirection.IMPROVING);
        assertThat(stats.changePercent).isCloseTo(60.0, within(0.001));
        assertThat(stats.averageRiskScore).isCloseTo(7.0, within(0.001));
        assertThat(stats.lastAssessment).isEqualTo(START.plusSeconds(86400L * 5));
    }

    @Test
    void risingScoreWithTwoRecordsIsWorsening() {
        RiskTrendStats stats = analyzer.analyze(history(new int[]{2, 2}, new int[]{2, 4}));

        assertThat(stats.trendDirection).isEqualTo(TrendDirection.WORSENING);
        assertThat(stats.changePercent).isCloseTo(100.0, within(0.001));
    }

    @Test
    void smallChangeIsStable() {
        // recent average 15.67 against 16
        RiskTrendStats stats = analyzer.analyze(history(
            new int[]{4, 4}, new int[]{4, 4}, new int[]{4, 4},
            new int[]{4, 4}, new int[]{4, 4}, new int[]{3, 5}));

        assertThat(stats.trendDirection).isEqualTo(TrendDirection.STABLE);
        assertThat(stats.changePercent).isCloseTo(2.083, within(0.01));

        RiskTrendStats flat = analyzer.analyze(history(
            new int[]{4, 5}, new int[]{4, 5}, new int[]{4, 5}, new int[]{4, 5}));
        assertThat(flat.trendDirection).isEqualTo(TrendDirection.STABLE);
        assertThat(flat.changePercent).isZero();
    }

    @Test
    void mostCommonCategoryPrefersMoreSevereOnTie() {
        RiskTrendStats majority = analyzer.analyze(history(new int[]{2, 2}, new int[]{2, 2}, new int[]{3, 4}));
        RiskTrendStats tie = analyzer.analyze(history(new int[]{2, 2}, new int[]{3, 4}));

        assertThat(majority.mostCommonCategory).isEqualTo(RiskCategory.LOW);
        assertThat(tie.mostCommonCategory).isEqualTo(RiskCategory.MODERATE);
    }
}
