package com.cardiorisk.history;

import com.cardiorisk.scoring.RiskCategory;
import com.cardiorisk.scoring.RiskFactor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Chart data derived from a patient's history, oldest record first:
 * category counts, per-vital time series and risk factor status.
 */
public class HistoryAnalytics {

    static final int RECENT_WINDOW = 3;
    static final int MAX_CONTRIBUTORS = 5;
    static final int MAX_IMPROVED = 3;
    static final int MAX_STABLE = 3;

    /** Assessments per category; every category is present, unused ones at 0. */
    public Map<RiskCategory, Integer> categoryDistribution(List<AssessmentRecord> history) {
        Map<RiskCategory, Integer> counts = new EnumMap<>(RiskCategory.class);
        for (RiskCategory category : RiskCategory.values()) {
            counts.put(category, 0);
        }
        for (AssessmentRecord record : history) {
            counts.merge(record.riskCategory, 1, Integer::sum);
        }
        return Collections.unmodifiableMap(counts);
    }

    /** One series per vital sign; records where it was not measured are skipped. */
    public Map<VitalSign, List<VitalSignPoint>> vitalSignTrends(List<AssessmentRecord> history) {
        Map<VitalSign, List<VitalSignPoint>> trends = new EnumMap<>(VitalSign.class);
        for (VitalSign vital : VitalSign.values()) {
            List<VitalSignPoint> points = new ArrayList<>();
            for (AssessmentRecord record : history) {
                Double value = vital.readingOf(record);
                if (value != null) {
                    points.add(new VitalSignPoint(record.timestamp, value, vital.isNormal(value)));
                }
            }
            trends.put(vital, List.copyOf(points));
        }
        return Collections.unmodifiableMap(trends);
    }

    /**
     * Groups every risk factor declared at least once. A factor present in
     * the previous assessment but not the latest is improved; one present in
     * at least two of the last three (or, with fewer records, any) is a
     * contributor; the rest are stable.
     */
    public RiskFactorAnalysis riskFactorAnalysis(List<AssessmentRecord> history) {
        if (history.isEmpty()) {
            return RiskFactorAnalysis.empty();
        }

        List<RiskFactorContribution> contributors = new ArrayList<>();
        List<RiskFactorContribution> improved = new ArrayList<>();
        List<RiskFactorContribution> stable = new ArrayList<>();

        for (RiskFactor factor : RiskFactor.values()) {
            List<Boolean> presence = history.stream()
                .map(r -> r.riskFactors.contains(factor))
                .collect(Collectors.toList());
            int occurrences = (int) presence.stream().filter(Boolean::booleanValue).count();
            if (occurrences == 0) {
                continue;
            }

            int size = presence.size();
            boolean recentlyPresent = size < RECENT_WINDOW
                || presence.subList(size - RECENT_WINDOW, size).stream().filter(Boolean::booleanValue).count() >= 2;
            boolean addressed = size >= 2 && !presence.get(size - 1) && presence.get(size - 2);

            if (addressed) {
                improved.add(new RiskFactorContribution(factor, occurrences, RiskFactorContribution.Status.IMPROVED));
            } else if (recentlyPresent) {
                contributors.add(new RiskFactorContribution(factor, occurrences, RiskFactorContribution.Status.CONTRIBUTOR));
            } else {
                stable.add(new RiskFactorContribution(factor, occurrences, RiskFactorContribution.Status.STABLE));
            }
        }

        return new RiskFactorAnalysis(
            mostFrequent(contributors, MAX_CONTRIBUTORS),
            mostFrequent(improved, MAX_IMPROVED),
            mostFrequent(stable, MAX_STABLE));
    }

    // Stable sort, so equal counts keep declaration order
    private static List<RiskFactorContribution> mostFrequent(List<RiskFactorContribution> contributions, int limit) {
        return contributions.stream()
            .sorted(Comparator.comparingInt((RiskFactorContribution c) -> c.occurrences).reversed())
            .limit(limit)
            .collect(Collectors.toList());
    }
}
