package com.cardiorisk.history;

import com.cardiorisk.scoring.RiskCategory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Summarises a patient's assessment history, oldest record first.
 *
 * The trend compares the average of the last three assessments with the
 * average of everything before them (with fewer than three records, the
 * last one against the rest). A change of more than 5 percent either way
 * counts as a trend.
 */
public class TrendAnalyzer {

    static final int RECENT_WINDOW = 3;
    static final double TREND_THRESHOLD_PERCENT = 5.0;

    public RiskTrendStats analyze(List<AssessmentRecord> history) {
        if (history == null || history.isEmpty()) {
            return RiskTrendStats.empty();
        }

        double average = average(history);

        TrendDirection direction = TrendDirection.STABLE;
        double changePercent = 0;
        if (history.size() >= 2) {
            int recentCount = history.size() < RECENT_WINDOW ? 1 : RECENT_WINDOW;
            List<AssessmentRecord> recent = history.subList(history.size() - recentCount, history.size());
            List<AssessmentRecord> older = history.size() <= recentCount
                ? recent
                : history.subList(0, history.size() - recentCount);

            double recentAvg = average(recent);
            double olderAvg = average(older);
            if (olderAvg > 0) {
                changePercent = (recentAvg - olderAvg) / olderAvg * 100;
                if (changePercent < -TREND_THRESHOLD_PERCENT) {
                    direction = TrendDirection.IMPROVING;
                } else if (changePercent > TREND_THRESHOLD_PERCENT) {
                    direction = TrendDirection.WORSENING;
                }
            }
        }

        return new RiskTrendStats(
            average,
            direction,
            Math.abs(changePercent),
            history.size(),
            history.get(history.size() - 1).timestamp,
            mostCommonCategory(history));
    }

    private static double average(List<AssessmentRecord> records) {
        return records.stream().mapToInt(r -> r.finalRiskScore).average().orElse(0);
    }

    // Ties go to the more severe category
    private static RiskCategory mostCommonCategory(List<AssessmentRecord> history) {
        Map<RiskCategory, Integer> counts = new EnumMap<>(RiskCategory.class);
        for (AssessmentRecord record : history) {
            counts.merge(record.riskCategory, 1, Integer::sum);
        }
        RiskCategory best = null;
        int bestCount = 0;
        for (Map.Entry<RiskCategory, Integer> entry : counts.entrySet()) {
            if (entry.getValue() >= bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }
}
