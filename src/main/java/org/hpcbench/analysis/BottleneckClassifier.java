package org.hpcbench.analysis;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.hpcbench.metrics.Summary;

/**
 * Attributes a campaign's performance to its most likely bottleneck.
 *
 * <p>Every rule is evaluated; their evidence is summed per category once at the end. The
 * classification is the highest-scoring category, ties going to the earlier category in
 * {@link BottleneckCategory#scored()} order, and {@link BottleneckCategory#UNKNOWN} when nothing
 * scored.
 */
public final class BottleneckClassifier {
    private final List<BottleneckRule> rules;

    public BottleneckClassifier() {
        this(BottleneckRules.defaults());
    }

    public BottleneckClassifier(List<BottleneckRule> rules) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
    }

    public BottleneckVerdict classify(Summary summary) {
        return classify(summary, ResourceTelemetry.none());
    }

    public BottleneckVerdict classify(Summary summary, ResourceTelemetry telemetry) {
        Objects.requireNonNull(summary, "summary");
        ResourceTelemetry effectiveTelemetry = telemetry == null ? ResourceTelemetry.none() : telemetry;
        if (summary.isEmpty()) {
            return unknown("No request data available for analysis");
        }

        List<Evidence> evidence = new ArrayList<>();
        for (BottleneckRule rule : rules) {
            evidence.addAll(rule.evaluate(summary, effectiveTelemetry));
        }

        Map<BottleneckCategory, Integer> scores = new EnumMap<>(BottleneckCategory.class);
        for (BottleneckCategory category : BottleneckCategory.scored()) {
            scores.put(category, 0);
        }
        Set<String> reasons = new LinkedHashSet<>();
        for (Evidence item : evidence) {
            scores.merge(item.category(), item.weight(), Integer::sum);
            if (!item.reason().isEmpty()) {
                reasons.add(item.reason());
            }
        }

        BottleneckCategory primary = BottleneckCategory.UNKNOWN;
        int best = 0;
        int secondBest = 0;
        for (BottleneckCategory category : BottleneckCategory.scored()) {
            int score = scores.get(category);
            if (score > best) {
                secondBest = best;
                best = score;
                primary = category;
            } else if (score > secondBest) {
                secondBest = score;
            }
        }
        List<String> reasonList = new ArrayList<>(reasons);
        return new BottleneckVerdict(
            primary,
            Confidence.fromScores(best, secondBest),
            orderedScores(scores),
            reasonList,
            primary.recommendations(),
            summaryText(primary, reasonList)
        );
    }

    /**
     * Verdict for a campaign that has nothing to classify.
     */
    public static BottleneckVerdict unknown(String reason) {
        Map<BottleneckCategory, Integer> scores = new LinkedHashMap<>();
        for (BottleneckCategory category : BottleneckCategory.scored()) {
            scores.put(category, 0);
        }
        return new BottleneckVerdict(
            BottleneckCategory.UNKNOWN,
            Confidence.LOW,
            scores,
            List.of(reason),
            BottleneckCategory.UNKNOWN.recommendations(),
            "Unable to analyze - " + reason
        );
    }

    private static Map<BottleneckCategory, Integer> orderedScores(Map<BottleneckCategory, Integer> scores) {
        Map<BottleneckCategory, Integer> ordered = new LinkedHashMap<>();
        for (BottleneckCategory category : BottleneckCategory.scored()) {
            ordered.put(category, scores.get(category));
        }
        return ordered;
    }

    private static String summaryText(BottleneckCategory primary, List<String> reasons) {
        if (reasons.isEmpty()) {
            return "Most likely bottleneck: " + primary.label() + " (insufficient data for detailed analysis)";
        }
        return "Most likely bottleneck: " + primary.label() + ". Primary indicator: " + reasons.get(0);
    }
}
