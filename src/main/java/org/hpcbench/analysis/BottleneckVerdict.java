package org.hpcbench.analysis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ranked bottleneck classification with the evidence that produced it.
 */
public final class BottleneckVerdict {
    private final BottleneckCategory classification;
    private final Confidence confidence;
    private final Map<BottleneckCategory, Integer> scores;
    private final List<String> evidence;
    private final List<String> recommendations;
    private final String summary;

    BottleneckVerdict(
        BottleneckCategory classification,
        Confidence confidence,
        Map<BottleneckCategory, Integer> scores,
        List<String> evidence,
        List<String> recommendations,
        String summary
    ) {
        this.classification = Objects.requireNonNull(classification, "classification");
        this.confidence = Objects.requireNonNull(confidence, "confidence");
        this.scores = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(scores, "scores")));
        this.evidence = List.copyOf(Objects.requireNonNull(evidence, "evidence"));
        this.recommendations = List.copyOf(Objects.requireNonNull(recommendations, "recommendations"));
        if (this.recommendations.size() > BottleneckCategory.MAX_RECOMMENDATIONS) {
            throw new IllegalArgumentException("at most " + BottleneckCategory.MAX_RECOMMENDATIONS + " recommendations");
        }
        this.summary = Objects.requireNonNull(summary, "summary");
    }

    public BottleneckCategory classification() {
        return classification;
    }

    public Confidence confidence() {
        return confidence;
    }

    /**
     * Score per category in tie-break order.
     */
    public Map<BottleneckCategory, Integer> scores() {
        return scores;
    }

    public int scoreFor(BottleneckCategory category) {
        return scores.getOrDefault(category, 0);
    }

    public List<String> evidence() {
        return evidence;
    }

    public List<String> recommendations() {
        return recommendations;
    }

    public String summary() {
        return summary;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("classification", classification.key());
        root.put("confidence", confidence.key());
        Map<String, Object> scoreMap = new LinkedHashMap<>();
        for (Map.Entry<BottleneckCategory, Integer> entry : scores.entrySet()) {
            scoreMap.put(entry.getKey().key(), entry.getValue());
        }
        root.put("scores", scoreMap);
        root.put("evidence", evidence);
        root.put("recommendations", recommendations);
        root.put("summary", summary);
        return root;
    }
}
