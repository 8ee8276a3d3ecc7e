package com.intentbench.classifier;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Combines the outcomes of several classification methods into one result.
 *
 * <p>Voting sums confidences per type. The highest sum wins; a tie goes to the type holding
 * the single most confident vote, then to the type voted for by the highest-priority member
 * (lowest index). The combined confidence is the winning sum divided by the number of
 * members, successful or not.
 */
public final class ResultAggregator {
    private static final double EPSILON = 1e-9;

    private ResultAggregator() {
    }

    /**
     * @param priority position of the member in the configured list; lower wins ties
     */
    public record MemberOutcome(int priority, String memberTag, MethodResult outcome) {
    }

    public static MethodResult vote(List<MemberOutcome> members, int quorum, String methodTag) {
        if (members.isEmpty()) {
            return MethodResult.failure(ErrorKind.INSUFFICIENT_QUORUM, "No members configured", methodTag);
        }
        int total = members.size();
        List<MemberOutcome> successes = members.stream().filter(member -> member.outcome().isSuccess()).toList();
        if (successes.size() < quorum) {
            String failures = members.stream()
                    .filter(member -> member.outcome().isFailure())
                    .map(member -> member.memberTag() + "=" + member.outcome().error().describe())
                    .collect(Collectors.joining("; "));
            return MethodResult.failure(ErrorKind.INSUFFICIENT_QUORUM,
                    successes.size() + " of " + total + " members succeeded, quorum is " + quorum
                            + (failures.isEmpty() ? "" : " [" + failures + "]"),
                    methodTag);
        }

        Map<IntentType, Tally> tallies = new LinkedHashMap<>();
        for (MemberOutcome member : successes) {
            ClassificationResult result = member.outcome().result();
            tallies.computeIfAbsent(result.type(), type -> new Tally()).add(result.confidence(), member.priority());
        }

        IntentType winner = null;
        Tally best = null;
        for (Map.Entry<IntentType, Tally> entry : tallies.entrySet()) {
            if (best == null || entry.getValue().beats(best)) {
                winner = entry.getKey();
                best = entry.getValue();
            }
        }

        double confidence = Math.min(1.0, best.score / total);
        String breakdown = tallies.entrySet().stream()
                .map(entry -> entry.getKey().label() + "=" + format(entry.getValue().score))
                .collect(Collectors.joining(";"));
        String split = tallies.entrySet().stream()
                .map(entry -> entry.getKey().label() + " " + format(entry.getValue().score)
                        + " (" + entry.getValue().votes + (entry.getValue().votes == 1 ? " vote)" : " votes)"))
                .collect(Collectors.joining(", "));

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("votingBreakdown", breakdown);
        metadata.put("agreement", format((double) best.votes / successes.size()));
        metadata.put("successfulMembers", successes.size() + "/" + total);
        return MethodResult.success(new ClassificationResult(
                winner,
                confidence,
                "Ensemble vote: " + split + "; winner " + winner.label(),
                methodTag,
                0L,
                metadata));
    }

    static String mergeReasoning(String modelReasoning, String ruleReasoning) {
        return modelReasoning + " | rule-based: " + ruleReasoning;
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    private static final class Tally {
        private double score;
        private double strongest;
        private int bestPriority = Integer.MAX_VALUE;
        private int votes;

        void add(double confidence, int priority) {
            score += confidence;
            strongest = Math.max(strongest, confidence);
            bestPriority = Math.min(bestPriority, priority);
            votes++;
        }

        boolean beats(Tally other) {
            if (Math.abs(score - other.score) > EPSILON) {
                return score > other.score;
            }
            if (Math.abs(strongest - other.strongest) > EPSILON) {
                return strongest > other.strongest;
            }
            return bestPriority < other.bestPriority;
        }
    }
}
