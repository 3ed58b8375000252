package com.guardian.backend.service.advisor;

import com.guardian.backend.model.PositionAction;
import com.guardian.backend.model.RiskLevel;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Deterministic fan-in of the debate: a confidence-weighted vote, ties resolved toward the more
 * defensive action.
 */
public class DebateJudge {

    /** Most defensive first. */
    static final List<PositionAction> DEFENSIVE_ORDER =
            List.of(PositionAction.EXIT, PositionAction.REDUCE, PositionAction.HOLD, PositionAction.ADD);

    public Verdict judge(List<DebateArgument> arguments, RiskLevel riskLevel) {
        Map<PositionAction, Double> weights = new EnumMap<>(PositionAction.class);
        for (DebateArgument argument : arguments) {
            weights.merge(argument.action(), argument.confidence(), Double::sum);
        }
        PositionAction winner = PositionAction.HOLD;
        double best = -1;
        for (PositionAction action : DEFENSIVE_ORDER) {
            Double weight = weights.get(action);
            if (weight != null && weight > best) {
                best = weight;
                winner = action;
            }
        }

        PositionAction finalAction = winner;
        String lead = arguments.stream()
                .filter(argument -> argument.action() == finalAction && !argument.isFailed())
                .max(Comparator.comparingDouble(DebateArgument::confidence))
                .map(argument -> argument.stance() + ": " + argument.reasoning())
                .orElse("No advisor argued for a change");
        String tally = DEFENSIVE_ORDER.stream()
                .filter(weights::containsKey)
                .map(action -> String.format(Locale.US, "%s %.2f", action, weights.get(action)))
                .collect(Collectors.joining(", "));
        String reasoning = finalAction + " by weighted vote (" + tally + "). " + lead;
        return new Verdict(finalAction, reasoning, riskScore(finalAction, riskLevel));
    }

    public String summarize(List<DebateArgument> arguments, PositionAction finalAction) {
        String votes = arguments.stream()
                .map(argument -> String.format(Locale.US, "%s: %s (%.0f%%)",
                        argument.stance(), argument.action(), argument.confidence() * 100))
                .collect(Collectors.joining(", "));
        return votes + " -> " + finalAction;
    }

    static double riskScore(PositionAction action, RiskLevel riskLevel) {
        double base = switch (riskLevel == null ? RiskLevel.MODERATE : riskLevel) {
            case LOW -> 20;
            case MODERATE -> 45;
            case HIGH -> 70;
            case CRITICAL -> 90;
        };
        double adjustment = switch (action) {
            case EXIT -> 10;
            case REDUCE -> 5;
            case ADD -> -10;
            default -> 0;
        };
        return Math.max(0, Math.min(100, base + adjustment));
    }

    public record Verdict(PositionAction action, String reasoning, double riskScore) {}
}
