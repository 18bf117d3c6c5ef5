package com.modelguard.modelguard.promotion;

import com.modelguard.modelguard.registry.ModelStage;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Applies the promotion rule. Pure: reads nothing and writes nothing.
 * <p>
 * Checks run in a fixed order so the justification reads the same way every time: (1) the challenger must
 * strictly exceed the minimum acceptable metric, (2) it must strictly exceed the incumbent. A tie with the
 * incumbent rejects.
 */
@Component
public class PromotionEngine {

    public PromotionDecision evaluatePromotion(
            ChallengerMetric challenger,
            IncumbentMetric incumbent,
            PromotionThresholds thresholds
    ) {
        double minimum = thresholds.minAcceptableMetric();
        boolean passedMinimum = challenger.metric() > minimum;

        ComparisonMode mode;
        Boolean beatIncumbent;
        if (!incumbent.exists()) {
            mode = ComparisonMode.NO_INCUMBENT;
            beatIncumbent = Boolean.TRUE;
        } else if (!incumbent.isAvailable()) {
            mode = ComparisonMode.DEGRADED_COMPARISON;
            beatIncumbent = null;
        } else {
            mode = ComparisonMode.FULL;
            beatIncumbent = challenger.metric() > incumbent.metric();
        }

        boolean promote = passedMinimum && !Boolean.FALSE.equals(beatIncumbent);
        PromotionOutcome outcome = promote ? PromotionOutcome.PROMOTE : PromotionOutcome.REJECT;

        List<StageTransition> transitions = new ArrayList<>();
        if (promote) {
            transitions.add(new StageTransition(challenger.version(), ModelStage.PRODUCTION));
            if (incumbent.exists()) {
                transitions.add(new StageTransition(incumbent.version(), ModelStage.ARCHIVED));
            }
        }

        return new PromotionDecision(
                null,
                System.currentTimeMillis(),
                challenger.modelName(),
                challenger.version(),
                challenger.metric(),
                incumbent.version(),
                incumbent.metric(),
                minimum,
                passedMinimum,
                beatIncumbent,
                mode,
                outcome,
                justify(challenger, incumbent, minimum, passedMinimum, beatIncumbent, mode, outcome),
                transitions,
                false
        );
    }

    private String justify(
            ChallengerMetric challenger,
            IncumbentMetric incumbent,
            double minimum,
            boolean passedMinimum,
            Boolean beatIncumbent,
            ComparisonMode mode,
            PromotionOutcome outcome
    ) {
        StringBuilder text = new StringBuilder();
        text.append(outcome).append(" ").append(challenger.modelName()).append(" v").append(challenger.version())
                .append(": [1] challenger ").append(format(challenger.metric()))
                .append(passedMinimum ? " > " : " <= ").append("minimum ").append(format(minimum))
                .append(passedMinimum ? " (pass)" : " (fail)");
        switch (mode) {
            case NO_INCUMBENT -> text.append("; [2] no incumbent in Production (pass by definition)");
            case DEGRADED_COMPARISON -> text.append("; [2] incumbent v").append(incumbent.version())
                    .append(" metric unavailable (").append(incumbent.unavailableReason())
                    .append("), decided on minimum only [DEGRADED_COMPARISON]");
            case FULL -> text.append("; [2] challenger ").append(format(challenger.metric()))
                    .append(Boolean.TRUE.equals(beatIncumbent) ? " > " : " <= ")
                    .append("incumbent v").append(incumbent.version()).append(" ").append(format(incumbent.metric()))
                    .append(Boolean.TRUE.equals(beatIncumbent) ? " (pass)" : " (fail)");
        }
        return text.toString();
    }

    private static String format(double metric) {
        return String.format(Locale.ROOT, "%.4f", metric);
    }
}
