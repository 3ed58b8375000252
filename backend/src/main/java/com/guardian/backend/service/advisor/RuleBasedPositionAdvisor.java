package com.guardian.backend.service.advisor;

import com.guardian.backend.model.PositionAction;
import com.guardian.backend.model.RiskLevel;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic advisor used when no remote advisor is configured. Each stance applies its own
 * loss tolerance and appetite for adding to winners.
 */
public class RuleBasedPositionAdvisor implements PositionAdvisor {

    @Override
    public Advice advise(PositionContext context, DebateStance stance) {
        return switch (stance) {
            case AGGRESSIVE -> aggressive(context);
            case CONSERVATIVE -> conservative(context);
            case NEUTRAL -> neutral(context);
        };
    }

    private Advice aggressive(PositionContext ctx) {
        double pnl = ctx.unrealizedPnlPct();
        if (pnl < -25) {
            return advice(PositionAction.EXIT, 0.6, "Loss is too deep to wait for a recovery", ctx);
        }
        if (pnl < 0) {
            return advice(PositionAction.HOLD, 0.65, "Drawdown is within tolerance; give the thesis time to play out", ctx);
        }
        if (ctx.concentration() < 15) {
            return advice(PositionAction.ADD, 0.7, "Winning position with room to grow in the portfolio", ctx);
        }
        return advice(PositionAction.HOLD, 0.75, "Let the winner run", ctx);
    }

    private Advice conservative(PositionContext ctx) {
        double pnl = ctx.unrealizedPnlPct();
        if (pnl < -10 || ctx.riskLevel() == RiskLevel.CRITICAL) {
            return advice(PositionAction.EXIT, 0.85, "Preserve capital: cut the loss before it grows", ctx);
        }
        if (pnl < -5 || ctx.riskLevel() == RiskLevel.HIGH) {
            return advice(PositionAction.REDUCE, 0.75, "Downside risk is building; reduce exposure", ctx);
        }
        if (pnl > 15) {
            return advice(PositionAction.REDUCE, 0.7, "Lock in part of the gain", ctx);
        }
        if (ctx.concentration() > 20) {
            return advice(PositionAction.REDUCE, 0.7, "Position is too large for a defensive portfolio", ctx);
        }
        return advice(PositionAction.HOLD, 0.6, "No defensive action required", ctx);
    }

    private Advice neutral(PositionContext ctx) {
        double pnl = ctx.unrealizedPnlPct();
        if (pnl < -15) {
            return advice(PositionAction.EXIT, 0.7, "Loss exceeds a balanced tolerance", ctx);
        }
        if (pnl < -10 || pnl > 25 || ctx.concentration() > 25) {
            return advice(PositionAction.REDUCE, 0.65, "Rebalance toward a moderate position size", ctx);
        }
        return advice(PositionAction.HOLD, 0.7, "Risk and reward are balanced", ctx);
    }

    private Advice advice(PositionAction action, double confidence, String reasoning, PositionContext ctx) {
        List<String> points = new ArrayList<>();
        points.add(String.format(Locale.US, "Unrealized P&L %.1f%%", ctx.unrealizedPnlPct()));
        points.add(String.format(Locale.US, "Concentration %.1f%%", ctx.concentration()));
        points.add("Risk level " + ctx.riskLevel());
        if (ctx.daysHeld() > 0) {
            points.add("Held for " + ctx.daysHeld() + " days");
        }
        return new Advice(action, confidence, reasoning, points);
    }
}
