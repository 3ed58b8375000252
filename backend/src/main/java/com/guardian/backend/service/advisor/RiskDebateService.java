package com.guardian.backend.service.advisor;

import com.guardian.backend.config.AdvisorProperties;
import com.guardian.backend.model.PositionAction;
import com.guardian.backend.model.RiskLevel;
import com.guardian.backend.service.risk.PortfolioRiskAssessment;
import com.guardian.backend.service.risk.PortfolioRiskService;
import com.guardian.backend.service.risk.PositionRiskAssessment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Three-way risk debate over a position: the same advisor is asked from each stance concurrently
 * and the answers are settled by {@link DebateJudge}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RiskDebateService {

    static final double FALLBACK_RISK_SCORE = 50.0;

    private final PortfolioRiskService portfolioRiskService;
    private final PositionAdvisor positionAdvisor;
    private final AdvisorProperties advisorProperties;
    private final Clock clock;
    @Qualifier("advisorExecutor")
    private final Executor advisorExecutor;
    private final DebateJudge judge = new DebateJudge();

    public DebateResult debate(Long accountId, String symbol) {
        return debate(portfolioRiskService.getPositionRecommendation(accountId, symbol));
    }

    public PortfolioAdvice portfolioRecommendations(Long accountId) {
        PortfolioRiskAssessment assessment = portfolioRiskService.assessPortfolio(accountId);
        List<PortfolioAdvice.Recommendation> all = new ArrayList<>();
        double totalScore = 0;
        for (PositionRiskAssessment position : assessment.positions()) {
            PortfolioAdvice.Recommendation recommendation;
            try {
                DebateResult result = debate(position);
                recommendation = new PortfolioAdvice.Recommendation(position.symbol(), result.finalAction(),
                        result.finalReasoning(), result.riskScore(), result.summary(), result.arguments(), null);
            } catch (RuntimeException e) {
                log.warn("Debate failed for account {} symbol {}: {}", accountId, position.symbol(), e.getMessage());
                recommendation = new PortfolioAdvice.Recommendation(position.symbol(), PositionAction.HOLD,
                        "Error analyzing: " + e.getMessage(), FALLBACK_RISK_SCORE, null, List.of(), e.getMessage());
            }
            all.add(recommendation);
            totalScore += recommendation.riskScore();
        }
        double average = all.isEmpty() ? 0.0 : totalScore / all.size();
        return new PortfolioAdvice(
                accountId,
                average,
                scoreToLevel(average),
                filter(all, PositionAction.EXIT),
                filter(all, PositionAction.REDUCE),
                filter(all, PositionAction.ADD),
                filter(all, PositionAction.HOLD),
                all,
                LocalDateTime.now(clock));
    }

    DebateResult debate(PositionRiskAssessment position) {
        PositionContext context = PositionContext.from(position);
        List<CompletableFuture<DebateArgument>> futures = Arrays.stream(DebateStance.values())
                .map(stance -> ask(context, stance))
                .toList();
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        List<DebateArgument> arguments = futures.stream().map(CompletableFuture::join).toList();

        DebateJudge.Verdict verdict = judge.judge(arguments, position.riskLevel());
        String summary = judge.summarize(arguments, verdict.action());
        log.debug("Debate for {}: {} (score {})", position.symbol(), summary, verdict.riskScore());
        return new DebateResult(
                position.symbol(),
                arguments,
                verdict.action(),
                verdict.reasoning(),
                verdict.riskScore(),
                summary,
                LocalDateTime.now(clock));
    }

    private CompletableFuture<DebateArgument> ask(PositionContext context, DebateStance stance) {
        return CompletableFuture
                .supplyAsync(() -> DebateArgument.of(stance, positionAdvisor.advise(context, stance)), advisorExecutor)
                .orTimeout(advisorProperties.getDebateTimeoutMs(), TimeUnit.MILLISECONDS)
                .exceptionally(e -> {
                    Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
                    String error = cause instanceof TimeoutException ? "timed out" : String.valueOf(cause.getMessage());
                    log.warn("{} advisor unavailable for {}: {}", stance, context.symbol(), error);
                    return DebateArgument.failed(stance, error);
                });
    }

    private static List<PortfolioAdvice.Recommendation> filter(List<PortfolioAdvice.Recommendation> all,
                                                               PositionAction action) {
        return all.stream().filter(recommendation -> recommendation.action() == action).toList();
    }

    static RiskLevel scoreToLevel(double score) {
        if (score >= 75) {
            return RiskLevel.CRITICAL;
        }
        if (score >= 50) {
            return RiskLevel.HIGH;
        }
        if (score >= 25) {
            return RiskLevel.MODERATE;
        }
        return RiskLevel.LOW;
    }
}
