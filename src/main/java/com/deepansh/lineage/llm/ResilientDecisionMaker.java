package com.deepansh.lineage.llm;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

/**
 * Decorator around OllamaDecisionMaker that adds a circuit breaker.
 *
 * Failures and open-circuit rejections propagate to the caller, which records
 * them and carries on with empty text. No retries.
 *
 * Circuit breaker config (in application.yml):
 * - Opens after 50% failure rate in a sliding window of 10 calls
 * - Waits 30s before allowing probe calls (half-open state)
 */
@Component
@Primary
public class ResilientDecisionMaker implements DecisionMaker {

    private final DecisionMaker delegate;

    public ResilientDecisionMaker(@Qualifier("ollamaDecisionMaker") DecisionMaker delegate) {
        this.delegate = delegate;
    }

    @Override
    @CircuitBreaker(name = "decisionMaker")
    public String generate(String prompt, int maxTokens) {
        String text = delegate.generate(prompt, maxTokens);
        return text != null ? text : "";
    }
}
