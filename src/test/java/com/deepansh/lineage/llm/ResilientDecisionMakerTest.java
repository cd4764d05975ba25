package com.deepansh.lineage.llm;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.ResourceAccessException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

/**
 * Exercises the decorator without the AOP proxy; the circuit breaker itself is
 * configuration.
 */
@ExtendWith(MockitoExtension.class)
class ResilientDecisionMakerTest {

    @Mock
    private DecisionMaker delegate;

    @InjectMocks
    private ResilientDecisionMaker decisionMaker;

    @Test
    void generate_delegatesText() {
        when(delegate.generate("plan it", 300)).thenReturn("1. search");

        assertThat(decisionMaker.generate("plan it", 300)).isEqualTo("1. search");
    }

    @Test
    void generate_nullFromDelegate_becomesEmpty() {
        when(delegate.generate("p", 50)).thenReturn(null);

        assertThat(decisionMaker.generate("p", 50)).isEmpty();
    }

    @Test
    void generate_delegateFailure_propagatesToCaller() {
        when(delegate.generate("p", 50)).thenThrow(new ResourceAccessException("Read timed out"));

        assertThatThrownBy(() -> decisionMaker.generate("p", 50))
                .isInstanceOf(ResourceAccessException.class)
                .hasMessage("Read timed out");
    }
}
