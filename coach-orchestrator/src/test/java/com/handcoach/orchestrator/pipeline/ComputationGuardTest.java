package com.handcoach.orchestrator.pipeline;

import com.handcoach.orchestrator.logger.PipelineFlowLogger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;

class ComputationGuardTest {

    private final ComputationGuard guard = new ComputationGuard(new PipelineFlowLogger());

    @Test
    @DisplayName("runs the computation and reports success")
    void success() {
        StepVerifier.create(guard.run("Engine", () -> 42, () -> 0))
            .assertNext(outcome -> {
                assertEquals(42, outcome.value());
                assertFalse(outcome.fallbackUsed());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("a runtime failure is replaced by the safe default")
    void failure() {
        StepVerifier.create(guard.run("Engine", () -> {
                throw new ArithmeticException("divide by zero");
            }, () -> 0))
            .assertNext(outcome -> {
                assertEquals(0, outcome.value());
                assertTrue(outcome.fallbackUsed());
                assertEquals("divide by zero", outcome.reason());
            })
            .verifyComplete();
    }
}
