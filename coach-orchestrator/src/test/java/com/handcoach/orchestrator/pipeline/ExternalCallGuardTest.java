package com.handcoach.orchestrator.pipeline;

import com.handcoach.common.exception.NarrativeServiceException;
import com.handcoach.orchestrator.logger.PipelineFlowLogger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ExternalCallGuardTest {

    private ExternalCallGuard guard;

    @BeforeEach
    void setUp() {
        guard = new ExternalCallGuard(new PipelineFlowLogger());
        ReflectionTestUtils.setField(guard, "timeoutMs", 200L);
    }

    @Test
    @DisplayName("a successful call is passed through untouched")
    void success() {
        StepVerifier.create(guard.call("Stage", () -> Mono.just("live"), () -> "fallback"))
            .assertNext(outcome -> {
                assertEquals("live", outcome.value());
                assertFalse(outcome.fallbackUsed());
                assertNull(outcome.reason());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("an error signal yields the fallback with the error message as reason")
    void errorSignal() {
        StepVerifier.create(guard.call("Stage",
                () -> Mono.<String>error(new NarrativeServiceException("Stage", "boom")), () -> "fallback"))
            .assertNext(outcome -> {
                assertEquals("fallback", outcome.value());
                assertTrue(outcome.fallbackUsed());
                assertEquals("[Stage] boom", outcome.reason());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("a call slower than the timeout is treated like an error")
    void timeout() {
        StepVerifier.create(guard.call("Stage",
                () -> Mono.just("late").delayElement(Duration.ofSeconds(5)), () -> "fallback"))
            .assertNext(outcome -> {
                assertEquals("fallback", outcome.value());
                assertEquals("timeout", outcome.reason());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("an empty result and a call that throws while being built both fall back")
    void emptyAndThrowing() {
        StepVerifier.create(guard.call("Stage", Mono::<String>empty, () -> "fallback"))
            .assertNext(outcome -> assertTrue(outcome.fallbackUsed()))
            .verifyComplete();

        StepVerifier.create(guard.call("Stage", () -> {
                throw new IllegalStateException("no client");
            }, () -> "fallback"))
            .assertNext(outcome -> {
                assertTrue(outcome.fallbackUsed());
                assertEquals("no client", outcome.reason());
            })
            .verifyComplete();
    }
}
