package com.resonanceloop.engine.convergence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.resonanceloop.common.exception.ProfileNotFoundException;
import com.resonanceloop.common.model.ConvergencePair;
import com.resonanceloop.common.model.ConvergenceResult;
import com.resonanceloop.common.model.ConvergenceStatus;
import com.resonanceloop.common.model.FailureCause;
import com.resonanceloop.common.model.Outcome;
import com.resonanceloop.common.model.Request;
import com.resonanceloop.common.model.ScoreBreakdown;
import com.resonanceloop.common.model.ScoreDimension;
import com.resonanceloop.common.model.TransportErrorKind;
import com.resonanceloop.common.mutation.RequestMutator;
import com.resonanceloop.common.profile.ProfileStore;
import com.resonanceloop.common.profile.TargetProfile;
import com.resonanceloop.common.provenance.ProvenanceSink;
import com.resonanceloop.common.scoring.ResonanceScorer;
import com.resonanceloop.engine.logger.ConvergenceFlowLogger;
import com.resonanceloop.engine.profile.ClasspathProfileStore;
import com.resonanceloop.engine.stats.ConvergenceStatistics;
import com.resonanceloop.engine.transport.Transport;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Attempt loop behaviour with a stubbed transport and a scorer keyed on response content.
 */
@ExtendWith(MockitoExtension.class)
class ConvergenceControllerTest {

    private static final String SCENARIO = "A colleague asks whether to accept a risky promotion.";

    private static TargetProfile aurora;

    @Mock ProfileStore profileStore;
    @Mock Transport transport;
    @Mock ProvenanceSink provenanceSink;

    private final Map<String, Double> scripted = new HashMap<>();
    private ConvergenceStatistics statistics;
    private ConvergenceController controller;

    @BeforeAll
    static void loadProfile() {
        aurora = new ClasspathProfileStore(new ObjectMapper(), "classpath*:profiles/*.json").getProfile("aurora");
    }

    @BeforeEach
    void setUp() {
        ResonanceScorer scorer = (content, profile) -> uniform(scripted.getOrDefault(content, 0.0));
        statistics = new ConvergenceStatistics();
        controller = new ConvergenceController(profileStore, transport, scorer, new RequestMutator(),
                                               provenanceSink, new ConvergenceSettings(3, 0.85, Duration.ZERO),
                                               new ConvergenceFlowLogger(), statistics);
    }

    private static ScoreBreakdown uniform(double value) {
        Map<ScoreDimension, Double> dims = new EnumMap<>(ScoreDimension.class);
        for (ScoreDimension d : ScoreDimension.values()) dims.put(d, value);
        return new ScoreBreakdown(dims, value, ScoreDimension.TONE, List.of(), List.of(), 120);
    }

    private static Mono<Outcome> ok(String content) {
        return Mono.just(Outcome.success(content, 5, 1, null));
    }

    private static Mono<Outcome> rateLimited() {
        return Mono.just(Outcome.failure(TransportErrorKind.RATE_LIMITED, "HTTP 429", 5, 3));
    }

    private void givenAurora() {
        when(profileStore.getProfile("aurora")).thenReturn(aurora);
    }

    private ConvergenceResult run(ConvergencePair pair) {
        return controller.converge(pair).block(Duration.ofSeconds(5));
    }

    private List<Request> sentRequests(int times) {
        ArgumentCaptor<Request> captor = ArgumentCaptor.forClass(Request.class);
        verify(transport, times(times)).send(captor.capture());
        return captor.getAllValues();
    }

    // ── terminal outcomes ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("terminal outcomes")
    class Terminal {

        @Test
        @DisplayName("scores 0.40, 0.60, 0.90 → SUCCESS at the third attempt")
        void convergesOnThirdAttempt() {
            givenAurora();
            scripted.putAll(Map.of("r1", 0.40, "r2", 0.60, "r3", 0.90));
            when(transport.send(any())).thenReturn(ok("r1"), ok("r2"), ok("r3"));

            ConvergenceResult result = run(new ConvergencePair("aurora", SCENARIO, 3, 0.85));

            assertThat(result.status()).isEqualTo(ConvergenceStatus.SUCCESS);
            assertThat(result.cause()).isEqualTo(FailureCause.NONE);
            assertThat(result.successfulAttempt()).isEqualTo(3);
            assertThat(result.totalAttempts()).isEqualTo(3);
            assertThat(result.bestAttempt().index()).isEqualTo(3);
            assertThat(result.bestOverall()).isEqualTo(0.90);
            assertThat(result.reason()).startsWith("converged at attempt 3");
            verify(provenanceSink).persist(result);

            List<Request> sent = sentRequests(3);
            assertThat(sent.get(0).revision()).isZero();
            assertThat(sent.get(1).appliedStrategies()).containsExactly("tone_booster");
            assertThat(sent.get(2).appliedStrategies()).containsExactly("tone_booster", "comprehensive_booster");
            assertThat(sent).allSatisfy(r -> assertThat(r.prompt()).contains(SCENARIO));
            assertThat(result.attempts().get(0).strategyTag()).isNull();
            assertThat(result.attempts().get(2).strategyTag()).isEqualTo("comprehensive_booster");
        }

        @Test
        @DisplayName("rate limited on every attempt → ERROR after exactly three sends")
        void transportExhausted() {
            givenAurora();
            when(transport.send(any())).thenReturn(rateLimited());

            ConvergenceResult result = run(new ConvergencePair("aurora", SCENARIO, 3, 0.85));

            assertThat(result.status()).isEqualTo(ConvergenceStatus.ERROR);
            assertThat(result.cause()).isEqualTo(FailureCause.TRANSPORT_EXHAUSTED);
            assertThat(result.totalAttempts()).isEqualTo(3);
            assertThat(result.bestAttempt()).isNull();
            assertThat(result.bestOverall()).isZero();
            assertThat(result.reason()).contains("RATE_LIMITED");
            verifyNoInteractions(provenanceSink);

            List<Request> sent = sentRequests(3);
            assertThat(sent).allSatisfy(r -> assertThat(r).isEqualTo(sent.get(0)));
        }

        @Test
        @DisplayName("unknown profile → ERROR with zero transport calls")
        void unknownProfile() {
            when(profileStore.getProfile("ghost")).thenThrow(new ProfileNotFoundException("ghost"));

            ConvergenceResult result = run(ConvergencePair.of("ghost", SCENARIO));

            assertThat(result.status()).isEqualTo(ConvergenceStatus.ERROR);
            assertThat(result.cause()).isEqualTo(FailureCause.PROFILE_NOT_FOUND);
            assertThat(result.totalAttempts()).isZero();
            assertThat(result.attempts()).isEmpty();
            assertThat(result.reason()).contains("ghost");
            verifyNoInteractions(transport, provenanceSink);
        }

        @Test
        @DisplayName("budget spent below threshold → FAILURE reporting the best attempt")
        void exhaustedKeepsBestAttempt() {
            givenAurora();
            scripted.putAll(Map.of("r1", 0.70, "r2", 0.50, "r3", 0.60));
            when(transport.send(any())).thenReturn(ok("r1"), ok("r2"), ok("r3"));

            ConvergenceResult result = run(ConvergencePair.of("aurora", SCENARIO));

            assertThat(result.status()).isEqualTo(ConvergenceStatus.FAILURE);
            assertThat(result.cause()).isEqualTo(FailureCause.CONVERGENCE_EXHAUSTED);
            assertThat(result.successfulAttempt()).isNull();
            assertThat(result.bestAttempt().index()).isEqualTo(1);
            assertThat(result.bestOverall()).isEqualTo(0.70);
            assertThat(result.reason()).contains("best overall 0.700 (attempt 1)").contains("tone=0.700");
            verifyNoInteractions(provenanceSink);
        }

        @Test
        @DisplayName("equal scores keep the earliest attempt as best")
        void tieKeepsEarliest() {
            givenAurora();
            scripted.putAll(Map.of("r1", 0.60, "r2", 0.60, "r3", 0.40));
            when(transport.send(any())).thenReturn(ok("r1"), ok("r2"), ok("r3"));

            ConvergenceResult result = run(ConvergencePair.of("aurora", SCENARIO));

            assertThat(result.bestAttempt().index()).isEqualTo(1);
        }
    }

    // ── loop mechanics ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("loop mechanics")
    class Mechanics {

        @Test
        @DisplayName("a transport failure consumes an attempt and the same request is re-sent")
        void transportFailureResendsUnchanged() {
            givenAurora();
            scripted.put("good", 0.95);
            when(transport.send(any())).thenReturn(rateLimited(), ok("good"));

            ConvergenceResult result = run(ConvergencePair.of("aurora", SCENARIO));

            assertThat(result.status()).isEqualTo(ConvergenceStatus.SUCCESS);
            assertThat(result.successfulAttempt()).isEqualTo(2);
            assertThat(result.attempts().get(0).breakdown()).isNull();
            assertThat(result.attempts().get(1).strategyTag()).isNull();
            List<Request> sent = sentRequests(2);
            assertThat(sent.get(1)).isEqualTo(sent.get(0));
        }

        @Test
        @DisplayName("per-pair budget overrides the engine default")
        void pairBudgetOverride() {
            givenAurora();
            when(transport.send(any())).thenReturn(ok("weak"));

            ConvergenceResult single = run(new ConvergencePair("aurora", SCENARIO, 1, null));
            assertThat(single.totalAttempts()).isEqualTo(1);
            assertThat(single.status()).isEqualTo(ConvergenceStatus.FAILURE);

            ConvergenceResult five = run(new ConvergencePair("aurora", SCENARIO, 5, null));
            assertThat(five.totalAttempts()).isEqualTo(5);
            assertThat(five.attempts().get(4).request().appliedStrategies()).hasSize(4);
            verify(transport, times(6)).send(any());
        }

        @Test
        @DisplayName("a failing provenance sink does not change a SUCCESS")
        void provenanceFailureIsNonCritical() {
            givenAurora();
            scripted.put("good", 0.95);
            when(transport.send(any())).thenReturn(ok("good"));
            doThrow(new IllegalStateException("disk full")).when(provenanceSink).persist(any());

            ConvergenceResult result = run(ConvergencePair.of("aurora", SCENARIO));

            assertThat(result.status()).isEqualTo(ConvergenceStatus.SUCCESS);
            verify(provenanceSink).persist(result);
        }

        @Test
        @DisplayName("threshold zero accepts a zero score")
        void zeroThreshold() {
            givenAurora();
            when(transport.send(any())).thenReturn(ok("nothing relevant"));

            ConvergenceResult result = run(new ConvergencePair("aurora", SCENARIO, 3, 0.0));

            assertThat(result.status()).isEqualTo(ConvergenceStatus.SUCCESS);
            assertThat(result.successfulAttempt()).isEqualTo(1);
        }

        @Test
        @DisplayName("every terminal result is counted in the statistics")
        void statisticsRecorded() {
            givenAurora();
            scripted.put("good", 0.95);
            when(transport.send(any())).thenReturn(ok("good"));

            run(ConvergencePair.of("aurora", SCENARIO));

            assertThat(statistics.snapshot().totalRuns()).isEqualTo(1);
            assertThat(statistics.snapshot().successes()).isEqualTo(1);
        }
    }

    // ── cancellation ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("cancellation")
    class Cancellation {

        @Test
        @DisplayName("a token cancelled up front stops the run before any send")
        void cancelledBeforeStart() {
            givenAurora();
            CancellationToken token = CancellationToken.create();
            token.cancel();

            ConvergenceResult result = controller.converge(ConvergencePair.of("aurora", SCENARIO), token)
                .block(Duration.ofSeconds(5));

            assertThat(result.status()).isEqualTo(ConvergenceStatus.ERROR);
            assertThat(result.cause()).isEqualTo(FailureCause.CANCELLED);
            verifyNoInteractions(transport);
        }

        @Test
        @DisplayName("cancelling while an exchange is in flight discards its outcome")
        void cancelledInFlight() {
            givenAurora();
            CancellationToken token = CancellationToken.create();
            when(transport.send(any())).thenAnswer(invocation -> {
                token.cancel();
                return ok("late");
            });

            ConvergenceResult result = controller.converge(ConvergencePair.of("aurora", SCENARIO), token)
                .block(Duration.ofSeconds(5));

            assertThat(result.cause()).isEqualTo(FailureCause.CANCELLED);
            assertThat(result.attempts()).isEmpty();
            assertThat(result.reason()).isEqualTo("run cancelled during attempt 1");
            verify(transport, times(1)).send(any());
        }
    }
}
