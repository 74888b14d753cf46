package com.ryuqq.relay.adapter.runner;

import com.ryuqq.relay.application.orchestrator.DeliveryOrchestrator;
import com.ryuqq.relay.core.model.DeliveryOutcome;
import com.ryuqq.relay.core.model.DeliveryRequest;
import com.ryuqq.relay.core.retry.DeliveryInterruptedException;
import com.ryuqq.relay.testkit.fixture.DeliveryRequests;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * AsyncDeliveryRunner 유닛 테스트.
 *
 * @author Relay Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class AsyncDeliveryRunnerTest {

    @Mock
    private DeliveryOrchestrator orchestrator;

    private AsyncDeliveryRunner runner;

    @BeforeEach
    void setUp() {
        runner = new AsyncDeliveryRunner(orchestrator, new AsyncRunnerConfig().withConcurrency(2));
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        runner.shutdown();
    }

    @Test
    void submit_Orchestrator_결과로_future_완료() throws Exception {
        // given
        DeliveryRequest request = DeliveryRequests.withId("req-1");
        DeliveryOutcome outcome = DeliveryOutcome.delivered("req-1", "SendGrid", 1, 0L, List.of());
        when(orchestrator.execute(request)).thenReturn(outcome);

        // when
        CompletableFuture<DeliveryOutcome> future = runner.submit(request);

        // then
        assertThat(future.get(5, TimeUnit.SECONDS)).isEqualTo(outcome);
        verify(orchestrator).execute(request);
    }

    @Test
    void submit_실패_Outcome도_정상_완료() throws Exception {
        DeliveryRequest request = DeliveryRequests.withId("req-2");
        DeliveryOutcome rejected = DeliveryOutcome.rejected("req-2", "rate limit exceeded", 0L);
        when(orchestrator.execute(request)).thenReturn(rejected);

        assertThat(runner.submit(request).get(5, TimeUnit.SECONDS).success()).isFalse();
    }

    @Test
    void submit_Orchestrator_예외는_future_예외로_전달() {
        // given
        DeliveryRequest request = DeliveryRequests.withId("req-3");
        DeliveryInterruptedException failure = new DeliveryInterruptedException("interrupted", new InterruptedException());
        when(orchestrator.execute(request)).thenThrow(failure);

        // when
        CompletableFuture<DeliveryOutcome> future = runner.submit(request);

        // then
        assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
            .isInstanceOf(ExecutionException.class)
            .hasCause(failure);
    }

    @Test
    void submit_null_요청은_예외() {
        assertThatThrownBy(() -> runner.submit(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shutdown_이후_submit은_예외() throws InterruptedException {
        runner.shutdown();

        assertThat(runner.isShutdown()).isTrue();
        assertThatThrownBy(() -> runner.submit(DeliveryRequests.withId("req-4")))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void 생성자_null_인자는_예외() {
        assertThatThrownBy(() -> new AsyncDeliveryRunner(null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new AsyncDeliveryRunner(orchestrator, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void AsyncRunnerConfig_기본값과_검증() {
        AsyncRunnerConfig config = new AsyncRunnerConfig();

        assertThat(config.concurrency()).isEqualTo(5);
        assertThat(config.shutdownTimeoutMs()).isEqualTo(60_000);
        assertThatThrownBy(() -> config.withConcurrency(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> config.withShutdownTimeoutMs(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
