package com.ryuqq.relay.adapter.runner;

import com.ryuqq.relay.application.orchestrator.DeliveryOrchestrator;
import com.ryuqq.relay.core.model.DeliveryOutcome;
import com.ryuqq.relay.core.model.DeliveryRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 비동기 발송 Runner.
 *
 * <p>각 {@code execute} 호출을 고정 크기 Worker Pool에서 독립된 작업 단위로 실행합니다.
 * 한 요청의 재시도 대기는 해당 Worker 스레드만 점유하므로 다른 요청의 진행을 막지 않습니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * submit(request)
 *   ↓
 * workerExecutor에 제출 → CompletableFuture 즉시 반환
 *   ↓
 * Worker: orchestrator.execute(request)
 *   - 정상 반환 → future 완료 (성공/실패 Outcome 모두)
 *   - 예외 (인터럽트 등) → future 예외 완료
 * </pre>
 *
 * <p><strong>종료:</strong> {@link #shutdown()}은 신규 제출을 막고, 설정된 시간만큼
 * 진행 중인 작업을 기다린 뒤 남은 작업을 인터럽트합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class AsyncDeliveryRunner implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AsyncDeliveryRunner.class);

    private final DeliveryOrchestrator orchestrator;
    private final AsyncRunnerConfig config;
    private final ExecutorService workerExecutor;

    /**
     * 생성자 (기본 설정 사용).
     *
     * @param orchestrator 발송 Orchestrator
     * @throws IllegalArgumentException orchestrator가 null인 경우
     */
    public AsyncDeliveryRunner(DeliveryOrchestrator orchestrator) {
        this(orchestrator, new AsyncRunnerConfig());
    }

    /**
     * 생성자.
     *
     * @param orchestrator 발송 Orchestrator
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public AsyncDeliveryRunner(DeliveryOrchestrator orchestrator, AsyncRunnerConfig config) {
        if (orchestrator == null) {
            throw new IllegalArgumentException("orchestrator cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.orchestrator = orchestrator;
        this.config = config;
        this.workerExecutor = Executors.newFixedThreadPool(config.concurrency(), new WorkerThreadFactory());
    }

    /**
     * 발송 요청을 비동기로 제출.
     *
     * @param request 발송 요청
     * @return 발송 결과 future
     * @throws IllegalArgumentException request가 null인 경우
     * @throws IllegalStateException Runner가 이미 종료된 경우
     */
    public CompletableFuture<DeliveryOutcome> submit(DeliveryRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        try {
            return CompletableFuture.supplyAsync(() -> orchestrator.execute(request), workerExecutor);
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("AsyncDeliveryRunner is shut down", e);
        }
    }

    /**
     * Runner 종료 (리소스 정리).
     *
     * <p>ExecutorService를 graceful shutdown하여 진행 중인 작업이
     * 완료되도록 대기합니다.</p>
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        workerExecutor.shutdown();
        if (!workerExecutor.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
            log.warn("AsyncDeliveryRunner did not terminate within {}ms, interrupting workers",
                config.shutdownTimeoutMs());
            workerExecutor.shutdownNow();
        }
    }

    public boolean isShutdown() {
        return workerExecutor.isShutdown();
    }

    @Override
    public void close() throws InterruptedException {
        shutdown();
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "relay-worker-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
