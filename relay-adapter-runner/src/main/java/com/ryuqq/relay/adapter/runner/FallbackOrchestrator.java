package com.ryuqq.relay.adapter.runner;

import com.ryuqq.relay.application.orchestrator.DeliveryOrchestrator;
import com.ryuqq.relay.application.orchestrator.ServiceStatus;
import com.ryuqq.relay.core.event.AttemptFailed;
import com.ryuqq.relay.core.event.AttemptSucceeded;
import com.ryuqq.relay.core.event.DeliveryEvent;
import com.ryuqq.relay.core.event.DeliveryEventListener;
import com.ryuqq.relay.core.event.ProviderSkipped;
import com.ryuqq.relay.core.event.RequestRejected;
import com.ryuqq.relay.core.model.DeliveryOutcome;
import com.ryuqq.relay.core.model.DeliveryRequest;
import com.ryuqq.relay.core.outcome.Delivered;
import com.ryuqq.relay.core.outcome.Denied;
import com.ryuqq.relay.core.outcome.Exhausted;
import com.ryuqq.relay.core.outcome.ProviderResult;
import com.ryuqq.relay.core.protection.CircuitBreaker;
import com.ryuqq.relay.core.protection.CircuitBreakerFactory;
import com.ryuqq.relay.core.protection.CircuitBreakerStatus;
import com.ryuqq.relay.core.protection.RateLimitStatus;
import com.ryuqq.relay.core.protection.RateLimiter;
import com.ryuqq.relay.core.provider.DeliveryFailure;
import com.ryuqq.relay.core.provider.DeliveryProvider;
import com.ryuqq.relay.core.retry.DeliveryInterruptedException;
import com.ryuqq.relay.core.retry.RetryPolicy;
import com.ryuqq.relay.core.retry.Sleeper;
import com.ryuqq.relay.core.spi.IdempotencyGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Fallback Chain 기반 발송 Orchestrator 구현체.
 *
 * <p>우선순위 순서로 Provider를 시도하며, 각 Provider는 자신의 Circuit Breaker와
 * 독립된 재시도 한도로 보호됩니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * execute(request)
 *   ↓
 * 1. IdempotencyGuard.isDuplicate → "duplicate request" (시도 0회)
 * 2. RateLimiter.isLimited       → "rate limit exceeded" (시도 0회)
 * 3. For each Provider (우선순위 순):
 *      CircuitBreaker.tryAcquire 거부 → Denied, 다음 Provider
 *      재시도 루프 (RetryPolicy)
 *        - 성공 → recordSuccess + markComplete → 성공 반환
 *        - 소진 → recordFailure → 다음 Provider
 * 4. 모두 실패 → providerUsed="none", Provider별 사유 연결
 * </pre>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>Orchestrator 자체는 불변 상태만 보유 (thread-safe)</li>
 *   <li>공유 상태(Breaker, Limiter, Guard)의 원자성은 각 구현체가 보장</li>
 *   <li>재시도 대기는 호출 스레드에서만 발생하며 다른 호출을 막지 않음</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Clock clock = Clock.systemUTC();
 * DeliveryOrchestrator orchestrator = new FallbackOrchestrator(
 *     List.of(SimulatedDeliveryProvider.sendGrid(), SimulatedDeliveryProvider.mailgun()),
 *     InMemoryCircuitBreaker.factory(new CircuitBreakerConfig(), clock),
 *     new SlidingWindowRateLimiter(clock),
 *     new InMemoryIdempotencyGuard(),
 *     new FallbackOrchestratorConfig()
 * );
 *
 * DeliveryOutcome outcome = orchestrator.execute(request);
 * </pre>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class FallbackOrchestrator implements DeliveryOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(FallbackOrchestrator.class);

    static final String DUPLICATE_MESSAGE = "duplicate request";
    static final String RATE_LIMITED_MESSAGE = "rate limit exceeded";

    private final List<ProviderSlot> slots;
    private final RateLimiter rateLimiter;
    private final IdempotencyGuard idempotencyGuard;
    private final RetryPolicy retryPolicy;
    private final DeliveryEventListener listener;
    private final Sleeper sleeper;
    private final Clock clock;

    /**
     * 생성자 (SLF4J Listener, 실제 sleep, 시스템 UTC Clock 사용).
     *
     * @param providers 우선순위 순서의 Provider 목록 (첫 번째가 Primary)
     * @param breakerFactory Provider별 Circuit Breaker 생성기
     * @param rateLimiter 전역 Rate Limiter
     * @param idempotencyGuard 전역 중복 방지 저장소
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null이거나 Provider 목록이 유효하지 않은 경우
     */
    public FallbackOrchestrator(List<? extends DeliveryProvider> providers,
                                CircuitBreakerFactory breakerFactory,
                                RateLimiter rateLimiter,
                                IdempotencyGuard idempotencyGuard,
                                FallbackOrchestratorConfig config) {
        this(providers, breakerFactory, rateLimiter, idempotencyGuard, config,
            new Slf4jDeliveryEventListener(), Sleeper.threadSleep(), Clock.systemUTC());
    }

    /**
     * 생성자 (모든 협력 객체 주입).
     *
     * @param providers 우선순위 순서의 Provider 목록 (첫 번째가 Primary)
     * @param breakerFactory Provider별 Circuit Breaker 생성기
     * @param rateLimiter 전역 Rate Limiter
     * @param idempotencyGuard 전역 중복 방지 저장소
     * @param config 설정
     * @param listener 이벤트 수신자 (Circuit Breaker에도 전달됨)
     * @param sleeper 재시도 대기 수단
     * @param clock 시간 소스 (outcome timestamp용)
     * @throws IllegalArgumentException 의존성이 null이거나 Provider 목록이 유효하지 않은 경우
     */
    public FallbackOrchestrator(List<? extends DeliveryProvider> providers,
                                CircuitBreakerFactory breakerFactory,
                                RateLimiter rateLimiter,
                                IdempotencyGuard idempotencyGuard,
                                FallbackOrchestratorConfig config,
                                DeliveryEventListener listener,
                                Sleeper sleeper,
                                Clock clock) {
        if (providers == null || providers.isEmpty()) {
            throw new IllegalArgumentException("providers cannot be null or empty");
        }
        if (breakerFactory == null) {
            throw new IllegalArgumentException("breakerFactory cannot be null");
        }
        if (rateLimiter == null) {
            throw new IllegalArgumentException("rateLimiter cannot be null");
        }
        if (idempotencyGuard == null) {
            throw new IllegalArgumentException("idempotencyGuard cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }

        this.rateLimiter = rateLimiter;
        this.idempotencyGuard = idempotencyGuard;
        this.retryPolicy = config.retryPolicy();
        this.listener = listener;
        this.sleeper = sleeper;
        this.clock = clock;
        // Breaker 이벤트도 publish를 거쳐 Listener 예외가 호출자에게 전파되지 않음
        this.slots = createSlots(providers, breakerFactory, this::publish);
    }

    /**
     * Provider마다 전용 Circuit Breaker 생성 (우선순위 순서 유지).
     */
    private static List<ProviderSlot> createSlots(List<? extends DeliveryProvider> providers,
                                                  CircuitBreakerFactory breakerFactory,
                                                  DeliveryEventListener listener) {
        Set<String> names = new HashSet<>();
        List<ProviderSlot> created = new ArrayList<>(providers.size());
        for (DeliveryProvider provider : providers) {
            if (provider == null) {
                throw new IllegalArgumentException("providers cannot contain null");
            }
            String name = provider.getName();
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("provider name cannot be null or blank");
            }
            if (!names.add(name)) {
                throw new IllegalArgumentException("duplicate provider name: " + name);
            }
            CircuitBreaker breaker = breakerFactory.create(name, listener);
            if (breaker == null) {
                throw new IllegalArgumentException("breakerFactory returned null for " + name);
            }
            created.add(new ProviderSlot(name, provider, breaker));
        }
        return List.copyOf(created);
    }

    @Override
    public DeliveryOutcome execute(DeliveryRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }

        // 시작 시각 기준 (완료 시각 아님)
        long startedAt = clock.millis();
        String requestId = request.requestId();

        // 1. 중복 요청 거부
        if (idempotencyGuard.isDuplicate(requestId)) {
            publish(new RequestRejected(requestId, RequestRejected.Reason.DUPLICATE));
            return DeliveryOutcome.rejected(requestId, DUPLICATE_MESSAGE, startedAt);
        }

        // 2. Rate Limit 거부
        if (rateLimiter.isLimited()) {
            publish(new RequestRejected(requestId, RequestRejected.Reason.RATE_LIMITED));
            return DeliveryOutcome.rejected(requestId, RATE_LIMITED_MESSAGE, startedAt);
        }

        // 3. Fallback Chain
        List<ProviderResult> results = new ArrayList<>(slots.size());
        int totalAttempts = 0;

        for (ProviderSlot slot : slots) {
            if (!slot.breaker().tryAcquire()) {
                String reason = deniedReason(slot);
                results.add(new Denied(slot.name(), reason));
                publish(new ProviderSkipped(requestId, slot.name(), reason));
                continue;
            }

            ProviderResult result = attemptAdmitted(slot, request);
            results.add(result);

            if (result instanceof Delivered delivered) {
                idempotencyGuard.markComplete(requestId);
                return DeliveryOutcome.delivered(requestId, slot.name(), delivered.attempts(), startedAt, results);
            }

            totalAttempts += result.attempts();
        }

        // 4. 모든 Provider 소진
        return DeliveryOutcome.exhausted(requestId, totalAttempts, aggregateErrors(results), startedAt, results);
    }

    /**
     * Breaker가 허용한 Provider를 실행하고 결과를 Breaker에 기록.
     *
     * <p>결과를 기록하지 못한 채 빠져나가는 경우(인터럽트, Error, Sleeper 예외)에는
     * {@link CircuitBreaker#releasePermission()}으로 허용을 반환합니다.
     * HALF_OPEN probe 슬롯이 점유된 채 남지 않습니다.</p>
     *
     * @return {@link Delivered} 또는 {@link Exhausted}
     */
    private ProviderResult attemptAdmitted(ProviderSlot slot, DeliveryRequest request) {
        boolean recorded = false;
        try {
            ProviderResult result = attemptWithRetries(slot, request);
            if (result instanceof Delivered) {
                slot.breaker().recordSuccess();
            } else {
                slot.breaker().recordFailure();
            }
            recorded = true;
            return result;
        } finally {
            if (!recorded) {
                slot.breaker().releasePermission();
            }
        }
    }

    /**
     * 단일 Provider에 대한 재시도 루프.
     *
     * <p>성공 시 즉시 반환하며, 마지막 시도 이후에는 대기하지 않습니다.</p>
     *
     * @return {@link Delivered} 또는 {@link Exhausted}
     * @throws DeliveryInterruptedException 대기 중 인터럽트 발생 시
     */
    private ProviderResult attemptWithRetries(ProviderSlot slot, DeliveryRequest request) {
        int maxAttempts = retryPolicy.getMaxAttempts();
        String lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                slot.provider().attemptDelivery(request);
                publish(new AttemptSucceeded(request.requestId(), slot.name(), attempt));
                return new Delivered(slot.name(), attempt);
            } catch (DeliveryFailure | RuntimeException e) {
                lastError = reasonOf(e);
            }

            Duration delay = retryPolicy.delayAfter(attempt);
            publish(new AttemptFailed(request.requestId(), slot.name(), attempt, maxAttempts, lastError, delay));

            if (attempt < maxAttempts) {
                backoff(slot, request, delay);
            }
        }

        return new Exhausted(slot.name(), maxAttempts, lastError);
    }

    private void backoff(ProviderSlot slot, DeliveryRequest request, Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeliveryInterruptedException(
                "Interrupted while backing off from " + slot.name() + " (requestId: " + request.requestId() + ")", e);
        }
    }

    private static String deniedReason(ProviderSlot slot) {
        return "Circuit breaker is " + slot.breaker().getState() + " - " + slot.name() + " temporarily unavailable";
    }

    private static String reasonOf(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getName() : message;
    }

    /**
     * "SendGrid: reason; Mailgun: reason" 형식으로 Provider별 실패 사유 연결.
     */
    private static String aggregateErrors(List<ProviderResult> results) {
        return results.stream()
            .map(result -> result.providerName() + ": " + failureReason(result))
            .collect(Collectors.joining("; "));
    }

    private static String failureReason(ProviderResult result) {
        if (result instanceof Exhausted exhausted) {
            return exhausted.lastError();
        }
        if (result instanceof Denied denied) {
            return denied.reason();
        }
        throw new IllegalStateException("Unexpected result in failure path: " + result);
    }

    private void publish(DeliveryEvent event) {
        try {
            listener.onEvent(event);
        } catch (RuntimeException e) {
            log.warn("DeliveryEventListener failed for {}", event, e);
        }
    }

    @Override
    public Map<String, CircuitBreakerStatus> getCircuitBreakerStatus() {
        Map<String, CircuitBreakerStatus> status = new LinkedHashMap<>();
        for (ProviderSlot slot : slots) {
            status.put(slot.name(), slot.breaker().getStatus());
        }
        return Collections.unmodifiableMap(status);
    }

    @Override
    public void resetCircuitBreakers() {
        for (ProviderSlot slot : slots) {
            slot.breaker().reset();
        }
        log.info("Circuit breakers reset for {} providers", slots.size());
    }

    @Override
    public boolean isAnyProviderAvailable() {
        return slots.stream().anyMatch(slot -> slot.breaker().isCallPermitted());
    }

    @Override
    public Optional<String> getBestAvailableProvider() {
        return slots.stream()
            .filter(slot -> slot.breaker().isCallPermitted())
            .map(ProviderSlot::name)
            .findFirst();
    }

    @Override
    public RateLimitStatus getRateLimitStatus() {
        return rateLimiter.getStatus();
    }

    @Override
    public ServiceStatus getServiceStatus() {
        List<String> names = slots.stream().map(ProviderSlot::name).collect(Collectors.toList());
        return new ServiceStatus(names, retryPolicy.getMaxAttempts(), retryPolicy.getBaseDelay(),
            getCircuitBreakerStatus());
    }

    /**
     * Provider와 전용 Circuit Breaker의 묶음.
     */
    private record ProviderSlot(String name, DeliveryProvider provider, CircuitBreaker breaker) {
    }
}
