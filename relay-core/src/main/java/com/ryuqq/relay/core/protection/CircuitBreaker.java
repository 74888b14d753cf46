package com.ryuqq.relay.core.protection;

/**
 * Circuit Breaker SPI.
 *
 * <p>Provider 하나의 건강 상태를 추적하고 호출마다 통과 여부를 결정합니다.
 * 인스턴스는 Provider마다 하나씩 생성되어 오케스트레이터가 단독으로 소유하며,
 * Provider 간에 공유되지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * if (!cb.tryAcquire()) {
 *     // OPEN 또는 프로브 진행 중
 *     return new Denied(provider.getName(), "Circuit breaker is OPEN");
 * }
 *
 * for (int attempt = 1; attempt <= maxAttempts; attempt++) {
 *     try {
 *         provider.attemptDelivery(request);
 *         cb.recordSuccess();
 *         return new Delivered(provider.getName(), attempt);
 *     } catch (DeliveryFailure e) {
 *         lastError = e.getMessage();
 *     }
 * }
 * cb.recordFailure();
 * }</pre>
 *
 * <p><strong>조회와 통과 판정의 분리:</strong></p>
 * <ul>
 *   <li>{@link #tryAcquire()}: 상태를 바꿀 수 있음 (OPEN → HALF_OPEN, 프로브 슬롯 점유)</li>
 *   <li>{@link #isCallPermitted()}, {@link #getState()}, {@link #getStatus()}: 상태를 바꾸지 않음</li>
 * </ul>
 *
 * <p>구현체는 thread-safe해야 하며, 각 메서드의 읽기-수정-쓰기는 서로에 대해 원자적이어야 합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * Circuit Breaker 이름 (Provider 이름).
     *
     * @return 이름
     */
    String getName();

    /**
     * 호출 통과 허용 여부 판정.
     *
     * <ul>
     *   <li>CLOSED: 항상 true</li>
     *   <li>OPEN: now ≥ nextAttemptTime이면 HALF_OPEN으로 전이하고 프로브 슬롯을 점유한 뒤 true,
     *       아니면 false</li>
     *   <li>HALF_OPEN: 프로브 슬롯이 비어 있으면 점유하고 true, 진행 중인 프로브가 있으면 false</li>
     * </ul>
     *
     * @return true: 호출 허용, false: 호출 차단
     */
    boolean tryAcquire();

    /**
     * 현재 시점에 {@link #tryAcquire()}가 true를 반환할지 조회 (부작용 없음).
     *
     * <p>헬스 체크처럼 실제 호출 없이 가용성을 확인할 때 사용합니다.
     * 이 메서드는 HALF_OPEN 전이나 프로브 슬롯 점유를 일으키지 않습니다.</p>
     *
     * @return 호출이 허용될 상태인지 여부
     */
    boolean isCallPermitted();

    /**
     * 성공 기록.
     *
     * <p>실패 카운트를 0으로 초기화하고, HALF_OPEN이면 CLOSED로 전이합니다.</p>
     */
    void recordSuccess();

    /**
     * 실패 기록.
     *
     * <ul>
     *   <li>마지막 실패 이후 monitoringWindow가 지났으면 카운트를 먼저 0으로 초기화</li>
     *   <li>카운트 증가, lastFailureTime 갱신</li>
     *   <li>카운트 ≥ failureThreshold: OPEN 전이, nextAttemptTime = now + recoveryTimeout</li>
     *   <li>HALF_OPEN에서 호출되면 임계값과 무관하게 OPEN 전이</li>
     * </ul>
     */
    void recordFailure();

    /**
     * 성공/실패를 기록하지 않고 점유한 프로브 슬롯 반환.
     *
     * <p>허가를 받은 호출이 결과 없이 중단된 경우(인터럽트 등) 호출합니다.
     * HALF_OPEN 상태는 유지되며, 다음 호출자가 프로브를 수행할 수 있습니다.</p>
     */
    void releasePermission();

    /**
     * 현재 상태 조회 (부작용 없음).
     *
     * @return CLOSED, OPEN, HALF_OPEN 중 하나
     */
    CircuitBreakerState getState();

    /**
     * 상태 스냅샷 조회 (부작용 없음).
     *
     * @return 상태 스냅샷
     */
    CircuitBreakerStatus getStatus();

    /**
     * CLOSED 상태로 강제 리셋.
     *
     * <p>모든 카운터와 타이머를 초기화합니다.
     * 관리 목적의 수동 복구 수단이며, 엔진이 자동으로 호출하지 않습니다.</p>
     */
    void reset();
}
