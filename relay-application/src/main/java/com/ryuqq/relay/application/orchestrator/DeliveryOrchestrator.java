package com.ryuqq.relay.application.orchestrator;

import com.ryuqq.relay.core.model.DeliveryOutcome;
import com.ryuqq.relay.core.model.DeliveryRequest;
import com.ryuqq.relay.core.protection.CircuitBreakerStatus;
import com.ryuqq.relay.core.protection.RateLimitStatus;

import java.util.Map;
import java.util.Optional;

/**
 * 발송 실행 조정자.
 *
 * <p>바운더리(HTTP 레이어 또는 임의의 호출자)에 노출되는 엔진의 유일한 진입점입니다.
 * 멱등성 검사, Rate Limit 검사 후 Provider를 우선순위 순서로 시도하고 최종 결과를 집계합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * DeliveryRequest request = new DeliveryRequest(to, subject, body, requestId);
 * DeliveryOutcome outcome = orchestrator.execute(request);
 *
 * if (outcome.success()) {
 *     // 200 OK
 *     String provider = outcome.providerUsed();
 * } else {
 *     // 실패 사유는 항상 존재
 *     String reason = outcome.errorMessage();
 * }
 * </pre>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public interface DeliveryOrchestrator {

    /**
     * 발송 실행.
     *
     * <p><strong>동작 방식:</strong></p>
     * <ol>
     *   <li>중복 requestId → 즉시 실패 ("duplicate request", attempts=0)</li>
     *   <li>Rate Limit 초과 → 즉시 실패 ("rate limit exceeded", attempts=0)</li>
     *   <li>Provider별: Circuit Breaker 거부 시 건너뜀, 허용 시 재시도 루프 수행</li>
     *   <li>첫 성공 시 requestId 완료 기록 후 반환</li>
     *   <li>모두 실패 시 providerUsed="none", 시도 횟수 합계, Provider별 실패 사유 반환</li>
     * </ol>
     *
     * @param request 발송 요청
     * @return 발송 결과 (timestampMs는 실행 시작 시각)
     * @throws IllegalArgumentException request가 null인 경우
     */
    DeliveryOutcome execute(DeliveryRequest request);

    /**
     * Provider별 Circuit Breaker 상태 스냅샷 조회.
     *
     * @return Provider 이름 → 상태 (우선순위 순서)
     */
    Map<String, CircuitBreakerStatus> getCircuitBreakerStatus();

    /**
     * 모든 Circuit Breaker를 CLOSED로 리셋 (관리 작업).
     *
     * <p>Rate Limiter와 멱등성 저장소는 리셋하지 않습니다.</p>
     */
    void resetCircuitBreakers();

    /**
     * 호출 가능한 Provider가 하나라도 있는지 조회.
     *
     * <p>Circuit Breaker 상태를 변경하지 않으므로, 헬스 체크에서 호출해도
     * HALF_OPEN 프로브 슬롯을 소모하지 않습니다.</p>
     *
     * @return 하나 이상의 Provider가 호출 가능하면 true
     */
    boolean isAnyProviderAvailable();

    /**
     * 우선순위 순서상 처음으로 호출 가능한 Provider 조회 (부작용 없음).
     *
     * @return Provider 이름, 없으면 empty
     */
    Optional<String> getBestAvailableProvider();

    /**
     * Rate Limiter 상태 조회.
     *
     * @return 현재 요청 수, 최대 요청 수, 윈도우 크기
     */
    RateLimitStatus getRateLimitStatus();

    /**
     * 서비스 상태 조회.
     *
     * @return Provider 목록, 재시도 설정, Circuit Breaker 상태
     */
    ServiceStatus getServiceStatus();
}
