package com.ryuqq.relay.application.orchestrator;

import com.ryuqq.relay.core.protection.CircuitBreakerStatus;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 서비스 상태 (읽기 모델).
 *
 * @param providers Provider 이름 목록 (우선순위 순서)
 * @param maxAttempts Provider당 최대 시도 횟수
 * @param baseDelay 재시도 기본 지연 시간
 * @param circuitBreakers Provider 이름 → Circuit Breaker 상태
 * @author Relay Team
 * @since 1.0.0
 */
public record ServiceStatus(
    List<String> providers,
    int maxAttempts,
    Duration baseDelay,
    Map<String, CircuitBreakerStatus> circuitBreakers
) {

    /**
     * Compact Constructor.
     *
     * <p>컬렉션은 방어적으로 복사되며, circuitBreakers는 입력 순서를 유지합니다.</p>
     *
     * @throws IllegalArgumentException 필수 필드가 null인 경우
     */
    public ServiceStatus {
        if (providers == null || baseDelay == null || circuitBreakers == null) {
            throw new IllegalArgumentException("providers, baseDelay and circuitBreakers are required");
        }
        providers = List.copyOf(providers);
        circuitBreakers = Collections.unmodifiableMap(new LinkedHashMap<>(circuitBreakers));
    }
}
