package com.ryuqq.relay.core.protection.noop;

import com.ryuqq.relay.core.protection.CircuitBreaker;
import com.ryuqq.relay.core.protection.CircuitBreakerConfig;
import com.ryuqq.relay.core.protection.CircuitBreakerState;
import com.ryuqq.relay.core.protection.CircuitBreakerStatus;

/**
 * Circuit Breaker NoOp 구현.
 *
 * <p>모든 요청을 항상 허용하며, 상태 추적을 하지 않습니다.
 * 보호 없이 Provider를 체인에 넣고자 할 때 사용합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>tryAcquire(), isCallPermitted(): 항상 true 반환</li>
 *   <li>recordSuccess(), recordFailure(), releasePermission(), reset(): 아무 동작 안 함</li>
 *   <li>getState(): 항상 CLOSED 반환</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class NoOpCircuitBreaker implements CircuitBreaker {

    private static final CircuitBreakerConfig DEFAULT_CONFIG = new CircuitBreakerConfig();

    private final String name;

    /**
     * 생성자.
     *
     * @param name Provider 이름
     * @throws IllegalArgumentException name이 null이거나 빈 문자열인 경우
     */
    public NoOpCircuitBreaker(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean tryAcquire() {
        return true;
    }

    @Override
    public boolean isCallPermitted() {
        return true;
    }

    @Override
    public void recordSuccess() {
        // NoOp
    }

    @Override
    public void recordFailure() {
        // NoOp
    }

    @Override
    public void releasePermission() {
        // NoOp
    }

    @Override
    public CircuitBreakerState getState() {
        return CircuitBreakerState.CLOSED;
    }

    @Override
    public CircuitBreakerStatus getStatus() {
        return new CircuitBreakerStatus(name, CircuitBreakerState.CLOSED, 0, null, DEFAULT_CONFIG);
    }

    @Override
    public void reset() {
        // NoOp
    }
}
