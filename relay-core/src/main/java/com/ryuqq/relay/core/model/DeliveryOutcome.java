package com.ryuqq.relay.core.model;

import com.ryuqq.relay.core.outcome.ProviderResult;

import java.util.List;

/**
 * 발송 실행 결과.
 *
 * <p>{@code execute} 호출 한 번당 하나씩 생성되며, 생성 이후 변경되지 않습니다.
 * 호출자에게 반환될 뿐 저장되지 않습니다.</p>
 *
 * <p><strong>필드 규칙:</strong></p>
 * <ul>
 *   <li>success=true: providerUsed는 성공한 Provider 이름, attempts는 해당 Provider의 시도 횟수</li>
 *   <li>입력 거부 (중복, Rate Limit): attempts=0, providerUsed=null</li>
 *   <li>모든 Provider 소진: providerUsed="none", attempts는 Provider별 시도 횟수의 합</li>
 *   <li>실패 시 errorMessage는 항상 존재</li>
 * </ul>
 *
 * @param success 발송 성공 여부
 * @param providerUsed 사용된 Provider 이름 (입력 거부 시 null)
 * @param attempts 시도 횟수
 * @param errorMessage 실패 사유 (성공 시 null)
 * @param timestampMs {@code execute} 시작 시각 (epoch millis)
 * @param requestId 요청 ID
 * @param providerResults 우선순위 순서로 조회된 Provider별 결과
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record DeliveryOutcome(
    boolean success,
    String providerUsed,
    int attempts,
    String errorMessage,
    long timestampMs,
    String requestId,
    List<ProviderResult> providerResults
) {

    /**
     * 모든 Provider가 실패했을 때의 providerUsed 값.
     */
    public static final String NO_PROVIDER = "none";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException requestId가 비어 있거나, attempts가 음수이거나,
     *                                  실패 결과에 errorMessage가 없는 경우
     */
    public DeliveryOutcome {
        if (requestId == null || requestId.isBlank()) {
            throw new IllegalArgumentException("requestId cannot be null or blank");
        }
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts cannot be negative (current: " + attempts + ")");
        }
        if (!success && (errorMessage == null || errorMessage.isBlank())) {
            throw new IllegalArgumentException("errorMessage is required for a failed outcome");
        }
        providerResults = providerResults == null ? List.of() : List.copyOf(providerResults);
    }

    /**
     * 발송 성공 결과 생성.
     *
     * @param requestId 요청 ID
     * @param providerUsed 성공한 Provider 이름
     * @param attempts 성공한 Provider에서의 시도 횟수
     * @param timestampMs 실행 시작 시각
     * @param providerResults Provider별 결과
     * @return 성공 결과
     */
    public static DeliveryOutcome delivered(String requestId, String providerUsed, int attempts,
                                            long timestampMs, List<ProviderResult> providerResults) {
        return new DeliveryOutcome(true, providerUsed, attempts, null, timestampMs, requestId, providerResults);
    }

    /**
     * 입력 거부 결과 생성 (Provider를 호출하지 않음).
     *
     * @param requestId 요청 ID
     * @param errorMessage 거부 사유
     * @param timestampMs 실행 시작 시각
     * @return 거부 결과
     */
    public static DeliveryOutcome rejected(String requestId, String errorMessage, long timestampMs) {
        return new DeliveryOutcome(false, null, 0, errorMessage, timestampMs, requestId, List.of());
    }

    /**
     * 모든 Provider 소진 결과 생성.
     *
     * @param requestId 요청 ID
     * @param attempts Provider별 시도 횟수의 합
     * @param errorMessage Provider 이름별로 표기한 실패 사유
     * @param timestampMs 실행 시작 시각
     * @param providerResults Provider별 결과
     * @return 실패 결과
     */
    public static DeliveryOutcome exhausted(String requestId, int attempts, String errorMessage,
                                            long timestampMs, List<ProviderResult> providerResults) {
        return new DeliveryOutcome(false, NO_PROVIDER, attempts, errorMessage, timestampMs, requestId, providerResults);
    }
}
