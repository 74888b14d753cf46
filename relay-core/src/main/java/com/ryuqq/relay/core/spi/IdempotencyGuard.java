package com.ryuqq.relay.core.spi;

/**
 * 멱등성 가드 SPI (Service Provider Interface).
 *
 * <p>발송이 완료된 requestId 집합을 관리하여 중복 요청을 거부합니다.</p>
 *
 * <p><strong>구현 책임:</strong></p>
 * <ul>
 *   <li>{@link #isDuplicate(String)}: 순수 멤버십 조회</li>
 *   <li>{@link #markComplete(String)}: 무조건 추가 (이미 있어도 예외 없음)</li>
 *   <li>만료/삭제 없음: 한 번 완료된 requestId는 프로세스 수명 동안 유지</li>
 *   <li>두 연산 각각은 원자적이고 thread-safe</li>
 * </ul>
 *
 * <p><strong>알려진 제약:</strong></p>
 * <p>markComplete는 발송 성공이 확인된 뒤에 호출됩니다. 따라서 같은 requestId로
 * 동시에 들어온 두 요청이 모두 isDuplicate=false를 관찰하고 함께 진행될 수 있는 구간이 존재합니다.
 * 완료 이후의 요청은 항상 중복으로 거부됩니다.</p>
 *
 * <p>만료 없는 저장 방식은 수명이 짧은 프로세스나 ID 공간이 제한된 환경에만 적합합니다.
 * 만료가 필요하면 별도 구현체(예: TTL 캐시, 데이터베이스 Unique Key)를 제공해야 합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public interface IdempotencyGuard {

    /**
     * 이미 완료된 requestId인지 조회.
     *
     * @param requestId 요청 ID
     * @return 완료 기록이 있으면 true
     * @throws IllegalArgumentException requestId가 null인 경우
     */
    boolean isDuplicate(String requestId);

    /**
     * requestId를 완료로 기록.
     *
     * @param requestId 요청 ID
     * @throws IllegalArgumentException requestId가 null인 경우
     */
    void markComplete(String requestId);
}
