package com.ryuqq.relay.adapter.inmemory.protection;

import com.ryuqq.relay.core.event.CircuitStateChanged;
import com.ryuqq.relay.core.event.DeliveryEventListener;
import com.ryuqq.relay.core.protection.CircuitBreaker;
import com.ryuqq.relay.core.protection.CircuitBreakerConfig;
import com.ryuqq.relay.core.protection.CircuitBreakerFactory;
import com.ryuqq.relay.core.protection.CircuitBreakerState;
import com.ryuqq.relay.testkit.contract.AbstractCircuitBreakerContractTest;
import com.ryuqq.relay.testkit.fixture.MutableClock;
import com.ryuqq.relay.testkit.fixture.RecordingEventListener;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryCircuitBreaker 테스트.
 *
 * <p>공통 계약은 {@link AbstractCircuitBreakerContractTest}에서 상속받고,
 * 구현 고유 동작(동시성, overflow, 이벤트 발행 위치)을 추가로 검증합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
class InMemoryCircuitBreakerTest extends AbstractCircuitBreakerContractTest {

    @Override
    protected CircuitBreaker createBreaker(String name, CircuitBreakerConfig config,
                                           MutableClock clock, RecordingEventListener listener) {
        return new InMemoryCircuitBreaker(name, config, clock, listener);
    }

    @Test
    void 생성자_null_인자는_예외() {
        CircuitBreakerConfig cfg = new CircuitBreakerConfig();
        MutableClock c = MutableClock.create();

        assertThatThrownBy(() -> new InMemoryCircuitBreaker(" ", cfg, c, DeliveryEventListener.NOOP))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new InMemoryCircuitBreaker("A", null, c, DeliveryEventListener.NOOP))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new InMemoryCircuitBreaker("A", cfg, null, DeliveryEventListener.NOOP))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new InMemoryCircuitBreaker("A", cfg, c, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void factory_Provider마다_독립된_인스턴스_생성() {
        CircuitBreakerFactory factory = InMemoryCircuitBreaker.factory(config, clock);

        CircuitBreaker first = factory.create("SendGrid", listener);
        CircuitBreaker second = factory.create("Mailgun", listener);
        for (int i = 0; i < 3; i++) {
            first.recordFailure();
        }

        assertThat(first).isNotSameAs(second);
        assertThat(first.getState()).isEqualTo(CircuitBreakerState.OPEN);
        assertThat(second.getState()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(second.getName()).isEqualTo("Mailgun");
    }

    @Test
    void OPEN_상태에서_실패_기록_시_다음_시도_시각_연장() {
        // given
        trip();
        clock.advance(Duration.ofSeconds(10));

        // when
        breaker.recordFailure();

        // then
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
        assertThat(breaker.getStatus().nextAttemptTime())
            .isEqualTo(clock.instant().plus(config.recoveryTimeout()));
        assertThat(listener.eventsOfType(CircuitStateChanged.class)).hasSize(1);
    }

    @Test
    void 매우_긴_recoveryTimeout도_overflow_없이_OPEN_유지() {
        CircuitBreaker cb = new InMemoryCircuitBreaker("SendGrid",
            new CircuitBreakerConfig(1, Duration.ofSeconds(Long.MAX_VALUE), Duration.ofSeconds(60)),
            clock, listener);

        cb.recordFailure();

        assertThat(cb.getState()).isEqualTo(CircuitBreakerState.OPEN);
        assertThat(cb.tryAcquire()).isFalse();
    }

    @Test
    void reset_CLOSED_상태에서는_이벤트_없음() {
        breaker.reset();

        assertThat(listener.events()).isEmpty();
    }

    @Test
    void HALF_OPEN_전이_Listener_예외_시_probe_슬롯_반환() {
        // given
        DeliveryEventListener failing = event -> {
            throw new IllegalStateException("listener down");
        };
        CircuitBreaker cb = new InMemoryCircuitBreaker("SendGrid", config.withFailureThreshold(1), clock, failing);
        assertThatThrownBy(cb::recordFailure).isInstanceOf(IllegalStateException.class);
        assertThat(cb.getState()).isEqualTo(CircuitBreakerState.OPEN);
        clock.advance(config.recoveryTimeout());

        // when
        assertThatThrownBy(cb::tryAcquire)
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("listener down");

        // then: HALF_OPEN이지만 probe는 점유되지 않음
        assertThat(cb.getState()).isEqualTo(CircuitBreakerState.HALF_OPEN);
        assertThat(cb.isCallPermitted()).isTrue();
        assertThat(cb.tryAcquire()).isTrue();
        assertThat(cb.tryAcquire()).isFalse();
    }

    @Test
    void 상태_전이_이벤트는_잠금_밖에서_발행됨() {
        AtomicInteger blockedReads = new AtomicInteger();
        CircuitBreaker[] holder = new CircuitBreaker[1];
        holder[0] = new InMemoryCircuitBreaker("SendGrid", config, clock, event -> {
            // a reader on another thread blocks if the breaker lock is still held
            Thread reader = new Thread(() -> holder[0].getState());
            reader.start();
            try {
                reader.join(1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (reader.isAlive()) {
                blockedReads.incrementAndGet();
            }
        });

        for (int i = 0; i < 3; i++) {
            holder[0].recordFailure();
        }

        assertThat(blockedReads.get()).isZero();
        assertThat(holder[0].getState()).isEqualTo(CircuitBreakerState.OPEN);
    }

    @Test
    void HALF_OPEN_동시_요청_중_하나만_probe_허용() throws InterruptedException {
        // given
        trip();
        clock.advance(config.recoveryTimeout());

        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger permitted = new AtomicInteger();

        // when
        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    if (breaker.tryAcquire()) {
                        permitted.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        // then
        assertThat(permitted.get()).isEqualTo(1);
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.HALF_OPEN);
        assertThat(listener.eventsOfType(CircuitStateChanged.class)).hasSize(2);
    }

    @Test
    void 동시_실패_기록_시_카운트_유실_없음() throws InterruptedException {
        CircuitBreaker cb = new InMemoryCircuitBreaker("SendGrid",
            new CircuitBreakerConfig(10_000, Duration.ofSeconds(30), Duration.ofSeconds(60)),
            clock, listener);
        int threads = 8;
        int perThread = 500;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch done = new CountDownLatch(threads);

        for (int t = 0; t < threads; t++) {
            executor.submit(() -> {
                for (int i = 0; i < perThread; i++) {
                    cb.recordFailure();
                }
                done.countDown();
            });
        }
        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        assertThat(cb.getStatus().failureCount()).isEqualTo(threads * perThread);
        assertThat(cb.getState()).isEqualTo(CircuitBreakerState.CLOSED);
    }
}
