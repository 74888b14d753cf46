package com.ryuqq.relay.adapter.runner;

import com.ryuqq.relay.core.event.AttemptFailed;
import com.ryuqq.relay.core.event.AttemptSucceeded;
import com.ryuqq.relay.core.event.CircuitStateChanged;
import com.ryuqq.relay.core.event.DeliveryEvent;
import com.ryuqq.relay.core.event.DeliveryEventListener;
import com.ryuqq.relay.core.event.ProviderSkipped;
import com.ryuqq.relay.core.event.RequestRejected;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DeliveryEvent}를 SLF4J 로그로 기록하는 Listener.
 *
 * <p><strong>로그 레벨:</strong></p>
 * <ul>
 *   <li>{@link CircuitStateChanged}: INFO</li>
 *   <li>{@link AttemptFailed}: WARN</li>
 *   <li>{@link ProviderSkipped}, {@link RequestRejected}: INFO</li>
 *   <li>{@link AttemptSucceeded}: DEBUG</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class Slf4jDeliveryEventListener implements DeliveryEventListener {

    private final Logger log;

    /**
     * 기본 Logger ({@code com.ryuqq.relay.adapter.runner.Slf4jDeliveryEventListener}) 사용.
     */
    public Slf4jDeliveryEventListener() {
        this(LoggerFactory.getLogger(Slf4jDeliveryEventListener.class));
    }

    /**
     * Logger 주입 생성자.
     *
     * @param log 기록 대상 Logger
     * @throws IllegalArgumentException log가 null인 경우
     */
    public Slf4jDeliveryEventListener(Logger log) {
        if (log == null) {
            throw new IllegalArgumentException("log cannot be null");
        }
        this.log = log;
    }

    @Override
    public void onEvent(DeliveryEvent event) {
        if (event instanceof CircuitStateChanged changed) {
            log.info("Circuit breaker for {} transitioned {} -> {} (failures: {})",
                changed.providerName(), changed.from(), changed.to(), changed.failureCount());
        } else if (event instanceof AttemptFailed failed) {
            if (failed.willRetry()) {
                log.warn("{} attempt {}/{} failed for {}: {} (retrying in {}ms)",
                    failed.providerName(), failed.attempt(), failed.maxAttempts(), failed.requestId(),
                    failed.reason(), failed.nextDelay().toMillis());
            } else {
                log.warn("{} attempt {}/{} failed for {}: {} (retries exhausted)",
                    failed.providerName(), failed.attempt(), failed.maxAttempts(), failed.requestId(),
                    failed.reason());
            }
        } else if (event instanceof AttemptSucceeded succeeded) {
            log.debug("{} delivered {} on attempt {}",
                succeeded.providerName(), succeeded.requestId(), succeeded.attempt());
        } else if (event instanceof ProviderSkipped skipped) {
            log.info("Skipping {} for {}: {}", skipped.providerName(), skipped.requestId(), skipped.reason());
        } else if (event instanceof RequestRejected rejected) {
            log.info("Rejected {}: {}", rejected.requestId(), rejected.reason());
        }
    }
}
