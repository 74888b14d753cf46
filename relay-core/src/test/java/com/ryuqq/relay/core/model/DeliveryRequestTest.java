package com.ryuqq.relay.core.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * DeliveryRequest 테스트.
 *
 * @author Relay Team
 * @since 1.0.0
 */
class DeliveryRequestTest {

    @Test
    void 네_필드_모두_있으면_생성() {
        DeliveryRequest request = new DeliveryRequest("user@example.com", "Welcome", "Hello", "req-1");

        assertThat(request.to()).isEqualTo("user@example.com");
        assertThat(request.requestId()).isEqualTo("req-1");
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"  ", "\t"})
    void requestId가_비어_있으면_예외(String requestId) {
        assertThatThrownBy(() -> new DeliveryRequest("user@example.com", "Welcome", "Hello", requestId))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("requestId cannot be null or blank");
    }

    @Test
    void 수신자_제목_본문이_비어_있으면_예외() {
        assertThatThrownBy(() -> new DeliveryRequest(null, "Welcome", "Hello", "req-1"))
            .hasMessage("to cannot be null or blank");
        assertThatThrownBy(() -> new DeliveryRequest("user@example.com", "", "Hello", "req-1"))
            .hasMessage("subject cannot be null or blank");
        assertThatThrownBy(() -> new DeliveryRequest("user@example.com", "Welcome", " ", "req-1"))
            .hasMessage("body cannot be null or blank");
    }
}
