package com.ryuqq.relay.testkit.fixture;

import com.ryuqq.relay.core.model.DeliveryRequest;
import com.ryuqq.relay.core.provider.DeliveryFailure;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ScriptedDeliveryProvider 테스트.
 *
 * @author Relay Team
 * @since 1.0.0
 */
class ScriptedDeliveryProviderTest {

    private final DeliveryRequest request = DeliveryRequests.withId("req-1");

    @Test
    void failingTimes_지정_횟수만큼_실패_후_성공() {
        ScriptedDeliveryProvider provider = ScriptedDeliveryProvider.failingTimes("Mailgun", 1);

        assertThatThrownBy(() -> provider.attemptDelivery(request))
            .isInstanceOf(DeliveryFailure.class)
            .hasMessage("Mailgun failed to send email");
        assertThatCode(() -> provider.attemptDelivery(request)).doesNotThrowAnyException();

        assertThat(provider.invocations()).isEqualTo(2);
        assertThat(provider.received()).containsExactly(request, request);
    }

    @Test
    void alwaysFailing_항상_DeliveryFailure() {
        ScriptedDeliveryProvider provider = ScriptedDeliveryProvider.alwaysFailing("SendGrid");

        for (int i = 0; i < 5; i++) {
            assertThatThrownBy(() -> provider.attemptDelivery(request)).isInstanceOf(DeliveryFailure.class);
        }
        assertThat(provider.invocations()).isEqualTo(5);
    }

    @Test
    void throwingUnchecked_지정한_예외를_그대로_던짐() {
        IllegalStateException boom = new IllegalStateException("boom");
        ScriptedDeliveryProvider provider = ScriptedDeliveryProvider.throwingUnchecked("SendGrid", boom);

        assertThatThrownBy(() -> provider.attemptDelivery(request)).isSameAs(boom);
    }
}
