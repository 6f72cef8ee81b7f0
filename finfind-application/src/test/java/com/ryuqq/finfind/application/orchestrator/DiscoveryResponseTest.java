package com.ryuqq.finfind.application.orchestrator;

import com.ryuqq.finfind.core.outcome.ErrorDetail;
import com.ryuqq.finfind.core.outcome.ErrorKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * DiscoveryResponse / DiscoveryRequest 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class DiscoveryResponseTest {

    @Test
    void failure_IsStructuredAndNotPartial() {
        // when
        DiscoveryResponse response = DiscoveryResponse.failure(
            List.of(new ErrorDetail("orchestrator", ErrorKind.VALIDATION, "text cannot be blank")), null, 3);

        // then
        assertThat(response.success()).isFalse();
        assertThat(response.partial()).isFalse();
        assertThat(response.products()).isEmpty();
        assertThat(response.warnings()).isEmpty();
        assertThat(response.conversationId()).isNull();
        assertThat(response.errors()).extracting(ErrorDetail::kind).containsExactly(ErrorKind.VALIDATION);
    }

    @Test
    void constructor_PartialWithoutSuccess_Rejected() {
        assertThatThrownBy(() -> new DiscoveryResponse(false, null, null, null, 0, null, true,
            null, null, null, null, null, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void request_NullContext_DefaultsToEmpty() {
        DiscoveryRequest request = new DiscoveryRequest("lamp", "u1", null);

        assertThat(request.context()).isEqualTo(RequestContext.empty());
    }

    @Test
    void requestContext_NonPositiveBudget_Rejected() {
        assertThatThrownBy(() -> RequestContext.empty().withBudgetMax(0.0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("budgetMax must be positive");
    }
}
