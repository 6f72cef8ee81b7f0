package com.ryuqq.finfind.core.outcome;

import com.ryuqq.finfind.core.exception.LlmException;
import com.ryuqq.finfind.core.exception.ValidationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Result / Fail / ErrorKind 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ResultTest {

    @Test
    void map_Ok_TransformsValue() {
        Result<Integer> result = Result.ok("abc").map(String::length);

        assertThat(result).isInstanceOf(Ok.class);
        assertThat(((Ok<Integer>) result).value()).isEqualTo(3);
    }

    @Test
    void map_Fail_KeepsKindAndMessage() {
        Result<String> failed = Result.fail(ErrorKind.UPSTREAM_TIMEOUT, "slow");

        Result<Integer> mapped = failed.map(String::length);

        assertThat(mapped.isFail()).isTrue();
        Fail<Integer> fail = (Fail<Integer>) mapped;
        assertThat(fail.kind()).isEqualTo(ErrorKind.UPSTREAM_TIMEOUT);
        assertThat(fail.message()).isEqualTo("slow");
    }

    @Test
    void isRetryable_FollowsErrorKind() {
        assertThat(Fail.of(ErrorKind.UPSTREAM_TIMEOUT, "t").isRetryable()).isTrue();
        assertThat(Fail.of(ErrorKind.UPSTREAM_FAILURE, "u").isRetryable()).isTrue();
        assertThat(Fail.of(ErrorKind.STEP_FAILURE, "s").isRetryable()).isTrue();
        assertThat(Fail.of(ErrorKind.VALIDATION, "v").isRetryable()).isFalse();
        assertThat(Fail.of(ErrorKind.CANCELLED, "c").isRetryable()).isFalse();
    }

    @Test
    void fail_BlankMessage_Rejected() {
        assertThatThrownBy(() -> Fail.of(ErrorKind.VALIDATION, " "))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("message");
    }

    @Test
    void ok_NullValue_Rejected() {
        assertThatThrownBy(() -> Result.ok(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void toFail_Exception_CarriesKind() {
        Fail<Object> fail = new ValidationException("bad field").toFail();

        assertThat(fail.kind()).isEqualTo(ErrorKind.VALIDATION);
        assertThat(fail.message()).isEqualTo("bad field");
    }

    @Test
    void llmException_TimeoutMapsToUpstreamTimeout() {
        assertThat(new LlmException(LlmException.Reason.TIMEOUT, "t").kind()).isEqualTo(ErrorKind.UPSTREAM_TIMEOUT);
        assertThat(new LlmException(LlmException.Reason.RATE_LIMITED, "r").kind()).isEqualTo(ErrorKind.UPSTREAM_FAILURE);
        assertThat(new LlmException(LlmException.Reason.INVALID_RESPONSE, "i").kind()).isEqualTo(ErrorKind.UPSTREAM_FAILURE);
    }
}
