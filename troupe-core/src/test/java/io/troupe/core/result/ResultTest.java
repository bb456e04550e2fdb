package io.troupe.core.result;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ResultTest {

    @Test
    void shouldExposeValueOfOk() {
        Result<String> result = Result.ok("report");

        assertThat(result.isOk()).isTrue();
        assertThat(result.toOptional()).contains("report");
        assertThat(result.toError()).isEmpty();
        assertThat(result.orElseThrow()).isEqualTo("report");
    }

    @Test
    void shouldExposeErrorOfErr() {
        Result<String> result = Result.err(ErrorKind.INVALID_PLAN, "no agents");

        assertThat(result.isOk()).isFalse();
        assertThat(result.toOptional()).isEmpty();
        assertThat(result.toError()).contains(new EngineError(ErrorKind.INVALID_PLAN, "no agents"));
        assertThatThrownBy(result::orElseThrow)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("no agents");
    }

    @Test
    void shouldMapValuesAndPassErrorsThrough() {
        assertThat(Result.ok(3).map(n -> n * 2).orElseThrow()).isEqualTo(6);

        Result<Integer> failed = Result.<Integer>err(ErrorKind.INTERNAL, "boom").map(n -> n * 2);
        assertThat(failed.toError()).map(EngineError::kind).contains(ErrorKind.INTERNAL);
    }

    @Test
    void shouldClassifySeverities() {
        assertThat(ErrorKind.TIMEOUT.isRecoverable()).isTrue();
        assertThat(ErrorKind.INVALID_INPUT.isFatal()).isTrue();
        assertThat(ErrorKind.CRITERIA_NOT_MET.isRecoverable()).isFalse();
        assertThat(ErrorKind.CRITERIA_NOT_MET.isFatal()).isFalse();
    }
}
