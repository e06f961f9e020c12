package com.ryuqq.gateway.adapter.dispatcher;

import com.ryuqq.gateway.core.spi.CoordinatorErrorKind;
import com.ryuqq.gateway.core.spi.CoordinatorException;
import com.ryuqq.gateway.core.status.Status;
import com.ryuqq.gateway.core.status.StatusCode;
import com.ryuqq.gateway.core.status.StatusException;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CoordinatorErrorMapper 유닛 테스트.
 *
 * @author Gateway Team
 * @since 1.0.0
 */
class CoordinatorErrorMapperTest {

    private final CoordinatorErrorMapper mapper = new CoordinatorErrorMapper();

    @Test
    void toStatusCode_모든_오류_종류를_고정_테이블로_분류() {
        // given
        Map<CoordinatorErrorKind, StatusCode> expected = new EnumMap<>(CoordinatorErrorKind.class);
        expected.put(CoordinatorErrorKind.BAD_INPUT, StatusCode.INVALID_ARGUMENT);
        expected.put(CoordinatorErrorKind.BAD_REQUEST, StatusCode.INVALID_ARGUMENT);
        expected.put(CoordinatorErrorKind.NOT_FOUND, StatusCode.NOT_FOUND);
        expected.put(CoordinatorErrorKind.ALREADY_EXISTS, StatusCode.ALREADY_EXISTS);
        expected.put(CoordinatorErrorKind.FORBIDDEN, StatusCode.PERMISSION_DENIED);
        expected.put(CoordinatorErrorKind.LOCKED, StatusCode.FAILED_PRECONDITION);
        expected.put(CoordinatorErrorKind.PRECONDITION_FAILED, StatusCode.FAILED_PRECONDITION);
        expected.put(CoordinatorErrorKind.RATE_LIMIT_EXCEEDED, StatusCode.RESOURCE_EXHAUSTED);
        expected.put(CoordinatorErrorKind.TIMEOUT, StatusCode.DEADLINE_EXCEEDED);
        expected.put(CoordinatorErrorKind.UNAVAILABLE, StatusCode.UNAVAILABLE);
        expected.put(CoordinatorErrorKind.CHECKSUM_MISMATCH, StatusCode.DATA_LOSS);
        expected.put(CoordinatorErrorKind.SERVICE_ERROR, StatusCode.INTERNAL);

        // when & then
        assertThat(expected).hasSize(CoordinatorErrorKind.values().length);
        for (CoordinatorErrorKind kind : CoordinatorErrorKind.values()) {
            assertThat(mapper.toStatusCode(kind)).as(kind.name()).isEqualTo(expected.get(kind));
        }
    }

    @Test
    void toException_코디네이터_오류는_메시지와_원인_보존() {
        // given
        CoordinatorException error = CoordinatorException.notFound("Collection `books` doesn't exist!");

        // when
        StatusException exception = mapper.toException(error);

        // then
        assertThat(exception.getStatus()).isEqualTo(
            new Status(StatusCode.NOT_FOUND, "Collection `books` doesn't exist!"));
        assertThat(exception).hasCause(error);
    }

    @Test
    void toException_CompletionException_래핑_해제() {
        // given
        CoordinatorException error = new CoordinatorException(CoordinatorErrorKind.TIMEOUT, "took too long");

        // when
        StatusException exception = mapper.toException(
            new CompletionException(new ExecutionException(error)));

        // then
        assertThat(exception.getCode()).isEqualTo(StatusCode.DEADLINE_EXCEEDED);
    }

    @Test
    void toException_StatusException은_그대로_통과() {
        // given
        StatusException original = Status.invalidArgument("bad").asException();

        // when & then
        assertThat(mapper.toException(new CompletionException(original))).isSameAs(original);
    }

    @Test
    void toException_분류되지_않은_오류는_INTERNAL() {
        // given
        IllegalStateException error = new IllegalStateException("disk on fire");

        // when
        StatusException exception = mapper.toException(error);

        // then
        assertThat(exception.getCode()).isEqualTo(StatusCode.INTERNAL);
        assertThat(exception.getStatus().description()).isEqualTo("coordinator failure: disk on fire");
        assertThat(exception).hasCause(error);
    }

    @Test
    void toException_메시지가_없으면_클래스_이름_사용() {
        assertThat(mapper.toException(new NullPointerException()).getStatus().description())
            .isEqualTo("coordinator failure: NullPointerException");
    }

    @Test
    void null_입력은_거부() {
        assertThatThrownBy(() -> mapper.toException(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> mapper.toStatusCode(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
