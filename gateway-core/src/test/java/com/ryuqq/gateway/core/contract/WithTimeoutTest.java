package com.ryuqq.gateway.core.contract;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 요청별 대기 타임아웃 추출 테스트.
 *
 * <p>timeout 필드 값 N은 정확히 N초로, 미지정은 empty로 변환되어야 합니다.</p>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
class WithTimeoutTest {

    @Test
    void 모든_요청_종류에서_timeout_N은_정확히_N초() {
        // given
        List<WithTimeout> requests = List.of(
            new CreateCollection("books", null, null, null, null, null, 30L),
            new UpdateCollection("books", null, 30L),
            new DeleteCollection("books", 30L),
            new ChangeAliases(List.of(), 30L)
        );

        // when & then
        for (WithTimeout request : requests) {
            assertThat(request.waitTimeout()).contains(Duration.ofSeconds(30));
        }
    }

    @Test
    void 모든_요청_종류에서_timeout_미지정시_empty() {
        // given
        List<WithTimeout> requests = List.of(
            new CreateCollection("books", null, null, null, null, null, null),
            new UpdateCollection("books", null, null),
            new DeleteCollection("books", null),
            new ChangeAliases(null, null)
        );

        // when & then
        for (WithTimeout request : requests) {
            assertThat(request.waitTimeout()).isEmpty();
        }
    }

    @Test
    void timeout_0은_0초() {
        assertThat(new DeleteCollection("books", 0L).waitTimeout()).contains(Duration.ZERO);
    }

    @Test
    void 큰_timeout도_그대로_전달() {
        // given
        long oneYear = 365L * 24 * 60 * 60;

        // when & then
        assertThat(new DeleteCollection("books", oneYear).waitTimeout()).contains(Duration.ofSeconds(oneYear));
    }

    @Test
    void 음수_timeout은_생성_시_거부() {
        assertThatThrownBy(() -> new DeleteCollection("books", -1L))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("timeout must be non-negative (current: -1)");
        assertThatThrownBy(() -> new ChangeAliases(List.of(), -5L))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
