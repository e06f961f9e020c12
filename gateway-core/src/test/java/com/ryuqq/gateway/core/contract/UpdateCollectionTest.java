package com.ryuqq.gateway.core.contract;

import com.ryuqq.gateway.core.model.CollectionParamsDiff;
import com.ryuqq.gateway.core.operation.ConversionResult;
import com.ryuqq.gateway.core.operation.UpdateCollectionOperation;
import com.ryuqq.gateway.core.status.StatusCode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * UpdateCollection / DeleteCollection 변환 테스트.
 *
 * @author Gateway Team
 * @since 1.0.0
 */
class UpdateCollectionTest {

    @Test
    void convert_파라미터_diff를_그대로_전달() {
        // given
        UpdateCollection request = new UpdateCollection(
            "books", new CollectionParamsDiffMessage(3, null, false), 10L);

        // when
        ConversionResult result = request.convert();

        // then
        UpdateCollectionOperation operation =
            (UpdateCollectionOperation) ((ConversionResult.Converted) result).operation();
        assertThat(operation.paramsDiff()).isEqualTo(new CollectionParamsDiff(3, null, false));
    }

    @Test
    void convert_params가_없으면_빈_diff() {
        // when
        ConversionResult result = new UpdateCollection("books", null, null).convert();

        // then
        UpdateCollectionOperation operation =
            (UpdateCollectionOperation) ((ConversionResult.Converted) result).operation();
        assertThat(operation.paramsDiff().isEmpty()).isTrue();
    }

    @Test
    void convert_replication_factor가_음수면_거부() {
        // when
        ConversionResult result = new UpdateCollection(
            "books", new CollectionParamsDiffMessage(-1, null, null), null).convert();

        // then
        assertThat(result).isInstanceOf(ConversionResult.Rejected.class);
        assertThat(((ConversionResult.Rejected) result).status().description())
            .isEqualTo("replication_factor must be positive (current: -1)");
    }

    @Test
    void delete_convert_이름이_잘못되면_거부() {
        // when
        ConversionResult result = new DeleteCollection("a|b", null).convert();

        // then
        assertThat(result).isInstanceOf(ConversionResult.Rejected.class);
        assertThat(((ConversionResult.Rejected) result).status().code()).isEqualTo(StatusCode.INVALID_ARGUMENT);
    }

    @Test
    void delete_convert_정상_이름은_변환() {
        assertThat(new DeleteCollection("books", null).convert().isConverted()).isTrue();
    }
}
