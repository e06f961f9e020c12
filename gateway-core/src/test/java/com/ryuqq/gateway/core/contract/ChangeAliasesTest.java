package com.ryuqq.gateway.core.contract;

import com.ryuqq.gateway.core.model.AliasName;
import com.ryuqq.gateway.core.model.CollectionName;
import com.ryuqq.gateway.core.operation.AliasOperation;
import com.ryuqq.gateway.core.operation.ChangeAliasesOperation;
import com.ryuqq.gateway.core.operation.ConversionResult;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ChangeAliases 변환 테스트.
 *
 * @author Gateway Team
 * @since 1.0.0
 */
class ChangeAliasesTest {

    @Test
    void convert_순서를_유지하며_변환() {
        // given
        ChangeAliases request = new ChangeAliases(List.of(
            AliasOperationMessage.delete("current"),
            AliasOperationMessage.create("books_v2", "current"),
            AliasOperationMessage.rename("old", "new")
        ), null);

        // when
        ConversionResult result = request.convert();

        // then
        ChangeAliasesOperation operation =
            (ChangeAliasesOperation) ((ConversionResult.Converted) result).operation();
        assertThat(operation.actions()).containsExactly(
            new AliasOperation.DeleteAlias(AliasName.of("current")),
            new AliasOperation.CreateAlias(CollectionName.of("books_v2"), AliasName.of("current")),
            new AliasOperation.RenameAlias(AliasName.of("old"), AliasName.of("new"))
        );
    }

    @Test
    void convert_빈_목록도_허용() {
        // when
        ConversionResult result = new ChangeAliases(List.of(), null).convert();

        // then
        assertThat(result.isConverted()).isTrue();
        assertThat(((ChangeAliasesOperation) ((ConversionResult.Converted) result).operation()).actions()).isEmpty();
    }

    @Test
    void convert_one_of_필드가_비어있으면_거부() {
        // given
        ChangeAliases request = new ChangeAliases(List.of(
            AliasOperationMessage.delete("a"),
            new AliasOperationMessage(null, null, null)
        ), null);

        // when
        ConversionResult result = request.convert();

        // then
        assertThat(rejectionReason(result))
            .startsWith("malformed alias operation at index 1")
            .endsWith("(current: 0)");
    }

    @Test
    void convert_one_of_필드가_둘_이상이면_거부() {
        // given
        AliasOperationMessage both = new AliasOperationMessage(
            new CreateAliasMessage("books", "a"), null, new DeleteAliasMessage("a"));

        // when
        ConversionResult result = new ChangeAliases(List.of(both), null).convert();

        // then
        assertThat(rejectionReason(result)).contains("exactly one of create_alias, rename_alias, delete_alias");
    }

    @Test
    void convert_null_원소는_거부() {
        // when
        ConversionResult result = new ChangeAliases(Arrays.asList(AliasOperationMessage.delete("a"), null), null)
            .convert();

        // then
        assertThat(rejectionReason(result)).isEqualTo("malformed alias operation at index 1: action is missing");
    }

    @Test
    void convert_별칭_이름이_잘못되면_위치와_함께_거부() {
        // when
        ConversionResult result = new ChangeAliases(List.of(AliasOperationMessage.rename("a", "")), null).convert();

        // then
        assertThat(rejectionReason(result))
            .isEqualTo("alias operation at index 0: alias name cannot be null or blank");
    }

    private static String rejectionReason(ConversionResult result) {
        assertThat(result).isInstanceOf(ConversionResult.Rejected.class);
        return ((ConversionResult.Rejected) result).status().description();
    }
}
