package io.templatexform.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class ConditionAnnotationTest {

    @Test
    void plainConditionIsNotABranch() {
        var condition = ConditionAnnotation.of("user.isAdmin");

        assertThat(condition.isBranch()).isFalse();
        assertThat(condition.expression()).isEqualTo("user.isAdmin");
    }

    @Test
    void elseBranchHasEmptyExpression() {
        var condition = ConditionAnnotation.elseBranch();

        assertThat(condition.isBranch()).isTrue();
        assertThat(condition.isElse()).isTrue();
        assertThat(condition.expression()).isEmpty();
    }

    @Test
    void branchCannotBeElseAndElseIf() {
        assertThatThrownBy(() -> new ConditionAnnotation("x", true, true))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("both else and else-if");
    }

    @Test
    void elementReportsOwnerAndBranchRoles() {
        var owner = Element.annotated("div", List.of(), Annotations.condition(ConditionAnnotation.of("a")));
        var branch = Element.annotated("div", List.of(), Annotations.condition(ConditionAnnotation.elseIf("b")));
        var plain = Element.of("p");

        assertThat(owner.isConditionOwner()).isTrue();
        assertThat(owner.isBranch()).isFalse();
        assertThat(branch.isBranch()).isTrue();
        assertThat(branch.isConditionOwner()).isFalse();
        assertThat(plain.isConditionOwner()).isFalse();
        assertThat(plain.isBranch()).isFalse();
    }
}
