package com.phillippitts.dialogaugment.service.enumerate;

import com.phillippitts.dialogaugment.config.properties.PipelineProperties.BudgetScope;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GroupBudgetTest {

    @Test
    void globalBudgetStopsTheRun() {
        GroupBudget budget = new GroupBudget(2, BudgetScope.GLOBAL);

        budget.startShard();
        assertThat(budget.tryAdmit()).isTrue();
        budget.startShard();
        assertThat(budget.tryAdmit()).isTrue();
        assertThat(budget.tryAdmit()).isFalse();

        assertThat(budget.isExhausted()).isTrue();
        assertThat(budget.stopsRun()).isTrue();
        assertThat(budget.admittedTotal()).isEqualTo(2);
    }

    @Test
    void perShardBudgetResetsWithEveryShard() {
        GroupBudget budget = new GroupBudget(1, BudgetScope.PER_SHARD);

        budget.startShard();
        assertThat(budget.tryAdmit()).isTrue();
        assertThat(budget.tryAdmit()).isFalse();
        assertThat(budget.stopsRun()).isFalse();

        budget.startShard();
        assertThat(budget.tryAdmit()).isTrue();
        assertThat(budget.admittedTotal()).isEqualTo(2);
    }

    @Test
    void nonPositiveLimitIsUnlimited() {
        GroupBudget budget = GroupBudget.unlimited();

        for (int i = 0; i < 1000; i++) {
            assertThat(budget.tryAdmit()).isTrue();
        }
        assertThat(budget.isExhausted()).isFalse();
    }
}
