package com.phillippitts.dialogaugment.service.enumerate;

import com.phillippitts.dialogaugment.config.properties.PipelineProperties.BudgetScope;

import java.util.Objects;

/**
 * Caps the number of groups admitted in a run.
 *
 * <p>Groups are admitted whole: once admitted, every valid turn of the group is processed.
 * Under {@link BudgetScope#PER_SHARD} the counter restarts with every shard.
 * A non-positive limit means unlimited. Owned by the scheduler thread; not thread-safe.
 */
public final class GroupBudget {

    private final int maxGroups;
    private final BudgetScope scope;
    private int admittedInScope;
    private int admittedTotal;

    public GroupBudget(int maxGroups, BudgetScope scope) {
        this.maxGroups = maxGroups;
        this.scope = Objects.requireNonNull(scope, "scope");
    }

    public static GroupBudget unlimited() {
        return new GroupBudget(0, BudgetScope.GLOBAL);
    }

    /** Called before a shard is read. */
    public void startShard() {
        if (scope == BudgetScope.PER_SHARD) {
            admittedInScope = 0;
        }
    }

    /**
     * Admits one group if the budget allows it.
     *
     * @return true if admitted (and counted)
     */
    public boolean tryAdmit() {
        if (isExhausted()) {
            return false;
        }
        admittedInScope++;
        admittedTotal++;
        return true;
    }

    public boolean isExhausted() {
        return maxGroups > 0 && admittedInScope >= maxGroups;
    }

    /** True if an exhausted budget also stops every later shard. */
    public boolean stopsRun() {
        return scope == BudgetScope.GLOBAL && isExhausted();
    }

    public int admittedTotal() {
        return admittedTotal;
    }

    public int maxGroups() {
        return maxGroups;
    }

    public BudgetScope scope() {
        return scope;
    }
}
