package com.iimsoft.sequencer.domain.solver;

import com.iimsoft.sequencer.domain.Task;

/**
 * 启发式的结果：累计改进量（≤ 0 表示迟期减少）以及相关节点。
 *
 * improve 返回链头（分支模式下为分支链头），insertBest 返回新插入的任务节点。
 */
public class ImprovementResult {

    private final int improvement;
    private final Task task;

    public ImprovementResult(int improvement, Task task) {
        this.improvement = improvement;
        this.task = task;
    }

    public int getImprovement() {
        return improvement;
    }

    public Task getTask() {
        return task;
    }

    public boolean isBranch() {
        return task != null && !task.isRoot();
    }

    @Override
    public String toString() {
        return "ImprovementResult{improvement=" + improvement + ", task=" + task + "}";
    }
}
