package com.iimsoft.sequencer.domain;

/**
 * 结构变更后的时间修复（迭代实现，不按链长递归）。
 *
 * 1) earliestStart 向后继方向推进：结构上被改动的节点一定重算，之后只在值发生变化时继续；
 * 2) start 从最后一个受影响节点向前驱方向推进：受影响区间及其前一个节点一定重算，之后只在值发生变化时继续。
 *
 * 所有邻居访问都走 nextInBranch / previousInBranch，分支里只会复制真正被改到的节点。
 */
final class TimingPropagator {

    private TimingPropagator() {
    }

    /**
     * @param from    first task whose predecessor changed
     * @param through last task whose predecessor changed, reachable forward from {@code from}
     */
    static void settle(Task from, Task through) {
        for (Task t = from; t != null; t = t.nextInBranch()) {
            t.invalidate();
            if (t == through) {
                break;
            }
        }

        Task last = from;
        boolean forced = true;
        for (Task t = from; t != null; t = t.nextInBranch()) {
            boolean changed = t.recomputeEarliestStart();
            if (!changed && !forced) {
                break;
            }
            last = t;
            if (t == through) {
                forced = false;
            }
        }

        settleStart(last, from.previousInBranch());
    }

    /**
     * Repairs start values backward from {@code task}, which is recomputed in any case.
     */
    static void settleStart(Task task) {
        settleStart(task, task);
    }

    private static void settleStart(Task last, Task boundary) {
        boolean forced = true;
        for (Task t = last; t != null; t = t.previousInBranch()) {
            boolean changed = t.recomputeStart();
            if (t == boundary) {
                forced = false;
            }
            if (!changed && !forced) {
                break;
            }
        }
    }

    /**
     * Recomputes every cached value of the chain starting at {@code head}.
     */
    static void recomputeAll(Task head) {
        Task last = null;
        for (Task t = head; t != null; t = t.nextInBranch()) {
            t.invalidate();
            t.recomputeEarliestStart();
            last = t;
        }
        for (Task t = last; t != null; t = t.previousInBranch()) {
            t.recomputeStart();
        }
    }
}
