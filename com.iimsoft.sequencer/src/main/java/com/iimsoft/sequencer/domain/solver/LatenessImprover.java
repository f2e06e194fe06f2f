package com.iimsoft.sequencer.domain.solver;

import com.iimsoft.sequencer.domain.Resource;
import com.iimsoft.sequencer.domain.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 局部搜索：相邻交换（moveIn）只要能降低迟期之和就执行。
 *
 * 迟期只取正值：max(0, start - target) 恒等于 max(0, earliestStart - target)，
 * 因此交换的代价可以只用 earliestStart 精确算出，不需要先真正交换。
 */
public final class LatenessImprover {

    private static final Logger LOGGER = LoggerFactory.getLogger(LatenessImprover.class);

    private LatenessImprover() {
    }

    /**
     * Cost change of moving {@code task} in front of its predecessor.
     * When the predecessor is the head and the two margins differ, the result also includes the
     * lateness change of every later task, which shifts by the margin difference.
     *
     * @param execute perform the swap when the change is negative
     * @return candidate cost minus current cost, 0 for a head task
     */
    public static int improvementMoveIn(Task task, boolean execute) {
        Task t1 = task.previousInBranch();
        if (t1 == null) {
            return 0;
        }
        Task t2 = task;

        // current t1 -> t2
        int currentCost = positive(t1.getStart() - t1.getTarget()) + positive(t2.getStart() - t2.getTarget());

        // alternative t2 -> t1; margins do not apply at the head of the chain
        boolean atHead = t1.getPrevious() == null;
        int frontStart = atHead ? 0 : t1.getEarliestStart() - t1.getMinMarginBefore() + t2.getMinMarginBefore();
        int backStart = frontStart + t2.getDuration() + t1.getMinMarginBefore();
        int candidateCost = positive(backStart - t1.getTarget()) + positive(frontStart - t2.getTarget());

        int improvement = candidateCost - currentCost;
        if (atHead && t1.getMinMarginBefore() != t2.getMinMarginBefore()) {
            improvement += downstreamCost(t2.getNext(), t1.getMinMarginBefore() - t2.getMinMarginBefore());
        }

        if (execute && improvement < 0) {
            LOGGER.debug("Moving {} before {} ({})", t2.getId(), t1.getId(), improvement);
            task.moveIn();
        }
        return improvement;
    }

    // 链头交换会让后续所有任务整体平移 shift（两者的 margin 差）
    private static int downstreamCost(Task first, int shift) {
        int cost = 0;
        for (Task t = first; t != null; t = t.getNext()) {
            int earliest = t.getEarliestStart();
            cost += positive(earliest + shift - t.getTarget()) - positive(earliest - t.getTarget());
        }
        return cost;
    }

    /**
     * Walks from the tail to the head, staying on a task as long as moving it forward pays off.
     *
     * @param branch work on a branch copy of the chain and leave the committed chain untouched
     */
    public static ImprovementResult improve(Resource resource, boolean branch) {
        Task tail = resource.getTail();
        if (tail == null) {
            return new ImprovementResult(0, null);
        }

        int improvement = 0;
        int swaps = 0;
        Task t = branch ? tail.branch() : tail;
        Task head = t;
        while (t != null) {
            int step = improvementMoveIn(t, true);
            if (step < 0) {
                improvement += step;
                swaps++;
            } else {
                head = t;
                t = t.previousInBranch();
            }
        }

        LOGGER.debug("Resource {}: {} swaps, improvement {}{}", resource.getId(), swaps, improvement,
                branch ? " (branch " + head.getBranchTag() + ")" : "");
        return new ImprovementResult(improvement, head);
    }

    private static int positive(int value) {
        return Math.max(0, value);
    }
}
