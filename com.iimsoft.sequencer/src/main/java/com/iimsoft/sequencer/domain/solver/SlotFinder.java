package com.iimsoft.sequencer.domain.solver;

import java.util.Objects;

import com.iimsoft.sequencer.domain.Resource;
import com.iimsoft.sequencer.domain.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 为新任务寻找插入位置：在目标日期之后、且前方空闲（slack）足够容纳新任务的第一个任务之前插入。
 *
 * slack ≥ margin + duration 时插入不会推迟该任务本身，也就不会推迟其后的任何任务。
 */
public final class SlotFinder {

    private static final Logger LOGGER = LoggerFactory.getLogger(SlotFinder.class);

    private SlotFinder() {
    }

    /**
     * @return the earliest task of the trailing run of tasks starting after {@code after}, or
     * {@code null} when the tail itself starts at or before it
     */
    public static Task findAfter(Resource resource, int after) {
        Task found = null;
        for (Task t = resource.getTail(); t != null && t.getStart() > after; t = t.getPrevious()) {
            found = t;
        }
        return found;
    }

    /**
     * @return the first task from {@link #findAfter} on with at least {@code amount} slack
     */
    public static Task findSlack(Resource resource, int after, int amount) {
        Task t = findAfter(resource, after);
        while (t != null && t.getSlack() < amount) {
            t = t.getNext();
        }
        return t;
    }

    /**
     * Inserts {@code task} before the first task after its target that can absorb it, then lets
     * the tasks behind it overtake it while that lowers lateness.
     *
     * @param branch insert into a branch copy; the committed chain is left untouched and the
     *               returned task can be merged later
     * @return the follow-up improvement and the inserted task
     */
    public static ImprovementResult insertBest(Resource resource, Task task, boolean branch) {
        Objects.requireNonNull(task, "task");
        if (!task.isRoot()) {
            throw new IllegalArgumentException("Task " + task.getId() + " already belongs to " + task.getBranchTag());
        }
        int amount = task.getMinMarginBefore() + task.getDuration();

        Task candidate = findSlack(resource, task.getTarget(), amount);
        while (candidate != null && (candidate.getTarget() <= task.getTarget() || candidate.getSlack() < amount)) {
            candidate = candidate.getNext();
        }

        if (candidate == null) {
            if (branch) {
                resource.graftAfterTail(task);
                LOGGER.debug("No slot for {} on resource {}, grafted after tail as {}", task.getId(),
                        resource.getId(), task.getBranchTag());
            } else {
                resource.addTail(task);
                LOGGER.debug("No slot for {} on resource {}, appended", task.getId(), resource.getId());
            }
            return new ImprovementResult(0, task);
        }

        Task anchor = branch ? candidate.branch() : candidate;
        task.insert(anchor);
        LOGGER.debug("Inserted {} before {} on resource {}", task.getId(), candidate.getId(), resource.getId());

        int improvement = 0;
        Task successor;
        while ((successor = task.nextInBranch()) != null) {
            int step = LatenessImprover.improvementMoveIn(successor, true);
            if (step >= 0) {
                break;
            }
            improvement += step;
        }
        return new ImprovementResult(improvement, task);
    }
}
