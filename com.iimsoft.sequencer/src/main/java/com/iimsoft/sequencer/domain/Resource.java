package com.iimsoft.sequencer.domain;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

import com.iimsoft.sequencer.domain.solver.ImprovementResult;
import com.iimsoft.sequencer.domain.solver.LatenessImprover;
import com.iimsoft.sequencer.domain.solver.SlotFinder;

/**
 * 资源：持有已提交任务链的头尾。
 *
 * revision 在每次已提交链的结构或目标日期变化时递增，分支据此判断 merge 时是否已过期。
 */
public class Resource {

    private final String id;
    private String name;

    private Task head;
    private Task tail;
    private long revision;

    public Resource(String id) {
        this(id, id);
    }

    public Resource(String id, String name) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name;
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public Task getHead() { return head; }
    public Task getTail() { return tail; }
    public long getRevision() { return revision; }

    void setHead(Task head) { this.head = head; }
    void setTail(Task tail) { this.tail = tail; }

    void touch() {
        revision++;
    }

    public boolean isEmpty() {
        return head == null;
    }

    // ************************************************************************
    // Attachment
    // ************************************************************************

    public void addTail(Task task) {
        checkAttachable(task);
        task.attachTail(this);
    }

    public void addHead(Task task) {
        checkAttachable(task);
        task.attachHead(this);
    }

    /**
     * Links {@code task} behind the committed tail as a new branch; the committed chain is
     * unchanged until the task is merged.
     */
    public void graftAfterTail(Task task) {
        checkAttachable(task);
        task.graftAfterTail(this);
    }

    private void checkAttachable(Task task) {
        Objects.requireNonNull(task, "task");
        if (!task.isRoot()) {
            throw new IllegalArgumentException("Task " + task.getId() + " belongs to " + task.getBranchTag()
                    + " and cannot be attached to resource " + id + " directly, merge the branch instead");
        }
    }

    // ************************************************************************
    // Read-out
    // ************************************************************************

    /**
     * Lazily walks the committed chain from head to tail. Every call starts a new walk.
     */
    public Iterable<Task> iterTasks() {
        return () -> new Iterator<>() {
            private Task cursor = head;

            @Override
            public boolean hasNext() {
                return cursor != null;
            }

            @Override
            public Task next() {
                if (cursor == null) {
                    throw new NoSuchElementException();
                }
                Task current = cursor;
                cursor = cursor.getNext();
                return current;
            }
        };
    }

    public List<Task> tasks() {
        List<Task> tasks = new ArrayList<>();
        for (Task t : iterTasks()) {
            tasks.add(t);
        }
        return tasks;
    }

    public int size() {
        int size = 0;
        for (Task ignored : iterTasks()) {
            size++;
        }
        return size;
    }

    /** Sum of positive lateness over the committed chain. */
    public int score() {
        int score = 0;
        for (Task t : iterTasks()) {
            score += Math.max(0, t.getLateness());
        }
        return score;
    }

    /**
     * Recomputes every cached value of the committed chain from scratch and returns the score.
     */
    public int schedule() {
        if (head != null) {
            TimingPropagator.recomputeAll(head);
        }
        return score();
    }

    // ************************************************************************
    // Heuristics
    // ************************************************************************

    public int improve() {
        return improve(false).getImprovement();
    }

    public ImprovementResult improve(boolean branch) {
        return LatenessImprover.improve(this, branch);
    }

    public Task findAfter(int after) {
        return SlotFinder.findAfter(this, after);
    }

    public Task findSlack(int after, int amount) {
        return SlotFinder.findSlack(this, after, amount);
    }

    public ImprovementResult insertBest(Task task) {
        return insertBest(task, false);
    }

    public ImprovementResult insertBest(Task task, boolean branch) {
        return SlotFinder.insertBest(this, task, branch);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(id).append('[');
        for (Task t : iterTasks()) {
            if (t != head) {
                sb.append(", ");
            }
            sb.append(t.getId());
        }
        return sb.append(']').toString();
    }
}
