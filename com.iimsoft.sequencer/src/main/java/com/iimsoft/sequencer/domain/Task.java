package com.iimsoft.sequencer.domain;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 单资源链上的任务节点（侵入式双向链表）。
 *
 * 每个节点缓存 earliestStart / start 两个计算值，各自带脏标记：
 * - earliestStart 只依赖前驱（向前传播）
 * - start 依赖 earliestStart 和后继的 start（向后传播）
 *
 * 非 ROOT 标记的节点属于一个写时复制分支：沿 nextInBranch / previousInBranch 跨越到其他标记的节点时，
 * 会先复制该节点（同一分支标记）并把链接改指向副本，已提交链本身不会被修改。
 */
public class Task {

    private static final Logger LOGGER = LoggerFactory.getLogger(Task.class);

    private final String id;
    private final int duration;
    private final int minMarginBefore;
    private int target;

    private int earliestStart;
    private int start;
    private boolean dirty = true;
    private boolean dirtyStart = true;

    private Task next;
    private Task previous;
    private Resource resource;
    private BranchTag branchTag = BranchTag.ROOT;

    public Task(String id, int duration, int target) {
        this(id, duration, target, 0);
    }

    public Task(String id, int duration, int target, int minMarginBefore) {
        this.id = Objects.requireNonNull(id, "id");
        this.duration = duration;
        this.target = target;
        this.minMarginBefore = minMarginBefore;
        this.start = target;
    }

    // 分支副本：逐字段复制，链接仍指向原节点的邻居
    private Task(Task source, BranchTag branchTag) {
        this.id = source.id;
        this.duration = source.duration;
        this.minMarginBefore = source.minMarginBefore;
        this.target = source.target;
        this.earliestStart = source.earliestStart;
        this.start = source.start;
        this.dirty = source.dirty;
        this.dirtyStart = source.dirtyStart;
        this.next = source.next;
        this.previous = source.previous;
        this.resource = source.resource;
        this.branchTag = branchTag;
    }

    public String getId() { return id; }
    public int getDuration() { return duration; }
    public int getMinMarginBefore() { return minMarginBefore; }
    public int getTarget() { return target; }

    public Task getNext() { return next; }
    public Task getPrevious() { return previous; }
    public Resource getResource() { return resource; }
    public BranchTag getBranchTag() { return branchTag; }

    public boolean isRoot() { return branchTag.isRoot(); }
    public boolean isDirty() { return dirty; }
    public boolean isDirtyStart() { return dirtyStart; }

    /**
     * Changing the target only moves this task's start; the change travels backward through the
     * predecessors until a start stops changing.
     */
    public void setTarget(int target) {
        if (this.target == target) {
            return;
        }
        this.target = target;
        dirtyStart = true;
        touchResource();
        TimingPropagator.settleStart(this);
    }

    // ************************************************************************
    // Timing
    // ************************************************************************

    public int getEarliestStart() {
        if (dirty) {
            resolveEarliestStart();
        }
        return earliestStart;
    }

    public int getStart() {
        if (dirtyStart) {
            resolveStart();
        }
        return start;
    }

    public int getEnd() {
        return getStart() + duration;
    }

    /** Room before this task that does not delay the task itself. */
    public int getSlack() {
        return getStart() - getEarliestStart();
    }

    /** Positive when the task starts after its target. */
    public int getLateness() {
        return getStart() - target;
    }

    /**
     * Sum of positive lateness over the whole chain this task is part of, as seen from this
     * task's branch.
     */
    public int score() {
        int score = 0;
        for (Task t : branchView()) {
            score += Math.max(0, t.getLateness());
        }
        return score;
    }

    // 从最近的干净前驱开始向后依次计算，避免按链长递归
    private void resolveEarliestStart() {
        Deque<Task> pending = new ArrayDeque<>();
        for (Task t = this; t != null && t.dirty; t = t.previousInBranch()) {
            pending.push(t);
        }
        while (!pending.isEmpty()) {
            pending.pop().recomputeEarliestStart();
        }
    }

    private void resolveStart() {
        Deque<Task> pending = new ArrayDeque<>();
        for (Task t = this; t != null && t.dirtyStart; t = t.nextInBranch()) {
            pending.push(t);
        }
        while (!pending.isEmpty()) {
            pending.pop().recomputeStart();
        }
    }

    /**
     * @return true if the cached value was dirty or differs from the recomputed one
     */
    boolean recomputeEarliestStart() {
        Task before = previousInBranch();
        int value = before == null ? 0 : before.getEarliestStart() + before.duration + minMarginBefore;
        boolean changed = dirty || value != earliestStart;
        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("{} earliestStart {} -> {} ({})", this, earliestStart, value,
                    dirty ? "invalidated" : "predecessor moved");
        }
        earliestStart = value;
        dirty = false;
        return changed;
    }

    boolean recomputeStart() {
        int earliest = getEarliestStart();
        Task after = nextInBranch();
        int latest = after == null ? target : Math.min(target, after.getStart() - after.minMarginBefore - duration);
        int value = Math.max(earliest, latest);
        boolean changed = dirtyStart || value != start;
        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("{} start {} -> {} ({})", this, start, value,
                    dirtyStart ? "invalidated" : "successor moved");
        }
        start = value;
        dirtyStart = false;
        return changed;
    }

    void invalidate() {
        dirty = true;
        dirtyStart = true;
    }

    // ************************************************************************
    // Branch aware navigation
    // ************************************************************************

    /**
     * Successor as seen from this task's branch. Crossing into a node with another tag copies it
     * into this branch first and keeps the copy in place of the original link.
     */
    public Task nextInBranch() {
        Task after = next;
        if (after == null || after.branchTag == branchTag || branchTag.isRoot()) {
            return after;
        }
        Task copy = after.materialize(branchTag);
        copy.previous = this;
        next = copy;
        return copy;
    }

    public Task previousInBranch() {
        Task before = previous;
        if (before == null || before.branchTag == branchTag || branchTag.isRoot()) {
            return before;
        }
        Task copy = before.materialize(branchTag);
        copy.next = this;
        previous = copy;
        return copy;
    }

    /**
     * The node standing for the committed {@code original} in this task's branch, copied into the
     * branch if needed. A detached copy is returned when the branch already dropped it.
     */
    private Task branchCopyOf(Task original) {
        List<Task> view = branchView();
        int from = -1;
        int to = -1;
        for (int i = 0; i < view.size(); i++) {
            Task t = view.get(i);
            if (t == this) {
                from = i;
            }
            if (t.id.equals(original.id)) {
                to = i;
            }
        }
        if (to < 0) {
            Task copy = original.materialize(BranchTag.ROOT);
            copy.next = null;
            copy.previous = null;
            copy.resource = null;
            copy.invalidate();
            return copy;
        }
        Task t = this;
        for (int i = from; i < to; i++) {
            t = t.nextInBranch();
        }
        for (int i = from; i > to; i--) {
            t = t.previousInBranch();
        }
        return t;
    }

    private Task materialize(BranchTag tag) {
        LOGGER.trace("Materializing {} into {}", this, tag);
        return new Task(this, tag);
    }

    /**
     * The ordered chain seen from this task. Nodes outside the touched part of a branch are shared
     * with the committed chain and are not copied.
     */
    public List<Task> branchView() {
        Deque<Task> view = new ArrayDeque<>();
        for (Task t = previous; t != null; t = t.previous) {
            view.addFirst(t);
        }
        for (Task t = this; t != null; t = t.next) {
            view.addLast(t);
        }
        return new ArrayList<>(view);
    }

    // ************************************************************************
    // Structural mutations
    // ************************************************************************

    /**
     * Detaches this task and links it immediately before {@code anchor}, adopting the anchor's
     * branch and resource. A committed task inserted into a branch of its own resource is moved
     * inside that branch only; the committed chain is unchanged until the branch is merged.
     */
    public void insert(Task anchor) {
        if (anchor == null || anchor == this) {
            return;
        }
        if (isRoot() && resource != null && !anchor.isRoot() && anchor.resource == resource) {
            // 已提交节点插入本资源的分支：移动它在分支里的副本，已提交链不动
            Task copy = anchor.branchCopyOf(this);
            if (copy != anchor) {
                copy.insert(anchor);
            }
            return;
        }
        drop();
        branchTag = anchor.branchTag;
        resource = anchor.resource;

        Task before = anchor.previousInBranch();
        previous = before;
        next = anchor;
        anchor.previous = this;
        if (before != null) {
            before.next = this;
        } else if (isRoot() && resource != null) {
            resource.setHead(this);
        }
        touchResource();
        TimingPropagator.settle(this, anchor);
    }

    /**
     * Unlinks this task and closes the gap. The dropped task ends up detached: no links, no
     * resource, root tag.
     */
    public void drop() {
        Task before = previousInBranch();
        Task after = nextInBranch();
        Resource owner = resource;
        boolean committed = isRoot() && owner != null;

        if (before != null) {
            before.next = after;
        } else if (committed && owner.getHead() == this) {
            owner.setHead(after);
        }
        if (after != null) {
            after.previous = before;
        } else if (committed && owner.getTail() == this) {
            owner.setTail(before);
        }

        previous = null;
        next = null;
        resource = null;
        branchTag = BranchTag.ROOT;
        invalidate();

        if (committed) {
            owner.touch();
        }
        if (after != null) {
            TimingPropagator.settle(after, after);
        } else if (before != null) {
            TimingPropagator.settleStart(before);
        }
    }

    /**
     * Swaps this task with its successor.
     */
    public void moveOut() {
        Task after = nextInBranch();
        if (after == null) {
            return;
        }
        Task before = previousInBranch();
        Task beyond = after.nextInBranch();

        // left side
        after.previous = before;
        if (before != null) {
            before.next = after;
        } else if (isRoot() && resource != null) {
            resource.setHead(after);
        }
        previous = after;

        // right side
        next = beyond;
        if (beyond != null) {
            beyond.previous = this;
        } else if (isRoot() && resource != null) {
            resource.setTail(this);
        }
        after.next = this;

        touchResource();
        TimingPropagator.settle(after, beyond != null ? beyond : this);
    }

    /**
     * Swaps this task with its predecessor.
     */
    public void moveIn() {
        Task before = previousInBranch();
        if (before == null) {
            return;
        }
        Task after = nextInBranch();
        Task beyond = before.previousInBranch();

        // right side
        before.next = after;
        if (after != null) {
            after.previous = before;
        } else if (isRoot() && resource != null) {
            resource.setTail(before);
        }
        next = before;

        // left side
        previous = beyond;
        if (beyond != null) {
            beyond.next = this;
        } else if (isRoot() && resource != null) {
            resource.setHead(this);
        }
        before.previous = this;

        touchResource();
        TimingPropagator.settle(this, after != null ? after : before);
    }

    // ************************************************************************
    // Branching
    // ************************************************************************

    /**
     * Copies this committed task into a fresh branch. Neither this task nor its neighbours change.
     */
    public Task branch() {
        if (!isRoot()) {
            throw new IllegalStateException("Task " + id + " already belongs to " + branchTag
                    + ", nested branches are not supported");
        }
        Task copy = materialize(BranchTag.fresh(resource));
        LOGGER.debug("Branched {} as {}", this, copy.branchTag);
        return copy;
    }

    /**
     * Commits the branch this task belongs to: the contiguous run of branch nodes replaces the
     * committed segment it was copied from.
     */
    public void merge() {
        if (isRoot()) {
            return;
        }
        if (resource == null) {
            throw new IllegalStateException("Cannot merge task " + id + " of " + branchTag
                    + ": it is not attached to a resource");
        }
        if (branchTag.getBaseRevision() != resource.getRevision()) {
            throw new IllegalStateException("Cannot merge " + branchTag + ": resource " + resource.getId()
                    + " changed since the branch was created");
        }
        BranchTag tag = branchTag;
        Task first = this;
        while (first.previous != null && first.previous.branchTag == tag) {
            first = first.previous;
        }
        Task last = this;
        while (last.next != null && last.next.branchTag == tag) {
            last = last.next;
        }
        Task linkHead = first.previous;
        Task linkTail = last.next;

        Resource owner = resource;
        // 被替换的已提交区段：linkHead 与 linkTail 之间的原节点
        Task replaced = linkHead == null ? owner.getHead() : linkHead.next;

        int merged = 0;
        for (Task t = first; t != linkTail; t = t.next) {
            t.branchTag = BranchTag.ROOT;
            t.resource = owner;
            merged++;
        }
        while (replaced != null && replaced != linkTail) {
            Task following = replaced.next;
            replaced.next = null;
            replaced.previous = null;
            replaced.resource = null;
            replaced.invalidate();
            replaced = following;
        }
        if (linkHead == null) {
            owner.setHead(first);
        } else {
            linkHead.next = first;
        }
        if (linkTail == null) {
            owner.setTail(last);
        } else {
            linkTail.previous = last;
        }
        owner.touch();
        LOGGER.debug("Merged {} tasks of {} into resource {}", merged, tag, owner.getId());
    }

    // ************************************************************************
    // Attachment (used by Resource and the slot finder)
    // ************************************************************************

    void attachTail(Resource owner) {
        drop();
        Task oldTail = owner.getTail();
        resource = owner;
        previous = oldTail;
        next = null;
        if (oldTail != null) {
            oldTail.next = this;
        } else {
            owner.setHead(this);
        }
        owner.setTail(this);
        owner.touch();
        TimingPropagator.settle(this, this);
    }

    void attachHead(Resource owner) {
        drop();
        Task oldHead = owner.getHead();
        resource = owner;
        previous = null;
        next = oldHead;
        if (oldHead != null) {
            oldHead.previous = this;
        } else {
            owner.setTail(this);
        }
        owner.setHead(this);
        owner.touch();
        TimingPropagator.settle(this, oldHead != null ? oldHead : this);
    }

    /**
     * Links this task behind the committed tail as the only node of a new branch. The committed
     * chain keeps ending at its tail until the branch is merged.
     */
    void graftAfterTail(Resource owner) {
        drop();
        branchTag = BranchTag.fresh(owner);
        resource = owner;
        previous = owner.getTail();
        next = null;
        TimingPropagator.settle(this, this);
    }

    private void touchResource() {
        if (isRoot() && resource != null) {
            resource.touch();
        }
    }

    @Override
    public String toString() {
        String margin = minMarginBefore != 0 ? minMarginBefore + "+" : "";
        String s = dirtyStart ? "..." : String.valueOf(start);
        return id + "[d=" + margin + duration + ", t=" + target + ", s=" + s + "]";
    }
}
