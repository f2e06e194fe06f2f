package com.iimsoft.sequencer.score;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.iimsoft.sequencer.domain.Resource;
import com.iimsoft.sequencer.domain.Task;

/**
 * 从头重算两条递推关系，与节点缓存值比较，同时检查链接对称性和间隔约束。
 *
 * 不修改任何节点；缓存值通过常规 getter 读取（脏节点会先被解析）。
 */
public final class ChainValidator {

    public enum ViolationType {
        BROKEN_LINK,
        DUPLICATE_TASK,
        FOREIGN_TASK,
        EARLIEST_START_MISMATCH,
        START_MISMATCH,
        MARGIN_VIOLATED
    }

    public static final class Violation {
        private final ViolationType type;
        private final String taskId;
        private final String message;

        public Violation(ViolationType type, String taskId, String message) {
            this.type = type;
            this.taskId = taskId;
            this.message = message;
        }

        public ViolationType getType() { return type; }
        public String getTaskId() { return taskId; }
        public String getMessage() { return message; }

        @Override
        public String toString() {
            return type + "(" + taskId + "): " + message;
        }
    }

    private ChainValidator() {
    }

    /**
     * Checks the committed chain of {@code resource}: link symmetry, ownership, both recurrences
     * and margins.
     */
    public static List<Violation> validate(Resource resource) {
        List<Violation> violations = new ArrayList<>();
        Task head = resource.getHead();
        Task tail = resource.getTail();
        if (head == null || tail == null) {
            if (head != tail) {
                violations.add(new Violation(ViolationType.BROKEN_LINK, null,
                        "resource " + resource.getId() + " has only one of head/tail"));
            }
            return violations;
        }
        if (head.getPrevious() != null) {
            violations.add(new Violation(ViolationType.BROKEN_LINK, head.getId(), "head has a predecessor"));
        }
        if (tail.getNext() != null) {
            violations.add(new Violation(ViolationType.BROKEN_LINK, tail.getId(), "tail has a successor"));
        }

        List<Task> sequence = new ArrayList<>();
        Set<Task> seen = new HashSet<>();
        Task last = null;
        for (Task t = head; t != null; t = t.getNext()) {
            if (!seen.add(t)) {
                violations.add(new Violation(ViolationType.BROKEN_LINK, t.getId(), "cycle in committed chain"));
                return violations;
            }
            if (t.getPrevious() != last) {
                violations.add(new Violation(ViolationType.BROKEN_LINK, t.getId(),
                        "previous does not point back to " + (last == null ? "nothing" : last.getId())));
            }
            if (!t.isRoot() || t.getResource() != resource) {
                violations.add(new Violation(ViolationType.FOREIGN_TASK, t.getId(),
                        "task in committed chain of " + resource.getId() + " is " + t.getBranchTag()
                                + " of " + (t.getResource() == null ? "no resource" : t.getResource().getId())));
            }
            sequence.add(t);
            last = t;
        }
        if (last != tail) {
            violations.add(new Violation(ViolationType.BROKEN_LINK, tail.getId(), "tail is not reachable from head"));
        }
        violations.addAll(validate(sequence));
        return violations;
    }

    /**
     * Checks the recurrences and margins over an ordered task sequence, e.g. a branch view.
     */
    public static List<Violation> validate(List<Task> sequence) {
        List<Violation> violations = new ArrayList<>();
        int n = sequence.size();
        int[] earliest = new int[n];
        int[] start = new int[n];

        Set<String> ids = new HashSet<>();
        for (int i = 0; i < n; i++) {
            Task t = sequence.get(i);
            if (!ids.add(t.getId())) {
                violations.add(new Violation(ViolationType.DUPLICATE_TASK, t.getId(), "task id appears twice"));
            }
            if (i == 0) {
                earliest[i] = 0;
            } else {
                Task before = sequence.get(i - 1);
                earliest[i] = earliest[i - 1] + before.getDuration() + t.getMinMarginBefore();
            }
        }
        for (int i = n - 1; i >= 0; i--) {
            Task t = sequence.get(i);
            int latest = t.getTarget();
            if (i < n - 1) {
                Task after = sequence.get(i + 1);
                latest = Math.min(latest, start[i + 1] - after.getMinMarginBefore() - t.getDuration());
            }
            start[i] = Math.max(earliest[i], latest);
        }

        for (int i = 0; i < n; i++) {
            Task t = sequence.get(i);
            if (t.getEarliestStart() != earliest[i]) {
                violations.add(new Violation(ViolationType.EARLIEST_START_MISMATCH, t.getId(),
                        "cached " + t.getEarliestStart() + ", expected " + earliest[i]));
            }
            if (t.getStart() != start[i]) {
                violations.add(new Violation(ViolationType.START_MISMATCH, t.getId(),
                        "cached " + t.getStart() + ", expected " + start[i]));
            }
            if (i > 0) {
                Task before = sequence.get(i - 1);
                if (t.getStart() < before.getEnd() + t.getMinMarginBefore()) {
                    violations.add(new Violation(ViolationType.MARGIN_VIOLATED, t.getId(),
                            "starts at " + t.getStart() + " but " + before.getId() + " ends at " + before.getEnd()
                                    + " with margin " + t.getMinMarginBefore()));
                }
            }
        }
        return violations;
    }
}
