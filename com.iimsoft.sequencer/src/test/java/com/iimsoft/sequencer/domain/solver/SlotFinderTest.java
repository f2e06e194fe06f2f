package com.iimsoft.sequencer.domain.solver;

import com.iimsoft.sequencer.domain.Resource;
import com.iimsoft.sequencer.domain.Task;
import com.iimsoft.sequencer.score.ChainValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SlotFinderTest {

    private Resource resource;
    private Task a;
    private Task b;
    private Task c;

    // 开工：A=0，B=20，C=30；slack：A=0，B=18，C=26
    @BeforeEach
    void setUp() {
        resource = new Resource("Resource1");
        a = new Task("A", 2, 0);
        b = new Task("B", 2, 20);
        c = new Task("C", 2, 30);
        resource.addTail(a);
        resource.addTail(b);
        resource.addTail(c);
    }

    private static List<String> ids(List<Task> tasks) {
        return tasks.stream().map(Task::getId).collect(Collectors.toList());
    }

    @Test
    void findAfterReturnsEarliestOfTrailingRun() {
        assertSame(b, resource.findAfter(10));
        assertSame(c, resource.findAfter(25));
        assertSame(a, resource.findAfter(-1));
        assertNull(resource.findAfter(30));
        assertNull(new Resource("Empty").findAfter(0));
    }

    @Test
    void findSlackSkipsTasksWithoutRoom() {
        assertEquals(18, b.getSlack());
        assertEquals(26, c.getSlack());

        assertSame(b, resource.findSlack(10, 5));
        assertSame(c, resource.findSlack(10, 20));
        assertNull(resource.findSlack(10, 30));
    }

    @Test
    @DisplayName("a new task lands in the gap after its target without delaying others")
    void insertBestUsesSlack() {
        Task x = new Task("X", 3, 5);

        ImprovementResult result = resource.insertBest(x);

        assertSame(x, result.getTask());
        assertEquals(0, result.getImprovement());
        assertEquals(List.of("A", "X", "B", "C"), ids(resource.tasks()));
        assertEquals(5, x.getStart());
        assertEquals(20, b.getStart());
        assertEquals(30, c.getStart());
        assertTrue(x.getStart() >= a.getEnd());
        assertTrue(b.getStart() >= x.getEnd());
        assertEquals(0, resource.score());
        assertTrue(ChainValidator.validate(resource).isEmpty());
    }

    @Test
    void insertBestRespectsTargetOrder() {
        Task x = new Task("X", 1, 25);

        resource.insertBest(x);

        assertEquals(List.of("A", "B", "X", "C"), ids(resource.tasks()));
        assertEquals(25, x.getStart());
    }

    @Test
    void insertBestAppendsWhenNoSlotFits() {
        Task x = new Task("X", 50, 5);

        ImprovementResult result = resource.insertBest(x);

        assertEquals(0, result.getImprovement());
        assertTrue(x.isRoot());
        assertSame(x, resource.getTail());
        assertEquals(6, x.getStart());
        assertEquals(1, x.getLateness());
    }

    @Test
    void insertBestIntoEmptyResource() {
        Resource empty = new Resource("Empty");
        Task x = new Task("X", 3, 5);

        empty.insertBest(x);

        assertSame(x, empty.getHead());
        assertSame(x, empty.getTail());
        assertEquals(5, x.getStart());
    }

    @Test
    void insertBestOnBranchLeavesCommittedChain() {
        Task x = new Task("X", 3, 5);

        ImprovementResult result = resource.insertBest(x, true);

        assertTrue(result.isBranch());
        assertEquals(List.of("A", "B", "C"), ids(resource.tasks()));
        assertEquals(List.of("A", "X", "B", "C"), ids(x.branchView()));
        assertTrue(ChainValidator.validate(x.branchView()).isEmpty());

        x.merge();

        assertEquals(List.of("A", "X", "B", "C"), ids(resource.tasks()));
        assertEquals(5, x.getStart());
        assertTrue(ChainValidator.validate(resource).isEmpty());
    }

    @Test
    void insertBestOnBranchWithoutSlotGraftsAfterTail() {
        Task x = new Task("X", 50, 5);

        resource.insertBest(x, true);

        assertFalse(x.isRoot());
        assertSame(c, resource.getTail());
        assertNull(c.getNext());

        x.merge();

        assertEquals(List.of("A", "B", "C", "X"), ids(resource.tasks()));
        assertSame(x, resource.getTail());
        assertTrue(ChainValidator.validate(resource).isEmpty());
    }

    @Test
    void insertBestRejectsBranchTask() {
        Task branch = a.branch();

        assertThrows(IllegalArgumentException.class, () -> resource.insertBest(branch));
        assertEquals(List.of("A", "B", "C"), ids(resource.tasks()));
    }
}
