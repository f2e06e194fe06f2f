package com.iimsoft.sequencer.domain;

import com.iimsoft.sequencer.score.ChainValidator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

class ResourceTest {

    private static List<String> ids(Iterable<Task> tasks) {
        List<String> ids = new ArrayList<>();
        for (Task t : tasks) {
            ids.add(t.getId());
        }
        return ids;
    }

    @Test
    void newResourceIsEmpty() {
        Resource resource = new Resource("Resource1");

        assertEquals("Resource1", resource.getId());
        assertEquals("Resource1", resource.getName());
        assertNull(resource.getHead());
        assertNull(resource.getTail());
        assertEquals(0, resource.size());
        assertEquals(0, resource.score());
        assertEquals(0, resource.improve());
        assertEquals("Resource1[]", resource.toString());
    }

    @Test
    void addTailLinksTasksInOrder() {
        Resource resource = new Resource("Resource1");
        Task task1 = new Task("Task1", 5, 10);
        Task task2 = new Task("Task2", 3, 15);

        resource.addTail(task1);
        resource.addTail(task2);

        assertSame(task1, resource.getHead());
        assertSame(task2, resource.getTail());
        assertSame(task2, task1.getNext());
        assertNull(task1.getPrevious());
        assertSame(task1, task2.getPrevious());
        assertNull(task2.getNext());
        assertSame(resource, task1.getResource());
        assertSame(resource, task2.getResource());
        assertEquals("Resource1[Task1, Task2]", resource.toString());
    }

    @Test
    void addHeadPrependsTasks() {
        Resource resource = new Resource("Resource1");
        Task task1 = new Task("Task1", 5, 10);
        Task task2 = new Task("Task2", 3, 15);

        resource.addHead(task2);
        resource.addHead(task1);

        assertEquals(List.of("Task1", "Task2"), ids(resource.iterTasks()));
        assertSame(task1, resource.getHead());
        assertSame(task2, resource.getTail());
        assertEquals(5, task2.getEarliestStart());
        assertTrue(ChainValidator.validate(resource).isEmpty());
    }

    @Test
    @DisplayName("two appended tasks keep order and gap")
    void twoTasksAreScheduledInOrder() {
        Resource resource = new Resource("Resource1");
        Task task1 = new Task("T1", 5, 10);
        Task task2 = new Task("T2", 3, 15);
        resource.addTail(task1);
        resource.addTail(task2);

        assertEquals(0, task1.getEarliestStart());
        assertTrue(task1.getStart() >= task1.getEarliestStart());
        assertTrue(task2.getStart() >= task1.getStart() + 5);
        assertEquals(10, task1.getStart());
        assertEquals(15, task2.getStart());
        assertEquals(0, resource.score());
    }

    @Test
    void earliestStartFollowsPredecessor() {
        Resource resource = new Resource("Resource1");
        Task first = new Task("A", 5, 0);
        Task second = new Task("B", 1, 0);
        resource.addTail(first);
        resource.addTail(second);

        assertEquals(0, first.getEarliestStart());
        assertEquals(5, second.getEarliestStart());
    }

    @Test
    void marginsAreRespected() {
        Resource resource = new Resource("Resource1");
        Task task1 = new Task("Task1", 5, 10, 2);
        Task task2 = new Task("Task2", 3, 18, 1);
        Task task3 = new Task("Task3", 4, 25, 3);
        resource.addTail(task1);
        resource.addTail(task2);
        resource.addTail(task3);

        resource.schedule();

        assertEquals(0, task1.getEarliestStart());
        assertEquals(6, task2.getEarliestStart());
        assertEquals(12, task3.getEarliestStart());
        assertTrue(task2.getStart() >= task1.getStart() + task1.getDuration() + task2.getMinMarginBefore());
        assertTrue(task3.getStart() >= task2.getStart() + task2.getDuration() + task3.getMinMarginBefore());
    }

    @Test
    void iterTasksIsRestartable() {
        Resource resource = new Resource("Resource1");
        List<String> taskIds = List.of("Task1", "Task2", "Task3", "Task4");
        for (String id : taskIds) {
            resource.addTail(new Task(id, 5, 10));
        }

        Iterable<Task> tasks = resource.iterTasks();

        assertEquals(taskIds, ids(tasks));
        assertEquals(taskIds, ids(tasks));
        assertEquals(ids(resource.iterTasks()), ids(resource.iterTasks()));
        assertEquals(4, resource.size());
    }

    @Test
    void exhaustedIteratorThrows() {
        Resource resource = new Resource("Resource1");
        resource.addTail(new Task("Task1", 1, 0));

        Iterator<Task> it = resource.iterTasks().iterator();
        it.next();

        assertFalse(it.hasNext());
        assertThrows(NoSuchElementException.class, it::next);
    }

    @Test
    void branchTaskIsRejectedBeforeAnyChange() {
        Resource resource = new Resource("Resource1");
        Task task1 = new Task("Task1", 5, 10);
        resource.addTail(task1);
        Task branch = task1.branch();
        long revision = resource.getRevision();

        assertThrows(IllegalArgumentException.class, () -> resource.addTail(branch));
        assertThrows(IllegalArgumentException.class, () -> resource.addHead(branch));

        assertEquals(List.of("Task1"), ids(resource.iterTasks()));
        assertSame(task1, resource.getTail());
        assertEquals(revision, resource.getRevision());
        assertFalse(branch.isRoot());
    }

    @Test
    void addingAttachedTaskMovesIt() {
        Resource first = new Resource("R1");
        Resource second = new Resource("R2");
        Task task = new Task("Task1", 5, 10);
        first.addTail(task);

        second.addTail(task);

        assertTrue(first.isEmpty());
        assertSame(second, task.getResource());
        assertEquals(List.of("Task1"), ids(second.iterTasks()));
    }

    @Test
    void scheduleReturnsScore() {
        Resource resource = new Resource("Resource1");
        resource.addTail(new Task("Task1", 5, 0));
        resource.addTail(new Task("Task2", 3, 0));
        resource.addTail(new Task("Task3", 4, 20));

        assertEquals(5, resource.schedule());
        assertEquals(resource.score(), resource.schedule());
    }

    @Test
    void everyStructuralChangeBumpsRevision() {
        Resource resource = new Resource("Resource1");
        Task task1 = new Task("Task1", 5, 10);
        Task task2 = new Task("Task2", 3, 15);

        resource.addTail(task1);
        long afterAdd = resource.getRevision();
        resource.addTail(task2);
        assertTrue(resource.getRevision() > afterAdd);

        long beforeSwap = resource.getRevision();
        task2.moveIn();
        assertTrue(resource.getRevision() > beforeSwap);

        long beforeTarget = resource.getRevision();
        task1.setTarget(30);
        assertTrue(resource.getRevision() > beforeTarget);
    }
}
