package io.taskqueue;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class QueueNamesTest {

    @Test
    void acceptsIdentifiers() {
        assertEquals("user_tasks", QueueNames.validate("user_tasks"));
        assertEquals("_q1", QueueNames.validate("_q1"));
        assertEquals("a".repeat(47), QueueNames.validate("a".repeat(47)));
    }

    @Test
    void rejectsNonIdentifiers() {
        assertThrows(IllegalArgumentException.class, () -> QueueNames.validate(""));
        assertThrows(IllegalArgumentException.class, () -> QueueNames.validate("9lives"));
        assertThrows(IllegalArgumentException.class, () -> QueueNames.validate("user-tasks"));
        assertThrows(IllegalArgumentException.class, () -> QueueNames.validate("x; DROP TABLE y"));
        assertThrows(IllegalArgumentException.class, () -> QueueNames.validate("a".repeat(48)));
        assertThrows(NullPointerException.class, () -> QueueNames.validate(null));
    }

    @Test
    void rejectsUpperCaseNames() {
        assertThrows(IllegalArgumentException.class, () -> QueueNames.validate("Jobs"));
        assertThrows(IllegalArgumentException.class, () -> QueueNames.validate("user_Tasks"));
        assertEquals("jobs", QueueNames.validate("jobs"));
    }

    @Test
    void sourceQueuesLeaveRoomForDeadLetterSuffix() {
        String longest = "q".repeat(QueueNames.MAX_SOURCE_LENGTH);
        assertEquals(longest, QueueNames.validateSource(longest));
        assertEquals(QueueNames.MAX_LENGTH, QueueNames.deadLetterQueue(longest).length());

        assertThrows(IllegalArgumentException.class, () -> QueueNames.validateSource(longest + "q"));
        assertThrows(IllegalArgumentException.class, () -> QueueNames.validateSource("q".repeat(47)));
        assertThrows(NullPointerException.class, () -> QueueNames.validateSource(null));
    }

    @Test
    void deadLetterQueueAppendsSuffix() {
        assertEquals("user_tasks_dlq", QueueNames.deadLetterQueue("user_tasks"));
        assertThrows(IllegalArgumentException.class, () -> QueueNames.deadLetterQueue("a".repeat(45)));
    }

    @Test
    void prefixedJoinsWithUnderscore() {
        assertEquals("unison_emails", QueueNames.prefixed("unison", "emails"));
        assertEquals("emails", QueueNames.prefixed("", "emails"));
    }
}
