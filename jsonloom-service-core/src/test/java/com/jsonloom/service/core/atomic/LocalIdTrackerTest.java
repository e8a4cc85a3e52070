package com.jsonloom.service.core.atomic;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.jsonloom.core.errors.IncompatibleLocalIdTypeException;
import com.jsonloom.core.errors.LocalIdAlreadyDeclaredException;
import com.jsonloom.core.errors.LocalIdNotAssignedException;
import com.jsonloom.core.errors.LocalIdNotFoundException;
import org.junit.jupiter.api.Test;

class LocalIdTrackerTest {

    private final LocalIdTracker tracker = new LocalIdTracker();

    @Test
    void declaredAndAssignedIdResolves() {
        tracker.declare("t1", "workItems");
        tracker.assign("t1", "workItems", "42");

        assertEquals("42", tracker.getValue("t1", "workItems"));
    }

    @Test
    void declaringTwiceFails() {
        tracker.declare("t1", "workItems");

        assertThatThrownBy(() -> tracker.declare("t1", "userAccounts"))
                .isInstanceOf(LocalIdAlreadyDeclaredException.class)
                .hasMessageContaining("Another local ID with name 't1' is already defined at this point.");
    }

    @Test
    void referencingUndeclaredIdFails() {
        assertThatThrownBy(() -> tracker.getValue("unknown", "workItems"))
                .isInstanceOf(LocalIdNotFoundException.class);
        assertThatThrownBy(() -> tracker.assign("unknown", "workItems", "1"))
                .isInstanceOf(LocalIdNotFoundException.class);
    }

    @Test
    void referencingBeforeAssignmentFails() {
        tracker.declare("t1", "workItems");

        assertThatThrownBy(() -> tracker.getValue("t1", "workItems")).isInstanceOf(LocalIdNotAssignedException.class);
    }

    @Test
    void usingIdWithOtherTypeFails() {
        tracker.declare("t1", "workItems");
        tracker.assign("t1", "workItems", "1");

        assertThatThrownBy(() -> tracker.getValue("t1", "userAccounts"))
                .isInstanceOf(IncompatibleLocalIdTypeException.class)
                .hasMessageContaining("Local ID 't1' belongs to resource type 'workItems' instead of 'userAccounts'.");
    }

    @Test
    void reassigningFails() {
        tracker.declare("t1", "workItems");
        tracker.assign("t1", "workItems", "1");

        assertThatThrownBy(() -> tracker.assign("t1", "workItems", "2"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Cannot reassign to existing local ID 't1'.");
    }

    @Test
    void resetForgetsEverything() {
        tracker.declare("t1", "workItems");
        tracker.reset();

        assertTrue(tracker.isEmpty());
        tracker.declare("t1", "workItems");
    }
}
