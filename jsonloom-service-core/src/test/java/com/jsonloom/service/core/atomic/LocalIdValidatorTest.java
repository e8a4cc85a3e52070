package com.jsonloom.service.core.atomic;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.jsonloom.core.errors.ErrorObject;
import com.jsonloom.core.errors.IncompatibleLocalIdTypeException;
import com.jsonloom.core.errors.JsonApiException;
import com.jsonloom.core.errors.LocalIdAlreadyDeclaredException;
import com.jsonloom.core.errors.LocalIdNotAssignedException;
import com.jsonloom.core.errors.LocalIdNotFoundException;
import com.jsonloom.core.resources.ResourceGraph;
import com.jsonloom.service.core.fixtures.Fixtures;
import com.jsonloom.service.core.fixtures.Operations;
import com.jsonloom.service.core.fixtures.UserAccount;
import com.jsonloom.service.core.fixtures.WorkItem;
import java.util.List;
import org.junit.jupiter.api.Test;

class LocalIdValidatorTest {

    private final ResourceGraph graph = Fixtures.graph();
    private final Operations operations = new Operations(graph);
    private final LocalIdValidator validator = new LocalIdValidator(graph);

    private static WorkItem workItemWithLid(String lid) {
        WorkItem item = new WorkItem();
        item.setLocalId(lid);
        return item;
    }

    private static UserAccount userWithLid(String lid) {
        UserAccount user = new UserAccount();
        user.setLocalId(lid);
        return user;
    }

    private static ErrorObject singleError(JsonApiException e) {
        assertEquals(1, e.getErrors().size());
        return e.getErrors().get(0);
    }

    @Test
    void acceptsDeclarationFollowedByReference() {
        validator.validate(List.of(
                operations.create(workItemWithLid("t1"), "description"),
                operations.relationship(
                        OperationKind.SET_RELATIONSHIP,
                        workItemWithLid("t1"),
                        "assignee",
                        new UserAccount(1L, "Jane", "Doe"))));
    }

    @Test
    void unknownReferenceInRefPointsAtFirstOperation() {
        JsonApiException e = assertThrows(
                LocalIdNotFoundException.class,
                () -> validator.validate(List.of(operations.relationship(
                        OperationKind.SET_RELATIONSHIP, workItemWithLid("unknown"), "assignee"))));

        assertEquals("/atomic:operations[0]/ref/lid", singleError(e).getSource().pointer());
    }

    @Test
    void unknownToOneReferenceInCreatePointsIntoRelationshipData() {
        WorkItem item = workItemWithLid("t1");
        item.setAssignee(userWithLid("u1"));

        JsonApiException e = assertThrows(
                LocalIdNotFoundException.class,
                () -> validator.validate(List.of(operations.create(item, "assignee"))));

        assertEquals(
                "/atomic:operations[0]/data/relationships/assignee/data/lid", singleError(e).getSource().pointer());
    }

    @Test
    void unknownToManyReferencePointsAtElementIndex() {
        WorkItem item = new WorkItem();
        item.getSubscribers().add(new UserAccount(1L, "Jane", "Doe"));
        item.getSubscribers().add(userWithLid("u9"));

        JsonApiException e = assertThrows(
                LocalIdNotFoundException.class,
                () -> validator.validate(List.of(operations.create(item, "subscribers"))));

        assertEquals(
                "/atomic:operations[0]/data/relationships/subscribers/data[1]/lid",
                singleError(e).getSource().pointer());
    }

    @Test
    void unknownReferenceInRelationshipDataPointsAtElementIndex() {
        WorkItem existing = new WorkItem(1, "existing");

        JsonApiException e = assertThrows(
                LocalIdNotFoundException.class,
                () -> validator.validate(List.of(
                        operations.create(userWithLid("u1")),
                        operations.relationship(
                                OperationKind.ADD_TO_RELATIONSHIP,
                                existing,
                                "subscribers",
                                userWithLid("u1"),
                                userWithLid("u2")))));

        assertEquals("/atomic:operations[1]/data[1]/lid", singleError(e).getSource().pointer());
    }

    @Test
    void duplicateDeclarationFails() {
        JsonApiException e = assertThrows(
                LocalIdAlreadyDeclaredException.class,
                () -> validator.validate(List.of(
                        operations.create(workItemWithLid("t1")), operations.create(workItemWithLid("t1")))));

        assertEquals("/atomic:operations[1]/data/lid", singleError(e).getSource().pointer());
    }

    @Test
    void declaringAndUsingInSameOperationFails() {
        WorkItem item = workItemWithLid("t1");
        item.setParent(workItemWithLid("t1"));

        JsonApiException e = assertThrows(
                LocalIdNotAssignedException.class,
                () -> validator.validate(List.of(operations.create(item, "parent"))));

        assertEquals("/atomic:operations[0]/data/relationships/parent/data/lid", singleError(e).getSource().pointer());
    }

    @Test
    void referenceWithOtherTypeFails() {
        JsonApiException e = assertThrows(
                IncompatibleLocalIdTypeException.class,
                () -> validator.validate(List.of(
                        operations.create(userWithLid("x")),
                        operations.update(workItemWithLid("x"), "description"))));

        assertEquals("/atomic:operations[1]/data/lid", singleError(e).getSource().pointer());
    }

    @Test
    void resourcesWithoutLocalIdsAreIgnored() {
        validator.validate(List.of(
                operations.update(new WorkItem(1, "a"), "description"), operations.delete(new WorkItem(2, "b"))));
    }
}
