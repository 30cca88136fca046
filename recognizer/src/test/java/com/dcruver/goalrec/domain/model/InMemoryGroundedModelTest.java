package com.dcruver.goalrec.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalInt;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryGroundedModelTest {

    @Test
    void testLookupIsExactThenCaseInsensitive() {
        InMemoryGroundedModel.Builder builder = InMemoryGroundedModel.builder();
        int lower = builder.primitive("pick[cup]");
        int upper = builder.primitive("PICK[CUP]");
        InMemoryGroundedModel model = builder.build();

        assertEquals(OptionalInt.of(upper), model.findTaskId("PICK[CUP]"));
        assertEquals(OptionalInt.of(lower), model.findTaskId("pick[cup]"));
        assertEquals(OptionalInt.of(lower), model.findTaskId("Pick[Cup]"));
        assertTrue(model.findTaskId("drop[cup]").isEmpty());
        assertTrue(model.findTaskId(null).isEmpty());
    }

    @Test
    void testMethodsAreIndexedByTask() {
        InMemoryGroundedModel.Builder builder = InMemoryGroundedModel.builder();
        int a = builder.primitive("a");
        int task = builder.compound("t");
        int first = builder.method("m1", task, List.of(a), List.of());
        int second = builder.method("m2", task, List.of(a, a), List.of(new SubtaskOrdering(0, 1)));
        InMemoryGroundedModel model = builder.build();

        assertEquals(2, model.getMethodsFor(task).size());
        assertTrue(model.getMethodsFor(a).isEmpty());
        assertEquals(OptionalInt.of(second), model.findMethodId("m2", task));
        assertTrue(model.findMethodId("m1", a).isEmpty());
        assertEquals(first, model.getMethod(first).getId());
    }

    @Test
    void testInvalidMethodsAreRejected() {
        InMemoryGroundedModel.Builder builder = InMemoryGroundedModel.builder();
        int a = builder.primitive("a");
        int task = builder.compound("t");

        assertThrows(IllegalArgumentException.class, () -> builder.method("m", a, List.of(), List.of()));
        assertThrows(IllegalArgumentException.class, () -> builder.method("m", task, List.of(9), List.of()));
        assertThrows(IndexOutOfBoundsException.class,
            () -> builder.method("m", task, List.of(a), List.of(new SubtaskOrdering(0, 1))));
    }

    @Test
    void testWorldStateAppliesDeletesBeforeAdds() {
        InMemoryGroundedModel.Builder builder = InMemoryGroundedModel.builder();
        int toggle = builder.primitive("toggle", Set.of(0), Set.of(0, 1), Set.of(0, 2));
        builder.initialState(Set.of(0, 2));
        InMemoryGroundedModel model = builder.build();

        WorldState state = WorldState.initialOf(model);
        assertTrue(state.isApplicable(model.getTask(toggle)));
        state.apply(model.getTask(toggle));

        assertEquals(Set.of(0, 1), state.snapshot());
        assertTrue(state.holds(1));
        assertFalse(state.holds(2));
        assertEquals(Set.of(0, 2), model.getInitialState());
    }
}
