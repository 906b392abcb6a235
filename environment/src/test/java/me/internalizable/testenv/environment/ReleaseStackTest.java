package me.internalizable.testenv.environment;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReleaseStackTest {

    @Test
    void releasesInReverseOrder() {
        List<String> released = new ArrayList<>();
        ReleaseStack stack = new ReleaseStack();
        stack.push("first", failure -> released.add("first"));
        stack.push("second", failure -> released.add("second"));
        stack.push("third", failure -> released.add("third"));

        stack.releaseAll(null);

        assertEquals(List.of("third", "second", "first"), released);
        assertEquals(0, stack.size());
    }

    @Test
    void passesScopeFailureToEveryAction() {
        RuntimeException failure = new RuntimeException("test failed");
        List<Throwable> seen = new ArrayList<>();
        ReleaseStack stack = new ReleaseStack();
        stack.push("a", seen::add);
        stack.push("b", seen::add);

        stack.releaseAll(failure);

        assertEquals(List.of(failure, failure), seen);
    }

    @Test
    void runsEveryActionAndAggregatesFailures() {
        List<String> released = new ArrayList<>();
        IllegalStateException firstFailure = new IllegalStateException("extra broke");
        ReleaseStack stack = new ReleaseStack();
        stack.push("logging", failure -> released.add("logging"));
        stack.push("cache", failure -> {
            throw new java.io.IOException("cache broke");
        });
        stack.push("extra", failure -> {
            throw firstFailure;
        });
        stack.push("fleet", failure -> released.add("fleet"));

        TeardownException e = assertThrows(TeardownException.class, () -> stack.releaseAll(null));

        assertEquals(List.of("fleet", "logging"), released);
        assertEquals("Failed to release extra, cache", e.getMessage());
        assertSame(firstFailure, e.getCause());
        assertEquals(1, firstFailure.getSuppressed().length);
        assertEquals("cache broke", firstFailure.getSuppressed()[0].getMessage());
    }
}
