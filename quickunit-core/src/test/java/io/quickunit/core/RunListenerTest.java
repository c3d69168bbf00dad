/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.quickunit.core;

import io.quickunit.assertion.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static io.quickunit.core.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the event system: RunEventType, the event records and the order in which the runner fires them.
 */
class RunListenerTest {

    private final List<String> calls = new ArrayList<>();

    @Test
    void testRunEventTypeValues() {
        assertEquals(7, RunEventType.values().length);
    }

    @Test
    void testEventOrder() {
        TestSuite<Journal> foo = journal("Foo", calls)
                .test("a", j -> j.log("a"))
                .disabled("b", "later", j -> j.log("b"))
                .build();
        TestSuite<Journal> bar = journal("Bar", calls)
                .test("x", j -> j.log("x"))
                .build();
        List<String> trace = runAndTrace(Registry.of(foo, bar));
        assertEquals(List.of(
                "RUN_ENTER",
                "SUITE_ENTER:Foo",
                "CASE_ENTER:Foo.a",
                "CASE_EXIT:Foo.a",
                "CASE_EXIT:Foo.b",
                "SUITE_EXIT:Foo",
                "SUITE_ENTER:Bar",
                "CASE_ENTER:Bar.x",
                "CASE_EXIT:Bar.x",
                "SUITE_EXIT:Bar",
                "RUN_EXIT"
        ), trace);
    }

    @Test
    void testFixtureEvents() {
        TestSuite<Journal> foo = journal("Foo", calls)
                .beforeAll(j -> Assertions.fail("setup"))
                .test("a", j -> j.log("a"))
                .build();
        TestSuite<Journal> bar = journal("Bar", calls)
                .afterAll(j -> {
                    throw new IllegalStateException("teardown");
                })
                .test("x", j -> j.log("x"))
                .build();
        List<String> trace = runAndTrace(Registry.of(foo, bar));
        assertEquals(List.of(
                "RUN_ENTER",
                "SUITE_ENTER:Foo",
                "FIXTURE_FAILED:Foo.BeforeAll",
                "SUITE_EXIT:Foo",
                "SUITE_ENTER:Bar",
                "CASE_ENTER:Bar.x",
                "CASE_EXIT:Bar.x",
                "FIXTURE_FAILED:Bar.AfterAll",
                "SUITE_EXIT:Bar",
                "RUN_EXIT"
        ), trace);
    }

    @Test
    void testFailingListenerIsIgnored() {
        TestSuite<Journal> suite = journal("Foo", calls)
                .test("a", j -> j.log("a"))
                .build();
        List<RunEventType> seen = new ArrayList<>();
        RunSummary summary = Runner.builder(Registry.of(suite))
                .listener(event -> {
                    throw new IllegalStateException("listener bug");
                })
                .listener(event -> seen.add(event.getType()))
                .run();
        assertTrue(summary.isPassed());
        assertEquals(List.of("construct", "a"), calls);
        assertEquals(RunEventType.RUN_EXIT, seen.get(seen.size() - 1));
    }

    @Test
    void testListenerAssertionErrorIsIgnored() {
        TestSuite<Journal> foo = journal("Foo", calls)
                .test("x", j -> j.log("x"))
                .build();
        TestSuite<Journal> bar = journal("Bar", calls)
                .test("y", j -> j.log("y"))
                .build();
        RunSummary summary = Runner.builder(Registry.of(foo, bar))
                .listener(event -> {
                    if (event.getType() == RunEventType.CASE_EXIT) {
                        throw new AssertionError("reporter bug");
                    }
                })
                .run();
        assertNotNull(summary);
        assertTrue(summary.isPassed());
        assertEquals(2, summary.getExecutedCount());
        assertEquals(List.of("construct", "x", "construct", "y"), calls);
    }

    @Test
    void testEventPayloads() {
        TestSuite<Journal> suite = journal("Foo", calls)
                .test("a", j -> Assertions.fail("nope"))
                .build();
        List<RunEvent> events = new ArrayList<>();
        Runner.builder(Registry.of(suite)).listener(events::add).run();

        SummaryRunEvent enter = (SummaryRunEvent) events.get(0);
        assertNull(enter.summary());
        assertNull(enter.getSuiteName());
        assertEquals(Map.of("suites", 1, "cases", 1), enter.toJson());

        SuiteRunEvent suiteEnter = (SuiteRunEvent) events.get(1);
        assertEquals("Foo", suiteEnter.getSuiteName());
        assertNull(suiteEnter.result());

        CaseRunEvent caseExit = (CaseRunEvent) events.get(3);
        assertEquals(RunEventType.CASE_EXIT, caseExit.getType());
        Map<String, Object> caseJson = caseExit.toJson();
        assertEquals("Foo", caseJson.get("suite"));
        assertEquals("a", caseJson.get("name"));
        assertEquals("failed", caseJson.get("status"));
        assertEquals("nope", caseJson.get("message"));

        SuiteRunEvent suiteExit = (SuiteRunEvent) events.get(4);
        Map<String, Object> suiteJson = suiteExit.toJson();
        assertEquals("Foo", suiteJson.get("name"));
        assertEquals(false, suiteJson.get("passed"));
        assertFalse(suiteJson.containsKey("caseResults"));

        SummaryRunEvent exit = (SummaryRunEvent) events.get(5);
        assertEquals(1, exit.summary().exitCode());
        assertTrue(exit.toJson().containsKey("summary"));
    }

}
