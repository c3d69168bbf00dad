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

import io.quickunit.assertion.AssertionFailure;
import io.quickunit.assertion.Assertions;
import io.quickunit.output.Console;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static io.quickunit.core.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

class RunnerTest {

    private final List<String> calls = new ArrayList<>();

    @BeforeEach
    void setup() {
        Console.setColorsEnabled(false);
    }

    @Test
    void testLifecycleOrder() {
        TestSuite<Journal> suite = journal("Foo", calls)
                .beforeAll(j -> j.log("beforeAll"))
                .beforeEach(j -> j.log("beforeEach"))
                .afterEach(j -> j.log("afterEach"))
                .afterAll(j -> j.log("afterAll"))
                .test("a", j -> j.log("a"))
                .test("b", j -> j.log("b"))
                .build();
        RunSummary summary = run(Registry.of(suite));
        assertEquals(List.of("construct", "beforeAll",
                "beforeEach", "a", "afterEach",
                "beforeEach", "b", "afterEach",
                "afterAll"), calls);
        assertTrue(summary.isPassed());
        assertEquals(2, summary.getExecutedCount());
        assertEquals(2, summary.getPassedCount());
        assertEquals(RunSummary.EXIT_OK, summary.exitCode());
    }

    @Test
    void testOneInstancePerSuite() {
        List<Integer> seen = new ArrayList<>();
        TestSuite<Journal> suite = journal("Foo", calls)
                .test("a", j -> seen.add(j.increment()))
                .test("b", j -> seen.add(j.increment()))
                .test("c", j -> seen.add(j.increment()))
                .build();
        run(Registry.of(suite));
        assertEquals(List.of(1, 2, 3), seen);
        assertEquals(1, calls.stream().filter("construct"::equals).count());
    }

    @Test
    void testHooksRunInRegistrationOrder() {
        TestSuite<Journal> suite = journal("Foo", calls)
                .beforeEach(j -> j.log("be1"))
                .beforeEach(j -> j.log("be2"))
                .afterEach(j -> j.log("ae1"))
                .afterEach(j -> j.log("ae2"))
                .test("a", j -> j.log("a"))
                .build();
        run(Registry.of(suite));
        assertEquals(List.of("construct", "be1", "be2", "a", "ae1", "ae2"), calls);
    }

    @Test
    void testBeforeEachFaultErrorsEveryCase() {
        AtomicInteger afterEach = new AtomicInteger();
        TestSuite<Journal> suite = journal("Foo", calls)
                .beforeEach(j -> {
                    throw new IllegalStateException("no db");
                })
                .beforeEach(j -> j.log("second beforeEach"))
                .afterEach(j -> afterEach.incrementAndGet())
                .test("a", j -> j.log("a"))
                .test("b", j -> j.log("b"))
                .build();
        RunSummary summary = run(Registry.of(suite));
        assertEquals(List.of("construct"), calls);
        assertEquals(2, afterEach.get());
        List<CaseResult> results = summary.getCaseResults();
        assertEquals(2, results.size());
        assertTrue(results.get(0).isErrored());
        assertTrue(results.get(1).isErrored());
        assertEquals(2, summary.getErrorCount());
        assertEquals(2, summary.getFixtureErrorCount());
        assertEquals(0, summary.getBodyErrorCount());
        assertEquals(Phase.BEFORE_EACH, summary.getEntries().get(0).phase());
        assertEquals("BeforeEach", summary.getEntries().get(0).getLabel());
        assertEquals(RunSummary.EXIT_ERRORS, summary.exitCode());
    }

    @Test
    void testDisabledCaseIsSkipped() {
        TestSuite<Journal> suite = journal("Foo", calls)
                .beforeEach(j -> j.log("beforeEach"))
                .disabled("a", "broken upstream", j -> j.log("a"))
                .test("b", j -> j.log("b"))
                .build();
        RunSummary summary = run(Registry.of(suite));
        assertEquals(List.of("construct", "beforeEach", "b"), calls);
        assertEquals(1, summary.getExecutedCount());
        assertEquals(1, summary.getSkippedCount());
        CaseResult skipped = summary.getCaseResults().get(0);
        assertTrue(skipped.isSkipped());
        assertEquals("broken upstream", skipped.getOutcome().getReason());
        assertEquals(RunSummary.EXIT_OK, summary.exitCode());
    }

    @Test
    void testBodyFailure() {
        TestSuite<Journal> suite = journal("Foo", calls)
                .afterEach(j -> j.log("afterEach"))
                .test("a", j -> Assertions.assertEquals(1, 2))
                .test("b", j -> j.log("b"))
                .build();
        RunSummary summary = run(Registry.of(suite));
        assertEquals(List.of("construct", "afterEach", "b", "afterEach"), calls);
        CaseResult a = summary.getCaseResults().get(0);
        assertTrue(a.isFailed());
        assertEquals("expected: <1> but was: <2>", a.getOutcome().getMessage());
        assertTrue(a.getOutcome().getLocation().startsWith("RunnerTest.java("));
        assertTrue(summary.getCaseResults().get(1).isPassed());
        assertEquals(1, summary.getFailureCount());
        assertEquals(1, summary.getBodyFailureCount());
        assertEquals(0, summary.getFixtureFailureCount());
        FailureEntry entry = summary.getFailures().get(0);
        assertEquals("a", entry.getLabel());
        assertEquals("Foo", entry.suiteName());
        assertEquals(RunSummary.EXIT_FAILURES, summary.exitCode());
    }

    @Test
    void testFirstProblemDecidesCaseOutcome() {
        TestSuite<Journal> suite = journal("Foo", calls)
                .afterEach(j -> {
                    throw new IOException("cleanup failed");
                })
                .test("a", j -> Assertions.fail("body"))
                .build();
        RunSummary summary = run(Registry.of(suite));
        CaseResult a = summary.getCaseResults().get(0);
        assertTrue(a.isFailed());
        assertEquals(2, a.getEntries().size());
        assertEquals(Phase.AFTER_EACH, a.getEntries().get(1).phase());
        assertEquals(1, summary.getFailureCount());
        assertEquals(1, summary.getErrorCount());
        assertEquals(RunSummary.EXIT_ERRORS, summary.exitCode());
    }

    @Test
    void testEveryAfterEachRuns() {
        TestSuite<Journal> suite = journal("Foo", calls)
                .afterEach(j -> Assertions.fail("first"))
                .afterEach(j -> j.log("second"))
                .test("a", j -> j.log("a"))
                .build();
        RunSummary summary = run(Registry.of(suite));
        assertEquals(List.of("construct", "a", "second"), calls);
        assertTrue(summary.getCaseResults().get(0).isFailed());
        assertEquals(1, summary.getFixtureFailureCount());
    }

    @Test
    void testCheckedExceptionAndAssertionErrorAreErrors() {
        TestSuite<Journal> suite = journal("Foo", calls)
                .test("checked", j -> {
                    throw new IOException("disk");
                })
                .test("jdkAssert", j -> {
                    throw new AssertionError("plain");
                })
                .build();
        RunSummary summary = run(Registry.of(suite));
        assertTrue(summary.getCaseResults().get(0).isErrored());
        assertTrue(summary.getCaseResults().get(1).isErrored());
        assertEquals(2, summary.getBodyErrorCount());
    }

    @Test
    void testConstructFailureIsolatedToSuite() {
        TestSuite<Journal> broken = TestSuite.<Journal>builder("Broken", () -> {
                    throw new IllegalStateException("cannot construct");
                })
                .afterAll(j -> calls.add("broken afterAll"))
                .test("a", j -> calls.add("broken a"))
                .test("b", j -> calls.add("broken b"))
                .build();
        TestSuite<Journal> healthy = journal("Healthy", calls)
                .test("a", j -> j.log("healthy a"))
                .build();
        RunSummary summary = run(Registry.of(broken, healthy));
        assertEquals(List.of("construct", "healthy a"), calls);
        SuiteResult sr = summary.getSuiteResult("Broken");
        assertEquals(2, sr.getNotRunCount());
        assertEquals(0, sr.getExecutedCount());
        assertEquals(1, sr.getFixtureEntries().size());
        assertEquals("this", sr.getFixtureEntries().get(0).getLabel());
        assertTrue(sr.isFailed());
        assertTrue(summary.getSuiteResult("Healthy").isPassed());
        assertEquals(2, summary.getNotRunCount());
        assertEquals(1, summary.getExecutedCount());
        assertEquals(RunSummary.EXIT_ERRORS, summary.exitCode());
    }

    @Test
    void testFactoryReturningNull() {
        TestSuite<Object> suite = TestSuite.builder("Null", () -> null)
                .test("a", o -> calls.add("a"))
                .build();
        RunSummary summary = run(Registry.of(suite));
        assertTrue(calls.isEmpty());
        FailureEntry entry = summary.getErrors().get(0);
        assertEquals(Phase.CONSTRUCT, entry.phase());
        assertInstanceOf(IllegalStateException.class, entry.outcome().getError());
    }

    @Test
    void testBeforeAllFailureSkipsCasesAndAfterAll() {
        TestSuite<Journal> first = journal("First", calls)
                .beforeAll(j -> Assertions.fail("no fixture"))
                .beforeAll(j -> j.log("second beforeAll"))
                .afterAll(j -> j.log("first afterAll"))
                .test("a", j -> j.log("first a"))
                .build();
        TestSuite<Journal> second = journal("Second", calls)
                .test("a", j -> j.log("second a"))
                .build();
        RunSummary summary = run(Registry.of(first, second));
        assertEquals(List.of("construct", "construct", "second a"), calls);
        assertEquals(1, summary.getFailureCount());
        assertEquals(1, summary.getFixtureFailureCount());
        assertEquals("BeforeAll", summary.getFailures().get(0).getLabel());
        assertNull(summary.getFailures().get(0).caseName());
        assertEquals(1, summary.getSuiteResult("First").getNotRunCount());
        assertEquals(RunSummary.EXIT_FAILURES, summary.exitCode());
    }

    @Test
    void testEveryAfterAllRuns() {
        TestSuite<Journal> suite = journal("Foo", calls)
                .afterAll(j -> {
                    throw new IllegalStateException("first");
                })
                .afterAll(j -> j.log("second afterAll"))
                .test("a", j -> j.log("a"))
                .build();
        RunSummary summary = run(Registry.of(suite));
        assertEquals(List.of("construct", "a", "second afterAll"), calls);
        assertTrue(summary.getCaseResults().get(0).isPassed());
        assertEquals(1, summary.getErrorCount());
        assertEquals("AfterAll", summary.getErrors().get(0).getLabel());
    }

    @Test
    void testOnlySelectedCasesRun() {
        TestSuite<Journal> foo = journal("Foo", calls)
                .test("a", j -> j.log("Foo.a"))
                .test("b", j -> j.log("Foo.b"))
                .build();
        TestSuite<Journal> bar = journal("Bar", calls)
                .beforeAll(j -> j.log("Bar.beforeAll"))
                .test("a", j -> j.log("Bar.a"))
                .build();
        RunSummary summary = Runner.run(Registry.of(foo, bar), List.of("Foo.*"), null);
        assertEquals(List.of("construct", "Foo.a", "Foo.b"), calls);
        assertEquals(1, summary.getSuiteResults().size());
        assertNull(summary.getSuiteResult("Bar"));
    }

    @Test
    void testDuplicateScheduling() {
        TestSuite<Journal> suite = journal("Foo", calls)
                .test("a", j -> j.log("a"))
                .build();
        RunSummary summary = Runner.builder(Registry.of(suite))
                .filters("Foo", "\\.a$")
                .duplicates(true)
                .run();
        assertEquals(List.of("construct", "a", "a"), calls);
        assertEquals(2, summary.getExecutedCount());
    }

    @Test
    void testEmptySelection() {
        RunSummary summary = run(Registry.of(passing("Foo", "a")), "Nope");
        assertTrue(summary.getSuiteResults().isEmpty());
        assertEquals(0, summary.getExecutedCount());
        assertEquals(RunSummary.EXIT_OK, summary.exitCode());
    }

    @Test
    void testTiming() {
        TestSuite<Journal> suite = journal("Foo", calls)
                .test("a", j -> Thread.sleep(5))
                .build();
        RunSummary summary = run(Registry.of(suite));
        CaseResult cr = summary.getCaseResults().get(0);
        assertTrue(cr.getBodyMillis() >= 5.0, "body: " + cr.getBodyMillis());
        assertTrue(cr.getEndTime() >= cr.getStartTime());
        assertTrue(summary.getDurationMillis() >= 0);
    }

    @Test
    void testSummaryJson() {
        TestSuite<Journal> suite = journal("Foo", calls)
                .test("a", j -> Assertions.fail("boom"))
                .disabled("b", null, j -> j.log("b"))
                .build();
        RunSummary summary = run(Registry.of(suite));
        Map<String, Object> json = summary.toJson();
        @SuppressWarnings("unchecked")
        Map<String, Object> counts = (Map<String, Object>) json.get("summary");
        assertEquals(1, counts.get("executed"));
        assertEquals(1, counts.get("skipped"));
        assertEquals(1, counts.get("failures"));
        assertEquals(0, counts.get("errors"));
        assertEquals(1, counts.get("exitCode"));
        assertEquals(1, ((List<?>) json.get("suites")).size());
        assertEquals(1, ((List<?>) json.get("entries")).size());
        AssertionFailure af = (AssertionFailure) summary.getFailures().get(0).outcome().getError();
        assertEquals("boom", af.getMessage());
    }

}
