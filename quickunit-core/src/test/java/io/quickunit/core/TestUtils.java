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

import java.util.ArrayList;
import java.util.List;

/**
 * Test utilities for runtime tests.
 * Pattern: build suites whose instances write every hook and body call to a shared journal, run
 * them and compare the journal with the expected lifecycle.
 * <pre>
 * List&lt;String&gt; calls = new ArrayList&lt;&gt;();
 * TestSuite&lt;Journal&gt; suite = journal("Foo", calls)
 *     .beforeEach(j -&gt; j.log("setUp"))
 *     .test("a", j -&gt; j.log("a"))
 *     .build();
 * </pre>
 */
public class TestUtils {

    /**
     * Suite instance type for tests, logs its own construction.
     */
    public static class Journal {

        private final List<String> calls;
        private int counter;

        public Journal(List<String> calls) {
            this.calls = calls;
            calls.add("construct");
        }

        public void log(String call) {
            calls.add(call);
        }

        public int increment() {
            return ++counter;
        }

    }

    public static TestSuite.Builder<Journal> journal(String name, List<String> calls) {
        return TestSuite.builder(name, () -> new Journal(calls));
    }

    /**
     * A suite of passing cases with no hooks.
     */
    public static TestSuite<Object> passing(String name, String... caseNames) {
        TestSuite.Builder<Object> builder = TestSuite.builder(name, Object::new);
        for (String caseName : caseNames) {
            builder.test(caseName, o -> {
            });
        }
        return builder.build();
    }

    public static RunSummary run(Registry registry, String... filters) {
        return Runner.builder(registry).filters(filters).run();
    }

    /**
     * Runs and returns every event as {@code TYPE} or {@code TYPE:label}, label being the suite name,
     * the fully-qualified case name or the failed fixture phase.
     */
    public static List<String> runAndTrace(Registry registry, String... filters) {
        List<String> trace = new ArrayList<>();
        Runner.builder(registry).filters(filters).listener(event -> trace.add(describe(event))).run();
        return trace;
    }

    static String describe(RunEvent event) {
        String type = event.getType().name();
        if (event instanceof CaseRunEvent) {
            return type + ":" + ((CaseRunEvent) event).testCase().getFullyQualifiedName();
        }
        if (event instanceof FixtureRunEvent) {
            FailureEntry entry = ((FixtureRunEvent) event).entry();
            return type + ":" + entry.suiteName() + "." + entry.getLabel();
        }
        return event.getSuiteName() == null ? type : type + ":" + event.getSuiteName();
    }

}
