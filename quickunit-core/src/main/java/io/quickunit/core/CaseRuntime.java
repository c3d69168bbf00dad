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

import java.util.concurrent.Callable;

/**
 * Runs one enabled test case: before-each hooks, the body if set-up succeeded, then every
 * after-each hook regardless of what happened before.
 *
 * @param <T> the suite instance type
 */
public class CaseRuntime<T> implements Callable<CaseResult> {

    private final SuiteRuntime<T> suiteRuntime;
    private final TestCase<T> testCase;
    private final CaseResult result;

    public CaseRuntime(SuiteRuntime<T> suiteRuntime, TestCase<T> testCase) {
        this.suiteRuntime = suiteRuntime;
        this.testCase = testCase;
        this.result = new CaseResult(testCase);
    }

    @Override
    public CaseResult call() {
        result.setStartTime(System.currentTimeMillis());
        suiteRuntime.getRun().fire(CaseRunEvent.enter(testCase));
        try {
            if (beforeEach()) {
                long start = System.nanoTime();
                Outcome outcome = suiteRuntime.invoke(testCase.getBody());
                result.setBodyNanos(System.nanoTime() - start);
                record(Phase.BODY, outcome);
            }
            afterEach();
        } finally {
            result.setEndTime(System.currentTimeMillis());
        }
        return result;
    }

    private boolean beforeEach() {
        for (TestFunction<T> hook : suiteRuntime.getSuite().getBeforeEach()) {
            if (!record(Phase.BEFORE_EACH, suiteRuntime.invoke(hook))) {
                return false;
            }
        }
        return true;
    }

    private void afterEach() {
        for (TestFunction<T> hook : suiteRuntime.getSuite().getAfterEach()) {
            record(Phase.AFTER_EACH, suiteRuntime.invoke(hook));
        }
    }

    private boolean record(Phase phase, Outcome outcome) {
        FailureEntry entry = result.record(phase, outcome);
        suiteRuntime.getRun().record(entry);
        return entry == null;
    }

    public TestCase<T> getTestCase() {
        return testCase;
    }

    public CaseResult getResult() {
        return result;
    }

}
