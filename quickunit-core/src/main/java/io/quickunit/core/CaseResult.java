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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The result of one selected test case. The outcome is the first non-passing phase outcome across
 * before-each, body and after-each, or passed if there was none.
 */
public class CaseResult {

    private final TestCase<?> testCase;
    private final List<FailureEntry> entries = new ArrayList<>();
    private Outcome outcome;
    private long startTime;
    private long endTime;
    private long bodyNanos;

    public CaseResult(TestCase<?> testCase) {
        this.testCase = testCase;
    }

    public static CaseResult skipped(TestCase<?> testCase) {
        CaseResult result = new CaseResult(testCase);
        result.outcome = Outcome.skipped(testCase.getDisabledReason());
        long now = System.currentTimeMillis();
        result.startTime = now;
        result.endTime = now;
        return result;
    }

    /**
     * Records a phase outcome, returns the new entry or null if the phase passed.
     */
    FailureEntry record(Phase phase, Outcome phaseOutcome) {
        if (!phaseOutcome.isNotOk()) {
            return null;
        }
        FailureEntry entry = new FailureEntry(phase, testCase.getSuiteName(), testCase.getName(), phaseOutcome);
        entries.add(entry);
        if (outcome == null) {
            outcome = phaseOutcome;
        }
        return entry;
    }

    public TestCase<?> getTestCase() {
        return testCase;
    }

    public String getSuiteName() {
        return testCase.getSuiteName();
    }

    public String getName() {
        return testCase.getName();
    }

    public Outcome getOutcome() {
        return outcome == null ? Outcome.passed() : outcome;
    }

    /**
     * Every non-passing phase of this case in execution order, a case can fail in its body and
     * again in an after-each hook.
     */
    public List<FailureEntry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public boolean isPassed() {
        return getOutcome().isPassed();
    }

    public boolean isFailed() {
        return getOutcome().isFailed();
    }

    public boolean isErrored() {
        return getOutcome().isErrored();
    }

    public boolean isSkipped() {
        return getOutcome().isSkipped();
    }

    public void setStartTime(long startTime) {
        this.startTime = startTime;
    }

    public void setEndTime(long endTime) {
        this.endTime = endTime;
    }

    void setBodyNanos(long bodyNanos) {
        this.bodyNanos = bodyNanos;
    }

    public long getStartTime() {
        return startTime;
    }

    public long getEndTime() {
        return endTime;
    }

    public long getDurationMillis() {
        return endTime - startTime;
    }

    /**
     * Time spent in the test body alone, excluding hooks.
     */
    public double getBodyMillis() {
        return bodyNanos / 1_000_000.0;
    }

    public Map<String, Object> toJson() {
        Map<String, Object> map = new LinkedHashMap<>(testCase.toJson());
        map.putAll(getOutcome().toJson());
        map.put("durationMillis", getDurationMillis());
        if (!entries.isEmpty()) {
            List<Map<String, Object>> list = new ArrayList<>();
            for (FailureEntry entry : entries) {
                list.add(entry.toJson());
            }
            map.put("entries", list);
        }
        return map;
    }

}
