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
 * The outcome of a whole run: suite results in registration order and every non-passing phase
 * outcome in execution order. Converted to a process exit code with {@link #exitCode()}.
 */
public class RunSummary {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURES = 1;
    public static final int EXIT_ERRORS = 2;

    private final List<SuiteResult> suiteResults = new ArrayList<>();
    private final List<FailureEntry> entries = new ArrayList<>();
    private long startTime;
    private long endTime;

    void addSuiteResult(SuiteResult sr) {
        suiteResults.add(sr);
    }

    void addEntry(FailureEntry entry) {
        entries.add(entry);
    }

    public List<SuiteResult> getSuiteResults() {
        return Collections.unmodifiableList(suiteResults);
    }

    public SuiteResult getSuiteResult(String suiteName) {
        for (SuiteResult sr : suiteResults) {
            if (sr.getSuiteName().equals(suiteName)) {
                return sr;
            }
        }
        return null;
    }

    public List<CaseResult> getCaseResults() {
        List<CaseResult> list = new ArrayList<>();
        for (SuiteResult sr : suiteResults) {
            list.addAll(sr.getCaseResults());
        }
        return list;
    }

    public List<FailureEntry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public List<FailureEntry> getFailures() {
        return entries.stream().filter(FailureEntry::isFailure).toList();
    }

    public List<FailureEntry> getErrors() {
        return entries.stream().filter(FailureEntry::isError).toList();
    }

    // ========== Aggregation ==========

    public int getExecutedCount() {
        return suiteResults.stream().mapToInt(SuiteResult::getExecutedCount).sum();
    }

    public int getSkippedCount() {
        return suiteResults.stream().mapToInt(SuiteResult::getSkippedCount).sum();
    }

    public int getNotRunCount() {
        return suiteResults.stream().mapToInt(SuiteResult::getNotRunCount).sum();
    }

    public int getPassedCount() {
        return suiteResults.stream().mapToInt(SuiteResult::getPassedCount).sum();
    }

    public int getFailureCount() {
        return (int) entries.stream().filter(FailureEntry::isFailure).count();
    }

    public int getErrorCount() {
        return (int) entries.stream().filter(FailureEntry::isError).count();
    }

    public int getFixtureFailureCount() {
        return (int) entries.stream().filter(e -> e.isFailure() && e.phase().isFixture()).count();
    }

    public int getFixtureErrorCount() {
        return (int) entries.stream().filter(e -> e.isError() && e.phase().isFixture()).count();
    }

    public int getBodyFailureCount() {
        return getFailureCount() - getFixtureFailureCount();
    }

    public int getBodyErrorCount() {
        return getErrorCount() - getFixtureErrorCount();
    }

    public boolean isPassed() {
        return entries.isEmpty();
    }

    public boolean isFailed() {
        return !entries.isEmpty();
    }

    /**
     * 0 when nothing went wrong, 1 when there were only assertion failures and 2 as soon as there
     * was at least one error.
     */
    public int exitCode() {
        if (getErrorCount() > 0) {
            return EXIT_ERRORS;
        }
        return getFailureCount() > 0 ? EXIT_FAILURES : EXIT_OK;
    }

    public void setStartTime(long startTime) {
        this.startTime = startTime;
    }

    public void setEndTime(long endTime) {
        this.endTime = endTime;
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

    // ========== Serialization ==========

    public Map<String, Object> toJson() {
        Map<String, Object> map = new LinkedHashMap<>();
        List<Map<String, Object>> suites = new ArrayList<>();
        for (SuiteResult sr : suiteResults) {
            suites.add(sr.toJson());
        }
        map.put("suites", suites);
        List<Map<String, Object>> list = new ArrayList<>();
        for (FailureEntry entry : entries) {
            list.add(entry.toJson());
        }
        map.put("entries", list);
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("suiteCount", suiteResults.size());
        summary.put("executed", getExecutedCount());
        summary.put("skipped", getSkippedCount());
        summary.put("notRun", getNotRunCount());
        summary.put("passed", getPassedCount());
        summary.put("failures", getFailureCount());
        summary.put("errors", getErrorCount());
        summary.put("fixtureFailures", getFixtureFailureCount());
        summary.put("fixtureErrors", getFixtureErrorCount());
        summary.put("durationMillis", getDurationMillis());
        summary.put("exitCode", exitCode());
        map.put("summary", summary);
        return map;
    }

}
