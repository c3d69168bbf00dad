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
 * The results of one test suite: a case result per selected case that was reached, plus the
 * non-passing suite-level phases (construction, before-all, after-all).
 */
public class SuiteResult {

    private final String suiteName;
    private final List<CaseResult> caseResults = new ArrayList<>();
    private final List<FailureEntry> fixtureEntries = new ArrayList<>();
    private final int selectedCount;
    private long startTime;
    private long endTime;

    public SuiteResult(String suiteName, int selectedCount) {
        this.suiteName = suiteName;
        this.selectedCount = selectedCount;
    }

    void addCaseResult(CaseResult cr) {
        caseResults.add(cr);
    }

    FailureEntry record(Phase phase, Outcome outcome) {
        if (!outcome.isNotOk()) {
            return null;
        }
        FailureEntry entry = new FailureEntry(phase, suiteName, null, outcome);
        fixtureEntries.add(entry);
        return entry;
    }

    public String getSuiteName() {
        return suiteName;
    }

    public List<CaseResult> getCaseResults() {
        return Collections.unmodifiableList(caseResults);
    }

    public List<FailureEntry> getFixtureEntries() {
        return Collections.unmodifiableList(fixtureEntries);
    }

    public int getSelectedCount() {
        return selectedCount;
    }

    public int getExecutedCount() {
        return (int) caseResults.stream().filter(cr -> !cr.isSkipped()).count();
    }

    public int getSkippedCount() {
        return (int) caseResults.stream().filter(CaseResult::isSkipped).count();
    }

    public int getPassedCount() {
        return (int) caseResults.stream().filter(CaseResult::isPassed).count();
    }

    public int getFailedCount() {
        return (int) caseResults.stream().filter(CaseResult::isFailed).count();
    }

    public int getErroredCount() {
        return (int) caseResults.stream().filter(CaseResult::isErrored).count();
    }

    /**
     * Selected cases never reached because construction or before-all failed.
     */
    public int getNotRunCount() {
        return selectedCount - caseResults.size();
    }

    public boolean isFailed() {
        return !fixtureEntries.isEmpty() || caseResults.stream().anyMatch(cr -> cr.getOutcome().isNotOk());
    }

    public boolean isPassed() {
        return !isFailed();
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

    public Map<String, Object> toJson() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", suiteName);
        map.put("passed", isPassed());
        map.put("selectedCount", selectedCount);
        map.put("executedCount", getExecutedCount());
        map.put("skippedCount", getSkippedCount());
        map.put("notRunCount", getNotRunCount());
        map.put("passedCount", getPassedCount());
        map.put("failedCount", getFailedCount());
        map.put("erroredCount", getErroredCount());
        map.put("durationMillis", getDurationMillis());
        if (!fixtureEntries.isEmpty()) {
            List<Map<String, Object>> list = new ArrayList<>();
            for (FailureEntry entry : fixtureEntries) {
                list.add(entry.toJson());
            }
            map.put("fixtureEntries", list);
        }
        List<Map<String, Object>> cases = new ArrayList<>();
        for (CaseResult cr : caseResults) {
            cases.add(cr.toJson());
        }
        map.put("caseResults", cases);
        return map;
    }

}
