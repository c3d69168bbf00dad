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

import io.quickunit.output.LogContext;
import org.slf4j.Logger;

import java.util.Collections;
import java.util.List;

/**
 * One execution of a {@link Selection} against a {@link Registry}.
 * <p>
 * Suites run one at a time in registration order and every selected suite runs, whatever happened
 * to the suites before it. Created through {@link Runner}.
 */
public class TestRun {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final Registry registry;
    private final Selection selection;
    private final List<RunListener> listeners;

    private RunSummary summary;

    TestRun(Registry registry, Selection selection, List<RunListener> listeners) {
        this.registry = registry;
        this.selection = selection;
        this.listeners = Collections.unmodifiableList(listeners);
    }

    public RunSummary run() {
        summary = new RunSummary();
        summary.setStartTime(System.currentTimeMillis());
        logger.debug("run started: {} case(s) in {} suite(s)", selection.size(), selection.suiteNames().size());
        fire(SummaryRunEvent.enter(selection));
        try {
            for (TestSuite<?> suite : registry.all()) {
                List<String> caseNames = selection.getCases(suite.getName());
                if (caseNames.isEmpty()) {
                    continue;
                }
                summary.addSuiteResult(runSuite(suite, caseNames));
            }
        } finally {
            summary.setEndTime(System.currentTimeMillis());
            logger.debug("run finished in {} ms: executed {}, failures {}, errors {}",
                    summary.getDurationMillis(), summary.getExecutedCount(),
                    summary.getFailureCount(), summary.getErrorCount());
            fire(SummaryRunEvent.exit(selection, summary));
        }
        return summary;
    }

    private <T> SuiteResult runSuite(TestSuite<T> suite, List<String> caseNames) {
        return new SuiteRuntime<>(this, suite, caseNames).call();
    }

    void record(FailureEntry entry) {
        if (entry != null) {
            summary.addEntry(entry);
        }
    }

    void fire(RunEvent event) {
        for (RunListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (Throwable t) {
                logger.warn("listener failed on {}: {}", event.getType(), t.getMessage(), t);
            }
        }
    }

    public Registry getRegistry() {
        return registry;
    }

    public Selection getSelection() {
        return selection;
    }

    public List<RunListener> getListeners() {
        return listeners;
    }

    public RunSummary getSummary() {
        return summary;
    }

}
