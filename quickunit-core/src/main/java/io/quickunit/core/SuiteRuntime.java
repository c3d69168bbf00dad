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

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Runs the selected cases of one suite against a single fresh suite instance.
 * <ol>
 *   <li>construct the instance, on failure nothing else runs</li>
 *   <li>before-all hooks, on failure no case and no after-all hook runs</li>
 *   <li>each selected case, see {@link CaseRuntime}</li>
 *   <li>after-all hooks, every one of them</li>
 * </ol>
 * Whatever a hook or test throws is turned into an {@link Outcome} by {@link #invoke}, nothing
 * escapes to the next suite.
 *
 * @param <T> the suite instance type
 */
public class SuiteRuntime<T> implements Callable<SuiteResult> {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final TestRun run;
    private final TestSuite<T> suite;
    private final List<String> caseNames;
    private final SuiteResult result;

    private T instance;

    public SuiteRuntime(TestRun run, TestSuite<T> suite, List<String> caseNames) {
        this.run = run;
        this.suite = suite;
        this.caseNames = caseNames;
        this.result = new SuiteResult(suite.getName(), caseNames.size());
    }

    @Override
    public SuiteResult call() {
        result.setStartTime(System.currentTimeMillis());
        logger.debug("suite {}: {} selected case(s)", suite.getName(), caseNames.size());
        run.fire(SuiteRunEvent.enter(suite));
        try {
            if (construct() && beforeAll()) {
                for (String caseName : caseNames) {
                    TestCase<T> testCase = suite.getCase(caseName);
                    CaseResult cr;
                    if (testCase.isDisabled()) {
                        cr = CaseResult.skipped(testCase);
                    } else {
                        cr = new CaseRuntime<>(this, testCase).call();
                    }
                    result.addCaseResult(cr);
                    logger.debug("{}: {}", testCase.getFullyQualifiedName(), cr.getOutcome());
                    run.fire(CaseRunEvent.exit(cr));
                }
                afterAll();
            }
        } finally {
            result.setEndTime(System.currentTimeMillis());
            run.fire(SuiteRunEvent.exit(suite, result));
        }
        return result;
    }

    private boolean construct() {
        Outcome outcome;
        try {
            instance = suite.getFactory().call();
            outcome = instance == null
                    ? Outcome.errored(new IllegalStateException("suite factory returned null: " + suite.getName()))
                    : Outcome.passed();
        } catch (Throwable t) {
            outcome = Outcome.of(t);
        }
        return record(Phase.CONSTRUCT, outcome);
    }

    private boolean beforeAll() {
        for (TestFunction<T> hook : suite.getBeforeAll()) {
            if (!record(Phase.BEFORE_ALL, invoke(hook))) {
                return false;
            }
        }
        return true;
    }

    private void afterAll() {
        for (TestFunction<T> hook : suite.getAfterAll()) {
            record(Phase.AFTER_ALL, invoke(hook));
        }
    }

    private boolean record(Phase phase, Outcome outcome) {
        FailureEntry entry = result.record(phase, outcome);
        if (entry == null) {
            return true;
        }
        logger.debug("suite {}: {} {}", suite.getName(), entry.getLabel(), outcome);
        run.record(entry);
        run.fire(new FixtureRunEvent(entry));
        return false;
    }

    /**
     * The single place where test code is called. Assertion failures and any other throwable are
     * classified here, so callers only ever see an {@link Outcome}.
     */
    Outcome invoke(TestFunction<T> function) {
        try {
            function.run(instance);
            return Outcome.passed();
        } catch (Throwable t) {
            return Outcome.of(t);
        }
    }

    TestRun getRun() {
        return run;
    }

    public TestSuite<T> getSuite() {
        return suite;
    }

    public T getInstance() {
        return instance;
    }

    public SuiteResult getResult() {
        return result;
    }

}
