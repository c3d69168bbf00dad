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
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * A named group of test cases sharing one fixture instance and its lifecycle hooks.
 * <p>
 * Suites are defined up front with a builder, nothing is discovered at runtime:
 * <pre>
 * TestSuite&lt;StackTest&gt; suite = TestSuite.builder("StackTest", StackTest::new)
 *     .beforeAll(StackTest::openPool)
 *     .beforeEach(StackTest::setUp)
 *     .test("push", StackTest::push)
 *     .test("pop", StackTest::pop)
 *     .disabled("peek", "not implemented yet", StackTest::peek)
 *     .afterEach(StackTest::tearDown)
 *     .afterAll(StackTest::closePool)
 *     .build();
 * </pre>
 * Several hooks may be registered for the same moment, they run in registration order.
 *
 * @param <T> the suite instance type
 */
public final class TestSuite<T> {

    private final String name;
    private final Callable<? extends T> factory;
    private final List<TestFunction<T>> beforeAll;
    private final List<TestFunction<T>> beforeEach;
    private final List<TestFunction<T>> afterEach;
    private final List<TestFunction<T>> afterAll;
    private final List<TestCase<T>> cases;

    private TestSuite(Builder<T> builder) {
        this.name = builder.name;
        this.factory = builder.factory;
        this.beforeAll = Collections.unmodifiableList(new ArrayList<>(builder.beforeAll));
        this.beforeEach = Collections.unmodifiableList(new ArrayList<>(builder.beforeEach));
        this.afterEach = Collections.unmodifiableList(new ArrayList<>(builder.afterEach));
        this.afterAll = Collections.unmodifiableList(new ArrayList<>(builder.afterAll));
        List<TestCase<T>> bound = new ArrayList<>(builder.cases.size());
        for (TestCase<T> tc : builder.cases) {
            bound.add(tc.bind(name));
        }
        this.cases = Collections.unmodifiableList(bound);
    }

    public static <T> Builder<T> builder(String name, Callable<? extends T> factory) {
        return new Builder<>(name, factory);
    }

    public String getName() {
        return name;
    }

    public Callable<? extends T> getFactory() {
        return factory;
    }

    public List<TestFunction<T>> getBeforeAll() {
        return beforeAll;
    }

    public List<TestFunction<T>> getBeforeEach() {
        return beforeEach;
    }

    public List<TestFunction<T>> getAfterEach() {
        return afterEach;
    }

    public List<TestFunction<T>> getAfterAll() {
        return afterAll;
    }

    public List<TestCase<T>> getCases() {
        return cases;
    }

    public TestCase<T> getCase(String caseName) {
        for (TestCase<T> tc : cases) {
            if (tc.getName().equals(caseName)) {
                return tc;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return name;
    }

    // ========== Builder ==========

    public static class Builder<T> {

        private final String name;
        private final Callable<? extends T> factory;
        private final List<TestFunction<T>> beforeAll = new ArrayList<>();
        private final List<TestFunction<T>> beforeEach = new ArrayList<>();
        private final List<TestFunction<T>> afterEach = new ArrayList<>();
        private final List<TestFunction<T>> afterAll = new ArrayList<>();
        private final List<TestCase<T>> cases = new ArrayList<>();
        private final Set<String> caseNames = new HashSet<>();

        Builder(String name, Callable<? extends T> factory) {
            if (name == null || name.isBlank()) {
                throw new RegistrationException("suite name is required");
            }
            if (factory == null) {
                throw new RegistrationException("suite factory is required: " + name);
            }
            this.name = name;
            this.factory = factory;
        }

        public Builder<T> beforeAll(TestFunction<T> hook) {
            beforeAll.add(hook);
            return this;
        }

        public Builder<T> beforeEach(TestFunction<T> hook) {
            beforeEach.add(hook);
            return this;
        }

        public Builder<T> afterEach(TestFunction<T> hook) {
            afterEach.add(hook);
            return this;
        }

        public Builder<T> afterAll(TestFunction<T> hook) {
            afterAll.add(hook);
            return this;
        }

        public Builder<T> test(String caseName, TestFunction<T> body) {
            return test(TestCase.of(caseName, body));
        }

        public Builder<T> disabled(String caseName, String reason, TestFunction<T> body) {
            return test(TestCase.of(caseName, body).disabled(reason));
        }

        public Builder<T> test(TestCase<T> testCase) {
            if (!caseNames.add(testCase.getName())) {
                throw new RegistrationException("duplicate test name in suite " + name + ": " + testCase.getName());
            }
            cases.add(testCase);
            return this;
        }

        public TestSuite<T> build() {
            return new TestSuite<>(this);
        }

    }

}
