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
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Main entry point for running registered suites programmatically.
 * <p>
 * Example usage:
 * <pre>
 * RunSummary summary = Runner.builder(registry)
 *     .filters("^StackTest\\.", "QueueTest.offer")
 *     .listener(new ProgressReporter())
 *     .run();
 * System.exit(summary.exitCode());
 * </pre>
 */
public final class Runner {

    public static final String FILTER_PROPERTY = "quickunit.filter";
    public static final String DUPLICATES_PROPERTY = "quickunit.duplicates";

    private Runner() {
    }

    /**
     * Select cases with the given patterns and run them, reporting to the listener.
     */
    public static RunSummary run(Registry registry, List<String> patterns, RunListener listener) {
        Builder builder = builder(registry).filters(patterns);
        if (listener != null) {
            builder.listener(listener);
        }
        return builder.run();
    }

    public static Builder builder(Registry registry) {
        return new Builder(registry);
    }

    // ========== Builder ==========

    public static class Builder {

        private final Registry registry;
        private final List<String> filters = new ArrayList<>();
        private final List<RunListener> listeners = new ArrayList<>();
        private Boolean duplicates;

        Builder(Registry registry) {
            this.registry = registry;
        }

        /**
         * Add regular expressions matched against {@code Suite.case} names, processed in sequence.
         */
        public Builder filters(String... values) {
            filters.addAll(Arrays.asList(values));
            return this;
        }

        public Builder filters(Collection<String> values) {
            if (values != null) {
                filters.addAll(values);
            }
            return this;
        }

        public Builder listener(RunListener listener) {
            listeners.add(listener);
            return this;
        }

        public Builder listeners(Collection<RunListener> values) {
            if (values != null) {
                listeners.addAll(values);
            }
            return this;
        }

        /**
         * Schedule a case once per matching filter instead of once.
         */
        public Builder duplicates(boolean value) {
            this.duplicates = value;
            return this;
        }

        /**
         * Compute the selection without running anything.
         * Falls back to the {@code quickunit.filter} and {@code quickunit.duplicates} system
         * properties for whatever was not set on the builder.
         */
        public Selection select() {
            List<String> patterns = new ArrayList<>(filters);
            if (patterns.isEmpty()) {
                String property = System.getProperty(FILTER_PROPERTY);
                if (property != null && !property.isEmpty()) {
                    patterns.add(property);
                }
            }
            boolean dup = duplicates != null ? duplicates : Boolean.getBoolean(DUPLICATES_PROPERTY);
            return new Selector(patterns).duplicates(dup).select(registry);
        }

        public TestRun buildRun() {
            return new TestRun(registry, select(), new ArrayList<>(listeners));
        }

        public RunSummary run() {
            return buildRun().run();
        }

        @Override
        public String toString() {
            return "Runner.Builder{suites=" + registry.size() + ", filters=" + filters + ", duplicates=" + duplicates + "}";
        }

    }

}
