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
 * The suites known to a test run, in registration order.
 * <p>
 * Built once by bootstrap code and then handed to the {@link Runner}, there is no global registry.
 * Execution and report order follow registration order.
 */
public class Registry {

    private final Map<String, TestSuite<?>> suites = new LinkedHashMap<>();

    public static Registry of(TestSuite<?>... suites) {
        Registry registry = new Registry();
        for (TestSuite<?> suite : suites) {
            registry.register(suite);
        }
        return registry;
    }

    /**
     * @throws RegistrationException if a suite with the same name was already registered
     */
    public Registry register(TestSuite<?> suite) {
        if (suites.containsKey(suite.getName())) {
            throw new RegistrationException("duplicate suite name: " + suite.getName());
        }
        suites.put(suite.getName(), suite);
        return this;
    }

    public List<TestSuite<?>> all() {
        return Collections.unmodifiableList(new ArrayList<>(suites.values()));
    }

    public TestSuite<?> get(String name) {
        return suites.get(name);
    }

    public boolean contains(String name) {
        return suites.containsKey(name);
    }

    public int size() {
        return suites.size();
    }

    public boolean isEmpty() {
        return suites.isEmpty();
    }

}
