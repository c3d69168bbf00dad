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

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A single named test of a {@link TestSuite}. Instances are immutable, the {@code with} style
 * methods return copies.
 * <pre>
 * TestCase.of("slowQuery", DatabaseTest::slowQuery)
 *     .tags("slow")
 *     .disabledIf(System.getenv("CI") != null, "too slow for CI");
 * </pre>
 *
 * @param <T> the suite instance type
 */
public final class TestCase<T> {

    private final String suiteName;
    private final String name;
    private final TestFunction<T> body;
    private final boolean disabled;
    private final String disabledReason;
    private final List<String> tags;

    private TestCase(String suiteName, String name, TestFunction<T> body,
                     boolean disabled, String disabledReason, List<String> tags) {
        this.suiteName = suiteName;
        this.name = name;
        this.body = body;
        this.disabled = disabled;
        this.disabledReason = disabledReason;
        this.tags = tags;
    }

    public static <T> TestCase<T> of(String name, TestFunction<T> body) {
        if (name == null || name.isBlank()) {
            throw new RegistrationException("test name is required");
        }
        if (body == null) {
            throw new RegistrationException("test body is required: " + name);
        }
        return new TestCase<>(null, name, body, false, null, Collections.emptyList());
    }

    public TestCase<T> disabled(String reason) {
        return new TestCase<>(suiteName, name, body, true, reason, tags);
    }

    /**
     * Gating hook for conditions evaluated up front (environment, OS, ...).
     */
    public TestCase<T> disabledIf(boolean condition, String reason) {
        return condition ? disabled(reason) : this;
    }

    public TestCase<T> tags(String... values) {
        return new TestCase<>(suiteName, name, body, disabled, disabledReason,
                Collections.unmodifiableList(Arrays.asList(values.clone())));
    }

    TestCase<T> bind(String suite) {
        return new TestCase<>(suite, name, body, disabled, disabledReason, tags);
    }

    public String getSuiteName() {
        return suiteName;
    }

    public String getName() {
        return name;
    }

    public String getFullyQualifiedName() {
        return qualify(suiteName, name);
    }

    public static String qualify(String suiteName, String caseName) {
        return suiteName + '.' + caseName;
    }

    public TestFunction<T> getBody() {
        return body;
    }

    public boolean isDisabled() {
        return disabled;
    }

    public String getDisabledReason() {
        return disabledReason;
    }

    public List<String> getTags() {
        return tags;
    }

    public Map<String, Object> toJson() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("suite", suiteName);
        map.put("name", name);
        if (disabled) {
            map.put("disabled", true);
            if (disabledReason != null) {
                map.put("reason", disabledReason);
            }
        }
        if (!tags.isEmpty()) {
            map.put("tags", tags);
        }
        return map;
    }

    @Override
    public String toString() {
        return getFullyQualifiedName();
    }

}
