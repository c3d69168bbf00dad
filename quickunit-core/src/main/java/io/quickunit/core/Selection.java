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
 * The cases scheduled for a run, keyed by suite name. Suites keep registration order and cases keep
 * the order in which they were scheduled.
 */
public class Selection {

    private final Map<String, List<String>> casesBySuite = new LinkedHashMap<>();

    void add(String suiteName, String caseName) {
        casesBySuite.computeIfAbsent(suiteName, k -> new ArrayList<>()).add(caseName);
    }

    public List<String> suiteNames() {
        return Collections.unmodifiableList(new ArrayList<>(casesBySuite.keySet()));
    }

    public List<String> getCases(String suiteName) {
        List<String> cases = casesBySuite.get(suiteName);
        return cases == null ? Collections.emptyList() : Collections.unmodifiableList(cases);
    }

    public boolean contains(String suiteName) {
        return casesBySuite.containsKey(suiteName);
    }

    public boolean contains(String suiteName, String caseName) {
        return getCases(suiteName).contains(caseName);
    }

    public int size() {
        int count = 0;
        for (List<String> cases : casesBySuite.values()) {
            count += cases.size();
        }
        return count;
    }

    public boolean isEmpty() {
        return casesBySuite.isEmpty();
    }

    public List<String> fullyQualifiedNames() {
        List<String> names = new ArrayList<>();
        casesBySuite.forEach((suite, cases) -> {
            for (String name : cases) {
                names.add(TestCase.qualify(suite, name));
            }
        });
        return names;
    }

    public Map<String, List<String>> toMap() {
        Map<String, List<String>> map = new LinkedHashMap<>();
        casesBySuite.forEach((suite, cases) -> map.put(suite, Collections.unmodifiableList(cases)));
        return Collections.unmodifiableMap(map);
    }

    @Override
    public String toString() {
        return casesBySuite.toString();
    }

}
