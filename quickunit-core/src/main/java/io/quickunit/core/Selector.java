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
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Selects test cases by regular expressions matched against fully-qualified names
 * ({@code Suite.case}). A pattern selects a case if it matches anywhere in the name, so
 * {@code "Foo"} selects every case of suite {@code Foo} and {@code "\\.testAdd$"} one case per suite.
 * <p>
 * Patterns are processed in sequence. An empty pattern list, a null pattern or an empty pattern
 * selects everything. By default a case matched by more than one pattern is scheduled once; with
 * {@link #duplicates(boolean)} it is scheduled once per matching pattern.
 */
public class Selector {

    private final List<Pattern> patterns;
    private boolean duplicates;

    public Selector(List<String> filters) {
        List<Pattern> list = new ArrayList<>();
        if (filters == null || filters.isEmpty()) {
            list.add(null);
        } else {
            for (String filter : filters) {
                list.add(compile(filter));
            }
        }
        this.patterns = Collections.unmodifiableList(list);
    }

    public static Selection select(Registry registry, List<String> filters) {
        return new Selector(filters).select(registry);
    }

    public Selector duplicates(boolean duplicates) {
        this.duplicates = duplicates;
        return this;
    }

    private static Pattern compile(String filter) {
        if (filter == null || filter.isEmpty()) {
            return null;
        }
        try {
            return Pattern.compile(filter);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("invalid filter: " + filter, e);
        }
    }

    public boolean matches(String fullyQualifiedName) {
        for (Pattern pattern : patterns) {
            if (matches(pattern, fullyQualifiedName)) {
                return true;
            }
        }
        return false;
    }

    private static boolean matches(Pattern pattern, String fullyQualifiedName) {
        return pattern == null || pattern.matcher(fullyQualifiedName).find();
    }

    public Selection select(Registry registry) {
        Map<String, List<String>> scheduled = new HashMap<>();
        Map<String, Set<String>> seen = new HashMap<>();
        for (Pattern pattern : patterns) {
            for (TestSuite<?> suite : registry.all()) {
                for (TestCase<?> tc : suite.getCases()) {
                    if (!matches(pattern, tc.getFullyQualifiedName())) {
                        continue;
                    }
                    if (!duplicates && !seen.computeIfAbsent(suite.getName(), k -> new LinkedHashSet<>()).add(tc.getName())) {
                        continue;
                    }
                    scheduled.computeIfAbsent(suite.getName(), k -> new ArrayList<>()).add(tc.getName());
                }
            }
        }
        // suites in registration order, whatever pattern matched them first
        Selection selection = new Selection();
        for (TestSuite<?> suite : registry.all()) {
            List<String> cases = scheduled.get(suite.getName());
            if (cases != null) {
                for (String name : cases) {
                    selection.add(suite.getName(), name);
                }
            }
        }
        return selection;
    }

    public List<Pattern> getPatterns() {
        return patterns;
    }

    public boolean isDuplicates() {
        return duplicates;
    }

}
