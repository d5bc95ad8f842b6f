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
package io.featurekit.gherkin;

import java.util.Collections;
import java.util.List;

/**
 * Named group of scenarios. The default rule holds the scenarios that appear
 * before any explicit rule and is never rendered with a header.
 */
public class Rule {

    private final String shortDescription;
    private final List<Scenario> scenarios;
    private final List<Tag> tags;
    private final String path;
    private final int line;
    private final boolean defaultRule;

    public static Rule ofDefault(List<Scenario> scenarios) {
        return new Rule(null, scenarios, Collections.emptyList(), null, 0, true);
    }

    public Rule(String shortDescription, List<Scenario> scenarios) {
        this(shortDescription, scenarios, Collections.emptyList(), null, 0, false);
    }

    public Rule(String shortDescription, List<Scenario> scenarios, List<Tag> tags, String path, int line) {
        this(shortDescription, scenarios, tags, path, line, false);
    }

    private Rule(String shortDescription, List<Scenario> scenarios, List<Tag> tags, String path, int line, boolean defaultRule) {
        this.shortDescription = shortDescription;
        this.scenarios = List.copyOf(scenarios);
        this.tags = tags == null ? Collections.emptyList() : List.copyOf(tags);
        this.path = path;
        this.line = line;
        this.defaultRule = defaultRule;
    }

    public boolean isDefault() {
        return defaultRule;
    }

    public String getShortDescription() {
        return shortDescription;
    }

    public List<Scenario> getScenarios() {
        return scenarios;
    }

    public List<Tag> getTags() {
        return tags;
    }

    public String getPath() {
        return path;
    }

    public int getLine() {
        return line;
    }

    @Override
    public String toString() {
        return defaultRule ? "(default rule)" : "Rule: " + shortDescription;
    }

}
