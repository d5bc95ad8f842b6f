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
 * A concrete scenario, and the common shape of the two template variants
 * {@link ScenarioOutline} and {@link ScenarioLoop}. Consumers switch on
 * {@link #getKind()}.
 */
public sealed class Scenario permits ScenarioOutline, ScenarioLoop {

    private final int id;
    private final String sentence;
    private final String path;
    private final int line;
    private final List<Tag> tags;
    private final List<Step> steps;

    public Scenario(int id, String sentence, String path, int line, List<Tag> tags, List<Step> steps) {
        this.id = id;
        this.sentence = sentence == null ? "" : sentence;
        this.path = path;
        this.line = line;
        this.tags = tags == null ? Collections.emptyList() : List.copyOf(tags);
        this.steps = List.copyOf(steps);
    }

    public ScenarioKind getKind() {
        return ScenarioKind.SCENARIO;
    }

    /**
     * @return the scenarios generated from this template, empty for a plain scenario
     */
    public List<Scenario> getChildren() {
        return Collections.emptyList();
    }

    public boolean isTemplate() {
        return getKind().isTemplate();
    }

    public int getId() {
        return id;
    }

    public String getSentence() {
        return sentence;
    }

    public String getPath() {
        return path;
    }

    public int getLine() {
        return line;
    }

    public List<Tag> getTags() {
        return tags;
    }

    public boolean hasTag(String name) {
        for (Tag tag : tags) {
            if (tag.getName().equals(name)) {
                return true;
            }
        }
        return false;
    }

    public List<Step> getSteps() {
        return steps;
    }

    public Step getStepByLine(int line) {
        for (Step step : steps) {
            if (step.getLine() == line) {
                return step;
            }
        }
        return null;
    }

    public String getDebugInfo() {
        return path + ":" + line;
    }

    @Override
    public String toString() {
        return getKind().getDisplayName() + ": " + sentence;
    }

}
