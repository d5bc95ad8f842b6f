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

import io.featurekit.common.Resource;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class Feature {

    private final int id;
    private final String sentence;
    private final List<String> description;
    private final String path;
    private final int line;
    private final String language;
    private final List<Tag> tags;
    private final Background background;
    private final List<Rule> rules;
    private final List<Scenario> scenarios;

    public static Feature read(String path) {
        return read(Resource.path(path));
    }

    public static Feature read(Path path) {
        return read(Resource.path(path));
    }

    public static Feature read(Resource resource) {
        FeatureParser parser = new FeatureParser(resource, 1, 1, FeatureParser.DEFAULT_LANGUAGE);
        return parser.parse();
    }

    public Feature(int id, String sentence, List<String> description, String path, int line, String language,
                   List<Tag> tags, Background background, List<Rule> rules) {
        this.id = id;
        this.sentence = sentence == null ? "" : sentence;
        this.description = description == null ? Collections.emptyList() : List.copyOf(description);
        this.path = path;
        this.line = line;
        this.language = language;
        this.tags = tags == null ? Collections.emptyList() : List.copyOf(tags);
        this.background = background;
        this.rules = rules == null ? Collections.emptyList() : List.copyOf(rules);
        List<Scenario> temp = new ArrayList<>();
        for (Rule rule : this.rules) {
            temp.addAll(rule.getScenarios());
        }
        this.scenarios = Collections.unmodifiableList(temp);
    }

    public int getId() {
        return id;
    }

    public String getSentence() {
        return sentence;
    }

    public List<String> getDescription() {
        return description;
    }

    public String getPath() {
        return path;
    }

    public int getLine() {
        return line;
    }

    public String getLanguage() {
        return language;
    }

    public List<Tag> getTags() {
        return tags;
    }

    public Background getBackground() {
        return background;
    }

    public boolean isBackgroundPresent() {
        return background != null;
    }

    public List<Rule> getRules() {
        return rules;
    }

    /**
     * @return every scenario of every rule in source order, templates included
     * but not the scenarios generated from them
     */
    public List<Scenario> getScenarios() {
        return scenarios;
    }

    /**
     * @return the runnable view: plain scenarios plus the children of every
     * outline and loop, in id order
     */
    public List<Scenario> getAllScenarios() {
        List<Scenario> list = new ArrayList<>();
        for (Scenario scenario : scenarios) {
            if (scenario.isTemplate()) {
                list.addAll(scenario.getChildren());
            } else {
                list.add(scenario);
            }
        }
        return list;
    }

    public Scenario findScenarioById(int scenarioId) {
        for (Scenario scenario : scenarios) {
            if (scenario.getId() == scenarioId) {
                return scenario;
            }
            for (Scenario child : scenario.getChildren()) {
                if (child.getId() == scenarioId) {
                    return child;
                }
            }
        }
        return null;
    }

    public Step findStepByLine(int line) {
        if (background != null) {
            for (Step step : background.getSteps()) {
                if (step.getLine() == line) {
                    return step;
                }
            }
        }
        for (Scenario scenario : scenarios) {
            Step step = scenario.getStepByLine(line);
            if (step != null) {
                return step;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return path;
    }

}
