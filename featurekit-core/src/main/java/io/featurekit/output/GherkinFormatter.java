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
package io.featurekit.output;

import io.featurekit.common.StringUtils;
import io.featurekit.gherkin.Background;
import io.featurekit.gherkin.DataTable;
import io.featurekit.gherkin.DocString;
import io.featurekit.gherkin.ExampleRow;
import io.featurekit.gherkin.Feature;
import io.featurekit.gherkin.FeatureParser;
import io.featurekit.gherkin.KeywordTable;
import io.featurekit.gherkin.Rule;
import io.featurekit.gherkin.Scenario;
import io.featurekit.gherkin.ScenarioLoop;
import io.featurekit.gherkin.ScenarioOutline;
import io.featurekit.gherkin.Step;
import io.featurekit.gherkin.Tag;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders the document model back to canonical Gherkin text.
 * <p>
 * Output for a feature with a description and a background:
 * <pre>
 * &#64;smoke
 * Feature: My Feature
 *     some description
 *
 *     Background: My Background
 *         Given there is a Step
 * </pre>
 * Each nesting level is indented by four spaces. An instance holds no state
 * besides the sink, generated scenarios of outlines and loops are never
 * written since they are derived from their template.
 */
public class GherkinFormatter {

    public static final String INDENT = "    ";

    private final Appendable out;
    private final KeywordTable keywords;

    public GherkinFormatter(Appendable out) {
        this(out, KeywordTable.load(FeatureParser.DEFAULT_LANGUAGE));
    }

    public GherkinFormatter(Appendable out, KeywordTable keywords) {
        this.out = out;
        this.keywords = keywords;
    }

    /**
     * Render a whole feature, using the keywords of the language it was parsed with.
     */
    public static String format(Feature feature) {
        String language = feature.getLanguage() == null ? FeatureParser.DEFAULT_LANGUAGE : feature.getLanguage();
        StringBuilder sb = new StringBuilder();
        new GherkinFormatter(sb, KeywordTable.load(language)).write(feature);
        return sb.toString();
    }

    public void write(Feature feature) {
        writeFeatureHeader(feature);
        Background background = feature.getBackground();
        boolean separated = background == null ? !feature.getDescription().isEmpty() : background.getSteps().isEmpty();
        if (!separated && !feature.getRules().isEmpty()) {
            newLine();
        }
        for (Rule rule : feature.getRules()) {
            writeRuleHeader(rule);
            String indent = rule.isDefault() ? INDENT : INDENT + INDENT;
            for (Scenario scenario : rule.getScenarios()) {
                writeScenario(scenario, indent);
            }
        }
        writeFeatureFooter(feature);
    }

    public void writeTagLine(Tag tag) {
        writeTagLine(tag, StringUtils.EMPTY);
    }

    public void writeTagLine(Tag tag, String indent) {
        line(indent + "@" + tag.getName());
    }

    public void writeFeatureHeader(Feature feature) {
        for (Tag tag : feature.getTags()) {
            writeTagLine(tag);
        }
        line(keywords.getFeature() + ": " + feature.getSentence());
        List<String> description = feature.getDescription();
        for (String text : description) {
            line(INDENT + text);
        }
        if (!description.isEmpty()) {
            newLine();
        }
        Background background = feature.getBackground();
        if (background == null) {
            return;
        }
        String shortDescription = background.getShortDescription();
        line(INDENT + keywords.getBackground() + ": " + (shortDescription == null ? "" : shortDescription));
        for (Step step : background.getSteps()) {
            writeStep(step, INDENT + INDENT);
        }
        if (background.getSteps().isEmpty()) {
            newLine();
        }
    }

    public void writeRuleHeader(Rule rule) {
        if (rule.isDefault()) {
            return;
        }
        for (Tag tag : rule.getTags()) {
            writeTagLine(tag, INDENT);
        }
        line(INDENT + keywords.getRule() + ": " + rule.getShortDescription());
        newLine();
    }

    public void writeFeatureFooter(Feature feature) {
        if (feature.getDescription().isEmpty() && feature.getRules().isEmpty()) {
            newLine();
        }
    }

    public void writeScenario(Scenario scenario, String indent) {
        for (Tag tag : scenario.getTags()) {
            writeTagLine(tag, indent);
        }
        String keyword = switch (scenario.getKind()) {
            case SCENARIO -> keywords.getScenario();
            case OUTLINE -> keywords.getScenarioOutline();
            case LOOP -> keywords.getScenarioLoop() + " " + ((ScenarioLoop) scenario).getIterations();
        };
        line(indent + keyword + ": " + scenario.getSentence());
        for (Step step : scenario.getSteps()) {
            writeStep(step, indent + INDENT);
        }
        if (scenario instanceof ScenarioOutline outline && !outline.getExamplesHeader().isEmpty()) {
            newLine();
            line(indent + keywords.getExamples() + ":");
            List<List<String>> rows = new ArrayList<>();
            rows.add(outline.getExamplesHeader());
            for (ExampleRow row : outline.getExamples()) {
                rows.add(row.getData());
            }
            writeRows(rows, indent + INDENT);
        }
        newLine();
    }

    public void writeStep(Step step, String indent) {
        line(indent + step.getSentence());
        if (step.getTable() != null) {
            writeDataTable(step.getTable(), indent + INDENT);
        }
        if (step.getDocString() != null) {
            writeDocString(step.getDocString(), indent + INDENT);
        }
    }

    public void writeDataTable(DataTable table, String indent) {
        writeRows(table.getRows(), indent);
    }

    public void writeDocString(DocString docString, String indent) {
        line(indent + DocString.DELIMITER);
        for (String text : docString.getLines()) {
            line(text.isEmpty() ? text : indent + text);
        }
        line(indent + DocString.DELIMITER);
    }

    private void writeRows(List<List<String>> rows, String indent) {
        int columns = 0;
        for (List<String> row : rows) {
            columns = Math.max(columns, row.size());
        }
        int[] widths = new int[columns];
        List<List<String>> escaped = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            List<String> cells = new ArrayList<>(columns);
            for (int i = 0; i < columns; i++) {
                String cell = i < row.size() ? StringUtils.escape(row.get(i), '|') : StringUtils.EMPTY;
                widths[i] = Math.max(widths[i], cell.length());
                cells.add(cell);
            }
            escaped.add(cells);
        }
        for (List<String> cells : escaped) {
            StringBuilder sb = new StringBuilder(indent).append('|');
            for (int i = 0; i < columns; i++) {
                sb.append(' ').append(StringUtils.padRight(cells.get(i), widths[i])).append(" |");
            }
            line(sb.toString());
        }
    }

    private void line(String text) {
        append(text);
        newLine();
    }

    private void newLine() {
        append("\n");
    }

    private void append(String text) {
        try {
            out.append(text);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

}
