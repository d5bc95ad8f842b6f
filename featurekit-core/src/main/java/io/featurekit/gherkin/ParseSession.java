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

import io.featurekit.common.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * State of a single parse: one forward pass over the scanned lines of one
 * document. Owns the id counters, so sessions never share mutable state and
 * documents can be parsed concurrently.
 */
class ParseSession {

    static final Logger logger = LoggerFactory.getLogger(ParseSession.class);

    private enum State {
        PRE_FEATURE,
        DESCRIPTION,
        FEATURE_BODY,
        BACKGROUND,
        RULE,
        SCENARIO,
        EXAMPLES
    }

    private final KeywordTable keywords;
    private final String path;
    private final int featureId;

    private int nextScenarioId;
    private int nextTagId;

    private State state = State.PRE_FEATURE;
    private final List<Tag> pendingTags = new ArrayList<>();
    private int pendingTagsLine;

    private String featureSentence;
    private int featureLine;
    private List<Tag> featureTags;
    private final List<String> description = new ArrayList<>();
    private Background background;

    private final List<Scenario> defaultScenarios = new ArrayList<>();
    private final List<Rule> rules = new ArrayList<>();
    private RuleDraft rule;
    private SectionDraft section;

    private StepDraft docStringStep;
    private int docStringIndent;
    private int docStringLine;
    private List<String> docStringLines;

    ParseSession(KeywordTable keywords, String path, int featureId, int tagId, int scenarioId) {
        this.keywords = keywords;
        this.path = path;
        this.featureId = featureId;
        this.nextTagId = tagId;
        this.nextScenarioId = scenarioId;
    }

    Feature run(List<ScannedLine> lines) {
        boolean found = lines.stream()
                .anyMatch(line -> KeywordTable.matchHeader(keywords.getFeature(), line.text()) != null);
        if (!found) {
            throw new EmptyDocumentException(path);
        }
        for (ScannedLine line : lines) {
            if (logger.isTraceEnabled()) {
                logger.trace("{}:{} [{}] {}", path, line.number(), state, line.text());
            }
            dispatch(line);
        }
        return finish();
    }

    private void dispatch(ScannedLine line) {
        if (docStringLines != null) {
            docStringLine(line);
            return;
        }
        String text = line.text();
        if (line.isBlank()) {
            if (state == State.DESCRIPTION) {
                state = State.FEATURE_BODY;
            }
            return;
        }
        if (line.isTag()) {
            tags(line);
            return;
        }
        String sentence = KeywordTable.matchHeader(keywords.getFeature(), text);
        if (sentence != null) {
            feature(line, sentence);
            return;
        }
        if (state == State.PRE_FEATURE) {
            throw malformed("unexpected text before " + keywords.getFeature() + ": " + text, line);
        }
        sentence = KeywordTable.matchHeader(keywords.getBackground(), text);
        if (sentence != null) {
            background(line, sentence);
            return;
        }
        sentence = KeywordTable.matchHeader(keywords.getRule(), text);
        if (sentence != null) {
            rule(line, sentence);
            return;
        }
        ScenarioLoopHeader loop = keywords.detectScenarioLoop(text);
        if (loop != null) {
            scenario(line, ScenarioKind.LOOP, loop.sentence(), loop.iterations());
            return;
        }
        sentence = KeywordTable.matchHeader(keywords.getScenarioOutline(), text);
        if (sentence != null) {
            scenario(line, ScenarioKind.OUTLINE, sentence, 0);
            return;
        }
        sentence = KeywordTable.matchHeader(keywords.getScenario(), text);
        if (sentence != null) {
            scenario(line, ScenarioKind.SCENARIO, sentence, 0);
            return;
        }
        if (KeywordTable.matchHeader(keywords.getExamples(), text) != null) {
            examples(line);
            return;
        }
        if (state == State.DESCRIPTION) {
            // step words, pipes and quotes are plain prose here
            description.add(text);
            return;
        }
        String stepKeyword = keywords.matchStepKeyword(text);
        if (stepKeyword != null) {
            step(line, stepKeyword);
            return;
        }
        if (line.isTableRow()) {
            tableRow(line);
            return;
        }
        if (line.isDocStringDelimiter()) {
            docString(line);
            return;
        }
        requireNoPendingTags(line);
        throw malformed("unexpected text: " + text, line);
    }

    private void tags(ScannedLine line) {
        if (state == State.DESCRIPTION) {
            state = State.FEATURE_BODY;
        }
        if (pendingTags.isEmpty()) {
            pendingTagsLine = line.number();
        }
        for (String token : line.text().split("\\s+")) {
            if (token.charAt(0) == LineScanner.COMMENT) {
                break;
            }
            if (token.length() < 2 || token.charAt(0) != '@') {
                throw malformed("invalid tag: " + token, line);
            }
            pendingTags.add(new Tag(token.substring(1), nextTagId++, line.number()));
        }
    }

    private List<Tag> takePendingTags() {
        List<Tag> tags = new ArrayList<>(pendingTags);
        pendingTags.clear();
        return tags;
    }

    private void requireNoPendingTags(ScannedLine line) {
        if (!pendingTags.isEmpty()) {
            throw malformed("tags must be followed by " + keywords.getFeature() + ", "
                    + keywords.getRule() + " or " + keywords.getScenario(), line);
        }
    }

    private void feature(ScannedLine line, String sentence) {
        if (featureSentence != null) {
            throw new MultipleFeatureException(path, line.number());
        }
        featureSentence = sentence;
        featureLine = line.number();
        featureTags = takePendingTags();
        state = State.DESCRIPTION;
    }

    private void background(ScannedLine line, String sentence) {
        requireNoPendingTags(line);
        if (background != null || (section != null && section.background)) {
            throw malformed("only one " + keywords.getBackground() + " is allowed", line);
        }
        if (state != State.DESCRIPTION && state != State.FEATURE_BODY) {
            throw malformed(keywords.getBackground() + " must come before any "
                    + keywords.getRule() + " or " + keywords.getScenario(), line);
        }
        section = new SectionDraft(line.number(), StringUtils.trimToNull(sentence));
        state = State.BACKGROUND;
    }

    private void rule(ScannedLine line, String sentence) {
        closeSection();
        closeRule();
        rule = new RuleDraft(sentence, takePendingTags(), line.number());
        state = State.RULE;
    }

    private void scenario(ScannedLine line, ScenarioKind kind, String sentence, int iterations) {
        closeSection();
        section = new SectionDraft(kind, nextScenarioId++, sentence, line.number(), takePendingTags(), iterations);
        state = State.SCENARIO;
    }

    private void examples(ScannedLine line) {
        requireNoPendingTags(line);
        if (section == null || section.background) {
            throw malformed(keywords.getExamples() + " must belong to a " + keywords.getScenarioOutline(), line);
        }
        if (section.kind != ScenarioKind.OUTLINE) {
            throw new UnsupportedExamplesException(section.kind, path, line.number());
        }
        if (section.headerPending) {
            throw malformed(keywords.getExamples() + " block has no header row", section.examplesLine);
        }
        section.headerPending = true;
        section.examplesLine = line.number();
        state = State.EXAMPLES;
    }

    private void step(ScannedLine line, String keyword) {
        requireNoPendingTags(line);
        if (state == State.EXAMPLES) {
            throw malformed("steps are not allowed after " + keywords.getExamples(), line);
        }
        if (section == null) {
            throw malformed("step outside of any " + keywords.getScenario()
                    + " or " + keywords.getBackground() + ": " + line.text(), line);
        }
        String text = line.text().substring(keyword.length()).trim();
        section.steps.add(new StepDraft(section.steps.size() + 1, keyword, text, line.number()));
    }

    private void tableRow(ScannedLine line) {
        requireNoPendingTags(line);
        List<String> cells = cells(line);
        if (state == State.EXAMPLES) {
            if (section.headerPending) {
                if (section.header == null) {
                    section.header = cells;
                } else if (!section.header.equals(cells)) {
                    throw malformed(keywords.getExamples() + " header differs from the first block: " + cells, line);
                }
                section.headerPending = false;
            } else if (cells.size() != section.header.size()) {
                throw malformed(keywords.getExamples() + " row has " + cells.size()
                        + " cells but the header has " + section.header.size(), line);
            } else {
                section.examples.add(new ExampleRow(cells, line.number()));
            }
            return;
        }
        StepDraft step = section == null ? null : section.lastStep();
        if (step == null) {
            throw malformed("table row without a step", line);
        }
        step.rows.add(cells);
        step.rowLines.add(line.number());
    }

    private List<String> cells(ScannedLine line) {
        String text = line.text();
        int last = text.length() - 1;
        if (last < 1 || text.charAt(last) != '|' || isEscaped(text, last)) {
            throw malformed("table row must end with '|'", line);
        }
        List<String> cells = new ArrayList<>();
        for (String cell : StringUtils.splitEscaped(text.substring(1, text.length() - 1), '|')) {
            cells.add(cell.trim());
        }
        return cells;
    }

    private static boolean isEscaped(String text, int index) {
        int count = 0;
        for (int i = index - 1; i >= 0 && text.charAt(i) == '\\'; i--) {
            count++;
        }
        return count % 2 == 1;
    }

    private void docString(ScannedLine line) {
        requireNoPendingTags(line);
        StepDraft step = section == null || state == State.EXAMPLES ? null : section.lastStep();
        if (step == null) {
            throw malformed("doc string without a step", line);
        }
        if (step.docString != null) {
            throw malformed("step already has a doc string", line);
        }
        docStringStep = step;
        docStringIndent = StringUtils.indentOf(line.raw());
        docStringLine = line.number();
        docStringLines = new ArrayList<>();
    }

    private void docStringLine(ScannedLine line) {
        if (line.isDocStringDelimiter()) {
            docStringStep.docString = new DocString(docStringLines, docStringLine);
            docStringStep = null;
            docStringLines = null;
            return;
        }
        String raw = line.raw();
        int strip = Math.min(docStringIndent, StringUtils.indentOf(raw));
        docStringLines.add(raw.substring(strip));
    }

    private void closeSection() {
        if (section == null) {
            return;
        }
        if (section.background) {
            background = new Background(section.sentence, buildSteps(section.steps), path, section.line);
        } else {
            Scenario scenario = buildScenario(section);
            if (rule == null) {
                defaultScenarios.add(scenario);
            } else {
                rule.scenarios.add(scenario);
            }
        }
        section = null;
    }

    private void closeRule() {
        if (rule != null) {
            rules.add(new Rule(rule.sentence, rule.scenarios, rule.tags, path, rule.line));
            rule = null;
        }
    }

    private List<Step> buildSteps(List<StepDraft> drafts) {
        List<Step> steps = new ArrayList<>(drafts.size());
        for (StepDraft draft : drafts) {
            DataTable table = draft.rows.isEmpty() ? null : new DataTable(draft.rows, draft.rowLines);
            steps.add(new Step(draft.id, draft.keyword, draft.text, path, draft.line, table, draft.docString));
        }
        return steps;
    }

    private Scenario buildScenario(SectionDraft draft) {
        List<Step> steps = buildSteps(draft.steps);
        return switch (draft.kind) {
            case SCENARIO -> new Scenario(draft.id, draft.sentence, path, draft.line, draft.tags, steps);
            case OUTLINE -> buildOutline(draft, steps);
            case LOOP -> new ScenarioLoop(draft.id, draft.sentence, path, draft.line, draft.tags, steps,
                    draft.iterations, expandLoop(draft, steps));
        };
    }

    private ScenarioOutline buildOutline(SectionDraft draft, List<Step> steps) {
        if (draft.headerPending) {
            throw malformed(keywords.getExamples() + " block has no header row", draft.examplesLine);
        }
        List<String> header = draft.header == null ? List.of() : draft.header;
        return new ScenarioOutline(draft.id, draft.sentence, path, draft.line, draft.tags, steps,
                header, draft.examples, expandOutline(draft, steps, header));
    }

    private List<Scenario> expandOutline(SectionDraft draft, List<Step> steps, List<String> header) {
        List<Scenario> children = new ArrayList<>(draft.examples.size());
        for (int i = 0; i < draft.examples.size(); i++) {
            ExampleRow row = draft.examples.get(i);
            Map<String, String> values = row.toMap(header);
            List<Step> copies = copySteps(steps, text -> ScenarioOutline.substitute(text, values));
            String sentence = draft.sentence + " - row " + i;
            children.add(new Scenario(nextScenarioId++, sentence, path, row.getLine(), draft.tags, copies));
        }
        return children;
    }

    private List<Scenario> expandLoop(SectionDraft draft, List<Step> steps) {
        List<Scenario> children = new ArrayList<>(draft.iterations);
        for (int i = 0; i < draft.iterations; i++) {
            List<Step> copies = copySteps(steps, UnaryOperator.identity());
            String sentence = draft.sentence + " - iteration " + i;
            children.add(new Scenario(nextScenarioId++, sentence, path, draft.line, draft.tags, copies));
        }
        return children;
    }

    private static List<Step> copySteps(List<Step> steps, UnaryOperator<String> fn) {
        List<Step> copies = new ArrayList<>(steps.size());
        for (Step step : steps) {
            copies.add(step.copy(fn));
        }
        return copies;
    }

    private Feature finish() {
        if (docStringLines != null) {
            throw malformed("doc string is not closed", docStringLine);
        }
        if (!pendingTags.isEmpty()) {
            throw malformed("tags at the end of the document", pendingTagsLine);
        }
        closeSection();
        closeRule();
        List<Rule> all = new ArrayList<>(rules.size() + 1);
        if (!defaultScenarios.isEmpty()) {
            all.add(Rule.ofDefault(defaultScenarios));
        }
        all.addAll(rules);
        return new Feature(featureId, featureSentence, description, path, featureLine, keywords.getLanguage(),
                featureTags, background, all);
    }

    private MalformedStructureException malformed(String message, ScannedLine line) {
        return malformed(message, line.number());
    }

    private MalformedStructureException malformed(String message, int line) {
        return new MalformedStructureException(message, path, line);
    }

    private static class StepDraft {

        final int id;
        final String keyword;
        final String text;
        final int line;
        final List<List<String>> rows = new ArrayList<>();
        final List<Integer> rowLines = new ArrayList<>();
        DocString docString;

        StepDraft(int id, String keyword, String text, int line) {
            this.id = id;
            this.keyword = keyword;
            this.text = text;
            this.line = line;
        }

    }

    private static class SectionDraft {

        final boolean background;
        final ScenarioKind kind;
        final int id;
        final String sentence;
        final int line;
        final List<Tag> tags;
        final int iterations;
        final List<StepDraft> steps = new ArrayList<>();

        List<String> header;
        final List<ExampleRow> examples = new ArrayList<>();
        boolean headerPending;
        int examplesLine;

        SectionDraft(int line, String sentence) {
            this.background = true;
            this.kind = null;
            this.id = 0;
            this.sentence = sentence;
            this.line = line;
            this.tags = List.of();
            this.iterations = 0;
        }

        SectionDraft(ScenarioKind kind, int id, String sentence, int line, List<Tag> tags, int iterations) {
            this.background = false;
            this.kind = kind;
            this.id = id;
            this.sentence = sentence;
            this.line = line;
            this.tags = tags;
            this.iterations = iterations;
        }

        StepDraft lastStep() {
            return steps.isEmpty() ? null : steps.get(steps.size() - 1);
        }

    }

    private static class RuleDraft {

        final String sentence;
        final List<Tag> tags;
        final int line;
        final List<Scenario> scenarios = new ArrayList<>();

        RuleDraft(String sentence, List<Tag> tags, int line) {
            this.sentence = sentence;
            this.tags = tags;
            this.line = line;
        }

    }

}
