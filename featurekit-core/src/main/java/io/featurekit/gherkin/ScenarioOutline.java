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

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class ScenarioOutline extends Scenario {

    private static final Pattern PLACEHOLDER = Pattern.compile("<([^<>]+)>");

    private final List<String> header;
    private final List<ExampleRow> examples;
    private final List<Scenario> children;

    public ScenarioOutline(int id, String sentence, String path, int line, List<Tag> tags, List<Step> steps,
                           List<String> header, List<ExampleRow> examples, List<Scenario> children) {
        super(id, sentence, path, line, tags, steps);
        this.header = List.copyOf(header);
        this.examples = List.copyOf(examples);
        this.children = List.copyOf(children);
    }

    /**
     * Replaces every <code>&lt;name&gt;</code> token whose name is a key of the
     * map, in a single pass. Tokens without a matching key are kept as-is and
     * substituted values are never scanned again.
     */
    public static String substitute(String text, Map<String, String> values) {
        if (text == null || text.indexOf('<') == -1) {
            return text;
        }
        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String value = values.get(matcher.group(1));
            String replacement = value == null ? matcher.group() : value;
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    @Override
    public ScenarioKind getKind() {
        return ScenarioKind.OUTLINE;
    }

    @Override
    public List<Scenario> getChildren() {
        return children;
    }

    public List<String> getExamplesHeader() {
        return header;
    }

    public List<ExampleRow> getExamples() {
        return examples;
    }

}
