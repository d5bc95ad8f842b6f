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

import io.featurekit.common.FileUtils;
import io.featurekit.common.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Localized keywords for one natural language. Tables are read from
 * <code>io/featurekit/gherkin/languages/&lt;code&gt;.json</code> on the
 * class-path, so a language is added by dropping in a file. Instances are
 * immutable and shared.
 */
public final class KeywordTable {

    static final Logger logger = LoggerFactory.getLogger(KeywordTable.class);

    public static final String RESOURCE_ROOT = "io/featurekit/gherkin/languages/";
    public static final String ANY_STEP = "*";

    private static final Pattern LANGUAGE_CODE = Pattern.compile("[a-zA-Z]{2,3}([-_][a-zA-Z0-9]{2,8})?");
    private static final Map<String, KeywordTable> CACHE = new ConcurrentHashMap<>();

    private final String language;
    private final String feature;
    private final String background;
    private final String scenario;
    private final String scenarioOutline;
    private final String scenarioLoop;
    private final String examples;
    private final String rule;
    private final List<String> given;
    private final List<String> when;
    private final List<String> then;
    private final List<String> and;
    private final List<String> but;
    private final List<String> stepKeywords;
    private final Pattern loopPattern;

    public static KeywordTable load(String language) {
        if (language == null || !LANGUAGE_CODE.matcher(language).matches()) {
            throw new UnsupportedLanguageException(language);
        }
        return CACHE.computeIfAbsent(language, KeywordTable::read);
    }

    private static KeywordTable read(String language) {
        String resource = RESOURCE_ROOT + language + ".json";
        ClassLoader cl = KeywordTable.class.getClassLoader();
        try (InputStream is = cl.getResourceAsStream(resource)) {
            if (is == null) {
                throw new UnsupportedLanguageException(language);
            }
            Map<String, Object> map = Json.parseObject(FileUtils.toString(is));
            logger.debug("loaded keyword table: {}", resource);
            return new KeywordTable(language, map);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read keyword table: " + resource, e);
        }
    }

    KeywordTable(String language, Map<String, Object> map) {
        this.language = language;
        feature = string(map, "feature");
        background = string(map, "background");
        scenario = string(map, "scenario");
        scenarioOutline = string(map, "scenario_outline");
        scenarioLoop = string(map, "scenario_loop");
        examples = string(map, "examples");
        rule = string(map, "rule");
        given = strings(map, "given");
        when = strings(map, "when");
        then = strings(map, "then");
        and = strings(map, "and");
        but = strings(map, "but");
        List<String> temp = new ArrayList<>();
        temp.addAll(given);
        temp.addAll(when);
        temp.addAll(then);
        temp.addAll(and);
        temp.addAll(but);
        temp.add(ANY_STEP);
        // longest first, so that "Gegeben sei" wins over "Gegeben"
        temp.sort(Comparator.comparingInt(String::length).reversed());
        stepKeywords = List.copyOf(temp);
        loopPattern = Pattern.compile("^" + Pattern.quote(scenarioLoop) + "\\s+(\\d+)\\s*:(.*)$");
    }

    private String string(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof String s && !s.isBlank()) {
            return s;
        }
        throw new IllegalStateException("keyword table '" + language + "' has no value for: " + key);
    }

    private List<String> strings(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof String s) {
            return List.of(s);
        }
        if (value instanceof List<?> list && !list.isEmpty()) {
            List<String> result = new ArrayList<>(list.size());
            for (Object o : list) {
                result.add(o.toString());
            }
            return List.copyOf(result);
        }
        throw new IllegalStateException("keyword table '" + language + "' has no value for: " + key);
    }

    /**
     * @return the text after <code>keyword:</code>, trimmed, or null if the
     * line does not start with the keyword immediately followed by a colon
     */
    public static String matchHeader(String keyword, String line) {
        if (line.length() <= keyword.length() || !line.startsWith(keyword) || line.charAt(keyword.length()) != ':') {
            return null;
        }
        return line.substring(keyword.length() + 1).trim();
    }

    /**
     * @return the step keyword the line starts with, or null
     */
    public String matchStepKeyword(String line) {
        for (String keyword : stepKeywords) {
            if (!line.startsWith(keyword)) {
                continue;
            }
            if (line.length() == keyword.length() || Character.isWhitespace(line.charAt(keyword.length()))) {
                return keyword;
            }
        }
        return null;
    }

    /**
     * Matches <code>Scenario Loop &lt;digits&gt;: sentence</code>. Returns null
     * for any other line, including a missing, zero or non-integer count.
     */
    public ScenarioLoopHeader detectScenarioLoop(String line) {
        if (line == null) {
            return null;
        }
        Matcher matcher = loopPattern.matcher(line.trim());
        if (!matcher.matches()) {
            return null;
        }
        int iterations;
        try {
            iterations = Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            logger.debug("scenario loop count out of range: {}", matcher.group(1));
            return null;
        }
        if (iterations < 1) {
            return null;
        }
        return new ScenarioLoopHeader(matcher.group(2).trim(), iterations);
    }

    public String getLanguage() {
        return language;
    }

    public String getFeature() {
        return feature;
    }

    public String getBackground() {
        return background;
    }

    public String getScenario() {
        return scenario;
    }

    public String getScenarioOutline() {
        return scenarioOutline;
    }

    public String getScenarioLoop() {
        return scenarioLoop;
    }

    public String getExamples() {
        return examples;
    }

    public String getRule() {
        return rule;
    }

    public List<String> getGiven() {
        return given;
    }

    public List<String> getWhen() {
        return when;
    }

    public List<String> getThen() {
        return then;
    }

    public List<String> getAnd() {
        return and;
    }

    public List<String> getBut() {
        return but;
    }

    /**
     * @return all step keywords, longest first
     */
    public List<String> getStepKeywords() {
        return stepKeywords;
    }

    @Override
    public String toString() {
        return "keywords[" + language + "]";
    }

}
