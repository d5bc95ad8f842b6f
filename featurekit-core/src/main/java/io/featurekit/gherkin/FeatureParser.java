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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Parses one feature document into a {@link Feature}, expanding every
 * Scenario Outline and Scenario Loop into its generated scenarios.
 * <p>
 * Example usage:
 * <pre>
 * Feature feature = FeatureParser.path("features/login.feature")
 *     .language("de")
 *     .featureId(3)
 *     .parse();
 * </pre>
 * An instance parses a single document and is not meant to be shared between
 * threads, one parser per document can safely run concurrently with others.
 */
public class FeatureParser {

    static final Logger logger = LoggerFactory.getLogger(FeatureParser.class);

    public static final String DEFAULT_LANGUAGE = "en";

    private final Resource resource;
    private final KeywordTable keywords;
    private final int featureId;
    private final int tagId;
    private final int scenarioId;

    private Feature feature;

    public FeatureParser(String path, int featureId, int tagId) {
        this(path, featureId, tagId, DEFAULT_LANGUAGE);
    }

    public FeatureParser(String path, int featureId, int tagId, String language) {
        this(Resource.path(path), featureId, tagId, language);
    }

    public FeatureParser(Resource resource, int featureId, int tagId, String language) {
        this(resource, featureId, tagId, 1, language);
    }

    /**
     * @param resource   the document to parse
     * @param featureId  id given to the feature
     * @param tagId      id of the first tag, following tags count up from it
     * @param scenarioId id of the first scenario, following scenarios and
     *                   generated scenarios count up from it
     * @param language   code of the keyword table to use
     * @throws UnsupportedLanguageException if there is no keyword table for the language
     * @throws FeatureNotFoundException     if the resource does not exist
     */
    public FeatureParser(Resource resource, int featureId, int tagId, int scenarioId, String language) {
        this.keywords = KeywordTable.load(language);
        if (!resource.exists()) {
            throw new FeatureNotFoundException(resource.getRelativePath());
        }
        this.resource = resource;
        this.featureId = featureId;
        this.tagId = tagId;
        this.scenarioId = scenarioId;
    }

    public static Builder path(String path) {
        return new Builder(Resource.path(path));
    }

    public static Builder path(Path path) {
        return new Builder(Resource.path(path));
    }

    public static Builder text(String text) {
        return new Builder(Resource.text(text));
    }

    public static Builder resource(Resource resource) {
        return new Builder(resource);
    }

    /**
     * @throws EmptyDocumentException        if there is no Feature line
     * @throws MultipleFeatureException      if there is more than one Feature line
     * @throws UnsupportedExamplesException  if Examples follow anything but an outline
     * @throws MalformedStructureException   for any other structural problem
     * @throws FeatureNotFoundException      if the resource cannot be read
     */
    public Feature parse() {
        String path = resource.getRelativePath();
        String text;
        try {
            text = resource.getText();
        } catch (UncheckedIOException e) {
            throw new FeatureNotFoundException(path, e);
        }
        List<ScannedLine> lines = LineScanner.scan(text);
        ParseSession session = new ParseSession(keywords, path, featureId, tagId, scenarioId);
        feature = session.run(lines);
        if (logger.isDebugEnabled()) {
            logger.debug("parsed {}: {} rule(s), {} scenario(s), {} generated", path, feature.getRules().size(),
                    feature.getScenarios().size(), feature.getAllScenarios().size());
        }
        return feature;
    }

    /**
     * @return the result of the last {@link #parse()}, null before
     */
    public Feature getFeature() {
        return feature;
    }

    public KeywordTable getKeywords() {
        return keywords;
    }

    public Resource getResource() {
        return resource;
    }

    public ScenarioLoopHeader detectScenarioLoop(String line) {
        return keywords.detectScenarioLoop(line);
    }

    // ========== Builder ==========

    public static class Builder {

        private final Resource resource;
        private String language = DEFAULT_LANGUAGE;
        private int featureId = 1;
        private int tagId = 1;
        private int scenarioId = 1;

        Builder(Resource resource) {
            this.resource = resource;
        }

        public Builder language(String language) {
            this.language = language;
            return this;
        }

        public Builder featureId(int featureId) {
            this.featureId = featureId;
            return this;
        }

        public Builder tagId(int tagId) {
            this.tagId = tagId;
            return this;
        }

        public Builder scenarioId(int scenarioId) {
            this.scenarioId = scenarioId;
            return this;
        }

        public FeatureParser build() {
            return new FeatureParser(resource, featureId, tagId, scenarioId, language);
        }

        public Feature parse() {
            return build().parse();
        }

    }

}
