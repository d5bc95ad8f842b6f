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

public class Background {

    private final String shortDescription;
    private final List<Step> steps;
    private final String path;
    private final int line;

    public Background(String shortDescription, List<Step> steps) {
        this(shortDescription, steps, null, 0);
    }

    public Background(String shortDescription, List<Step> steps, String path, int line) {
        this.shortDescription = shortDescription;
        this.steps = List.copyOf(steps);
        this.path = path;
        this.line = line;
    }

    /**
     * @return the text after the keyword, null when absent
     */
    public String getShortDescription() {
        return shortDescription;
    }

    public List<Step> getSteps() {
        return steps;
    }

    public String getPath() {
        return path;
    }

    public int getLine() {
        return line;
    }

}
