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

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

public class DocString {

    public static final String DELIMITER = "\"\"\"";

    private final List<String> lines;
    private final int line;

    public DocString(List<String> lines) {
        this(lines, 0);
    }

    /**
     * @param lines content between the delimiters
     * @param line  line of the opening delimiter
     */
    public DocString(List<String> lines, int line) {
        this.lines = List.copyOf(lines);
        this.line = line;
    }

    public List<String> getLines() {
        return lines;
    }

    public int getLine() {
        return line;
    }

    public String getText() {
        return String.join("\n", lines);
    }

    DocString map(UnaryOperator<String> fn) {
        List<String> temp = new ArrayList<>(lines.size());
        for (String s : lines) {
            temp.add(fn.apply(s));
        }
        return new DocString(temp, line);
    }

    @Override
    public String toString() {
        return getText();
    }

}
