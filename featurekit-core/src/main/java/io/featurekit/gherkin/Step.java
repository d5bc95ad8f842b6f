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

import java.util.function.UnaryOperator;

public class Step {

    private final int id;
    private final String keyword;
    private final String text;
    private final String path;
    private final int line;
    private final DataTable table;
    private final DocString docString;

    public Step(int id, String keyword, String text, String path, int line) {
        this(id, keyword, text, path, line, null, null);
    }

    public Step(int id, String keyword, String text, String path, int line, DataTable table, DocString docString) {
        this.id = id;
        this.keyword = keyword;
        this.text = text == null ? "" : text;
        this.path = path;
        this.line = line;
        this.table = table;
        this.docString = docString;
    }

    /**
     * Copy with every piece of text (step text, table cells, doc string lines)
     * passed through the given function. Used to build the steps of generated
     * scenarios, the source step is left untouched.
     */
    Step copy(UnaryOperator<String> fn) {
        DataTable tableCopy = table == null ? null : table.map(fn);
        DocString docStringCopy = docString == null ? null : docString.map(fn);
        return new Step(id, keyword, fn.apply(text), path, line, tableCopy, docStringCopy);
    }

    public int getId() {
        return id;
    }

    public String getKeyword() {
        return keyword;
    }

    public String getText() {
        return text;
    }

    public String getSentence() {
        return text.isEmpty() ? keyword : keyword + " " + text;
    }

    public String getPath() {
        return path;
    }

    public int getLine() {
        return line;
    }

    public DataTable getTable() {
        return table;
    }

    public boolean hasTable() {
        return table != null;
    }

    public DocString getDocString() {
        return docString;
    }

    public boolean hasDocString() {
        return docString != null;
    }

    public String getDebugInfo() {
        return path + ":" + line;
    }

    @Override
    public String toString() {
        return getSentence();
    }

}
