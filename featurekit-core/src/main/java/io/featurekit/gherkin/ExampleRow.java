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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ExampleRow {

    private final List<String> data;
    private final int line;

    public ExampleRow(List<String> data, int line) {
        this.data = List.copyOf(data);
        this.line = line;
    }

    public List<String> getData() {
        return data;
    }

    public int getLine() {
        return line;
    }

    /**
     * Values keyed by header column, the first column wins when the header
     * repeats a name.
     */
    public Map<String, String> toMap(List<String> header) {
        Map<String, String> map = new LinkedHashMap<>();
        int count = Math.min(header.size(), data.size());
        for (int i = 0; i < count; i++) {
            map.putIfAbsent(header.get(i), data.get(i));
        }
        return map;
    }

    @Override
    public String toString() {
        return data.toString();
    }

}
