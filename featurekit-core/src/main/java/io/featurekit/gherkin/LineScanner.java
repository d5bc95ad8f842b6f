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

/**
 * Splits document text into numbered lines and drops comment lines. Lines
 * inside a doc string are always kept, whatever they start with.
 */
public class LineScanner {

    public static final char COMMENT = '#';

    private static final char BOM = '\uFEFF';

    private LineScanner() {
        // only static methods
    }

    public static List<ScannedLine> scan(String text) {
        List<ScannedLine> lines = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return lines;
        }
        if (text.charAt(0) == BOM) {
            text = text.substring(1);
        }
        String[] raw = text.split("\\r?\\n", -1);
        int count = raw.length;
        if (text.endsWith("\n")) {
            count--; // no line after the last terminator
        }
        boolean docString = false;
        for (int i = 0; i < count; i++) {
            String stripped = raw[i].strip();
            if (stripped.startsWith(DocString.DELIMITER)) {
                docString = !docString;
            } else if (!docString && !stripped.isEmpty() && stripped.charAt(0) == COMMENT) {
                continue;
            }
            lines.add(new ScannedLine(i + 1, raw[i], stripped));
        }
        return lines;
    }

}
