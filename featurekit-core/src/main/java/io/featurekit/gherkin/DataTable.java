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
import java.util.Collections;
import java.util.List;
import java.util.function.UnaryOperator;

public class DataTable {

    private final List<List<String>> rows;
    private final List<Integer> lineNumbers;

    public DataTable(List<List<String>> rows) {
        this(rows, Collections.nCopies(rows.size(), 0));
    }

    public DataTable(List<List<String>> rows, List<Integer> lineNumbers) {
        if (rows.size() != lineNumbers.size()) {
            throw new IllegalArgumentException("rows and line numbers differ in size");
        }
        List<List<String>> temp = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            temp.add(List.copyOf(row));
        }
        this.rows = Collections.unmodifiableList(temp);
        this.lineNumbers = List.copyOf(lineNumbers);
    }

    public List<List<String>> getRows() {
        return rows;
    }

    public List<String> getRow(int index) {
        return rows.get(index);
    }

    public int getLineNumber(int index) {
        return lineNumbers.get(index);
    }

    public List<Integer> getLineNumbers() {
        return lineNumbers;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int getColumnCount() {
        int count = 0;
        for (List<String> row : rows) {
            count = Math.max(count, row.size());
        }
        return count;
    }

    DataTable map(UnaryOperator<String> fn) {
        List<List<String>> temp = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            List<String> cells = new ArrayList<>(row.size());
            for (String cell : row) {
                cells.add(fn.apply(cell));
            }
            temp.add(cells);
        }
        return new DataTable(temp, lineNumbers);
    }

    @Override
    public String toString() {
        return rows.toString();
    }

}
