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
package io.featurekit.common;

import java.nio.file.Path;

/**
 * Source of a feature document, either a file on disk or in-memory text.
 */
public interface Resource {

    String INLINE = "(inline)";

    boolean exists();

    /**
     * @return the path as given by the caller, used on every parsed entity
     * and in error messages
     */
    String getRelativePath();

    String getText();

    default boolean isFile() {
        return false;
    }

    static Resource path(String path) {
        if (path == null) {
            path = "";
        }
        return new PathResource(Path.of(path), path);
    }

    static Resource path(Path path) {
        return new PathResource(path, path.toString());
    }

    static Resource text(String text) {
        return new MemoryResource(text);
    }

    static Resource text(String relativePath, String text) {
        return new MemoryResource(relativePath, text);
    }

}
