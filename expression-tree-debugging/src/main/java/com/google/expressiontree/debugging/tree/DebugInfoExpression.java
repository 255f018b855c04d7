/*
 * Copyright (C) 2024 Google LLC
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not
 * use this file except in compliance with the License. You may obtain a copy of
 * the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations under
 * the License.
 */

package com.google.expressiontree.debugging.tree;

/**
 * Marks a span of source text. A marker whose start line is {@link #CLEAR_LINE} clears the span
 * set by an earlier marker.
 */
public final class DebugInfoExpression extends Expression {
    public static final int CLEAR_LINE = 0xfeefee;

    private final String fileName;
    private final int startLine;
    private final int startColumn;
    private final int endLine;
    private final int endColumn;

    DebugInfoExpression(String fileName, int startLine, int startColumn, int endLine, int endColumn) {
        super(ExpressionType.DEBUG_INFO, void.class);
        this.fileName = fileName;
        this.startLine = startLine;
        this.startColumn = startColumn;
        this.endLine = endLine;
        this.endColumn = endColumn;
    }

    public String getFileName() {
        return fileName;
    }

    public int getStartLine() {
        return startLine;
    }

    public int getStartColumn() {
        return startColumn;
    }

    public int getEndLine() {
        return endLine;
    }

    public int getEndColumn() {
        return endColumn;
    }

    public boolean isClear() {
        return startLine == CLEAR_LINE;
    }

    @Override
    public Expression accept(ExpressionVisitor visitor) {
        return visitor.visitDebugInfo(this);
    }

    @Override
    public String toString() {
        if (isClear()) {
            return "#clear " + fileName;
        }
        return "#" + fileName + "(" + startLine + "," + startColumn + ")-(" + endLine + "," + endColumn + ")";
    }
}
