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
 * Base class for node kinds defined outside this package. Subclasses that have children override
 * {@link #visitChildren(ExpressionVisitor)} so that visitors can reach them.
 */
public abstract class ExtensionExpression extends Expression {

    protected ExtensionExpression(Class<?> type) {
        super(ExpressionType.EXTENSION, type);
    }

    /**
     * A short name for the node, used in diagnostics.
     */
    public String getName() {
        return getClass().getSimpleName();
    }

    /**
     * Visits the children of this node and returns the node rebuilt from the results, or
     * {@code this} if nothing changed. The default has no children.
     */
    protected Expression visitChildren(ExpressionVisitor visitor) {
        return this;
    }

    @Override
    public final Expression accept(ExpressionVisitor visitor) {
        return visitor.visitExtension(this);
    }

    @Override
    public String toString() {
        return getName();
    }
}
