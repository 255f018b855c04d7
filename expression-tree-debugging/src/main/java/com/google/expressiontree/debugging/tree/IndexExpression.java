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

import java.util.List;

/**
 * Indexes into an array, or into an object through a named indexer such as {@code List.get}.
 */
public final class IndexExpression extends Expression {
    private final Expression object;
    private final String indexer;
    private final List<Expression> arguments;

    IndexExpression(Class<?> type, Expression object, String indexer, List<Expression> arguments) {
        super(ExpressionType.INDEX, type);
        this.object = object;
        this.indexer = indexer;
        this.arguments = List.copyOf(arguments);
    }

    public Expression getObject() {
        return object;
    }

    /**
     * The name of the accessor used for the lookup, or {@code null} for array access.
     */
    public String getIndexer() {
        return indexer;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    public IndexExpression update(Expression object, List<Expression> arguments) {
        if (object == this.object && sameElements(arguments, this.arguments)) {
            return this;
        }
        return new IndexExpression(getType(), object, indexer, arguments);
    }

    @Override
    public Expression accept(ExpressionVisitor visitor) {
        return visitor.visitIndex(this);
    }

    @Override
    public String toString() {
        return object + "[" + join(arguments) + "]";
    }
}
