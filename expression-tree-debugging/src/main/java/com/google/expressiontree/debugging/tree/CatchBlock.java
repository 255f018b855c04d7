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
 * A handler of a {@link TryExpression}. The variable and the filter are optional.
 */
public final class CatchBlock {
    private final Class<? extends Throwable> test;
    private final ParameterExpression variable;
    private final Expression filter;
    private final Expression body;

    CatchBlock(Class<? extends Throwable> test, ParameterExpression variable, Expression filter, Expression body) {
        this.test = test;
        this.variable = variable;
        this.filter = filter;
        this.body = body;
    }

    public Class<? extends Throwable> getTest() {
        return test;
    }

    public ParameterExpression getVariable() {
        return variable;
    }

    public Expression getFilter() {
        return filter;
    }

    public Expression getBody() {
        return body;
    }

    public CatchBlock update(ParameterExpression variable, Expression filter, Expression body) {
        if (variable == this.variable && filter == this.filter && body == this.body) {
            return this;
        }
        return new CatchBlock(test, variable, filter, body);
    }

    @Override
    public String toString() {
        String declaration = test.getSimpleName() + (variable == null ? "" : " " + variable);
        String when = filter == null ? "" : " when " + filter;
        return "catch (" + declaration + ")" + when + " " + body;
    }
}
