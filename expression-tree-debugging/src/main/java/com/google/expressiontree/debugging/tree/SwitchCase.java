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
 * One case of a {@link SwitchExpression}: the values that select it and the body it runs.
 */
public final class SwitchCase {
    private final List<Expression> testValues;
    private final Expression body;

    SwitchCase(List<Expression> testValues, Expression body) {
        this.testValues = List.copyOf(testValues);
        this.body = body;
    }

    public List<Expression> getTestValues() {
        return testValues;
    }

    public Expression getBody() {
        return body;
    }

    public SwitchCase update(List<Expression> testValues, Expression body) {
        if (Expression.sameElements(testValues, this.testValues) && body == this.body) {
            return this;
        }
        return new SwitchCase(testValues, body);
    }

    @Override
    public String toString() {
        return "case " + Expression.join(testValues) + ": " + body;
    }
}
