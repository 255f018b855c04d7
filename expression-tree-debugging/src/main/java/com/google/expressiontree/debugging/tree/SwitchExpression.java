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
 * Selects one of several cases by comparing a value with each case's test values.
 */
public final class SwitchExpression extends Expression {
    private final Expression switchValue;
    private final List<SwitchCase> cases;
    private final Expression defaultBody;

    SwitchExpression(Class<?> type, Expression switchValue, List<SwitchCase> cases, Expression defaultBody) {
        super(ExpressionType.SWITCH, type);
        this.switchValue = switchValue;
        this.cases = List.copyOf(cases);
        this.defaultBody = defaultBody;
    }

    public Expression getSwitchValue() {
        return switchValue;
    }

    public List<SwitchCase> getCases() {
        return cases;
    }

    /**
     * The body run when no case matches, or {@code null}.
     */
    public Expression getDefaultBody() {
        return defaultBody;
    }

    public SwitchExpression update(Expression switchValue, List<SwitchCase> cases, Expression defaultBody) {
        if (switchValue == this.switchValue && sameElements(cases, this.cases) && defaultBody == this.defaultBody) {
            return this;
        }
        return new SwitchExpression(getType(), switchValue, cases, defaultBody);
    }

    @Override
    public Expression accept(ExpressionVisitor visitor) {
        return visitor.visitSwitch(this);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("switch (").append(switchValue).append(") { ");
        builder.append(join(cases, "; "));
        if (defaultBody != null) {
            builder.append(cases.isEmpty() ? "" : "; ").append("default: ").append(defaultBody);
        }
        return builder.append(" }").toString();
    }
}
