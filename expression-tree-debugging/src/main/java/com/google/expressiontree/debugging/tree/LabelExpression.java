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
 * Places a {@link LabelTarget}. When reached by falling through, the label evaluates to its default
 * value.
 */
public final class LabelExpression extends Expression {
    private final LabelTarget target;
    private final Expression defaultValue;

    LabelExpression(LabelTarget target, Expression defaultValue) {
        super(ExpressionType.LABEL, target.getType());
        this.target = target;
        this.defaultValue = defaultValue;
    }

    public LabelTarget getTarget() {
        return target;
    }

    public Expression getDefaultValue() {
        return defaultValue;
    }

    public LabelExpression update(LabelTarget target, Expression defaultValue) {
        if (target == this.target && defaultValue == this.defaultValue) {
            return this;
        }
        return new LabelExpression(target, defaultValue);
    }

    @Override
    public Expression accept(ExpressionVisitor visitor) {
        return visitor.visitLabel(this);
    }

    @Override
    public String toString() {
        return defaultValue == null ? target + ":" : target + ": " + defaultValue;
    }
}
