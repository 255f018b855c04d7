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
 * An unconditional jump to a {@link LabelTarget}, optionally carrying a value.
 */
public final class GotoExpression extends Expression {
    private final GotoKind kind;
    private final LabelTarget target;
    private final Expression value;

    GotoExpression(Class<?> type, GotoKind kind, LabelTarget target, Expression value) {
        super(ExpressionType.GOTO, type);
        this.kind = kind;
        this.target = target;
        this.value = value;
    }

    public GotoKind getKind() {
        return kind;
    }

    public LabelTarget getTarget() {
        return target;
    }

    public Expression getValue() {
        return value;
    }

    public GotoExpression update(LabelTarget target, Expression value) {
        if (target == this.target && value == this.value) {
            return this;
        }
        return new GotoExpression(getType(), kind, target, value);
    }

    @Override
    public Expression accept(ExpressionVisitor visitor) {
        return visitor.visitGoto(this);
    }

    @Override
    public String toString() {
        String keyword = kind.name().toLowerCase();
        if (kind == GotoKind.RETURN) {
            return value == null ? keyword : keyword + " " + value;
        }
        return value == null ? keyword + " " + target : keyword + " " + target + " " + value;
    }
}
