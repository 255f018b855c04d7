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
 * Repeats its body until a jump to the break label leaves the loop.
 */
public final class LoopExpression extends Expression {
    private final Expression body;
    private final LabelTarget breakLabel;
    private final LabelTarget continueLabel;

    LoopExpression(Expression body, LabelTarget breakLabel, LabelTarget continueLabel) {
        super(ExpressionType.LOOP, breakLabel == null ? void.class : breakLabel.getType());
        this.body = body;
        this.breakLabel = breakLabel;
        this.continueLabel = continueLabel;
    }

    public Expression getBody() {
        return body;
    }

    public LabelTarget getBreakLabel() {
        return breakLabel;
    }

    public LabelTarget getContinueLabel() {
        return continueLabel;
    }

    public LoopExpression update(LabelTarget breakLabel, LabelTarget continueLabel, Expression body) {
        if (breakLabel == this.breakLabel && continueLabel == this.continueLabel && body == this.body) {
            return this;
        }
        return new LoopExpression(body, breakLabel, continueLabel);
    }

    @Override
    public Expression accept(ExpressionVisitor visitor) {
        return visitor.visitLoop(this);
    }

    @Override
    public String toString() {
        return "loop " + body;
    }
}
