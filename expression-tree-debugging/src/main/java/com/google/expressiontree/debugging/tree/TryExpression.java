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
 * A protected region with catch handlers and either a finally block or a fault block, which runs
 * only when the body exits with an exception.
 */
public final class TryExpression extends Expression {
    private final Expression body;
    private final List<CatchBlock> handlers;
    private final Expression finallyBody;
    private final Expression faultBody;

    TryExpression(Class<?> type, Expression body, List<CatchBlock> handlers, Expression finallyBody,
                  Expression faultBody) {
        super(ExpressionType.TRY, type);
        this.body = body;
        this.handlers = List.copyOf(handlers);
        this.finallyBody = finallyBody;
        this.faultBody = faultBody;
    }

    public Expression getBody() {
        return body;
    }

    public List<CatchBlock> getHandlers() {
        return handlers;
    }

    public Expression getFinally() {
        return finallyBody;
    }

    public Expression getFault() {
        return faultBody;
    }

    public TryExpression update(Expression body, List<CatchBlock> handlers, Expression finallyBody,
                                Expression faultBody) {
        if (body == this.body && sameElements(handlers, this.handlers)
                && finallyBody == this.finallyBody && faultBody == this.faultBody) {
            return this;
        }
        return new TryExpression(getType(), body, handlers, finallyBody, faultBody);
    }

    @Override
    public Expression accept(ExpressionVisitor visitor) {
        return visitor.visitTry(this);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("try ").append(body);
        for (CatchBlock handler : handlers) {
            builder.append(' ').append(handler);
        }
        if (finallyBody != null) {
            builder.append(" finally ").append(finallyBody);
        }
        if (faultBody != null) {
            builder.append(" fault ").append(faultBody);
        }
        return builder.toString();
    }
}
