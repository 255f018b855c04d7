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
 * Gives read and write access to a set of variables at run time.
 */
public final class RuntimeVariablesExpression extends Expression {
    private final List<ParameterExpression> variables;

    RuntimeVariablesExpression(List<ParameterExpression> variables) {
        super(ExpressionType.RUNTIME_VARIABLES, Object[].class);
        this.variables = List.copyOf(variables);
    }

    public List<ParameterExpression> getVariables() {
        return variables;
    }

    public RuntimeVariablesExpression update(List<ParameterExpression> variables) {
        if (sameElements(variables, this.variables)) {
            return this;
        }
        return new RuntimeVariablesExpression(variables);
    }

    @Override
    public Expression accept(ExpressionVisitor visitor) {
        return visitor.visitRuntimeVariables(this);
    }

    @Override
    public String toString() {
        return "runtimeVariables(" + join(variables) + ")";
    }
}
