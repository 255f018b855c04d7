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
 * One element added to a collection by a {@link ListInitExpression}: the name of the add method
 * and its arguments.
 */
public final class ElementInit {
    private final String addMethod;
    private final List<Expression> arguments;

    ElementInit(String addMethod, List<Expression> arguments) {
        this.addMethod = addMethod;
        this.arguments = List.copyOf(arguments);
    }

    public String getAddMethod() {
        return addMethod;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    public ElementInit update(List<Expression> arguments) {
        if (Expression.sameElements(arguments, this.arguments)) {
            return this;
        }
        return new ElementInit(addMethod, arguments);
    }

    @Override
    public String toString() {
        if (arguments.size() == 1) {
            return String.valueOf(arguments.get(0));
        }
        return "{" + Expression.join(arguments) + "}";
    }
}
