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

package com.google.expressiontree.debugging;

import org.slf4j.event.Level;

/**
 * Destination of the records written while debugging an expression tree. Templates use SLF4J
 * {@code {}} placeholders, filled from {@code arguments} in order.
 *
 * @see com.google.expressiontree.debugging.util.Slf4jLogSink
 */
@FunctionalInterface
public interface LogSink {
    void log(Level level, String template, Object... arguments);
}
