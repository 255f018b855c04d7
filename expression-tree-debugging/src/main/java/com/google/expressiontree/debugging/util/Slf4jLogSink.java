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

package com.google.expressiontree.debugging.util;

import com.google.expressiontree.debugging.LogSink;
import org.slf4j.Logger;
import org.slf4j.event.Level;

/**
 * Writes records to an SLF4J {@link Logger}. Records below the logger's threshold are dropped
 * before any formatting happens.
 */
public class Slf4jLogSink implements LogSink {

    private final Logger logger;

    public Slf4jLogSink(Logger logger) {
        if (logger == null) {
            throw new NullPointerException("logger");
        }
        this.logger = logger;
    }

    public Logger getLogger() {
        return logger;
    }

    @Override
    public void log(Level level, String template, Object... arguments) {
        if (!logger.isEnabledForLevel(level)) {
            return;
        }
        logger.atLevel(level).log(template, arguments);
    }
}
