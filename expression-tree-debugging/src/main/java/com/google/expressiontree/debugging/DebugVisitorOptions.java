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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;

/**
 * Settings of a {@link com.google.expressiontree.debugging.visitors.DebugExpressionVisitor}.
 *
 * <p>The per-kind flags ({@code logConstants}, {@code logMembers}, ...) and the broad category
 * flags ({@code logExpressionStructure}, {@code logExpressionValues}, {@code logExpressionTypes})
 * overlap: a node kind is logged when any flag that covers it is set. By default the level is
 * {@link LogLevel#BASIC} and every flag is set.
 *
 * <p>Options bind from JSON with the same property names, for example
 * {@code {"logLevel": "DETAILED", "logConstants": false}}. Missing properties keep their defaults
 * and unknown ones are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DebugVisitorOptions {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private LogLevel logLevel = LogLevel.BASIC;
    private boolean logMethodCalls = true;
    private boolean logBinaryExpressions = true;
    private boolean logConstants = true;
    private boolean logLambdas = true;
    private boolean logParameters = true;
    private boolean logUnaryExpressions = true;
    private boolean logMembers = true;
    private boolean logExpressionStructure = true;
    private boolean logExpressionValues = true;
    private boolean logExpressionTypes = true;

    public static DebugVisitorOptions fromJson(String json) throws IOException {
        return objectMapper.readValue(json, DebugVisitorOptions.class);
    }

    public static DebugVisitorOptions readFrom(InputStream in) throws IOException {
        return objectMapper.readValue(in, DebugVisitorOptions.class);
    }

    public LogLevel getLogLevel() {
        return logLevel;
    }

    public void setLogLevel(LogLevel logLevel) {
        if (logLevel == null) {
            throw new IllegalArgumentException("logLevel must not be null");
        }
        this.logLevel = logLevel;
    }

    public boolean isLogMethodCalls() {
        return logMethodCalls;
    }

    public void setLogMethodCalls(boolean logMethodCalls) {
        this.logMethodCalls = logMethodCalls;
    }

    public boolean isLogBinaryExpressions() {
        return logBinaryExpressions;
    }

    public void setLogBinaryExpressions(boolean logBinaryExpressions) {
        this.logBinaryExpressions = logBinaryExpressions;
    }

    public boolean isLogConstants() {
        return logConstants;
    }

    public void setLogConstants(boolean logConstants) {
        this.logConstants = logConstants;
    }

    public boolean isLogLambdas() {
        return logLambdas;
    }

    public void setLogLambdas(boolean logLambdas) {
        this.logLambdas = logLambdas;
    }

    public boolean isLogParameters() {
        return logParameters;
    }

    public void setLogParameters(boolean logParameters) {
        this.logParameters = logParameters;
    }

    public boolean isLogUnaryExpressions() {
        return logUnaryExpressions;
    }

    public void setLogUnaryExpressions(boolean logUnaryExpressions) {
        this.logUnaryExpressions = logUnaryExpressions;
    }

    public boolean isLogMembers() {
        return logMembers;
    }

    public void setLogMembers(boolean logMembers) {
        this.logMembers = logMembers;
    }

    /**
     * Covers the structural kinds (blocks, loops, jumps, object creation, indexing, type tests, ...).
     */
    public boolean isLogExpressionStructure() {
        return logExpressionStructure;
    }

    public void setLogExpressionStructure(boolean logExpressionStructure) {
        this.logExpressionStructure = logExpressionStructure;
    }

    /**
     * Covers the kinds that produce a value directly: constants, members, indexing, invocations and
     * object or array creation.
     */
    public boolean isLogExpressionValues() {
        return logExpressionValues;
    }

    public void setLogExpressionValues(boolean logExpressionValues) {
        this.logExpressionValues = logExpressionValues;
    }

    /**
     * Covers the value kinds and also type tests.
     */
    public boolean isLogExpressionTypes() {
        return logExpressionTypes;
    }

    public void setLogExpressionTypes(boolean logExpressionTypes) {
        this.logExpressionTypes = logExpressionTypes;
    }

    /**
     * Clears every per-kind and category flag, leaving the level unchanged.
     */
    public DebugVisitorOptions disableAll() {
        logMethodCalls = false;
        logBinaryExpressions = false;
        logConstants = false;
        logLambdas = false;
        logParameters = false;
        logUnaryExpressions = false;
        logMembers = false;
        logExpressionStructure = false;
        logExpressionValues = false;
        logExpressionTypes = false;
        return this;
    }
}
