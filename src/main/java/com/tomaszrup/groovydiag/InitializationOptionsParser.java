////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.groovydiag;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.groovydiag.worker.DiagnosticWorkerOptions;

/**
 * Parses the {@code initializationOptions} JSON object sent by the client
 * during the LSP {@code initialize} request.
 *
 * <p>Recognized options: {@code protocolVersion}, {@code logLevel},
 * {@code diagnosticWorkersThreadCount}, {@code documentAnalysisTimeoutMs} and
 * {@code enableAnalyzers}. Out-of-range numbers are ignored with a warning.</p>
 */
class InitializationOptionsParser {

    private static final Logger logger = LoggerFactory.getLogger(InitializationOptionsParser.class);

    static final String PROTOCOL_VERSION_OPTION = "protocolVersion";
    static final String LOG_LEVEL_OPTION = "logLevel";
    static final String WORKER_THREAD_COUNT_OPTION = "diagnosticWorkersThreadCount";
    static final String ANALYSIS_TIMEOUT_OPTION = "documentAnalysisTimeoutMs";
    static final String ENABLE_ANALYZERS_OPTION = "enableAnalyzers";

    /** Immutable container for parsed initialization options. */
    static final class ParsedOptions {
        final int workerThreadCount;
        final long documentAnalysisTimeoutMs;
        final boolean analyzersEnabled;

        ParsedOptions(int workerThreadCount, long documentAnalysisTimeoutMs, boolean analyzersEnabled) {
            this.workerThreadCount = workerThreadCount;
            this.documentAnalysisTimeoutMs = documentAnalysisTimeoutMs;
            this.analyzersEnabled = analyzersEnabled;
        }

        DiagnosticWorkerOptions toWorkerOptions() {
            return new DiagnosticWorkerOptions(workerThreadCount, documentAnalysisTimeoutMs);
        }
    }

    static ParsedOptions defaults() {
        return new ParsedOptions(DiagnosticWorkerOptions.defaultThreadCount(),
                DiagnosticWorkerOptions.DEFAULT_DOCUMENT_ANALYSIS_TIMEOUT_MS, true);
    }

    /**
     * Parse initialization options and apply side-effects that are
     * self-contained (protocol version warning, log level change).
     *
     * @return parsed options; defaults if the input is not a {@link JsonObject}
     */
    static ParsedOptions parse(Object initOptions) {
        if (!(initOptions instanceof JsonObject)) {
            return defaults();
        }
        JsonObject opts = (JsonObject) initOptions;
        applyProtocolVersionOption(opts);
        applyLogLevelOption(opts);

        int threads = DiagnosticWorkerOptions.defaultThreadCount();
        Long parsedThreads = parsePositiveLong(opts, WORKER_THREAD_COUNT_OPTION);
        if (parsedThreads != null) {
            threads = (int) Math.min(parsedThreads, Integer.MAX_VALUE);
            logger.info("Diagnostic worker threads: {}", threads);
        }

        long timeoutMs = DiagnosticWorkerOptions.DEFAULT_DOCUMENT_ANALYSIS_TIMEOUT_MS;
        Long parsedTimeout = parsePositiveLong(opts, ANALYSIS_TIMEOUT_OPTION);
        if (parsedTimeout != null) {
            timeoutMs = parsedTimeout;
            logger.info("Document analysis timeout: {} ms", timeoutMs);
        }

        boolean analyzersEnabled = true;
        if (opts.has(ENABLE_ANALYZERS_OPTION) && opts.get(ENABLE_ANALYZERS_OPTION).isJsonPrimitive()) {
            analyzersEnabled = opts.get(ENABLE_ANALYZERS_OPTION).getAsBoolean();
            logger.info("Optional analyzers enabled: {}", analyzersEnabled);
        }

        return new ParsedOptions(threads, timeoutMs, analyzersEnabled);
    }

    private static Long parsePositiveLong(JsonObject opts, String name) {
        if (!opts.has(name) || !opts.get(name).isJsonPrimitive()) {
            return null;
        }
        JsonElement element = opts.get(name);
        try {
            long value = element.getAsLong();
            if (value < 1) {
                logger.warn("Ignoring {}={}: must be positive", name, value);
                return null;
            }
            return value;
        } catch (NumberFormatException e) {
            logger.warn("Ignoring {}='{}': not a number", name, element.getAsString());
            return null;
        }
    }

    private static void applyProtocolVersionOption(JsonObject opts) {
        if (!opts.has(PROTOCOL_VERSION_OPTION) || !opts.get(PROTOCOL_VERSION_OPTION).isJsonPrimitive()) {
            return;
        }
        String clientProtocolVersion = opts.get(PROTOCOL_VERSION_OPTION).getAsString();
        if (!Protocol.VERSION.equals(clientProtocolVersion)) {
            logger.warn("Protocol version mismatch: extension={}, server={}. "
                            + "Some custom features may not work as expected.",
                    clientProtocolVersion, Protocol.VERSION);
        }
    }

    private static void applyLogLevelOption(JsonObject opts) {
        if (opts.has(LOG_LEVEL_OPTION) && opts.get(LOG_LEVEL_OPTION).isJsonPrimitive()) {
            applyLogLevel(opts.get(LOG_LEVEL_OPTION).getAsString());
        }
    }

    /**
     * Dynamically set the Logback root logger level from a string value.
     * Accepted values (case-insensitive): ERROR, WARN, INFO, DEBUG, TRACE.
     * Invalid values are ignored and a warning is logged.
     */
    static void applyLogLevel(String levelName) {
        ch.qos.logback.classic.Level level = ch.qos.logback.classic.Level.toLevel(levelName, null);
        if (level == null) {
            logger.warn("Unknown log level '{}', keeping current level", levelName);
            return;
        }
        org.slf4j.Logger rootLogger = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (!(rootLogger instanceof ch.qos.logback.classic.Logger)) {
            logger.warn("Logging backend is not Logback, cannot set log level to '{}'", levelName);
            return;
        }
        ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger) rootLogger;
        ch.qos.logback.classic.Level previous = root.getLevel();
        root.setLevel(level);
        logger.info("Log level changed from {} to {}", previous, level);
    }

    private InitializationOptionsParser() {
        // utility class
    }
}
