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
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.groovydiag;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonObject;
import com.tomaszrup.groovydiag.worker.DiagnosticWorkerOptions;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;

class InitializationOptionsParserTests {

	private Logger rootLogger;
	private Level originalLevel;

	@BeforeEach
	void setup() {
		rootLogger = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
		originalLevel = rootLogger.getLevel();
	}

	@AfterEach
	void tearDown() {
		rootLogger.setLevel(originalLevel);
	}

	@Test
	void testNonObjectOptionsYieldDefaults() {
		InitializationOptionsParser.ParsedOptions options = InitializationOptionsParser.parse("not an object");

		Assertions.assertEquals(DiagnosticWorkerOptions.defaultThreadCount(), options.workerThreadCount);
		Assertions.assertEquals(DiagnosticWorkerOptions.DEFAULT_DOCUMENT_ANALYSIS_TIMEOUT_MS,
				options.documentAnalysisTimeoutMs);
		Assertions.assertTrue(options.analyzersEnabled);
	}

	@Test
	void testNullOptionsYieldDefaults() {
		InitializationOptionsParser.ParsedOptions options = InitializationOptionsParser.parse(null);

		Assertions.assertEquals(DiagnosticWorkerOptions.defaultThreadCount(), options.workerThreadCount);
		Assertions.assertTrue(options.analyzersEnabled);
	}

	@Test
	void testParsesWorkerOptions() {
		JsonObject json = new JsonObject();
		json.addProperty(InitializationOptionsParser.WORKER_THREAD_COUNT_OPTION, 3);
		json.addProperty(InitializationOptionsParser.ANALYSIS_TIMEOUT_OPTION, 2500);
		json.addProperty(InitializationOptionsParser.ENABLE_ANALYZERS_OPTION, false);

		InitializationOptionsParser.ParsedOptions options = InitializationOptionsParser.parse(json);

		Assertions.assertEquals(3, options.workerThreadCount);
		Assertions.assertEquals(2500L, options.documentAnalysisTimeoutMs);
		Assertions.assertFalse(options.analyzersEnabled);
		DiagnosticWorkerOptions workerOptions = options.toWorkerOptions();
		Assertions.assertEquals(3, workerOptions.getThreadCount());
		Assertions.assertEquals(2500L, workerOptions.getDocumentAnalysisTimeoutMs());
	}

	@Test
	void testNumbersAsStringsAreAccepted() {
		JsonObject json = new JsonObject();
		json.addProperty(InitializationOptionsParser.WORKER_THREAD_COUNT_OPTION, "2");

		Assertions.assertEquals(2, InitializationOptionsParser.parse(json).workerThreadCount);
	}

	@Test
	void testNonPositiveValuesAreIgnored() {
		JsonObject json = new JsonObject();
		json.addProperty(InitializationOptionsParser.WORKER_THREAD_COUNT_OPTION, 0);
		json.addProperty(InitializationOptionsParser.ANALYSIS_TIMEOUT_OPTION, -5);

		InitializationOptionsParser.ParsedOptions options = InitializationOptionsParser.parse(json);

		Assertions.assertEquals(DiagnosticWorkerOptions.defaultThreadCount(), options.workerThreadCount);
		Assertions.assertEquals(DiagnosticWorkerOptions.DEFAULT_DOCUMENT_ANALYSIS_TIMEOUT_MS,
				options.documentAnalysisTimeoutMs);
	}

	@Test
	void testNonNumericValuesAreIgnored() {
		JsonObject json = new JsonObject();
		json.addProperty(InitializationOptionsParser.ANALYSIS_TIMEOUT_OPTION, "soon");

		Assertions.assertEquals(DiagnosticWorkerOptions.DEFAULT_DOCUMENT_ANALYSIS_TIMEOUT_MS,
				InitializationOptionsParser.parse(json).documentAnalysisTimeoutMs);
	}

	@Test
	void testNonPrimitiveValuesAreIgnored() {
		JsonObject json = new JsonObject();
		json.add(InitializationOptionsParser.WORKER_THREAD_COUNT_OPTION, new JsonObject());
		json.add(InitializationOptionsParser.ENABLE_ANALYZERS_OPTION, new JsonObject());

		InitializationOptionsParser.ParsedOptions options = InitializationOptionsParser.parse(json);

		Assertions.assertEquals(DiagnosticWorkerOptions.defaultThreadCount(), options.workerThreadCount);
		Assertions.assertTrue(options.analyzersEnabled);
	}

	@Test
	void testLogLevelOptionChangesRootLevel() {
		JsonObject json = new JsonObject();
		json.addProperty(InitializationOptionsParser.LOG_LEVEL_OPTION, "debug");

		InitializationOptionsParser.parse(json);

		Assertions.assertEquals(Level.DEBUG, rootLogger.getLevel());
	}

	@Test
	void testInvalidLogLevelKeepsCurrentLevel() {
		rootLogger.setLevel(Level.WARN);

		InitializationOptionsParser.applyLogLevel("LOUD");

		Assertions.assertEquals(Level.WARN, rootLogger.getLevel());
	}

	@Test
	void testProtocolVersionMismatchDoesNotAffectOptions() {
		JsonObject json = new JsonObject();
		json.addProperty(InitializationOptionsParser.PROTOCOL_VERSION_OPTION, "0");
		json.addProperty(InitializationOptionsParser.WORKER_THREAD_COUNT_OPTION, 1);

		Assertions.assertEquals(1, InitializationOptionsParser.parse(json).workerThreadCount);
	}
}
