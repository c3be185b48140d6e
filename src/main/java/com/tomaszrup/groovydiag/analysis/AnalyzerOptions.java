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
package com.tomaszrup.groovydiag.analysis;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Analyzer settings read from a project's {@code .editorconfig} files.
 *
 * <p>Only properties that apply to Groovy sources are kept: those before the
 * first section, and those in sections whose glob is {@code *}, {@code **} or
 * mentions {@code groovy}. Keys are lower-cased. When several files are given,
 * files deeper in the tree override shallower ones.</p>
 */
public final class AnalyzerOptions {
	private static final Logger logger = LoggerFactory.getLogger(AnalyzerOptions.class);

	public static final AnalyzerOptions EMPTY = new AnalyzerOptions(Collections.emptyMap());

	private final Map<String, String> values;

	private AnalyzerOptions(Map<String, String> values) {
		this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
	}

	/**
	 * Reads and merges the given configuration files. Unreadable files are
	 * logged and skipped.
	 */
	public static AnalyzerOptions load(Collection<Path> configPaths) {
		if (configPaths.isEmpty()) {
			return EMPTY;
		}
		List<Path> ordered = new ArrayList<>(configPaths);
		ordered.sort(Comparator.comparingInt(Path::getNameCount));
		Map<String, String> merged = new LinkedHashMap<>();
		for (Path path : ordered) {
			if (!Files.isRegularFile(path)) {
				continue;
			}
			try {
				parseInto(Files.readString(path, StandardCharsets.UTF_8), merged);
			} catch (IOException e) {
				logger.warn("Cannot read analyzer config {}: {}", path, e.getMessage());
			}
		}
		return new AnalyzerOptions(merged);
	}

	public static AnalyzerOptions parse(String text) {
		Map<String, String> values = new LinkedHashMap<>();
		parseInto(text, values);
		return new AnalyzerOptions(values);
	}

	private static void parseInto(String text, Map<String, String> values) {
		boolean applies = true;
		for (String rawLine : text.split("\\r?\\n")) {
			String line = rawLine.trim();
			if (line.isEmpty() || line.startsWith("#") || line.startsWith(";")) {
				continue;
			}
			if (line.startsWith("[") && line.endsWith("]")) {
				applies = sectionAppliesToGroovy(line.substring(1, line.length() - 1).trim());
				continue;
			}
			int eq = line.indexOf('=');
			if (eq <= 0 || !applies) {
				continue;
			}
			String key = line.substring(0, eq).trim().toLowerCase(Locale.ROOT);
			String value = line.substring(eq + 1).trim();
			values.put(key, value);
		}
	}

	private static boolean sectionAppliesToGroovy(String glob) {
		return "*".equals(glob) || "**".equals(glob) || glob.toLowerCase(Locale.ROOT).contains("groovy");
	}

	public String get(String key) {
		return values.get(key.toLowerCase(Locale.ROOT));
	}

	/**
	 * Integer value of {@code key}, or {@code defaultValue} if it is missing
	 * or not a number (for example {@code off}).
	 */
	public int getInt(String key, int defaultValue) {
		String value = get(key);
		if (value == null) {
			return defaultValue;
		}
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException e) {
			logger.debug("Ignoring non-numeric value '{}' for {}", value, key);
			return defaultValue;
		}
	}

	public Map<String, String> asMap() {
		return values;
	}

	public boolean isEmpty() {
		return values.isEmpty();
	}

	@Override
	public String toString() {
		return "AnalyzerOptions" + values;
	}
}
