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
package com.tomaszrup.groovydiag.worker;

/**
 * Immutable settings of the diagnostic worker.
 */
public final class DiagnosticWorkerOptions {
	public static final long DEFAULT_DOCUMENT_ANALYSIS_TIMEOUT_MS = 30_000L;

	private final int threadCount;
	private final long documentAnalysisTimeoutMs;

	public DiagnosticWorkerOptions(int threadCount, long documentAnalysisTimeoutMs) {
		if (threadCount < 1) {
			throw new IllegalArgumentException("threadCount must be at least 1: " + threadCount);
		}
		if (documentAnalysisTimeoutMs <= 0) {
			throw new IllegalArgumentException("documentAnalysisTimeoutMs must be positive: "
					+ documentAnalysisTimeoutMs);
		}
		this.threadCount = threadCount;
		this.documentAnalysisTimeoutMs = documentAnalysisTimeoutMs;
	}

	/** {@code max(1, 0.75 * availableProcessors)} threads, 30 second timeout. */
	public static DiagnosticWorkerOptions defaults() {
		return new DiagnosticWorkerOptions(defaultThreadCount(), DEFAULT_DOCUMENT_ANALYSIS_TIMEOUT_MS);
	}

	public static int defaultThreadCount() {
		return Math.max(1, (int) (Runtime.getRuntime().availableProcessors() * 0.75));
	}

	public int getThreadCount() {
		return threadCount;
	}

	public long getDocumentAnalysisTimeoutMs() {
		return documentAnalysisTimeoutMs;
	}

	/**
	 * How long diagnostic queries wait for Foreground work to drain: three
	 * document timeouts, saturating at {@link Long#MAX_VALUE}.
	 */
	public long getQueryTimeoutMs() {
		try {
			return Math.multiplyExact(documentAnalysisTimeoutMs, 3L);
		} catch (ArithmeticException e) {
			return Long.MAX_VALUE;
		}
	}

	@Override
	public String toString() {
		return "DiagnosticWorkerOptions{threads=" + threadCount + ", timeoutMs=" + documentAnalysisTimeoutMs + "}";
	}
}
