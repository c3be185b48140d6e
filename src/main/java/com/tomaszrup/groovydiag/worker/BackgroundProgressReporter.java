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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns batch lifecycle callbacks of Background batches into
 * {@link BackgroundStatusSink} reports. Foreground batches are not reported.
 */
public class BackgroundProgressReporter implements BatchListener {
	private static final Logger logger = LoggerFactory.getLogger(BackgroundProgressReporter.class);

	private final BackgroundStatusSink sink;

	public BackgroundProgressReporter(BackgroundStatusSink sink) {
		this.sink = sink;
	}

	@Override
	public void batchStarted(WorkBatch batch) {
		if (batch.getWorkType() != AnalyzerWorkType.BACKGROUND) {
			return;
		}
		logger.info("Background analysis started: {} document(s) in {} project(s)",
				batch.getDocumentCount(), batch.getProjectCount());
		report(BackgroundDiagnosticStatus.STARTED, batch, batch.getDocumentCount());
	}

	@Override
	public void batchProgress(WorkBatch batch, int remaining) {
		if (batch.getWorkType() != AnalyzerWorkType.BACKGROUND) {
			return;
		}
		logger.debug("Background analysis progress: {}/{} remaining", remaining, batch.getDocumentCount());
		report(BackgroundDiagnosticStatus.PROGRESS, batch, remaining);
	}

	@Override
	public void batchFinished(WorkBatch batch) {
		if (batch.getWorkType() != AnalyzerWorkType.BACKGROUND) {
			return;
		}
		logger.info("Background analysis finished: {} document(s)", batch.getDocumentCount());
		report(BackgroundDiagnosticStatus.FINISHED, batch, 0);
	}

	private void report(BackgroundDiagnosticStatus status, WorkBatch batch, int remaining) {
		try {
			sink.reportBackgroundStatus(status, batch.getProjectCount(), batch.getDocumentCount(), remaining);
		} catch (RuntimeException e) {
			logger.warn("Failed to report background status {}: {}", status, e.getMessage(), e);
		}
	}
}
