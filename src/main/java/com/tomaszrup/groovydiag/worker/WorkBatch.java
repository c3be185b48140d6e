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
 * Counters shared by all items enqueued together by one
 * {@link AnalyzerWorkQueue#putWork} call. Used for progress reporting only.
 *
 * <p>{@code remaining} starts at {@code documentCount} and drops by one per
 * acknowledged item, whatever the analysis outcome. Listener callbacks are
 * made while holding the batch monitor so that the values a listener sees
 * never go back up.</p>
 */
public final class WorkBatch {
	private static final int MIN_PROGRESS_INTERVAL = 10;

	private final int documentCount;
	private final int projectCount;
	private final AnalyzerWorkType workType;
	private final int progressInterval;

	private int remaining;
	private boolean started;

	public WorkBatch(int documentCount, int projectCount, AnalyzerWorkType workType) {
		if (documentCount < 0) {
			throw new IllegalArgumentException("documentCount must not be negative: " + documentCount);
		}
		this.documentCount = documentCount;
		this.projectCount = projectCount;
		this.workType = workType;
		this.remaining = documentCount;
		this.progressInterval = Math.max(MIN_PROGRESS_INTERVAL, documentCount / 100);
	}

	public int getDocumentCount() {
		return documentCount;
	}

	public int getProjectCount() {
		return projectCount;
	}

	public AnalyzerWorkType getWorkType() {
		return workType;
	}

	public int getProgressInterval() {
		return progressInterval;
	}

	public synchronized int getRemaining() {
		return remaining;
	}

	public synchronized boolean isStarted() {
		return started;
	}

	synchronized void onItemDispatched(BatchListener listener) {
		if (!started) {
			started = true;
			listener.batchStarted(this);
		}
	}

	/**
	 * Records one acknowledged item.
	 *
	 * @return the remaining count after the decrement
	 */
	synchronized int onItemCompleted(BatchListener listener) {
		if (remaining == 0) {
			throw new IllegalStateException("Batch already drained: " + this);
		}
		onItemDispatched(listener);
		remaining--;
		int completed = documentCount - remaining;
		if (remaining == 0 || completed % progressInterval == 0) {
			listener.batchProgress(this, remaining);
		}
		if (remaining == 0) {
			listener.batchFinished(this);
		}
		return remaining;
	}

	@Override
	public synchronized String toString() {
		return "WorkBatch{" + workType + ", documents=" + documentCount + ", projects=" + projectCount
				+ ", remaining=" + remaining + "}";
	}
}
