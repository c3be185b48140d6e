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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.tomaszrup.groovydiag.workspace.DocumentId;

/**
 * A scheduled "analyze this document" unit.
 *
 * <p>An item normally belongs to one batch. When a pending item is superseded
 * by a later enqueue, the replacement carries the batches of both so that each
 * batch still counts the document once. The work type is only changed by the
 * queue, under its lock, while the item is pending.</p>
 */
public final class QueueItem {
	private final DocumentId documentId;
	private final CancellationToken cancellationToken;
	private final List<WorkBatch> batches;
	private volatile AnalyzerWorkType workType;

	QueueItem(DocumentId documentId, AnalyzerWorkType workType, CancellationToken cancellationToken,
			List<WorkBatch> batches) {
		this.documentId = documentId;
		this.workType = workType;
		this.cancellationToken = cancellationToken;
		this.batches = Collections.unmodifiableList(new ArrayList<>(batches));
	}

	public DocumentId getDocumentId() {
		return documentId;
	}

	public AnalyzerWorkType getWorkType() {
		return workType;
	}

	void setWorkType(AnalyzerWorkType workType) {
		this.workType = workType;
	}

	public CancellationToken getCancellationToken() {
		return cancellationToken;
	}

	public List<WorkBatch> getBatches() {
		return batches;
	}

	QueueItem supersededBy(WorkBatch batch, AnalyzerWorkType newType) {
		List<WorkBatch> merged = new ArrayList<>(batches);
		merged.add(batch);
		return new QueueItem(documentId, newType, cancellationToken, merged);
	}

	@Override
	public String toString() {
		return "QueueItem{" + documentId + ", " + workType + ", batches=" + batches.size() + "}";
	}
}
