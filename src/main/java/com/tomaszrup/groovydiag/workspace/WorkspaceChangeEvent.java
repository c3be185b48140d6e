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
package com.tomaszrup.groovydiag.workspace;

/**
 * Notification that the workspace moved to a new snapshot.
 *
 * <p>{@code projectId} is set for project, document and analyzer-config
 * events; {@code documentId} only for document events and is {@code null}
 * otherwise.</p>
 */
public final class WorkspaceChangeEvent {
	private final WorkspaceChangeKind kind;
	private final WorkspaceSnapshot newSnapshot;
	private final ProjectId projectId;
	private final DocumentId documentId;

	public WorkspaceChangeEvent(WorkspaceChangeKind kind, WorkspaceSnapshot newSnapshot,
			ProjectId projectId, DocumentId documentId) {
		this.kind = kind;
		this.newSnapshot = newSnapshot;
		this.projectId = projectId;
		this.documentId = documentId;
	}

	public WorkspaceChangeKind getKind() {
		return kind;
	}

	public WorkspaceSnapshot getNewSnapshot() {
		return newSnapshot;
	}

	public ProjectId getProjectId() {
		return projectId;
	}

	public DocumentId getDocumentId() {
		return documentId;
	}

	@Override
	public String toString() {
		return "WorkspaceChangeEvent{" + kind + ", project=" + projectId + ", document=" + documentId + "}";
	}
}
