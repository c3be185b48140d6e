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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable view of every project in the workspace. Readers hold on to one
 * snapshot for the duration of an operation; the {@link Workspace} publishes
 * a new snapshot on every mutation.
 *
 * <p>Document lookups go through the per-project indexes, so replacing one
 * project copies only the project map and never touches the documents of
 * the others.</p>
 */
public final class WorkspaceSnapshot {

	public static final WorkspaceSnapshot EMPTY = new WorkspaceSnapshot(Collections.emptyList());

	private final Map<ProjectId, ProjectSnapshot> projects;

	public WorkspaceSnapshot(Collection<ProjectSnapshot> projects) {
		Map<ProjectId, ProjectSnapshot> byId = new LinkedHashMap<>();
		for (ProjectSnapshot project : projects) {
			byId.put(project.getId(), project);
		}
		this.projects = Collections.unmodifiableMap(byId);
	}

	private WorkspaceSnapshot(Map<ProjectId, ProjectSnapshot> projects) {
		this.projects = Collections.unmodifiableMap(projects);
	}

	public Collection<ProjectSnapshot> getProjects() {
		return projects.values();
	}

	public ProjectSnapshot getProject(ProjectId projectId) {
		return projectId != null ? projects.get(projectId) : null;
	}

	/**
	 * Returns the project that owns the given document, or {@code null} if the
	 * document is not part of this snapshot.
	 */
	public ProjectSnapshot getOwningProject(DocumentId documentId) {
		if (documentId == null) {
			return null;
		}
		for (ProjectSnapshot project : projects.values()) {
			if (project.containsDocument(documentId)) {
				return project;
			}
		}
		return null;
	}

	public DocumentSnapshot getDocument(DocumentId documentId) {
		ProjectSnapshot project = getOwningProject(documentId);
		return project != null ? project.getDocument(documentId) : null;
	}

	/**
	 * A build project's copy of a file wins over a miscellaneous-files copy.
	 */
	public DocumentId getDocumentId(Path path) {
		if (path == null) {
			return null;
		}
		DocumentId miscellaneous = null;
		for (ProjectSnapshot project : projects.values()) {
			DocumentId documentId = project.getDocumentIdAt(path);
			if (documentId == null) {
				continue;
			}
			if (!project.isMiscellaneous()) {
				return documentId;
			}
			miscellaneous = documentId;
		}
		return miscellaneous;
	}

	/** All document ids, grouped by project in project order. */
	public List<DocumentId> getDocumentIds() {
		List<DocumentId> ids = new ArrayList<>();
		for (ProjectSnapshot project : projects.values()) {
			ids.addAll(project.getDocumentIds());
		}
		return ids;
	}

	public int getDocumentCount() {
		int count = 0;
		for (ProjectSnapshot project : projects.values()) {
			count += project.getDocumentCount();
		}
		return count;
	}

	public WorkspaceSnapshot withProject(ProjectSnapshot project) {
		Map<ProjectId, ProjectSnapshot> updated = new LinkedHashMap<>(projects);
		updated.put(project.getId(), project);
		return new WorkspaceSnapshot(updated);
	}

	public WorkspaceSnapshot withoutProject(ProjectId projectId) {
		Map<ProjectId, ProjectSnapshot> updated = new LinkedHashMap<>(projects);
		updated.remove(projectId);
		return new WorkspaceSnapshot(updated);
	}
}
