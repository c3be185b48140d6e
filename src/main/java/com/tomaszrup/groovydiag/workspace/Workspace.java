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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.UnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread-safe, in-memory model of the projects and documents the server
 * knows about.
 *
 * <p>Every mutation produces a new immutable {@link WorkspaceSnapshot}
 * (copy-on-write) and then notifies {@link WorkspaceChangeListener}s. Writers
 * are serialized on an internal lock; readers simply grab
 * {@link #getCurrentSnapshot()} without locking. Listeners are invoked after
 * the new snapshot is published and outside the write lock.</p>
 *
 * <p>Removing a project (or dropping documents while reloading one) emits a
 * {@link WorkspaceChangeKind#DOCUMENT_REMOVED} event for every document that
 * disappears, before the project-level event.</p>
 */
public class Workspace {
	private static final Logger logger = LoggerFactory.getLogger(Workspace.class);

	/** Name of the catch-all project holding open files outside any build project. */
	public static final String MISCELLANEOUS_PROJECT_NAME = "MiscellaneousFiles";

	private final Object writeLock = new Object();
	private volatile WorkspaceSnapshot currentSnapshot = WorkspaceSnapshot.EMPTY;
	private volatile boolean initialized = false;
	private ProjectId miscellaneousProjectId;

	private final List<WorkspaceChangeListener> changeListeners = new CopyOnWriteArrayList<>();
	private final List<WorkspaceInitializationListener> initializationListeners = new CopyOnWriteArrayList<>();

	public WorkspaceSnapshot getCurrentSnapshot() {
		return currentSnapshot;
	}

	public boolean isInitialized() {
		return initialized;
	}

	public DocumentId getDocumentId(Path path) {
		return currentSnapshot.getDocumentId(path);
	}

	// --- Listeners ---

	public void addChangeListener(WorkspaceChangeListener listener) {
		changeListeners.add(listener);
	}

	public void removeChangeListener(WorkspaceChangeListener listener) {
		changeListeners.remove(listener);
	}

	public void addInitializationListener(WorkspaceInitializationListener listener) {
		initializationListeners.add(listener);
	}

	public void removeInitializationListener(WorkspaceInitializationListener listener) {
		initializationListeners.remove(listener);
	}

	// --- Solution-level mutations ---

	/**
	 * Publishes the initial set of projects and raises the initialization
	 * signal. No change events are emitted for the initial load; listeners
	 * are expected to react to the initialization signal instead. Calling
	 * this again on an initialized workspace behaves like
	 * {@link #reloadSolution(Collection)}.
	 */
	public void initialize(Collection<ProjectSnapshot> projects) {
		boolean firstTime;
		synchronized (writeLock) {
			firstTime = !initialized;
			if (firstTime) {
				currentSnapshot = new WorkspaceSnapshot(mergeMiscellaneous(projects));
				initialized = true;
				logger.info("Workspace initialized with {} project(s), {} document(s)",
						projects.size(), currentSnapshot.getDocumentCount());
			}
		}
		if (!firstTime) {
			logger.debug("Workspace already initialized, reloading solution instead");
			reloadSolution(projects);
			return;
		}
		for (WorkspaceInitializationListener listener : initializationListeners) {
			try {
				listener.onWorkspaceInitialized(true);
			} catch (RuntimeException e) {
				logger.warn("Workspace initialization listener failed: {}", e.getMessage(), e);
			}
		}
	}

	/**
	 * Replaces all build projects with the given set. The miscellaneous-files
	 * project survives a reload.
	 */
	public void reloadSolution(Collection<ProjectSnapshot> projects) {
		List<WorkspaceChangeEvent> events = new ArrayList<>();
		synchronized (writeLock) {
			WorkspaceSnapshot previous = currentSnapshot;
			WorkspaceSnapshot next = new WorkspaceSnapshot(mergeMiscellaneous(projects));
			currentSnapshot = next;
			for (DocumentId documentId : previous.getDocumentIds()) {
				if (next.getDocument(documentId) == null) {
					ProjectSnapshot owner = previous.getOwningProject(documentId);
					events.add(new WorkspaceChangeEvent(WorkspaceChangeKind.DOCUMENT_REMOVED, next,
							owner.getId(), documentId));
				}
			}
			events.add(new WorkspaceChangeEvent(WorkspaceChangeKind.SOLUTION_RELOADED, next, null, null));
		}
		fire(events);
	}

	private List<ProjectSnapshot> mergeMiscellaneous(Collection<ProjectSnapshot> projects) {
		List<ProjectSnapshot> merged = new ArrayList<>(projects);
		ProjectSnapshot misc = currentSnapshot.getProject(miscellaneousProjectId);
		if (misc != null) {
			merged.add(misc);
		}
		return merged;
	}

	// --- Project-level mutations ---

	public void addProject(ProjectSnapshot project) {
		List<WorkspaceChangeEvent> events = new ArrayList<>();
		synchronized (writeLock) {
			if (currentSnapshot.getProject(project.getId()) != null) {
				throw new IllegalArgumentException("Project already exists: " + project.getName());
			}
			WorkspaceSnapshot next = currentSnapshot.withProject(project);
			currentSnapshot = next;
			events.add(new WorkspaceChangeEvent(WorkspaceChangeKind.PROJECT_ADDED, next, project.getId(), null));
		}
		fire(events);
	}

	/**
	 * Replaces a project's metadata and document set, e.g. after its build
	 * file changed.
	 */
	public void updateProject(ProjectSnapshot project) {
		replaceProject(project, WorkspaceChangeKind.PROJECT_CHANGED);
	}

	/**
	 * Replaces a project with a freshly loaded copy of itself.
	 */
	public void reloadProject(ProjectSnapshot project) {
		replaceProject(project, WorkspaceChangeKind.PROJECT_RELOADED);
	}

	private void replaceProject(ProjectSnapshot project, WorkspaceChangeKind kind) {
		List<WorkspaceChangeEvent> events = new ArrayList<>();
		synchronized (writeLock) {
			ProjectSnapshot previous = currentSnapshot.getProject(project.getId());
			if (previous == null) {
				throw new IllegalArgumentException("Unknown project: " + project.getName());
			}
			WorkspaceSnapshot next = currentSnapshot.withProject(project);
			currentSnapshot = next;
			for (DocumentId documentId : previous.getDocumentIds()) {
				if (!project.containsDocument(documentId)) {
					events.add(new WorkspaceChangeEvent(WorkspaceChangeKind.DOCUMENT_REMOVED, next,
							project.getId(), documentId));
				}
			}
			events.add(new WorkspaceChangeEvent(kind, next, project.getId(), null));
		}
		fire(events);
	}

	public boolean removeProject(ProjectId projectId) {
		List<WorkspaceChangeEvent> events = new ArrayList<>();
		synchronized (writeLock) {
			ProjectSnapshot previous = currentSnapshot.getProject(projectId);
			if (previous == null) {
				return false;
			}
			WorkspaceSnapshot next = currentSnapshot.withoutProject(projectId);
			currentSnapshot = next;
			for (DocumentId documentId : previous.getDocumentIds()) {
				events.add(new WorkspaceChangeEvent(WorkspaceChangeKind.DOCUMENT_REMOVED, next,
						projectId, documentId));
			}
			events.add(new WorkspaceChangeEvent(WorkspaceChangeKind.PROJECT_REMOVED, next, projectId, null));
			if (projectId.equals(miscellaneousProjectId)) {
				miscellaneousProjectId = null;
			}
		}
		fire(events);
		return true;
	}

	/**
	 * Records that an analyzer configuration document of the project was
	 * created, edited or deleted.
	 *
	 * @param exists whether the configuration file still exists
	 */
	public void changeAnalyzerConfig(ProjectId projectId, Path configPath, boolean exists) {
		List<WorkspaceChangeEvent> events = new ArrayList<>();
		synchronized (writeLock) {
			ProjectSnapshot project = currentSnapshot.getProject(projectId);
			if (project == null) {
				logger.debug("Ignoring analyzer config change {} for unknown project {}", configPath, projectId);
				return;
			}
			Path normalized = configPath.toAbsolutePath().normalize();
			Set<Path> configs = new LinkedHashSet<>(project.getAnalyzerConfigPaths());
			if (exists) {
				configs.add(normalized);
			} else {
				configs.remove(normalized);
			}
			WorkspaceSnapshot next = currentSnapshot.withProject(project.withAnalyzerConfigPaths(configs));
			currentSnapshot = next;
			events.add(new WorkspaceChangeEvent(WorkspaceChangeKind.ANALYZER_CONFIG_DOCUMENT_CHANGED, next,
					projectId, null));
		}
		fire(events);
	}

	/**
	 * Returns the catch-all project for files outside every build project,
	 * creating it on first use.
	 */
	public ProjectId getOrCreateMiscellaneousProject() {
		List<WorkspaceChangeEvent> events = new ArrayList<>();
		ProjectId result;
		synchronized (writeLock) {
			if (miscellaneousProjectId == null) {
				ProjectSnapshot misc = new ProjectSnapshot(ProjectId.create(MISCELLANEOUS_PROJECT_NAME),
						MISCELLANEOUS_PROJECT_NAME, null, true, new ArrayList<>(), new ArrayList<>());
				miscellaneousProjectId = misc.getId();
				WorkspaceSnapshot next = currentSnapshot.withProject(misc);
				currentSnapshot = next;
				events.add(new WorkspaceChangeEvent(WorkspaceChangeKind.PROJECT_ADDED, next, misc.getId(), null));
			}
			result = miscellaneousProjectId;
		}
		fire(events);
		return result;
	}

	/**
	 * Finds the build project whose root contains {@code path}; the deepest
	 * root wins for nested projects.
	 *
	 * @return the owning project, or {@code null} if none contains the path
	 */
	public ProjectSnapshot findProjectForPath(Path path) {
		Path normalized = path.toAbsolutePath().normalize();
		ProjectSnapshot best = null;
		for (ProjectSnapshot project : currentSnapshot.getProjects()) {
			Path root = project.getRoot();
			if (root == null || !normalized.startsWith(root)) {
				continue;
			}
			if (best == null || root.getNameCount() > best.getRoot().getNameCount()) {
				best = project;
			}
		}
		return best;
	}

	// --- Document-level mutations ---

	public DocumentId addDocument(ProjectId projectId, Path path, String text) {
		List<WorkspaceChangeEvent> events = new ArrayList<>();
		DocumentId documentId;
		synchronized (writeLock) {
			ProjectSnapshot project = currentSnapshot.getProject(projectId);
			if (project == null) {
				throw new IllegalArgumentException("Unknown project: " + projectId);
			}
			if (currentSnapshot.getDocumentId(path) != null) {
				throw new IllegalArgumentException("Document already exists: " + path);
			}
			documentId = DocumentId.create(String.valueOf(path.getFileName()));
			DocumentSnapshot document = new DocumentSnapshot(documentId, projectId, path, text);
			WorkspaceSnapshot next = currentSnapshot.withProject(project.withDocument(document));
			currentSnapshot = next;
			events.add(new WorkspaceChangeEvent(WorkspaceChangeKind.DOCUMENT_ADDED, next, projectId, documentId));
		}
		fire(events);
		return documentId;
	}

	/** Applies an editor edit. Returns {@code false} if the document is unknown. */
	public boolean changeDocumentText(DocumentId documentId, String text) {
		return replaceDocument(documentId, WorkspaceChangeKind.DOCUMENT_CHANGED,
				document -> document.withText(text));
	}

	/** Replaces the document text with what was re-read from disk. */
	public boolean reloadDocument(DocumentId documentId, String text) {
		return replaceDocument(documentId, WorkspaceChangeKind.DOCUMENT_RELOADED,
				document -> document.withText(text));
	}

	/** Moves or renames a document without touching its text. */
	public boolean changeDocumentPath(DocumentId documentId, Path newPath) {
		return replaceDocument(documentId, WorkspaceChangeKind.DOCUMENT_INFO_CHANGED,
				document -> document.withPath(newPath));
	}

	private boolean replaceDocument(DocumentId documentId, WorkspaceChangeKind kind,
			UnaryOperator<DocumentSnapshot> change) {
		List<WorkspaceChangeEvent> events = new ArrayList<>();
		synchronized (writeLock) {
			ProjectSnapshot project = currentSnapshot.getOwningProject(documentId);
			if (project == null) {
				return false;
			}
			DocumentSnapshot updated = change.apply(project.getDocument(documentId));
			WorkspaceSnapshot next = currentSnapshot.withProject(project.withDocument(updated));
			currentSnapshot = next;
			events.add(new WorkspaceChangeEvent(kind, next, project.getId(), documentId));
		}
		fire(events);
		return true;
	}

	public boolean removeDocument(DocumentId documentId) {
		List<WorkspaceChangeEvent> events = new ArrayList<>();
		synchronized (writeLock) {
			ProjectSnapshot project = currentSnapshot.getOwningProject(documentId);
			if (project == null) {
				return false;
			}
			WorkspaceSnapshot next = currentSnapshot.withProject(project.withoutDocument(documentId));
			currentSnapshot = next;
			events.add(new WorkspaceChangeEvent(WorkspaceChangeKind.DOCUMENT_REMOVED, next,
					project.getId(), documentId));
		}
		fire(events);
		return true;
	}

	private void fire(List<WorkspaceChangeEvent> events) {
		for (WorkspaceChangeEvent event : events) {
			logger.trace("Workspace change: {}", event);
			for (WorkspaceChangeListener listener : changeListeners) {
				try {
					listener.onWorkspaceChanged(event);
				} catch (RuntimeException e) {
					logger.warn("Workspace change listener failed for {}: {}", event, e.getMessage(), e);
				}
			}
		}
	}
}
