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

import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.groovydiag.workspace.DocumentId;
import com.tomaszrup.groovydiag.workspace.ProjectSnapshot;
import com.tomaszrup.groovydiag.workspace.Workspace;
import com.tomaszrup.groovydiag.workspace.WorkspaceChangeEvent;
import com.tomaszrup.groovydiag.workspace.WorkspaceChangeListener;
import com.tomaszrup.groovydiag.workspace.WorkspaceInitializationListener;

/**
 * Schedules analysis in response to workspace changes.
 *
 * <ul>
 *   <li>Document added, changed, reloaded or moved: that document, Foreground.</li>
 *   <li>Document removed: its cached diagnostics are dropped.</li>
 *   <li>Analyzer config changed, project added, changed or reloaded: all
 *       documents of the project, Background.</li>
 *   <li>Solution added, changed or reloaded, and workspace initialization:
 *       every document, Background.</li>
 * </ul>
 *
 * <p>Subscriptions are made in {@link #start()} and released in
 * {@link #stop()}.</p>
 */
public class WorkspaceChangeHandler {
	private static final Logger logger = LoggerFactory.getLogger(WorkspaceChangeHandler.class);

	private final Workspace workspace;
	private final DiagnosticWorker diagnosticWorker;
	private final WorkspaceChangeListener changeListener = this::onWorkspaceChanged;
	private final WorkspaceInitializationListener initializationListener = this::onWorkspaceInitialized;
	private boolean started = false;

	public WorkspaceChangeHandler(Workspace workspace, DiagnosticWorker diagnosticWorker) {
		this.workspace = workspace;
		this.diagnosticWorker = diagnosticWorker;
	}

	/**
	 * Subscribes to the workspace. If the workspace is already initialized,
	 * all of its documents are queued right away.
	 */
	public synchronized void start() {
		if (started) {
			return;
		}
		started = true;
		workspace.addChangeListener(changeListener);
		workspace.addInitializationListener(initializationListener);
		if (workspace.isInitialized()) {
			onWorkspaceInitialized(true);
		}
	}

	public synchronized void stop() {
		if (!started) {
			return;
		}
		started = false;
		workspace.removeChangeListener(changeListener);
		workspace.removeInitializationListener(initializationListener);
	}

	void onWorkspaceInitialized(boolean initialized) {
		if (!initialized) {
			return;
		}
		List<DocumentId> queued = diagnosticWorker.queueDocumentsForDiagnostics();
		logger.info("Workspace initialized, queued {} document(s) for background analysis", queued.size());
	}

	void onWorkspaceChanged(WorkspaceChangeEvent event) {
		switch (event.getKind()) {
			case DOCUMENT_ADDED:
			case DOCUMENT_CHANGED:
			case DOCUMENT_RELOADED:
			case DOCUMENT_INFO_CHANGED:
				diagnosticWorker.queueForAnalysis(Collections.singletonList(event.getDocumentId()),
						AnalyzerWorkType.FOREGROUND, 1);
				break;
			case DOCUMENT_REMOVED:
				diagnosticWorker.removeDocumentDiagnostics(event.getDocumentId());
				break;
			case ANALYZER_CONFIG_DOCUMENT_CHANGED:
			case PROJECT_ADDED:
			case PROJECT_CHANGED:
			case PROJECT_RELOADED:
				queueProject(event);
				break;
			case PROJECT_REMOVED:
				logger.debug("Project {} removed", event.getProjectId());
				break;
			case SOLUTION_ADDED:
			case SOLUTION_CHANGED:
			case SOLUTION_RELOADED:
				List<DocumentId> queued = diagnosticWorker.queueDocumentsForDiagnostics();
				logger.debug("Solution {}: queued {} document(s)", event.getKind(), queued.size());
				break;
			default:
				logger.debug("Ignoring workspace change {}", event);
				break;
		}
	}

	private void queueProject(WorkspaceChangeEvent event) {
		ProjectSnapshot project = event.getNewSnapshot().getProject(event.getProjectId());
		if (project == null) {
			logger.debug("Project {} no longer exists, nothing to queue for {}", event.getProjectId(),
					event.getKind());
			return;
		}
		diagnosticWorker.queueForAnalysis(project.getDocumentIds(), AnalyzerWorkType.BACKGROUND, 1);
		logger.debug("{}: queued {} document(s) of {}", event.getKind(), project.getDocumentIds().size(),
				project.getName());
	}
}
