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
package com.tomaszrup.groovydiag;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

import org.eclipse.lsp4j.DidChangeConfigurationParams;
import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidChangeWatchedFilesParams;
import org.eclipse.lsp4j.DidCloseTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.DidSaveTextDocumentParams;
import org.eclipse.lsp4j.FileChangeType;
import org.eclipse.lsp4j.FileEvent;
import org.eclipse.lsp4j.TextDocumentContentChangeEvent;
import org.eclipse.lsp4j.services.TextDocumentService;
import org.eclipse.lsp4j.services.WorkspaceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.tomaszrup.groovydiag.util.MdcProjectContext;
import com.tomaszrup.groovydiag.workspace.DocumentId;
import com.tomaszrup.groovydiag.workspace.DocumentSnapshot;
import com.tomaszrup.groovydiag.workspace.ProjectDiscovery;
import com.tomaszrup.groovydiag.workspace.ProjectId;
import com.tomaszrup.groovydiag.workspace.ProjectSnapshot;
import com.tomaszrup.groovydiag.workspace.Workspace;

/**
 * Translates LSP document and workspace notifications into {@link Workspace}
 * mutations. Analysis is scheduled by the workspace change listener, never
 * here.
 *
 * <p>Editor buffers win over disk content: while a file is open, watched-file
 * events for it are ignored and project reloads keep the editor text.
 * Files opened outside every build project go to the miscellaneous-files
 * project and leave it again when closed.</p>
 *
 * <p>Text synchronization is {@code Full}: every {@code didChange} carries the
 * whole document.</p>
 */
public class DiagnosticsServices implements TextDocumentService, WorkspaceService {
	private static final Logger logger = LoggerFactory.getLogger(DiagnosticsServices.class);

	private static final String SETTINGS_SECTION = "groovy";

	private final Workspace workspace;
	private final Executor fileEventExecutor;
	private final Map<Path, String> openDocuments = new ConcurrentHashMap<>();

	/**
	 * @param fileEventExecutor runs watched-file handling, which reads from disk
	 */
	public DiagnosticsServices(Workspace workspace, Executor fileEventExecutor) {
		this.workspace = workspace;
		this.fileEventExecutor = fileEventExecutor;
	}

	public boolean isOpen(Path path) {
		return openDocuments.containsKey(path);
	}

	// --- TextDocumentService ---

	@Override
	public void didOpen(DidOpenTextDocumentParams params) {
		Path path = uriToPath(params.getTextDocument().getUri());
		if (path == null) {
			return;
		}
		String text = params.getTextDocument().getText();
		openDocuments.put(path, text);
		try {
			DocumentId documentId = workspace.getDocumentId(path);
			if (documentId != null) {
				DocumentSnapshot existing = workspace.getCurrentSnapshot().getDocument(documentId);
				if (existing == null || !text.equals(existing.getText())) {
					workspace.changeDocumentText(documentId, text);
				}
				return;
			}
			ProjectSnapshot project = workspace.findProjectForPath(path);
			ProjectId projectId = project != null ? project.getId() : workspace.getOrCreateMiscellaneousProject();
			MdcProjectContext.setProject(project != null ? project.getName() : Workspace.MISCELLANEOUS_PROJECT_NAME);
			workspace.addDocument(projectId, path, text);
			logger.debug("Opened {} in {}", path, project != null ? project.getName() : "miscellaneous files");
		} catch (RuntimeException e) {
			logger.warn("Unexpected exception during didOpen for {}: {}", path, e.getMessage());
			logger.debug("didOpen exception details", e);
		} finally {
			MdcProjectContext.clear();
		}
	}

	@Override
	public void didChange(DidChangeTextDocumentParams params) {
		Path path = uriToPath(params.getTextDocument().getUri());
		List<TextDocumentContentChangeEvent> changes = params.getContentChanges();
		if (path == null || changes == null || changes.isEmpty()) {
			return;
		}
		String text = changes.get(changes.size() - 1).getText();
		openDocuments.put(path, text);
		DocumentId documentId = workspace.getDocumentId(path);
		if (documentId == null) {
			logger.debug("didChange for unknown document {}", path);
			return;
		}
		workspace.changeDocumentText(documentId, text);
	}

	@Override
	public void didClose(DidCloseTextDocumentParams params) {
		Path path = uriToPath(params.getTextDocument().getUri());
		if (path == null) {
			return;
		}
		openDocuments.remove(path);
		DocumentId documentId = workspace.getDocumentId(path);
		if (documentId == null) {
			return;
		}
		ProjectSnapshot owner = workspace.getCurrentSnapshot().getOwningProject(documentId);
		if (owner == null || owner.isMiscellaneous() || !Files.isRegularFile(path)) {
			workspace.removeDocument(documentId);
			return;
		}
		// discard unsaved edits
		String diskText = readFile(path);
		DocumentSnapshot current = owner.getDocument(documentId);
		if (diskText != null && !diskText.equals(current.getText())) {
			workspace.reloadDocument(documentId, diskText);
		}
	}

	@Override
	public void didSave(DidSaveTextDocumentParams params) {
		logger.trace("didSave {}", params.getTextDocument().getUri());
	}

	// --- WorkspaceService ---

	@Override
	public void didChangeConfiguration(DidChangeConfigurationParams params) {
		Object settings = params.getSettings();
		if (!(settings instanceof JsonObject)) {
			return;
		}
		JsonObject root = (JsonObject) settings;
		JsonObject section = root.has(SETTINGS_SECTION) && root.get(SETTINGS_SECTION).isJsonObject()
				? root.getAsJsonObject(SETTINGS_SECTION)
				: root;
		JsonElement logLevel = section.get(InitializationOptionsParser.LOG_LEVEL_OPTION);
		if (logLevel != null && logLevel.isJsonPrimitive()) {
			InitializationOptionsParser.applyLogLevel(logLevel.getAsString());
		}
	}

	@Override
	public void didChangeWatchedFiles(DidChangeWatchedFilesParams params) {
		List<FileEvent> events = new ArrayList<>(params.getChanges());
		fileEventExecutor.execute(() -> {
			for (FileEvent event : events) {
				try {
					handleFileEvent(event);
				} catch (IOException | RuntimeException e) {
					logger.warn("Failed to handle file event {} {}: {}", event.getType(), event.getUri(),
							e.getMessage());
					logger.debug("File event failure details", e);
				}
			}
		});
	}

	private void handleFileEvent(FileEvent event) throws IOException {
		Path path = uriToPath(event.getUri());
		if (path == null) {
			return;
		}
		logger.debug("File event {} {}", event.getType(), path);
		if (ProjectDiscovery.isBuildFile(path)) {
			handleBuildFileEvent(path, event.getType());
		} else if (ProjectDiscovery.isAnalyzerConfigFile(path)) {
			ProjectSnapshot project = workspace.findProjectForPath(path);
			if (project != null) {
				workspace.changeAnalyzerConfig(project.getId(), path, event.getType() != FileChangeType.Deleted);
			}
		} else if (ProjectDiscovery.isGroovySource(path)) {
			handleSourceFileEvent(path, event.getType());
		}
	}

	private void handleSourceFileEvent(Path path, FileChangeType type) {
		if (openDocuments.containsKey(path)) {
			return;
		}
		DocumentId documentId = workspace.getDocumentId(path);
		if (type == FileChangeType.Deleted) {
			if (documentId != null) {
				workspace.removeDocument(documentId);
			}
			return;
		}
		String text = readFile(path);
		if (text == null) {
			return;
		}
		if (documentId != null) {
			workspace.reloadDocument(documentId, text);
			return;
		}
		ProjectSnapshot project = workspace.findProjectForPath(path);
		if (project == null || ProjectDiscovery.isBuildOutputFile(path, project.getRoot())) {
			return;
		}
		workspace.addDocument(project.getId(), path, text);
	}

	private void handleBuildFileEvent(Path buildFile, FileChangeType type) throws IOException {
		Path root = buildFile.getParent();
		ProjectSnapshot existing = findProjectByRoot(root);
		if (type == FileChangeType.Deleted) {
			if (existing != null && !hasBuildFile(root)) {
				logger.info("Build file removed, unloading project {}", existing.getName());
				workspace.removeProject(existing.getId());
			}
			return;
		}
		ProjectSnapshot loaded = withOpenDocuments(ProjectDiscovery.loadProject(root, existing));
		if (existing == null) {
			logger.info("New project discovered at {}", root);
			workspace.addProject(loaded);
		} else {
			workspace.updateProject(loaded);
		}
	}

	private ProjectSnapshot findProjectByRoot(Path root) {
		for (ProjectSnapshot project : workspace.getCurrentSnapshot().getProjects()) {
			if (root.equals(project.getRoot())) {
				return project;
			}
		}
		return null;
	}

	private static boolean hasBuildFile(Path dir) {
		return Files.isRegularFile(dir.resolve("build.gradle"))
				|| Files.isRegularFile(dir.resolve("build.gradle.kts"))
				|| Files.isRegularFile(dir.resolve("pom.xml"));
	}

	// --- Workspace import support ---

	/**
	 * Replaces the disk text of documents that are open in the editor with
	 * the editor text.
	 */
	ProjectSnapshot withOpenDocuments(ProjectSnapshot project) {
		ProjectSnapshot result = project;
		for (DocumentSnapshot document : project.getDocuments()) {
			String openText = openDocuments.get(document.getPath());
			if (openText != null && !openText.equals(document.getText())) {
				result = result.withDocument(document.withText(openText));
			}
		}
		return result;
	}

	/**
	 * Drops documents of the miscellaneous-files project that now belong to a
	 * build project, e.g. files opened before the workspace import finished.
	 */
	void removeShadowedMiscellaneousDocuments() {
		for (ProjectSnapshot project : workspace.getCurrentSnapshot().getProjects()) {
			if (!project.isMiscellaneous()) {
				continue;
			}
			for (DocumentSnapshot document : project.getDocuments()) {
				ProjectSnapshot owner = workspace.findProjectForPath(document.getPath());
				if (owner != null && owner.containsDocumentAt(document.getPath())) {
					workspace.removeDocument(document.getId());
				}
			}
		}
	}

	private static String readFile(Path path) {
		try {
			return Files.readString(path, StandardCharsets.UTF_8);
		} catch (IOException e) {
			logger.warn("Cannot read {}: {}", path, e.getMessage());
			return null;
		}
	}

	/**
	 * @return the normalized file path, or {@code null} for non-file URIs
	 */
	static Path uriToPath(String uri) {
		if (uri == null) {
			return null;
		}
		try {
			return Paths.get(URI.create(uri)).toAbsolutePath().normalize();
		} catch (IllegalArgumentException | FileSystemNotFoundException e) {
			logger.debug("Ignoring non-file URI {}: {}", uri, e.getMessage());
			return null;
		}
	}
}
