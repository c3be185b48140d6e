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
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable view of a project: its documents and the analyzer configuration
 * documents ({@code .editorconfig}) that apply to them.
 *
 * <p>All {@code with*} methods return a modified copy.</p>
 */
public final class ProjectSnapshot {
	private final ProjectId id;
	private final String name;
	private final Path root;
	private final boolean miscellaneous;
	private final Map<DocumentId, DocumentSnapshot> documents;
	private final Map<Path, DocumentId> documentsByPath;
	private final List<Path> analyzerConfigPaths;

	public ProjectSnapshot(ProjectId id, String name, Path root, boolean miscellaneous,
			Collection<DocumentSnapshot> documents, Collection<Path> analyzerConfigPaths) {
		this.id = Objects.requireNonNull(id, "id");
		this.name = Objects.requireNonNull(name, "name");
		this.root = root != null ? root.toAbsolutePath().normalize() : null;
		this.miscellaneous = miscellaneous;
		Map<DocumentId, DocumentSnapshot> docs = new LinkedHashMap<>();
		Map<Path, DocumentId> byPath = new HashMap<>();
		for (DocumentSnapshot document : documents) {
			if (!id.equals(document.getProjectId())) {
				throw new IllegalArgumentException(document + " does not belong to project " + name);
			}
			docs.put(document.getId(), document);
			byPath.put(document.getPath().toAbsolutePath().normalize(), document.getId());
		}
		this.documents = Collections.unmodifiableMap(docs);
		this.documentsByPath = byPath;
		List<Path> configs = new ArrayList<>();
		for (Path configPath : analyzerConfigPaths) {
			configs.add(configPath.toAbsolutePath().normalize());
		}
		this.analyzerConfigPaths = Collections.unmodifiableList(configs);
	}

	/**
	 * Creates an empty project rooted at {@code root}.
	 */
	public static ProjectSnapshot create(String name, Path root) {
		return new ProjectSnapshot(ProjectId.create(name), name, root, false,
				Collections.emptyList(), Collections.emptyList());
	}

	public ProjectId getId() {
		return id;
	}

	public String getName() {
		return name;
	}

	/** Project root directory, or {@code null} for the miscellaneous-files project. */
	public Path getRoot() {
		return root;
	}

	/**
	 * Whether this is the catch-all project for documents that are open in
	 * the editor but belong to no discovered build project.
	 */
	public boolean isMiscellaneous() {
		return miscellaneous;
	}

	public Collection<DocumentSnapshot> getDocuments() {
		return documents.values();
	}

	public List<DocumentId> getDocumentIds() {
		return new ArrayList<>(documents.keySet());
	}

	public DocumentSnapshot getDocument(DocumentId documentId) {
		return documents.get(documentId);
	}

	public boolean containsDocument(DocumentId documentId) {
		return documents.containsKey(documentId);
	}

	public int getDocumentCount() {
		return documents.size();
	}

	/** @return the id of the document at {@code path}, or {@code null} */
	public DocumentId getDocumentIdAt(Path path) {
		return documentsByPath.get(path.toAbsolutePath().normalize());
	}

	public boolean containsDocumentAt(Path path) {
		return getDocumentIdAt(path) != null;
	}

	public List<Path> getAnalyzerConfigPaths() {
		return analyzerConfigPaths;
	}

	/** Adds a new document or replaces an existing one with the same id. */
	public ProjectSnapshot withDocument(DocumentSnapshot document) {
		Map<DocumentId, DocumentSnapshot> docs = new LinkedHashMap<>(documents);
		docs.put(document.getId(), document);
		return new ProjectSnapshot(id, name, root, miscellaneous, docs.values(), analyzerConfigPaths);
	}

	public ProjectSnapshot withoutDocument(DocumentId documentId) {
		Map<DocumentId, DocumentSnapshot> docs = new LinkedHashMap<>(documents);
		docs.remove(documentId);
		return new ProjectSnapshot(id, name, root, miscellaneous, docs.values(), analyzerConfigPaths);
	}

	public ProjectSnapshot withAnalyzerConfigPaths(Collection<Path> configPaths) {
		return new ProjectSnapshot(id, name, root, miscellaneous, documents.values(), configPaths);
	}

	@Override
	public String toString() {
		return "ProjectSnapshot{" + name + ", documents=" + documents.size() + "}";
	}
}
