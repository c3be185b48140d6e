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
import java.util.Objects;

/**
 * Immutable view of a single source document at one point in time.
 */
public final class DocumentSnapshot {
	private final DocumentId id;
	private final ProjectId projectId;
	private final Path path;
	private final String text;

	public DocumentSnapshot(DocumentId id, ProjectId projectId, Path path, String text) {
		this.id = Objects.requireNonNull(id, "id");
		this.projectId = Objects.requireNonNull(projectId, "projectId");
		this.path = Objects.requireNonNull(path, "path").toAbsolutePath().normalize();
		this.text = text != null ? text : "";
	}

	public DocumentId getId() {
		return id;
	}

	public ProjectId getProjectId() {
		return projectId;
	}

	public Path getPath() {
		return path;
	}

	public String getName() {
		Path fileName = path.getFileName();
		return fileName != null ? fileName.toString() : path.toString();
	}

	public String getText() {
		return text;
	}

	public DocumentSnapshot withText(String newText) {
		return new DocumentSnapshot(id, projectId, path, newText);
	}

	public DocumentSnapshot withPath(Path newPath) {
		return new DocumentSnapshot(id, projectId, newPath, text);
	}

	@Override
	public String toString() {
		return "DocumentSnapshot{" + path + "}";
	}
}
