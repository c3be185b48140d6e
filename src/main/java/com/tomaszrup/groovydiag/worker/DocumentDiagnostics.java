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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.eclipse.lsp4j.Diagnostic;

import com.tomaszrup.groovydiag.workspace.DocumentId;
import com.tomaszrup.groovydiag.workspace.ProjectId;

/**
 * Latest diagnostics computed for one document. Replaced wholesale on every
 * analysis; never merged.
 */
public final class DocumentDiagnostics {
	private final DocumentId documentId;
	private final Path filePath;
	private final ProjectId projectId;
	private final String projectName;
	private final List<Diagnostic> diagnostics;

	public DocumentDiagnostics(DocumentId documentId, Path filePath, ProjectId projectId, String projectName,
			List<Diagnostic> diagnostics) {
		this.documentId = documentId;
		this.filePath = filePath;
		this.projectId = projectId;
		this.projectName = projectName;
		this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
	}

	public DocumentId getDocumentId() {
		return documentId;
	}

	public Path getFilePath() {
		return filePath;
	}

	public ProjectId getProjectId() {
		return projectId;
	}

	public String getProjectName() {
		return projectName;
	}

	public List<Diagnostic> getDiagnostics() {
		return diagnostics;
	}

	@Override
	public String toString() {
		return "DocumentDiagnostics{" + filePath + ", project=" + projectName + ", diagnostics="
				+ diagnostics.size() + "}";
	}
}
