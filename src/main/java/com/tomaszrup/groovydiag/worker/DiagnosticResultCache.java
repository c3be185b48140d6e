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
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.tomaszrup.groovydiag.workspace.DocumentId;

/**
 * Latest {@link DocumentDiagnostics} per document, last writer wins.
 */
public class DiagnosticResultCache {
	private final Map<DocumentId, DocumentDiagnostics> entries = new ConcurrentHashMap<>();

	public void put(DocumentDiagnostics diagnostics) {
		entries.put(diagnostics.getDocumentId(), diagnostics);
	}

	public DocumentDiagnostics get(DocumentId documentId) {
		return entries.get(documentId);
	}

	/** @return the removed entry, or {@code null} if there was none */
	public DocumentDiagnostics remove(DocumentId documentId) {
		return entries.remove(documentId);
	}

	public boolean contains(DocumentId documentId) {
		return entries.containsKey(documentId);
	}

	/** Entries for the given documents, in argument order, skipping documents with no entry. */
	public List<DocumentDiagnostics> getAll(Collection<DocumentId> documentIds) {
		List<DocumentDiagnostics> result = new ArrayList<>();
		for (DocumentId documentId : documentIds) {
			DocumentDiagnostics diagnostics = entries.get(documentId);
			if (diagnostics != null) {
				result.add(diagnostics);
			}
		}
		return result;
	}

	public List<DocumentDiagnostics> values() {
		return new ArrayList<>(entries.values());
	}

	public int size() {
		return entries.size();
	}
}
