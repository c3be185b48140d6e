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
package com.tomaszrup.groovydiag.analysis;

import java.util.ArrayList;
import java.util.List;

import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.DiagnosticSeverity;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.jsonrpc.CancelChecker;

import com.tomaszrup.groovydiag.workspace.DocumentSnapshot;

/**
 * Flags lines longer than the {@code max_line_length} set in the project's
 * {@code .editorconfig}. Does nothing when the property is absent or
 * {@code off}.
 */
public class LineLengthAnalyzer implements DocumentAnalyzer {
	public static final String ID = "line-length";
	public static final String MAX_LINE_LENGTH = "max_line_length";

	private static final int CANCEL_CHECK_INTERVAL = 256;

	@Override
	public String getId() {
		return ID;
	}

	@Override
	public List<Diagnostic> analyze(AnalysisContext context, DocumentSnapshot document, CancelChecker cancelChecker) {
		List<Diagnostic> diagnostics = new ArrayList<>();
		int maxLength = context.getOptions().getInt(MAX_LINE_LENGTH, -1);
		if (maxLength <= 0) {
			return diagnostics;
		}
		String[] lines = document.getText().split("\\r?\\n", -1);
		for (int i = 0; i < lines.length; i++) {
			if (i % CANCEL_CHECK_INTERVAL == 0) {
				cancelChecker.checkCanceled();
			}
			int length = lines[i].length();
			if (length <= maxLength) {
				continue;
			}
			Diagnostic diagnostic = new Diagnostic();
			diagnostic.setRange(new Range(new Position(i, maxLength), new Position(i, length)));
			diagnostic.setSeverity(DiagnosticSeverity.Information);
			diagnostic.setMessage("Line is longer than " + maxLength + " characters (" + length + ")");
			diagnostic.setCode(ID);
			diagnostic.setSource("editorconfig");
			diagnostics.add(diagnostic);
		}
		return diagnostics;
	}
}
