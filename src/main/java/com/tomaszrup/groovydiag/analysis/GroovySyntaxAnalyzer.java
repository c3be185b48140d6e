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
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.codehaus.groovy.GroovyBugError;
import org.codehaus.groovy.control.CompilationFailedException;
import org.codehaus.groovy.control.CompilationUnit;
import org.codehaus.groovy.control.Phases;
import org.codehaus.groovy.control.ProcessingUnit;
import org.codehaus.groovy.control.messages.ExceptionMessage;
import org.codehaus.groovy.control.messages.Message;
import org.codehaus.groovy.control.messages.SyntaxErrorMessage;
import org.codehaus.groovy.syntax.SyntaxException;
import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.DiagnosticSeverity;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.jsonrpc.CancelChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.groovydiag.workspace.DocumentSnapshot;

/**
 * Parses a document with the Groovy compiler up to the CONVERSION phase and
 * reports the syntax errors it collects.
 *
 * <p>Only the document itself is compiled, without a classpath, so
 * unresolved types are never reported. The compiler's progress callback is
 * used as a cancellation point between phases.</p>
 */
public class GroovySyntaxAnalyzer implements DocumentAnalyzer {
	private static final Logger logger = LoggerFactory.getLogger(GroovySyntaxAnalyzer.class);

	public static final String ID = "groovy";

	@Override
	public String getId() {
		return ID;
	}

	@Override
	public boolean isSyntaxOnly() {
		return true;
	}

	@Override
	public List<Diagnostic> analyze(AnalysisContext context, DocumentSnapshot document, CancelChecker cancelChecker) {
		cancelChecker.checkCanceled();
		CompilationUnit compilationUnit = new CompilationUnit(context.getCompilerConfiguration());
		compilationUnit.setProgressCallback(new CompilationUnit.ProgressCallback() {
			@Override
			public void call(ProcessingUnit unit, int phase) {
				cancelChecker.checkCanceled();
			}
		});
		compilationUnit.addSource(document.getPath().toString(), document.getText());
		try {
			compilationUnit.compile(Phases.CONVERSION);
		} catch (CompilationFailedException e) {
			logger.trace("Compilation of {} failed: {}", document.getPath(), e.getMessage());
		} catch (GroovyBugError e) {
			logger.debug("Groovy compiler bug while parsing {}: {}", document.getPath(), e.getMessage());
		}
		cancelChecker.checkCanceled();

		List<? extends Message> errors = compilationUnit.getErrorCollector().getErrors();
		if (errors == null || errors.isEmpty()) {
			return new ArrayList<>();
		}
		List<Diagnostic> diagnostics = new ArrayList<>();
		Set<String> seen = new HashSet<>();
		for (Message message : errors) {
			Diagnostic diagnostic = toDiagnostic(message);
			if (diagnostic == null) {
				continue;
			}
			// the compiler may report the same error more than once
			String key = diagnostic.getRange() + "|" + diagnostic.getMessage() + "|" + diagnostic.getSeverity();
			if (seen.add(key)) {
				diagnostics.add(diagnostic);
			}
		}
		logger.debug("{} syntax diagnostic(s) in {}", diagnostics.size(), document.getPath());
		return diagnostics;
	}

	private Diagnostic toDiagnostic(Message message) {
		if (message instanceof SyntaxErrorMessage) {
			SyntaxException cause = ((SyntaxErrorMessage) message).getCause();
			Range range = syntaxExceptionToRange(cause);
			if (range == null) {
				range = emptyRange();
			}
			// non-fatal parser errors are still errors; warnings are collected separately
			return createDiagnostic(range, cause.getOriginalMessage(), DiagnosticSeverity.Error);
		}
		if (message instanceof ExceptionMessage) {
			Exception cause = ((ExceptionMessage) message).getCause();
			String text = cause != null && cause.getMessage() != null ? cause.getMessage() : String.valueOf(cause);
			return createDiagnostic(emptyRange(), text, DiagnosticSeverity.Error);
		}
		return null;
	}

	private static Diagnostic createDiagnostic(Range range, String message, DiagnosticSeverity severity) {
		Diagnostic diagnostic = new Diagnostic();
		diagnostic.setRange(range);
		diagnostic.setSeverity(severity);
		diagnostic.setMessage(message);
		diagnostic.setSource(ID);
		return diagnostic;
	}

	/**
	 * Converts the 1-based line/column span of a syntax exception to a 0-based
	 * LSP range.
	 *
	 * @return the range, or {@code null} if the exception has no position
	 */
	static Range syntaxExceptionToRange(SyntaxException exception) {
		int startLine = exception.getStartLine();
		int endLine = exception.getEndLine();
		if (startLine < 1 || endLine < 1) {
			return null;
		}
		int startColumn = Math.max(0, exception.getStartColumn() - 1);
		int endColumn = Math.max(0, exception.getEndColumn() - 1);
		Position start = new Position(startLine - 1, startColumn);
		Position end = endLine < startLine ? start : new Position(endLine - 1, endColumn);
		return new Range(start, end);
	}

	private static Range emptyRange() {
		return new Range(new Position(0, 0), new Position(0, 0));
	}
}
