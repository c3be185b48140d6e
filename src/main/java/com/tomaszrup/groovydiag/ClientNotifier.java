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

import java.util.ArrayList;

import org.eclipse.lsp4j.MessageParams;
import org.eclipse.lsp4j.MessageType;
import org.eclipse.lsp4j.PublishDiagnosticsParams;
import org.eclipse.lsp4j.services.LanguageClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.groovydiag.worker.BackgroundDiagnosticStatus;
import com.tomaszrup.groovydiag.worker.BackgroundStatusSink;
import com.tomaszrup.groovydiag.worker.DiagnosticsSink;
import com.tomaszrup.groovydiag.worker.DocumentDiagnostics;

/**
 * Forwards worker output to the connected client. Nothing is sent before
 * {@link #connect(LanguageClient)}; custom notifications are only sent to a
 * {@link GroovyDiagnosticsClient}.
 */
public class ClientNotifier implements DiagnosticsSink, BackgroundStatusSink {
	private static final Logger logger = LoggerFactory.getLogger(ClientNotifier.class);

	private volatile LanguageClient client;

	public void connect(LanguageClient client) {
		this.client = client;
	}

	@Override
	public void publish(DocumentDiagnostics diagnostics) {
		LanguageClient current = client;
		if (current == null) {
			return;
		}
		current.publishDiagnostics(new PublishDiagnosticsParams(diagnostics.getFilePath().toUri().toString(),
				new ArrayList<>(diagnostics.getDiagnostics())));
	}

	@Override
	public void reportBackgroundStatus(BackgroundDiagnosticStatus status, int projectCount, int documentCount,
			int remaining) {
		LanguageClient current = client;
		if (current instanceof GroovyDiagnosticsClient) {
			((GroovyDiagnosticsClient) current).backgroundDiagnosticStatus(
					new BackgroundDiagnosticStatusParams(status, projectCount, documentCount, remaining));
		}
	}

	public void statusUpdate(String state, String message) {
		LanguageClient current = client;
		if (current instanceof GroovyDiagnosticsClient) {
			try {
				((GroovyDiagnosticsClient) current).statusUpdate(new StatusUpdateParams(state, message));
			} catch (RuntimeException e) {
				logger.debug("Failed to send statusUpdate: {}", e.getMessage());
			}
		}
	}

	public void logMessage(MessageType type, String message) {
		LanguageClient current = client;
		if (current != null) {
			current.logMessage(new MessageParams(type, message));
		}
	}
}
