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

/**
 * Shared constants for custom client↔server protocol messages.
 */
public final class Protocol {

	private Protocol() {
	}

	/**
	 * Custom protocol contract version between the client extension and server.
	 */
	public static final String VERSION = "1";

	public static final String REQUEST_GET_DIAGNOSTICS = "groovy/getDiagnostics";
	public static final String REQUEST_GET_ALL_DIAGNOSTICS = "groovy/getAllDiagnostics";
	public static final String REQUEST_QUEUE_DIAGNOSTICS = "groovy/queueDiagnostics";
	public static final String REQUEST_ANALYZE_DOCUMENT = "groovy/analyzeDocument";
	public static final String REQUEST_ANALYZE_PROJECT = "groovy/analyzeProject";
	public static final String REQUEST_GET_PROTOCOL_VERSION = "groovy/getProtocolVersion";

	public static final String NOTIFICATION_STATUS_UPDATE = "groovy/statusUpdate";
	public static final String NOTIFICATION_BACKGROUND_DIAGNOSTIC_STATUS = "groovy/backgroundDiagnosticStatus";
}
