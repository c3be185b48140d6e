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

import org.eclipse.lsp4j.jsonrpc.services.JsonNotification;
import org.eclipse.lsp4j.services.LanguageClient;

/**
 * Language client interface with the server's custom notifications.
 */
public interface GroovyDiagnosticsClient extends LanguageClient {

    /**
     * Notify the client of a server status change.
     *
     * @param params {@code state} is {@code "importing"}, {@code "ready"} or
     *               {@code "error"}, with an optional {@code message}
     */
    @JsonNotification("groovy/statusUpdate")
    void statusUpdate(StatusUpdateParams params);

    /**
     * Report progress of a background analysis sweep: one {@code STARTED},
     * any number of {@code PROGRESS} and one {@code FINISHED} per sweep.
     */
    @JsonNotification("groovy/backgroundDiagnosticStatus")
    void backgroundDiagnosticStatus(BackgroundDiagnosticStatusParams params);
}
