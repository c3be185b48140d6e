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
 * Payload of {@code groovy/statusUpdate}, which tracks the workspace import
 * rather than diagnostics. The server goes {@link #IMPORTING} then
 * {@link #READY} once projects are loaded and the background sweep is
 * queued, or {@link #ERROR} when project discovery fails. Per-file progress
 * is reported through {@code groovy/backgroundDiagnosticStatus} instead.
 */
public class StatusUpdateParams {

    public static final String IMPORTING = "importing";
    public static final String READY = "ready";
    public static final String ERROR = "error";

    private String state;

    /** Project and file counts, or the failure reason; may be {@code null}. */
    private String message;

    public StatusUpdateParams() {
    }

    public StatusUpdateParams(String state, String message) {
        this.state = state;
        this.message = message;
    }

    public String getState() {
        return state;
    }

    public void setState(String state) {
        this.state = state;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }
}
