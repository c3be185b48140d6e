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

import java.util.UUID;

/**
 * Opaque identity of a project, i.e. a group of documents that share one
 * compilation context.
 */
public final class ProjectId {
	private final UUID id;
	private final String debugName;

	private ProjectId(UUID id, String debugName) {
		this.id = id;
		this.debugName = debugName;
	}

	public static ProjectId create(String debugName) {
		return new ProjectId(UUID.randomUUID(), debugName);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof ProjectId)) {
			return false;
		}
		return id.equals(((ProjectId) obj).id);
	}

	@Override
	public int hashCode() {
		return id.hashCode();
	}

	@Override
	public String toString() {
		return "ProjectId(" + debugName + ")";
	}
}
