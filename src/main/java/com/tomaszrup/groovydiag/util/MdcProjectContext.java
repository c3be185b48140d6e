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
package com.tomaszrup.groovydiag.util;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Manages the SLF4J MDC key {@code "project"} so that every log line written
 * while a document is analyzed carries the name of its project.
 *
 * <h3>Usage at entry points (worker loop, request handlers):</h3>
 * <pre>{@code
 * MdcProjectContext.setProject(project.getName());
 * try {
 *     // ... all log calls inside here will include [project-name]
 * } finally {
 *     MdcProjectContext.clear();
 * }
 * }</pre>
 *
 * <p>Use {@link #wrap(Runnable)} to carry the current context into another
 * thread.</p>
 */
public final class MdcProjectContext {

    /** MDC key used in the logback pattern via {@code %X{project}}. */
    public static final String MDC_KEY = "project";

    private MdcProjectContext() {
        // utility class
    }

    /**
     * Labels the current thread with a project name. A {@code null} name is
     * logged as {@code default}.
     */
    public static void setProject(String projectName) {
        MDC.put(MDC_KEY, projectName != null ? projectName : "default");
    }

    public static void clear() {
        MDC.remove(MDC_KEY);
    }

    /**
     * @return the current MDC context map, or null if empty
     */
    public static Map<String, String> snapshot() {
        return MDC.getCopyOfContextMap();
    }

    /**
     * Restores a previously captured MDC context map on the current thread.
     *
     * @param contextMap the context map to restore (may be null)
     */
    public static void restore(Map<String, String> contextMap) {
        if (contextMap != null) {
            MDC.setContextMap(contextMap);
        } else {
            MDC.clear();
        }
    }

    /**
     * Wraps a {@link Runnable} so that the caller's MDC context is restored in
     * the executing thread, and the executing thread's own context is put
     * back afterwards.
     */
    public static Runnable wrap(Runnable task) {
        Map<String, String> callerContext = snapshot();
        return () -> {
            Map<String, String> previousContext = snapshot();
            restore(callerContext);
            try {
                task.run();
            } finally {
                restore(previousContext);
            }
        };
    }

    /**
     * {@link Callable} counterpart of {@link #wrap(Runnable)}.
     */
    public static <T> Callable<T> wrapCallable(Callable<T> task) {
        Map<String, String> callerContext = snapshot();
        return () -> {
            Map<String, String> previousContext = snapshot();
            restore(callerContext);
            try {
                return task.call();
            } finally {
                restore(previousContext);
            }
        };
    }
}
