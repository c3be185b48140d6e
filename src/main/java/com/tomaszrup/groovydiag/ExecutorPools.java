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

import java.util.List;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.groovydiag.util.MdcProjectContext;

/**
 * Centralized thread pool management for the diagnostics server.
 *
 * <ul>
 *   <li><b>Scheduling pool</b>: per-document analysis timeouts and query
 *       timeouts. Tasks only flip cancellation tokens.</li>
 *   <li><b>Analysis pool</b>: cached pool that runs analyzer invocations.
 *       Workers wait on these with a timeout, so a hung analyzer occupies an
 *       analysis thread, never a worker.</li>
 *   <li><b>Request pool</b>: LSP requests that block on the work queue
 *       ({@code groovy/getDiagnostics} and friends), keeping lsp4j's message
 *       thread free.</li>
 *   <li><b>Import pool</b>: single thread for project discovery and
 *       loading, so workspace reloads are applied in order.</li>
 * </ul>
 *
 * <p>All threads are daemons and every pool propagates the caller's SLF4J MDC
 * context. Call {@link #shutdownAll()} on server shutdown.</p>
 */
public class ExecutorPools {

    private static final Logger logger = LoggerFactory.getLogger(ExecutorPools.class);

    private final ScheduledExecutorService schedulingPool;
    private final ExecutorService analysisPool;
    private final ExecutorService requestPool;
    private final ExecutorService importPool;

    public ExecutorPools() {
        this.schedulingPool = new MdcScheduledExecutorService(
                Executors.newScheduledThreadPool(1, daemonThreadFactory("groovydiag-scheduler")));
        this.analysisPool = new MdcExecutorService(
                Executors.newCachedThreadPool(daemonThreadFactory("groovydiag-analysis")));
        this.requestPool = new MdcExecutorService(
                Executors.newCachedThreadPool(daemonThreadFactory("groovydiag-request")));
        this.importPool = new MdcExecutorService(
                Executors.newSingleThreadExecutor(daemonThreadFactory("groovydiag-import")));
    }

    /** Daemon thread factory naming threads {@code prefix-1}, {@code prefix-2}, ... */
    public static ThreadFactory daemonThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    public ScheduledExecutorService getSchedulingPool() {
        return schedulingPool;
    }

    public ExecutorService getAnalysisPool() {
        return analysisPool;
    }

    public ExecutorService getRequestPool() {
        return requestPool;
    }

    public ExecutorService getImportPool() {
        return importPool;
    }

    /**
     * Shut down all pools, interrupting running tasks, and wait up to 5
     * seconds for each.
     */
    public void shutdownAll() {
        logger.debug("Shutting down executor pools");
        schedulingPool.shutdownNow();
        analysisPool.shutdownNow();
        requestPool.shutdownNow();
        importPool.shutdownNow();
        try {
            schedulingPool.awaitTermination(5, TimeUnit.SECONDS);
            analysisPool.awaitTermination(5, TimeUnit.SECONDS);
            requestPool.awaitTermination(5, TimeUnit.SECONDS);
            importPool.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // -----------------------------------------------------------------------
    // MDC-propagating executor wrappers
    // -----------------------------------------------------------------------

    /**
     * Wraps an {@link ExecutorService} so that every submitted task
     * inherits the submitting thread's MDC context. The {@code submit} and
     * {@code invoke*} methods of {@link AbstractExecutorService} all funnel
     * through {@link #execute(Runnable)}.
     */
    private static class MdcExecutorService extends AbstractExecutorService {
        protected final ExecutorService delegate;

        MdcExecutorService(ExecutorService delegate) {
            this.delegate = delegate;
        }

        @Override public void execute(Runnable command) {
            delegate.execute(MdcProjectContext.wrap(command));
        }

        @Override public void shutdown() { delegate.shutdown(); }
        @Override public List<Runnable> shutdownNow() { return delegate.shutdownNow(); }
        @Override public boolean isShutdown() { return delegate.isShutdown(); }
        @Override public boolean isTerminated() { return delegate.isTerminated(); }
        @Override public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
            return delegate.awaitTermination(timeout, unit);
        }
    }

    private static class MdcScheduledExecutorService extends MdcExecutorService
            implements ScheduledExecutorService {
        private final ScheduledExecutorService scheduledDelegate;

        MdcScheduledExecutorService(ScheduledExecutorService delegate) {
            super(delegate);
            this.scheduledDelegate = delegate;
        }

        @Override
        public ScheduledFuture<?> schedule(Runnable command, long delay, TimeUnit unit) {
            return scheduledDelegate.schedule(MdcProjectContext.wrap(command), delay, unit);
        }

        @Override
        public <V> ScheduledFuture<V> schedule(Callable<V> callable, long delay, TimeUnit unit) {
            return scheduledDelegate.schedule(MdcProjectContext.wrapCallable(callable), delay, unit);
        }

        @Override
        public ScheduledFuture<?> scheduleAtFixedRate(Runnable command, long initialDelay,
                long period, TimeUnit unit) {
            return scheduledDelegate.scheduleAtFixedRate(
                    MdcProjectContext.wrap(command), initialDelay, period, unit);
        }

        @Override
        public ScheduledFuture<?> scheduleWithFixedDelay(Runnable command, long initialDelay,
                long delay, TimeUnit unit) {
            return scheduledDelegate.scheduleWithFixedDelay(
                    MdcProjectContext.wrap(command), initialDelay, delay, unit);
        }
    }
}
