/*
 * Copyright 2025 devteam@scivicslab.com
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package com.scivicslab.nexusiac;

import java.time.Duration;

/**
 * Cancellation signal and optional deadline shared by every task of one call.
 *
 * <p>A context is canceled when {@link #cancel()} is called on it or on any of its
 * ancestors, or when its deadline passes. Blocking operations poll
 * {@link #isCancelled()} while they wait, so a single context passed to a fan-out
 * reaches every in-flight command.</p>
 *
 * <pre>{@code
 * OperationContext ctx = OperationContext.withTimeout(Duration.ofSeconds(30));
 * NexusStatus status = coordinator.status(ctx, "prod");
 * }</pre>
 *
 * @author devteam@scivicslab.com
 */
public final class OperationContext {

    private static final long NO_DEADLINE = Long.MAX_VALUE;

    private final OperationContext parent;
    private final long deadlineNanos;
    private volatile boolean cancelled;

    private OperationContext(OperationContext parent, long deadlineNanos) {
        this.parent = parent;
        this.deadlineNanos = deadlineNanos;
    }

    /**
     * Creates a context without a deadline that is only canceled explicitly.
     *
     * @return a new root context
     */
    public static OperationContext background() {
        return new OperationContext(null, NO_DEADLINE);
    }

    /**
     * Creates a root context that expires after the given timeout.
     *
     * @param timeout the time budget
     * @return a new root context
     */
    public static OperationContext withTimeout(Duration timeout) {
        return new OperationContext(null, deadlineAfter(timeout));
    }

    /**
     * Creates a child context. The child is canceled when this context is,
     * and expires at the earlier of the two deadlines.
     *
     * @param timeout the child's own time budget
     * @return the child context
     */
    public OperationContext child(Duration timeout) {
        return new OperationContext(this, Math.min(deadlineNanos, deadlineAfter(timeout)));
    }

    private static long deadlineAfter(Duration timeout) {
        long now = System.nanoTime();
        long budget;
        try {
            budget = timeout.toNanos();
        } catch (ArithmeticException e) {
            return NO_DEADLINE;
        }
        long deadline = now + budget;
        // overflow means "effectively never"
        return deadline < now ? NO_DEADLINE : deadline;
    }

    /**
     * Cancels this context and every context derived from it.
     */
    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled
            || isDeadlineExceeded()
            || (parent != null && parent.isCancelled());
    }

    public boolean isDeadlineExceeded() {
        return deadlineNanos != NO_DEADLINE && System.nanoTime() - deadlineNanos >= 0;
    }

    /**
     * Gets the time left before the deadline.
     *
     * @return the remaining time, {@link Duration#ZERO} if expired, or
     *         a very long duration if there is no deadline
     */
    public Duration remaining() {
        if (deadlineNanos == NO_DEADLINE) {
            return Duration.ofNanos(Long.MAX_VALUE);
        }
        long left = deadlineNanos - System.nanoTime();
        return left <= 0 ? Duration.ZERO : Duration.ofNanos(left);
    }

    /**
     * Describes why the context is no longer usable.
     *
     * @return "deadline exceeded" or "operation canceled"
     */
    public String cancellationReason() {
        return isDeadlineExceeded() ? "deadline exceeded" : "operation canceled";
    }

    /**
     * Fails fast if the context was already canceled.
     *
     * @param hostId the host the caller is about to work on
     * @throws CommandCanceledException if the context is canceled or expired
     */
    public void throwIfCancelled(String hostId) throws CommandCanceledException {
        if (isCancelled()) {
            throw new CommandCanceledException(hostId, cancellationReason());
        }
    }
}
