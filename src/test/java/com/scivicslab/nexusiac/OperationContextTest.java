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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for OperationContext.
 *
 * @author devteam@scivicslab.com
 */
@DisplayName("OperationContext Tests")
class OperationContextTest {

    @Test
    @DisplayName("Background context is never canceled on its own")
    void testBackground() throws Exception {
        OperationContext ctx = OperationContext.background();

        assertFalse(ctx.isCancelled());
        assertFalse(ctx.isDeadlineExceeded());
        ctx.throwIfCancelled("web1");
    }

    @Test
    @DisplayName("Cancel propagates from parent to child but not back")
    void testCancelPropagation() {
        OperationContext parent = OperationContext.background();
        OperationContext child = parent.child(Duration.ofMinutes(5));
        OperationContext sibling = parent.child(Duration.ofMinutes(5));

        child.cancel();
        assertTrue(child.isCancelled());
        assertFalse(parent.isCancelled());
        assertFalse(sibling.isCancelled());

        parent.cancel();
        assertTrue(sibling.isCancelled());
        assertEquals("operation canceled", sibling.cancellationReason());
    }

    @Test
    @DisplayName("Expired deadline cancels the context")
    void testDeadline() throws Exception {
        OperationContext ctx = OperationContext.withTimeout(Duration.ofMillis(1));
        Thread.sleep(20);

        assertTrue(ctx.isCancelled());
        assertEquals(Duration.ZERO, ctx.remaining());
        CommandCanceledException e = assertThrows(CommandCanceledException.class, () -> ctx.throwIfCancelled("db1"));
        assertEquals("db1", e.getHostId());
        assertTrue(e.getMessage().contains("deadline exceeded"));
    }

    @Test
    @DisplayName("Child expires no later than its parent")
    void testChildDeadlineBoundedByParent() {
        OperationContext parent = OperationContext.withTimeout(Duration.ofSeconds(1));
        OperationContext child = parent.child(Duration.ofHours(1));

        assertTrue(child.remaining().compareTo(Duration.ofSeconds(1)) <= 0);
    }

    @Test
    @DisplayName("Huge timeouts do not overflow into the past")
    void testHugeTimeout() {
        OperationContext ctx = OperationContext.withTimeout(Duration.ofSeconds(Long.MAX_VALUE));

        assertFalse(ctx.isCancelled());
    }
}
