/*
 * Copyright 2026 dorkbox, llc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dorkbox.publisher.error;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import dorkbox.publisher.common.AssertSupport;

/**
 * Verify the error handler chain and its fallback to the default logger
 *
 * @author dorkbox, llc
 */
public
class ErrorHandlerTest extends AssertSupport {

    private static
    PublicationError createError() {
        return new PublicationError().setMessage("Error during publication of message.")
                                     .setCause(new IllegalStateException("broken"))
                                     .setPublishedObjects(1, "one");
    }

    @Test
    public
    void testDefaultLoggerIsInstalledLazily() {
        ErrorHandler errorHandler = new ErrorHandler();
        assertEquals(0, errorHandler.size());

        errorHandler.handlePublicationError(createError());
        assertEquals(1, errorHandler.size());

        errorHandler.handlePublicationError(createError());
        assertEquals(1, errorHandler.size());
    }

    @Test
    public
    void testHandlersAreCalledInOrder() {
        final List<String> calls = new ArrayList<String>();

        ErrorHandler errorHandler = new ErrorHandler();
        errorHandler.addErrorHandler(error -> calls.add("first " + error.getCause().getMessage()));
        errorHandler.addErrorHandler(error -> calls.add("second " + error.getCause().getMessage()));

        errorHandler.handlePublicationError(createError());

        assertEquals(Arrays.asList("first broken", "second broken"), calls);
        // no default logger was added
        assertEquals(2, errorHandler.size());
    }

    @Test(expected = NullPointerException.class)
    public
    void testNullHandler() {
        new ErrorHandler().addErrorHandler(null);
    }

    @Test
    public
    void testPublicationErrorDescription() {
        PublicationError error = createError().setCallback("callback");

        String description = error.toString();
        assertTrue(description.contains("Error during publication of message."));
        assertTrue(description.contains("[1, one]"));
        assertTrue(description.contains("broken"));
        assertTrue(description.contains("callback"));

        // the published objects cannot be changed from outside
        error.getPublishedObjects()[0] = 2;
        assertArrayEquals(new Object[] {1, "one"}, error.getPublishedObjects());
    }
}
