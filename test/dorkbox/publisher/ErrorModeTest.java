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
package dorkbox.publisher;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import dorkbox.publisher.callback.Callback2;
import dorkbox.publisher.common.PublisherTest;
import dorkbox.publisher.error.IPublicationErrorHandler;
import dorkbox.publisher.error.PublicationError;
import dorkbox.publisher.listeners.ExceptionThrowingListener;
import dorkbox.publisher.listeners.RecordingListener;
import dorkbox.publisher.subscription.WeakSubscription;

/**
 * Verify that callback failures either propagate to the publishing owner, or are reported while the publication continues
 *
 * @author dorkbox, llc
 */
public
class ErrorModeTest extends PublisherTest {

    @Test
    public
    void testFailurePropagatesAndAbortsPublication() {
        RecordingListener a = new RecordingListener("A", log).subscribeTo(publisher);
        ExceptionThrowingListener thrower = new ExceptionThrowingListener("T", log);
        thrower.subscribeTo(publisher);
        RecordingListener c = new RecordingListener("C", log).subscribeTo(publisher);

        try {
            publish(5, "x");
            fail("The callback failure should have propagated");
        } catch (IllegalStateException e) {
            assertEquals("Thrown by T", e.getMessage());
        }

        assertEquals(Arrays.asList("A:5,x", "T:5,x"), log);
        assertEquals(1, a.getTimesHandled());
        assertEquals(0, c.getTimesHandled());

        // the strong reference taken for the failed invocation was given back
        WeakSubscription<Callback2<Integer, String>> observation = thrower.getSubscription().observe();
        thrower.release();
        assertTrue(observation.isExpired());
    }

    @Test
    public
    void testPublicationContinuesAfterFailureWhenIsolated() {
        final List<PublicationError> errors = new ArrayList<PublicationError>();

        Publisher<Callback2<Integer, String>> isolated = new Publisher<Callback2<Integer, String>>(ErrorMode.Isolate);
        isolated.addErrorHandler(new IPublicationErrorHandler() {
            @Override
            public
            void handleError(final PublicationError error) {
                errors.add(error);
            }
        });
        Dispatcher<Callback2<Integer, String>> isolatedDispatcher = isolated.dispatcher();

        RecordingListener a = new RecordingListener("A", log).subscribeTo(isolated);
        ExceptionThrowingListener thrower = new ExceptionThrowingListener("T", log);
        thrower.subscribeTo(isolated);
        RecordingListener c = new RecordingListener("C", log).subscribeTo(isolated);

        isolatedDispatcher.publish(Callback2.args(5, "x"));

        assertEquals(Arrays.asList("A:5,x", "T:5,x", "C:5,x"), log);
        assertEquals(1, a.getTimesHandled());
        assertEquals(1, c.getTimesHandled());

        assertEquals(1, errors.size());
        PublicationError error = errors.get(0);
        assertTrue(error.getCause() instanceof IllegalStateException);
        assertEquals("Thrown by T", error.getCause().getMessage());
        assertArrayEquals(new Object[] {5, "x"}, error.getPublishedObjects());
        assertSame(thrower.getSubscription().callback(), error.getCallback());

        // a failing subscriber keeps its subscription
        isolatedDispatcher.publish(Callback2.args(6, "y"));
        assertEquals(2, thrower.getTimesHandled());
        assertEquals(2, errors.size());
    }

    @Test
    public
    void testIsolatedFailureWithoutErrorHandlerIsLogged() {
        Publisher<Callback2<Integer, String>> isolated = new Publisher<Callback2<Integer, String>>(ErrorMode.Isolate);
        Dispatcher<Callback2<Integer, String>> isolatedDispatcher = isolated.dispatcher();

        ExceptionThrowingListener thrower = new ExceptionThrowingListener("T", log);
        thrower.subscribeTo(isolated);
        RecordingListener c = new RecordingListener("C", log).subscribeTo(isolated);

        isolatedDispatcher.publish(Callback2.args(1, "logged"));

        assertEquals(1, thrower.getTimesHandled());
        assertEquals(1, c.getTimesHandled());
    }
}
