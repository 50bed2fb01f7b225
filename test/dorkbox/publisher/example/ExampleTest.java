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
package dorkbox.publisher.example;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import dorkbox.publisher.common.AssertSupport;

/**
 * Runs the owner and listener pair end to end
 *
 * @author dorkbox, llc
 */
public
class ExampleTest extends AssertSupport {

    @Test
    public
    void testClientsListenOnce() {
        Primary primary = new Primary();

        List<Client> clients = new ArrayList<Client>();
        for (int i = 0; i < 3; i++) {
            clients.add(new Client(primary));
        }
        assertEquals(3, primary.subscriberCount());

        primary.doSomething(1, "hello");

        for (Client client : clients) {
            assertEquals(1, client.getTimesHandled());
            assertEquals(1, client.getLastA());
            assertEquals("hello", client.getLastB());
            assertFalse(client.isListening());
        }

        // every client ended its subscription during the publication, the entries go with the next one
        assertEquals(3, primary.subscriberCount());

        primary.doSomething(2, "again");

        assertEquals(0, primary.subscriberCount());
        for (Client client : clients) {
            assertEquals(1, client.getTimesHandled());
            assertEquals("hello", client.getLastB());
        }
    }

    @Test
    public
    void testLateClientOnlySeesLaterPublications() {
        Primary primary = new Primary();
        Client early = new Client(primary);

        primary.doSomething(1, "first");

        Client late = new Client(primary);
        primary.doSomething(2, "second");

        assertEquals("first", early.getLastB());
        assertEquals(1, early.getTimesHandled());
        assertEquals(2, late.getLastA());
        assertEquals("second", late.getLastB());

        // the early entry was purged, the late one waits for the next publication
        assertEquals(1, primary.subscriberCount());
    }
}
