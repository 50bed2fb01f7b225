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

import dorkbox.publisher.subscription.Subscription;
import dorkbox.publisher.subscription.WeakSubscription;

/**
 * The part of a publisher that anyone may see: a place to subscribe.
 * <p/>
 * An object that publishes events implements (or exposes) this interface and keeps its {@link Publisher} and the publisher's
 * {@link Dispatcher} to itself, so that only it can trigger a publication.
 *
 * @param <C> the callback type, which fixes the event signature
 *
 * @author dorkbox, llc
 */
public
interface Publication<C> {

    /**
     * Registers the observed handle for future publications.
     * <p/>
     * There is no unsubscribe: the subscription ends when the listener closes its last strong reference to the handle.
     *
     * @param subscription the handle to observe. An expired (or null) handle is silently ignored.
     */
    void subscribe(WeakSubscription<C> subscription);

    /**
     * Registers a weak observation of the given strong reference. The caller keeps ownership of the reference.
     */
    default
    void subscribe(final Subscription<C> subscription) {
        if (subscription != null) {
            subscribe(subscription.observe());
        }
    }
}
