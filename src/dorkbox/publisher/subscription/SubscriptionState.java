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
package dorkbox.publisher.subscription;

import java.lang.ref.WeakReference;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The state shared by every strong and weak reference to one subscription handle.
 * <p>
 * The handle is alive while the strong count is above zero. Once it reaches zero it stays there, and the callback is dropped.
 * <p>
 * The callback is held weakly here. Each {@link Subscription} holds it strongly, so a listener that owns its own handle and is
 * abandoned becomes unreachable, even though publishers still observe the handle.
 * <p>
 * The count is atomic only because the {@link java.lang.ref.Cleaner} releases abandoned strong references from its own thread.
 *
 * @author dorkbox, llc
 */
final
class SubscriptionState<C> {

    private final AtomicInteger strongCount;
    // only strong references hold the callback strongly, the callback usually reaches its owner
    private final WeakReference<C> callback;

    SubscriptionState(final C callback) {
        this.callback = new WeakReference<C>(callback);
        this.strongCount = new AtomicInteger(1);
    }

    /**
     * A state that was never alive.
     */
    private
    SubscriptionState() {
        this.callback = new WeakReference<C>(null);
        this.strongCount = new AtomicInteger(0);
    }

    static
    <C> SubscriptionState<C> expired() {
        return new SubscriptionState<C>();
    }

    /**
     * @return the callback, or null once it is no longer strongly reachable
     */
    C getCallback() {
        return this.callback.get();
    }

    /**
     * A cleared callback means every strong reference is unreachable, even if the cleaner has not released them yet.
     */
    boolean isExpired() {
        return this.strongCount.get() == 0 || this.callback.get() == null;
    }

    int getStrongCount() {
        return this.strongCount.get();
    }

    /**
     * Adds a strong reference, but only if one still exists. Zero is terminal.
     *
     * @return true if the handle was alive and is now retained
     */
    boolean tryRetain() {
        for (;;) {
            final int count = this.strongCount.get();
            if (count == 0) {
                return false;
            }

            if (this.strongCount.compareAndSet(count, count + 1)) {
                return true;
            }
        }
    }

    void release() {
        // each Subscription releases exactly once (Cleanable.clean is idempotent), so this never goes below zero
        if (this.strongCount.decrementAndGet() == 0) {
            this.callback.clear();
        }
    }
}
