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

import java.util.function.Consumer;

/**
 * A non-owning observation of a subscription handle.
 * <p/>
 * It can be tested for liveness and momentarily upgraded to a strong reference with {@link #lock()}, but it never keeps the handle
 * alive by itself. Two observations are equal when they observe the same handle.
 *
 * @author dorkbox, llc
 */
public final
class WeakSubscription<C> {

    /**
     * @return an observation of a handle that has already expired
     */
    public static
    <C> WeakSubscription<C> expired() {
        return new WeakSubscription<C>(SubscriptionState.<C>expired());
    }


    private final SubscriptionState<C> state;

    WeakSubscription(final SubscriptionState<C> state) {
        this.state = state;
    }

    /**
     * @return true if no strong reference to the handle remains. Once expired, a handle never becomes valid again.
     */
    public
    boolean isExpired() {
        return this.state.isExpired();
    }

    /**
     * Acquires a new strong reference to the observed handle, which the caller must close when done with it.
     *
     * @return the strong reference, or null if the handle has expired
     */
    public
    Subscription<C> lock() {
        if (!this.state.tryRetain()) {
            return null;
        }

        final C callback = this.state.getCallback();
        if (callback == null) {
            // every strong reference is already unreachable, the cleaner just has not caught up
            this.state.release();
            return null;
        }
        return Subscription.adopt(this.state, callback);
    }

    /**
     * Runs the action with the callback of the observed handle, while holding a momentary strong reference to it. The handle stays
     * valid for the duration of the action, even if the action releases the last other strong reference.
     * <p>
     * Unlike {@link #lock()}, nothing is registered with the cleaner, so this is the cheaper choice for a single invocation.
     *
     * @return false if the handle has expired and the action was not run
     */
    public
    boolean withCallback(final Consumer<? super C> action) {
        if (!this.state.tryRetain()) {
            return false;
        }

        try {
            final C callback = this.state.getCallback();
            if (callback == null) {
                return false;
            }

            action.accept(callback);
            return true;
        } finally {
            this.state.release();
        }
    }

    @Override
    public
    int hashCode() {
        return System.identityHashCode(this.state);
    }

    @Override
    public
    boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null) {
            return false;
        }
        if (getClass() != obj.getClass()) {
            return false;
        }
        WeakSubscription<?> other = (WeakSubscription<?>) obj;
        return this.state == other.state;
    }

    @Override
    public
    String toString() {
        return "WeakSubscription{expired=" + isExpired() + '}';
    }
}
