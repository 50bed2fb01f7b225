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

import java.lang.ref.Cleaner;
import java.util.Objects;

/**
 * A strong (owning) reference to a subscription handle, which wraps exactly one callback.
 * <p/>
 * The listener keeps this reference for as long as it wants to receive publications. A publisher only ever receives a
 * {@link WeakSubscription}, which never extends the lifetime of the handle.
 * <p/>
 * The handle stays valid as long as at least one strong reference to it has not been released. A strong reference is released by
 * {@link #close()}. If the owner drops a strong reference without closing it, it is released once it has been garbage collected.
 * <p/>
 * There is no unsubscribe: closing the last strong reference is how a listener stops receiving publications. Publishers notice
 * the expired handle on their next publication.
 *
 * @param <C> the callback type, which fixes the event signature
 *
 * @author dorkbox, llc
 */
public final
class Subscription<C> implements AutoCloseable {
    private static final Cleaner CLEANER = Cleaner.create();

    /**
     * Creates a new subscription handle for the callback. The caller owns the returned (and only) strong reference.
     *
     * @param callback the callback to invoke for every publication
     */
    public static
    <C> Subscription<C> create(final C callback) {
        Objects.requireNonNull(callback, "callback");
        return new Subscription<C>(new SubscriptionState<C>(callback), callback);
    }

    /**
     * Wraps a strong count that was already incremented on behalf of this new reference.
     */
    static
    <C> Subscription<C> adopt(final SubscriptionState<C> state, final C callback) {
        return new Subscription<C>(state, callback);
    }


    private final SubscriptionState<C> state;
    private final C callback;
    private final Cleaner.Cleanable cleanable;
    private volatile boolean released = false;

    private
    Subscription(final SubscriptionState<C> state, final C callback) {
        this.state = state;
        this.callback = callback;

        // the action must not reference this object, otherwise it would never become phantom reachable
        this.cleanable = CLEANER.register(this, new Release(state));
    }

    /**
     * @return the callback wrapped by this handle
     *
     * @throws IllegalStateException if this reference has already been released
     */
    public
    C callback() {
        checkNotReleased();
        return this.callback;
    }

    /**
     * Creates an additional strong reference to the same handle. The handle stays valid until every strong reference is released.
     *
     * @throws IllegalStateException if this reference has already been released
     */
    public
    Subscription<C> share() {
        checkNotReleased();

        if (!this.state.tryRetain()) {
            // a live reference guarantees a positive count
            throw new IllegalStateException("Subscription handle expired while still referenced");
        }
        return new Subscription<C>(this.state, this.callback);
    }

    /**
     * @return a non-owning observation of this handle, suitable for {@code Publication.subscribe}
     */
    public
    WeakSubscription<C> observe() {
        return new WeakSubscription<C>(this.state);
    }

    /**
     * @return true if this particular reference has been released
     */
    public
    boolean isReleased() {
        return this.released;
    }

    /**
     * Releases this strong reference. When it is the last one, the handle expires and no publisher will invoke its callback again.
     * <p/>
     * Releasing more than once has no further effect.
     */
    @Override
    public
    void close() {
        if (!this.released) {
            this.released = true;
            this.cleanable.clean();
        }
    }

    private
    void checkNotReleased() {
        if (this.released) {
            throw new IllegalStateException("Subscription reference has already been released");
        }
    }

    @Override
    public
    String toString() {
        return "Subscription{" +
               "callback=" + this.callback +
               ", strongCount=" + this.state.getStrongCount() +
               ", released=" + this.released +
               '}';
    }


    private static final
    class Release implements Runnable {
        private final SubscriptionState<?> state;

        Release(final SubscriptionState<?> state) {
            this.state = state;
        }

        @Override
        public
        void run() {
            this.state.release();
        }
    }
}
