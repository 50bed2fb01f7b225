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
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dorkbox.publisher.error.ErrorHandler;
import dorkbox.publisher.error.IPublicationErrorHandler;
import dorkbox.publisher.error.PublicationError;
import dorkbox.publisher.subscription.WeakSubscription;

/**
 * A publisher keeps weak observations of subscription handles, and forwards the events of its owner to every handle that is still
 * alive.
 * <p/>
 *
 * The publisher never owns a handle. Each listener owns the strong reference to its own handle, and a listener stops receiving
 * publications by closing it (there is no unsubscribe). Expired handles are removed lazily, at the start of the next publication.
 *
 * <p/>
 * A publication runs in three passes:
 * <ol>
 *     <li>expired observations are removed from the subscriber list</li>
 *     <li>the remaining list is copied</li>
 *     <li>each entry of the copy is locked to a strong reference and, if still alive, invoked</li>
 * </ol>
 * Because the dispatch iterates the copy, a callback may close its own handle (or any other), or subscribe new handles, without
 * affecting the iteration. A handle closed during the dispatch is skipped if it has not been reached yet, and its entry is removed
 * by the next publication. A handle subscribed during the dispatch only receives later publications.
 *
 * <p/>
 * Subscribing the same handle twice is not guarded against, and results in two invocations per publication.
 *
 * <p/>
 * Only the owner may publish. It claims the publisher's {@link Dispatcher} once with {@link #dispatcher()}, and exposes only
 * {@link Publication} (or its own subscribe method) to everybody else.
 *
 * <p/>
 * A publisher is not thread safe. Both subscribe and publish run to completion on the calling thread.
 *
 * @param <C> the callback type, which fixes the event signature
 *
 * @author dorkbox, llc
 */
public final
class Publisher<C> implements Publication<C> {
    private static final Logger logger = LoggerFactory.getLogger(Publisher.class);

    /**
     * Gets the version number.
     */
    public static
    String getVersion() {
        return "1.0";
    }


    // only modified by subscribe (append) and by the purge at the start of publish
    private final List<WeakSubscription<C>> subscriptions = new LinkedList<WeakSubscription<C>>();

    private final ErrorMode errorMode;
    private final ErrorHandler errorHandler = new ErrorHandler();

    private final Dispatcher<C> dispatcher;
    private boolean dispatcherClaimed = false;

    /**
     * Exceptions thrown by callbacks propagate to the caller of publish.
     */
    public
    Publisher() {
        this(ErrorMode.Propagate);
    }

    /**
     * @param errorMode Specifies whether an exception thrown by a callback propagates to the caller of publish, or is passed to the
     *                  error handlers while the publication continues.
     */
    public
    Publisher(final ErrorMode errorMode) {
        if (errorMode == null) {
            throw new NullPointerException("errorMode");
        }

        this.errorMode = errorMode;
        this.dispatcher = new Dispatcher<C>(this);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public
    void subscribe(final WeakSubscription<C> subscription) {
        if (subscription == null || subscription.isExpired()) {
            logger.trace("Ignoring subscription to an expired handle");
            return;
        }

        this.subscriptions.add(subscription);
    }

    /**
     * Claims the dispatcher of this publisher. This is meant for the owner of the publisher, and can only be done once.
     *
     * @throws IllegalStateException if the dispatcher was already claimed
     */
    public
    Dispatcher<C> dispatcher() {
        if (this.dispatcherClaimed) {
            throw new IllegalStateException("The dispatcher of this publisher has already been claimed");
        }

        this.dispatcherClaimed = true;
        return this.dispatcher;
    }

    /**
     * Publication errors only occur with {@link ErrorMode#Isolate}, when a callback throws an exception.
     * <p>
     * A call to this method will add the given error handler to the chain. If no handler was added, errors are logged.
     */
    public
    void addErrorHandler(final IPublicationErrorHandler errorHandler) {
        this.errorHandler.addErrorHandler(errorHandler);
    }

    public
    ErrorMode getErrorMode() {
        return this.errorMode;
    }

    /**
     * The number of entries in the subscriber list.
     * <p>
     * Handles that expired since the last publication are still counted, until the next publication removes them.
     */
    public
    int size() {
        return this.subscriptions.size();
    }

    void publish(final Invocation<C> invocation) {
        purge();

        // subscriptions made by the callbacks go to the live list, not to this copy
        final List<WeakSubscription<C>> snapshot = new ArrayList<WeakSubscription<C>>(this.subscriptions);

        final Consumer<C> dispatch = callback -> invoke(callback, invocation);
        for (WeakSubscription<C> subscription : snapshot) {
            // the momentary strong reference keeps the handle alive while its callback runs, even if the callback closes it
            subscription.withCallback(dispatch);
        }
    }

    private
    void purge() {
        int purged = 0;

        final Iterator<WeakSubscription<C>> iterator = this.subscriptions.iterator();
        while (iterator.hasNext()) {
            if (iterator.next().isExpired()) {
                iterator.remove();
                purged++;
            }
        }

        if (purged > 0) {
            logger.trace("Purged {} expired subscriptions, {} remaining", purged, this.subscriptions.size());
        }
    }

    private
    void invoke(final C callback, final Invocation<C> invocation) {
        if (this.errorMode == ErrorMode.Propagate) {
            invocation.invoke(callback);
            return;
        }

        try {
            invocation.invoke(callback);
        } catch (Throwable e) {
            this.errorHandler.handlePublicationError(new PublicationError().setMessage("Error during publication of message.")
                                                                           .setCause(e)
                                                                           .setPublishedObjects(invocation.arguments())
                                                                           .setCallback(callback));
        }
    }
}
