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

/**
 * The right to publish through one {@link Publisher}. Each publisher hands out its dispatcher exactly once, to its owner.
 *
 * @author dorkbox, llc
 */
public final
class Dispatcher<C> {
    private final Publisher<C> publisher;

    Dispatcher(final Publisher<C> publisher) {
        this.publisher = publisher;
    }

    /**
     * Synchronously publish to every live subscriber, in the order they subscribed.
     * <p>
     * The call returns when every live subscriber has been invoked. Subscriptions made while this publication is running only
     * receive later publications.
     *
     * @param invocation the published arguments, for example {@code Callback2.args(5, "x")}
     */
    public
    void publish(final Invocation<C> invocation) {
        if (invocation == null) {
            throw new NullPointerException("invocation");
        }

        this.publisher.publish(invocation);
    }

    /**
     * @return the publisher this dispatcher triggers
     */
    public
    Publisher<C> getPublisher() {
        return this.publisher;
    }
}
