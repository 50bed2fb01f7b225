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
 * The arguments of one publication, applied to each subscriber's callback in turn.
 * <p/>
 * The callback interfaces in {@code dorkbox.publisher.callback} build these for their own signature, for example
 * {@code Callback2.args(5, "x")}.
 *
 * @param <C> the callback type of the publisher
 *
 * @author dorkbox, llc
 */
public
interface Invocation<C> {

    /**
     * Invoke the callback with the published arguments.
     *
     * @param callback the callback of a live subscription
     */
    void invoke(C callback);

    /**
     * @return the published arguments, used when reporting a failed invocation
     */
    default
    Object[] arguments() {
        return new Object[0];
    }
}
