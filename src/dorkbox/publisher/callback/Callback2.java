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
package dorkbox.publisher.callback;

import dorkbox.publisher.Invocation;

/**
 * An event with two arguments.
 *
 * @author dorkbox, llc
 */
@FunctionalInterface
public
interface Callback2<T1, T2> {

    void handle(T1 arg1, T2 arg2);

    /**
     * @return the publication of this event with the given arguments, for {@code Dispatcher.publish}
     */
    static
    <T1, T2> Invocation<Callback2<T1, T2>> args(final T1 arg1, final T2 arg2) {
        return new Invocation<Callback2<T1, T2>>() {
            @Override
            public
            void invoke(final Callback2<T1, T2> callback) {
                callback.handle(arg1, arg2);
            }

            @Override
            public
            Object[] arguments() {
                return new Object[] {arg1, arg2};
            }
        };
    }
}
