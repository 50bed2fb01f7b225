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
 * An event with one argument.
 *
 * @author dorkbox, llc
 */
@FunctionalInterface
public
interface Callback1<T1> {

    void handle(T1 arg1);

    /**
     * @return the publication of this event with the given argument, for {@code Dispatcher.publish}
     */
    static
    <T1> Invocation<Callback1<T1>> args(final T1 arg1) {
        return new Invocation<Callback1<T1>>() {
            @Override
            public
            void invoke(final Callback1<T1> callback) {
                callback.handle(arg1);
            }

            @Override
            public
            Object[] arguments() {
                return new Object[] {arg1};
            }
        };
    }
}
