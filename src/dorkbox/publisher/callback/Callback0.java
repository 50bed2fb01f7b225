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
 * An event without arguments.
 *
 * @author dorkbox, llc
 */
@FunctionalInterface
public
interface Callback0 {

    void handle();

    /**
     * @return the publication of this event, for {@code Dispatcher.publish}
     */
    static
    Invocation<Callback0> args() {
        return new Invocation<Callback0>() {
            @Override
            public
            void invoke(final Callback0 callback) {
                callback.handle();
            }
        };
    }
}
