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

public
enum ErrorMode {
    /**
     * This is the default.
     * <p>
     * An exception thrown by a callback propagates to whoever called publish. Subscribers later in the same publication do not
     * receive it.
     */
    Propagate,

    /**
     * Every callback invocation is wrapped. A failure is passed to the publisher's error handlers as a
     * {@link dorkbox.publisher.error.PublicationError}, and the publication continues with the next subscriber.
     */
    Isolate,
}
