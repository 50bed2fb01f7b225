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

/**
 * Thrown when a method cannot be bound as a callback, because the receiver is missing or has no public method with the requested
 * name and parameter types.
 *
 * @author dorkbox, llc
 */
public
class BindingException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public
    BindingException(final String message) {
        super(message);
    }

    public
    BindingException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
