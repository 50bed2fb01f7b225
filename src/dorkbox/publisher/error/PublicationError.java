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
package dorkbox.publisher.error;

import java.util.Arrays;

/**
 * Publication errors are created when a subscriber's callback fails while a publisher isolates its subscribers from each other.
 * They carry the cause, the published arguments and the callback that failed.
 *
 * @author dorkbox, llc
 */
public
class PublicationError {

    // Internal state
    private Throwable cause;
    private String message;
    private Object[] publishedObjects = new Object[0];
    private Object callback;


    public
    PublicationError() {
        super();
    }

    /**
     * @return The Throwable giving rise to this PublicationError.
     */
    public
    Throwable getCause() {
        return this.cause;
    }

    /**
     * Assigns the cause of this PublicationError.
     *
     * @param cause A Throwable which gave rise to this PublicationError.
     * @return This PublicationError.
     */
    public
    PublicationError setCause(final Throwable cause) {
        this.cause = cause;
        return this;
    }

    public
    String getMessage() {
        return this.message;
    }

    public
    PublicationError setMessage(final String message) {
        this.message = message;
        return this;
    }

    public
    Object[] getPublishedObjects() {
        return this.publishedObjects.clone();
    }

    public
    PublicationError setPublishedObjects(final Object... publishedObjects) {
        this.publishedObjects = publishedObjects.clone();
        return this;
    }

    /**
     * @return the callback whose invocation failed
     */
    public
    Object getCallback() {
        return this.callback;
    }

    public
    PublicationError setCallback(final Object callback) {
        this.callback = callback;
        return this;
    }

    @Override
    public
    String toString() {
        String newLine = System.lineSeparator();
        return "PublicationError{" +
               newLine +
               "\tcause=" + this.cause +
               newLine +
               "\tmessage='" + this.message + '\'' +
               newLine +
               "\tpublishedObjects=" + Arrays.deepToString(this.publishedObjects) +
               newLine +
               "\tcallback=" + this.callback +
               '}';
    }
}
