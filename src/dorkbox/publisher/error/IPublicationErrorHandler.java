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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publication error handlers are provided with a publication error every time a subscriber's callback fails, when the publisher
 * isolates its subscribers from each other ({@code ErrorMode.Isolate}).
 *
 * @author dorkbox, llc
 */
public
interface IPublicationErrorHandler {

    /**
     * Handle the given publication error.
     *
     * @param error The PublicationError to handle.
     */
    void handleError(PublicationError error);


    /**
     * The default error handler, which logs the error and its cause.
     */
    final
    class DefaultLogger implements IPublicationErrorHandler {
        private static final Logger logger = LoggerFactory.getLogger(DefaultLogger.class);

        @Override
        public
        void handleError(final PublicationError error) {
            logger.error(error.toString(), error.getCause());
        }
    }
}
