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

import java.util.ArrayDeque;
import java.util.Collection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The chain of error handlers of one publisher.
 *
 * @author dorkbox, llc
 */
public final
class ErrorHandler {
    private static final Logger logger = LoggerFactory.getLogger(ErrorHandler.class);

    private static final String ERROR_HANDLER_MSG = "No error handler has been configured to handle exceptions during publication. " +
                                                    "Falling back to the default logger. Publication error handlers can be added " +
                                                    "by calling Publisher.addErrorHandler()";

    // this handler chain will receive all errors that occur while invoking callbacks
    private final Collection<IPublicationErrorHandler> errorHandlers = new ArrayDeque<IPublicationErrorHandler>();
    private boolean changedDefaults = false;


    public
    ErrorHandler() {
    }

    public synchronized
    void addErrorHandler(final IPublicationErrorHandler handler) {
        if (handler == null) {
            throw new NullPointerException("handler");
        }

        this.changedDefaults = true;
        this.errorHandlers.add(handler);
    }

    public synchronized
    void handlePublicationError(final PublicationError error) {
        if (!this.changedDefaults) {
            this.changedDefaults = true;

            // lazy-set the error handler + default message if none have been set
            if (this.errorHandlers.isEmpty()) {
                this.errorHandlers.add(new IPublicationErrorHandler.DefaultLogger());
                logger.info(ERROR_HANDLER_MSG);
            }
        }

        for (IPublicationErrorHandler errorHandler : this.errorHandlers) {
            errorHandler.handleError(error);
        }
    }

    /**
     * only used in unit tests
     */
    synchronized
    int size() {
        return this.errorHandlers.size();
    }
}
