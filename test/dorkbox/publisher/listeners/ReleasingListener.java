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
package dorkbox.publisher.listeners;

import java.util.List;

/**
 * Ends the subscription of another listener while handling an event.
 *
 * @author dorkbox, llc
 */
public
class ReleasingListener extends RecordingListener {
    private final RecordingListener target;

    public
    ReleasingListener(final String name, final List<String> log, final RecordingListener target) {
        super(name, log);
        this.target = target;
    }

    @Override
    public
    void handle(final Integer number, final String text) {
        super.handle(number, text);
        this.target.release();
    }
}
