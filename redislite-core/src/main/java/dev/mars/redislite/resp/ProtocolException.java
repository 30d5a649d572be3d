/*
 * Copyright 2026 Mark Andrew Ray-Smith
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
package dev.mars.redislite.resp;

import java.io.IOException;

/**
 * Thrown when a byte stream does not hold a well-formed request frame.
 * <p>
 * The stream position after this exception is undefined, so the stream cannot be
 * resynchronised: callers drop the connection (or, for the log, abort replay).
 */
public class ProtocolException extends IOException {

    public ProtocolException(String message) {
        super(message);
    }
}
