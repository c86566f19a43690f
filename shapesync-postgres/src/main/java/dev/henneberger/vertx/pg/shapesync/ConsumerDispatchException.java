/*
 * Copyright (C) 2026 Daniel Henneberger
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.henneberger.vertx.pg.shapesync;

import dev.henneberger.vertx.shapesync.core.LogOffset;

/**
 * A consumer failed a change; the remaining changes of the transaction were not delivered.
 */
public final class ConsumerDispatchException extends Exception {
  private final String handle;
  private final LogOffset offset;

  public ConsumerDispatchException(String handle, LogOffset offset, Throwable cause) {
    super("consumer " + handle + " failed to process change at " + offset, cause);
    this.handle = handle;
    this.offset = offset;
  }

  public String handle() {
    return handle;
  }

  public LogOffset offset() {
    return offset;
  }
}
