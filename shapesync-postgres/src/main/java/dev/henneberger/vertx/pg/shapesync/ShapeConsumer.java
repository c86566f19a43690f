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

import io.vertx.core.Future;

/**
 * Receives the committed changes of one shape.
 */
public interface ShapeConsumer {

  String handle();

  /**
   * Table this consumer follows, or {@link TableRef#UNSCOPED} to receive every change.
   */
  TableRef table();

  /**
   * Handles one change. The collector does not deliver the next change until the returned future
   * completes; a failed future aborts the rest of the transaction's dispatch.
   */
  Future<Void> processChange(Change change);
}
