/*
 * Copyright 2026 The OpenZipkin Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 */
package brave.request_tracing;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Invoked when request processing needs a segment and none is available, for example when the
 * host reports the end of a request that was never begun.
 */
public interface ContextMissingStrategy {
  /** Logs the problem at SEVERE. This is the default. */
  ContextMissingStrategy LOG_ERROR = new ContextMissingStrategy() {
    final Logger logger = Logger.getLogger(ContextMissingStrategy.class.getName());

    @Override
    public void handleEntityMissing(Recorder recorder, RuntimeException error, String message) {
      logger.log(Level.SEVERE, message, error);
    }

    @Override public String toString() {
      return "LOG_ERROR";
    }
  };

  /** Does nothing, for hosts that routinely report requests outside a trace. */
  ContextMissingStrategy IGNORE_ERROR = new ContextMissingStrategy() {
    @Override
    public void handleEntityMissing(Recorder recorder, RuntimeException error, String message) {
    }

    @Override public String toString() {
      return "IGNORE_ERROR";
    }
  };

  /**
   * @param recorder the recorder that couldn't supply the entity
   * @param error why the entity isn't available
   * @param message what was being attempted
   */
  void handleEntityMissing(Recorder recorder, RuntimeException error, String message);
}
