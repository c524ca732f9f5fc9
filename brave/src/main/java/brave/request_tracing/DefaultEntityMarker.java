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

/**
 * Marks 4xx responses as errors, 429 as both error and throttle, and 5xx as faults. Other status
 * codes are left unmarked.
 */
public final class DefaultEntityMarker implements EntityMarker {
  public static final DefaultEntityMarker INSTANCE = new DefaultEntityMarker();

  static final String AUTO_INSTRUMENTATION = "auto_instrumentation";

  @Override public void markEntityFromStatus(Entity entity, int statusCode) {
    if (entity == null) throw new NullPointerException("entity == null");
    if (statusCode >= 400 && statusCode < 500) {
      entity.markError();
      if (statusCode == 429) entity.markThrottle();
    } else if (statusCode >= 500 && statusCode < 600) {
      entity.markFault();
    }
  }

  @Override public void addAutoInstrumentationMark(Entity entity) {
    if (entity == null) throw new NullPointerException("entity == null");
    entity.annotate(AUTO_INSTRUMENTATION, "true");
  }

  @Override public String toString() {
    return "DefaultEntityMarker()";
  }

  DefaultEntityMarker() {
  }
}
