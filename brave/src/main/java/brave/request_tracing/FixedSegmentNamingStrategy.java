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

/** Names every segment the same, typically after the service. */
public final class FixedSegmentNamingStrategy implements SegmentNamingStrategy {
  public static FixedSegmentNamingStrategy create(String name) {
    return new FixedSegmentNamingStrategy(validateName(name));
  }

  final String name;

  FixedSegmentNamingStrategy(String name) {
    this.name = name;
  }

  @Override public String segmentName(InboundRequest request) {
    return name;
  }

  @Override public String toString() {
    return "FixedSegmentNamingStrategy(" + name + ")";
  }

  static String validateName(String name) {
    if (name == null) throw new NullPointerException("name == null");
    String trimmed = name.trim();
    if (trimmed.isEmpty()) throw new IllegalArgumentException("name is empty");
    return trimmed;
  }
}
