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

import brave.internal.codec.HexCodec;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Root trace IDs look like {@code 1-5759e988-bd862e3fe1be46a994272793}: a version, the epoch
 * seconds the trace began in 8 hex characters, then 96 random bits in 24 hex characters. Dropping
 * the version and dashes leaves 32 hex characters, which is how the ID maps to a 128-bit Brave
 * trace ID.
 *
 * <p>Parent IDs are 16 hex characters, the same as a Brave span ID.
 *
 * <p>Brave reserves zero for "no ID", so the lower 64 bits of a root and a parent ID must not be
 * all zeros.
 */
final class TraceIds {
  static final int ROOT_LENGTH = 35, PARENT_LENGTH = 16;

  static String newRootTraceId() {
    long epochSeconds = System.currentTimeMillis() / 1000L;
    ThreadLocalRandom random = ThreadLocalRandom.current();
    long lowBits;
    do {
      lowBits = random.nextLong();
    } while (lowBits == 0L);
    return "1-"
      + HexCodec.toLowerHex(epochSeconds).substring(8)
      + "-"
      + HexCodec.toLowerHex(random.nextInt() & 0xffffffffL).substring(8)
      + HexCodec.toLowerHex(lowBits);
  }

  static boolean isValidRootTraceId(String rootTraceId) {
    if (rootTraceId.length() != ROOT_LENGTH) return false;
    if (rootTraceId.charAt(0) != '1' || rootTraceId.charAt(1) != '-') return false;
    if (rootTraceId.charAt(10) != '-') return false;
    if (!isHex(rootTraceId, 2, 10) || !isHex(rootTraceId, 11, ROOT_LENGTH)) return false;
    return !isZero(rootTraceId, 19, ROOT_LENGTH);
  }

  static boolean isValidParentId(String parentId) {
    if (parentId.length() != PARENT_LENGTH || !isHex(parentId, 0, PARENT_LENGTH)) return false;
    return !isZero(parentId, 0, PARENT_LENGTH);
  }

  /** The upper 64 bits of the 128-bit trace ID: epoch seconds and the first random word. */
  static long traceIdHigh(String rootTraceId) {
    return Long.parseUnsignedLong(rootTraceId.substring(2, 10) + rootTraceId.substring(11, 19), 16);
  }

  /** The lower 64 bits of the 128-bit trace ID. */
  static long traceId(String rootTraceId) {
    return Long.parseUnsignedLong(rootTraceId.substring(19, ROOT_LENGTH), 16);
  }

  static long parentId(String parentId) {
    return Long.parseUnsignedLong(parentId, 16);
  }

  static boolean isHex(String input, int beginIndex, int endIndex) {
    for (int i = beginIndex; i < endIndex; i++) {
      char c = input.charAt(i);
      if ((c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F')) continue;
      return false;
    }
    return true;
  }

  static boolean isZero(String input, int beginIndex, int endIndex) {
    for (int i = beginIndex; i < endIndex; i++) {
      if (input.charAt(i) != '0') return false;
    }
    return true;
  }

  TraceIds() {
  }
}
