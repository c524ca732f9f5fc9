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

import brave.internal.Nullable;
import brave.internal.codec.EntrySplitter;
import brave.internal.codec.EntrySplitter.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads and writes the {@value #HEADER_KEY} header.
 *
 * <p><pre>{@code
 * X-Amzn-Trace-Id: Root=1-5759e988-bd862e3fe1be46a994272793;Parent=53995c3f42cd8ad8;Sampled=1
 * }</pre>
 *
 * <p>{@code Root} is required. {@code Parent} and {@code Sampled} are optional, and other keys,
 * such as {@code Lineage}, are ignored.
 */
public final class TraceHeaderCodec {
  static final Logger LOG = Logger.getLogger(TraceHeaderCodec.class.getName());

  public static final String HEADER_KEY = "X-Amzn-Trace-Id";

  static final String ROOT = "Root", PARENT = "Parent", SAMPLED = "Sampled";

  static final EntrySplitter ENTRY_SPLITTER = EntrySplitter.newBuilder()
    .entrySeparator(';')
    .keyValueSeparator('=')
    .build();

  static final Handler<ParseState> HANDLER =
    (target, input, beginKey, endKey, beginValue, endValue) -> {
      String key = input.subSequence(beginKey, endKey).toString();
      String value = input.subSequence(beginValue, endValue).toString();
      switch (key) {
        case ROOT:
          if (!TraceIds.isValidRootTraceId(value)) return false;
          target.rootTraceId = value;
          return true;
        case PARENT:
          if (!TraceIds.isValidParentId(value)) return false;
          target.parentId = value;
          return true;
        case SAMPLED:
          SampleDecision sampled = SampleDecision.fromHeaderValue(value);
          if (sampled == null) return false;
          target.sampled = sampled;
          return true;
        default: // Lineage, Self, etc.
          return true;
      }
    };

  /**
   * Returns null if the input is null, empty or invalid. Callers should treat that the same as an
   * absent header, which is what {@link #parseOrCreate(String)} does.
   */
  @Nullable public static TraceHeader parse(@Nullable String headerValue) {
    if (headerValue == null || headerValue.isEmpty()) return null;

    ParseState state = new ParseState();
    if (!ENTRY_SPLITTER.parse(HANDLER, state, headerValue)) return null;
    if (state.rootTraceId == null) return null;
    return new TraceHeader(state.rootTraceId, state.parentId, state.sampled);
  }

  /** Parses the header, or starts a new trace with an unknown decision if that fails. */
  public static TraceHeader parseOrCreate(@Nullable String headerValue) {
    TraceHeader result = parse(headerValue);
    if (result != null) return result;
    if (LOG.isLoggable(Level.FINE)) {
      LOG.fine("Trace header doesn't exist or is invalid: (" + headerValue + "). Starting a trace.");
    }
    return TraceHeader.newRoot();
  }

  public static String serialize(TraceHeader header) {
    if (header == null) throw new NullPointerException("header == null");
    StringBuilder result = new StringBuilder(ROOT).append('=').append(header.rootTraceId);
    if (header.parentId != null) {
      result.append(';').append(PARENT).append('=').append(header.parentId);
    }
    String sampled = header.sampled.headerValue();
    if (sampled != null) {
      result.append(';').append(SAMPLED).append('=').append(sampled);
    }
    return result.toString();
  }

  static final class ParseState {
    String rootTraceId, parentId;
    SampleDecision sampled = SampleDecision.UNKNOWN;
  }

  TraceHeaderCodec() {
  }
}
