/*
 * Copyright (C) 2017-2019 Dremio Corporation
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
package com.dremio.diagnostics.stmt.trace;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Turns a flat recording into a tree rooted at the first span.
 *
 * <p>Children are found by scanning the whole recording for each node, which is quadratic in the
 * number of spans. Recordings of a single statement are small enough for that.
 */
public class SpanTreeBuilder {

  public NormalizedSpan build(List<RecordedSpan> recording) {
    Preconditions.checkArgument(!recording.isEmpty(), "recording has no spans");
    final Set<RecordedSpan> visited = Collections.newSetFromMap(new IdentityHashMap<>());
    return normalize(recording.get(0), recording, visited);
  }

  private NormalizedSpan normalize(
      RecordedSpan span, List<RecordedSpan> recording, Set<RecordedSpan> visited) {
    visited.add(span);
    final List<NormalizedSpan> children = new ArrayList<>();
    for (RecordedSpan candidate : recording) {
      // a malformed recording may contain cycles
      if (candidate.getParentId() != span.getSpanId() || visited.contains(candidate)) {
        continue;
      }
      children.add(normalize(candidate, recording, visited));
    }
    return new NormalizedSpan(span, children);
  }
}
