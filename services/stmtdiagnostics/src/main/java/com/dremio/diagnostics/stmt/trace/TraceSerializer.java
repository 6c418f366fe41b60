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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.util.List;

/** Serializes a recording as an indented JSON span tree. */
public class TraceSerializer {

  private final SpanTreeBuilder treeBuilder;
  private final ObjectWriter writer;

  public TraceSerializer() {
    this(new SpanTreeBuilder(), new ObjectMapper());
  }

  public TraceSerializer(SpanTreeBuilder treeBuilder, ObjectMapper mapper) {
    this.treeBuilder = treeBuilder;
    this.writer = mapper.writerWithDefaultPrettyPrinter();
  }

  /**
   * Serializes the recording, whose first span must be the root of all others.
   *
   * @throws TraceSerializationException if the recording is empty or cannot be written
   */
  public String toJson(List<RecordedSpan> recording) throws TraceSerializationException {
    if (recording == null || recording.isEmpty()) {
      throw new TraceSerializationException("no spans were recorded for the statement");
    }
    try {
      return writer.writeValueAsString(treeBuilder.build(recording));
    } catch (JsonProcessingException e) {
      throw new TraceSerializationException("unable to serialize trace: " + e.getMessage(), e);
    }
  }
}
