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
package com.dremio.diagnostics.common.exceptions;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/** Holds the context lines and error id of a {@link UserException}. */
class UserExceptionContext {

  private final String errorId;
  private final List<String> contextList;

  UserExceptionContext() {
    this.errorId = UUID.randomUUID().toString();
    this.contextList = new ArrayList<>();
  }

  synchronized void add(String context) {
    contextList.add(context);
  }

  void add(String name, String value) {
    add(name + " " + value);
  }

  void add(String name, long value) {
    add(name + " " + value);
  }

  String getErrorId() {
    return errorId;
  }

  synchronized List<String> getContextAsStrings() {
    return ImmutableList.copyOf(contextList);
  }

  synchronized String generateContextMessage() {
    StringBuilder sb = new StringBuilder();
    for (String context : contextList) {
      sb.append(context).append('\n');
    }
    sb.append("[ErrorId: ").append(errorId).append(']');
    return sb.toString();
  }
}
