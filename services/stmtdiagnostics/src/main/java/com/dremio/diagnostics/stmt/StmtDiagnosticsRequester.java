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
package com.dremio.diagnostics.stmt;

/** Entry point for administrative requests to collect statement diagnostics. */
public interface StmtDiagnosticsRequester {

  /**
   * Requests diagnostics for the next execution, on any node, of a statement with the given
   * fingerprint.
   *
   * @return id of the new request
   * @throws com.dremio.diagnostics.common.exceptions.UserException if the fingerprint is blank or
   *     a request for it is already pending
   */
  long insertRequest(String fingerprint);
}
