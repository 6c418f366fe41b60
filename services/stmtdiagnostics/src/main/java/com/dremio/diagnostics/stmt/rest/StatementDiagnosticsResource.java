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
package com.dremio.diagnostics.stmt.rest;

import com.dremio.diagnostics.common.exceptions.UserException;
import com.dremio.diagnostics.datastore.DatastoreException;
import com.dremio.diagnostics.datastore.DiagnosticsStore;
import com.dremio.diagnostics.stmt.StmtDiagnosticsRequester;
import java.util.List;
import java.util.stream.Collectors;
import javax.annotation.security.RolesAllowed;
import javax.inject.Inject;
import javax.ws.rs.Consumes;
import javax.ws.rs.GET;
import javax.ws.rs.POST;
import javax.ws.rs.Path;
import javax.ws.rs.PathParam;
import javax.ws.rs.Produces;
import javax.ws.rs.core.MediaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Request statement diagnostics and read back what was collected. */
@RolesAllowed({"admin"})
@Path("/statement-diagnostics")
@Consumes(MediaType.APPLICATION_JSON)
@Produces(MediaType.APPLICATION_JSON)
public class StatementDiagnosticsResource {
  private static final Logger logger = LoggerFactory.getLogger(StatementDiagnosticsResource.class);

  private final StmtDiagnosticsRequester requester;
  private final DiagnosticsStore store;

  @Inject
  public StatementDiagnosticsResource(StmtDiagnosticsRequester requester, DiagnosticsStore store) {
    this.requester = requester;
    this.store = store;
  }

  @POST
  public CreatedDiagnosticsRequest createRequest(CreateDiagnosticsRequest request) {
    if (request == null) {
      throw UserException.validationError().message("request body is required").build(logger);
    }
    try {
      return new CreatedDiagnosticsRequest(requester.insertRequest(request.getFingerprint()));
    } catch (DatastoreException e) {
      throw storeError(e);
    }
  }

  @GET
  public List<DiagnosticsRequestInfo> listRequests() {
    try {
      return store.getRequests().stream()
          .map(DiagnosticsRequestInfo::of)
          .collect(Collectors.toList());
    } catch (DatastoreException e) {
      throw storeError(e);
    }
  }

  @GET
  @Path("/trace/{id}")
  public DiagnosticsTraceInfo getTrace(@PathParam("id") long id) {
    try {
      return store
          .getTrace(id)
          .map(DiagnosticsTraceInfo::of)
          .orElseThrow(
              () ->
                  UserException.notFoundError()
                      .message("trace %d not found", id)
                      .build(logger));
    } catch (DatastoreException e) {
      throw storeError(e);
    }
  }

  private static UserException storeError(DatastoreException e) {
    return UserException.resourceError(e)
        .message("statement diagnostics store is unavailable")
        .build(logger);
  }
}
