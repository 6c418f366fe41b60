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

import static javax.ws.rs.core.MediaType.APPLICATION_JSON_TYPE;

import com.dremio.diagnostics.common.exceptions.UserException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import java.util.List;
import javax.ws.rs.core.Response;
import javax.ws.rs.ext.ExceptionMapper;
import javax.ws.rs.ext.Provider;

/** Maps UserException to a JSON error with a status matching its type. */
@Provider
public class UserExceptionMapper implements ExceptionMapper<UserException> {

  public static final String SYSTEM_ERROR_MSG = "Unexpected error occurred";

  @Override
  public Response toResponse(UserException exception) {
    return Response.status(statusFor(exception))
        .entity(toErrorMessage(exception))
        .type(APPLICATION_JSON_TYPE)
        .build();
  }

  static ErrorMessage toErrorMessage(UserException exception) {
    final String message =
        exception.getErrorType() == UserException.ErrorType.SYSTEM
            ? SYSTEM_ERROR_MSG
            : exception.getMessage();
    return new ErrorMessage(message, exception.getErrorId(), exception.getContextStrings());
  }

  static Response.Status statusFor(UserException exception) {
    switch (exception.getErrorType()) {
      case VALIDATION:
        return Response.Status.BAD_REQUEST;
      case CONCURRENT_MODIFICATION:
        return Response.Status.CONFLICT;
      case NOT_FOUND:
        return Response.Status.NOT_FOUND;
      case RESOURCE:
        return Response.Status.SERVICE_UNAVAILABLE;
      default:
        return Response.Status.INTERNAL_SERVER_ERROR;
    }
  }

  /** Error body. */
  public static class ErrorMessage {
    private final String errorMessage;
    private final String errorId;
    private final List<String> context;

    @JsonCreator
    public ErrorMessage(
        @JsonProperty("errorMessage") String errorMessage,
        @JsonProperty("errorId") String errorId,
        @JsonProperty("context") List<String> context) {
      this.errorMessage = errorMessage;
      this.errorId = errorId;
      this.context = context == null ? ImmutableList.of() : ImmutableList.copyOf(context);
    }

    public String getErrorMessage() {
      return errorMessage;
    }

    public String getErrorId() {
      return errorId;
    }

    public List<String> getContext() {
      return context;
    }
  }
}
