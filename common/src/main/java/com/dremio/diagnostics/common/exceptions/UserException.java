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

import java.util.List;
import org.slf4j.Logger;

/**
 * Base class for errors whose message is meant for the operator that made the request.
 *
 * <p>A user exception carries an {@link ErrorType}, a message and a list of context lines. System
 * errors are the catch-all for failures the operator can do nothing about; they always report the
 * root cause message.
 *
 * <p>Instances are created through the {@link Builder} returned by the static factory methods, for
 * example:
 *
 * <pre>
 * throw UserException.validationError()
 *     .message("fingerprint must not be empty")
 *     .build(logger);
 * </pre>
 */
public class UserException extends RuntimeException {
  private static final Logger logger = org.slf4j.LoggerFactory.getLogger(UserException.class);

  /** Category of a user exception. */
  public enum ErrorType {
    /** The request was malformed. */
    VALIDATION,
    /** The request conflicts with state created concurrently, or previously, by someone else. */
    CONCURRENT_MODIFICATION,
    /** The requested entity does not exist. */
    NOT_FOUND,
    /** A backing resource (store, network) failed. */
    RESOURCE,
    /** Anything else. */
    SYSTEM
  }

  public static Builder validationError() {
    return validationError(null);
  }

  public static Builder validationError(Throwable cause) {
    return new Builder(ErrorType.VALIDATION, cause);
  }

  /**
   * Creates a new CONCURRENT_MODIFICATION exception builder.
   *
   * @return user exception builder
   */
  public static Builder concurrentModificationError() {
    return concurrentModificationError(null);
  }

  public static Builder concurrentModificationError(Throwable cause) {
    return new Builder(ErrorType.CONCURRENT_MODIFICATION, cause);
  }

  public static Builder notFoundError() {
    return new Builder(ErrorType.NOT_FOUND, null);
  }

  /**
   * Wraps the passed exception inside a resource error.
   *
   * <p>If the wrapped exception is, or wraps, a user exception it will be returned by {@link
   * Builder#build(Logger)} instead of creating a new exception.
   *
   * @param cause exception we want the user exception to wrap
   * @return user exception builder
   */
  public static Builder resourceError(Throwable cause) {
    return new Builder(ErrorType.RESOURCE, cause);
  }

  public static Builder systemError(Throwable cause) {
    return new Builder(ErrorType.SYSTEM, cause);
  }

  /**
   * Builder for UserException. When wrapping an exception that is, or wraps, a UserException the
   * builder returns that exception as it is and appends any new context to it.
   */
  public static class Builder {

    private final Throwable cause;
    private final ErrorType errorType;
    private final UserException uex;
    private final UserExceptionContext context;

    private String message;

    private Builder(final ErrorType errorType, final Throwable cause) {
      uex = ErrorHelper.findWrappedCause(cause, UserException.class);
      if (uex != null) {
        this.errorType = uex.errorType;
        this.context = uex.context;
        this.cause = cause;
      } else {
        this.cause = cause;
        this.errorType = errorType;
        this.message = cause != null ? cause.getMessage() : null;
        this.context = new UserExceptionContext();
      }
    }

    /**
     * sets or replaces the error message. Ignored if this builder is wrapping a user exception.
     *
     * @see String#format(String, Object...)
     */
    public Builder message(final String format, final Object... args) {
      if (uex == null && format != null) {
        this.message = (args == null || args.length == 0) ? format : String.format(format, args);
      }
      return this;
    }

    public Builder addContext(final String value) {
      context.add(value);
      return this;
    }

    public Builder addContext(final String name, final String value) {
      context.add(name, value);
      return this;
    }

    public Builder addContext(final String name, final long value) {
      context.add(name, value);
      return this;
    }

    /**
     * builds a user exception or returns the wrapped one. System errors are logged at ERROR, other
     * types at INFO.
     *
     * @param logger the logger to write to
     * @return user exception
     */
    public UserException build(final Logger logger) {
      if (uex != null) {
        return uex;
      }

      if (errorType == ErrorType.SYSTEM) {
        message = ErrorHelper.getRootMessage(cause);
      } else if (message == null || message.isEmpty()) {
        message = cause != null ? cause.getClass().getSimpleName() : "";
      }

      final UserException newException = new UserException(this);
      if (errorType == ErrorType.SYSTEM) {
        logger.error(newException.getMessage(), newException);
      } else {
        logger.info("User Error Occurred [{}]", newException.getErrorId(), newException);
      }
      return newException;
    }

    /** Builds the exception, logging through {@link UserException}'s own logger. */
    public UserException build() {
      return build(logger);
    }
  }

  private final ErrorType errorType;
  private final UserExceptionContext context;

  private UserException(final Builder builder) {
    super(builder.message, builder.cause);
    this.errorType = builder.errorType;
    this.context = builder.context;
  }

  public ErrorType getErrorType() {
    return errorType;
  }

  public String getErrorId() {
    return context.getErrorId();
  }

  public List<String> getContextStrings() {
    return context.getContextAsStrings();
  }

  /**
   * Message in the form:
   *
   * <pre>
   * ERROR_TYPE ERROR: message
   *
   * context lines
   * [ErrorId: ...]
   * </pre>
   */
  public String getVerboseMessage() {
    return errorType + " ERROR: " + getMessage() + "\n\n" + context.generateContextMessage();
  }
}
