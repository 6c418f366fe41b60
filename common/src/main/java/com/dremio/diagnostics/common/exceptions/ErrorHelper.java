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

/** Utility class that handles error message generation. */
public final class ErrorHelper {

  private ErrorHelper() {}

  /**
   * Constructs the root error message in the form [root exception class name]: [root exception
   * message]
   *
   * @param cause exception we want the root message for
   * @return root error message or empty string if none found
   */
  public static String getRootMessage(final Throwable cause) {
    String message = "";

    Throwable ex = cause;
    while (ex != null) {
      message = ex.getClass().getSimpleName();
      if (ex.getMessage() != null) {
        message += ": " + ex.getMessage();
      }

      if (ex.getCause() != null && ex.getCause() != ex) {
        ex = ex.getCause();
      } else {
        break;
      }
    }

    return message;
  }

  /**
   * Walks the cause chain looking for an exception of the given type.
   *
   * @return the first matching exception, or null
   */
  public static <T extends Throwable> T findWrappedCause(Throwable ex, Class<T> clazz) {
    Throwable current = ex;
    while (current != null) {
      if (clazz.isInstance(current)) {
        return clazz.cast(current);
      }
      if (current.getCause() == current) {
        return null;
      }
      current = current.getCause();
    }
    return null;
  }
}
