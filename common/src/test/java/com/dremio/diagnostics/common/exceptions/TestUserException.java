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

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class TestUserException {
  private static final Logger logger = LoggerFactory.getLogger(TestUserException.class);

  @Test
  public void testMessageAndContext() {
    UserException e =
        UserException.concurrentModificationError()
            .message("a pending request for fingerprint %s already exists", "SELECT _")
            .addContext("fingerprint", "SELECT _")
            .addContext("pending requests", 1)
            .build(logger);

    assertThat(e.getErrorType()).isEqualTo(UserException.ErrorType.CONCURRENT_MODIFICATION);
    assertThat(e.getMessage())
        .isEqualTo("a pending request for fingerprint SELECT _ already exists");
    assertThat(e.getContextStrings()).containsExactly("fingerprint SELECT _", "pending requests 1");
    assertThat(e.getVerboseMessage())
        .startsWith("CONCURRENT_MODIFICATION ERROR: a pending request")
        .contains("[ErrorId: " + e.getErrorId() + "]");
  }

  @Test
  public void testWrappedUserExceptionIsReturnedAsIs() {
    UserException original = UserException.validationError().message("bad").build(logger);

    UserException wrapped =
        UserException.resourceError(new RuntimeException("outer", original))
            .message("ignored")
            .addContext("extra")
            .build(logger);

    assertThat(wrapped).isSameAs(original);
    assertThat(original.getContextStrings()).containsExactly("extra");
  }

  @Test
  public void testSystemErrorUsesRootMessage() {
    UserException e =
        UserException.systemError(new RuntimeException("top", new IOException("disk gone")))
            .message("ignored for system errors")
            .build(logger);

    assertThat(e.getErrorType()).isEqualTo(UserException.ErrorType.SYSTEM);
    assertThat(e.getMessage()).isEqualTo("IOException: disk gone");
  }

  @Test
  public void testMissingMessageFallsBackToCauseClass() {
    UserException e = UserException.resourceError(new NullPointerException()).build(logger);

    assertThat(e.getMessage()).isEqualTo("NullPointerException");
  }
}
