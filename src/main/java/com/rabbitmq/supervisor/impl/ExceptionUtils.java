// Copyright (c) 2024 Broadcom. All Rights Reserved.
// The term "Broadcom" refers to Broadcom Inc. and/or its subsidiaries.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
//
// If you have any questions regarding licensing, please contact us at
// info@rabbitmq.com.
package com.rabbitmq.supervisor.impl;

import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.ShutdownSignalException;
import com.rabbitmq.supervisor.SupervisorException;
import java.io.IOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

abstract class ExceptionUtils {

  private ExceptionUtils() {}

  static SupervisorException convert(Throwable e) {
    return convert(e, null);
  }

  static SupervisorException convert(Throwable e, String format, Object... args) {
    if (e instanceof CompletionException || e instanceof ExecutionException) {
      if (e.getCause() != null) {
        return convert(e.getCause(), format, args);
      }
    }
    if (e instanceof SupervisorException) {
      return (SupervisorException) e;
    }
    String message = format == null ? e.getMessage() : String.format(format, args);
    if (isConnectionError(e)) {
      return new SupervisorException.SupervisorConnectionException(message, e);
    } else {
      return new SupervisorException(message, e);
    }
  }

  static boolean isConnectionError(Throwable e) {
    return e instanceof IOException
        || e instanceof TimeoutException
        || e instanceof ShutdownSignalException;
  }

  /**
   * Whether the application closed the connection or channel itself.
   *
   * <p>{@link AlreadyClosedException} is a {@link ShutdownSignalException}, its flags are those of
   * the original closing.
   */
  static boolean initiatedByApplication(ShutdownSignalException e) {
    return e != null && e.isInitiatedByApplication();
  }

  /** Connection-level error, as opposed to a channel-level error. */
  static boolean hardError(ShutdownSignalException e) {
    return e != null && e.isHardError();
  }

  static String exceptionMessage(Throwable e) {
    if (e == null) {
      return "unknown";
    } else if (e.getMessage() == null) {
      return e.getClass().getSimpleName();
    } else {
      return e.getMessage() + " [" + e.getClass().getSimpleName() + "]";
    }
  }
}
