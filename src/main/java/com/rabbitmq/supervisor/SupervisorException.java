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
package com.rabbitmq.supervisor;

public class SupervisorException extends RuntimeException {

  public SupervisorException(Throwable cause) {
    super(cause);
  }

  public SupervisorException(String format, Object... args) {
    super(String.format(format, args));
  }

  public SupervisorException(String message, Throwable cause) {
    super(message, cause);
  }

  /** A connection or a channel could not be created. */
  public static class SupervisorConnectionException extends SupervisorException {

    public SupervisorConnectionException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** No channel is available to run the requested operation. */
  public static class ChannelUnavailableException extends SupervisorException {

    public ChannelUnavailableException(String format, Object... args) {
      super(format, args);
    }

    public ChannelUnavailableException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** The broker has blocked the connection. */
  public static class ConnectionBlockedException extends SupervisorException {

    private final String reason;

    public ConnectionBlockedException(String reason) {
      super("Connection is blocked by the broker (reason: %s)", reason);
      this.reason = reason;
    }

    /**
     * The reason sent by the broker.
     *
     * @return the blocking reason
     */
    public String reason() {
      return this.reason;
    }
  }

  public static class WorkerNameAlreadyInUseException extends SupervisorException {

    public WorkerNameAlreadyInUseException(String name) {
      super("A channel worker named '%s' already exists", name);
    }
  }

  public static class SupervisorClosedException extends SupervisorException {

    public SupervisorClosedException(String message) {
      super(message);
    }
  }
}
