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

import com.rabbitmq.client.Connection;
import com.rabbitmq.supervisor.Resource;

/**
 * State of the {@link AmqpConnectionSupervisor} finite-state machine.
 *
 * <p>Only the supervisor event loop creates and reads instances.
 */
abstract class SupervisorState {

  static final SupervisorState DISCONNECTED = new Disconnected();
  static final SupervisorState CLOSED = new Closed();

  private SupervisorState() {}

  static Connected connected(Connection connection) {
    return new Connected(connection, null);
  }

  abstract Resource.State resourceState();

  static final class Disconnected extends SupervisorState {

    private Disconnected() {}

    @Override
    Resource.State resourceState() {
      return Resource.State.DISCONNECTED;
    }

    @Override
    public String toString() {
      return "Disconnected";
    }
  }

  static final class Connected extends SupervisorState {

    private final Connection connection;
    private final String blockedReason;

    private Connected(Connection connection, String blockedReason) {
      this.connection = connection;
      this.blockedReason = blockedReason;
    }

    Connection connection() {
      return this.connection;
    }

    /**
     * The reason the broker sent when it blocked the connection.
     *
     * @return the reason, null if the connection is not blocked
     */
    String blockedReason() {
      return this.blockedReason;
    }

    boolean blocked() {
      return this.blockedReason != null;
    }

    Connected blocked(String reason) {
      return new Connected(this.connection, reason);
    }

    Connected unblocked() {
      return new Connected(this.connection, null);
    }

    @Override
    Resource.State resourceState() {
      return Resource.State.CONNECTED;
    }

    @Override
    public String toString() {
      return "Connected{" + "connection=" + connection + ", blockedReason=" + blockedReason + '}';
    }
  }

  static final class Closed extends SupervisorState {

    private Closed() {}

    @Override
    Resource.State resourceState() {
      return Resource.State.CLOSED;
    }

    @Override
    public String toString() {
      return "Closed";
    }
  }
}
