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

import com.rabbitmq.client.BlockedListener;
import com.rabbitmq.client.Connection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Forwards connection.blocked and connection.unblocked notifications to the supervisor. */
final class BlockedConnectionSupport implements BlockedListener {

  private static final Logger LOGGER = LoggerFactory.getLogger(BlockedConnectionSupport.class);

  private final Connection connection;
  private final AmqpConnectionSupervisor supervisor;

  private BlockedConnectionSupport(Connection connection, AmqpConnectionSupervisor supervisor) {
    this.connection = connection;
    this.supervisor = supervisor;
  }

  static void register(Connection connection, AmqpConnectionSupervisor supervisor) {
    connection.addBlockedListener(new BlockedConnectionSupport(connection, supervisor));
  }

  @Override
  public void handleBlocked(String reason) {
    LOGGER.debug("Connection {} blocked by broker: {}", this.connection, reason);
    this.supervisor.queueBlocked(this.connection, reason);
  }

  @Override
  public void handleUnblocked() {
    LOGGER.debug("Connection {} unblocked by broker", this.connection);
    this.supervisor.queueUnblocked(this.connection);
  }
}
