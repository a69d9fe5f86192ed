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

import com.rabbitmq.client.Connection;

/**
 * Callback run against every new connection, before channel workers get their channels.
 *
 * <p>Typical usages are registering listeners on the connection or declaring topology that all
 * workers rely on. An exception thrown by the callback fails the connection attempt: the
 * connection is closed and a new attempt is scheduled.
 *
 * @see ConnectionSupervisorBuilder#setup(ConnectionSetup)
 */
@FunctionalInterface
public interface ConnectionSetup {

  /** Callback that does nothing. */
  ConnectionSetup NO_OP = (connection, supervisor) -> {};

  /**
   * Set up the new connection.
   *
   * @param connection the connection
   * @param supervisor the supervisor owning the connection
   * @throws Exception if the setup fails
   */
  void setup(Connection connection, ConnectionSupervisor supervisor) throws Exception;
}
