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

import static org.assertj.core.api.Assertions.fail;

import com.rabbitmq.supervisor.Resource;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.assertj.core.api.AbstractObjectAssert;

final class Assertions {

  private Assertions() {}

  static CountDownLatchAssert assertThat(CountDownLatch latch) {
    return new CountDownLatchAssert(latch);
  }

  static SyncAssert assertThat(TestUtils.Sync sync) {
    return new SyncAssert(sync);
  }

  static ResourceAssert assertThat(Resource resource) {
    return new ResourceAssert(resource);
  }

  static class CountDownLatchAssert
      extends AbstractObjectAssert<CountDownLatchAssert, CountDownLatch> {

    private CountDownLatchAssert(CountDownLatch latch) {
      super(latch, CountDownLatchAssert.class);
    }

    CountDownLatchAssert completes() {
      try {
        if (!actual.await(TestUtils.DEFAULT_CONDITION_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
          fail(
              "Latch still at %d after %s", actual.getCount(), TestUtils.DEFAULT_CONDITION_TIMEOUT);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IllegalStateException("Interrupted while waiting for latch", e);
      }
      return this;
    }
  }

  static class SyncAssert extends AbstractObjectAssert<SyncAssert, TestUtils.Sync> {

    private SyncAssert(TestUtils.Sync sync) {
      super(sync, SyncAssert.class);
    }

    SyncAssert completes() {
      return this.completes(TestUtils.DEFAULT_CONDITION_TIMEOUT);
    }

    SyncAssert completes(Duration timeout) {
      boolean completed = actual.await(timeout);
      if (!completed) {
        fail("Sync '%s' timed out after %d ms", this.actual.toString(), timeout.toMillis());
      }
      return this;
    }

    SyncAssert hasNotCompleted() {
      if (actual.hasCompleted()) {
        fail("Sync '%s' should not have completed", this.actual.toString());
      }
      return this;
    }
  }

  static class ResourceAssert extends AbstractObjectAssert<ResourceAssert, Resource> {

    private ResourceAssert(Resource resource) {
      super(resource, ResourceAssert.class);
    }

    ResourceAssert hasState(Resource.State expected) {
      Resource.State state = state();
      if (state != expected) {
        fail("Resource %s should be %s but is %s", actual, expected, state);
      }
      return this;
    }

    /** Waits for the asynchronous transition to the expected state. */
    ResourceAssert reaches(Resource.State expected) {
      TestUtils.waitAtMost(
          () -> state() == expected,
          () -> String.format("%s should be %s but is %s", actual, expected, state()));
      return this;
    }

    private Resource.State state() {
      if (actual instanceof ResourceBase) {
        return ((ResourceBase) actual).state();
      } else {
        fail("Unexpected resource type: %s", actual.getClass());
        return null;
      }
    }
  }
}
