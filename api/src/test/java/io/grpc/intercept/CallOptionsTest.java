/*
 * Copyright 2024 The gRPC Authors
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

package io.grpc.intercept;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/**
 * Tests for {@link CallOptions}.
 */
@RunWith(JUnit4.class)
public class CallOptionsTest {

  @Test
  public void defaultsAreUnset() {
    assertNull(CallOptions.DEFAULT.getTimeout());
    assertSame(Metadata.EMPTY, CallOptions.DEFAULT.getMetadata());
    assertNull(CallOptions.DEFAULT.getCredentials());
  }

  @Test
  public void withMethodsDoNotMutate() {
    CallOptions options = CallOptions.DEFAULT.withTimeout(3, TimeUnit.SECONDS);

    assertEquals(Duration.ofSeconds(3), options.getTimeout());
    assertNull(CallOptions.DEFAULT.getTimeout());
    assertEquals(options, CallOptions.DEFAULT.withTimeout(Duration.ofSeconds(3)));
  }

  @Test
  public void rejectsNegativeTimeout() {
    assertThrows(IllegalArgumentException.class,
        () -> CallOptions.DEFAULT.withTimeout(-1, TimeUnit.SECONDS));
  }

  @Test
  public void rejectsNullMetadata() {
    assertThrows(NullPointerException.class, () -> CallOptions.DEFAULT.withMetadata(null));
  }
}
