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

package io.grpc.intercept.testing;

import io.grpc.intercept.Metadata;
import io.grpc.intercept.ResponseStream;
import io.grpc.intercept.StatusCode;
import java.time.Duration;
import java.util.Iterator;
import javax.annotation.Nullable;

/**
 * A response stream over a fixed sequence of messages that terminates with {@link StatusCode#OK}.
 */
public final class FakeResponseStream<V> implements ResponseStream<V> {
  private final Iterator<V> responses;

  public FakeResponseStream(Iterator<V> responses) {
    this.responses = responses;
  }

  @Override
  public boolean hasNext() {
    return responses.hasNext();
  }

  @Override
  public V next() {
    return responses.next();
  }

  @Override
  public boolean isActive() {
    return responses.hasNext();
  }

  @Nullable
  @Override
  public Duration getTimeRemaining() {
    return null;
  }

  @Override
  public boolean cancel() {
    return false;
  }

  @Override
  public boolean addCallback(Runnable callback) {
    return false;
  }

  @Override
  public Metadata getInitialMetadata() {
    return Metadata.EMPTY;
  }

  @Override
  public Metadata getTrailingMetadata() {
    return Metadata.EMPTY;
  }

  @Override
  public StatusCode getCode() {
    return StatusCode.OK;
  }

  @Nullable
  @Override
  public String getDetails() {
    return null;
  }
}
