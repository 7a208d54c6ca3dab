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

import com.google.common.base.MoreObjects;
import java.time.Duration;
import javax.annotation.Nullable;

/**
 * A {@link ResponseStream} which forwards all of its methods to another {@link ResponseStream}.
 * Subclasses override the methods they want to observe or change.
 */
public abstract class ForwardingResponseStream<V> implements ResponseStream<V> {

  /**
   * Returns the delegated {@code ResponseStream}.
   */
  protected abstract ResponseStream<V> delegate();

  @Override
  public boolean hasNext() {
    return delegate().hasNext();
  }

  @Override
  public V next() {
    return delegate().next();
  }

  @Override
  public boolean isActive() {
    return delegate().isActive();
  }

  @Nullable
  @Override
  public Duration getTimeRemaining() {
    return delegate().getTimeRemaining();
  }

  @Override
  public boolean cancel() {
    return delegate().cancel();
  }

  @Override
  public boolean addCallback(Runnable callback) {
    return delegate().addCallback(callback);
  }

  @Override
  public Metadata getInitialMetadata() {
    return delegate().getInitialMetadata();
  }

  @Override
  public Metadata getTrailingMetadata() {
    return delegate().getTrailingMetadata();
  }

  @Override
  public StatusCode getCode() {
    return delegate().getCode();
  }

  @Nullable
  @Override
  public String getDetails() {
    return delegate().getDetails();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("delegate", delegate()).toString();
  }

  /**
   * A simplified version of {@link ForwardingResponseStream} where subclasses can pass in an
   * already constructed {@link ResponseStream} as the delegate.
   */
  public abstract static class SimpleForwardingResponseStream<V>
      extends ForwardingResponseStream<V> {
    private final ResponseStream<V> delegate;

    protected SimpleForwardingResponseStream(ResponseStream<V> delegate) {
      this.delegate = delegate;
    }

    @Override
    protected final ResponseStream<V> delegate() {
      return delegate;
    }
  }
}
