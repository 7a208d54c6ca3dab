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

import com.google.common.util.concurrent.AbstractFuture;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import io.grpc.intercept.Metadata;
import io.grpc.intercept.RpcException;
import io.grpc.intercept.RpcFuture;
import io.grpc.intercept.StatusCode;
import java.time.Duration;
import javax.annotation.Nullable;

/**
 * An {@link RpcFuture} completed by the test.
 */
public final class SettableRpcFuture<V> extends AbstractFuture<V> implements RpcFuture<V> {
  private volatile StatusCode code = StatusCode.OK;

  @CanIgnoreReturnValue
  @Override
  public boolean set(@Nullable V value) {
    return super.set(value);
  }

  @CanIgnoreReturnValue
  @Override
  public boolean setException(Throwable throwable) {
    if (throwable instanceof RpcException) {
      code = ((RpcException) throwable).getCode();
    } else {
      code = StatusCode.UNKNOWN;
    }
    return super.setException(throwable);
  }

  @Override
  public boolean isActive() {
    return !isDone();
  }

  @Nullable
  @Override
  public Duration getTimeRemaining() {
    return null;
  }

  @Override
  public boolean cancel() {
    if (cancel(false)) {
      code = StatusCode.CANCELLED;
      return true;
    }
    return false;
  }

  @Override
  public boolean addCallback(Runnable callback) {
    if (isDone()) {
      return false;
    }
    addListener(callback, MoreExecutors.directExecutor());
    return true;
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
    return code;
  }

  @Nullable
  @Override
  public String getDetails() {
    return null;
  }
}
