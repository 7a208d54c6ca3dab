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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Throwables;
import com.google.common.util.concurrent.ForwardingListenableFuture.SimpleForwardingListenableFuture;
import com.google.common.util.concurrent.Futures;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import javax.annotation.Nullable;

/**
 * Call handles produced by the blocking paths of the single-response call chains, and the
 * unwrapping of a handle back into a response.
 */
final class RpcOutcomes {

  private RpcOutcomes() {}

  /**
   * Returns an already-completed handle for a call that returned {@code result}.
   */
  static <V> RpcFuture<V> completed(CallResult<V> result) {
    return new CompletedRpcFuture<>(result.getResponse(), result.getCall());
  }

  /**
   * Returns an already-failed handle for a call that threw {@code error}.
   */
  static <V> RpcFuture<V> failed(RuntimeException error) {
    return new FailedRpcFuture<>(error);
  }

  /**
   * Waits for {@code outcome} and returns its value. If it failed, the exception it failed with
   * is rethrown as-is.
   */
  static <V> V await(Future<V> outcome) {
    try {
      return outcome.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RpcException(StatusCode.CANCELLED, "Thread interrupted", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      Throwables.throwIfUnchecked(cause);
      throw new RpcException(StatusCode.UNKNOWN, "Call failed", cause);
    }
  }

  private static final class CompletedRpcFuture<V> extends SimpleForwardingListenableFuture<V>
      implements RpcFuture<V> {
    private final Call call;

    CompletedRpcFuture(V response, Call call) {
      super(Futures.immediateFuture(response));
      this.call = checkNotNull(call, "call");
    }

    @Override
    public boolean isActive() {
      return call.isActive();
    }

    @Nullable
    @Override
    public Duration getTimeRemaining() {
      return call.getTimeRemaining();
    }

    @Override
    public boolean cancel() {
      return call.cancel();
    }

    @Override
    public boolean addCallback(Runnable callback) {
      return call.addCallback(callback);
    }

    @Override
    public Metadata getInitialMetadata() {
      return call.getInitialMetadata();
    }

    @Override
    public Metadata getTrailingMetadata() {
      return call.getTrailingMetadata();
    }

    @Override
    public StatusCode getCode() {
      return call.getCode();
    }

    @Nullable
    @Override
    public String getDetails() {
      return call.getDetails();
    }
  }

  /**
   * The handle of a call that failed before or while it ran. If the failure is an
   * {@link RpcException} its status and trailers are reported; otherwise the call reports
   * {@link StatusCode#INTERNAL}.
   */
  private static final class FailedRpcFuture<V> extends SimpleForwardingListenableFuture<V>
      implements RpcFuture<V> {
    private final RuntimeException error;

    FailedRpcFuture(RuntimeException error) {
      super(Futures.<V>immediateFailedFuture(checkNotNull(error, "error")));
      this.error = error;
    }

    @Override
    public boolean isActive() {
      return false;
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
      return error instanceof RpcException ? ((RpcException) error).getTrailers() : Metadata.EMPTY;
    }

    @Override
    public StatusCode getCode() {
      return error instanceof RpcException ? ((RpcException) error).getCode() : StatusCode.INTERNAL;
    }

    @Nullable
    @Override
    public String getDetails() {
      return error instanceof RpcException
          ? ((RpcException) error).getDescription()
          : String.valueOf(error);
    }
  }
}
