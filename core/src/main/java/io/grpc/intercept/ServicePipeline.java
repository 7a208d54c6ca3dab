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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import java.util.List;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Runs the handler lookup of incoming calls through an ordered list of
 * {@link ServerInterceptor}s. The first interceptor sees each lookup first.
 *
 * <p>For interceptors {@code i0 .. in-1} and a terminal lookup {@code t}, the continuation given
 * to {@code ik} runs {@code ik+1} with the continuation after it, and the continuation given to
 * the last interceptor is {@code t} itself. Continuations are created per call and hold nothing
 * but their index and the terminal lookup.
 */
@ThreadSafe
public final class ServicePipeline {
  private final ImmutableList<ServerInterceptor> interceptors;

  private ServicePipeline(ImmutableList<ServerInterceptor> interceptors) {
    this.interceptors = interceptors;
  }

  /**
   * Creates a pipeline of the given interceptors, in order.
   *
   * @return the pipeline, or {@code null} if {@code interceptors} is {@code null} or empty, in
   *     which case the caller should look handlers up directly
   * @throws NullPointerException if any interceptor is {@code null}
   */
  @Nullable
  public static ServicePipeline create(@Nullable List<? extends ServerInterceptor> interceptors) {
    if (interceptors == null || interceptors.isEmpty()) {
      return null;
    }
    return new ServicePipeline(ImmutableList.copyOf(interceptors));
  }

  /**
   * Resolves the handler for one incoming call.
   *
   * @param thunk the real handler lookup, run by the innermost continuation
   * @param handlerCallDetails the method and metadata of the call
   * @return what the outermost interceptor returns
   */
  @Nullable
  public RpcMethodHandler<?, ?> execute(
      ServiceContinuation thunk, HandlerCallDetails handlerCallDetails) {
    checkNotNull(thunk, "thunk");
    checkNotNull(handlerCallDetails, "handlerCallDetails");
    return continuationAt(0, thunk).proceed(handlerCallDetails);
  }

  @VisibleForTesting
  List<ServerInterceptor> getInterceptors() {
    return interceptors;
  }

  private ServiceContinuation continuationAt(int index, ServiceContinuation thunk) {
    if (index < interceptors.size()) {
      return new IndexedContinuation(index, thunk);
    }
    return thunk;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("interceptors", interceptors).toString();
  }

  private final class IndexedContinuation implements ServiceContinuation {
    private final int index;
    private final ServiceContinuation thunk;

    IndexedContinuation(int index, ServiceContinuation thunk) {
      this.index = index;
      this.thunk = thunk;
    }

    @Nullable
    @Override
    public RpcMethodHandler<?, ?> proceed(HandlerCallDetails handlerCallDetails) {
      return interceptors.get(index)
          .interceptService(continuationAt(index + 1, thunk), handlerCallDetails);
    }
  }
}
