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

import java.util.Arrays;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Utility methods for working with {@link ServerInterceptor}s.
 */
public final class ServerInterceptors {
  private static final Logger logger = Logger.getLogger(ServerInterceptors.class.getName());

  // Prevent instantiation
  private ServerInterceptors() {}

  /**
   * Create a new {@link GenericRpcHandler} whose lookups pass through {@code interceptors} before
   * reaching {@code handler}. The first interceptor will have its
   * {@link ServerInterceptor#interceptService} called first.
   *
   * @param handler the handler lookup to intercept.
   * @param interceptors array of interceptors to apply.
   * @return a wrapped version of {@code handler}, or {@code handler} itself if there are no
   *     interceptors.
   */
  public static GenericRpcHandler intercept(
      GenericRpcHandler handler, ServerInterceptor... interceptors) {
    return intercept(handler, Arrays.asList(interceptors));
  }

  /**
   * Create a new {@link GenericRpcHandler} whose lookups pass through {@code interceptors} before
   * reaching {@code handler}. The first interceptor will have its
   * {@link ServerInterceptor#interceptService} called first.
   *
   * @param handler the handler lookup to intercept.
   * @param interceptors list of interceptors to apply.
   * @return a wrapped version of {@code handler}, or {@code handler} itself if there are no
   *     interceptors.
   */
  public static GenericRpcHandler intercept(
      GenericRpcHandler handler, List<? extends ServerInterceptor> interceptors) {
    checkNotNull(handler, "handler");
    ServicePipeline pipeline = ServicePipeline.create(interceptors);
    if (pipeline == null) {
      return handler;
    }
    return new InterceptedRpcHandler(handler, pipeline);
  }

  private static final class InterceptedRpcHandler implements GenericRpcHandler {
    private final GenericRpcHandler delegate;
    private final ServicePipeline pipeline;

    InterceptedRpcHandler(GenericRpcHandler delegate, ServicePipeline pipeline) {
      this.delegate = delegate;
      this.pipeline = pipeline;
    }

    @Nullable
    @Override
    public RpcMethodHandler<?, ?> service(HandlerCallDetails handlerCallDetails) {
      RpcMethodHandler<?, ?> handler = pipeline.execute(delegate::service, handlerCallDetails);
      if (handler == null) {
        logger.log(Level.FINE, "No handler resolved for {0}", handlerCallDetails.getMethod());
      }
      return handler;
    }

    @Override
    public String toString() {
      return "InterceptedRpcHandler{delegate=" + delegate + ", pipeline=" + pipeline + "}";
    }
  }
}
