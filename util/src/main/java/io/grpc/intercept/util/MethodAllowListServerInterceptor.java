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

package io.grpc.intercept.util;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableSet;
import io.grpc.intercept.HandlerCallDetails;
import io.grpc.intercept.MethodType;
import io.grpc.intercept.RpcException;
import io.grpc.intercept.RpcMethodHandler;
import io.grpc.intercept.ServerInterceptor;
import io.grpc.intercept.ServiceContinuation;
import io.grpc.intercept.StatusCode;
import java.util.Collection;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * A {@link ServerInterceptor} that only lets calls to a fixed set of methods through. Calls to
 * any other method get a handler that fails them with {@link StatusCode#PERMISSION_DENIED}; the
 * rest of the chain and the real lookup are never consulted for them.
 *
 * <p>The rejecting handler is unary-unary, since the shape of an unlisted method is not known
 * without looking it up.
 */
@Immutable
public final class MethodAllowListServerInterceptor implements ServerInterceptor {
  private static final Logger logger =
      Logger.getLogger(MethodAllowListServerInterceptor.class.getName());

  private final ImmutableSet<String> allowedMethods;

  private MethodAllowListServerInterceptor(ImmutableSet<String> allowedMethods) {
    this.allowedMethods = allowedMethods;
  }

  /**
   * Returns an interceptor that allows only the given fully qualified method names.
   */
  public static MethodAllowListServerInterceptor create(Collection<String> allowedMethods) {
    checkNotNull(allowedMethods, "allowedMethods");
    return new MethodAllowListServerInterceptor(ImmutableSet.copyOf(allowedMethods));
  }

  public Set<String> getAllowedMethods() {
    return allowedMethods;
  }

  @Nullable
  @Override
  public RpcMethodHandler<?, ?> interceptService(
      ServiceContinuation continuation, HandlerCallDetails handlerCallDetails) {
    String method = handlerCallDetails.getMethod();
    if (allowedMethods.contains(method)) {
      return continuation.proceed(handlerCallDetails);
    }
    logger.log(Level.FINE, "Rejecting call to {0}: method is not allowed", method);
    return RpcMethodHandler.failing(
        MethodType.UNARY_UNARY,
        new RpcException(StatusCode.PERMISSION_DENIED, "Method not allowed: " + method));
  }
}
