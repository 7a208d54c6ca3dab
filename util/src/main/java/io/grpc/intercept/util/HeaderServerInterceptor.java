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

import io.grpc.intercept.HandlerCallDetails;
import io.grpc.intercept.Metadata;
import io.grpc.intercept.RpcMethodHandler;
import io.grpc.intercept.ServerInterceptor;
import io.grpc.intercept.ServiceContinuation;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * A {@link ServerInterceptor} that appends a fixed set of entries to the invocation metadata of
 * every incoming call before the rest of the chain resolves its handler.
 */
@Immutable
public final class HeaderServerInterceptor implements ServerInterceptor {
  private final Metadata headers;

  private HeaderServerInterceptor(Metadata headers) {
    this.headers = headers;
  }

  public static HeaderServerInterceptor create(Metadata headers) {
    return new HeaderServerInterceptor(checkNotNull(headers, "headers"));
  }

  public static HeaderServerInterceptor create(String key, String value) {
    return create(Metadata.of(key, value));
  }

  @Nullable
  @Override
  public RpcMethodHandler<?, ?> interceptService(
      ServiceContinuation continuation, HandlerCallDetails handlerCallDetails) {
    return continuation.proceed(handlerCallDetails.withInvocationMetadata(
        handlerCallDetails.getInvocationMetadata().withAll(headers)));
  }

  @Override
  public String toString() {
    return "HeaderServerInterceptor{headers=" + headers + "}";
  }
}
