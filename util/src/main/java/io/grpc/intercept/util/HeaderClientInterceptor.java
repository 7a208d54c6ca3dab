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

import com.google.common.collect.Sets;
import io.grpc.intercept.CallDetails;
import io.grpc.intercept.ClientInterceptor;
import io.grpc.intercept.Metadata;
import io.grpc.intercept.MethodType;
import io.grpc.intercept.ResponseStream;
import io.grpc.intercept.RpcFuture;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.Set;
import javax.annotation.concurrent.Immutable;

/**
 * A {@link ClientInterceptor} that appends a fixed set of headers to the metadata of every call,
 * after whatever metadata the call already carries.
 */
@Immutable
public final class HeaderClientInterceptor implements ClientInterceptor {
  private static final Set<MethodType> ALL_METHOD_TYPES =
      Sets.immutableEnumSet(EnumSet.allOf(MethodType.class));

  private final Metadata headers;

  private HeaderClientInterceptor(Metadata headers) {
    this.headers = headers;
  }

  /**
   * Returns an interceptor that appends {@code headers} to every call.
   */
  public static HeaderClientInterceptor create(Metadata headers) {
    return new HeaderClientInterceptor(checkNotNull(headers, "headers"));
  }

  /**
   * Returns an interceptor that appends the single header {@code key: value} to every call.
   */
  public static HeaderClientInterceptor create(String key, String value) {
    return create(Metadata.of(key, value));
  }

  @Override
  public Set<MethodType> interceptedMethodTypes() {
    return ALL_METHOD_TYPES;
  }

  @Override
  public <ReqT, RespT> RpcFuture<RespT> interceptUnaryUnary(
      UnaryUnaryContinuation<ReqT, RespT> continuation, CallDetails<ReqT, RespT> callDetails,
      ReqT request) {
    return continuation.proceed(withHeaders(callDetails), request);
  }

  @Override
  public <ReqT, RespT> ResponseStream<RespT> interceptUnaryStream(
      UnaryStreamContinuation<ReqT, RespT> continuation, CallDetails<ReqT, RespT> callDetails,
      ReqT request) {
    return continuation.proceed(withHeaders(callDetails), request);
  }

  @Override
  public <ReqT, RespT> RpcFuture<RespT> interceptStreamUnary(
      StreamUnaryContinuation<ReqT, RespT> continuation, CallDetails<ReqT, RespT> callDetails,
      Iterator<ReqT> requests) {
    return continuation.proceed(withHeaders(callDetails), requests);
  }

  @Override
  public <ReqT, RespT> ResponseStream<RespT> interceptStreamStream(
      StreamStreamContinuation<ReqT, RespT> continuation, CallDetails<ReqT, RespT> callDetails,
      Iterator<ReqT> requests) {
    return continuation.proceed(withHeaders(callDetails), requests);
  }

  private <ReqT, RespT> CallDetails<ReqT, RespT> withHeaders(
      CallDetails<ReqT, RespT> callDetails) {
    return callDetails.withMetadata(callDetails.getMetadata().withAll(headers));
  }

  @Override
  public String toString() {
    return "HeaderClientInterceptor{headers=" + headers + "}";
  }
}
