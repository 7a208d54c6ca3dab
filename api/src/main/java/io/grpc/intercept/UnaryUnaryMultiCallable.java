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

/**
 * Affords invoking a unary-unary method.
 *
 * @param <ReqT> type of the request message
 * @param <RespT> type of the response message
 */
public interface UnaryUnaryMultiCallable<ReqT, RespT> {

  /**
   * Synchronously invokes the method.
   *
   * @return the response
   * @throws RpcException if the call terminated with a non-OK status
   */
  RespT call(ReqT request, CallOptions options);

  /**
   * Synchronously invokes the method, returning the response together with the call handle.
   *
   * @throws RpcException if the call terminated with a non-OK status
   */
  CallResult<RespT> withCall(ReqT request, CallOptions options);

  /**
   * Asynchronously invokes the method.
   */
  RpcFuture<RespT> future(ReqT request, CallOptions options);

  default RespT call(ReqT request) {
    return call(request, CallOptions.DEFAULT);
  }

  default CallResult<RespT> withCall(ReqT request) {
    return withCall(request, CallOptions.DEFAULT);
  }

  default RpcFuture<RespT> future(ReqT request) {
    return future(request, CallOptions.DEFAULT);
  }
}
