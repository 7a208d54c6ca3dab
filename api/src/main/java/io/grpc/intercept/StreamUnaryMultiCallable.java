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

import java.util.Iterator;

/**
 * Affords invoking a stream-unary method.
 *
 * <p>Request messages are pulled from the given iterator, which is consumed at most once and
 * never restarted. It may block while the producer prepares the next message.
 *
 * @param <ReqT> type of the request messages
 * @param <RespT> type of the response message
 */
public interface StreamUnaryMultiCallable<ReqT, RespT> {

  /**
   * Synchronously invokes the method.
   *
   * @return the response
   * @throws RpcException if the call terminated with a non-OK status
   */
  RespT call(Iterator<ReqT> requests, CallOptions options);

  /**
   * Synchronously invokes the method, returning the response together with the call handle.
   *
   * @throws RpcException if the call terminated with a non-OK status
   */
  CallResult<RespT> withCall(Iterator<ReqT> requests, CallOptions options);

  /**
   * Asynchronously invokes the method.
   */
  RpcFuture<RespT> future(Iterator<ReqT> requests, CallOptions options);

  default RespT call(Iterator<ReqT> requests) {
    return call(requests, CallOptions.DEFAULT);
  }

  default CallResult<RespT> withCall(Iterator<ReqT> requests) {
    return withCall(requests, CallOptions.DEFAULT);
  }

  default RpcFuture<RespT> future(Iterator<ReqT> requests) {
    return future(requests, CallOptions.DEFAULT);
  }
}
