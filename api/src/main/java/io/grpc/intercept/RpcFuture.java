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

import com.google.common.util.concurrent.ListenableFuture;

/**
 * The handle of an RPC with a single response: a future of that response that is also the
 * {@link Call}.
 *
 * <p>If the RPC fails, {@link #get} throws an {@link java.util.concurrent.ExecutionException}
 * whose cause is the exception the call failed with, usually an {@link RpcException}.
 *
 * @param <V> type of the response message
 */
public interface RpcFuture<V> extends ListenableFuture<V>, Call {
}
