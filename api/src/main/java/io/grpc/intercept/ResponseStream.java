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
 * The handle of an RPC with a stream of responses: a blocking iterator over the responses that is
 * also the {@link Call}.
 *
 * <p>{@link #hasNext} and {@link #next} block until the next response arrives or the RPC
 * terminates. If the RPC fails they throw the exception it failed with, usually an
 * {@link RpcException}. The iterator is single-pass.
 *
 * @param <V> type of the response message
 */
public interface ResponseStream<V> extends Iterator<V>, Call {
}
