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

import javax.annotation.Nullable;

/**
 * The client-side handle of an RPC: its context plus what the server sent back besides messages.
 *
 * <p>The accessors for metadata, code and details block until the server has sent them.
 */
public interface Call extends RpcContext {

  /**
   * Returns the initial metadata sent by the server.
   */
  Metadata getInitialMetadata();

  /**
   * Returns the trailing metadata sent by the server.
   */
  Metadata getTrailingMetadata();

  /**
   * Returns the status code the RPC completed with.
   */
  StatusCode getCode();

  /**
   * Returns the status description the RPC completed with, if any.
   */
  @Nullable
  String getDetails();
}
