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
 * The server-side context of an RPC, handed to a method handler's behavior by the transport.
 */
public interface ServicerContext extends RpcContext {

  /**
   * Returns the metadata sent by the client.
   */
  Metadata getInvocationMetadata();

  /**
   * Returns an identifier of the peer that invoked the RPC.
   */
  String getPeer();

  /**
   * Sends the initial metadata. May be called at most once, before any response is sent.
   */
  void sendInitialMetadata(Metadata initialMetadata);

  /**
   * Sets the trailing metadata sent when the RPC terminates.
   */
  void setTrailingMetadata(Metadata trailingMetadata);

  /**
   * Terminates the RPC with the given non-OK status. Never returns normally.
   *
   * @throws RpcException always
   */
  void abort(StatusCode code, @Nullable String details);
}
