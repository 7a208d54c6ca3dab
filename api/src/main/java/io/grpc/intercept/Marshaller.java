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

import java.io.InputStream;

/**
 * A typed abstraction over message serialization and deserialization, a.k.a. marshalling and
 * unmarshalling.
 *
 * <p>Interceptors never call a marshaller; they hand it through to the {@link Channel} that owns
 * the wire format. Stub implementations will define implementations of this interface for each
 * of the request and response messages provided by a service.
 *
 * @param <T> type of serializable message
 */
public interface Marshaller<T> {
  /**
   * Given a message, produce an {@link InputStream} for it so that it can be written to the wire.
   *
   * @param value to serialize.
   * @return serialized value as stream of bytes.
   */
  InputStream stream(T value);

  /**
   * Given an {@link InputStream} parse it into an instance of the declared type so that it can be
   * passed to application code.
   *
   * @param stream of bytes for serialized value
   * @return parsed value
   */
  T parse(InputStream stream);
}
