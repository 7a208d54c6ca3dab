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

import static com.google.common.base.Preconditions.checkNotNull;

import javax.annotation.Nullable;

/**
 * A call that completed with a status other than {@link StatusCode#OK}, in RuntimeException form.
 *
 * <p>Transports raise this from the real call; interceptors may raise it to reject a call. The
 * interceptor pipeline propagates it unchanged.
 */
public class RpcException extends RuntimeException {

  private static final long serialVersionUID = 6914728531205466581L;

  private final StatusCode code;
  @Nullable
  private final String description;
  private final Metadata trailers;

  public RpcException(StatusCode code) {
    this(code, null);
  }

  public RpcException(StatusCode code, @Nullable String description) {
    this(code, description, null, Metadata.EMPTY);
  }

  public RpcException(StatusCode code, @Nullable String description, @Nullable Throwable cause) {
    this(code, description, cause, Metadata.EMPTY);
  }

  /**
   * Constructs an exception with status code, description, cause and trailers.
   */
  public RpcException(
      StatusCode code, @Nullable String description, @Nullable Throwable cause,
      Metadata trailers) {
    super(formatMessage(code, description), cause);
    this.code = checkNotNull(code, "code");
    this.description = description;
    this.trailers = checkNotNull(trailers, "trailers");
  }

  public final StatusCode getCode() {
    return code;
  }

  @Nullable
  public final String getDescription() {
    return description;
  }

  /**
   * Returns the trailing metadata received with the status. Never {@code null}.
   */
  public final Metadata getTrailers() {
    return trailers;
  }

  private static String formatMessage(StatusCode code, @Nullable String description) {
    if (description == null) {
      return String.valueOf(code);
    }
    return code + ": " + description;
  }
}
