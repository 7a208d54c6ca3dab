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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.Iterables;
import com.google.common.collect.Lists;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Utility methods for working with {@link ClientInterceptor}s.
 */
public final class ClientInterceptors {
  private static final Logger logger = Logger.getLogger(ClientInterceptors.class.getName());

  // Prevent instantiation
  private ClientInterceptors() {}

  /**
   * Create a new {@link Channel} that will run calls through {@code interceptors} before they
   * reach the given channel. The first interceptor is outermost: it sees each call first and
   * returns last.
   *
   * @param channel the underlying channel to intercept.
   * @param interceptors array of interceptors to bind to {@code channel}.
   * @return a new channel instance with the interceptors applied, or {@code channel} itself if
   *     there are none.
   * @throws IllegalArgumentException if an interceptor declares no call shape, or a null one
   */
  public static Channel intercept(Channel channel, ClientInterceptor... interceptors) {
    return intercept(channel, Arrays.asList(interceptors));
  }

  /**
   * Create a new {@link Channel} that will run calls through {@code interceptors} before they
   * reach the given channel. The first interceptor is outermost: it sees each call first and
   * returns last.
   *
   * <p>Intercepting with {@code [a, b, c]} is equivalent to intercepting with {@code c}, then
   * intercepting the result with {@code b}, then that result with {@code a}.
   *
   * @param channel the underlying channel to intercept.
   * @param interceptors a list of interceptors to bind to {@code channel}.
   * @return a new channel instance with the interceptors applied, or {@code channel} itself if
   *     there are none.
   * @throws IllegalArgumentException if an interceptor declares no call shape, or a null one
   */
  public static Channel intercept(Channel channel, List<? extends ClientInterceptor> interceptors) {
    checkNotNull(channel, "channel");
    checkNotNull(interceptors, "interceptors");
    // Validate everything first so a bad interceptor leaves nothing half-built.
    for (ClientInterceptor interceptor : interceptors) {
      checkNotNull(interceptor, "interceptor");
      Set<MethodType> methodTypes = interceptor.interceptedMethodTypes();
      checkArgument(
          methodTypes != null && !methodTypes.isEmpty(),
          "%s must intercept at least one of %s",
          interceptor, Arrays.toString(MethodType.values()));
      checkArgument(
          !Iterables.contains(methodTypes, null),
          "%s declares a null method type: %s", interceptor, methodTypes);
    }
    for (ClientInterceptor interceptor : Lists.reverse(interceptors)) {
      channel = new InterceptorChannel(channel, interceptor);
    }
    if (!interceptors.isEmpty() && logger.isLoggable(Level.FINER)) {
      logger.log(Level.FINER, "Intercepted channel: {0}", channel);
    }
    return channel;
  }
}
