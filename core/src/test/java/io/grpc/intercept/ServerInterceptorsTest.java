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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnit;
import org.mockito.junit.MockitoRule;

/**
 * Tests for {@link ServerInterceptors}.
 */
@RunWith(JUnit4.class)
public class ServerInterceptorsTest {
  private static final HandlerCallDetails DETAILS =
      HandlerCallDetails.create("/test.Echo/Say", Metadata.EMPTY);

  @Rule public final MockitoRule mocks = MockitoJUnit.rule();

  @Mock private GenericRpcHandler handler;

  private final RpcMethodHandler<String, String> methodHandler =
      RpcMethodHandler.unaryUnary((request, context) -> request, null, null);

  @Test
  public void noInterceptorsReturnsSameHandler() {
    assertSame(handler, ServerInterceptors.intercept(handler));
    assertSame(handler,
        ServerInterceptors.intercept(handler, Collections.<ServerInterceptor>emptyList()));
  }

  @Test
  public void lookupsPassThroughInterceptors() {
    stubService(methodHandler);
    final List<String> seen = new ArrayList<>();
    GenericRpcHandler intercepted = ServerInterceptors.intercept(handler,
        (continuation, details) -> {
          seen.add("first " + details.getMethod());
          return continuation.proceed(details);
        },
        (continuation, details) -> {
          seen.add("second " + details.getMethod());
          return continuation.proceed(details.withInvocationMetadata(Metadata.of("b", "2")));
        });

    assertSame(methodHandler, intercepted.service(DETAILS));
    assertThat(seen).containsExactly("first /test.Echo/Say", "second /test.Echo/Say").inOrder();
    verify(handler).service(HandlerCallDetails.create("/test.Echo/Say", Metadata.of("b", "2")));
  }

  @Test
  public void interceptorCanReplaceHandler() {
    final RpcMethodHandler<?, ?> replacement = RpcMethodHandler.failing(
        MethodType.UNARY_UNARY, new RpcException(StatusCode.UNIMPLEMENTED));
    GenericRpcHandler intercepted =
        ServerInterceptors.intercept(handler, (continuation, details) -> replacement);

    assertSame(replacement, intercepted.service(DETAILS));
    verifyNoInteractions(handler);
  }

  @Test
  public void unresolvedLookupReturnsNull() {
    GenericRpcHandler intercepted = ServerInterceptors.intercept(
        handler, (continuation, details) -> continuation.proceed(details));

    assertNull(intercepted.service(DETAILS));
    verify(handler).service(DETAILS);
  }

  private void stubService(RpcMethodHandler<?, ?> result) {
    // service() returns a wildcard type, which thenReturn cannot capture directly.
    when(handler.service(any(HandlerCallDetails.class))).thenAnswer(invocation -> result);
  }
}
