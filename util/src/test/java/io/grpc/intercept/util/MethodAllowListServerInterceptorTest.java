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

package io.grpc.intercept.util;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import io.grpc.intercept.GenericRpcHandler;
import io.grpc.intercept.HandlerCallDetails;
import io.grpc.intercept.Metadata;
import io.grpc.intercept.MethodType;
import io.grpc.intercept.RpcException;
import io.grpc.intercept.RpcMethodHandler;
import io.grpc.intercept.ServerInterceptors;
import io.grpc.intercept.StatusCode;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/**
 * Tests for {@link MethodAllowListServerInterceptor}.
 */
@RunWith(JUnit4.class)
public class MethodAllowListServerInterceptorTest {
  private static final String ALLOWED = "/test.Echo/Say";
  private static final String FORBIDDEN = "/test.Admin/Shutdown";
  private static final RpcMethodHandler<String, String> HANDLER =
      RpcMethodHandler.unaryUnary((request, context) -> request, null, null);

  private final MethodAllowListServerInterceptor interceptor =
      MethodAllowListServerInterceptor.create(ImmutableList.of(ALLOWED));

  @Test
  public void allowedMethodProceeds() {
    RpcMethodHandler<?, ?> handler = interceptor.interceptService(
        details -> HANDLER, HandlerCallDetails.create(ALLOWED, Metadata.EMPTY));

    assertSame(HANDLER, handler);
  }

  @Test
  public void otherMethodIsRejectedWithoutLookup() {
    AtomicBoolean lookedUp = new AtomicBoolean();

    RpcMethodHandler<?, ?> handler = interceptor.interceptService(details -> {
      lookedUp.set(true);
      return HANDLER;
    }, HandlerCallDetails.create(FORBIDDEN, Metadata.EMPTY));

    assertFalse(lookedUp.get());
    assertEquals(MethodType.UNARY_UNARY, handler.getMethodType());
    RpcException e = assertThrows(RpcException.class,
        () -> handler.getUnaryUnary().invoke(null, null));
    assertEquals(StatusCode.PERMISSION_DENIED, e.getCode());
    assertEquals("Method not allowed: " + FORBIDDEN, e.getDescription());
  }

  @Test
  public void copiesAllowedMethods() {
    List<String> methods = new ArrayList<>();
    methods.add(ALLOWED);
    MethodAllowListServerInterceptor copied = MethodAllowListServerInterceptor.create(methods);

    methods.add(FORBIDDEN);

    assertThat(copied.getAllowedMethods()).containsExactly(ALLOWED);
  }

  @Test
  public void worksInsideServerPipeline() {
    List<HandlerCallDetails> lookups = new ArrayList<>();
    GenericRpcHandler registry = details -> {
      lookups.add(details);
      return details.getMethod().equals(ALLOWED) ? HANDLER : null;
    };
    GenericRpcHandler intercepted = ServerInterceptors.intercept(
        registry, interceptor, HeaderServerInterceptor.create("x-checked", "true"));

    assertSame(HANDLER, intercepted.service(HandlerCallDetails.create(ALLOWED, Metadata.EMPTY)));
    RpcMethodHandler<?, ?> rejected =
        intercepted.service(HandlerCallDetails.create(FORBIDDEN, Metadata.EMPTY));

    assertThat(lookups).containsExactly(
        HandlerCallDetails.create(ALLOWED, Metadata.of("x-checked", "true")));
    assertEquals(MethodType.UNARY_UNARY, rejected.getMethodType());
  }

  @Test
  public void unknownAllowedMethodResolvesToNull() {
    MethodAllowListServerInterceptor permissive =
        MethodAllowListServerInterceptor.create(ImmutableList.of("/test.Echo/Missing"));
    GenericRpcHandler intercepted = ServerInterceptors.intercept(details -> null, permissive);

    assertNull(
        intercepted.service(HandlerCallDetails.create("/test.Echo/Missing", Metadata.EMPTY)));
  }
}
