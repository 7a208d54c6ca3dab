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
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/**
 * Tests for {@link ServicePipeline}.
 */
@RunWith(JUnit4.class)
public class ServicePipelineTest {
  private static final HandlerCallDetails DETAILS =
      HandlerCallDetails.create("/test.Echo/Say", Metadata.of("a", "1"));
  private static final RpcMethodHandler<String, String> HANDLER =
      RpcMethodHandler.unaryUnary((request, context) -> request, null, null);

  private final List<String> events = new ArrayList<>();

  @Test
  public void emptyPipelineIsNull() {
    assertNull(ServicePipeline.create(null));
    assertNull(ServicePipeline.create(Collections.<ServerInterceptor>emptyList()));
  }

  @Test
  public void interceptorsRunInOrderBeforeThunk() {
    ServicePipeline pipeline = ServicePipeline.create(
        Arrays.asList(recording("first"), recording("second"), recording("third")));

    RpcMethodHandler<?, ?> handler = pipeline.execute(details -> {
      events.add("thunk");
      return HANDLER;
    }, DETAILS);

    assertSame(HANDLER, handler);
    assertThat(events).containsExactly(
        "first before", "second before", "third before", "thunk",
        "third after", "second after", "first after").inOrder();
  }

  @Test
  public void singleInterceptor() {
    ServicePipeline pipeline = ServicePipeline.create(Arrays.asList(recording("only")));

    assertSame(HANDLER, pipeline.execute(details -> HANDLER, DETAILS));
    assertThat(events).containsExactly("only before", "only after").inOrder();
  }

  @Test
  public void interceptorCanShortCircuit() {
    final RpcMethodHandler<?, ?> denied = RpcMethodHandler.failing(
        MethodType.UNARY_UNARY, new RpcException(StatusCode.PERMISSION_DENIED));
    ServerInterceptor rejecting = (continuation, details) -> denied;
    ServicePipeline pipeline =
        ServicePipeline.create(Arrays.asList(recording("outer"), rejecting, recording("inner")));

    RpcMethodHandler<?, ?> handler = pipeline.execute(details -> {
      events.add("thunk");
      return HANDLER;
    }, DETAILS);

    assertSame(denied, handler);
    assertThat(events).containsExactly("outer before", "outer after").inOrder();
  }

  @Test
  public void interceptorCanRewriteDetails() {
    ServerInterceptor renaming = (continuation, details) ->
        continuation.proceed(details.withMethod("/test.Echo/Renamed"));
    final AtomicReference<HandlerCallDetails> seen = new AtomicReference<>();
    ServicePipeline pipeline = ServicePipeline.create(Arrays.asList(renaming));

    pipeline.execute(details -> {
      seen.set(details);
      return HANDLER;
    }, DETAILS);

    assertEquals("/test.Echo/Renamed", seen.get().getMethod());
    assertEquals(DETAILS.getInvocationMetadata(), seen.get().getInvocationMetadata());
  }

  @Test
  public void thunkReturningNullYieldsNull() {
    ServicePipeline pipeline = ServicePipeline.create(Arrays.asList(recording("only")));

    assertNull(pipeline.execute(details -> null, DETAILS));
  }

  @Test
  public void continuationMayRunMoreThanOnce() {
    ServerInterceptor twice = (continuation, details) -> {
      continuation.proceed(details);
      return continuation.proceed(details);
    };
    ServicePipeline pipeline = ServicePipeline.create(Arrays.asList(twice, recording("inner")));

    pipeline.execute(details -> HANDLER, DETAILS);

    assertThat(events).containsExactly(
        "inner before", "inner after", "inner before", "inner after").inOrder();
  }

  @Test
  public void pipelineIsReusable() {
    ServicePipeline pipeline = ServicePipeline.create(Arrays.asList(recording("only")));

    pipeline.execute(details -> HANDLER, DETAILS);
    pipeline.execute(details -> HANDLER, DETAILS);

    assertThat(events).hasSize(4);
  }

  @Test
  public void copiesInterceptorList() {
    List<ServerInterceptor> interceptors = new ArrayList<>();
    interceptors.add(recording("only"));
    ServicePipeline pipeline = ServicePipeline.create(interceptors);

    interceptors.add(recording("late"));

    assertThat(pipeline.getInterceptors()).hasSize(1);
  }

  @Test
  public void interceptorExceptionPropagates() {
    final IllegalStateException error = new IllegalStateException("boom");
    ServerInterceptor throwing = (continuation, details) -> {
      throw error;
    };
    ServicePipeline pipeline = ServicePipeline.create(Arrays.asList(recording("outer"), throwing));

    assertSame(error, assertThrows(IllegalStateException.class,
        () -> pipeline.execute(details -> HANDLER, DETAILS)));
    assertThat(events).containsExactly("outer before");
  }

  @Test
  public void rejectsNulls() {
    assertThrows(NullPointerException.class,
        () -> ServicePipeline.create(Arrays.asList(recording("a"), null)));
    ServicePipeline pipeline = ServicePipeline.create(Arrays.asList(recording("a")));
    assertThrows(NullPointerException.class, () -> pipeline.execute(null, DETAILS));
    assertThrows(NullPointerException.class, () -> pipeline.execute(details -> HANDLER, null));
  }

  private ServerInterceptor recording(final String name) {
    return (continuation, details) -> {
      events.add(name + " before");
      RpcMethodHandler<?, ?> handler = continuation.proceed(details);
      events.add(name + " after");
      return handler;
    };
  }
}
