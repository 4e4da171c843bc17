/*
 * Copyright 2020 Rackspace US, Inc.
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


package com.rackspace.timelens.app.resolution;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

class CancellationTokenTest {

  @Test
  void cancelledRequestCompletesEmpty() {
    final CancellationToken token = new CancellationToken(3);
    final Sinks.One<String> response = Sinks.one();

    StepVerifier.create(token.guard(response.asMono()))
        .then(token::cancel)
        .then(() -> response.tryEmitValue("late"))
        .verifyComplete();

    assertThat(token.isCancelled()).isTrue();
    assertThat(token.getGeneration()).isEqualTo(3);
  }

  @Test
  void passesResultWhileActive() {
    final CancellationToken token = new CancellationToken(1);
    final Sinks.One<String> response = Sinks.one();

    StepVerifier.create(token.guard(response.asMono()))
        .then(() -> response.tryEmitValue("bins"))
        .expectNext("bins")
        .verifyComplete();

    // cancelling after completion has no effect on the delivered result
    token.cancel();
    token.cancel();
    assertThat(token.isCancelled()).isTrue();
  }

  @Test
  void cancelledBeforeSubscribe() {
    final CancellationToken token = new CancellationToken(1);
    token.cancel();

    StepVerifier.create(token.guard(Sinks.<String>one().asMono()))
        .expectComplete()
        .verify(Duration.ofSeconds(1));
  }
}
