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

import lombok.Getter;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Created per domain request and threaded through its provider calls. Cancelling the token makes
 * every guarded {@link Mono} complete empty, dropping whatever the provider returns later.
 */
public class CancellationToken {

  @Getter
  private final long generation;
  private final Sinks.One<Boolean> cancelSignal = Sinks.one();
  private boolean cancelled;

  public CancellationToken(long generation) {
    this.generation = generation;
  }

  public void cancel() {
    if (!cancelled) {
      cancelled = true;
      cancelSignal.tryEmitValue(Boolean.TRUE);
    }
  }

  public boolean isCancelled() {
    return cancelled;
  }

  public <T> Mono<T> guard(Mono<T> source) {
    return source.takeUntilOther(cancelSignal.asMono());
  }
}
