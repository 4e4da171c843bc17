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

package com.rackspace.timelens.app.services;

/**
 * A data provider call failed, for example because the underlying storage could not be read.
 */
public class ProviderUnavailableException extends RuntimeException {

  public ProviderUnavailableException(String message) {
    super(message);
  }

  public ProviderUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }

  public static ProviderUnavailableException wrap(Throwable throwable) {
    if (throwable instanceof ProviderUnavailableException) {
      return (ProviderUnavailableException) throwable;
    }
    return new ProviderUnavailableException("Data provider call failed: " + throwable.getMessage(),
        throwable);
  }
}
