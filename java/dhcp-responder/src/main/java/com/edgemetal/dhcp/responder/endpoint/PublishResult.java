/*
 * Copyright 2015 VMware, Inc. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not
 * use this file except in compliance with the License.  You may obtain a copy of
 * the License at http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed
 * under the License is distributed on an "AS IS" BASIS, without warranties or
 * conditions of any kind, EITHER EXPRESS OR IMPLIED.  See the License for the
 * specific language governing permissions and limitations under the License.
 */

package com.edgemetal.dhcp.responder.endpoint;

/**
 * Outcome of {@link EndpointPublisher#publish}.
 */
public enum PublishResult {
  CREATED,
  UPDATED,
  /**
   * An endpoint with the same hardware address and IP already exists. Not an error.
   */
  ALREADY_EXISTS,
  /**
   * The hardware address is not managed by this responder.
   */
  SKIPPED
}
