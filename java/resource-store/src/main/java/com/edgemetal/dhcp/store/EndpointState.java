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

package com.edgemetal.dhcp.store;

/**
 * Binds a host name to a MAC address and an IP address. Cluster scoped.
 */
public class EndpointState extends ResourceDocument {

  /**
   * MAC address of host, lower-case colon separated.
   */
  public String macAddress;

  public String ip;

  public void copyTo(EndpointState target) {
    super.copyTo(target);
    target.macAddress = this.macAddress;
    target.ip = this.ip;
  }
}
