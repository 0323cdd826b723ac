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

package com.edgemetal.dhcp.responder.protocol;

/**
 * A decoded DHCPv6 option.
 */
public interface Dhcp6Option {

  int OPTION_IA_NA = 3;
  int OPTION_IAADDR = 5;
  int OPTION_IA_PD = 25;
  int OPTION_IAPREFIX = 26;
  int OPTION_CLIENT_LINKLAYER_ADDR = 79;

  int getCode();
}
