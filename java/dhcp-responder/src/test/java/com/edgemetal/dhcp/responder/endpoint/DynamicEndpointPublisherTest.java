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

import com.edgemetal.dhcp.responder.protocol.HardwareAddress;
import com.edgemetal.dhcp.store.EndpointState;
import com.edgemetal.dhcp.store.LabelSelector;
import com.edgemetal.dhcp.store.exceptions.ResourceConflictException;
import com.edgemetal.dhcp.store.exceptions.StoreException;
import com.edgemetal.dhcp.store.memory.InMemoryResourceStore;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.testng.Assert.fail;

import static com.edgemetal.dhcp.responder.protocol.TestMessages.ipv4;
import static com.edgemetal.dhcp.responder.protocol.TestMessages.ipv6;

import java.util.List;

/**
 * Tests {@link DynamicEndpointPublisher}.
 */
public class DynamicEndpointPublisherTest {

  private static final HardwareAddress MAC = HardwareAddress.parse("00:1a:2b:3c:4d:5e");

  private InMemoryResourceStore store;
  private DynamicEndpointPublisher publisher;

  @BeforeMethod
  public void setUp() {
    store = spy(new InMemoryResourceStore());
    publisher = new DynamicEndpointPublisher(store,
        new Inventory(ImmutableMap.<HardwareAddress, String>of(), ImmutableList.of("00:1a:2b"), "server-"));
  }

  @Test
  public void testCreatesEndpointWithGeneratedName() throws Exception {
    assertThat(publisher.publish(MAC, ipv6("2001:db8::5")), is(PublishResult.CREATED));

    List<EndpointState> endpoints = endpoints();
    assertThat(endpoints, hasSize(1));
    assertThat(endpoints.get(0).name, startsWith("server-"));
    assertThat(endpoints.get(0).macAddress, is("00:1a:2b:3c:4d:5e"));
    assertThat(endpoints.get(0).ip, is("2001:db8::5"));
  }

  @Test
  public void testSameAddressIsNotWrittenAgain() throws Exception {
    publisher.publish(MAC, ipv6("2001:db8::5"));

    assertThat(publisher.publish(MAC, ipv6("2001:db8::5")), is(PublishResult.ALREADY_EXISTS));
    verify(store, times(1)).create(any(EndpointState.class));
    verify(store, never()).update(any(EndpointState.class));
  }

  @Test
  public void testMatchesEndpointsWrittenInOtherNotation() throws Exception {
    EndpointState endpoint = new EndpointState();
    endpoint.name = "server-abcde";
    endpoint.namespace = EndpointPublisher.CLUSTER_SCOPE;
    endpoint.macAddress = "00-1A-2B-3C-4D-5E";
    endpoint.ip = "2001:db8:0:0::5";
    store.create(endpoint);

    assertThat(publisher.publish(MAC, ipv6("2001:db8::5")), is(PublishResult.ALREADY_EXISTS));
  }

  @Test
  public void testChangedAddressIsUpdatedOnce() throws Exception {
    publisher.publish(MAC, ipv6("2001:db8::5"));
    String name = endpoints().get(0).name;

    assertThat(publisher.publish(MAC, ipv6("2001:db8::6")), is(PublishResult.UPDATED));

    verify(store, times(1)).create(any(EndpointState.class));
    verify(store, times(1)).update(any(EndpointState.class));
    List<EndpointState> endpoints = endpoints();
    assertThat(endpoints, hasSize(1));
    assertThat(endpoints.get(0).name, is(name));
    assertThat(endpoints.get(0).ip, is("2001:db8::6"));
  }

  @Test
  public void testConflictIsNotRetried() throws Exception {
    publisher.publish(MAC, ipv4("10.0.0.5"));
    doThrow(new ResourceConflictException("modified")).when(store).update(any(EndpointState.class));

    try {
      publisher.publish(MAC, ipv4("10.0.0.6"));
      fail("conflict should have been reported");
    } catch (EndpointPublishException e) {
      assertThat(e.getCause(), is(instanceOf(ResourceConflictException.class)));
    }
    verify(store, times(1)).update(any(EndpointState.class));
  }

  @Test
  public void testUnknownPrefixIsSkipped() throws Exception {
    assertThat(publisher.publish(HardwareAddress.parse("aa:bb:cc:dd:ee:ff"), ipv4("10.0.0.5")),
        is(PublishResult.SKIPPED));
    verify(store, never()).create(any(EndpointState.class));
    assertThat(endpoints(), hasSize(0));
  }

  private List<EndpointState> endpoints() throws StoreException {
    return store.list(EndpointState.class, EndpointPublisher.CLUSTER_SCOPE, LabelSelector.everything());
  }
}
