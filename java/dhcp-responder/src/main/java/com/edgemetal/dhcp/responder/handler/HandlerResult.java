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

package com.edgemetal.dhcp.responder.handler;

import com.google.common.base.Preconditions;

/**
 * Outcome of one handler: continue with a (possibly augmented) reply, drop the request, or fail it.
 *
 * @param <M> reply type.
 */
public final class HandlerResult<M> {

  /**
   * Kind of outcome.
   */
  public enum Kind {
    CONTINUE,
    DROP,
    ERROR
  }

  private final Kind kind;
  private final M reply;
  private final String reason;
  private final Throwable cause;

  private HandlerResult(Kind kind, M reply, String reason, Throwable cause) {
    this.kind = kind;
    this.reply = reply;
    this.reason = reason;
    this.cause = cause;
  }

  /**
   * Passes the reply on to the next handler.
   */
  public static <M> HandlerResult<M> next(M reply) {
    return new HandlerResult<>(Kind.CONTINUE, Preconditions.checkNotNull(reply), null, null);
  }

  /**
   * Stops the chain without an answer. Used for requests this responder cannot process.
   */
  public static <M> HandlerResult<M> drop(String reason) {
    return new HandlerResult<>(Kind.DROP, null, reason, null);
  }

  /**
   * Stops the chain without an answer because handling the request failed.
   */
  public static <M> HandlerResult<M> error(Throwable cause) {
    Preconditions.checkNotNull(cause);
    return new HandlerResult<>(Kind.ERROR, null, cause.getMessage(), cause);
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isContinue() {
    return kind == Kind.CONTINUE;
  }

  /**
   * @throws IllegalStateException if the chain does not continue
   */
  public M getReply() {
    Preconditions.checkState(kind == Kind.CONTINUE, "%s result has no reply", kind);
    return reply;
  }

  public String getReason() {
    return reason;
  }

  public Throwable getCause() {
    return cause;
  }

  @Override
  public String toString() {
    return kind == Kind.CONTINUE ? "CONTINUE" : kind + ": " + reason;
  }
}
