/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.egraph.parse;

import net.hydromatic.egraph.util.EGraphException;

/** Exception caused by a syntax error in a term or pattern. */
public class EGraphParseException extends EGraphException {
  private final int offset;

  EGraphParseException(String message, int offset) {
    super(message);
    this.offset = offset;
  }

  EGraphParseException(String message, int offset, Throwable cause) {
    super(message, cause);
    this.offset = offset;
  }

  /** Returns the offset in the input at which the error was detected. */
  public int offset() {
    return offset;
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append("Error at offset ")
        .append(offset)
        .append(": ")
        .append(getMessage());
  }
}

// End EGraphParseException.java
