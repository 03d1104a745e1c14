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
package net.hydromatic.egraph.util;

/**
 * Base class for errors that an e-graph reports to its caller.
 *
 * <p>Errors that indicate a bug in the library itself (a corrupted hashcons
 * table, a dangling parent link) are thrown as {@link AssertionError} and are
 * not subclasses of this class.
 */
public abstract class EGraphException extends RuntimeException {
  protected EGraphException(String message) {
    super(message);
  }

  protected EGraphException(String message, Throwable cause) {
    super(message, cause);
  }

  /** Appends a description of this error to a buffer. */
  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append("Error: ").append(getMessage());
  }
}

// End EGraphException.java
