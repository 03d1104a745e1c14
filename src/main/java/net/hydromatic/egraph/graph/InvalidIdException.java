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
package net.hydromatic.egraph.graph;

import net.hydromatic.egraph.lang.Id;
import net.hydromatic.egraph.util.EGraphException;

/** An operation referenced a class id that was not issued by the e-graph. */
public class InvalidIdException extends EGraphException {
  private final Id id;

  public InvalidIdException(Id id, int size) {
    super("invalid id " + id + "; e-graph has " + size + " ids");
    this.id = id;
  }

  /** Returns the invalid id. */
  public Id id() {
    return id;
  }
}

// End InvalidIdException.java
