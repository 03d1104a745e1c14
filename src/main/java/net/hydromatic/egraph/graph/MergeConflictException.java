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

import net.hydromatic.egraph.util.EGraphException;

/**
 * Thrown by {@link Analysis#merge} when two classes that are being merged
 * have irreconcilable values; for example, when two different constants
 * have been proven equal.
 *
 * <p>It indicates that the rewrite rules are unsound for the input.
 */
public class MergeConflictException extends EGraphException {
  public MergeConflictException(String message) {
    super(message);
  }

  /** Creates an exception for two values that cannot be merged. */
  public static MergeConflictException of(Object a, Object b) {
    return new MergeConflictException("cannot merge " + a + " with " + b);
  }
}

// End MergeConflictException.java
