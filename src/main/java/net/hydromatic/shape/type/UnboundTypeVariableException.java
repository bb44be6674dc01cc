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
package net.hydromatic.shape.type;

import static java.util.Objects.requireNonNull;

/**
 * Thrown on reaching a {@link TypeVar} while printing or decoding a value.
 *
 * <p>Type variables exist only inside the type syntax printer, so this
 * indicates that a type was built wrongly, not that a value is bad. It is
 * not a parse failure, and callers should not catch and retry it.
 */
public class UnboundTypeVariableException extends RuntimeException {
  private final String name;

  public UnboundTypeVariableException(String name) {
    super("unbound type variable " + name);
    this.name = requireNonNull(name);
  }

  /** Returns the name of the variable. */
  public String name() {
    return name;
  }
}

// End UnboundTypeVariableException.java
