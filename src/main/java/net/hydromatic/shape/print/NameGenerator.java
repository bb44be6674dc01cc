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
package net.hydromatic.shape.print;

import net.hydromatic.shape.type.TypeVar;

/**
 * Generates fresh type variable names: 'a, 'b, ..., 'z, 'aa, 'ab, ...
 *
 * <p>Each call to the type syntax printer has its own generator, so that
 * names do not depend on what was printed before.
 */
class NameGenerator {
  private int id = 0;

  /** Generates a name that has not been returned by this generator. */
  String get() {
    return TypeVar.ordinalName(id++);
  }
}

// End NameGenerator.java
