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
package net.hydromatic.rustsmith.select;

import net.hydromatic.rustsmith.ast.Op;

/**
 * A kind of production that the generator can make at a decision point:
 * a kind of statement, expression or type.
 */
public interface Production {
  /** Node kind of the production; the key by which choices are counted. */
  Op op();

  /**
   * Whether the production is always enabled, even in a swarm
   * configuration, because without it some values could not be built.
   */
  boolean essential();

  /** Name of the production. */
  String name();
}

// End Production.java
