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
package net.hydromatic.rustsmith.compile;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Limits and switches that control the generation of one program.
 *
 * <p>Immutable; use the {@code with} methods to create a modified copy.
 */
public class GenerationConfig {
  /** Configuration with default values. */
  public static final GenerationConfig DEFAULT =
      new GenerationConfig(64, false, 5, 2, 3_000, 8, 3, 3, 4, 3, 4, 10, 3);

  /** Width of {@code isize} and {@code usize}, in bits; 32 or 64. */
  public final int usizeWidth;
  /**
   * Whether a dead-end aborts the attempt, rather than trying another
   * production at the same decision point.
   */
  public final boolean failFast;
  /** Greatest recursion depth of statements and expressions. */
  public final int maxDepth;
  /** Greatest nesting of generated types, such as "Option<Box<i32>>". */
  public final int maxTypeDepth;
  /** Number of nodes after which only the cheapest productions are made. */
  public final int maxNodes;
  public final int maxStatements;
  public final int maxStructs;
  public final int maxEnums;
  public final int maxFunctions;
  public final int maxParams;
  /** Greatest number of fields of a struct, and of variants of an enum. */
  public final int maxFields;
  public final int maxLoopIterations;
  /** Number of alternatives tried at a decision point if not failing fast. */
  public final int retryLimit;

  private GenerationConfig(int usizeWidth, boolean failFast, int maxDepth,
      int maxTypeDepth, int maxNodes, int maxStatements, int maxStructs,
      int maxEnums, int maxFunctions, int maxParams, int maxFields,
      int maxLoopIterations, int retryLimit) {
    checkArgument(usizeWidth == 32 || usizeWidth == 64,
        "usize width must be 32 or 64: %s", usizeWidth);
    checkArgument(maxDepth >= 1, "max depth must be positive: %s", maxDepth);
    checkArgument(maxTypeDepth >= 0);
    checkArgument(maxNodes > 0);
    checkArgument(maxStatements > 0);
    checkArgument(maxStructs >= 0 && maxEnums >= 0 && maxFunctions >= 0);
    checkArgument(maxParams >= 0 && maxFields > 0);
    checkArgument(maxLoopIterations > 0);
    checkArgument(retryLimit >= 0);
    this.usizeWidth = usizeWidth;
    this.failFast = failFast;
    this.maxDepth = maxDepth;
    this.maxTypeDepth = maxTypeDepth;
    this.maxNodes = maxNodes;
    this.maxStatements = maxStatements;
    this.maxStructs = maxStructs;
    this.maxEnums = maxEnums;
    this.maxFunctions = maxFunctions;
    this.maxParams = maxParams;
    this.maxFields = maxFields;
    this.maxLoopIterations = maxLoopIterations;
    this.retryLimit = retryLimit;
  }

  public GenerationConfig withUsizeWidth(int usizeWidth) {
    return usizeWidth == this.usizeWidth ? this
        : new GenerationConfig(usizeWidth, failFast, maxDepth, maxTypeDepth,
            maxNodes, maxStatements, maxStructs, maxEnums, maxFunctions,
            maxParams, maxFields, maxLoopIterations, retryLimit);
  }

  public GenerationConfig withFailFast(boolean failFast) {
    return failFast == this.failFast ? this
        : new GenerationConfig(usizeWidth, failFast, maxDepth, maxTypeDepth,
            maxNodes, maxStatements, maxStructs, maxEnums, maxFunctions,
            maxParams, maxFields, maxLoopIterations, retryLimit);
  }

  public GenerationConfig withMaxDepth(int maxDepth) {
    return maxDepth == this.maxDepth ? this
        : new GenerationConfig(usizeWidth, failFast, maxDepth, maxTypeDepth,
            maxNodes, maxStatements, maxStructs, maxEnums, maxFunctions,
            maxParams, maxFields, maxLoopIterations, retryLimit);
  }

  public GenerationConfig withMaxNodes(int maxNodes) {
    return maxNodes == this.maxNodes ? this
        : new GenerationConfig(usizeWidth, failFast, maxDepth, maxTypeDepth,
            maxNodes, maxStatements, maxStructs, maxEnums, maxFunctions,
            maxParams, maxFields, maxLoopIterations, retryLimit);
  }

  public GenerationConfig withMaxStatements(int maxStatements) {
    return maxStatements == this.maxStatements ? this
        : new GenerationConfig(usizeWidth, failFast, maxDepth, maxTypeDepth,
            maxNodes, maxStatements, maxStructs, maxEnums, maxFunctions,
            maxParams, maxFields, maxLoopIterations, retryLimit);
  }

  /** Returns a copy with the given limits on the number of declarations. */
  public GenerationConfig withDeclarations(int maxStructs, int maxEnums,
      int maxFunctions) {
    return new GenerationConfig(usizeWidth, failFast, maxDepth, maxTypeDepth,
        maxNodes, maxStatements, maxStructs, maxEnums, maxFunctions,
        maxParams, maxFields, maxLoopIterations, retryLimit);
  }

  public GenerationConfig withRetryLimit(int retryLimit) {
    return retryLimit == this.retryLimit ? this
        : new GenerationConfig(usizeWidth, failFast, maxDepth, maxTypeDepth,
            maxNodes, maxStatements, maxStructs, maxEnums, maxFunctions,
            maxParams, maxFields, maxLoopIterations, retryLimit);
  }

  @Override
  public String toString() {
    return "GenerationConfig{usizeWidth=" + usizeWidth
        + ", failFast=" + failFast
        + ", maxDepth=" + maxDepth
        + ", maxNodes=" + maxNodes
        + ", retryLimit=" + retryLimit
        + "}";
  }
}

// End GenerationConfig.java
