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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.rustsmith.ast.Ast;
import net.hydromatic.rustsmith.ast.AstWriter;
import net.hydromatic.rustsmith.ast.ExternalParameter;
import net.hydromatic.rustsmith.type.PrimitiveType;

/** Result of a successful generation attempt. */
public class GeneratedProgram {
  public final Ast.Program program;

  GeneratedProgram(Ast.Program program) {
    this.program = requireNonNull(program);
  }

  /** Returns the external parameters, in order of first use. */
  public List<ExternalParameter> externals() {
    return program.externals;
  }

  /** Returns the values of the external parameters, as program arguments. */
  public List<String> arguments() {
    final ImmutableList.Builder<String> b = ImmutableList.builder();
    program.externals.forEach(p -> b.add(p.value));
    return b.build();
  }

  /** Returns the types of the external parameters. */
  public List<PrimitiveType> parameterTypes() {
    final ImmutableList.Builder<PrimitiveType> b = ImmutableList.builder();
    program.externals.forEach(p -> b.add(p.type));
    return b.build();
  }

  /** Returns the Rust source code of the program, as an executable. */
  public String source() {
    return program.toString();
  }

  /**
   * Returns the Rust source code of the program as a library, whose entry
   * point is a public function that takes the external parameters as
   * arguments and returns the hash.
   */
  public String librarySource(String name) {
    return program.unparse(AstWriter.library(name));
  }

  /** Returns a copy with a different program, such as after reconditioning. */
  public GeneratedProgram withProgram(Ast.Program program) {
    return program == this.program ? this : new GeneratedProgram(program);
  }
}

// End GeneratedProgram.java
