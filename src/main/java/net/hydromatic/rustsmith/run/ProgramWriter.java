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
package net.hydromatic.rustsmith.run;

import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import net.hydromatic.rustsmith.ast.ExternalParameter;
import net.hydromatic.rustsmith.compile.GeneratedProgram;
import net.hydromatic.rustsmith.compile.Statistics;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Writes generated programs to a directory.
 *
 * <p>Program {@code i} is written to {@code file<i>/file<i>.rs}, with its
 * arguments in {@code file<i>.txt} and, optionally, its statistics in
 * {@code file<i>.json}.
 *
 * <p>In zkVM layout, the program is also written as a crate
 * {@code native/file<i>}, whose library exposes the program as a function
 * {@code pub fn file<i>(a0: T0, ...) -> u64} and whose binary parses the
 * arguments from the command line and prints the result; and the arguments
 * are written to {@code input/file<i>.json}.
 */
public class ProgramWriter {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final Path directory;
  private final boolean zkvm;
  private final boolean stats;

  public ProgramWriter(File directory, boolean zkvm, boolean stats) {
    this.directory = directory.toPath();
    this.zkvm = zkvm;
    this.stats = stats;
  }

  /** Deletes the directory, if it exists, and creates it empty. */
  public void reset() {
    try {
      if (Files.exists(directory)) {
        MoreFiles.deleteRecursively(directory,
            RecursiveDeleteOption.ALLOW_INSECURE);
      }
      Files.createDirectories(directory);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /** Writes the {@code i}th program. */
  public void write(int i, GeneratedProgram program,
      @Nullable Statistics statistics) {
    final String name = "file" + i;
    final Path dir = directory.resolve(name);
    write(dir.resolve(name + ".rs"), program.source());
    write(dir.resolve(name + ".txt"),
        Arguments.commandLine(program.externals()));
    if (stats) {
      requireNonNull(statistics, "statistics");
      write(dir.resolve(name + ".json"),
          Arguments.toString(statistics.toMap()));
    }
    if (zkvm) {
      writeCrate(name, program);
    }
  }

  private void writeCrate(String name, GeneratedProgram program) {
    final Path crate = directory.resolve("native").resolve(name);
    write(crate.resolve("Cargo.toml"), cargoToml(name));
    write(crate.resolve("config.json"), config(name, program.externals()));
    write(crate.resolve("src").resolve("lib.rs"), program.librarySource(name));
    write(crate.resolve("src").resolve("main.rs"),
        wrapper(name, program.externals()));
    write(directory.resolve("input").resolve(name + ".json"),
        Arguments.inputFile(program.externals()));
  }

  static String cargoToml(String name) {
    return "[package]\n"
        + "name = \"" + name + "\"\n"
        + "version = \"0.1.0\"\n"
        + "edition = \"2024\"\n"
        + "\n"
        + "[dependencies]\n";
  }

  /** Describes the crate's entry point: its file, name and signature. */
  static String config(String name, List<ExternalParameter> externals) {
    final ObjectNode node = MAPPER.createObjectNode();
    node.put("root", ".");
    node.put("program_file", "src/lib.rs");
    node.put("program_name", name);
    final ObjectNode signature = node.putObject("signature");
    final ArrayNode input = signature.putArray("input");
    externals.forEach(p -> input.add(p.type.moniker));
    signature.putArray("output").add("u64");
    return Arguments.toString(node);
  }

  /**
   * Returns a binary that parses each argument as the type of the
   * corresponding parameter, calls the library function, and prints its
   * result.
   */
  static String wrapper(String name, List<ExternalParameter> externals) {
    final String usage = "Usage: " + name + " <args...>";
    final StringBuilder b = new StringBuilder();
    b.append("use std::env;\n")
        .append("use std::process;\n")
        .append("\n")
        .append("use ").append(name).append("::").append(name).append(";\n")
        .append("\n")
        .append("fn main() {\n")
        .append("    let mut args = env::args().skip(1);\n");
    for (ExternalParameter p : externals) {
      final int i = p.ordinal;
      final String type = p.type.moniker;
      b.append("    let raw_").append(i)
          .append(" = args.next().unwrap_or_else(|| { eprintln!(\"")
          .append(usage).append("\"); process::exit(1); });\n");
      if (type.equals("String")) {
        b.append("    let a").append(i).append(": String = raw_").append(i)
            .append(";\n");
      } else {
        b.append("    let a").append(i).append(": ").append(type)
            .append(" = raw_").append(i)
            .append(".parse().unwrap_or_else(|_| { eprintln!(\"Invalid arg #")
            .append(i + 1).append(" for type ").append(type)
            .append(": \\\"{}\\\"\", raw_").append(i)
            .append("); process::exit(1); });\n");
      }
    }
    b.append("    if args.next().is_some() { eprintln!(\"").append(usage)
        .append("\"); process::exit(1); }\n")
        .append("\n")
        .append("    println!(\"{}\", ").append(name).append("(");
    for (ExternalParameter p : externals) {
      b.append(p.ordinal > 0 ? ", " : "").append(p.name());
    }
    return b.append("));\n")
        .append("}\n")
        .toString();
  }

  private static void write(Path path, String text) {
    try {
      Files.createDirectories(requireNonNull(path.getParent()));
      Files.write(path, text.getBytes(StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}

// End ProgramWriter.java
