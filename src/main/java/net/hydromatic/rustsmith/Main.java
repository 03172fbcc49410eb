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
package net.hydromatic.rustsmith;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.rustsmith.run.Prop;
import net.hydromatic.rustsmith.run.Runner;
import net.hydromatic.rustsmith.select.SelectionManager.Strategy;

/** Command-line generator of random Rust programs. */
public class Main {
  /** Single-letter options, and the properties they set. */
  private static final ImmutableMap<String, Prop> SHORT_OPTIONS =
      ImmutableMap.<String, Prop>builder()
          .put("-n", Prop.COUNT)
          .put("-p", Prop.PRINT)
          .put("-t", Prop.THREADS)
          .put("-f", Prop.FAIL_FAST)
          .put("-s", Prop.SEED)
          .build();

  private final PrintStream out;
  private final boolean help;
  final Map<Prop, Object> propMap;
  final List<Strategy> strategies;

  /**
   * Command-line entry point.
   *
   * @param args Command-line arguments
   */
  public static void main(String[] args) {
    final Main main;
    try {
      main =
          new Main(ImmutableList.copyOf(args), System.out,
              new LinkedHashMap<>());
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      System.err.print(usage());
      System.exit(2);
      return;
    }
    try {
      main.run();
    } catch (Throwable e) {
      e.printStackTrace();
      System.exit(1);
    }
  }

  /** Creates a Main, parsing its arguments into a property map. */
  public Main(List<String> args, PrintStream out, Map<Prop, Object> propMap) {
    this.out = out;
    this.propMap = propMap;
    this.help = args.contains("-h") || args.contains("--help");
    this.strategies = help ? ImmutableList.of() : parse(args, propMap);
  }

  /** Returns the usage message. */
  static String usage() {
    final StringBuilder b = new StringBuilder();
    b.append("Usage: rustsmith [option...] [strategy...]\n")
        .append("\n")
        .append("Strategies: BASE_SELECTION, SWARM_SELECTION,")
        .append(" OPTIMAL_SELECTION (default), AGGRESSIVE_SELECTION\n")
        .append("\n")
        .append("Options:\n")
        .append("  -h, --help\n");
    final Map<Prop, String> shortNames = new LinkedHashMap<>();
    SHORT_OPTIONS.forEach((name, prop) -> shortNames.put(prop, name));
    for (Prop prop : Prop.BY_CAMEL_NAME) {
      b.append("  ");
      final String shortName = shortNames.get(prop);
      if (shortName != null) {
        b.append(shortName).append(", ");
      }
      b.append("--")
          .append(CaseFormat.LOWER_CAMEL.to(CaseFormat.LOWER_HYPHEN,
              prop.camelName));
      if (!prop.isFlag()) {
        b.append(" <value>");
        final Object defaultValue = prop.get(ImmutableMap.of());
        if (defaultValue != null) {
          b.append(" (default ").append(defaultValue).append(")");
        }
      }
      b.append("\n");
    }
    return b.toString();
  }

  /**
   * Parses command-line arguments. Options set properties; other arguments
   * are the names of strategies. If no strategy is named, the strategy is
   * {@link Strategy#OPTIMAL}.
   *
   * <p>A long option is the hyphenated name of a property; for example,
   * "--usize-width" sets {@link Prop#USIZE_WIDTH}. Its value follows it, or
   * follows an "=". Boolean properties take no value, and are set to true.
   */
  static List<Strategy> parse(List<String> args, Map<Prop, Object> propMap) {
    final Set<Strategy> strategies = new LinkedHashSet<>();
    for (int i = 0; i < args.size(); i++) {
      String arg = args.get(i);
      String value = null;
      final Prop prop;
      if (arg.startsWith("--")) {
        final int eq = arg.indexOf('=');
        if (eq > 0) {
          value = arg.substring(eq + 1);
          arg = arg.substring(0, eq);
        }
        final String name =
            CaseFormat.LOWER_HYPHEN.to(CaseFormat.LOWER_CAMEL,
                arg.substring(2));
        try {
          prop = Prop.lookup(name);
        } catch (IllegalArgumentException e) {
          throw new IllegalArgumentException("unknown option: " + arg, e);
        }
      } else if (arg.startsWith("-")) {
        prop = SHORT_OPTIONS.get(arg);
        if (prop == null) {
          throw new IllegalArgumentException("unknown option: " + arg);
        }
      } else {
        strategies.add(Strategy.lookup(arg));
        continue;
      }
      if (value == null) {
        if (prop.isFlag()) {
          prop.set(propMap, true);
          continue;
        }
        if (i + 1 >= args.size()) {
          throw new IllegalArgumentException("option " + arg
              + " requires a value");
        }
        value = args.get(++i);
      }
      prop.setLenient(propMap, value);
    }
    if (strategies.isEmpty()) {
      strategies.add(Strategy.OPTIMAL);
    }
    return new ArrayList<>(strategies);
  }

  /** Generates programs; returns how many were produced. If help was
   * requested, prints the usage message and generates nothing. */
  public int run() {
    if (help) {
      out.print(usage());
      return 0;
    }
    return new Runner(propMap, strategies, out).run();
  }
}

// End Main.java
