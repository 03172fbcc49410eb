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

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.rustsmith.run.Prop;
import net.hydromatic.rustsmith.select.SelectionManager.Strategy;
import org.junit.jupiter.api.Test;

/** Tests for the command line, {@link Main}. */
public class MainTest {
  private static List<Strategy> parse(Map<Prop, Object> map, String... args) {
    return Main.parse(ImmutableList.copyOf(args), map);
  }

  @Test
  void testParse() {
    final Map<Prop, Object> map = new HashMap<>();
    final List<Strategy> strategies =
        parse(map, "-n", "7", "--threads=3", "-s", "-12", "--directory",
            "/tmp/rs", "--usize-width", "32", "--max-depth=4", "-p",
            "--stats", "-f", "--zkvm", "SWARM_SELECTION", "BASE_SELECTION",
            "SWARM_SELECTION");
    assertThat(strategies,
        is(ImmutableList.of(Strategy.SWARM, Strategy.UNIFORM)));
    assertThat(Prop.COUNT.intValue(map), is(7));
    assertThat(Prop.THREADS.intValue(map), is(3));
    assertThat(Prop.SEED.longValue(map), is(-12L));
    assertThat(Prop.DIRECTORY.fileValue(map), is(new File("/tmp/rs")));
    assertThat(Prop.USIZE_WIDTH.intValue(map), is(32));
    assertThat(Prop.MAX_DEPTH.intValue(map), is(4));
    assertThat(Prop.PRINT.booleanValue(map), is(true));
    assertThat(Prop.STATS.booleanValue(map), is(true));
    assertThat(Prop.FAIL_FAST.booleanValue(map), is(true));
    assertThat(Prop.ZKVM.booleanValue(map), is(true));
  }

  @Test
  void testDefaults() {
    final Map<Prop, Object> map = new HashMap<>();
    assertThat(parse(map), is(ImmutableList.of(Strategy.OPTIMAL)));
    assertThat(map.isEmpty(), is(true));
    assertThat(Prop.COUNT.intValue(map), is(100));
    assertThat(Prop.PRINT.booleanValue(map), is(false));
  }

  @Test
  void testInvalid() {
    final Map<Prop, Object> map = new HashMap<>();
    assertThrows(IllegalArgumentException.class,
        () -> parse(map, "--colour"));
    assertThrows(IllegalArgumentException.class,
        () -> parse(map, "-n"));
    assertThrows(IllegalArgumentException.class,
        () -> parse(map, "-n", "lots"));
    assertThrows(IllegalArgumentException.class,
        () -> parse(map, "FASTEST_SELECTION"));
    assertThrows(IllegalArgumentException.class,
        () -> parse(map, "-x"));
    assertThrows(IllegalArgumentException.class,
        () -> parse(map, "--"));
    assertThrows(IllegalArgumentException.class,
        () -> parse(map, "--print=maybe"));
  }

  /** A long option is the hyphenated name of any property, and a boolean
   * option may be given an explicit value. */
  @Test
  void testLongOptions() {
    final Map<Prop, Object> map = new HashMap<>();
    parse(map, "--count=3", "--fail-fast", "--print=false", "--seed", "8");
    assertThat(Prop.COUNT.intValue(map), is(3));
    assertThat(Prop.FAIL_FAST.booleanValue(map), is(true));
    assertThat(Prop.PRINT.booleanValue(map), is(false));
    assertThat(Prop.SEED.longValue(map), is(8L));
  }

  @Test
  void testUsage() {
    final String usage = Main.usage();
    assertThat(usage, containsString("  -h, --help\n"));
    assertThat(usage, containsString("  -n, --count <value> (default 100)\n"));
    assertThat(usage, containsString("  -f, --fail-fast\n"));
    assertThat(usage, containsString("  --usize-width <value> (default 64)\n"));
    assertThat(usage, containsString("  -s, --seed <value>\n"));
    assertThat(usage, containsString("AGGRESSIVE_SELECTION"));
  }

  /** With "--help", prints usage and generates nothing, even if other
   * arguments are invalid. */
  @Test
  void testHelp() {
    final ByteArrayOutputStream b = new ByteArrayOutputStream();
    final Main main =
        new Main(ImmutableList.of("--help", "--colour"),
            new PrintStream(b, true), new HashMap<>());
    assertThat(main.run(), is(0));
    final String s = new String(b.toByteArray(), StandardCharsets.UTF_8);
    assertThat(s, is(Main.usage()));
  }

  @Test
  void testRun() {
    final ByteArrayOutputStream b = new ByteArrayOutputStream();
    final Main main =
        new Main(ImmutableList.of("-p", "-n", "1", "-s", "99", "optimal"),
            new PrintStream(b, true), new HashMap<>());
    assertThat(main.run(), is(1));
    final String s = new String(b.toByteArray(), StandardCharsets.UTF_8);
    assertThat(s, containsString("// Seed: 99\n"));
    assertThat(s, containsString("println!(\"{:?}\", hasher.finish());"));
  }
}

// End MainTest.java
