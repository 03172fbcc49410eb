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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;
import net.hydromatic.rustsmith.compile.GeneratedProgram;
import net.hydromatic.rustsmith.compile.GenerationConfig;
import net.hydromatic.rustsmith.compile.Generator;
import net.hydromatic.rustsmith.compile.NameGenerator;
import net.hydromatic.rustsmith.compile.Reconditioner;
import net.hydromatic.rustsmith.select.SelectionManager;
import net.hydromatic.rustsmith.select.SelectionManager.Strategy;
import net.hydromatic.rustsmith.util.Outcome;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Generates a batch of programs, in parallel, and writes them out.
 *
 * <p>Each program occupies a slot. A slot repeatedly chooses a seed and a
 * strategy and generates a program until it gets one that is neither a
 * dead-end nor too large; then it reconditions the program and writes it.
 */
public class Runner {
  private static final Logger LOGGER = LogManager.getLogger(Runner.class);

  /** Programs with more lines than this are discarded. */
  public static final int MAX_LINES = 20_000;

  /**
   * Number of attempts a slot makes with an explicit seed, each with a
   * different strategy, before it gives up.
   */
  static final int SEED_ATTEMPT_LIMIT = 16;

  private final Map<Prop, Object> map;
  private final List<Strategy> strategies;
  private final LongSupplier seeds;
  private final PrintStream out;
  private final int maxLines;
  private final GenerationConfig config;

  /** Creates a runner whose seeds, if not set explicitly, are random. */
  public Runner(Map<Prop, Object> map, List<Strategy> strategies,
      PrintStream out) {
    this(map, strategies, () -> ThreadLocalRandom.current().nextLong(), out,
        MAX_LINES);
  }

  /** Creates a runner with a given source of seeds and line limit. */
  Runner(Map<Prop, Object> map, List<Strategy> strategies,
      LongSupplier seeds, PrintStream out, int maxLines) {
    checkArgument(!strategies.isEmpty(), "no strategies");
    this.map = requireNonNull(map);
    this.strategies = ImmutableList.copyOf(strategies);
    this.seeds = requireNonNull(seeds);
    this.out = requireNonNull(out);
    this.maxLines = maxLines;
    final int usizeWidth = Prop.USIZE_WIDTH.intValue(map);
    checkArgument(usizeWidth == 32 || usizeWidth == 64,
        "usize width must be 32 or 64, was %s", usizeWidth);
    this.config = GenerationConfig.DEFAULT
        .withUsizeWidth(usizeWidth)
        .withFailFast(Prop.FAIL_FAST.booleanValue(map))
        .withMaxDepth(Prop.MAX_DEPTH.intValue(map));
  }

  /**
   * Generates programs, and returns how many were produced. This is the
   * count requested, unless an explicit seed leads to a dead-end.
   */
  public int run() {
    final int count = Prop.COUNT.intValue(map);
    final int threads = Prop.THREADS.intValue(map);
    checkArgument(count >= 0, "count must not be negative");
    checkArgument(threads > 0, "threads must be positive");
    final boolean print = Prop.PRINT.booleanValue(map);
    final ProgramWriter writer =
        new ProgramWriter(Prop.DIRECTORY.fileValue(map),
            Prop.ZKVM.booleanValue(map), Prop.STATS.booleanValue(map));
    if (!print) {
      writer.reset();
    }

    final ExecutorService executor =
        Executors.newFixedThreadPool(Math.max(1, Math.min(count, threads)));
    final List<Future<Boolean>> futures = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      final int slot = i;
      futures.add(executor.submit(() -> runSlot(slot, print, writer)));
    }
    executor.shutdown();
    try {
      if (!executor.awaitTermination(10, TimeUnit.HOURS)) {
        LOGGER.warn("timed out waiting for {} programs", count);
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
      throw new IllegalStateException("interrupted", e);
    }

    int produced = 0;
    for (Future<Boolean> future : futures) {
      try {
        if (future.isDone() && future.get()) {
          ++produced;
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IllegalStateException("interrupted", e);
      } catch (ExecutionException e) {
        final Throwable cause = e.getCause();
        if (cause instanceof RuntimeException) {
          throw (RuntimeException) cause;
        }
        if (cause instanceof Error) {
          throw (Error) cause;
        }
        throw new IllegalStateException(cause);
      }
    }
    LOGGER.info("generated {} of {} programs", produced, count);
    return produced;
  }

  /**
   * Generates the program for one slot. Returns whether a program was
   * produced.
   */
  boolean runSlot(int slot, boolean print, ProgramWriter writer) {
    final Long explicitSeed = Prop.SEED.longValue(map);
    for (int attempt = 0; ; attempt++) {
      final long seed =
          explicitSeed != null ? explicitSeed + slot : seeds.getAsLong();
      final Strategy strategy = chooseStrategy(seed, attempt);
      LOGGER.debug("program {}: attempt {}, seed {}, strategy {}", slot,
          attempt, seed, strategy.optionName);
      final Outcome<GeneratedProgram> outcome =
          Generator.generateProgram(seed, new NameGenerator(),
              SelectionManager.of(strategy), config);
      final String failure;
      if (outcome.isDeadEnd()) {
        failure = outcome.reason();
      } else if (lineCount(outcome.get()) > maxLines) {
        failure = "more than " + maxLines + " lines";
      } else {
        final Reconditioner reconditioner = new Reconditioner();
        final GeneratedProgram program =
            outcome.get().withProgram(
                reconditioner.recondition(outcome.get().program));
        if (print) {
          synchronized (out) {
            out.println(program.source());
            out.println(Arguments.commandLine(program.externals()));
          }
        } else {
          writer.write(slot, program, reconditioner.statistics());
          LOGGER.info("program {}: seed {}, strategy {}", slot, seed,
              strategy.optionName);
        }
        return true;
      }

      LOGGER.debug("program {}: seed {} discarded: {}", slot, seed, failure);
      if (explicitSeed != null
          && (strategies.size() == 1 || attempt + 1 >= SEED_ATTEMPT_LIMIT)) {
        // The same seed and strategy would fail the same way
        LOGGER.warn("program {}: seed {} discarded ({}); giving up", slot,
            seed, failure);
        return false;
      }
    }
  }

  /**
   * Chooses the strategy for an attempt. Deterministic in the seed and the
   * attempt number, so that a retry with the same seed may use another
   * strategy.
   */
  private Strategy chooseStrategy(long seed, int attempt) {
    if (strategies.size() == 1) {
      return strategies.get(0);
    }
    final Random random = new Random(seed + attempt);
    return strategies.get(random.nextInt(strategies.size()));
  }

  private static int lineCount(GeneratedProgram program) {
    return CharMatcher.is('\n').countIn(program.source());
  }
}

// End Runner.java
