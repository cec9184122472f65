/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.corrector.util;

import java.util.Random;

import junit.framework.TestCase;

/** Base class for all corrector unit tests.  Adds seeded
 *  randomness on top of JUnit's TestCase: the seed of a
 *  failing test is printed so the run can be reproduced with
 *  {@link #newRandom(long)}.  If you override either
 *  <code>setUp()</code> or <code>tearDown()</code> in your
 *  unit test, make sure you call <code>super.setUp()</code>
 *  and <code>super.tearDown()</code>.
 */
public abstract class CorrectorTestCase extends TestCase {

  /** Number of iterations randomized tests should run; override with -Dtests.iterations. */
  public static final int ITERATIONS = Integer.getInteger("tests.iterations", 50);

  public CorrectorTestCase() {
    super();
  }

  public CorrectorTestCase(String name) {
    super(name);
  }

  /**
   * Returns a {@link Random} instance for generating random numbers during the test.
   * The random seed is printed to System.out on any failure
   * for reproducing the test using {@link #newRandom(long)} with the recorded seed.
   */
  public Random newRandom() {
    if (seed != null) {
      throw new IllegalStateException("please call CorrectorTestCase.newRandom only once per test");
    }
    Long fixed = Long.getLong("tests.seed");
    return newRandom(fixed != null ? fixed.longValue() : seedRnd.nextLong());
  }

  /**
   * Returns a {@link Random} instance for generating random numbers during the test.
   * If an error occurs in the test that is not reproducible, you can use this method to
   * initialize the number generator with the seed that was printed out during the failing test.
   */
  public Random newRandom(long seed) {
    if (this.seed != null) {
      throw new IllegalStateException("please call CorrectorTestCase.newRandom only once per test");
    }
    this.seed = Long.valueOf(seed);
    return new Random(seed);
  }

  @Override
  protected void runTest() throws Throwable {
    try {
      seed = null;
      super.runTest();
    } catch (Throwable e) {
      if (seed != null) {
        System.out.println("NOTE: random seed of testcase '" + getName() + "' was: " + seed
            + " (reproduce with -Dtests.seed=" + seed + ")");
      }
      throw e;
    }
  }

  // recorded seed
  protected Long seed = null;

  // static members
  private static final Random seedRnd = new Random();
}
