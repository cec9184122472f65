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

/**
 * Random data helpers for tests.
 */
public final class TestUtil {

  private TestUtil() {} // no instance

  /** start and end are BOTH inclusive */
  public static int nextInt(Random r, int start, int end) {
    return start + r.nextInt(end - start + 1);
  }

  /** Returns a random string of lowercase letters drawn from the first
   *  {@code alphabetSize} letters of the alphabet, of length up to {@code maxLength}.
   *  A small alphabet makes collisions (and therefore near matches) likely. */
  public static String randomSimpleString(Random r, int alphabetSize, int maxLength) {
    final int end = r.nextInt(maxLength + 1);
    if (end == 0) {
      // allow 0 length
      return "";
    }
    final char[] buffer = new char[end];
    for (int i = 0; i < end; i++) {
      buffer[i] = (char) nextInt(r, 'a', 'a' + alphabetSize - 1);
    }
    return new String(buffer, 0, end);
  }

  /** Returns a random string of length up to 10 over the letters a-f. */
  public static String randomSimpleString(Random r) {
    return randomSimpleString(r, 6, 10);
  }

  /** Returns a random string mixing plain letters with the accented
   *  vowels and the letter ñ used in Spanish. */
  public static String randomSpanishString(Random r, int maxLength) {
    final String alphabet = "abcdeilmnorstáéíóúñ";
    final int end = r.nextInt(maxLength + 1);
    final char[] buffer = new char[end];
    for (int i = 0; i < end; i++) {
      buffer[i] = alphabet.charAt(r.nextInt(alphabet.length()));
    }
    return new String(buffer, 0, end);
  }
}
