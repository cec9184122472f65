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

/**
 * Edit distance between two strings.
 * <p>
 * The Levenshtein distance is the minimum number of insertions, deletions
 * and substitutions needed to transform one string into the other. The
 * Damerau variant ({@link #damerauLevenshtein}) additionally counts the swap
 * of two adjacent characters as a single operation (optimal string alignment).
 * <p>
 * Distances are computed on UTF-16 code units; all letters of the supported
 * languages are in the BMP.
 */
public final class EditDistance {

  private EditDistance() {} // no instance

  /**
   * Classic Levenshtein distance.
   */
  public static int levenshtein(CharSequence a, CharSequence b) {
    final int n = a.length();
    final int m = b.length();
    if (n == 0) {
      return m;
    }
    if (m == 0) {
      return n;
    }

    // two rows are enough: p is the previous row, d the one being filled
    int p[] = new int[m + 1];
    int d[] = new int[m + 1];
    int swap[];

    for (int j = 0; j <= m; j++) {
      p[j] = j;
    }

    for (int i = 1; i <= n; i++) {
      final char ai = a.charAt(i - 1);
      d[0] = i;
      for (int j = 1; j <= m; j++) {
        final int cost = ai == b.charAt(j - 1) ? 0 : 1;
        d[j] = min(p[j] + 1, d[j - 1] + 1, p[j - 1] + cost);
      }
      swap = p;
      p = d;
      d = swap;
    }
    return p[m];
  }

  /**
   * Levenshtein distance bounded by {@code maxDistance}.
   *
   * @return the distance, or {@code -1} if it is greater than {@code maxDistance}
   */
  public static int levenshtein(CharSequence a, CharSequence b, int maxDistance) {
    if (maxDistance < 0) {
      return -1;
    }
    final int n = a.length();
    final int m = b.length();
    // the length difference alone is a lower bound
    if (Math.abs(n - m) > maxDistance) {
      return -1;
    }
    int[] row = new int[m + 1];
    for (int j = 0; j <= m; j++) {
      row[j] = j;
    }

    for (int i = 1; i <= n; i++) {
      row[0] = i;
      int bestInTheRow = row[0];
      int previous = i - 1;
      final char ai = a.charAt(i - 1);
      for (int j = 1; j <= m; j++) {
        final int old = row[j];
        row[j] = Math.min(previous + (ai == b.charAt(j - 1) ? 0 : 1),
            1 + Math.min(row[j - 1], row[j]));
        previous = old;
        bestInTheRow = Math.min(bestInTheRow, row[j]);
      }
      if (bestInTheRow > maxDistance) {
        return -1;
      }
    }
    return row[m] <= maxDistance ? row[m] : -1;
  }

  /**
   * Damerau-Levenshtein distance (optimal string alignment): like
   * {@link #levenshtein(CharSequence, CharSequence)} but a transposition of
   * two adjacent characters costs one.
   */
  public static int damerauLevenshtein(CharSequence a, CharSequence b) {
    final int n = a.length();
    final int m = b.length();
    if (n == 0) {
      return m;
    }
    if (m == 0) {
      return n;
    }

    final int[][] d = new int[n + 1][m + 1];
    for (int i = 0; i <= n; i++) {
      d[i][0] = i;
    }
    for (int j = 0; j <= m; j++) {
      d[0][j] = j;
    }

    for (int i = 1; i <= n; i++) {
      final char ai = a.charAt(i - 1);
      for (int j = 1; j <= m; j++) {
        final char bj = b.charAt(j - 1);
        final int cost = ai == bj ? 0 : 1;
        d[i][j] = min(d[i - 1][j] + 1, d[i][j - 1] + 1, d[i - 1][j - 1] + cost);
        if (i > 1 && j > 1 && ai == b.charAt(j - 2) && a.charAt(i - 2) == bj) {
          d[i][j] = Math.min(d[i][j], d[i - 2][j - 2] + cost);
        }
      }
    }
    return d[n][m];
  }

  private static int min(int a, int b, int c) {
    return Math.min(a, Math.min(b, c));
  }
}
