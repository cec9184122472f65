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
package org.corrector.analysis.es;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Stem alternations of Spanish verbs in their stressed forms
 * (<i>pensar</i>/<i>pienso</i>, <i>conocer</i>/<i>conozco</i>).
 */
public enum StemChange {
  /** pensar, pienso */
  E_TO_IE("e", "ie"),
  /** contar, cuento */
  O_TO_UE("o", "ue"),
  /** pedir, pido */
  E_TO_I("e", "i"),
  /** jugar, juego */
  U_TO_UE("u", "ue"),
  /** conocer, conozco */
  C_TO_ZC("c", "zc");

  private static final List<String> ENDINGS_AR = Collections.unmodifiableList(Arrays.asList(
      "o", "as", "a", "an", "e", "es", "e", "en", "ue", "ues", "uen"));
  private static final List<String> ENDINGS_ER = Collections.unmodifiableList(Arrays.asList(
      "o", "es", "e", "en", "a", "as", "a", "an"));
  private static final List<String> ENDINGS_IR = Collections.unmodifiableList(Arrays.asList(
      "o", "es", "e", "en", "a", "as", "a", "an", "iendo", "ió", "ieron"));
  private static final List<String> ENDINGS_ZC = Collections.unmodifiableList(Arrays.asList(
      "o", "a", "as", "amos", "áis", "an"));

  /** The vowel alternations, in the order they are tried. */
  public static final List<StemChange> VOWEL_CHANGES =
      Collections.unmodifiableList(Arrays.asList(E_TO_IE, O_TO_UE, E_TO_I, U_TO_UE));

  private final String original;
  private final String changed;

  private StemChange(String original, String changed) {
    this.original = original;
    this.changed = changed;
  }

  public String getOriginal() {
    return original;
  }

  public String getChanged() {
    return changed;
  }

  /**
   * Undoes the alternation on a changed stem: the last occurrence of the
   * changed sequence is replaced by the original one, except for
   * {@link #C_TO_ZC} which only applies at the end of the stem.
   *
   * @return the original stem, or <code>null</code> if the stem does not show
   *         this alternation
   */
  public String reverse(String stem) {
    if (this == C_TO_ZC) {
      return stem.endsWith(changed) ? stem.substring(0, stem.length() - changed.length()) + original : null;
    }
    final int pos = stem.lastIndexOf(changed);
    if (pos < 0) {
      return null;
    }
    return stem.substring(0, pos) + original + stem.substring(pos + changed.length());
  }

  /**
   * Returns the endings after which this alternation shows up in verbs of
   * the given conjugation.
   */
  public List<String> triggeringEndings(VerbClass verbClass) {
    if (this == C_TO_ZC) {
      return ENDINGS_ZC;
    }
    switch (verbClass) {
      case AR: return ENDINGS_AR;
      case ER: return ENDINGS_ER;
      default: return ENDINGS_IR;
    }
  }
}
