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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.corrector.dict.Depluralizer;

/**
 * Proposes Spanish singulars for a plural form without consulting any
 * dictionary. Candidates come from the most specific rule to the least
 * specific one:
 * <ul>
 *   <li><i>-ces</i> to <i>-z</i> (veces, vez)</li>
 *   <li><i>-iones</i> to <i>-ión</i> (canciones, canción)</li>
 *   <li><i>-anes, -enes, -eses, -ines, -ones, -unes</i> to the accented
 *       singular (alemanes, alemán; leones, león)</li>
 *   <li><i>-íes, -úes</i> to <i>-í, -ú</i> (rubíes, rubí)</li>
 *   <li>consonant + <i>es</i> (ciudades, ciudad; leyes, ley)</li>
 *   <li>vowel + <i>s</i> (abuelas, abuela; cafés, café)</li>
 *   <li>consonant + <i>s</i>, for loanwords (pellets, pellet)</li>
 * </ul>
 */
public class SpanishDepluralizer implements Depluralizer {

  private static final String VOWELS = "aeiouáéíóúü";

  private static final String[][] ACCENTED_RULES = {
    { "anes", "án" },
    { "enes", "én" },
    { "eses", "és" },
    { "ines", "ín" },
  };

  @Override
  public boolean hasPluralMarker(String word) {
    return word.endsWith("s");
  }

  @Override
  public List<String> singularCandidates(String word) {
    if (!hasPluralMarker(word)) {
      return Collections.emptyList();
    }
    final List<String> candidates = new ArrayList<String>(4);
    replaceSuffix(word, "ces", "z", candidates);
    replaceSuffix(word, "iones", "ión", candidates);
    for (String[] rule : ACCENTED_RULES) {
      replaceSuffix(word, rule[0], rule[1], candidates);
    }
    if (!word.endsWith("iones")) {
      replaceSuffix(word, "ones", "ón", candidates);
    }
    replaceSuffix(word, "unes", "ún", candidates);
    replaceSuffix(word, "íes", "í", candidates);
    replaceSuffix(word, "úes", "ú", candidates);

    if (word.endsWith("es")) {
      final String stem = word.substring(0, word.length() - 2);
      if (stem.length() > 0 && !isVowel(stem.charAt(stem.length() - 1))) {
        add(stem, candidates);
      }
    }
    // vowel + s, then consonant + s: both just drop the s
    if (word.length() > 1) {
      add(word.substring(0, word.length() - 1), candidates);
    }
    return candidates;
  }

  private static void replaceSuffix(String word, String suffix, String replacement, List<String> candidates) {
    if (word.length() > suffix.length() && word.endsWith(suffix)) {
      add(word.substring(0, word.length() - suffix.length()) + replacement, candidates);
    }
  }

  private static void add(String candidate, List<String> candidates) {
    if (!candidates.contains(candidate)) {
      candidates.add(candidate);
    }
  }

  static boolean isVowel(char ch) {
    return VOWELS.indexOf(ch) >= 0;
  }
}
