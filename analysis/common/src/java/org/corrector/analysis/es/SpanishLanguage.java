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
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.corrector.analysis.Language;
import org.corrector.analysis.VerbFormRecognizer;
import org.corrector.dict.Depluralizer;
import org.corrector.dict.PrefixTree;

/**
 * Spanish: plural derivation, verb form recognition and the
 * <i>j</i>/<i>g</i> confusion before front vowels (<i>cojer</i> for
 * <i>coger</i>).
 */
public class SpanishLanguage extends Language {

  private static final Set<String> ABBREVIATIONS = new HashSet<String>(Arrays.asList("n.º", "n.ª"));

  private static final String FRONT_VOWELS = "eiéí";

  private final Depluralizer depluralizer = new SpanishDepluralizer();

  public SpanishLanguage() {
    super("es", "Español", "spanish", "español");
  }

  @Override
  public Depluralizer getDepluralizer() {
    return depluralizer;
  }

  @Override
  public boolean isKnownAbbreviation(String word) {
    return word != null && ABBREVIATIONS.contains(word.toLowerCase(Locale.ROOT));
  }

  @Override
  public List<String> getVerbPrefixes() {
    return VerbPrefixes.DEFAULT_PREFIXES;
  }

  @Override
  public List<String> getEncliticPronouns() {
    return EncliticAnalyzer.DEFAULT_PRONOUNS;
  }

  /**
   * Returns, for each <i>j</i> followed by <i>e</i> or <i>i</i> (accented or
   * not), the word with that <i>j</i> written as <i>g</i>.
   */
  @Override
  public List<String> getConfusableSpellings(String word) {
    List<String> variants = null;
    for (int i = 0; i + 1 < word.length(); i++) {
      if (word.charAt(i) == 'j' && FRONT_VOWELS.indexOf(word.charAt(i + 1)) >= 0) {
        final char[] chars = word.toCharArray();
        chars[i] = 'g';
        if (variants == null) {
          variants = new ArrayList<String>(2);
        }
        variants.add(new String(chars));
      }
    }
    return variants == null ? Collections.<String>emptyList() : variants;
  }

  @Override
  public VerbFormRecognizer createVerbRecognizer(PrefixTree dictionary) {
    return new SpanishVerbRecognizer(dictionary, IrregularVerbs.getDefault(), StemChangingVerbs.getDefault(),
        new VerbPrefixes(getVerbPrefixes()), new EncliticAnalyzer(getEncliticPronouns()));
  }
}
