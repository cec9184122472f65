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
import java.util.LinkedList;
import java.util.List;
import java.util.Set;

/**
 * Separates clitic pronouns attached to the end of verb forms:
 * <i>dámelo</i> is <i>da</i> + <i>me</i> + <i>lo</i>, <i>diciéndote</i> is
 * <i>diciendo</i> + <i>te</i>, <i>decirle</i> is <i>decir</i> + <i>le</i>.
 * <p>
 * Up to {@link #MAX_ENCLITICS} pronouns are removed, preferring the longest
 * analysis. Every removal must leave at least two characters and the final
 * base must look like an infinitive, a gerund or an imperative. The written
 * accent that attaching clitics forces on the base is removed again.
 * <p>
 * Only the shape of the base is checked here; whether it belongs to a known
 * verb is up to {@link SpanishVerbRecognizer}.
 */
public final class EncliticAnalyzer {

  /** Clitic pronouns. */
  public static final List<String> DEFAULT_PRONOUNS = Collections.unmodifiableList(Arrays.asList(
      "me", "te", "se", "nos", "os", "lo", "la", "le", "los", "las", "les"));

  public static final int MAX_ENCLITICS = 3;

  private static final int MIN_BASE_LENGTH = 2;

  private static final Set<String> MONOSYLLABIC_IMPERATIVES = new HashSet<String>(Arrays.asList(
      "da", "dá", "di", "dí", "ve", "pon", "sal", "ten", "ven", "haz", "se", "sé"));

  private static final String VOWELS = "aeiouáéíóúü";

  private final List<String> pronouns;

  public EncliticAnalyzer() {
    this(DEFAULT_PRONOUNS);
  }

  public EncliticAnalyzer(List<String> pronouns) {
    this.pronouns = Collections.unmodifiableList(new ArrayList<String>(pronouns));
  }

  /**
   * Strips enclitic pronouns off <code>word</code>.
   *
   * @return the base and the pronouns, or <code>null</code> if no analysis
   *         leaves a plausible verb base
   */
  public Result strip(String word) {
    for (int n = MAX_ENCLITICS; n >= 1; n--) {
      final Result result = strip(word, n, new LinkedList<String>());
      if (result != null) {
        return result;
      }
    }
    return null;
  }

  private Result strip(String current, int remaining, LinkedList<String> stripped) {
    if (remaining == 0) {
      return isValidBase(current) ? new Result(restoreAccent(current), new ArrayList<String>(stripped)) : null;
    }
    for (String pronoun : pronouns) {
      if (current.endsWith(pronoun) && current.length() - pronoun.length() >= MIN_BASE_LENGTH) {
        stripped.addFirst(pronoun);
        final Result result = strip(current.substring(0, current.length() - pronoun.length()), remaining - 1, stripped);
        if (result != null) {
          return result;
        }
        stripped.removeFirst();
      }
    }
    return null;
  }

  static boolean isValidBase(String base) {
    if (endsWithExhortative(base)) {
      return base.length() >= 4;
    }
    final int len = base.length();
    final char last = base.charAt(len - 1);
    switch (last) {
      case 'r':
        // infinitive, possibly accented by the clitics: dármelo
        return len >= 2 && "aeiáéí".indexOf(base.charAt(len - 2)) >= 0;
      case 'o':
        return isGerundShape(base);
      case 'a':
      case 'á':
      case 'e':
      case 'é':
        return len >= 2;
      case 'i':
      case 'í':
      case 'n':
      case 'z':
      case 'l':
        return isMonosyllabicImperative(base) || isMonosyllabicImperative(removeAccents(base));
      case 'd':
        // vosotros imperative
        return len >= 2 && "aei".indexOf(base.charAt(len - 2)) >= 0;
      default:
        return false;
    }
  }

  static String restoreAccent(String base) {
    if (base.endsWith("ámos")) {
      return base.substring(0, base.length() - 4) + "amos";
    }
    if (base.endsWith("émos")) {
      return base.substring(0, base.length() - 4) + "emos";
    }
    if (base.endsWith("ímos")) {
      return base.substring(0, base.length() - 4) + "imos";
    }
    if (base.endsWith("ár") || base.endsWith("ér") || base.endsWith("ír")) {
      return removeAccents(base);
    }
    if (countVowels(base) == 1) {
      final String unaccented = removeAccents(base);
      if (isMonosyllabicImperative(unaccented)) {
        return unaccented;
      }
    }
    if (base.endsWith("ándo")) {
      return base.substring(0, base.length() - 4) + "ando";
    }
    if (base.endsWith("iéndo")) {
      return base.substring(0, base.length() - 5) + "iendo";
    }
    return base;
  }

  /** Returns true if <code>base</code> ends like an infinitive. */
  public static boolean isInfinitiveShape(String base) {
    return base.endsWith("ar") || base.endsWith("er") || base.endsWith("ir");
  }

  /** Returns true if <code>base</code> ends like a gerund, accented or not. */
  public static boolean isGerundShape(String base) {
    return base.endsWith("ando") || base.endsWith("iendo") || base.endsWith("yendo")
        || base.endsWith("ándo") || base.endsWith("iéndo") || base.endsWith("yéndo");
  }

  /** Returns true if <code>base</code> could be an imperative (tú, vosotros, or exhortative nosotros). */
  public static boolean couldBeImperative(String base) {
    if (isMonosyllabicImperative(base) || endsWithExhortative(base)) {
      return true;
    }
    if (base.endsWith("ad") || base.endsWith("ed") || base.endsWith("id")) {
      return true;
    }
    return base.endsWith("a") || base.endsWith("e");
  }

  static boolean isMonosyllabicImperative(String word) {
    return MONOSYLLABIC_IMPERATIVES.contains(word);
  }

  private static boolean endsWithExhortative(String base) {
    return base.endsWith("amos") || base.endsWith("emos") || base.endsWith("imos")
        || base.endsWith("ámos") || base.endsWith("émos") || base.endsWith("ímos");
  }

  /** Replaces the acute accented vowels by plain ones. */
  public static String removeAccents(String word) {
    final char[] chars = word.toCharArray();
    for (int i = 0; i < chars.length; i++) {
      switch (chars[i]) {
        case 'á': chars[i] = 'a'; break;
        case 'é': chars[i] = 'e'; break;
        case 'í': chars[i] = 'i'; break;
        case 'ó': chars[i] = 'o'; break;
        case 'ú': chars[i] = 'u'; break;
        default: break;
      }
    }
    return new String(chars);
  }

  private static int countVowels(String word) {
    int count = 0;
    for (int i = 0; i < word.length(); i++) {
      if (VOWELS.indexOf(word.charAt(i)) >= 0) {
        count++;
      }
    }
    return count;
  }

  /** The verb base and the pronouns stripped from it, in written order. */
  public static final class Result {
    private final String base;
    private final List<String> pronouns;

    Result(String base, List<String> pronouns) {
      this.base = base;
      this.pronouns = Collections.unmodifiableList(pronouns);
    }

    public String getBase() {
      return base;
    }

    public List<String> getPronouns() {
      return pronouns;
    }

    @Override
    public String toString() {
      return base + pronouns;
    }
  }
}
