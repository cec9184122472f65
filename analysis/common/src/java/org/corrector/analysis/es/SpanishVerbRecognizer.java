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
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.corrector.analysis.VerbFormRecognizer;
import org.corrector.dict.PrefixTree;
import org.corrector.dict.WordCategory;
import org.corrector.dict.WordEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recognizes conjugated Spanish verb forms without listing them in the
 * dictionary.
 * <p>
 * The recognizer is built from the verbs of a {@link PrefixTree}: every
 * {@link WordCategory#VERB} entry ending in <i>-ar</i>, <i>-er</i> or
 * <i>-ir</i> is an infinitive, and a pronominal infinitive
 * (<i>sentirse</i>) contributes both itself and its base
 * (<i>sentir</i>). A word is then analysed by the following steps, the
 * first one that succeeds wins:
 * <ol>
 *   <li>the word is a known infinitive;</li>
 *   <li>the {@link IrregularVerbs irregular table};</li>
 *   <li>the regular endings of the three conjugations, then future and
 *       conditional (including the contracted stems <i>tendr-</i>,
 *       <i>cabr-</i>, <i>querr-</i>, <i>podr-</i>);</li>
 *   <li>{@link StemChange stem alternations}, which must match the
 *       alternation the verb is registered with in
 *       {@link StemChangingVerbs};</li>
 *   <li>the spelling changes of <i>-zar</i>, <i>-gar</i> and <i>-car</i>
 *       verbs before <i>e</i> (<i>garantice</i>, <i>largue</i>,
 *       <i>indique</i>);</li>
 *   <li>{@link VerbPrefixes derivational prefixes} (<i>deshago</i>);</li>
 *   <li>{@link EncliticAnalyzer enclitic pronouns} on infinitives, gerunds
 *       and imperatives (<i>dámelo</i>).</li>
 * </ol>
 * {@link #getInfinitive(String)} follows the same order and returns the
 * pronominal infinitive whenever the dictionary has one.
 * <p>
 * Instances are immutable and safe for use by concurrent threads.
 */
public class SpanishVerbRecognizer implements VerbFormRecognizer {

  private static final Logger log = LoggerFactory.getLogger(SpanishVerbRecognizer.class);

  /** Endings where -ir verbs registered as E_TO_IE show E_TO_I: sintió, sintieron, sintiendo. */
  private static final Set<String> IR_E_TO_I_ENDINGS = new HashSet<String>(Arrays.asList("ió", "ieron", "iendo"));

  private static final String[] ZAR_ENDINGS = { "e", "es", "emos", "éis", "en", "é" };
  private static final String[] GAR_ENDINGS = { "ue", "ues", "uemos", "uéis", "uen", "ué" };
  private static final String[] CAR_ENDINGS = { "que", "ques", "quemos", "quéis", "quen", "qué" };

  private final Set<String> infinitives;
  private final Map<String,String> pronominals;
  private final IrregularVerbs irregulars;
  private final StemChangingVerbs stemChangingVerbs;
  private final VerbPrefixes prefixes;
  private final EncliticAnalyzer enclitics;

  /** Creates a recognizer with the default tables, prefixes and pronouns. */
  public SpanishVerbRecognizer(PrefixTree dictionary) {
    this(dictionary, IrregularVerbs.getDefault(), StemChangingVerbs.getDefault(),
        new VerbPrefixes(), new EncliticAnalyzer());
  }

  public SpanishVerbRecognizer(PrefixTree dictionary, IrregularVerbs irregulars, StemChangingVerbs stemChangingVerbs,
      VerbPrefixes prefixes, EncliticAnalyzer enclitics) {
    this.irregulars = irregulars;
    this.stemChangingVerbs = stemChangingVerbs;
    this.prefixes = prefixes;
    this.enclitics = enclitics;

    final Set<String> infinitives = new HashSet<String>();
    final Map<String,String> pronominals = new HashMap<String,String>();
    for (Map.Entry<String,WordEntry> e : dictionary.allEntries().entrySet()) {
      if (e.getValue().getCategory() != WordCategory.VERB) {
        continue;
      }
      final String word = e.getKey();
      if (word.endsWith("arse") || word.endsWith("erse") || word.endsWith("irse")) {
        final String base = word.substring(0, word.length() - 2);
        infinitives.add(word);
        infinitives.add(base);
        pronominals.put(base, word);
      } else if (EncliticAnalyzer.isInfinitiveShape(word)) {
        infinitives.add(word);
      }
    }
    this.infinitives = Collections.unmodifiableSet(infinitives);
    this.pronominals = Collections.unmodifiableMap(pronominals);

    log.info("Verb recognizer built: {} infinitives ({} pronominal), {} irregular forms, {} stem changing verbs",
        infinitives.size(), pronominals.size(), irregulars.size(), stemChangingVerbs.size());
  }

  @Override
  public boolean isValidVerbForm(String word) {
    if (word == null || word.length() == 0) {
      return false;
    }
    final String w = word.toLowerCase(Locale.ROOT);
    return simpleInfinitive(w) != null
        || isPrefixedForm(w)
        || encliticInfinitive(w) != null;
  }

  @Override
  public String getInfinitive(String word) {
    if (word == null || word.length() == 0) {
      return null;
    }
    final String w = word.toLowerCase(Locale.ROOT);
    String infinitive = simpleInfinitive(w);
    if (infinitive == null) {
      infinitive = prefixedInfinitive(w);
    }
    if (infinitive == null) {
      infinitive = encliticInfinitive(w);
    }
    if (infinitive == null) {
      return null;
    }
    final String pronominal = pronominals.get(infinitive);
    return pronominal != null ? pronominal : infinitive;
  }

  @Override
  public boolean isGerund(String word) {
    if (word == null || word.length() == 0) {
      return false;
    }
    final String w = word.toLowerCase(Locale.ROOT);
    if (!EncliticAnalyzer.isGerundShape(w)) {
      return false;
    }
    // sintiendo, pidiendo
    return irregulars.contains(w) || gerundInfinitive(w) != null || stemChangingInfinitive(w) != null;
  }

  /** Number of known infinitives, pronominal ones and their bases included. */
  public int infinitiveCount() {
    return infinitives.size();
  }

  /** Number of forms in the irregular table. */
  public int irregularCount() {
    return irregulars.size();
  }

  /** Number of pronominal infinitives. */
  public int pronominalCount() {
    return pronominals.size();
  }

  /** Steps that need neither prefix nor clitic analysis. */
  private String simpleInfinitive(String w) {
    if (infinitives.contains(w)) {
      return w;
    }
    String infinitive = irregulars.getInfinitive(w);
    if (infinitive == null) {
      infinitive = regularInfinitive(w);
    }
    if (infinitive == null) {
      infinitive = stemChangingInfinitive(w);
    }
    if (infinitive == null) {
      infinitive = orthographicInfinitive(w);
    }
    return infinitive;
  }

  private String regularInfinitive(String w) {
    for (VerbClass verbClass : VerbClass.values()) {
      for (String ending : VerbEndings.allEndings(verbClass)) {
        if (w.length() > ending.length() && w.endsWith(ending)) {
          final String candidate = w.substring(0, w.length() - ending.length()) + verbClass.getInfinitiveEnding();
          if (infinitives.contains(candidate)) {
            return candidate;
          }
        }
      }
    }
    String infinitive = futureInfinitive(w, VerbEndings.FUTURE);
    if (infinitive == null) {
      infinitive = futureInfinitive(w, VerbEndings.CONDITIONAL);
    }
    return infinitive;
  }

  private String futureInfinitive(String w, List<String> endings) {
    for (String ending : endings) {
      if (w.endsWith(ending)) {
        final String base = w.substring(0, w.length() - ending.length());
        if (infinitives.contains(base)) {
          return base;
        }
        final String irregular = irregularFutureStem(base);
        if (irregular != null) {
          return irregular;
        }
      }
    }
    return null;
  }

  /** valdr- and saldr- (valer, salir), cabr- (caber), querr- (querer), podr- (poder) */
  private String irregularFutureStem(String stem) {
    if (stem.endsWith("dr")) {
      final String base = stem.substring(0, stem.length() - 2);
      if (infinitives.contains(base + "er")) {
        return base + "er";
      }
      if (infinitives.contains(base + "ir")) {
        return base + "ir";
      }
    }
    if (stem.endsWith("br")) {
      final String candidate = stem.substring(0, stem.length() - 2) + "ber";
      if (infinitives.contains(candidate)) {
        return candidate;
      }
    }
    if (stem.endsWith("rr")) {
      final String candidate = stem.substring(0, stem.length() - 2) + "rer";
      if (infinitives.contains(candidate)) {
        return candidate;
      }
    }
    if (stem.endsWith("odr")) {
      final String candidate = stem.substring(0, stem.length() - 3) + "oder";
      if (infinitives.contains(candidate)) {
        return candidate;
      }
    }
    return null;
  }

  private String stemChangingInfinitive(String w) {
    for (VerbClass verbClass : VerbClass.values()) {
      for (String ending : StemChange.E_TO_IE.triggeringEndings(verbClass)) {
        if (w.length() <= ending.length() || !w.endsWith(ending)) {
          continue;
        }
        final String changedStem = w.substring(0, w.length() - ending.length());
        for (StemChange change : StemChange.VOWEL_CHANGES) {
          final String stem = change.reverse(changedStem);
          if (stem == null) {
            continue;
          }
          final String candidate = stem + verbClass.getInfinitiveEnding();
          if (!infinitives.contains(candidate)) {
            continue;
          }
          final StemChange registered = stemChangingVerbs.get(candidate);
          if (registered == change) {
            return candidate;
          }
          if (verbClass == VerbClass.IR && registered == StemChange.E_TO_IE && change == StemChange.E_TO_I
              && IR_E_TO_I_ENDINGS.contains(ending)) {
            return candidate;
          }
        }
      }
    }
    for (VerbClass verbClass : new VerbClass[] { VerbClass.ER, VerbClass.IR }) {
      for (String ending : StemChange.C_TO_ZC.triggeringEndings(verbClass)) {
        if (w.length() <= ending.length() || !w.endsWith(ending)) {
          continue;
        }
        final String stem = StemChange.C_TO_ZC.reverse(w.substring(0, w.length() - ending.length()));
        if (stem == null) {
          continue;
        }
        final String candidate = stem + verbClass.getInfinitiveEnding();
        if (infinitives.contains(candidate) && stemChangingVerbs.get(candidate) == StemChange.C_TO_ZC) {
          return candidate;
        }
      }
    }
    return null;
  }

  /** z to c (garantice), g to gu (largue) and c to qu (indique) before e. */
  private String orthographicInfinitive(String w) {
    for (String ending : ZAR_ENDINGS) {
      if (!w.endsWith(ending)) {
        continue;
      }
      final String stem = w.substring(0, w.length() - ending.length());
      if (stem.length() > 1 && stem.endsWith("c")) {
        final String original = stem.substring(0, stem.length() - 1) + "z";
        if (infinitives.contains(original + "ar")) {
          return original + "ar";
        }
        // forzar, fuerce
        final int ue = original.indexOf("ue");
        if (ue >= 0) {
          final String candidate = original.substring(0, ue) + "o" + original.substring(ue + 2) + "ar";
          if (infinitives.contains(candidate)) {
            return candidate;
          }
        }
      }
    }
    for (String ending : GAR_ENDINGS) {
      if (w.endsWith(ending)) {
        final String stem = w.substring(0, w.length() - ending.length());
        if (stem.endsWith("g") && infinitives.contains(stem + "ar")) {
          return stem + "ar";
        }
      }
    }
    for (String ending : CAR_ENDINGS) {
      if (w.length() > ending.length() && w.endsWith(ending)) {
        final String candidate = w.substring(0, w.length() - ending.length()) + "car";
        if (infinitives.contains(candidate)) {
          return candidate;
        }
      }
    }
    return null;
  }

  /** Infinitive of a form without prefix: irregular, regular or stem changing. */
  private String baseInfinitive(String base) {
    String infinitive = irregulars.getInfinitive(base);
    if (infinitive == null) {
      infinitive = regularInfinitive(base);
    }
    if (infinitive == null) {
      infinitive = stemChangingInfinitive(base);
    }
    return infinitive;
  }

  private boolean isPrefixedForm(String w) {
    for (VerbPrefixes.Split split : prefixes.split(w)) {
      if (infinitives.contains(split.getBase()) || baseInfinitive(split.getBase()) != null) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns the prefixed infinitive of the first split whose infinitive is
   * known, otherwise the one of the first analysable split even if the
   * dictionary lacks it.
   */
  private String prefixedInfinitive(String w) {
    String fallback = null;
    for (VerbPrefixes.Split split : prefixes.split(w)) {
      String baseInfinitive = baseInfinitive(split.getBase());
      if (baseInfinitive == null && infinitives.contains(split.getBase())) {
        baseInfinitive = split.getBase();
      }
      if (baseInfinitive == null) {
        continue;
      }
      final String candidate = VerbPrefixes.reconstruct(split.getPrefix(), baseInfinitive);
      if (infinitives.contains(candidate)) {
        return candidate;
      }
      if (fallback == null) {
        fallback = candidate;
      }
    }
    return fallback;
  }

  private String encliticInfinitive(String w) {
    final EncliticAnalyzer.Result result = enclitics.strip(w);
    if (result == null) {
      return null;
    }
    final String base = result.getBase();
    if (EncliticAnalyzer.isInfinitiveShape(base) && infinitives.contains(base)) {
      return base;
    }
    if (EncliticAnalyzer.isGerundShape(base)) {
      final String irregular = irregulars.getInfinitive(EncliticAnalyzer.removeAccents(base));
      if (irregular != null) {
        return irregular;
      }
      final String infinitive = gerundInfinitive(base);
      if (infinitive != null) {
        return infinitive;
      }
    }
    if (EncliticAnalyzer.couldBeImperative(base)) {
      final String irregular = irregulars.getInfinitive(base);
      if (irregular != null) {
        return irregular;
      }
      final String infinitive = imperativeInfinitive(base);
      if (infinitive != null) {
        return infinitive;
      }
    }
    return null;
  }

  private String gerundInfinitive(String base) {
    String infinitive = gerundInfinitive(base, "ando", "ar");
    if (infinitive == null) infinitive = gerundInfinitive(base, "iendo", "er", "ir");
    if (infinitive == null) infinitive = gerundInfinitive(base, "yendo", "er", "ir");
    if (infinitive == null) infinitive = gerundInfinitive(base, "ándo", "ar");
    if (infinitive == null) infinitive = gerundInfinitive(base, "iéndo", "er", "ir");
    return infinitive;
  }

  private String gerundInfinitive(String base, String suffix, String... infinitiveEndings) {
    if (!base.endsWith(suffix)) {
      return null;
    }
    final String stem = base.substring(0, base.length() - suffix.length());
    for (String ending : infinitiveEndings) {
      if (infinitives.contains(stem + ending)) {
        return stem + ending;
      }
    }
    return null;
  }

  /** cantad, comed, vivid; canta, come, vive; and exhortatives such as analicemos */
  private String imperativeInfinitive(String base) {
    final String b = EncliticAnalyzer.removeAccents(base);
    if (b.endsWith("ad") && infinitives.contains(b.substring(0, b.length() - 2) + "ar")) {
      return b.substring(0, b.length() - 2) + "ar";
    }
    if (b.endsWith("ed") && infinitives.contains(b.substring(0, b.length() - 2) + "er")) {
      return b.substring(0, b.length() - 2) + "er";
    }
    if (b.endsWith("id") && infinitives.contains(b.substring(0, b.length() - 2) + "ir")) {
      return b.substring(0, b.length() - 2) + "ir";
    }
    if (b.length() > 1 && b.endsWith("a") && infinitives.contains(b.substring(0, b.length() - 1) + "ar")) {
      return b.substring(0, b.length() - 1) + "ar";
    }
    if (b.length() > 1 && b.endsWith("e")) {
      final String stem = b.substring(0, b.length() - 1);
      if (infinitives.contains(stem + "er")) {
        return stem + "er";
      }
      if (infinitives.contains(stem + "ir")) {
        return stem + "ir";
      }
    }
    if (b.endsWith("mos")) {
      return simpleInfinitive(b);
    }
    return null;
  }
}
