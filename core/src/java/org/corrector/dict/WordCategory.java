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
package org.corrector.dict;

import java.util.Locale;

/** Grammatical category of a dictionary word. */
public enum WordCategory {
  NOUN, VERB, ADJECTIVE, ADVERB, ARTICLE, PREPOSITION, CONJUNCTION, PRONOUN, DETERMINER, OTHER;

  /**
   * Parses the category column of a dictionary line. Spanish and English
   * names and their usual abbreviations are accepted; anything else is
   * {@link #OTHER}.
   */
  public static WordCategory fromString(String s) {
    if (s == null) {
      return OTHER;
    }
    switch (s.trim().toLowerCase(Locale.ROOT)) {
      case "sustantivo": case "noun": case "n":
        return NOUN;
      case "verbo": case "verb": case "v":
        return VERB;
      case "adjetivo": case "adjective": case "adj":
        return ADJECTIVE;
      case "adverbio": case "adverb": case "adv":
        return ADVERB;
      case "articulo": case "artículo": case "article": case "art":
        return ARTICLE;
      case "preposicion": case "preposición": case "preposition": case "prep":
        return PREPOSITION;
      case "conjuncion": case "conjunción": case "conjunction": case "conj":
        return CONJUNCTION;
      case "pronombre": case "pronoun": case "pron":
        return PRONOUN;
      case "determinante": case "determiner": case "det":
        return DETERMINER;
      default:
        return OTHER;
    }
  }
}
