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
package org.corrector.spell;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.corrector.analysis.Language;
import org.corrector.analysis.VerbFormRecognizer;
import org.corrector.dict.FuzzyMatch;
import org.corrector.dict.PrefixTree;

/**
 * Checks single words against a dictionary and proposes corrections.
 * <p>
 * A word is accepted when it is stored in the dictionary, is an elision
 * whose two halves are known (<code>l'home</code>), is a known abbreviation,
 * is the derivable plural of a stored noun or adjective, or is recognized as
 * a verb form. Verb form recognition is overruled when a confusable spelling
 * of the word is itself in the dictionary (<code>cojer</code> against
 * <code>coger</code>), as the recognizer would otherwise accept the
 * misspelling as a form of some other verb.
 * <p>
 * Suggestions come from a bounded fuzzy search of the dictionary, ranked by
 * {@link Suggestion#RANKING}. Confusable spellings found in the dictionary
 * are put in front of them.
 * <p>
 * Instances are read-only and may be shared between threads as long as the
 * dictionary is not modified.
 */
public class SpellingCorrector {

  public static final int DEFAULT_MAX_DISTANCE = 2;
  public static final int DEFAULT_MAX_SUGGESTIONS = 5;

  private final PrefixTree dictionary;
  private final Language language;
  private final VerbFormRecognizer verbRecognizer;
  private final int maxDistance;
  private final int maxSuggestions;

  /** Creates a corrector without verb recognition and default limits. */
  public SpellingCorrector(PrefixTree dictionary, Language language) {
    this(dictionary, language, null, DEFAULT_MAX_DISTANCE, DEFAULT_MAX_SUGGESTIONS);
  }

  /**
   * @param dictionary the word store
   * @param language language policies
   * @param verbRecognizer verb form recognizer, or <code>null</code>
   * @param maxDistance the largest edit distance of a suggestion
   * @param maxSuggestions the number of suggestions returned at most
   */
  public SpellingCorrector(PrefixTree dictionary, Language language, VerbFormRecognizer verbRecognizer,
      int maxDistance, int maxSuggestions) {
    if (dictionary == null || language == null) {
      throw new IllegalArgumentException("dictionary and language must not be null");
    }
    if (maxDistance < 0) {
      throw new IllegalArgumentException("maxDistance must be >= 0, got " + maxDistance);
    }
    if (maxSuggestions < 1) {
      throw new IllegalArgumentException("maxSuggestions must be >= 1, got " + maxSuggestions);
    }
    this.dictionary = dictionary;
    this.language = language;
    this.verbRecognizer = verbRecognizer;
    this.maxDistance = maxDistance;
    this.maxSuggestions = maxSuggestions;
  }

  public PrefixTree getDictionary() {
    return dictionary;
  }

  public Language getLanguage() {
    return language;
  }

  /** Returns the verb form recognizer, possibly <code>null</code>. */
  public VerbFormRecognizer getVerbRecognizer() {
    return verbRecognizer;
  }

  public int getMaxDistance() {
    return maxDistance;
  }

  public int getMaxSuggestions() {
    return maxSuggestions;
  }

  /** Returns true if <code>word</code> is spelled correctly. */
  public boolean isCorrect(String word) {
    if (word == null || word.length() == 0) {
      return false;
    }
    final String lower = word.toLowerCase(Locale.ROOT);
    if (dictionary.contains(lower)) {
      return true;
    }
    if (isCorrectElision(lower)) {
      return true;
    }
    if (language.isKnownAbbreviation(word) || language.isKnownAbbreviation(lower)) {
      return true;
    }
    if (dictionary.derivePluralInfo(lower) != null) {
      return true;
    }
    if (verbRecognizer != null && verbRecognizer.isValidVerbForm(lower)) {
      return !hasConfusableInDictionary(lower);
    }
    return false;
  }

  private boolean isCorrectElision(String lower) {
    for (char apostrophe : language.getElisionApostrophes()) {
      final int pos = lower.indexOf(apostrophe);
      if (pos < 0) {
        continue;
      }
      final String head = lower.substring(0, pos + 1);
      final String tail = lower.substring(pos + 1);
      if (tail.length() > 0 && dictionary.contains(head)
          && (dictionary.contains(tail) || dictionary.derivePluralInfo(tail) != null)) {
        return true;
      }
    }
    return false;
  }

  private boolean hasConfusableInDictionary(String lower) {
    for (String variant : language.getConfusableSpellings(lower)) {
      if (dictionary.contains(variant)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns up to {@link #getMaxSuggestions()} corrections for
   * <code>word</code>, best first. A word stored in the dictionary gets no
   * suggestions.
   */
  public List<Suggestion> getSuggestions(String word) {
    if (word == null || word.length() == 0) {
      return Collections.emptyList();
    }
    final String lower = word.toLowerCase(Locale.ROOT);
    if (dictionary.contains(lower)) {
      return Collections.emptyList();
    }
    List<Suggestion> suggestions = elisionSuggestions(lower);
    if (suggestions == null) {
      suggestions = new ArrayList<Suggestion>();
      for (FuzzyMatch match : dictionary.searchWithinDistance(lower, maxDistance)) {
        suggestions.add(new Suggestion(match.getWord(), match.getDistance(), match.getEntry().getFrequency()));
      }
      rank(suggestions);
    }
    return boostConfusables(lower, suggestions);
  }

  /** Suggestions for the part after the apostrophe, or null if the word is no elision of a known head. */
  private List<Suggestion> elisionSuggestions(String lower) {
    for (char apostrophe : language.getElisionApostrophes()) {
      final int pos = lower.indexOf(apostrophe);
      if (pos < 0) {
        continue;
      }
      final String head = lower.substring(0, pos + 1);
      final String tail = lower.substring(pos + 1);
      if (tail.length() == 0 || !dictionary.contains(head)) {
        continue;
      }
      final List<Suggestion> suggestions = new ArrayList<Suggestion>();
      for (FuzzyMatch match : dictionary.searchWithinDistance(tail, maxDistance)) {
        if (isPlainWord(match.getWord())) {
          suggestions.add(new Suggestion(head + match.getWord(), match.getDistance(),
              match.getEntry().getFrequency()));
        }
      }
      rank(suggestions);
      return suggestions;
    }
    return null;
  }

  private boolean isPlainWord(String candidate) {
    for (int i = 0; i < candidate.length(); i++) {
      final char ch = candidate.charAt(i);
      if (!Character.isLetter(ch) && !language.isWordInternalChar(ch)) {
        return false;
      }
    }
    return true;
  }

  private void rank(List<Suggestion> suggestions) {
    Collections.sort(suggestions, Suggestion.RANKING);
    truncate(suggestions);
  }

  private List<Suggestion> boostConfusables(String lower, List<Suggestion> suggestions) {
    final Set<String> boosted = new LinkedHashSet<String>();
    for (String variant : language.getConfusableSpellings(lower)) {
      if (dictionary.contains(variant)) {
        boosted.add(variant);
      }
    }
    if (boosted.isEmpty()) {
      return suggestions;
    }
    final List<Suggestion> result = new ArrayList<Suggestion>(suggestions.size() + boosted.size());
    for (String variant : boosted) {
      result.add(new Suggestion(variant, 1, Long.MAX_VALUE));
    }
    for (Suggestion s : suggestions) {
      if (!boosted.contains(s.getWord())) {
        result.add(s);
      }
    }
    truncate(result);
    return result;
  }

  private void truncate(List<Suggestion> suggestions) {
    while (suggestions.size() > maxSuggestions) {
      suggestions.remove(suggestions.size() - 1);
    }
  }
}
