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
package org.corrector.analysis;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import org.corrector.dict.Depluralizer;
import org.corrector.dict.PrefixTree;
import org.corrector.util.NamedSPILoader;

/**
 * Describes the language specific policies used by the spelling corrector:
 * plural derivation, abbreviations, elision, word internal punctuation,
 * verb prefixes and clitics, orthographic confusions, and the verb form
 * recognizer.
 * <p>
 * Languages are resolved by code or alias through {@link #forName(String)}.
 * To register a new language, subclass this class, list the implementation
 * in <code>META-INF/services/org.corrector.analysis.Language</code> and
 * provide a public no-arg constructor. This method uses Java's
 * {@link java.util.ServiceLoader Service Provider Interface}.
 * <p>
 * The defaults describe a language without plural derivation, verb
 * analysis or confusable spellings.
 */
public abstract class Language implements NamedSPILoader.NamedSPI {

  private static final NamedSPILoader<Language> loader =
    new NamedSPILoader<Language>(Language.class);

  private static final char[] DEFAULT_APOSTROPHES = { '\'', '\u2019' };

  private final String code;
  private final String name;
  private final List<String> lookupNames;

  /**
   * @param code ISO 639-1 code, the canonical lookup name
   * @param name human readable name
   * @param aliases further names this language can be looked up by
   */
  protected Language(String code, String name, String... aliases) {
    this.code = code;
    this.name = name;
    final List<String> names = new ArrayList<String>(aliases.length + 1);
    names.add(code);
    Collections.addAll(names, aliases);
    this.lookupNames = Collections.unmodifiableList(names);
  }

  /** Returns the language code, e.g. <code>es</code>. */
  public final String getCode() {
    return code;
  }

  /** Returns the human readable name of this language. */
  public final String getName() {
    return name;
  }

  @Override
  public final Collection<String> getLookupNames() {
    return lookupNames;
  }

  /**
   * Returns the plural policy to inject into the dictionary tree, or
   * <code>null</code> if this language derives no plurals.
   */
  public Depluralizer getDepluralizer() {
    return null;
  }

  /** Returns true if <code>word</code> is an abbreviation that is always spelled right. */
  public boolean isKnownAbbreviation(String word) {
    return false;
  }

  /** Returns true if <code>ch</code> may appear inside a suggested word besides letters. */
  public boolean isWordInternalChar(char ch) {
    return ch == '-';
  }

  /** Returns the characters that join an elided article or pronoun to its word. */
  public char[] getElisionApostrophes() {
    return DEFAULT_APOSTROPHES.clone();
  }

  /** Returns the derivational verb prefixes, longest first. */
  public List<String> getVerbPrefixes() {
    return Collections.emptyList();
  }

  /** Returns the enclitic pronouns that may be attached to verb forms. */
  public List<String> getEncliticPronouns() {
    return Collections.emptyList();
  }

  /**
   * Returns spellings commonly confused with <code>word</code>, e.g. a
   * <code>j</code> written where the dictionary has a <code>g</code>. The
   * word itself is not included.
   */
  public List<String> getConfusableSpellings(String word) {
    return Collections.emptyList();
  }

  /**
   * Builds the verb form recognizer of this language from the verbs of
   * <code>dictionary</code>, or returns <code>null</code> if the language has
   * none.
   */
  public VerbFormRecognizer createVerbRecognizer(PrefixTree dictionary) {
    return null;
  }

  @Override
  public String toString() {
    return code;
  }

  /** looks up a language by code or alias */
  public static Language forName(String name) {
    return loader.lookup(name);
  }

  /** returns the codes of all available languages */
  public static Set<String> availableLanguages() {
    return loader.availableServices();
  }
}
