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

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import org.corrector.analysis.Language;
import org.corrector.analysis.VerbFormRecognizer;
import org.corrector.dict.DictionaryLoader;
import org.corrector.dict.PrefixTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates {@link SpellingCorrector}s from string init args:
 * <pre class="prettyprint">
 *   language=es           (required, code or alias of a {@link Language})
 *   maxDistance=2         (largest edit distance of a suggestion)
 *   maxSuggestions=5      (suggestions returned at most)
 *   verbRecognition=true  (accept verb forms the language can recognize)
 * </pre>
 */
public class SpellingCorrectorFactory {

  private static final Logger log = LoggerFactory.getLogger(SpellingCorrectorFactory.class);

  public static final String LANGUAGE = "language";
  public static final String MAX_DISTANCE = "maxDistance";
  public static final String MAX_SUGGESTIONS = "maxSuggestions";
  public static final String VERB_RECOGNITION = "verbRecognition";

  /** The init args */
  protected Map<String,String> args;

  private Language language;
  private int maxDistance;
  private int maxSuggestions;
  private boolean verbRecognition;

  public void init(Map<String,String> args) {
    this.args = args == null ? Collections.<String,String>emptyMap() : new HashMap<String,String>(args);
    final String code = this.args.get(LANGUAGE);
    if (code == null) {
      throw new IllegalArgumentException("Configuration Error: missing parameter '" + LANGUAGE + "'");
    }
    try {
      language = Language.forName(code);
    } catch (IllegalArgumentException iae) {
      throw new IllegalArgumentException("Configuration Error: unknown language '" + code + "', available: "
          + Language.availableLanguages(), iae);
    }
    maxDistance = getInt(MAX_DISTANCE, SpellingCorrector.DEFAULT_MAX_DISTANCE);
    if (maxDistance < 0) {
      throw new IllegalArgumentException("Configuration Error: '" + MAX_DISTANCE + "' must be >= 0, got " + maxDistance);
    }
    maxSuggestions = getInt(MAX_SUGGESTIONS, SpellingCorrector.DEFAULT_MAX_SUGGESTIONS);
    if (maxSuggestions < 1) {
      throw new IllegalArgumentException("Configuration Error: '" + MAX_SUGGESTIONS + "' must be >= 1, got " + maxSuggestions);
    }
    verbRecognition = getBoolean(VERB_RECOGNITION, true);
    log.debug("language={} maxDistance={} maxSuggestions={} verbRecognition={}",
        language.getCode(), maxDistance, maxSuggestions, verbRecognition);
  }

  public Map<String,String> getArgs() {
    return args;
  }

  public Language getLanguage() {
    assureInitialized();
    return language;
  }

  /** Returns an empty dictionary set up with the language's plural policy. */
  public PrefixTree newDictionary() {
    assureInitialized();
    return new PrefixTree(language.getDepluralizer());
  }

  /** Loads a dictionary file set up with the language's plural policy. */
  public PrefixTree loadDictionary(Path path) throws IOException {
    assureInitialized();
    return DictionaryLoader.load(path, language.getDepluralizer());
  }

  /** Builds a corrector over <code>dictionary</code>. */
  public SpellingCorrector create(PrefixTree dictionary) {
    assureInitialized();
    if (dictionary.getDepluralizer() == null && language.getDepluralizer() != null) {
      log.warn("Dictionary has no plural policy, plurals of language '{}' will not be derived", language.getCode());
    }
    VerbFormRecognizer recognizer = null;
    if (verbRecognition) {
      recognizer = language.createVerbRecognizer(dictionary);
    }
    return new SpellingCorrector(dictionary, language, recognizer, maxDistance, maxSuggestions);
  }

  private void assureInitialized() {
    if (language == null) {
      throw new IllegalStateException("Factory '" + getClass().getName() + "' was not initialized");
    }
  }

  protected int getInt(String name, int defaultVal) {
    return getInt(name, defaultVal, true);
  }

  protected int getInt(String name, int defaultVal, boolean useDefault) {
    String s = args.get(name);
    if (s == null) {
      if (useDefault) return defaultVal;
      throw new IllegalArgumentException("Configuration Error: missing parameter '" + name + "'");
    }
    try {
      return Integer.parseInt(s.trim());
    } catch (NumberFormatException nfe) {
      throw new IllegalArgumentException("Configuration Error: parameter '" + name + "' is not an integer: '" + s + "'", nfe);
    }
  }

  protected boolean getBoolean(String name, boolean defaultVal) {
    return getBoolean(name, defaultVal, true);
  }

  protected boolean getBoolean(String name, boolean defaultVal, boolean useDefault) {
    String s = args.get(name);
    if (s == null) {
      if (useDefault) return defaultVal;
      throw new IllegalArgumentException("Configuration Error: missing parameter '" + name + "'");
    }
    return Boolean.parseBoolean(s.trim());
  }
}
