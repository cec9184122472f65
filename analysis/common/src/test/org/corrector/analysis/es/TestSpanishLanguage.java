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

import java.io.IOException;
import java.io.StringReader;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.corrector.analysis.Language;
import org.corrector.dict.DictionaryLoader;
import org.corrector.dict.PrefixTree;
import org.corrector.spell.SpellingCorrector;
import org.corrector.spell.SpellingCorrectorFactory;
import org.corrector.spell.Suggestion;
import org.corrector.util.CorrectorTestCase;

public class TestSpanishLanguage extends CorrectorTestCase {

  private static final String DICTIONARY =
      "abuela|sustantivo|f|s||40\n"
      + "casa|sustantivo|f|s||100\n"
      + "cosa|sustantivo|f|s||300\n"
      + "gris|adjetivo||s||5\n"
      + "perro|sustantivo|m|s||30\n"
      + "perros|sustantivo|m|p||3\n"
      + "coger|verbo||||80\n"
      + "cantar|verbo||||50\n"
      + "sentirse|verbo||||10\n"
      + "injerir|verbo||||2\n"
      + "ingerir|verbo||||3\n"
      + "ingerimos|verbo||||1\n";

  private static SpellingCorrector corrector(String... settings) throws IOException {
    Map<String,String> args = new HashMap<String,String>();
    args.put(SpellingCorrectorFactory.LANGUAGE, "español");
    for (int i = 0; i < settings.length; i += 2) {
      args.put(settings[i], settings[i + 1]);
    }
    SpellingCorrectorFactory factory = new SpellingCorrectorFactory();
    factory.init(args);
    PrefixTree dictionary = factory.newDictionary();
    DictionaryLoader.load(new StringReader(DICTIONARY), dictionary);
    return factory.create(dictionary);
  }

  public void testLookup() {
    Language es = Language.forName("es");
    assertTrue(es instanceof SpanishLanguage);
    assertSame(es, Language.forName("Spanish"));
    assertSame(es, Language.forName("ESPAÑOL"));
    assertEquals("Español", es.getName());
    assertTrue(Language.availableLanguages().containsAll(Arrays.asList("es", "ca")));
  }

  public void testPolicies() {
    Language es = Language.forName("es");
    assertTrue(es.getDepluralizer() instanceof SpanishDepluralizer);
    assertTrue(es.isKnownAbbreviation("n.º"));
    assertTrue(es.isKnownAbbreviation("N.ª"));
    assertFalse(es.isKnownAbbreviation("nº"));
    assertEquals(VerbPrefixes.DEFAULT_PREFIXES, es.getVerbPrefixes());
    assertEquals(EncliticAnalyzer.DEFAULT_PRONOUNS, es.getEncliticPronouns());
    assertTrue(es.createVerbRecognizer(new PrefixTree()) instanceof SpanishVerbRecognizer);
  }

  public void testConfusableSpellings() {
    Language es = Language.forName("es");
    assertEquals(Arrays.asList("coger"), es.getConfusableSpellings("cojer"));
    assertEquals(Arrays.asList("geje", "jege"), es.getConfusableSpellings("jeje"));
    assertEquals(Arrays.asList("gícara"), es.getConfusableSpellings("jícara"));
    assertEquals(Collections.emptyList(), es.getConfusableSpellings("jamón"));
    assertEquals(Collections.emptyList(), es.getConfusableSpellings("reloj"));
  }

  public void testPlurals() throws IOException {
    SpellingCorrector corrector = corrector();
    assertTrue(corrector.isCorrect("abuelas"));
    assertEquals(20, corrector.getDictionary().derivePluralInfo("abuelas").getFrequency());
    assertTrue(corrector.isCorrect("grises"));
    // stored literally, nothing to derive
    assertTrue(corrector.isCorrect("perros"));
    assertNull(corrector.getDictionary().derivePluralInfo("perros"));
    // verbs have no plural
    assertFalse(corrector.isCorrect("cantars"));
  }

  public void testVerbForms() throws IOException {
    SpellingCorrector corrector = corrector();
    assertTrue(corrector.isCorrect("cantamos"));
    assertTrue(corrector.isCorrect("Sintió"));
    assertTrue(corrector.isCorrect("dámelo"));

    SpellingCorrector withoutVerbs = corrector(SpellingCorrectorFactory.VERB_RECOGNITION, "false");
    assertFalse(withoutVerbs.isCorrect("cantamos"));
    assertTrue(withoutVerbs.isCorrect("cantar"));
  }

  public void testConfusableOverridesVerbForm() throws IOException {
    SpellingCorrector corrector = corrector();
    // a regular form of injerir, but the dictionary has the g spelling
    assertTrue(corrector.getVerbRecognizer().isValidVerbForm("injerimos"));
    assertFalse(corrector.isCorrect("injerimos"));
    assertEquals("ingerimos", corrector.getSuggestions("injerimos").get(0).getWord());
  }

  public void testJInsteadOfG() throws IOException {
    SpellingCorrector corrector = corrector();
    assertFalse(corrector.isCorrect("cojer"));
    List<Suggestion> suggestions = corrector.getSuggestions("cojer");
    assertEquals(new Suggestion("coger", 1, Long.MAX_VALUE), suggestions.get(0));
    for (int i = 1; i < suggestions.size(); i++) {
      assertFalse(suggestions.get(i).getWord().equals("coger"));
    }
  }

  public void testRanking() throws IOException {
    List<Suggestion> suggestions = corrector().getSuggestions("cisa");
    assertEquals(new Suggestion("cosa", 1, 300), suggestions.get(0));
    assertEquals(new Suggestion("casa", 1, 100), suggestions.get(1));

    List<Suggestion> one = corrector(SpellingCorrectorFactory.MAX_SUGGESTIONS, "1").getSuggestions("cisa");
    assertEquals(1, one.size());
    assertEquals("cosa", one.get(0).getWord());
  }
}
