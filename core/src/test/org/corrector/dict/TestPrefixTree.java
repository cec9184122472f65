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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import org.corrector.util.CorrectorTestCase;
import org.corrector.util.EditDistance;
import org.corrector.util.TestUtil;

/**
 * Tests {@link PrefixTree}.
 */
public class TestPrefixTree extends CorrectorTestCase {

  /** adds "s" to make plurals, enough to exercise plural derivation */
  static final Depluralizer TRAILING_S = new Depluralizer() {
    @Override
    public boolean hasPluralMarker(String word) {
      return word.endsWith("s");
    }

    @Override
    public List<String> singularCandidates(String word) {
      if (!hasPluralMarker(word) || word.length() < 2) {
        return Collections.emptyList();
      }
      return Collections.singletonList(word.substring(0, word.length() - 1));
    }
  };

  private static WordEntry noun(Gender gender, long frequency) {
    return new WordEntry(WordCategory.NOUN, gender, GrammaticalNumber.SINGULAR, "", frequency);
  }

  public void testInsertAndLookup() {
    PrefixTree tree = new PrefixTree();
    assertTrue(tree.isEmpty());
    WordEntry casa = noun(Gender.FEMININE, 10);
    tree.insert("casa", casa);
    tree.insert("casas");
    tree.insert("cosa");

    assertEquals(3, tree.size());
    assertFalse(tree.isEmpty());
    assertTrue(tree.contains("casa"));
    assertSame(casa, tree.lookup("casa"));
    assertEquals(WordEntry.DEFAULT, tree.lookup("casas"));
    assertFalse(tree.contains("cas"));
    assertNull(tree.lookup("cas"));
    assertNull(tree.lookup("casamiento"));
    assertFalse(tree.contains(""));
    assertFalse(tree.contains(null));
  }

  public void testCaseInsensitive() {
    PrefixTree tree = new PrefixTree();
    tree.insert("Madrid", new WordEntry(WordCategory.NOUN, Gender.MASCULINE, GrammaticalNumber.SINGULAR));
    tree.insert("6K");
    assertTrue(tree.contains("madrid"));
    assertTrue(tree.contains("MADRID"));
    assertTrue(tree.contains("MaDrId"));
    assertTrue(tree.contains("6k"));
    assertEquals(Arrays.asList("madrid"), tree.wordsWithPrefix("MAD"));
  }

  public void testFrequencyDominance() {
    PrefixTree tree = new PrefixTree();
    tree.insert("banco", noun(Gender.MASCULINE, 5));
    tree.insert("banco", noun(Gender.MASCULINE, 3));
    assertEquals(5, tree.lookup("banco").getFrequency());
    // equal frequency does not overwrite either
    WordEntry other = new WordEntry(WordCategory.VERB, Gender.NONE, GrammaticalNumber.NONE, "", 5);
    tree.insert("banco", other);
    assertEquals(WordCategory.NOUN, tree.lookup("banco").getCategory());
    tree.insert("banco", noun(Gender.MASCULINE, 9));
    assertEquals(9, tree.lookup("banco").getFrequency());
    assertEquals(1, tree.size());

    // update replaces unconditionally
    tree.update("banco", other);
    assertSame(other, tree.lookup("banco"));
    tree.update("nuevo", other);
    assertTrue(tree.contains("nuevo"));
    assertEquals(2, tree.size());
  }

  public void testWordsWithPrefix() {
    PrefixTree tree = new PrefixTree();
    for (String w : new String[] { "casa", "casas", "casamiento", "cosa", "caso", "perro" }) {
      tree.insert(w);
    }
    List<String> words = new ArrayList<String>(tree.wordsWithPrefix("cas"));
    Collections.sort(words);
    assertEquals(Arrays.asList("casa", "casamiento", "casas", "caso"), words);
    assertEquals(Arrays.asList("perro"), tree.wordsWithPrefix("perro"));
    assertTrue(tree.wordsWithPrefix("x").isEmpty());
    assertEquals(6, tree.wordsWithPrefix("").size());
  }

  public void testAllEntries() {
    PrefixTree tree = new PrefixTree();
    tree.insert("b", noun(Gender.MASCULINE, 2));
    tree.insert("a");
    tree.insert("ab");
    Map<String,WordEntry> all = tree.allEntries();
    assertEquals(Arrays.asList("a", "ab", "b"), new ArrayList<String>(all.keySet()));
    assertEquals(2, all.get("b").getFrequency());
  }

  public void testSearchWithinDistance() {
    PrefixTree tree = new PrefixTree();
    for (String w : new String[] { "casa", "cosa", "caso", "casas", "perro", "cas", "masa" }) {
      tree.insert(w);
    }
    Map<String,Integer> found = toMap(tree.searchWithinDistance("casa", 1));
    Map<String,Integer> expected = new HashMap<String,Integer>();
    expected.put("casa", 0);
    expected.put("cosa", 1);
    expected.put("caso", 1);
    expected.put("casas", 1);
    expected.put("cas", 1);
    expected.put("masa", 1);
    assertEquals(expected, found);

    found = toMap(tree.searchWithinDistance("CASA", 0));
    assertEquals(Collections.singletonMap("casa", 0), found);

    assertTrue(tree.searchWithinDistance("xyzxyz", 2).isEmpty());
    assertTrue(tree.searchWithinDistance("casa", -1).isEmpty());
  }

  /** compares the pruned walk against a scan of every word */
  public void testSearchMatchesBruteForce() {
    Random random = newRandom();
    for (int iter = 0; iter < ITERATIONS; iter++) {
      PrefixTree tree = new PrefixTree();
      int numWords = TestUtil.nextInt(random, 1, 200);
      for (int i = 0; i < numWords; i++) {
        String word = random.nextBoolean()
            ? TestUtil.randomSimpleString(random, 3, 7)
            : TestUtil.randomSpanishString(random, 7);
        tree.insert(word);
      }
      Map<String,WordEntry> all = tree.allEntries();
      assertEquals(tree.size(), all.size());
      for (int q = 0; q < 10; q++) {
        String query = TestUtil.randomSimpleString(random, 4, 8);
        int maxDistance = random.nextInt(4);
        Map<String,Integer> expected = new HashMap<String,Integer>();
        for (String word : all.keySet()) {
          int d = EditDistance.levenshtein(query, word);
          if (d <= maxDistance) {
            expected.put(word, d);
          }
        }
        assertEquals("query=" + query + " maxDistance=" + maxDistance,
            expected, toMap(tree.searchWithinDistance(query, maxDistance)));
      }
    }
  }

  public void testDerivePluralInfo() {
    PrefixTree tree = new PrefixTree(TRAILING_S);
    tree.insert("abuela", noun(Gender.FEMININE, 40));
    tree.insert("come", new WordEntry(WordCategory.VERB, Gender.NONE, GrammaticalNumber.NONE, "", 30));
    tree.insert("tijeras", new WordEntry(WordCategory.NOUN, Gender.FEMININE, GrammaticalNumber.PLURAL, "", 8));
    tree.insert("gris", new WordEntry(WordCategory.ADJECTIVE, Gender.NONE, GrammaticalNumber.SINGULAR, "", 1));

    WordEntry derived = tree.derivePluralInfo("abuelas");
    assertNotNull(derived);
    assertEquals(WordCategory.NOUN, derived.getCategory());
    assertEquals(Gender.FEMININE, derived.getGender());
    assertEquals(GrammaticalNumber.PLURAL, derived.getNumber());
    assertEquals(20, derived.getFrequency());
    assertFalse("derived entries are not stored", tree.contains("abuelas"));
    assertEquals(4, tree.size());

    // never from verbs
    assertNull(tree.derivePluralInfo("comes"));
    // no plural marker
    assertNull(tree.derivePluralInfo("abuela"));
    // singular candidate already plural
    assertNull(tree.derivePluralInfo("tijerass"));
    // literal words are not derived
    assertNull(tree.derivePluralInfo("gris"));
    assertNull(tree.derivePluralInfo("perros"));

    // frequency floor of 1
    tree.insert("sol", noun(Gender.MASCULINE, 1));
    assertEquals(1, tree.derivePluralInfo("sols").getFrequency());

    // once inserted literally, nothing is derived
    tree.insert("abuelas", noun(Gender.FEMININE, 3));
    assertNull(tree.derivePluralInfo("abuelas"));
  }

  public void testNoDepluralizer() {
    PrefixTree tree = new PrefixTree();
    tree.insert("abuela", noun(Gender.FEMININE, 40));
    assertNull(tree.getDepluralizer());
    assertNull(tree.derivePluralInfo("abuelas"));
  }

  private static Map<String,Integer> toMap(List<FuzzyMatch> matches) {
    Map<String,Integer> map = new HashMap<String,Integer>();
    for (FuzzyMatch m : matches) {
      assertNull("duplicate match " + m, map.put(m.getWord(), Integer.valueOf(m.getDistance())));
    }
    return map;
  }
}
