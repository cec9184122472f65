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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * A character trie holding the words of a dictionary together with their
 * {@link WordEntry}.
 * <p>
 * Keys are lowercased (with {@link Locale#ROOT}) on insertion and on every
 * lookup, so the tree is case insensitive. Each node exclusively owns its
 * children; a terminal node holds at most one entry.
 * <p>
 * Besides exact lookups the tree answers bounded fuzzy queries
 * ({@link #searchWithinDistance(String, int)}) by walking the nodes while
 * carrying one row of the Levenshtein table per depth, and can synthesize
 * entries for plurals missing from the dictionary
 * ({@link #derivePluralInfo(String)}) when a {@link Depluralizer} is supplied.
 * <p>
 * <b>NOTE</b>: the tree is not synchronized. Once built it may be shared by
 * any number of reading threads, but {@link #insert} and {@link #update}
 * require exclusive access.
 */
public class PrefixTree {

  /** A node of the tree. Children are kept sorted by character. */
  static final class Node {
    final TreeMap<Character, Node> children = new TreeMap<Character, Node>();
    WordEntry entry;

    Node getChild(char ch) {
      return children.get(Character.valueOf(ch));
    }

    Node getOrAddChild(char ch) {
      Node child = children.get(Character.valueOf(ch));
      if (child == null) {
        child = new Node();
        children.put(Character.valueOf(ch), child);
      }
      return child;
    }
  }

  private final Node root = new Node();
  private final Depluralizer depluralizer;
  private int wordCount;

  /** Creates an empty tree without plural derivation. */
  public PrefixTree() {
    this(null);
  }

  /**
   * Creates an empty tree.
   *
   * @param depluralizer plural policy used by {@link #derivePluralInfo(String)},
   *          or <code>null</code> to disable plural derivation
   */
  public PrefixTree(Depluralizer depluralizer) {
    this.depluralizer = depluralizer;
  }

  /** Returns the plural policy of this tree, possibly <code>null</code>. */
  public Depluralizer getDepluralizer() {
    return depluralizer;
  }

  /**
   * Inserts a word. If the word is already present its entry is only
   * replaced when the new frequency is strictly greater. Empty words are
   * ignored.
   */
  public void insert(String word, WordEntry entry) {
    put(word, entry, false);
  }

  /** Inserts a word with {@link WordEntry#DEFAULT}. */
  public void insert(String word) {
    put(word, WordEntry.DEFAULT, false);
  }

  /** Inserts a word, replacing any existing entry unconditionally. */
  public void update(String word, WordEntry entry) {
    put(word, entry, true);
  }

  private void put(String word, WordEntry entry, boolean replace) {
    if (word == null || entry == null) {
      throw new IllegalArgumentException("word and entry must not be null");
    }
    final String key = fold(word);
    if (key.isEmpty()) {
      return;
    }
    Node node = root;
    for (int i = 0; i < key.length(); i++) {
      node = node.getOrAddChild(key.charAt(i));
    }
    if (node.entry == null) {
      node.entry = entry;
      wordCount++;
    } else if (replace || entry.getFrequency() > node.entry.getFrequency()) {
      node.entry = entry;
    }
  }

  /** Returns true if the word is stored in the tree. */
  public boolean contains(String word) {
    return lookup(word) != null;
  }

  /** Returns the entry stored for a word, or <code>null</code> if the word is unknown. */
  public WordEntry lookup(String word) {
    if (word == null) {
      return null;
    }
    final Node node = find(fold(word));
    return node == null ? null : node.entry;
  }

  private Node find(String key) {
    if (key.isEmpty()) {
      return null;
    }
    Node node = root;
    for (int i = 0; i < key.length() && node != null; i++) {
      node = node.getChild(key.charAt(i));
    }
    return node;
  }

  /**
   * Returns every stored word starting with <code>prefix</code>, the prefix
   * itself included when it is a word. Order is unspecified.
   */
  public List<String> wordsWithPrefix(String prefix) {
    if (prefix == null) {
      return Collections.emptyList();
    }
    final String key = fold(prefix);
    final Node start = key.isEmpty() ? root : find(key);
    if (start == null) {
      return Collections.emptyList();
    }
    final List<String> words = new ArrayList<String>();
    final StringBuilder path = new StringBuilder(key);
    collect(start, path, words, null);
    return words;
  }

  /**
   * Returns a snapshot of all words with their entries, in lexicographic
   * (char) order.
   */
  public Map<String, WordEntry> allEntries() {
    final Map<String, WordEntry> entries = new LinkedHashMap<String, WordEntry>(Math.max(16, wordCount * 2));
    collect(root, new StringBuilder(), null, entries);
    return entries;
  }

  private static void collect(Node node, StringBuilder path, List<String> words, Map<String, WordEntry> entries) {
    if (node.entry != null) {
      if (words != null) {
        words.add(path.toString());
      } else {
        entries.put(path.toString(), node.entry);
      }
    }
    for (Map.Entry<Character, Node> child : node.children.entrySet()) {
      path.append(child.getKey().charValue());
      collect(child.getValue(), path, words, entries);
      path.setLength(path.length() - 1);
    }
  }

  /**
   * Returns every stored word whose Levenshtein distance to <code>word</code>
   * is at most <code>maxDistance</code>, each with its entry and exact
   * distance. Order is unspecified.
   * <p>
   * The tree is walked depth first. Each visited node computes the row of the
   * edit distance table for its path from the row of its parent; a subtree
   * is skipped as soon as the smallest value of that row exceeds
   * <code>maxDistance</code>, because extending the path can never lower it.
   */
  public List<FuzzyMatch> searchWithinDistance(String word, int maxDistance) {
    final List<FuzzyMatch> results = new ArrayList<FuzzyMatch>();
    if (word == null || maxDistance < 0) {
      return results;
    }
    final String target = fold(word);
    final int[] firstRow = new int[target.length() + 1];
    for (int j = 0; j < firstRow.length; j++) {
      firstRow[j] = j;
    }
    final StringBuilder path = new StringBuilder();
    for (Map.Entry<Character, Node> child : root.children.entrySet()) {
      search(child.getValue(), child.getKey().charValue(), target, firstRow, maxDistance, path, results);
    }
    return results;
  }

  private static void search(Node node, char ch, String target, int[] previousRow, int maxDistance,
      StringBuilder path, List<FuzzyMatch> results) {
    final int columns = target.length() + 1;
    final int[] row = new int[columns];
    row[0] = previousRow[0] + 1;
    int rowMin = row[0];
    for (int j = 1; j < columns; j++) {
      final int insertCost = row[j - 1] + 1;
      final int deleteCost = previousRow[j] + 1;
      final int replaceCost = previousRow[j - 1] + (target.charAt(j - 1) == ch ? 0 : 1);
      row[j] = Math.min(insertCost, Math.min(deleteCost, replaceCost));
      if (row[j] < rowMin) {
        rowMin = row[j];
      }
    }
    if (rowMin > maxDistance) {
      return;
    }

    path.append(ch);
    final int distance = row[columns - 1];
    if (node.entry != null && distance <= maxDistance) {
      results.add(new FuzzyMatch(path.toString(), node.entry, distance));
    }
    for (Map.Entry<Character, Node> child : node.children.entrySet()) {
      search(child.getValue(), child.getKey().charValue(), target, row, maxDistance, path, results);
    }
    path.setLength(path.length() - 1);
  }

  /**
   * Synthesizes an entry for a plural that is not literally stored.
   * <p>
   * Only applies when this tree has a {@link Depluralizer}, the word carries
   * the plural marker and is not itself stored. The singular candidates are
   * probed in order and the first one that is a noun or adjective not marked
   * plural is used: its category and gender are kept, the number becomes
   * plural and the frequency is halved (floor 1). The result is never
   * inserted into the tree.
   *
   * @return the synthesized entry, or <code>null</code> if none applies
   */
  public WordEntry derivePluralInfo(String word) {
    if (depluralizer == null || word == null) {
      return null;
    }
    final String key = fold(word);
    if (key.isEmpty() || !depluralizer.hasPluralMarker(key) || lookup(key) != null) {
      return null;
    }
    for (String candidate : depluralizer.singularCandidates(key)) {
      final WordEntry singular = lookup(candidate);
      if (singular == null) {
        continue;
      }
      final WordCategory category = singular.getCategory();
      if ((category == WordCategory.NOUN || category == WordCategory.ADJECTIVE)
          && singular.getNumber() != GrammaticalNumber.PLURAL) {
        return singular.asDerivedPlural();
      }
    }
    return null;
  }

  /** Number of words stored. */
  public int size() {
    return wordCount;
  }

  public boolean isEmpty() {
    return wordCount == 0;
  }

  static String fold(String word) {
    return word.toLowerCase(Locale.ROOT);
  }
}
