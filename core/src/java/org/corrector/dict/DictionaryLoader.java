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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads dictionaries into a {@link PrefixTree}.
 * <p>
 * The main format is UTF-8, one word per line, with pipe separated fields:
 * <pre>word|category|gender|number|extra|frequency</pre>
 * Trailing fields may be left out (<code>word</code>,
 * <code>word|category</code>, <code>word|category|gender|number</code>...).
 * Missing fields take their defaults and a frequency that does not parse is
 * read as 1. Blank lines and lines starting with <code>#</code> are skipped,
 * as is a leading byte order mark.
 */
public final class DictionaryLoader {

  private static final Logger log = LoggerFactory.getLogger(DictionaryLoader.class);

  /** no instance */
  private DictionaryLoader() {}

  /**
   * Loads the dictionary at <code>path</code> into a new tree.
   *
   * @param depluralizer plural policy for the new tree, may be <code>null</code>
   */
  public static PrefixTree load(Path path, Depluralizer depluralizer) throws IOException {
    final PrefixTree tree = new PrefixTree(depluralizer);
    final Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
    try {
      final int count = load(reader, tree);
      log.info("Loaded {} entries ({} distinct words) from {}", count, tree.size(), path);
    } finally {
      reader.close();
    }
    return tree;
  }

  /**
   * Reads every entry of <code>reader</code> into <code>tree</code>, applying
   * the frequency dominance rule of {@link PrefixTree#insert(String, WordEntry)}.
   * The reader is not closed.
   *
   * @return the number of entries read
   */
  public static int load(Reader reader, PrefixTree tree) throws IOException {
    final BufferedReader br = getBufferedReader(reader);
    int count = 0;
    int lineNumber = 0;
    String line;
    while ((line = br.readLine()) != null) {
      lineNumber++;
      if (lineNumber == 1) {
        line = stripBOM(line);
      }
      line = line.trim();
      if (line.length() == 0 || line.startsWith("#")) {
        continue;
      }
      final WordEntryLine parsed = parseLine(line, lineNumber);
      if (parsed != null) {
        tree.insert(parsed.word, parsed.entry);
        count++;
      }
    }
    return count;
  }

  /**
   * Reads a plain word list (one word per line, <code>#</code> comments) into
   * <code>tree</code> with {@link WordEntry#DEFAULT} metadata.
   *
   * @return the number of words read
   */
  public static int loadSimple(Reader reader, PrefixTree tree) throws IOException {
    final BufferedReader br = getBufferedReader(reader);
    int count = 0;
    boolean first = true;
    String line;
    while ((line = br.readLine()) != null) {
      if (first) {
        line = stripBOM(line);
        first = false;
      }
      final String word = line.trim();
      if (word.length() > 0 && !word.startsWith("#")) {
        tree.insert(word);
        count++;
      }
    }
    return count;
  }

  /**
   * Merges several trees into a new one. Entries are inserted in order, so a
   * word present in several trees keeps its most frequent entry. The result
   * uses the depluralizer of the first tree.
   */
  public static PrefixTree merge(PrefixTree... trees) {
    final PrefixTree result = new PrefixTree(trees.length == 0 ? null : trees[0].getDepluralizer());
    for (PrefixTree tree : trees) {
      for (Map.Entry<String, WordEntry> e : tree.allEntries().entrySet()) {
        result.insert(e.getKey(), e.getValue());
      }
    }
    return result;
  }

  /**
   * Appends a single word to a user dictionary file, creating the file and
   * its parent directories when needed.
   */
  public static void appendCustomWord(Path path, String word) throws IOException {
    final String trimmed = word == null ? "" : word.trim();
    if (trimmed.length() == 0 || trimmed.indexOf('\n') >= 0 || trimmed.indexOf('\r') >= 0) {
      throw new IllegalArgumentException("Not a single word: '" + word + "'");
    }
    final Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    final Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    try {
      writer.write(trimmed);
      writer.write('\n');
    } finally {
      writer.close();
    }
    log.debug("Appended '{}' to {}", trimmed, path);
  }

  static WordEntryLine parseLine(String line, int lineNumber) {
    final String[] parts = line.split("\\|", -1);
    final String word = parts[0].trim();
    if (word.length() == 0) {
      log.warn("Skipping line {}: missing word in '{}'", lineNumber, line);
      return null;
    }
    if (parts.length == 1) {
      return new WordEntryLine(word, WordEntry.DEFAULT);
    }
    final WordCategory category = WordCategory.fromString(field(parts, 1));
    final Gender gender = Gender.fromString(field(parts, 2));
    final GrammaticalNumber number = GrammaticalNumber.fromString(field(parts, 3));
    final String extra = field(parts, 4);
    long frequency = 1;
    if (parts.length > 5 && parts[5].trim().length() > 0) {
      final String raw = parts[5].trim();
      try {
        frequency = Long.parseLong(raw);
        if (frequency < 1) {
          log.warn("Line {}: frequency {} of '{}' below 1, using 1", lineNumber, raw, word);
          frequency = 1;
        }
      } catch (NumberFormatException nfe) {
        log.warn("Line {}: unparseable frequency '{}' for '{}', using 1", lineNumber, raw, word);
      }
    }
    return new WordEntryLine(word, new WordEntry(category, gender, number, extra, frequency));
  }

  private static String field(String[] parts, int index) {
    return index < parts.length ? parts[index].trim() : "";
  }

  private static String stripBOM(String line) {
    return line.length() > 0 && line.charAt(0) == '\uFEFF' ? line.substring(1) : line;
  }

  private static BufferedReader getBufferedReader(Reader reader) {
    return (reader instanceof BufferedReader) ? (BufferedReader) reader
        : new BufferedReader(reader);
  }

  static final class WordEntryLine {
    final String word;
    final WordEntry entry;

    WordEntryLine(String word, WordEntry entry) {
      this.word = word;
      this.entry = entry;
    }
  }
}
