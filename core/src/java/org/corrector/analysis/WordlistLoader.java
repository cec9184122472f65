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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loader for the text tables bundled with language modules.
 */
public class WordlistLoader {

  /** no instance */
  private WordlistLoader() {}

  /**
   * Reads the (non comment) lines containing data from a stream using the
   * given character encoding. The stream is closed.
   *
   * <p>
   * A comment line is any line that starts with the character "#"
   * </p>
   *
   * @return a list of non-blank non-comment lines with whitespace trimmed
   * @throws IOException If there is a low-level I/O error.
   */
  public static List<String> getLines(InputStream stream, Charset charset) throws IOException {
    final BufferedReader input = new BufferedReader(getDecodingReader(stream, charset));
    try {
      final List<String> lines = new ArrayList<String>();
      for (String word = null; (word = input.readLine()) != null;) {
        // skip initial bom marker
        if (lines.isEmpty() && word.length() > 0 && word.charAt(0) == '\uFEFF')
          word = word.substring(1);
        // skip comments
        if (word.startsWith("#")) continue;
        word = word.trim();
        // skip blank lines
        if (word.length() == 0) continue;
        lines.add(word);
      }
      return lines;
    } finally {
      input.close();
    }
  }

  /**
   * Reads a two column table. Each data line contains:
   * <pre>key<b>\t</b>value</pre>
   * Later lines overwrite earlier ones with the same key.
   *
   * @return the given map, filled with the table
   * @throws IOException If there is a low-level I/O error or a data line has no tab.
   */
  public static Map<String,String> getTabSeparated(InputStream stream, Charset charset, Map<String,String> result)
      throws IOException {
    for (String line : getLines(stream, charset)) {
      final String[] keyValue = line.split("\t", 2);
      if (keyValue.length != 2) {
        throw new IOException("Malformed table line (expected key<TAB>value): '" + line + "'");
      }
      result.put(keyValue[0].trim(), keyValue[1].trim());
    }
    return result;
  }

  private static Reader getDecodingReader(InputStream stream, Charset charset) {
    final CharsetDecoder charSetDecoder = charset.newDecoder()
        .onMalformedInput(CodingErrorAction.REPORT)
        .onUnmappableCharacter(CodingErrorAction.REPORT);
    return new InputStreamReader(stream, charSetDecoder);
  }
}
