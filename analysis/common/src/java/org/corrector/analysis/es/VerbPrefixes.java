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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Splits derivational prefixes off verb forms (<i>deshago</i> is
 * <i>des</i> + <i>hago</i>, <i>predigo</i> is <i>pre</i> + <i>digo</i>).
 */
public final class VerbPrefixes {

  /** Common Spanish verb prefixes, longest first. */
  public static final List<String> DEFAULT_PREFIXES = Collections.unmodifiableList(Arrays.asList(
      "contra", "entre", "sobre", "super", "trans", "inter",
      "ante", "anti", "auto", "semi", "pre", "sub", "com", "con", "dis", "pro",
      "des", "re", "co", "ex", "in", "en", "im"));

  /** The shortest remainder a split may leave. */
  public static final int MIN_BASE_LENGTH = 2;

  private final List<String> prefixes;

  public VerbPrefixes() {
    this(DEFAULT_PREFIXES);
  }

  /** @param prefixes lowercase prefixes, in any order */
  public VerbPrefixes(List<String> prefixes) {
    final List<String> sorted = new ArrayList<String>(prefixes);
    // stable, so equally long prefixes keep their order
    Collections.sort(sorted, new Comparator<String>() {
      @Override
      public int compare(String a, String b) {
        return b.length() - a.length();
      }
    });
    this.prefixes = Collections.unmodifiableList(sorted);
  }

  public List<String> getPrefixes() {
    return prefixes;
  }

  /**
   * Returns every way of splitting a known prefix off <code>word</code> that
   * leaves at least {@link #MIN_BASE_LENGTH} characters, longest prefix
   * first.
   */
  public List<Split> split(String word) {
    List<Split> splits = null;
    for (String prefix : prefixes) {
      if (word.startsWith(prefix) && word.length() - prefix.length() >= MIN_BASE_LENGTH) {
        if (splits == null) {
          splits = new ArrayList<Split>(2);
        }
        splits.add(new Split(prefix, word.substring(prefix.length())));
      }
    }
    return splits == null ? Collections.<Split>emptyList() : splits;
  }

  /** Rebuilds the infinitive of a prefixed verb from its base infinitive. */
  public static String reconstruct(String prefix, String baseInfinitive) {
    return prefix + baseInfinitive;
  }

  /** A prefix and the remainder of the word. */
  public static final class Split {
    private final String prefix;
    private final String base;

    Split(String prefix, String base) {
      this.prefix = prefix;
      this.base = base;
    }

    public String getPrefix() {
      return prefix;
    }

    public String getBase() {
      return base;
    }

    @Override
    public String toString() {
      return prefix + "+" + base;
    }
  }
}
