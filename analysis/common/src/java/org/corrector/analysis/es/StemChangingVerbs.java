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
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import org.corrector.analysis.WordlistLoader;

/**
 * Registry of the verbs whose stem alternates, keyed by infinitive.
 * <p>
 * A form is only analysed as stem changing when its candidate infinitive is
 * registered here under the matching {@link StemChange}, so <i>pensar</i>
 * (E_TO_IE) yields <i>pienso</i> while <i>pesar</i> never yields
 * <i>pieso</i>. Pronominal infinitives are also registered without their
 * <i>se</i>.
 */
public final class StemChangingVerbs {

  /** File containing the default table. */
  public static final String DEFAULT_RESOURCE = "stem_changing_verbs.txt";

  private final Map<String,StemChange> verbs;

  public StemChangingVerbs(Map<String,StemChange> verbs) {
    final Map<String,StemChange> copy = new HashMap<String,StemChange>();
    for (Map.Entry<String,StemChange> e : verbs.entrySet()) {
      final String infinitive = e.getKey().toLowerCase(Locale.ROOT);
      copy.put(infinitive, e.getValue());
      if (infinitive.endsWith("se") && infinitive.length() > 4) {
        final String base = infinitive.substring(0, infinitive.length() - 2);
        if (!copy.containsKey(base)) {
          copy.put(base, e.getValue());
        }
      }
    }
    this.verbs = Collections.unmodifiableMap(copy);
  }

  /** Returns the shared table loaded from {@link #DEFAULT_RESOURCE}. */
  public static StemChangingVerbs getDefault() {
    return DefaultHolder.DEFAULT;
  }

  /** Atomically loads the default table in a lazy fashion once the outer class accesses the static final field for the first time. */
  private static class DefaultHolder {
    static final StemChangingVerbs DEFAULT;

    static {
      try {
        DEFAULT = load(StemChangingVerbs.class.getResourceAsStream(DEFAULT_RESOURCE));
      } catch (IOException ex) {
        // default resource is always part of the jar
        throw new IllegalStateException("Unable to load default stem changing verbs", ex);
      }
    }
  }

  /**
   * Reads a table of <code>infinitive&lt;TAB&gt;alternation</code> lines, the
   * alternation being a {@link StemChange} constant name.
   */
  public static StemChangingVerbs load(InputStream stream) throws IOException {
    if (stream == null) {
      throw new IOException("Stem changing verbs resource not found");
    }
    final Map<String,String> raw = WordlistLoader.getTabSeparated(stream, StandardCharsets.UTF_8,
        new LinkedHashMap<String,String>());
    final Map<String,StemChange> verbs = new LinkedHashMap<String,StemChange>();
    for (Map.Entry<String,String> e : raw.entrySet()) {
      try {
        verbs.put(e.getKey(), StemChange.valueOf(e.getValue().toUpperCase(Locale.ROOT)));
      } catch (IllegalArgumentException iae) {
        throw new IOException("Unknown stem change '" + e.getValue() + "' for verb '" + e.getKey() + "'", iae);
      }
    }
    return new StemChangingVerbs(verbs);
  }

  /** Returns the alternation of an infinitive, or <code>null</code> if it has none. */
  public StemChange get(String infinitive) {
    return verbs.get(infinitive);
  }

  public int size() {
    return verbs.size();
  }
}
