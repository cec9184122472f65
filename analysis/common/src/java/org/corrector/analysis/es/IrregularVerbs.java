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
import java.util.Locale;
import java.util.Map;

import org.corrector.analysis.WordlistLoader;

/**
 * Lookup table from irregular verb forms to their infinitive
 * (<i>tuve</i> to <i>tener</i>, <i>condujo</i> to <i>conducir</i>).
 * <p>
 * The table is consulted before any rule, so an irregular form always wins
 * over a regular analysis of the same string.
 */
public final class IrregularVerbs {

  /** File containing the default table. */
  public static final String DEFAULT_RESOURCE = "irregular_verbs.txt";

  private final Map<String,String> forms;

  public IrregularVerbs(Map<String,String> forms) {
    final Map<String,String> copy = new HashMap<String,String>(forms.size() * 2);
    for (Map.Entry<String,String> e : forms.entrySet()) {
      copy.put(e.getKey().toLowerCase(Locale.ROOT), e.getValue().toLowerCase(Locale.ROOT));
    }
    this.forms = Collections.unmodifiableMap(copy);
  }

  /** Returns the shared table loaded from {@link #DEFAULT_RESOURCE}. */
  public static IrregularVerbs getDefault() {
    return DefaultHolder.DEFAULT;
  }

  private static class DefaultHolder {
    static final IrregularVerbs DEFAULT;

    static {
      try {
        DEFAULT = load(IrregularVerbs.class.getResourceAsStream(DEFAULT_RESOURCE));
      } catch (IOException ex) {
        // default resource is always part of the jar
        throw new IllegalStateException("Unable to load default irregular verbs", ex);
      }
    }
  }

  /**
   * Reads a table of <code>form&lt;TAB&gt;infinitive</code> lines. When a
   * form is listed twice the last line wins.
   */
  public static IrregularVerbs load(InputStream stream) throws IOException {
    if (stream == null) {
      throw new IOException("Irregular verbs resource not found");
    }
    return new IrregularVerbs(WordlistLoader.getTabSeparated(stream, StandardCharsets.UTF_8,
        new HashMap<String,String>()));
  }

  /** Returns the infinitive of an irregular form, or <code>null</code>. */
  public String getInfinitive(String form) {
    return forms.get(form);
  }

  public boolean contains(String form) {
    return forms.containsKey(form);
  }

  public int size() {
    return forms.size();
  }
}
