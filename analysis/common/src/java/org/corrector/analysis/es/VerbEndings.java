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
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Endings of the regular Spanish paradigms.
 * <p>
 * Simple tenses are added to the stem (infinitive minus its ending); future
 * and conditional are added to the whole infinitive.
 */
public final class VerbEndings {

  static final String[] PRESENT_AR = { "o", "as", "a", "amos", "áis", "an" };
  static final String[] PRESENT_ER = { "o", "es", "e", "emos", "éis", "en" };
  static final String[] PRESENT_IR = { "o", "es", "e", "imos", "ís", "en" };

  static final String[] PRETERITE_AR = { "é", "aste", "ó", "amos", "asteis", "aron" };
  static final String[] PRETERITE_ER_IR = { "í", "iste", "ió", "imos", "isteis", "ieron" };

  static final String[] IMPERFECT_AR = { "aba", "abas", "aba", "ábamos", "abais", "aban" };
  static final String[] IMPERFECT_ER_IR = { "ía", "ías", "ía", "íamos", "íais", "ían" };

  static final String[] PRESENT_SUBJUNCTIVE_AR = { "e", "es", "e", "emos", "éis", "en" };
  static final String[] PRESENT_SUBJUNCTIVE_ER_IR = { "a", "as", "a", "amos", "áis", "an" };

  static final String[] IMPERFECT_SUBJUNCTIVE_RA_AR = { "ara", "aras", "ara", "áramos", "arais", "aran" };
  static final String[] IMPERFECT_SUBJUNCTIVE_RA_ER_IR = { "iera", "ieras", "iera", "iéramos", "ierais", "ieran" };

  static final String[] IMPERFECT_SUBJUNCTIVE_SE_AR = { "ase", "ases", "ase", "ásemos", "aseis", "asen" };
  static final String[] IMPERFECT_SUBJUNCTIVE_SE_ER_IR = { "iese", "ieses", "iese", "iésemos", "ieseis", "iesen" };

  static final String[] FUTURE_SUBJUNCTIVE_AR = { "are", "ares", "are", "áremos", "areis", "aren" };
  static final String[] FUTURE_SUBJUNCTIVE_ER_IR = { "iere", "ieres", "iere", "iéremos", "iereis", "ieren" };

  /** Future endings, added to the infinitive. */
  public static final List<String> FUTURE =
      Collections.unmodifiableList(Arrays.asList("é", "ás", "á", "emos", "éis", "án"));

  /** Conditional endings, added to the infinitive. */
  public static final List<String> CONDITIONAL =
      Collections.unmodifiableList(Arrays.asList("ía", "ías", "ía", "íamos", "íais", "ían"));

  private static final Map<VerbClass,List<String>> ALL_ENDINGS = new EnumMap<VerbClass,List<String>>(VerbClass.class);

  static {
    ALL_ENDINGS.put(VerbClass.AR, build(PRESENT_AR, PRETERITE_AR, IMPERFECT_AR, PRESENT_SUBJUNCTIVE_AR,
        IMPERFECT_SUBJUNCTIVE_RA_AR, IMPERFECT_SUBJUNCTIVE_SE_AR, FUTURE_SUBJUNCTIVE_AR,
        new String[] { gerund(VerbClass.AR), participle(VerbClass.AR), "ad" }));
    ALL_ENDINGS.put(VerbClass.ER, build(PRESENT_ER, PRETERITE_ER_IR, IMPERFECT_ER_IR, PRESENT_SUBJUNCTIVE_ER_IR,
        IMPERFECT_SUBJUNCTIVE_RA_ER_IR, IMPERFECT_SUBJUNCTIVE_SE_ER_IR, FUTURE_SUBJUNCTIVE_ER_IR,
        new String[] { gerund(VerbClass.ER), participle(VerbClass.ER), "ed" }));
    ALL_ENDINGS.put(VerbClass.IR, build(PRESENT_IR, PRETERITE_ER_IR, IMPERFECT_ER_IR, PRESENT_SUBJUNCTIVE_ER_IR,
        IMPERFECT_SUBJUNCTIVE_RA_ER_IR, IMPERFECT_SUBJUNCTIVE_SE_ER_IR, FUTURE_SUBJUNCTIVE_ER_IR,
        new String[] { gerund(VerbClass.IR), participle(VerbClass.IR), "id" }));
  }

  /** no instance */
  private VerbEndings() {}

  private static List<String> build(String[]... tables) {
    final List<String> endings = new ArrayList<String>();
    for (String[] table : tables) {
      endings.addAll(Arrays.asList(table));
    }
    return Collections.unmodifiableList(endings);
  }

  /**
   * Returns every stem ending of a conjugation: present, preterite,
   * imperfect, the subjunctives, gerund, participle and the vosotros
   * imperative. Persons sharing an ending appear more than once.
   */
  public static List<String> allEndings(VerbClass verbClass) {
    return ALL_ENDINGS.get(verbClass);
  }

  public static String gerund(VerbClass verbClass) {
    return verbClass == VerbClass.AR ? "ando" : "iendo";
  }

  public static String participle(VerbClass verbClass) {
    return verbClass == VerbClass.AR ? "ado" : "ido";
  }
}
