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

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

import org.corrector.util.CorrectorTestCase;

public class TestStemChange extends CorrectorTestCase {

  public void testReverse() {
    assertEquals("pens", StemChange.E_TO_IE.reverse("piens"));
    assertEquals("cont", StemChange.O_TO_UE.reverse("cuent"));
    assertEquals("ped", StemChange.E_TO_I.reverse("pid"));
    assertEquals("jug", StemChange.U_TO_UE.reverse("jueg"));
    assertEquals("conoc", StemChange.C_TO_ZC.reverse("conozc"));
    // last occurrence only
    assertEquals("entend", StemChange.E_TO_IE.reverse("entiend"));
  }

  public void testNotApplicable() {
    assertNull(StemChange.E_TO_IE.reverse("cant"));
    assertNull(StemChange.O_TO_UE.reverse("pens"));
    // zc only at the end of the stem
    assertNull(StemChange.C_TO_ZC.reverse("zcab"));
  }

  public void testTriggeringEndings() {
    assertTrue(StemChange.E_TO_IE.triggeringEndings(VerbClass.IR).contains("ió"));
    assertFalse(StemChange.E_TO_IE.triggeringEndings(VerbClass.AR).contains("ió"));
    assertTrue(StemChange.O_TO_UE.triggeringEndings(VerbClass.AR).contains("uen"));
    assertEquals(StemChange.C_TO_ZC.triggeringEndings(VerbClass.ER),
        StemChange.C_TO_ZC.triggeringEndings(VerbClass.IR));
    assertTrue(StemChange.C_TO_ZC.triggeringEndings(VerbClass.ER).contains("amos"));
    assertFalse(StemChange.VOWEL_CHANGES.contains(StemChange.C_TO_ZC));
  }

  public void testVerbClass() {
    assertEquals(VerbClass.AR, VerbClass.fromInfinitive("cantar"));
    assertEquals(VerbClass.ER, VerbClass.fromInfinitive("comer"));
    assertEquals(VerbClass.IR, VerbClass.fromInfinitive("vivir"));
    assertEquals("ir", VerbClass.IR.getInfinitiveEnding());
  }

  public void testDefaultTable() {
    StemChangingVerbs verbs = StemChangingVerbs.getDefault();
    assertSame(verbs, StemChangingVerbs.getDefault());
    assertEquals(StemChange.E_TO_IE, verbs.get("pensar"));
    assertEquals(StemChange.O_TO_UE, verbs.get("contar"));
    assertEquals(StemChange.E_TO_I, verbs.get("pedir"));
    assertEquals(StemChange.U_TO_UE, verbs.get("jugar"));
    assertEquals(StemChange.C_TO_ZC, verbs.get("conocer"));
    // registered through arrepentirse
    assertEquals(StemChange.E_TO_IE, verbs.get("arrepentir"));
    assertNull(verbs.get("cantar"));
  }

  public void testLoad() throws IOException {
    StemChangingVerbs verbs = StemChangingVerbs.load(new ByteArrayInputStream(
        "# test\nPensar\te_to_ie\nvolver\tO_TO_UE\n".getBytes(StandardCharsets.UTF_8)));
    assertEquals(2, verbs.size());
    assertEquals(StemChange.E_TO_IE, verbs.get("pensar"));

    try {
      StemChangingVerbs.load(new ByteArrayInputStream("pensar\tE_TO_UE\n".getBytes(StandardCharsets.UTF_8)));
      fail("unknown alternation must be rejected");
    } catch (IOException expected) {
      assertTrue(expected.getMessage().contains("E_TO_UE"));
    }
    try {
      StemChangingVerbs.load(null);
      fail("missing resource must be reported");
    } catch (IOException expected) {
      // expected
    }
  }

  public void testPronominalBaseDoesNotOverride() {
    Map<String,StemChange> map = new HashMap<String,StemChange>();
    map.put("sentir", StemChange.E_TO_IE);
    map.put("sentirse", StemChange.E_TO_I);
    StemChangingVerbs verbs = new StemChangingVerbs(map);
    assertEquals(StemChange.E_TO_IE, verbs.get("sentir"));
    assertEquals(StemChange.E_TO_I, verbs.get("sentirse"));
  }

  public void testIrregularTable() {
    IrregularVerbs irregulars = IrregularVerbs.getDefault();
    assertTrue(irregulars.size() > 900);
    assertEquals("ser", irregulars.getInfinitive("fui"));
    assertEquals("ir", irregulars.getInfinitive("yendo"));
    assertEquals("decir", irregulars.getInfinitive("diciendo"));
    assertTrue(irregulars.contains("hago"));
    assertFalse(irregulars.contains("cantamos"));
  }
}
