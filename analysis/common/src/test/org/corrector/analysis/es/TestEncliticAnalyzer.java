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

import java.util.Arrays;

import org.corrector.util.CorrectorTestCase;

public class TestEncliticAnalyzer extends CorrectorTestCase {

  private final EncliticAnalyzer analyzer = new EncliticAnalyzer();

  private void assertStrip(String word, String base, String... pronouns) {
    EncliticAnalyzer.Result result = analyzer.strip(word);
    assertNotNull(word, result);
    assertEquals(word, base, result.getBase());
    assertEquals(word, Arrays.asList(pronouns), result.getPronouns());
  }

  public void testInfinitive() {
    assertStrip("decirle", "decir", "le");
    assertStrip("comerlos", "comer", "los");
    // the accent added by the clitics is removed
    assertStrip("dármelo", "dar", "me", "lo");
  }

  public void testGerund() {
    assertStrip("diciéndote", "diciendo", "te");
    assertStrip("dándoselo", "dando", "se", "lo");
  }

  public void testImperative() {
    assertStrip("dámelo", "da", "me", "lo");
    assertStrip("díselo", "di", "se", "lo");
    assertStrip("hazlo", "haz", "lo");
    assertStrip("cantadlo", "cantad", "lo");
    assertStrip("analicémoslo", "analicemos", "lo");
  }

  public void testNoAnalysis() {
    assertNull(analyzer.strip("casa"));
    // "ho" is no verb base
    assertNull(analyzer.strip("hola"));
    assertNull(analyzer.strip("lo"));
  }

  public void testCustomPronouns() {
    EncliticAnalyzer onlyLo = new EncliticAnalyzer(Arrays.asList("lo"));
    assertNull(onlyLo.strip("decirle"));
    assertEquals("decir", onlyLo.strip("decirlo").getBase());
  }

  public void testShapes() {
    assertTrue(EncliticAnalyzer.isInfinitiveShape("cantar"));
    assertFalse(EncliticAnalyzer.isInfinitiveShape("canta"));
    assertTrue(EncliticAnalyzer.isGerundShape("cantando"));
    assertTrue(EncliticAnalyzer.isGerundShape("cayendo"));
    assertTrue(EncliticAnalyzer.isGerundShape("diciéndo"));
    assertFalse(EncliticAnalyzer.isGerundShape("cantado"));
    assertTrue(EncliticAnalyzer.couldBeImperative("canta"));
    assertTrue(EncliticAnalyzer.couldBeImperative("comed"));
    assertTrue(EncliticAnalyzer.couldBeImperative("sal"));
    assertTrue(EncliticAnalyzer.couldBeImperative("vivamos"));
    assertFalse(EncliticAnalyzer.couldBeImperative("cantó"));
    assertEquals("damelo", EncliticAnalyzer.removeAccents("dámelo"));
  }

  public void testBaseValidation() {
    assertTrue(EncliticAnalyzer.isValidBase("dar"));
    assertTrue(EncliticAnalyzer.isValidBase("dár"));
    assertFalse(EncliticAnalyzer.isValidBase("dor"));
    assertTrue(EncliticAnalyzer.isValidBase("pon"));
    assertFalse(EncliticAnalyzer.isValidBase("son"));
    assertFalse(EncliticAnalyzer.isValidBase("mos"));
    assertEquals("da", EncliticAnalyzer.restoreAccent("dá"));
    assertEquals("cantando", EncliticAnalyzer.restoreAccent("cantándo"));
    assertEquals("hagamos", EncliticAnalyzer.restoreAccent("hagámos"));
  }
}
