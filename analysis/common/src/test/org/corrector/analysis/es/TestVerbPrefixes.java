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
import java.util.List;

import org.corrector.util.CorrectorTestCase;

public class TestVerbPrefixes extends CorrectorTestCase {

  private static List<String> splits(VerbPrefixes prefixes, String word) {
    List<String> result = new ArrayList<String>();
    for (VerbPrefixes.Split split : prefixes.split(word)) {
      result.add(split.toString());
    }
    return result;
  }

  public void testDefaultsLongestFirst() {
    VerbPrefixes prefixes = new VerbPrefixes();
    assertEquals(VerbPrefixes.DEFAULT_PREFIXES, prefixes.getPrefixes());
    int last = Integer.MAX_VALUE;
    for (String prefix : prefixes.getPrefixes()) {
      assertTrue(prefix.length() <= last);
      last = prefix.length();
    }
  }

  public void testSplit() {
    VerbPrefixes prefixes = new VerbPrefixes();
    assertEquals(Arrays.asList("des+hago"), splits(prefixes, "deshago"));
    assertEquals(Arrays.asList("contra+digo", "con+tradigo", "co+ntradigo"), splits(prefixes, "contradigo"));
    VerbPrefixes.Split split = prefixes.split("rehacer").get(0);
    assertEquals("re", split.getPrefix());
    assertEquals("hacer", split.getBase());
  }

  public void testRemainderTooShort() {
    VerbPrefixes prefixes = new VerbPrefixes();
    assertTrue(prefixes.split("exa").isEmpty());
    assertTrue(prefixes.split("pre").isEmpty());
    assertTrue(prefixes.split("cantar").isEmpty());
  }

  public void testCustomOrder() {
    VerbPrefixes prefixes = new VerbPrefixes(Arrays.asList("re", "contra", "des", "in"));
    assertEquals(Arrays.asList("contra", "des", "re", "in"), prefixes.getPrefixes());
  }

  public void testReconstruct() {
    assertEquals("deshacer", VerbPrefixes.reconstruct("des", "hacer"));
  }
}
