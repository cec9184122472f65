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

import java.util.List;

/**
 * Language policy used by {@link PrefixTree#derivePluralInfo(String)}: tells
 * whether a word carries the plural marker and proposes the singular forms
 * it may come from. Implementations do not consult any dictionary.
 */
public interface Depluralizer {

  /** Returns true if {@code word} (lowercased) ends with the language's plural marker. */
  boolean hasPluralMarker(String word);

  /**
   * Returns the singular candidates for a lowercased plural, most specific
   * rule first, without duplicates. Returns an empty list when no rule applies.
   */
  List<String> singularCandidates(String word);
}
