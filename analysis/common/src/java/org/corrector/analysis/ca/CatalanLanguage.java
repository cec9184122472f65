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
package org.corrector.analysis.ca;

import org.corrector.analysis.Language;

/**
 * Catalan, spelling only. Elided forms such as <i>l'home</i> are accepted
 * when the dictionary knows both the article (<i>l'</i>) and the word, and
 * the middle dot of <i>l·l</i> may appear inside suggestions.
 */
public class CatalanLanguage extends Language {

  public CatalanLanguage() {
    super("ca", "Català", "catalan", "català");
  }

  @Override
  public boolean isWordInternalChar(char ch) {
    return ch == '-' || ch == '·';
  }
}
