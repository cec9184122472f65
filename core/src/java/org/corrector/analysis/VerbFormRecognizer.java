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

/**
 * Decides whether a surface string is a conjugated form of a known verb.
 * <p>
 * Implementations are built once from a dictionary and are read-only
 * afterwards, so a single instance may serve concurrent callers. Input is
 * case-folded by the implementation.
 */
public interface VerbFormRecognizer {

  /** Returns true if <code>word</code> is a recognized form of a known verb. */
  boolean isValidVerbForm(String word);

  /**
   * Returns the infinitive <code>word</code> is a form of, preferring the
   * pronominal infinitive when the dictionary has one, or <code>null</code>
   * if the word is not recognized.
   */
  String getInfinitive(String word);

  /** Returns true if <code>word</code> is the gerund of a known verb. */
  boolean isGerund(String word);
}
