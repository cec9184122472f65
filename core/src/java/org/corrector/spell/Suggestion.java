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
package org.corrector.spell;

import java.util.Comparator;

/**
 * A correction proposed for a misspelled word: the replacement, its edit
 * distance to the original and the frequency of the replacement.
 */
public final class Suggestion {

  /**
   * Ranking order: closest first, then most frequent, then alphabetical so
   * that the order is deterministic.
   */
  public static final Comparator<Suggestion> RANKING = new Comparator<Suggestion>() {
    @Override
    public int compare(Suggestion a, Suggestion b) {
      if (a.distance != b.distance) {
        return a.distance < b.distance ? -1 : 1;
      }
      if (a.frequency != b.frequency) {
        return a.frequency > b.frequency ? -1 : 1;
      }
      return a.word.compareTo(b.word);
    }
  };

  private final String word;
  private final int distance;
  private final long frequency;

  public Suggestion(String word, int distance, long frequency) {
    this.word = word;
    this.distance = distance;
    this.frequency = frequency;
  }

  public String getWord() {
    return word;
  }

  public int getDistance() {
    return distance;
  }

  public long getFrequency() {
    return frequency;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Suggestion)) return false;
    Suggestion other = (Suggestion) o;
    return distance == other.distance && frequency == other.frequency && word.equals(other.word);
  }

  @Override
  public int hashCode() {
    return (word.hashCode() * 31 + distance) * 31 + Long.hashCode(frequency);
  }

  @Override
  public String toString() {
    return word + " (distance=" + distance + ", freq=" + frequency + ")";
  }
}
