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

/**
 * Metadata stored for a word of the dictionary: category, gender, number,
 * a free-form tag and a frequency counter.
 * <p>
 * Instances are immutable. The frequency is never below 1.
 */
public final class WordEntry {

  /** Entry used for words inserted without metadata. */
  public static final WordEntry DEFAULT =
      new WordEntry(WordCategory.OTHER, Gender.NONE, GrammaticalNumber.NONE, "", 1);

  private final WordCategory category;
  private final Gender gender;
  private final GrammaticalNumber number;
  private final String extra;
  private final long frequency;

  public WordEntry(WordCategory category, Gender gender, GrammaticalNumber number, String extra, long frequency) {
    if (category == null || gender == null || number == null) {
      throw new IllegalArgumentException("category, gender and number must not be null");
    }
    if (frequency < 0) {
      throw new IllegalArgumentException("frequency must be >= 0, got " + frequency);
    }
    this.category = category;
    this.gender = gender;
    this.number = number;
    this.extra = extra == null ? "" : extra;
    this.frequency = frequency;
  }

  public WordEntry(WordCategory category, Gender gender, GrammaticalNumber number) {
    this(category, gender, number, "", 1);
  }

  public WordCategory getCategory() {
    return category;
  }

  public Gender getGender() {
    return gender;
  }

  public GrammaticalNumber getNumber() {
    return number;
  }

  /** Opaque tag carried over from the dictionary source. Never null. */
  public String getExtra() {
    return extra;
  }

  public long getFrequency() {
    return frequency;
  }

  /**
   * Returns the entry synthesized for the plural of this (singular) entry:
   * category and gender are kept, the number becomes plural and the
   * frequency is halved, with a floor of 1.
   */
  public WordEntry asDerivedPlural() {
    return new WordEntry(category, gender, GrammaticalNumber.PLURAL, extra, Math.max(1, frequency / 2));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof WordEntry)) return false;
    WordEntry other = (WordEntry) o;
    return category == other.category && gender == other.gender && number == other.number
        && frequency == other.frequency && extra.equals(other.extra);
  }

  @Override
  public int hashCode() {
    int h = category.hashCode();
    h = 31 * h + gender.hashCode();
    h = 31 * h + number.hashCode();
    h = 31 * h + extra.hashCode();
    h = 31 * h + Long.hashCode(frequency);
    return h;
  }

  @Override
  public String toString() {
    return category + "/" + gender + "/" + number + (extra.isEmpty() ? "" : "/" + extra) + " freq=" + frequency;
  }
}
