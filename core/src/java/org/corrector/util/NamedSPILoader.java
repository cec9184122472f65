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
package org.corrector.util;

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.Set;

/**
 * Helper class for loading named SPIs from classpath (e.g. languages).
 * <p>
 * Every service registers under one or more case-insensitive names; the first
 * name is the canonical one reported by {@link #availableServices()}. When two
 * services claim the same name the first one found on the classpath wins.
 */
public final class NamedSPILoader<S extends NamedSPILoader.NamedSPI> implements Iterable<S> {

  private final Map<String,S> services;
  private final Set<String> canonicalNames;
  private final Class<S> clazz;

  public NamedSPILoader(Class<S> clazz) {
    this(clazz, Thread.currentThread().getContextClassLoader());
  }

  public NamedSPILoader(Class<S> clazz, ClassLoader classloader) {
    this.clazz = clazz;
    final Map<String,S> services = new LinkedHashMap<String,S>();
    final Set<String> canonicalNames = new LinkedHashSet<String>();
    try {
      for (S service : ServiceLoader.load(clazz, classloader)) {
        boolean first = true;
        for (String name : service.getLookupNames()) {
          final String key = name.toLowerCase(Locale.ROOT);
          if (!services.containsKey(key)) {
            services.put(key, service);
            if (first) {
              canonicalNames.add(key);
            }
          }
          first = false;
        }
      }
    } catch (ServiceConfigurationError sce) {
      throw new IllegalStateException("Cannot load SPI services of type " + clazz.getName(), sce);
    }
    this.services = Collections.unmodifiableMap(services);
    this.canonicalNames = Collections.unmodifiableSet(canonicalNames);
  }

  /**
   * Returns the service registered under <code>name</code>.
   *
   * @throws IllegalArgumentException if no service has that name
   */
  public S lookup(String name) {
    final S service = name == null ? null : services.get(name.trim().toLowerCase(Locale.ROOT));
    if (service != null) return service;
    throw new IllegalArgumentException("A SPI class of type " + clazz.getName() + " with name '" + name + "' does not exist. "
        + "You need to add the corresponding JAR file supporting this SPI to your classpath. "
        + "The current classpath supports the following names: " + availableServices());
  }

  public Set<String> availableServices() {
    return canonicalNames;
  }

  @Override
  public Iterator<S> iterator() {
    return new LinkedHashSet<S>(services.values()).iterator();
  }

  /**
   * Interface to support {@link NamedSPILoader#lookup(String)} by name.
   */
  public static interface NamedSPI {
    /** Names this service answers to, canonical name first. */
    Collection<String> getLookupNames();
  }
}
