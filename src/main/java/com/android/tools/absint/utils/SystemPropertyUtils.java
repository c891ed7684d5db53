// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.utils;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

public class SystemPropertyUtils {

  public static <T> T applySystemProperty(
      String propertyName, Function<String, T> function, Supplier<T> defaultValue) {
    String propertyValue = System.getProperty(propertyName);
    return propertyValue == null ? defaultValue.get() : function.apply(propertyValue);
  }

  public static String getSystemPropertyOrDefault(String propertyName, String defaultValue) {
    String propertyValue = System.getProperty(propertyName);
    return propertyValue == null ? defaultValue : propertyValue;
  }

  public static boolean parseSystemPropertyOrDefault(String propertyName, boolean defaultValue) {
    String propertyValue = System.getProperty(propertyName);
    if (propertyValue == null) {
      return defaultValue;
    }
    // -Dproperty with no value means enabled.
    return propertyValue.isEmpty() || Boolean.parseBoolean(propertyValue);
  }

  /** Parses a comma separated list, e.g., -Dproperty=malloc,calloc. */
  public static Set<String> parseSystemPropertyOrDefault(
      String propertyName, Set<String> defaultValue) {
    return applySystemProperty(
        propertyName,
        value ->
            ImmutableSet.copyOf(
                Splitter.on(',').trimResults().omitEmptyStrings().split(value)),
        () -> defaultValue);
  }
}
