/*
 * Copyright (c) 2011, Cloudera, Inc. All Rights Reserved.
 *
 * Cloudera, Inc. licenses this file to you under the Apache License,
 * Version 2.0 (the "License"). You may not use this file except in
 * compliance with the License. You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * This software is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR
 * CONDITIONS OF ANY KIND, either express or implied. See the License for
 * the specific language governing permissions and limitations under the
 * License.
 */
package com.cloudera.xml2code.inference;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/*********************************************************
 * JavaNames turns XML local names into Java identifiers and hands
 * them out without collisions.  One instance is one name space: the
 * nested types of the generated reader share one, the fields of each
 * generated type get their own.
 *********************************************************/
public class JavaNames {
  static final Set<String> KEYWORDS = new HashSet<String>(Arrays.asList(
    "abstract", "assert", "boolean", "break", "byte", "case", "catch", "char", "class", "const",
    "continue", "default", "do", "double", "else", "enum", "extends", "final", "finally", "float",
    "for", "goto", "if", "implements", "import", "instanceof", "int", "interface", "long", "native",
    "new", "package", "private", "protected", "public", "return", "short", "static", "strictfp",
    "super", "switch", "synchronized", "this", "throw", "throws", "transient", "try", "void",
    "volatile", "while", "true", "false", "null", "var", "yield", "record"));

  private final Set<String> used = new HashSet<String>();

  /**
   * Marks a name as taken without allocating it.
   */
  public void reserve(String name) {
    used.add(name);
  }

  /**
   * Returns the base name, or the base name with the smallest numeric
   * suffix that is still free.
   */
  public String allocate(String base) {
    String name = base;
    for (int i = 2; used.contains(name) || KEYWORDS.contains(name); i++) {
      name = base + i;
    }
    used.add(name);
    return name;
  }

  /**
   * Splits a name at non-alphanumerics, lower/upper humps and the end of
   * acronyms.  Only ASCII letters and digits survive.
   */
  public static List<String> words(String name) {
    List<String> words = new ArrayList<String>();
    StringBuilder cur = new StringBuilder();
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      if (! EnumVariants.isAsciiLetterOrDigit(c)) {
        flush(cur, words);
        continue;
      }
      if (cur.length() > 0 && Character.isUpperCase(c)) {
        char prev = cur.charAt(cur.length() - 1);
        boolean nextIsLower = i + 1 < name.length() && name.charAt(i + 1) >= 'a' && name.charAt(i + 1) <= 'z';
        if (Character.isLowerCase(prev) || Character.isDigit(prev) || (Character.isUpperCase(prev) && nextIsLower)) {
          flush(cur, words);
        }
      }
      cur.append(c);
    }
    flush(cur, words);
    return words;
  }

  static void flush(StringBuilder cur, List<String> words) {
    if (cur.length() > 0) {
      words.add(cur.toString());
      cur.setLength(0);
    }
  }

  /**
   * "entryFree" becomes "EntryFree", "TEI" becomes "Tei".
   */
  public static String pascalCase(String name) {
    StringBuilder buf = new StringBuilder();
    for (String word: words(name)) {
      buf.append(Character.toUpperCase(word.charAt(0)));
      buf.append(word.substring(1).toLowerCase());
    }
    if (buf.length() == 0) {
      return "Unnamed";
    }
    if (! Character.isLetter(buf.charAt(0))) {
      buf.insert(0, 'X');
    }
    return buf.toString();
  }

  /**
   * "entry-free" becomes "entryFree".
   */
  public static String camelCase(String name) {
    String pascal = pascalCase(name);
    return Character.toLowerCase(pascal.charAt(0)) + pascal.substring(1);
  }
}
