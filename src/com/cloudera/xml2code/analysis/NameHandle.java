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
package com.cloudera.xml2code.analysis;

/*********************************************************
 * NameHandle is the interned form of an element or attribute local name.
 * Two handles are equal iff their names are equal, so a handle can be
 * used as a map key everywhere the registry needs "the same name".
 *
 * Handles are only created by a NameRegistry.
 *********************************************************/
public final class NameHandle implements Comparable<NameHandle> {
  private final String name;

  NameHandle(String name) {
    if (name == null) {
      throw new NullPointerException("name");
    }
    this.name = name;
  }

  public String getName() {
    return name;
  }

  public int compareTo(NameHandle other) {
    return name.compareTo(other.name);
  }

  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (! (o instanceof NameHandle)) {
      return false;
    }
    return name.equals(((NameHandle) o).name);
  }

  public int hashCode() {
    return name.hashCode();
  }

  public String toString() {
    return name;
  }
}
