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
 * Thrown when a document's top-level element differs from the root
 * that earlier documents of the same session established.
 *********************************************************/
public class MultipleRootsException extends AnalysisException {
  private final String expectedRoot;
  private final String foundRoot;

  public MultipleRootsException(String expectedRoot, String foundRoot) {
    super("Multiple roots are not supported: expected <" + expectedRoot + "> but found <" + foundRoot + ">");
    this.expectedRoot = expectedRoot;
    this.foundRoot = foundRoot;
  }

  public String getExpectedRoot() {
    return expectedRoot;
  }

  public String getFoundRoot() {
    return foundRoot;
  }
}
