///////////////////////////////////////////////////////////////////////////////
//  Copyright (C) 2010 Travis Brown, The University of Texas at Austin
//
//  Licensed under the Apache License, Version 2.0 (the "License");
//  you may not use this file except in compliance with the License.
//  You may obtain a copy of the License at
//
//      http://www.apache.org/licenses/LICENSE-2.0
//
//  Unless required by applicable law or agreed to in writing, software
//  distributed under the License is distributed on an "AS IS" BASIS,
//  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
//  See the License for the specific language governing permissions and
//  limitations under the License.
///////////////////////////////////////////////////////////////////////////////
package opennlp.storygrounder.resolver;

import java.io.IOException;

/**
 * The relevance scorer failed or answered with something unusable. Carries
 * the HTTP status and response body when the scorer gave one.
 */
public class ScoringException extends IOException {

  private static final long serialVersionUID = 42L;

  private final int status;
  private final String body;

  public ScoringException(String message) {
    this(message, -1, null);
  }

  public ScoringException(String message, Throwable cause) {
    super(message, cause);
    this.status = -1;
    this.body = null;
  }

  public ScoringException(String message, int status, String body) {
    super(body == null ? message : message + ": " + body);
    this.status = status;
    this.body = body;
  }

  /** HTTP status, or -1 if there was no response. */
  public int getStatus() {
    return this.status;
  }

  public String getBody() {
    return this.body;
  }
}
