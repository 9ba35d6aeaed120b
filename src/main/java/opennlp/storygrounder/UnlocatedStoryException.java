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
package opennlp.storygrounder;

/**
 * Thrown when none of a story's places has any usable coordinate, so there is
 * nothing to cluster. Callers should store the story without locations.
 */
public class UnlocatedStoryException extends Exception {

  private static final long serialVersionUID = 42L;

  public UnlocatedStoryException(String message) {
    super(message);
  }
}
