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
package opennlp.storygrounder.util;

/**
 * Settings read from the environment.
 */
public class Constants {

  public static final String OPENCAGE_API_KEY_VAR = "OPENCAGE_API_KEY";
  public static final String NOMINATIM_USER_AGENT_VAR = "NOMINATIM_USER_AGENT";
  public static final String DEFAULT_USER_AGENT = "storygrounder";

  public static String getOpenCageApiKey() {
    return System.getenv(OPENCAGE_API_KEY_VAR);
  }

  public static String getNominatimUserAgent() {
    String agent = System.getenv(NOMINATIM_USER_AGENT_VAR);
    return agent == null || agent.length() == 0 ? DEFAULT_USER_AGENT : agent;
  }
}
