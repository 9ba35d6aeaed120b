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
package opennlp.storygrounder.topo.gaz;

import java.util.List;

import opennlp.storygrounder.topo.Location;

/**
 * Represents a mapping from place name strings to lists of location
 * candidates, typically backed by a remote geocoding service.
 */
public interface Gazetteer {
  /**
   * Short name identifying this source in logs and in the produced records.
   */
  public String getName();

  /**
   * Lookup a place name, returning an empty list if the source knows no
   * candidates for it. The order of the returned candidates is the source's
   * own ranking.
   */
  public List<Location> lookup(String query) throws GeocodingException;
}
