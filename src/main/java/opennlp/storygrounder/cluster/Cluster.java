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
package opennlp.storygrounder.cluster;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import opennlp.storygrounder.topo.Location;

/**
 * A group of places judged to be geographically coincident, each with the
 * candidate location currently chosen for it. Membership only changes
 * through {@link ClusterSet#apply(Move)}.
 */
public class Cluster {

  private final int id;
  private final Map<String, Location> members;

  Cluster(int id) {
    this.id = id;
    this.members = new LinkedHashMap<String, Location>();
  }

  public int getId() {
    return this.id;
  }

  public int size() {
    return this.members.size();
  }

  public boolean isEmpty() {
    return this.members.isEmpty();
  }

  public boolean contains(String placeName) {
    return this.members.containsKey(placeName);
  }

  public Location getLocation(String placeName) {
    return this.members.get(placeName);
  }

  public Map<String, Location> getMembers() {
    return Collections.unmodifiableMap(this.members);
  }

  public List<String> getPlaceNames() {
    return new ArrayList<String>(this.members.keySet());
  }

  void put(String placeName, Location location) {
    this.members.put(placeName, location);
  }

  Location remove(String placeName) {
    return this.members.remove(placeName);
  }

  @Override
  public String toString() {
    return "cluster " + this.id + " " + this.members.keySet();
  }
}
