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
package opennlp.storygrounder.text.io;

import java.io.BufferedOutputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.Writer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;

import opennlp.storygrounder.resolver.ResolvedLocation;
import opennlp.storygrounder.topo.Coordinate;
import opennlp.storygrounder.util.KMLUtil;

/**
 * Writes resolved stories as KML: a folder per story, inside it a folder per
 * cluster with a placemark (and bounding box outline, if known) per location.
 * The core location of a story gets its own style.
 */
public class ClusterKMLWriter {

  private final XMLOutputFactory factory;
  private final List<StoryEntry> stories;

  public ClusterKMLWriter() {
    this.factory = XMLOutputFactory.newInstance();
    this.stories = new ArrayList<StoryEntry>();
  }

  public synchronized void add(String storyId, Map<String, ResolvedLocation> locations,
                               ResolvedLocation core) {
    this.stories.add(new StoryEntry(storyId, locations, core));
  }

  public synchronized int size() {
    return this.stories.size();
  }

  protected XMLStreamWriter createXMLStreamWriter(Writer writer) throws XMLStreamException {
    return this.factory.createXMLStreamWriter(writer);
  }

  protected XMLStreamWriter createXMLStreamWriter(OutputStream stream) throws XMLStreamException {
    return this.factory.createXMLStreamWriter(stream, "UTF-8");
  }

  public void write(File file) throws IOException, XMLStreamException {
    OutputStream stream = new BufferedOutputStream(new FileOutputStream(file));
    try {
      this.write(this.createXMLStreamWriter(stream));
    } finally {
      stream.close();
    }
  }

  public void write(Writer writer) throws XMLStreamException {
    this.write(this.createXMLStreamWriter(writer));
  }

  protected synchronized void write(XMLStreamWriter out) throws XMLStreamException {
    KMLUtil.writeHeader(out, "stories", this.center());

    for (StoryEntry story : this.stories) {
      KMLUtil.writeFolderStart(out, story.id,
          story.core == null ? null : "Core location: " + story.core.getName());
      int n = 0;
      for (List<ResolvedLocation> cluster : groupByCluster(story.locations).values()) {
        KMLUtil.writeFolderStart(out, "Cluster " + (++n), null);
        for (ResolvedLocation location : cluster)
          this.writeLocation(out, location, location == story.core);
        KMLUtil.writeFolderEnd(out);
      }
      KMLUtil.writeFolderEnd(out);
    }

    KMLUtil.writeFooter(out);
    out.flush();
    out.close();
  }

  protected void writeLocation(XMLStreamWriter out, ResolvedLocation location, boolean core)
    throws XMLStreamException {
    Coordinate coord = location.getCoordinate();
    if (coord == null)
      return;
    KMLUtil.writePlacemark(out, location.getName(), location.getAddress(), coord,
                           core ? KMLUtil.CORE_STYLE : KMLUtil.LOCATION_STYLE);
    if (location.getBoundingBox() != null)
      KMLUtil.writeBox(out, location.getName(), location.getBoundingBox());
  }

  /**
   * Locations grouped by cluster, in order of first appearance.
   */
  protected static Map<List<String>, List<ResolvedLocation>> groupByCluster(
      Map<String, ResolvedLocation> locations) {
    Map<List<String>, List<ResolvedLocation>> clusters =
        new LinkedHashMap<List<String>, List<ResolvedLocation>>();
    for (ResolvedLocation location : locations.values()) {
      List<ResolvedLocation> members = clusters.get(location.getCluster());
      if (members == null) {
        members = new ArrayList<ResolvedLocation>();
        clusters.put(location.getCluster(), members);
      }
      members.add(location);
    }
    return clusters;
  }

  private Coordinate center() {
    List<Coordinate> coordinates = new ArrayList<Coordinate>();
    for (StoryEntry story : this.stories) {
      for (ResolvedLocation location : story.locations.values()) {
        if (location.getCoordinate() != null)
          coordinates.add(location.getCoordinate());
      }
    }
    return coordinates.isEmpty() ? Coordinate.fromDegrees(0, 0) : Coordinate.centroid(coordinates);
  }

  private static class StoryEntry {
    final String id;
    final Map<String, ResolvedLocation> locations;
    final ResolvedLocation core;

    StoryEntry(String id, Map<String, ResolvedLocation> locations, ResolvedLocation core) {
      this.id = id;
      this.locations = locations;
      this.core = core;
    }
  }
}
