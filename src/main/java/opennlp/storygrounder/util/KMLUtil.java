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

import java.util.List;

import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;

import opennlp.storygrounder.topo.Coordinate;
import opennlp.storygrounder.topo.RectRegion;

/**
 * Class of static methods for generating KML headers, footers and other stuff.
 */
public class KMLUtil {

  public static final String LOCATION_STYLE = "#location";
  public static final String CORE_STYLE = "#coreLocation";
  public static final String BOX_STYLE = "#box";

  protected static void writeWithCharacters(XMLStreamWriter w, String localName, String text)
    throws XMLStreamException {
    w.writeStartElement(localName);
    w.writeCharacters(text);
    w.writeEndElement();
  }

  public static void writeHeader(XMLStreamWriter w, String name, Coordinate center)
    throws XMLStreamException {
    w.writeStartDocument("UTF-8", "1.0");
    w.writeStartElement("kml");
    w.writeDefaultNamespace("http://www.opengis.net/kml/2.2");
    w.writeNamespace("gx", "http://www.google.com/kml/ext/2.2");
    w.writeNamespace("kml", "http://www.opengis.net/kml/2.2");
    w.writeNamespace("atom", "http://www.w3.org/2005/Atom");
    w.writeStartElement("Document");

    writeIconStyle(w, "location", "http://maps.google.com/mapfiles/kml/pushpin/ylw-pushpin.png", 1.0);
    writeIconStyle(w, "coreLocation", "http://maps.google.com/mapfiles/kml/pushpin/red-pushpin.png", 1.4);

    w.writeStartElement("Style");
    w.writeAttribute("id", "box");
    w.writeStartElement("LineStyle");
    KMLUtil.writeWithCharacters(w, "color", "ff0155ff");
    KMLUtil.writeWithCharacters(w, "width", "2");
    w.writeEndElement(); // LineStyle
    w.writeStartElement("PolyStyle");
    KMLUtil.writeWithCharacters(w, "fill", "0");
    w.writeEndElement(); // PolyStyle
    w.writeEndElement(); // Style

    w.writeStartElement("Folder");
    KMLUtil.writeWithCharacters(w, "name", name);
    KMLUtil.writeWithCharacters(w, "open", "1");
    KMLUtil.writeWithCharacters(w, "description", "Resolved locations of " + name);
    KMLUtil.writeLookAt(w, center.getLatDegrees(), center.getLngDegrees(), 0, 2000000, 0, 0);
  }

  private static void writeIconStyle(XMLStreamWriter w, String id, String href, double scale)
    throws XMLStreamException {
    w.writeStartElement("Style");
    w.writeAttribute("id", id);
    w.writeStartElement("IconStyle");
    KMLUtil.writeWithCharacters(w, "scale", String.format("%.1f", scale));
    w.writeStartElement("Icon");
    KMLUtil.writeWithCharacters(w, "href", href);
    w.writeEndElement(); // Icon
    w.writeEndElement(); // IconStyle
    w.writeEndElement(); // Style
  }

  public static void writeFooter(XMLStreamWriter w)
    throws XMLStreamException {
    w.writeEndElement(); // Folder
    w.writeEndElement(); // Document
    w.writeEndElement(); // kml
    w.writeEndDocument();
  }

  public static void writeFolderStart(XMLStreamWriter w, String name, String description)
    throws XMLStreamException {
    w.writeStartElement("Folder");
    KMLUtil.writeWithCharacters(w, "name", name);
    if (description != null)
      KMLUtil.writeWithCharacters(w, "description", description);
  }

  public static void writeFolderEnd(XMLStreamWriter w)
    throws XMLStreamException {
    w.writeEndElement(); // Folder
  }

  public static void writeLookAt(XMLStreamWriter w, double lat, double lon,
                                 double alt, double range, double tilt, double heading)
    throws XMLStreamException {
    w.writeStartElement("LookAt");
    KMLUtil.writeWithCharacters(w, "latitude", String.format("%f", lat));
    KMLUtil.writeWithCharacters(w, "longitude", String.format("%f", lon));
    KMLUtil.writeWithCharacters(w, "altitude", String.format("%f", alt));
    KMLUtil.writeWithCharacters(w, "range", String.format("%f", range));
    KMLUtil.writeWithCharacters(w, "tilt", String.format("%f", tilt));
    KMLUtil.writeWithCharacters(w, "heading", String.format("%f", heading));
    w.writeEndElement(); // LookAt
  }

  public static void writePlacemark(XMLStreamWriter w, String name, String description,
                                    Coordinate coord, String styleUrl)
    throws XMLStreamException {
    w.writeStartElement("Placemark");
    KMLUtil.writeWithCharacters(w, "name", name);
    if (description != null)
      KMLUtil.writeWithCharacters(w, "description", description);
    KMLUtil.writeWithCharacters(w, "styleUrl", styleUrl);
    w.writeStartElement("Point");
    KMLUtil.writeWithCharacters(w, "coordinates",
        String.format("%f,%f", coord.getLngDegrees(), coord.getLatDegrees()));
    w.writeEndElement(); // Point
    w.writeEndElement(); // Placemark
  }

  /**
   * Outline of a bounding box as a closed ring through its corners.
   */
  public static void writeBox(XMLStreamWriter w, String name, RectRegion box)
    throws XMLStreamException {
    w.writeStartElement("Placemark");
    KMLUtil.writeWithCharacters(w, "name", name + " BOX");
    KMLUtil.writeWithCharacters(w, "styleUrl", BOX_STYLE);
    w.writeStartElement("Polygon");
    KMLUtil.writeWithCharacters(w, "tessellate", "1");
    w.writeStartElement("outerBoundaryIs");
    w.writeStartElement("LinearRing");
    w.writeStartElement("coordinates");
    w.writeCharacters("\n");
    List<Coordinate> corners = box.getRepresentatives();
    for (int i = 0; i <= corners.size(); i++) {
      Coordinate corner = corners.get(i % corners.size());
      w.writeCharacters(String.format("%f,%f\n", corner.getLngDegrees(), corner.getLatDegrees()));
    }
    w.writeEndElement(); // coordinates
    w.writeEndElement(); // LinearRing
    w.writeEndElement(); // outerBoundaryIs
    w.writeEndElement(); // Polygon
    w.writeEndElement(); // Placemark
  }
}
