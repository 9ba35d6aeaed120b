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
package opennlp.storygrounder.topo;

import java.util.Arrays;

import org.junit.Test;

import static org.junit.Assert.*;

public class CoordinateTest {

  private static final Coordinate GENEVA = Coordinate.fromDegrees(46.20, 6.14);
  private static final Coordinate LAUSANNE = Coordinate.fromDegrees(46.52, 6.63);

  @Test
  public void distanceToSelfIsZero() {
    assertEquals(0.0, GENEVA.distance(GENEVA), 0.0);
    assertEquals(0.0, GENEVA.distanceInKm(Coordinate.fromDegrees(46.20, 6.14)), 0.0);
  }

  @Test
  public void distanceIsSymmetricGreatCircle() {
    double km = GENEVA.distanceInKm(LAUSANNE);
    assertTrue("got " + km, km > 45 && km < 60);
    assertEquals(km, LAUSANNE.distanceInKm(GENEVA), 1e-9);
  }

  @Test
  public void quarterOfEquatorIsQuarterOfCircumference() {
    double km = Coordinate.fromDegrees(0, 0).distanceInKm(Coordinate.fromDegrees(0, 90));
    assertEquals(Math.PI / 2 * Coordinate.EARTH_RADIUS_KM, km, 1e-6);
  }

  @Test
  public void radiansRoundTrip() {
    Coordinate c = Coordinate.fromRadians(LAUSANNE.getLatRadians(), LAUSANNE.getLngRadians());
    assertEquals(46.52, c.getLatDegrees(), 1e-9);
    assertEquals(6.63, c.getLngDegrees(), 1e-9);
  }

  @Test
  public void validity() {
    assertTrue(GENEVA.isValid());
    assertTrue(Coordinate.fromDegrees(-90, 180).isValid());
    assertFalse(Coordinate.fromDegrees(91, 0).isValid());
    assertFalse(Coordinate.fromDegrees(0, -180.5).isValid());
    assertFalse(Coordinate.fromDegrees(Double.NaN, 0).isValid());
  }

  @Test
  public void centroidOfTwoPointsIsBetweenThem() {
    Coordinate c = Coordinate.centroid(Arrays.asList(Coordinate.fromDegrees(10, 10),
                                                     Coordinate.fromDegrees(20, 10)));
    assertEquals(15.0, c.getLatDegrees(), 1e-6);
    assertEquals(10.0, c.getLngDegrees(), 1e-6);
  }

  @Test
  public void kmToRadians() {
    assertEquals(150 / 6371.009, Coordinate.kmToRadians(150), 1e-12);
  }
}
