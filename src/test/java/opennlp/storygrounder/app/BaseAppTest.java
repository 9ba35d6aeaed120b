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
package opennlp.storygrounder.app;

import java.util.Arrays;

import org.apache.commons.cli.ParseException;
import org.junit.Test;

import static org.junit.Assert.*;

public class BaseAppTest {

  @Test
  public void parsesOptions() throws Exception {
    BaseApp.initializeOptionsFromCommandLine(new String[] {
        "-i", "stories.json", "-o", "out.json", "-ok", "out.kml",
        "-md", "80", "-ms", "2", "-t", "0.2", "-n",
        "-scorer", "http://localhost:8000/locations", "-seed", "17", "-threads", "4",
        "-g", "opencage,nominatim" });

    assertEquals("stories.json", BaseApp.getInputPath());
    assertEquals("out.json", BaseApp.getOutputPath());
    assertEquals("out.kml", BaseApp.getKMLOutputPath());
    assertEquals(80.0, BaseApp.getMaxDistKm(), 1e-9);
    assertEquals(2, BaseApp.getMinClusterSize());
    assertEquals(0.2, BaseApp.getFilterThreshold(), 1e-9);
    assertTrue(BaseApp.isNormedFilter());
    assertEquals("http://localhost:8000/locations", BaseApp.getScorerUrl());
    assertEquals(Long.valueOf(17), BaseApp.getSeed());
    assertEquals(4, BaseApp.getNumThreads());
    assertEquals(Arrays.asList(BaseApp.GEOCODER.OPENCAGE, BaseApp.GEOCODER.NOMINATIM), BaseApp.getGeocoders());
  }

  @Test
  public void defaultsToOpenCage() throws Exception {
    BaseApp.initializeOptionsFromCommandLine(new String[] { "-i", "stories.json" });
    assertEquals(Arrays.asList(BaseApp.GEOCODER.OPENCAGE), BaseApp.getGeocoders());
  }

  @Test(expected = ParseException.class)
  public void rejectsUnknownGeocoder() throws Exception {
    BaseApp.initializeOptionsFromCommandLine(new String[] { "-g", "google" });
  }
}
