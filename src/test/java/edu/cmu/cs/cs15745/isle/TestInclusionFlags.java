package edu.cmu.cs.cs15745.isle;

import org.junit.After;
import org.junit.Assert;
import org.junit.Test;

public class TestInclusionFlags {

  @After
  public void clearProperties() {
    System.clearProperty("isle.debug");
    System.clearProperty("isle.quickIndInd");
  }

  @Test
  public void propertiesOverrideDefaults() {
    System.setProperty("isle.debug", " 2 ");
    System.setProperty("isle.quickIndInd", "false");
    var flags = InclusionFlags.fromEnvironment();
    Assert.assertEquals(2, flags.debugLevel());
    Assert.assertFalse(flags.quickIndInd());
  }

  @Test
  public void unparsableDebugLevelIsQuiet() {
    System.setProperty("isle.debug", "verbose");
    var flags = InclusionFlags.fromEnvironment();
    Assert.assertEquals(0, flags.debugLevel());
    Assert.assertTrue(flags.quickIndInd());
  }
}
