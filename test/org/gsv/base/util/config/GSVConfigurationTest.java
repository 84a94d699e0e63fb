package org.gsv.base.util.config;

import org.gsv.base.util.config.GSVConfiguration.CfgItem;
import org.gsv.base.util.semantics.InformationState;
import org.junit.After;
import org.junit.Assert;
import org.junit.Test;

public class GSVConfigurationTest extends Assert
{
  @After
  public void tearDown()
  {
    for (CfgItem lItem : CfgItem.values())
    {
      GSVConfiguration.utResetCfgVal(lItem);
    }
  }

  @Test
  public void testDefaults()
  {
    assertEquals(1, GSVConfiguration.getCfgInt(CfgItem.RELATION_THREADS));
    assertEquals(-1, GSVConfiguration.getCfgInt(CfgItem.RELATION_TIMEOUT_MS));
    assertFalse(GSVConfiguration.getCfgBool(CfgItem.COLLAPSE_POSSIBILITIES_BY_WORLD));
    assertFalse(GSVConfiguration.getCfgBool(CfgItem.SKIP_UNDEFINED_PREMISES));
    assertFalse(GSVConfiguration.getCfgBool(CfgItem.TRACE_UPDATES));
  }

  @Test
  public void testOverrides()
  {
    GSVConfiguration.utOverrideCfgVal(CfgItem.RELATION_THREADS, " 4 ");
    GSVConfiguration.utOverrideCfgVal(CfgItem.TRACE_UPDATES, true);
    assertEquals(4, GSVConfiguration.getCfgInt(CfgItem.RELATION_THREADS));
    assertTrue(GSVConfiguration.getCfgBool(CfgItem.TRACE_UPDATES));

    GSVConfiguration.utResetCfgVal(CfgItem.RELATION_THREADS);
    assertEquals(1, GSVConfiguration.getCfgInt(CfgItem.RELATION_THREADS));

    GSVConfiguration.logConfig();
  }

  @Test
  public void testBadIntegerFallsBackToDefault()
  {
    GSVConfiguration.utOverrideCfgVal(CfgItem.RELATION_TIMEOUT_MS, "soon");
    assertEquals(-1, GSVConfiguration.getCfgInt(CfgItem.RELATION_TIMEOUT_MS));
  }

  @Test
  public void testCollapseModeFromConfiguration()
  {
    assertFalse(new InformationState().isCollapsedByWorld());

    GSVConfiguration.utOverrideCfgVal(CfgItem.COLLAPSE_POSSIBILITIES_BY_WORLD, true);
    assertTrue(new InformationState().isCollapsedByWorld());
  }
}
