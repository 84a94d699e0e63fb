package org.gsv.base.util.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map.Entry;
import java.util.Properties;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Class giving access to evaluator configuration.
 *
 * Values come from the gsv.properties resource on the classpath (if there is one), and any value can be overridden by
 * a system property named "gsv." followed by the item name, e.g. -Dgsv.RELATION_THREADS=4.
 */
public class GSVConfiguration
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * Name of the classpath resource holding the configuration.
   */
  public static final String PROPERTIES_RESOURCE = "gsv.properties";

  /**
   * Prefix of system properties that override configured values.
   */
  public static final String SYSTEM_PROPERTY_PREFIX = "gsv.";

  /**
   * Available configuration items.
   */
  public static enum CfgItem
  {
    /**
     * The number of threads used to check the states of a semantic relation.  1 checks them synchronously on the
     * calling thread.  0 or less uses one thread per available CPU.
     */
    RELATION_THREADS(1),

    /**
     * Time, in milliseconds, after which a semantic relation check is abandoned.  -1 for no limit.
     */
    RELATION_TIMEOUT_MS(-1),

    /**
     * Whether an information state holds at most one possibility per world.  When set, inserting a possibility whose
     * world is already present has no effect, so distinct witnesses at the same world are merged.
     */
    COLLAPSE_POSSIBILITIES_BY_WORLD(false),

    /**
     * Whether a state on which the update with some premise is undefined is simply skipped when checking entailment
     * over every state.  Otherwise the failure is reported.
     */
    SKIP_UNDEFINED_PREMISES(false),

    /**
     * Whether semantic relations trace every update to the log (at TRACE level) when no logger is supplied.
     */
    TRACE_UPDATES(false);

    /**
     * Default value, as a string.
     */
    public final String mDefault;

    private CfgItem(int xiDefault)
    {
      mDefault = "" + xiDefault;
    }

    private CfgItem(boolean xiDefault)
    {
      mDefault = xiDefault ? "true" : "false";
    }
  }

  private static final Properties PROPERTIES = new Properties();
  static
  {
    try (InputStream lPropStream = GSVConfiguration.class.getClassLoader().getResourceAsStream(PROPERTIES_RESOURCE))
    {
      if (lPropStream != null)
      {
        PROPERTIES.load(lPropStream);
      }
    }
    catch (IOException lEx)
    {
      LOGGER.warn("Invalid configuration in " + PROPERTIES_RESOURCE + ": " + lEx);
    }

    for (CfgItem lItem : CfgItem.values())
    {
      String lOverride = System.getProperty(SYSTEM_PROPERTY_PREFIX + lItem);
      if (lOverride != null)
      {
        PROPERTIES.setProperty(lItem.toString(), lOverride);
      }
    }
  }

  private GSVConfiguration()
  {
  }

  /**
   * @return the specified String configuration value, or the default if not configured.
   *
   * @param xiKey
   */
  public static String getCfgStr(CfgItem xiKey)
  {
    return PROPERTIES.getProperty(xiKey.toString(), xiKey.mDefault).trim();
  }

  /**
   * @return the specified integer configuration value, or the default if not configured.
   *
   * @param xiKey
   */
  public static int getCfgInt(CfgItem xiKey)
  {
    String lValue = getCfgStr(xiKey);
    try
    {
      return Integer.parseInt(lValue);
    }
    catch (NumberFormatException lEx)
    {
      LOGGER.warn("Non-integer value '" + lValue + "' for " + xiKey + " - using default " + xiKey.mDefault);
      return Integer.parseInt(xiKey.mDefault);
    }
  }

  /**
   * @return the specified boolean configuration value, or the default if not configured.
   *
   * @param xiKey
   */
  public static boolean getCfgBool(CfgItem xiKey)
  {
    return Boolean.parseBoolean(getCfgStr(xiKey));
  }

  /**
   * Log all configuration.
   */
  public static void logConfig()
  {
    LOGGER.info("Running with properties:");
    for (Entry<Object, Object> e : PROPERTIES.entrySet())
    {
      String lKey = (String)e.getKey();

      // Check that this is a known configuration parameter (and not a typo in the config file).
      try
      {
        CfgItem lItem = CfgItem.valueOf(lKey);
        LOGGER.info("\t" + lKey + " = " + e.getValue() + " (default: " + lItem.mDefault + ")");
      }
      catch (IllegalArgumentException lEx)
      {
        LOGGER.warn("Unknown configuration parameter: '" + lKey + "'");
      }
    }
  }

  /**
   * UT-only method for overriding configuration.
   *
   * @param xiKey - the property to override.
   * @param xiValue - the new value.
   */
  public static void utOverrideCfgVal(CfgItem xiKey, String xiValue)
  {
    PROPERTIES.setProperty(xiKey.toString(), xiValue);
  }

  /**
   * UT-only method for overriding configuration.
   *
   * @param xiKey - the property to override.
   * @param xiValue - the new value.
   */
  public static void utOverrideCfgVal(CfgItem xiKey, boolean xiValue)
  {
    utOverrideCfgVal(xiKey, xiValue ? "true" : "false");
  }

  /**
   * UT-only method for reverting an override.
   *
   * @param xiKey - the property to revert to its default.
   */
  public static void utResetCfgVal(CfgItem xiKey)
  {
    PROPERTIES.remove(xiKey.toString());
  }
}
