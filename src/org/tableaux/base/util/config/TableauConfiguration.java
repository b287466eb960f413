package org.tableaux.base.util.config;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map.Entry;
import java.util.Properties;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Class giving access to engine configuration.
 *
 * Values come from the classpath resource {@value #RESOURCE_NAME}, overlaid by the file named in the system property
 * {@value #FILE_PROPERTY} (if set).  Anything not configured takes the default from {@link CfgItem}.
 */
public class TableauConfiguration
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * Name of the classpath resource holding the configuration.
   */
  public static final String RESOURCE_NAME = "tableaux.properties";

  /**
   * System property naming an additional configuration file.
   */
  public static final String FILE_PROPERTY = "tableaux.config";

  /**
   * Available configuration items.
   */
  public static enum CfgItem
  {
    /**
     * Maximum number of recently constructed lexical items kept by the interning pool.
     */
    LEX_CACHE_SIZE(10000),

    /**
     * Default limit on the number of rule applications per tableau.  Negative means unlimited.
     */
    MAX_STEPS(-1),

    /**
     * Default build timeout, in milliseconds.  Negative means no timeout.
     */
    BUILD_TIMEOUT_MS(-1),

    /**
     * Whether, by default, the best-scoring rule in a group is chosen (rather than the first that applies).
     */
    GROUP_OPTIM(true),

    /**
     * Whether, by default, rules rank their candidate targets (rather than taking the first).
     */
    RANK_OPTIM(true),

    /**
     * Whether, by default, countermodels are requested for open branches.
     */
    BUILD_MODELS(false);

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
    try (InputStream lPropStream = TableauConfiguration.class.getClassLoader().getResourceAsStream(RESOURCE_NAME))
    {
      if (lPropStream != null)
      {
        PROPERTIES.load(lPropStream);
      }
    }
    catch (IOException lEx)
    {
      LOGGER.warn("Invalid configuration resource " + RESOURCE_NAME, lEx);
    }

    String lFileName = System.getProperty(FILE_PROPERTY);
    if (lFileName != null)
    {
      try (InputStream lPropStream = new FileInputStream(lFileName))
      {
        PROPERTIES.load(lPropStream);
      }
      catch (IOException lEx)
      {
        LOGGER.warn("Missing/invalid configuration file " + lFileName, lEx);
      }
    }
  }

  /**
   * @return the specified String configuration value, or the default if not configured.
   *
   * @param xiKey - the item to read.
   */
  public static String getCfgStr(CfgItem xiKey)
  {
    return PROPERTIES.getProperty(xiKey.toString(), xiKey.mDefault);
  }

  /**
   * @return the specified integer configuration value, or the default if not configured.
   *
   * @param xiKey - the item to read.
   */
  public static int getCfgInt(CfgItem xiKey)
  {
    return Integer.parseInt(getCfgStr(xiKey).trim());
  }

  /**
   * @return the specified boolean configuration value, or the default if not configured.
   *
   * @param xiKey - the item to read.
   */
  public static boolean getCfgBool(CfgItem xiKey)
  {
    return Boolean.parseBoolean(getCfgStr(xiKey).trim());
  }

  /**
   * Log all explicitly set configuration.
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
   * @param xiValue - the new value, or null to restore the default.
   */
  public static void utOverrideCfgVal(CfgItem xiKey, String xiValue)
  {
    if (xiValue == null)
    {
      PROPERTIES.remove(xiKey.toString());
    }
    else
    {
      PROPERTIES.setProperty(xiKey.toString(), xiValue);
    }
  }
}
