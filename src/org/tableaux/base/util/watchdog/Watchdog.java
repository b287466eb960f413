package org.tableaux.base.util.watchdog;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Watchdog that notifies an expiry handler once a fixed interval has elapsed, unless it is stopped first.  Used to
 * bound the wall-clock time of a tableau build.
 */
public class Watchdog implements Runnable
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * Interface implemented by objects which can handle watchdog expiration.
   */
  public interface WatchdogExpiryHandler
  {
    /**
     * Callback made (on the watchdog thread) when the watchdog expires.
     */
    public void expired();
  }

  private WatchdogExpiryHandler mExpiryHandler;
  private final long mInterval;
  private final long mExpiryTime;

  private Thread mThread;

  private volatile boolean mContinue;
  private volatile boolean mExpired;

  /**
   * Create and start a watchdog.
   *
   * @param xiInterval - the interval, in milliseconds, after which the watchdog expires.
   * @param xiExpiryHandler - the handler to notify.
   */
  public Watchdog(long xiInterval, WatchdogExpiryHandler xiExpiryHandler)
  {
    mInterval = xiInterval;
    mExpiryHandler = xiExpiryHandler;
    mExpiryTime = System.currentTimeMillis() + xiInterval;

    mContinue = true;
    mExpired = false;

    mThread = new Thread(this, "TableauWatchdog");
    mThread.setDaemon(true);
    mThread.start();
  }

  /**
   * @return whether the watchdog has fired.
   */
  public boolean isExpired()
  {
    return mExpired;
  }

  /**
   * Stop the watchdog.  Safe to call after expiry.
   */
  public void stop()
  {
    if (mExpired)
    {
      return;
    }

    Thread lThread = mThread;
    if (lThread == null)
    {
      return;
    }

    mContinue = false;
    lThread.interrupt();
    try
    {
      lThread.join(5000);
    }
    catch (InterruptedException lEx)
    {
      LOGGER.warn("Interrupted whilst waiting for watchdog to stop");
      Thread.currentThread().interrupt();
    }

    if (lThread.isAlive())
    {
      LOGGER.error("Failed to stop watchdog");
    }
    else
    {
      LOGGER.debug("Watchdog terminated");
    }
  }

  @Override
  public void run()
  {
    LOGGER.debug("Starting watchdog with interval " + mInterval + "ms");

    try
    {
      while (mContinue)
      {
        long lTimeRemaining = mExpiryTime - System.currentTimeMillis();

        if (lTimeRemaining > 0)
        {
          try
          {
            Thread.sleep(lTimeRemaining);
          }
          catch (InterruptedException lEx)
          {
            // Interrupted by stop().  The loop condition decides whether to quit.
            LOGGER.trace("Watchdog woken");
          }
        }
        else
        {
          LOGGER.warn("Watchdog timer expired after " + mInterval + "ms");
          mExpired = true;
          mExpiryHandler.expired();
          break;
        }
      }
    }
    catch (RuntimeException lEx)
    {
      LOGGER.error("Watchdog died unexpectedly", lEx);
    }

    mExpiryHandler = null;
    mThread = null;
  }
}
