package org.tableaux.base.test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.Assert;
import org.junit.Test;
import org.tableaux.base.util.watchdog.Watchdog;
import org.tableaux.base.util.watchdog.Watchdog.WatchdogExpiryHandler;

/**
 * Tests for the build watchdog.
 */
public class WatchdogTest extends Assert
{
  @Test
  public void testExpiry() throws Exception
  {
    final CountDownLatch lFired = new CountDownLatch(1);
    Watchdog lWatchdog = new Watchdog(20, new WatchdogExpiryHandler()
    {
      @Override
      public void expired()
      {
        lFired.countDown();
      }
    });

    assertTrue(lFired.await(5, TimeUnit.SECONDS));
    assertTrue(lWatchdog.isExpired());
    lWatchdog.stop();
    assertTrue(lWatchdog.isExpired());
  }

  @Test
  public void testStopBeforeExpiry() throws Exception
  {
    final CountDownLatch lFired = new CountDownLatch(1);
    Watchdog lWatchdog = new Watchdog(60000, new WatchdogExpiryHandler()
    {
      @Override
      public void expired()
      {
        lFired.countDown();
      }
    });

    lWatchdog.stop();
    assertFalse(lWatchdog.isExpired());
    assertEquals(1, lFired.getCount());
  }
}
