package eu.toolchain.timer.cache;

import java.util.Arrays;
import java.util.TreeSet;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import eu.toolchain.timer.ManagerStoppedException;
import eu.toolchain.timer.ManualScheduler;
import eu.toolchain.timer.Task;
import eu.toolchain.timer.TaskHandle;
import eu.toolchain.timer.statistics.TallyReporter;

public class TestTTLCache {
    private ManualScheduler scheduler;
    private TallyReporter reporter;
    private TTLCache<Integer> cache;

    @Before
    public void setup() {
        scheduler = new ManualScheduler();
        reporter = new TallyReporter();
        cache = new TTLCache<>(scheduler, reporter);
    }

    @Test
    public void testExpires() throws Exception {
        cache.add("k", 1, 100);

        scheduler.advance(99);
        Assert.assertEquals(Integer.valueOf(1), cache.peek("k"));

        scheduler.advance(1);
        Assert.assertNull(cache.get("k"));
        Assert.assertEquals(0, cache.size());
        Assert.assertEquals(1, reporter.getExpired());
    }

    @Test
    public void testGetSlidesExpiration() throws Exception {
        cache.add("k", 1, 100);

        scheduler.advance(80);
        Assert.assertEquals(Integer.valueOf(1), cache.get("k"));

        // would have expired at 100 without the read above.
        scheduler.advance(80);
        Assert.assertEquals(Integer.valueOf(1), cache.get("k"));

        scheduler.advance(100);
        Assert.assertNull(cache.get("k"));

        // only the latest expiration is left pending at any time.
        Assert.assertEquals(0, scheduler.pending());
    }

    @Test
    public void testPeekDoesNotSlide() throws Exception {
        cache.add("k", 1, 100);

        scheduler.advance(80);
        Assert.assertEquals(Integer.valueOf(1), cache.peek("k"));
        Assert.assertTrue(cache.containsKey("k"));

        scheduler.advance(20);
        Assert.assertFalse(cache.containsKey("k"));
    }

    @Test
    public void testDuplicateKey() throws Exception {
        cache.add("k", 1, 100);

        try {
            cache.add("k", 2, 100);
            Assert.fail("expected DuplicateKeyException");
        } catch (final DuplicateKeyException e) {
            Assert.assertEquals("k", e.getKey());
        }

        Assert.assertEquals(Integer.valueOf(1), cache.peek("k"));
        Assert.assertEquals(1, scheduler.pending());
    }

    @Test
    public void testPutOverwritesAndCancelsFirstExpiration() throws Exception {
        cache.add("k", 1, 100);
        final TaskHandle first = scheduler.last();

        scheduler.advance(50);
        Assert.assertEquals(Integer.valueOf(1), cache.put("k", 2, 100));
        Assert.assertTrue(first.isCancelled());

        // the first expiration would have removed the key here.
        scheduler.advance(60);
        Assert.assertEquals(Integer.valueOf(2), cache.peek("k"));

        scheduler.advance(40);
        Assert.assertNull(cache.peek("k"));
    }

    @Test
    public void testPutNewKey() throws Exception {
        Assert.assertNull(cache.put("k", 1, 100));
        Assert.assertEquals(Integer.valueOf(1), cache.peek("k"));
    }

    @Test
    public void testDeleteCancelsExpiration() throws Exception {
        cache.add("k", 1, 100);
        final TaskHandle expire = scheduler.last();

        Assert.assertTrue(cache.delete("k"));
        Assert.assertTrue(expire.isCancelled());
        Assert.assertNull(cache.get("k"));
        Assert.assertFalse(cache.delete("k"));

        // the key can be added again, and is not removed by the old expiration.
        cache.add("k", 2, 200);
        scheduler.advance(150);
        Assert.assertEquals(Integer.valueOf(2), cache.peek("k"));
    }

    @Test
    public void testFailedRescheduleKeepsOriginalExpiration() throws Exception {
        cache.add("k", 1, 100);
        final TaskHandle expire = scheduler.last();

        scheduler.advance(50);
        scheduler.stop();

        Assert.assertEquals(Integer.valueOf(1), cache.get("k"));
        Assert.assertTrue(expire.isPending());
        Assert.assertEquals(1, reporter.getRescheduleFailed());

        scheduler.advance(50);
        Assert.assertNull(cache.peek("k"));
    }

    @Test
    public void testAddOnStoppedSchedulerStoresNothing() throws Exception {
        scheduler.stop();

        try {
            cache.add("k", 1, 100);
            Assert.fail("expected ManagerStoppedException");
        } catch (final ManagerStoppedException e) {
        }

        Assert.assertFalse(cache.containsKey("k"));
    }

    @Test
    public void testFailedPutKeepsPreviousEntry() throws Exception {
        cache.add("k", 1, 100);
        final TaskHandle expire = scheduler.last();
        scheduler.stop();

        try {
            cache.put("k", 2, 100);
            Assert.fail("expected ManagerStoppedException");
        } catch (final ManagerStoppedException e) {
        }

        Assert.assertEquals(Integer.valueOf(1), cache.peek("k"));
        Assert.assertTrue(expire.isPending());
    }

    @Test
    public void testGetRacingWithExpiration() throws Exception {
        cache.add("k", 1, 100);

        // the expiration has been picked up, but has not yet removed the entry.
        final Task inflight = scheduler.take(scheduler.last());

        Assert.assertEquals(Integer.valueOf(1), cache.get("k"));
        Assert.assertEquals(1, reporter.getCancelMissed());
        Assert.assertTrue(scheduler.last().isCancelled());

        inflight.run();
        Assert.assertNull(cache.get("k"));
        Assert.assertEquals(1, reporter.getExpired());
    }

    @Test
    public void testExpirationRacingWithPut() throws Exception {
        cache.add("k", 1, 100);
        final Task inflight = scheduler.take(scheduler.last());

        cache.put("k", 2, 100);
        inflight.run();

        Assert.assertEquals(Integer.valueOf(2), cache.peek("k"));
        Assert.assertEquals(0, reporter.getExpired());
    }

    @Test
    public void testClear() throws Exception {
        cache.add("a", 1, 100);
        cache.add("b", 2, 100);

        cache.clear();

        Assert.assertEquals(0, cache.size());
        Assert.assertEquals(0, scheduler.pending());
    }

    @Test
    public void testKeysAndToString() throws Exception {
        cache.add("b", 2, 100);
        cache.add("a", 1, 100);

        Assert.assertEquals(new TreeSet<>(Arrays.asList("a", "b")), cache.keys());

        final String value = cache.toString();
        Assert.assertTrue(value, value.contains("size=2"));
        Assert.assertTrue(value, value.contains("[a, b]"));
    }

    @Test
    public void testZeroTtlExpiresOnNextTick() throws Exception {
        cache.add("k", 1, 0);
        Assert.assertTrue(cache.containsKey("k"));

        scheduler.advance(0);
        Assert.assertFalse(cache.containsKey("k"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeTtl() throws Exception {
        cache.add("k", 1, -1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNullValue() throws Exception {
        cache.add("k", null, 100);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNullKey() throws Exception {
        cache.put(null, 1, 100);
    }
}
