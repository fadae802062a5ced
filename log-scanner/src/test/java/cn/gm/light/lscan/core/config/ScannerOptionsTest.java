package cn.gm.light.lscan.core.config;

import cn.gm.light.lscan.core.retry.ExponentialBackoffRetryPolicy;
import cn.gm.light.lscan.core.retry.FixedDelayRetryPolicy;
import cn.gm.light.lscan.core.retry.RetryPolicy;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Properties;

public class ScannerOptionsTest {

    @Test
    public void testDefaults() {
        ScannerOptions options = ScannerOptions.defaults();
        Assertions.assertEquals(1000, options.getBatchSize());
        Assertions.assertEquals(1, options.getNumProcessWorkers());
        Assertions.assertEquals(1, options.getNumFetchWorkers());
        Assertions.assertFalse(options.isQuiet());
        Assertions.assertSame(RetryPolicy.unbounded(), options.getRetryPolicy());
        Assertions.assertSame(options, options.validate());
    }

    @Test
    public void testValidate() {
        IllegalArgumentException e = Assertions.assertThrows(IllegalArgumentException.class,
                () -> ScannerOptions.builder().numProcessWorkers(0).build().validate());
        Assertions.assertTrue(e.getMessage().contains("numProcessWorkers"));
        e = Assertions.assertThrows(IllegalArgumentException.class,
                () -> ScannerOptions.builder().numFetchWorkers(-1).build().validate());
        Assertions.assertTrue(e.getMessage().contains("numFetchWorkers"));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> ScannerOptions.builder().workQueueCapacity(0).build().validate());
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> ScannerOptions.builder().entryQueueCapacity((1 << 30) + 1).build().validate());
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> ScannerOptions.builder().retryPolicy(null).build().validate());
        // batchSize 不校验
        ScannerOptions.builder().batchSize(0).build().validate();
    }

    @Test
    public void testRingBufferSize() {
        Assertions.assertEquals(131072, ScannerOptions.defaults().ringBufferSize());
        Assertions.assertEquals(1, ScannerOptions.builder().entryQueueCapacity(1).build().ringBufferSize());
        Assertions.assertEquals(1024, ScannerOptions.builder().entryQueueCapacity(1000).build().ringBufferSize());
        Assertions.assertEquals(1024, ScannerOptions.builder().entryQueueCapacity(1024).build().ringBufferSize());
        Assertions.assertEquals(1 << 30, ScannerOptions.builder().entryQueueCapacity(1 << 30).build().ringBufferSize());
    }

    @Test
    public void testFromProperties() {
        Properties props = new Properties();
        props.setProperty("scanner.batchSize", "250");
        props.setProperty("scanner.numFetchWorkers", " 4 ");
        props.setProperty("scanner.numProcessWorkers", "8");
        props.setProperty("scanner.quiet", "true");
        props.setProperty("scanner.progressIntervalMs", "");

        ScannerOptions options = ScannerOptions.fromProperties(props);

        Assertions.assertEquals(250, options.getBatchSize());
        Assertions.assertEquals(4, options.getNumFetchWorkers());
        Assertions.assertEquals(8, options.getNumProcessWorkers());
        Assertions.assertTrue(options.isQuiet());
        Assertions.assertEquals(1000, options.getProgressIntervalMs());
        Assertions.assertSame(RetryPolicy.unbounded(), options.getRetryPolicy());
    }

    @Test
    public void testRetryFromProperties() {
        Properties props = new Properties();
        props.setProperty("scanner.retry.maxAttempts", "5");
        RetryPolicy fixed = ScannerOptions.fromProperties(props).getRetryPolicy();
        Assertions.assertTrue(fixed instanceof FixedDelayRetryPolicy);
        Assertions.assertEquals(RetryPolicy.GIVE_UP, fixed.nextDelayMillis(5));

        props.setProperty("scanner.retry.initialDelayMs", "50");
        props.setProperty("scanner.retry.maxDelayMs", "400");
        RetryPolicy exponential = ScannerOptions.fromProperties(props).getRetryPolicy();
        Assertions.assertTrue(exponential instanceof ExponentialBackoffRetryPolicy);
        Assertions.assertEquals(50, exponential.nextDelayMillis(1));
        Assertions.assertEquals(400, exponential.nextDelayMillis(4));
        Assertions.assertEquals(RetryPolicy.GIVE_UP, exponential.nextDelayMillis(5));
    }

    @Test
    public void testBadProperty() {
        Properties props = new Properties();
        props.setProperty("scanner.batchSize", "lots");
        IllegalArgumentException e = Assertions.assertThrows(IllegalArgumentException.class,
                () -> ScannerOptions.fromProperties(props));
        Assertions.assertTrue(e.getMessage().contains("scanner.batchSize"));

        Properties invalid = new Properties();
        invalid.setProperty("scanner.numFetchWorkers", "0");
        Assertions.assertThrows(IllegalArgumentException.class, () -> ScannerOptions.fromProperties(invalid));
    }
}
