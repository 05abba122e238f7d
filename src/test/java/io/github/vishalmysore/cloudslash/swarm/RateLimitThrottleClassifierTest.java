package io.github.vishalmysore.cloudslash.swarm;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.IOException;

import org.junit.Test;

/**
 * Tests for {@link RateLimitThrottleClassifier}.
 */
public class RateLimitThrottleClassifierTest {

    private final RateLimitThrottleClassifier classifier = new RateLimitThrottleClassifier();

    @Test
    public void testThrottledException() {
        assertTrue(classifier.isThrottled(new ThrottledException("slow down please")));
    }

    @Test
    public void testProviderErrorCodes() {
        assertTrue(classifier.isThrottled(new RuntimeException("Throttling: Rate exceeded")));
        assertTrue(classifier.isThrottled(new IOException("HTTP 429 Too Many Requests")));
        assertTrue(classifier.isThrottled(new IllegalStateException("RequestLimitExceeded")));
    }

    @Test
    public void testHttpStatus() {
        assertTrue(classifier.isThrottled(new IOException("Service returned Status Code: 429")));
        assertTrue(classifier.isThrottled(new IOException("http 429")));
    }

    /**
     * Digits inside resource ids are not a status code.
     */
    @Test
    public void testDigitsInIdsIgnored() {
        assertFalse(classifier.isThrottled(
                new IllegalStateException("InvalidVolume.NotFound: The volume 'vol-0429ab' does not exist")));
        assertFalse(classifier.isThrottled(new IOException("snapshot snap-429 is in use")));
        assertFalse(classifier.isThrottled(new IOException("status code: 4290")));
    }

    @Test
    public void testWrappedCause() {
        Exception wrapped = new RuntimeException("scan failed",
                new ThrottledException("RequestLimitExceeded"));
        assertTrue(classifier.isThrottled(wrapped));
    }

    @Test
    public void testOrdinaryFailures() {
        assertFalse(classifier.isThrottled(new IOException("connection reset")));
        assertFalse(classifier.isThrottled(new NullPointerException()));
        assertFalse(classifier.isThrottled(new RuntimeException("AccessDenied", new IOException("403"))));
    }
}
