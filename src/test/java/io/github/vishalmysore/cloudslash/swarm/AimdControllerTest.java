package io.github.vishalmysore.cloudslash.swarm;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;

import org.junit.Before;
import org.junit.Test;
import org.mockito.Mockito;

/**
 * Tests for {@link AimdController}.
 */
public class AimdControllerTest {

    private static final Duration FAST = Duration.ofMillis(50);
    private static final Duration SLOW = Duration.ofMillis(500);

    private final Clock clock = Mockito.mock(Clock.class);
    private long now;

    @Before
    public void setup() {
        now = 1_000L;
        when(clock.millis()).thenAnswer(invocation -> now);
    }

    private void advance(long millis) {
        now += millis;
    }

    /**
     * Success grows by the additive step, throttling halves, the floor holds.
     */
    @Test
    public void testAdditiveIncreaseMultiplicativeDecrease() {
        AimdController aimd = new AimdController(10, 5, 20, clock);

        advance(150);
        aimd.feedback(FAST, false);
        assertThat(aimd.getConcurrency(), is(15));

        advance(150);
        aimd.feedback(FAST, true);
        assertThat(aimd.getConcurrency(), is(7));

        advance(150);
        aimd.feedback(FAST, true);
        assertThat(aimd.getConcurrency(), is(5));

        advance(150);
        aimd.feedback(FAST, true);
        assertThat(aimd.getConcurrency(), is(5));
    }

    /**
     * Increase never passes the maximum.
     */
    @Test
    public void testCeiling() {
        AimdController aimd = new AimdController(18, 5, 20, clock);
        advance(150);
        aimd.feedback(FAST, false);
        assertThat(aimd.getConcurrency(), is(20));

        advance(150);
        aimd.feedback(FAST, false);
        assertThat(aimd.getConcurrency(), is(20));
    }

    /**
     * Feedback inside the cooldown window is ignored, including the window
     * right after construction.
     */
    @Test
    public void testCooldown() {
        AimdController aimd = new AimdController(10, 5, 20, clock);

        advance(50);
        aimd.feedback(FAST, true);
        assertThat(aimd.getConcurrency(), is(10));

        advance(60);
        aimd.feedback(FAST, true);
        assertThat(aimd.getConcurrency(), is(5));

        advance(10);
        aimd.feedback(FAST, false);
        assertThat(aimd.getConcurrency(), is(5));
    }

    /**
     * Slow successful tasks leave concurrency unchanged.
     */
    @Test
    public void testSlowSuccessHolds() {
        AimdController aimd = new AimdController(10, 5, 20, clock);
        advance(150);
        aimd.feedback(SLOW, false);
        assertThat(aimd.getConcurrency(), is(10));
    }

    /**
     * The start value is clamped into the bounds.
     */
    @Test
    public void testStartClamped() {
        assertThat(new AimdController(1, 5, 20, clock).getConcurrency(), is(5));
        assertThat(new AimdController(100, 5, 20, clock).getConcurrency(), is(20));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidBounds() {
        new AimdController(10, 20, 5, clock);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testZeroMinimum() {
        new AimdController(10, 0, 5, clock);
    }
}
