package io.github.vishalmysore.cloudslash.domain;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.Test;

/**
 * Tests for {@link PropertyValue}.
 */
public class PropertyValueTest {

    @Test
    public void testAccessorsMatchKind() {
        PropertyValue state = PropertyValue.of("available");
        assertThat(state.getKind(), is(PropertyValue.Kind.STRING));
        assertThat(state.asString().get(), is("available"));
        assertFalse(state.asNumber().isPresent());
        assertFalse(state.asTimestamp().isPresent());

        assertThat(PropertyValue.of(true).asBoolean().get(), is(true));
        assertThat(PropertyValue.of(8.5).asNumber().get(), is(8.5));

        Instant launched = Instant.parse("2024-01-01T00:00:00Z");
        assertThat(PropertyValue.of(launched).asTimestamp().get(), is(launched));
        assertThat(PropertyValue.of(launched).toJsonValue(), is("2024-01-01T00:00:00Z"));
    }

    /**
     * Collections are copied on the way in.
     */
    @Test
    public void testCollectionsAreCopied() {
        List<String> zones = new ArrayList<>(List.of("us-east-1a"));
        PropertyValue value = PropertyValue.of(zones);
        zones.add("us-east-1b");
        assertThat(value.asStringList().get(), is(List.of("us-east-1a")));

        PropertyValue tags = PropertyValue.of(Map.of("env", "prod"));
        assertThat(tags.getKind(), is(PropertyValue.Kind.STRING_MAP));
        assertThat(tags.asStringMap().get().get("env"), is("prod"));
        assertFalse(tags.asStringList().isPresent());
    }

    /**
     * Each kind exposes only its own accessor and renders its own raw value.
     */
    @Test
    public void testKindsDoNotCross() {
        PropertyValue zones = PropertyValue.of(List.of("a", "b"));
        assertFalse(zones.asString().isPresent());
        assertFalse(zones.asStringMap().isPresent());
        assertThat(zones.toJsonValue(), is(List.of("a", "b")));

        PropertyValue size = PropertyValue.of(500);
        assertFalse(size.asBoolean().isPresent());
        assertThat(size.toJsonValue(), is(500.0));
        assertThat(size.toString(), is("500.0"));

        PropertyValue flag = PropertyValue.of(false);
        assertThat(flag.asBoolean().get(), is(false));
        assertFalse(flag.asNumber().isPresent());
    }

    @Test
    public void testEquality() {
        assertEquals(PropertyValue.of("x"), PropertyValue.of("x"));
        assertTrue(!PropertyValue.of("1").equals(PropertyValue.of(1.0)));
    }

    @Test
    public void testNodeTags() {
        ResourceNode node = ResourceNode.builder().id("vol-1").type(ResourceTypes.VOLUME).build();
        assertTrue(node.getTags().isEmpty());

        node.getProperties().put(ResourceNode.TAGS, PropertyValue.of(Map.of("Owner", "data-team")));
        assertThat(node.getTags().get("Owner"), is("data-team"));
        assertThat(node.getReachability(), is(ReachabilityState.UNKNOWN));
    }
}
