package org.endlesssource.streambridge.direct;

import org.endlesssource.streambridge.api.BackendException;
import org.endlesssource.streambridge.direct.fixture.FullCatalog;
import org.endlesssource.streambridge.direct.fixture.RailOnly;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CapabilityProbeTest {

    @Test
    void inspect_picksFirstPresentMethodName() {
        CapabilityProbe probe = CapabilityProbe.inspect(new FullCatalog());

        assertEquals(Optional.of("getRailItems"), probe.methodName(Capability.RAIL));
        assertEquals(Optional.of("getPlayable"), probe.methodName(Capability.PLAYABLE));
        assertTrue(probe.missingRequired().isEmpty());
        assertTrue(probe.missingOptional().isEmpty());
    }

    @Test
    void inspect_reportsMissingCapabilities() {
        CapabilityProbe probe = CapabilityProbe.inspect(new RailOnly());

        assertEquals(List.of(Capability.PLAYABLE), probe.missingRequired());
        assertTrue(probe.missingOptional().contains(Capability.SEARCH));
        assertFalse(probe.supports(Capability.HOME));
    }

    @Test
    void invoke_nullForPrimitiveParameter_doesNotMatchPositionally() {
        CapabilityProbe probe = CapabilityProbe.inspect(new FullCatalog());
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("railId", "popular");
        args.put("cursor", null);
        args.put("limit", null);

        BackendException e = assertThrows(BackendException.class, () -> probe.invoke(Capability.RAIL, args));
        assertTrue(e.getMessage().contains("getRailItems"));
    }

    @Test
    void invoke_unsupportedCapability_throwsBackendException() {
        CapabilityProbe probe = CapabilityProbe.inspect(new RailOnly());

        assertThrows(BackendException.class, () -> probe.invoke(Capability.SEARCH, Map.of("query", "x")));
    }
}
