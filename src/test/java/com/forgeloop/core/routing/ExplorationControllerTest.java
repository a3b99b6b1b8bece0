package com.forgeloop.core.routing;

import com.forgeloop.core.config.KernelProperties;
import com.forgeloop.core.model.ControlDecision;
import com.forgeloop.core.transition.TransitionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

class ExplorationControllerTest {

    private KernelProperties properties;
    private TransitionStore store;
    private ExplorationController controller;

    @BeforeEach
    void setUp() {
        properties = new KernelProperties();
        store = mock(TransitionStore.class);
        controller = new ExplorationController(properties, store);
    }

    @Test
    @DisplayName("No history -> baseline")
    void baseline() {
        when(store.verifiedRate(anyInt())).thenReturn(OptionalDouble.empty());

        ControlDecision decision = controller.refresh();

        assertEquals("baseline", decision.mode());
        assertNull(decision.actionRate());
        assertEquals(0.2, decision.temperature(), 1e-9);
        assertEquals(2, decision.speculateParallelism());
    }

    @Test
    @DisplayName("Low verified rate -> explore: hotter and wider")
    void explore() {
        when(store.verifiedRate(50)).thenReturn(OptionalDouble.of(0.05));

        ControlDecision decision = controller.refresh();

        assertEquals("explore", decision.mode());
        assertEquals(0.3, decision.temperature(), 1e-9);
        assertEquals(3, decision.speculateParallelism());
    }

    @Test
    @DisplayName("High verified rate -> exploit: cooler")
    void exploit() {
        when(store.verifiedRate(50)).thenReturn(OptionalDouble.of(0.9));

        ControlDecision decision = controller.refresh();

        assertEquals("exploit", decision.mode());
        assertEquals(0.1, decision.temperature(), 1e-9);
        assertEquals(2, decision.speculateParallelism());
    }

    @Test
    @DisplayName("Rate within the band -> hold")
    void hold() {
        when(store.verifiedRate(50)).thenReturn(OptionalDouble.of(0.3));
        assertEquals("hold", controller.refresh().mode());
    }

    @Test
    @DisplayName("Store failure keeps the controller at baseline")
    void storeFailure() {
        when(store.verifiedRate(anyInt())).thenThrow(new IllegalStateException("db down"));
        assertEquals("baseline", controller.refresh().mode());
    }

    @Test
    @DisplayName("Disabled controller never reads the store")
    void disabled() {
        properties.getControl().setEnabled(false);

        assertEquals("baseline", controller.refresh().mode());
        verifyNoInteractions(store);
    }

    @Test
    @DisplayName("current() holds the last refreshed snapshot")
    void snapshotHeld() {
        when(store.verifiedRate(50)).thenReturn(OptionalDouble.of(0.9), OptionalDouble.of(0.0));

        ControlDecision first = controller.refresh();

        assertSame(first, controller.current());
        assertSame(first, controller.current());
        verify(store, times(1)).verifiedRate(50);
    }
}
