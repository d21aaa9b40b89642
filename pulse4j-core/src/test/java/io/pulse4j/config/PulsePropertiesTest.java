package io.pulse4j.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PulsePropertiesTest {

    @Test
    void defaultsShouldBeValid() {
        PulseProperties props = new PulseProperties();

        assertDoesNotThrow(props::validate);
        assertEquals(Duration.ofSeconds(60), props.getPollInterval());
        assertEquals(5, props.getWorkers());
        assertEquals(3, props.getMaxAttempts());
    }

    @Test
    void nonPositiveValuesShouldBeRejected() {
        PulseProperties zeroPoll = new PulseProperties();
        zeroPoll.setPollInterval(Duration.ZERO);
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, zeroPoll::validate);
        assertEquals("pulse.pollInterval must be a positive duration", e.getMessage());

        PulseProperties noTimeout = new PulseProperties();
        noTimeout.setCallTimeout(null);
        assertThrows(IllegalArgumentException.class, noTimeout::validate);

        PulseProperties noAttempts = new PulseProperties();
        noAttempts.setMaxAttempts(0);
        assertThrows(IllegalArgumentException.class, noAttempts::validate);
    }
}
