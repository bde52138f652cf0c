package com.taleforge.app.config;

import com.taleforge.core.model.CalendarConfig;
import com.taleforge.engine.config.EngineSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class TaleforgePropertiesTest {

    @Test
    @DisplayName("Unset properties convert to the engine defaults")
    void defaultsMatchEngine() {
        EngineSettings settings = new TaleforgeProperties().toEngineSettings();

        assertEquals(EngineSettings.DEFAULTS, settings);
        assertEquals(CalendarConfig.DEFAULT, settings.calendar());
    }

    @Test
    @DisplayName("Validation bounds are carried into the limits record")
    void validationBounds() {
        TaleforgeProperties properties = new TaleforgeProperties();
        properties.setLockWaitTimeout(Duration.ofSeconds(2));
        properties.getValidation().setMinDc(5);
        properties.getValidation().setMaxDiceCount(20);

        EngineSettings settings = properties.toEngineSettings();

        assertEquals(Duration.ofSeconds(2), settings.lockWaitTimeout());
        assertEquals(5, settings.validation().minDifficultyClass());
        assertEquals(20, settings.validation().maxDiceCount());
        assertEquals(40, settings.validation().maxDifficultyClass());
    }
}
