package tw.gc.daytrade.picker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.junit.jupiter.api.Test;
import tw.gc.daytrade.picker.config.FallbackPolicy;
import tw.gc.daytrade.picker.config.PickerConfig;
import tw.gc.daytrade.picker.config.PickerProperties;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class AppConfigTest {

    private final AppConfig appConfig = new AppConfig();

    @Test
    void testObjectMapperBean() throws Exception {
        ObjectMapper objectMapper = appConfig.objectMapper();

        assertNotNull(objectMapper);
        assertFalse(objectMapper.getRegisteredModuleIds().isEmpty());
        assertFalse(objectMapper.isEnabled(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS));
        assertEquals("\"2025-01-06\"", objectMapper.writeValueAsString(LocalDate.of(2025, 1, 6)));
    }

    @Test
    void testPickerConfigBean() {
        PickerProperties properties = new PickerProperties();
        properties.setFallbackPolicy(FallbackPolicy.LEADER_PERCENTILE);

        PickerConfig config = appConfig.pickerConfig(properties);

        assertEquals(FallbackPolicy.LEADER_PERCENTILE, config.fallbackPolicy());
        assertEquals(5, config.sector().momentumLookback());
    }
}
