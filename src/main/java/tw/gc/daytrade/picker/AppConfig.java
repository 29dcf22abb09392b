package tw.gc.daytrade.picker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tw.gc.daytrade.picker.config.PickerConfig;
import tw.gc.daytrade.picker.config.PickerProperties;

@Configuration
public class AppConfig {

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    /**
     * Validated once here; stages only ever see the immutable form.
     */
    @Bean
    public PickerConfig pickerConfig(PickerProperties properties) {
        return properties.toConfig();
    }
}
