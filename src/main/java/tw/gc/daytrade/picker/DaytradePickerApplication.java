package tw.gc.daytrade.picker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.TimeZone;

@SpringBootApplication
public class DaytradePickerApplication {

    static {
        // Trade dates are Taipei calendar dates
        TimeZone.setDefault(TimeZone.getTimeZone(AppConstants.TAIPEI_ZONE_ID));
    }

    public static void main(String[] args) {
        SpringApplication.run(DaytradePickerApplication.class, args);
    }
}
