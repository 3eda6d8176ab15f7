package io.github.riemr.schedule;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan("io.github.riemr.schedule.config")
public class ScheduleVersionApplication {

	public static void main(String[] args) {
		SpringApplication.run(ScheduleVersionApplication.class, args);
	}

}
