package my.wealthtracker.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class WealthTrackerApplication {
	public static void main(String[] args) {
		SpringApplication.run(WealthTrackerApplication.class, args);
	}
}
