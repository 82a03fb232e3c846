package de.bycsitsm.meetingcost;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MeetingCostApplication {

    public static void main(String[] args) {
        SpringApplication.run(MeetingCostApplication.class, args);
    }
}
