package tech.noetzold.devpulse_api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DevpulseApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(DevpulseApiApplication.class, args);
    }
}
