package net.scanward.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ScanwardApplication {
    public static void main(String[] args) {
        SpringApplication.run(ScanwardApplication.class, args);
    }
}
