package net.gpuwarden.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class GpuWardenApplication {

    public static void main(String[] args) {
        SpringApplication.run(GpuWardenApplication.class, args);
    }
}
