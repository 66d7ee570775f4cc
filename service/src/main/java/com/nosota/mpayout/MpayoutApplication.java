package com.nosota.mpayout;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class MpayoutApplication {
    public static void main(String[] args) {
        SpringApplication.run(MpayoutApplication.class, args);
    }
}
