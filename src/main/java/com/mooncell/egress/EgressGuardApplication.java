package com.mooncell.egress;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class EgressGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(EgressGuardApplication.class, args);
    }

}
