package com.chicu.opsdash;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.chicu.opsdash")
public class OpsDashApplication {

    public static void main(String[] args) {
        SpringApplication.run(OpsDashApplication.class, args);
    }
}
