package com.deepansh.kernel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class AgentKernelApplication {
    public static void main(String[] args) {
        SpringApplication.run(AgentKernelApplication.class, args);
    }
}
