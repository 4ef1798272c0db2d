package com.chicu.marginoptimizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.chicu.marginoptimizer")
public class MarginOptimizerApplication {

    public static void main(String[] args) {
        // один запуск = один тик (cron); код выхода берётся из MarginCommandRunner
        System.exit(SpringApplication.exit(SpringApplication.run(MarginOptimizerApplication.class, args)));
    }
}
