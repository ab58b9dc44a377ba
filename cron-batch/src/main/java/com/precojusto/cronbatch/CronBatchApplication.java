package com.precojusto.cronbatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the cron batch service. Scheduler calls drive
 * time-boxed passes over the queued work of each job.
 */
@SpringBootApplication
public class CronBatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(CronBatchApplication.class, args);
    }

}
