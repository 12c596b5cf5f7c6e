package com.reprise;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for Reprise - question answering over video transcripts
 * with a tiered response cache and hybrid retrieval.
 */
@SpringBootApplication
public class RepriseApplication {

    public static void main(String[] args) {
        SpringApplication.run(RepriseApplication.class, args);
    }
}
