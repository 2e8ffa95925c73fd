package com.slidemaker.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Hosts the orchestration core. Callers obtain {@code CreatePipeline} or
 * {@code ConvertPipeline} from the context and call {@code execute}.
 */
@SpringBootApplication
public class SlidemakerApplication {

    public static void main(String[] args) {
        SpringApplication.run(SlidemakerApplication.class, args);
    }
}
