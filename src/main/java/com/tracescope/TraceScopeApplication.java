package com.tracescope;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the TraceScope query service.
 * 
 * TraceScope answers trace searches over an indexed span store: it finds
 * the traces matching every filter of a search, fetches and adjusts traces
 * by id, and serves service names, span names and dependency graphs.
 */
@SpringBootApplication
public class TraceScopeApplication {

    public static void main(String[] args) {
        SpringApplication.run(TraceScopeApplication.class, args);
    }
}
