package ru.tigran.eventfeedbackanalyzer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EventFeedbackAnalyzerApplication {

    public static void main(String[] args) {
        SpringApplication.run(EventFeedbackAnalyzerApplication.class, args);
    }
}
