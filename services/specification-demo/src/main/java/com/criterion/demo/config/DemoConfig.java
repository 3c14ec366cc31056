package com.criterion.demo.config;

import com.criterion.demo.data.SampleDataLoader;
import com.criterion.demo.data.WarehouseDataset;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.time.Clock;
import java.time.ZoneOffset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

/** Wires the clock, the JSON mapper and the sample dataset. */
@Configuration
public class DemoConfig {

    private static final Logger log = LoggerFactory.getLogger(DemoConfig.class);

    @Bean
    public Clock clock(DemoProperties properties) {
        if (properties.referenceTime() == null) {
            log.info("Evaluating time-based rules against the system clock");
            return Clock.systemUTC();
        }
        log.info("Evaluating time-based rules against fixed reference time {}", properties.referenceTime());
        return Clock.fixed(properties.referenceTime(), ZoneOffset.UTC);
    }

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
    }

    @Bean
    public SampleDataLoader sampleDataLoader(ObjectMapper objectMapper, ResourceLoader resourceLoader) {
        return new SampleDataLoader(objectMapper, resourceLoader);
    }

    @Bean
    public WarehouseDataset warehouseDataset(SampleDataLoader loader, DemoProperties properties) {
        return loader.load(properties.sampleData());
    }
}
