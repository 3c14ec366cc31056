package com.criterion.demo;

import com.criterion.demo.config.DemoProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Console application that walks through the specification toolkit.
 *
 * <p>Runs without a web server. {@link com.criterion.demo.console.DemoRunner} either opens the
 * interactive menu or runs every scenario once, depending on {@code criterion.demo.interactive}.
 */
@SpringBootApplication
@EnableConfigurationProperties(DemoProperties.class)
public class SpecificationDemoApplication {

    private static final Logger log = LoggerFactory.getLogger(SpecificationDemoApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(SpecificationDemoApplication.class, args);
        log.info("Specification demo finished");
    }
}
