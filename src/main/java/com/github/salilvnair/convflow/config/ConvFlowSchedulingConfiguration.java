package com.github.salilvnair.convflow.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "convflow.stack.sweep", name = "enabled", havingValue = "true")
public class ConvFlowSchedulingConfiguration {
}
