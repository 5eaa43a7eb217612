package com.github.salilvnair.formflow.config;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.AutoConfigurationPackage;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@AutoConfiguration
@AutoConfigurationPackage(basePackages = "com.github.salilvnair.formflow")
@ComponentScan(basePackages = "com.github.salilvnair.formflow")
@EntityScan(basePackages = "com.github.salilvnair.formflow.entity")
@EnableJpaRepositories(basePackages = "com.github.salilvnair.formflow.repo")
public class FormFlowAutoConfiguration {
}
