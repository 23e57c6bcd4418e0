package com.example.itemstore.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Settings bound from the {@code item-store} prefix.
 *
 * @param welcomeMessage text returned by the root discovery endpoint
 */
@ConfigurationProperties(prefix = "item-store")
public record ItemStoreProperties(
        @DefaultValue("Welcome to the Simple REST API") String welcomeMessage) {
}
