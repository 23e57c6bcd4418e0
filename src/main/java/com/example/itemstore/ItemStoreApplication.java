package com.example.itemstore;

import com.example.itemstore.config.ItemStoreProperties;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ItemStoreProperties.class)
public class ItemStoreApplication {

	public static void main(String[] args) {
		SpringApplication.run(ItemStoreApplication.class, args);
	}
}
