package com.apicatalog.collectionsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cache.annotation.EnableCaching;

@SpringBootApplication
@EnableCaching
public class CollectionSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(CollectionSyncApplication.class, args);
    }
}
