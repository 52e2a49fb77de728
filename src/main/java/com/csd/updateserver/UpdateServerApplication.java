package com.csd.updateserver;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class UpdateServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(UpdateServerApplication.class, args);
    }

    /**
     * Implementation version from the jar manifest; "development" when running from classes.
     */
    public static String version() {
        String version = UpdateServerApplication.class.getPackage().getImplementationVersion();
        return version != null ? version : "development";
    }
}
