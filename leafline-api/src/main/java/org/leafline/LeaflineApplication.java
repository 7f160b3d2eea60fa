package org.leafline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LeaflineApplication {

    public static void main(String[] args) {
        SpringApplication.run(LeaflineApplication.class, args);
    }
}
