package com.firesim;

import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

@SpringBootApplication
public class FiresimApplication {

    public static void main(String[] args) {
        new SpringApplicationBuilder(FiresimApplication.class)
                .properties("spring.main.banner-mode=off")
                .run(args);
        // the embedded web server keeps the JVM alive
    }
}
