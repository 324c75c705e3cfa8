package org.csu.minipy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MiniPyApplication {

    public static void main(String[] args) {
        SpringApplication.run(MiniPyApplication.class, args);
    }

}
