package com.example.alpenglow.theoremmap;

import com.example.alpenglow.theoremmap.config.MappingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(MappingProperties.class)
public class TheoremMapApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(TheoremMapApplication.class, args)));
    }

}
