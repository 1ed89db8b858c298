package com.phillippitts.mediatoolbox;

import com.phillippitts.mediatoolbox.config.properties.JobProperties;
import com.phillippitts.mediatoolbox.config.properties.ToolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        ToolProperties.class,
        JobProperties.class
})
public class MediaToolboxApplication {

    public static void main(String[] args) {
        SpringApplication.run(MediaToolboxApplication.class, args);
    }

}
