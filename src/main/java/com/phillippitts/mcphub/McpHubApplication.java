package com.phillippitts.mcphub;

import com.phillippitts.mcphub.config.properties.AnythingLlmProperties;
import com.phillippitts.mcphub.config.properties.McpProperties;
import com.phillippitts.mcphub.config.properties.TaskProperties;
import com.phillippitts.mcphub.config.properties.ThreadPoolProperties;
import com.phillippitts.mcphub.config.properties.WhisperProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        McpProperties.class,
        TaskProperties.class,
        ThreadPoolProperties.class,
        WhisperProperties.class,
        AnythingLlmProperties.class
})
@EnableScheduling
public class McpHubApplication {

    public static void main(String[] args) {
        SpringApplication.run(McpHubApplication.class, args);
    }

}
