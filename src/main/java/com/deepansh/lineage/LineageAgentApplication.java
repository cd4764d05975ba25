package com.deepansh.lineage;

import com.deepansh.lineage.config.AgentProperties;
import com.deepansh.lineage.config.ToolProperties;
import com.deepansh.lineage.llm.LlmProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({AgentProperties.class, ToolProperties.class, LlmProperties.class})
public class LineageAgentApplication {
    public static void main(String[] args) {
        SpringApplication.run(LineageAgentApplication.class, args);
    }
}
